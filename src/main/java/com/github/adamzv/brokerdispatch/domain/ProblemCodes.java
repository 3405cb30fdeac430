package com.github.adamzv.brokerdispatch.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String BROKER_UNAVAILABLE = "BROKER_UNAVAILABLE";
  public static final String NOT_CONNECTED = "NOT_CONNECTED";
  public static final String ALREADY_RUNNING = "ALREADY_RUNNING";
  public static final String NO_HANDLERS = "NO_HANDLERS";
  public static final String SUBSCRIBE_FAILED = "SUBSCRIBE_FAILED";
  public static final String PUBLISH_FAILED = "PUBLISH_FAILED";
  public static final String DEAD_LETTER_FAILED = "DEAD_LETTER_FAILED";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  private ProblemCodes() {
  }
}
