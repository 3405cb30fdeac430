package com.github.adamzv.brokerdispatch.domain;

/**
 * Header names stamped by the dispatch pipeline on retried and dead-lettered messages.
 */
public final class MessageHeaders {

  public static final String RETRY_COUNT = "x-retry-count";
  public static final String LAST_ERROR = "x-last-error";

  public static final String ORIGINAL_TOPIC = "x-original-topic";
  public static final String ERROR = "x-error";
  public static final String FAILED_AT = "x-failed-at";

  private MessageHeaders() {
  }
}
