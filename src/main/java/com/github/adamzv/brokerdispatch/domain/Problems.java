package com.github.adamzv.brokerdispatch.domain;

import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details, null);
  }

  public static ProblemException notFound(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_FOUND, message, details, null);
  }

  public static ProblemException brokerUnavailable(String message, Map<String, Object> details) {
    return raise(ProblemCodes.BROKER_UNAVAILABLE, message, details, null);
  }

  public static ProblemException brokerUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.BROKER_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException notConnected(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_CONNECTED, message, details, null);
  }

  public static ProblemException alreadyRunning(String message, Map<String, Object> details) {
    return raise(ProblemCodes.ALREADY_RUNNING, message, details, null);
  }

  public static ProblemException noHandlers(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NO_HANDLERS, message, details, null);
  }

  public static ProblemException subscribeFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.SUBSCRIBE_FAILED, message, details, cause);
  }

  public static ProblemException publishFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.PUBLISH_FAILED, message, details, cause);
  }

  public static ProblemException deadLetterFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.DEAD_LETTER_FAILED, message, details, cause);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, null);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
