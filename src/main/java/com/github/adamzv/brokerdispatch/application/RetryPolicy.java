package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.TopicPolicy;
import java.time.Duration;

/**
 * Decides what happens to a message whose handler failed, given how often it was retried.
 * Backoff is linear: the wait before retry {@code n} is {@code unit * n}.
 */
public final class RetryPolicy {

  public enum Action {
    RETRY,
    DEAD_LETTER,
    DROP
  }

  /**
   * @param attempt retry number about to be made (1-based), 0 when not retrying
   */
  public record Decision(Action action, int attempt, Duration backoff) {}

  public Decision decide(BrokerMessage message, TopicPolicy policy) {
    int retried = message.retryCount();
    if (retried < policy.maxRetries()) {
      int attempt = retried + 1;
      return new Decision(Action.RETRY, attempt, backoffFor(policy.retryBackoffUnit(), attempt));
    }
    if (policy.dlqTopic() != null) {
      return new Decision(Action.DEAD_LETTER, 0, Duration.ZERO);
    }
    return new Decision(Action.DROP, 0, Duration.ZERO);
  }

  public static Duration backoffFor(Duration unit, int attempt) {
    if (unit == null || attempt <= 0) {
      return Duration.ZERO;
    }
    return unit.multipliedBy(attempt);
  }

  static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getName();
    }
    return message;
  }
}
