package com.github.adamzv.brokerdispatch.domain;

import java.util.Locale;

/**
 * What happened to one inbound message.
 */
public enum DispatchOutcome {
  /** Handler succeeded and the message was acknowledged explicitly. */
  ACKNOWLEDGED,
  /** Handler succeeded; acknowledgment is left to the driver's commit policy. */
  COMPLETED,
  /** Handler failed and a copy was republished to the original topic. */
  RETRIED,
  /** Retries exhausted, a dead-letter message was published. */
  DEAD_LETTERED,
  /** Retries exhausted with no dead-letter topic, the message was negatively acknowledged. */
  DROPPED,
  /** Stop signal observed mid-retry; nothing was republished and the message is not settled. */
  CANCELLED;

  /**
   * Whether the driver may consider this message's position consumed.
   */
  public boolean isSettled() {
    return this != CANCELLED;
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
