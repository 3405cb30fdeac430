package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import java.time.Duration;

/**
 * Waits out a retry backoff while watching the stop signal.
 */
@FunctionalInterface
public interface BackoffSleeper {

  /**
   * @return {@code true} if the full duration elapsed, {@code false} if {@code cancellation}
   *     fired first
   */
  boolean sleep(Duration duration, CancellationToken cancellation);

  static BackoffSleeper cancellable() {
    return (duration, cancellation) -> !cancellation.await(duration);
  }
}
