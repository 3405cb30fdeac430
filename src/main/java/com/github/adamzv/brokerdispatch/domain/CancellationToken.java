package com.github.adamzv.brokerdispatch.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation signal shared between the lifecycle controller, the dispatch task
 * and the driver. Once cancelled it stays cancelled; a new run needs a new token.
 */
public final class CancellationToken {

  private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> listeners = new ArrayList<>();
  private boolean cancelled;
  private Registration parentLink = Registration.NONE;

  public static CancellationToken create() {
    return new CancellationToken();
  }

  /**
   * A token that is cancelled whenever {@code parent} is, and can also be cancelled on its own.
   */
  public static CancellationToken linkedTo(CancellationToken parent) {
    CancellationToken child = new CancellationToken();
    if (parent != null) {
      Registration link = parent.onCancel(child::cancel);
      synchronized (child) {
        child.parentLink = link;
      }
    }
    return child;
  }

  /**
   * Stops following the parent this token was linked to. Cancelling the parent afterwards no
   * longer reaches this token, and the parent drops its reference to it.
   */
  public void unlink() {
    Registration link;
    synchronized (this) {
      link = parentLink;
      parentLink = Registration.NONE;
    }
    link.remove();
  }

  public void cancel() {
    List<Runnable> toNotify;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toNotify = List.copyOf(listeners);
      listeners.clear();
    }
    latch.countDown();
    for (Runnable listener : toNotify) {
      notifyListener(listener);
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /**
   * Runs {@code listener} once on cancellation, immediately if already cancelled.
   *
   * @return handle that removes the listener if it has not run yet
   */
  public Registration onCancel(Runnable listener) {
    synchronized (this) {
      if (!cancelled) {
        listeners.add(listener);
        return () -> removeListener(listener);
      }
    }
    notifyListener(listener);
    return Registration.NONE;
  }

  synchronized int listenerCount() {
    return listeners.size();
  }

  private synchronized void removeListener(Runnable listener) {
    listeners.remove(listener);
  }

  /**
   * Waits up to {@code timeout} for cancellation.
   *
   * @return {@code true} if the token was cancelled (or the waiting thread interrupted)
   *     before the timeout elapsed
   */
  public boolean await(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    try {
      return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private void notifyListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException ex) {
      log.warn("cancellation_listener_failed error={} message={}", ex.getClass().getSimpleName(), ex.getMessage());
    }
  }

  /**
   * A listener registered with {@link #onCancel(Runnable)}.
   */
  @FunctionalInterface
  public interface Registration {

    Registration NONE = () -> { };

    void remove();
  }
}
