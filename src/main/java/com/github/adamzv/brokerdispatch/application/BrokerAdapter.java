package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.AdapterState;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the dispatch task and its lifecycle: {@code IDLE -> CONNECTING -> CONSUMING -> DRAINING
 * -> STOPPED}, restartable from {@code STOPPED}.
 *
 * <p>{@link #start()} connects the driver and checks the topic set on the calling thread, then
 * runs the consumer group session on one dedicated thread. {@link #stop()} fires the run's
 * cancellation signal, lets the in-flight message finish and waits for the driver to be
 * disconnected. The driver is disconnected on every exit path of a run.
 *
 * <p>Only the state and the per-run signal are shared mutable state; both are guarded by one lock.
 */
public class BrokerAdapter {

  private static final Logger log = LoggerFactory.getLogger(BrokerAdapter.class);

  private final BrokerDriver driver;
  private final TopicRegistry registry;
  private final DispatchConfig config;
  private final RetryPolicy retryPolicy;
  private final DeadLetterRouter deadLetterRouter;
  private final BackoffSleeper sleeper;
  private final DispatchMetrics metrics;
  private final ThreadFactory threadFactory;

  private final Object lock = new Object();
  private AdapterState state = AdapterState.IDLE;
  private CancellationToken runCancellation;
  private CompletableFuture<Void> runCompletion;
  private Thread dispatchThread;

  public BrokerAdapter(BrokerDriver driver,
                       TopicRegistry registry,
                       DispatchConfig config,
                       RetryPolicy retryPolicy,
                       DeadLetterRouter deadLetterRouter,
                       BackoffSleeper sleeper,
                       DispatchMetrics metrics) {
    this(driver, registry, config, retryPolicy, deadLetterRouter, sleeper, metrics,
        runnable -> new Thread(runnable, "broker-dispatch-" + config.groupId()));
  }

  public BrokerAdapter(BrokerDriver driver,
                       TopicRegistry registry,
                       DispatchConfig config,
                       RetryPolicy retryPolicy,
                       DeadLetterRouter deadLetterRouter,
                       BackoffSleeper sleeper,
                       DispatchMetrics metrics,
                       ThreadFactory threadFactory) {
    this.driver = driver;
    this.registry = registry;
    this.config = config;
    this.retryPolicy = retryPolicy;
    this.deadLetterRouter = deadLetterRouter;
    this.sleeper = sleeper;
    this.metrics = metrics;
    this.threadFactory = threadFactory;
  }

  public CompletableFuture<Void> start() {
    return start(null);
  }

  /**
   * Starts a run. Connect failures and an empty topic set are thrown from here; a failure to
   * establish the consumer group session completes the returned future exceptionally.
   *
   * @param parent optional external signal; cancelling it stops the run like {@link #stop()}
   * @return completes when the run reached {@code STOPPED}
   * @throws ProblemException {@code ALREADY_RUNNING}, {@code BROKER_UNAVAILABLE} or {@code NO_HANDLERS}
   */
  public CompletableFuture<Void> start(CancellationToken parent) {
    CancellationToken cancellation;
    CompletableFuture<Void> completion;
    synchronized (lock) {
      if (state.isActive()) {
        throw Problems.alreadyRunning("Broker adapter already running", Map.of("state", state.name()));
      }
      state = AdapterState.CONNECTING;
      cancellation = CancellationToken.linkedTo(parent);
      completion = new CompletableFuture<>();
      runCancellation = cancellation;
      runCompletion = completion;
    }

    log.info("broker_adapter_starting driver={} group={} topics={}", driver.name(), config.groupId(), registry.topics());
    try {
      connect();
      if (registry.isEmpty()) {
        throw Problems.noHandlers("No message handlers registered", Map.of("group", config.groupId()));
      }
    } catch (ProblemException ex) {
      log.error("broker_adapter_start_failed driver={} code={} message={}", driver.name(), ex.code(), ex.getMessage());
      finishRun(cancellation, completion, ex);
      throw ex;
    }

    if (cancellation.isCancelled()) {
      finishRun(cancellation, completion, null);
      return completion;
    }

    Thread thread = threadFactory.newThread(() -> runSession(cancellation, completion));
    synchronized (lock) {
      dispatchThread = thread;
    }
    thread.start();
    return completion;
  }

  /**
   * Blocking variant of {@link #start(CancellationToken)}: returns once the run stopped, by
   * {@code cancellation}, by {@link #stop()} from another thread, or by a session failure.
   */
  public void run(CancellationToken cancellation) {
    CompletableFuture<Void> completion = start(cancellation);
    try {
      completion.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stop();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ProblemException problem) {
        throw problem;
      }
      throw Problems.operationFailed("Broker adapter run failed", Map.of("group", config.groupId()), cause);
    }
  }

  /**
   * Stops the current run and waits, up to the configured shutdown timeout, until the driver is
   * disconnected. No-op when nothing is running. Never throws for run outcomes.
   */
  public void stop() {
    CompletableFuture<Void> completion;
    Thread thread;
    synchronized (lock) {
      if (!state.isActive()) {
        log.debug("broker_adapter_stop_ignored state={}", state);
        return;
      }
      if (state != AdapterState.DRAINING) {
        log.info("broker_adapter_draining group={}", config.groupId());
        state = AdapterState.DRAINING;
      }
      runCancellation.cancel();
      completion = runCompletion;
      thread = dispatchThread;
    }

    if (thread == Thread.currentThread()) {
      // called from a handler; the session unwinds once the current message returns
      return;
    }
    awaitStopped(completion);
  }

  public boolean isRunning() {
    synchronized (lock) {
      return state.isActive();
    }
  }

  public AdapterState state() {
    synchronized (lock) {
      return state;
    }
  }

  public List<String> subscribedTopics() {
    return registry.topics();
  }

  public DispatchConfig config() {
    return config;
  }

  public BrokerDriver driver() {
    return driver;
  }

  private void connect() {
    try {
      driver.connect();
    } catch (ProblemException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw Problems.brokerUnavailable(
          "Failed to connect to broker",
          Map.of("driver", driver.name(), "error", ex.getClass().getSimpleName()),
          ex
      );
    }
  }

  private void runSession(CancellationToken cancellation, CompletableFuture<Void> completion) {
    Throwable failure = null;
    try {
      boolean consuming;
      synchronized (lock) {
        consuming = state == AdapterState.CONNECTING && !cancellation.isCancelled();
        if (consuming) {
          state = AdapterState.CONSUMING;
        }
      }
      if (consuming) {
        MessageDispatcher dispatcher = new MessageDispatcher(
            driver, registry, config, retryPolicy, deadLetterRouter, sleeper, metrics, cancellation);
        log.info("broker_adapter_consuming driver={} group={} topics={}", driver.name(), config.groupId(), registry.topics());
        driver.consumeGroup(config.groupId(), registry.topics(), dispatcher, cancellation);
        if (!cancellation.isCancelled()) {
          log.warn("broker_adapter_session_ended group={} reason=driver_returned", config.groupId());
        }
      }
    } catch (ProblemException ex) {
      log.error("broker_adapter_session_failed group={} code={} message={}", config.groupId(), ex.code(), ex.getMessage());
      failure = ex;
    } catch (RuntimeException ex) {
      log.error("broker_adapter_session_failed group={} error={}", config.groupId(), ex.getClass().getSimpleName(), ex);
      failure = Problems.operationFailed(
          "Consumer group session failed",
          Map.of("group", config.groupId(), "error", ex.getClass().getSimpleName()),
          ex
      );
    } finally {
      finishRun(cancellation, completion, failure);
    }
  }

  private void finishRun(CancellationToken cancellation, CompletableFuture<Void> completion, Throwable failure) {
    synchronized (lock) {
      if (state != AdapterState.STOPPED) {
        state = AdapterState.DRAINING;
      }
    }
    cancellation.cancel();
    cancellation.unlink();

    RuntimeException disconnectFailure = null;
    try {
      driver.disconnect();
    } catch (RuntimeException ex) {
      log.error("broker_adapter_disconnect_failed driver={} error={} message={}",
          driver.name(), ex.getClass().getSimpleName(), ex.getMessage());
      disconnectFailure = ex;
    }

    synchronized (lock) {
      state = AdapterState.STOPPED;
      dispatchThread = null;
    }
    log.info("broker_adapter_stopped driver={} group={}", driver.name(), config.groupId());

    if (failure != null) {
      if (disconnectFailure != null) {
        failure.addSuppressed(disconnectFailure);
      }
      completion.completeExceptionally(failure);
    } else if (disconnectFailure != null) {
      completion.completeExceptionally(disconnectFailure);
    } else {
      completion.complete(null);
    }
  }

  private void awaitStopped(CompletableFuture<Void> completion) {
    try {
      completion.get(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException ex) {
      log.debug("broker_adapter_run_failed cause={}", ex.getCause() == null ? null : ex.getCause().getMessage());
    } catch (TimeoutException ex) {
      Map<String, Object> details = new HashMap<>();
      details.put("group", config.groupId());
      details.put("timeoutMs", config.shutdownTimeout().toMillis());
      log.warn("broker_adapter_stop_timeout details={}", details);
    }
  }
}
