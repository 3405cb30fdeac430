package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.DispatchOutcome;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.domain.TopicPolicy;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import com.github.adamzv.brokerdispatch.ports.MessageCallback;
import io.micrometer.core.instrument.Timer;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each inbound message to its handler and applies the failure policy. One instance per
 * adapter run; invoked by the driver on the dispatch thread, one message at a time.
 */
public final class MessageDispatcher implements MessageCallback {

  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

  private final BrokerDriver driver;
  private final TopicRegistry registry;
  private final DispatchConfig config;
  private final RetryPolicy retryPolicy;
  private final DeadLetterRouter deadLetterRouter;
  private final BackoffSleeper sleeper;
  private final DispatchMetrics metrics;
  private final CancellationToken cancellation;

  public MessageDispatcher(BrokerDriver driver,
                           TopicRegistry registry,
                           DispatchConfig config,
                           RetryPolicy retryPolicy,
                           DeadLetterRouter deadLetterRouter,
                           BackoffSleeper sleeper,
                           DispatchMetrics metrics,
                           CancellationToken cancellation) {
    this.driver = driver;
    this.registry = registry;
    this.config = config;
    this.retryPolicy = retryPolicy;
    this.deadLetterRouter = deadLetterRouter;
    this.sleeper = sleeper;
    this.metrics = metrics;
    this.cancellation = cancellation;
  }

  @Override
  public DispatchOutcome onMessage(BrokerMessage message) {
    DispatchOutcome outcome;
    try {
      outcome = dispatch(message);
    } catch (ProblemException ex) {
      metrics.outcome(message.topic(), "failed");
      metrics.failure(message.topic(), ex.code());
      log.error(
          "dispatch outcome=error topic={} partition={} offset={} retryCount={} code={} message={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.retryCount(),
          ex.code(),
          ex.getMessage()
      );
      throw ex;
    }
    metrics.outcome(message.topic(), outcome.tag());
    log.debug(
        "dispatch outcome={} topic={} partition={} offset={} retryCount={}",
        outcome.tag(),
        message.topic(),
        message.partition(),
        message.offset(),
        message.retryCount()
    );
    return outcome;
  }

  private DispatchOutcome dispatch(BrokerMessage message) {
    TopicRegistry.Route route = registry.route(message.topic())
        .orElseThrow(() -> Problems.notFound(
            "No handler bound to topic",
            Map.of("topic", message.topic())
        ));

    Timer.Sample sample = metrics.startHandler();
    try {
      route.binding().handler().handle(message);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.handlerFinished(message.topic(), sample, false);
      return onFailure(message, route, ex);
    }
    metrics.handlerFinished(message.topic(), sample, true);

    if (config.autoAck()) {
      return DispatchOutcome.COMPLETED;
    }
    driver.ack(message);
    return DispatchOutcome.ACKNOWLEDGED;
  }

  private DispatchOutcome onFailure(BrokerMessage message, TopicRegistry.Route route, Exception error) {
    TopicPolicy policy = route.policy();
    RetryPolicy.Decision decision = retryPolicy.decide(message, policy);

    switch (decision.action()) {
      case RETRY:
        return retry(message, route, decision, error);
      case DEAD_LETTER:
        deadLetterRouter.route(message, policy.dlqTopic(), error);
        settleManually(message);
        return DispatchOutcome.DEAD_LETTERED;
      case DROP:
      default:
        log.warn(
            "dispatch_dropped topic={} partition={} offset={} retryCount={} handler={} error={}",
            message.topic(),
            message.partition(),
            message.offset(),
            message.retryCount(),
            route.binding().handlerName(),
            RetryPolicy.describe(error)
        );
        driver.nack(message, false);
        return DispatchOutcome.DROPPED;
    }
  }

  private DispatchOutcome retry(BrokerMessage message,
                                TopicRegistry.Route route,
                                RetryPolicy.Decision decision,
                                Exception error) {
    BrokerMessage next = message.nextAttempt(RetryPolicy.describe(error));
    log.warn(
        "dispatch_retry topic={} partition={} offset={} attempt={} maxRetries={} backoffMs={} handler={} error={}",
        message.topic(),
        message.partition(),
        message.offset(),
        decision.attempt(),
        route.policy().maxRetries(),
        decision.backoff().toMillis(),
        route.binding().handlerName(),
        RetryPolicy.describe(error)
    );

    if (!sleeper.sleep(decision.backoff(), cancellation)) {
      log.info(
          "dispatch_retry_cancelled topic={} partition={} offset={} attempt={}",
          message.topic(),
          message.partition(),
          message.offset(),
          decision.attempt()
      );
      return DispatchOutcome.CANCELLED;
    }

    try {
      driver.publish(message.topic(), next);
    } catch (RuntimeException ex) {
      Map<String, Object> details = new HashMap<>();
      details.put("topic", message.topic());
      details.put("partition", message.partition());
      details.put("offset", message.offset());
      details.put("attempt", decision.attempt());
      details.put("error", ex.getClass().getSimpleName());
      if (ex.getMessage() != null) {
        details.put("message", ex.getMessage());
      }
      throw Problems.publishFailed("Retry republish failed", details, ex);
    }
    settleManually(message);
    return DispatchOutcome.RETRIED;
  }

  // the original is superseded by its republished copy
  private void settleManually(BrokerMessage message) {
    if (!config.autoAck()) {
      driver.ack(message);
    }
  }
}
