package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.MessageHeaders;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DeadLetterRouter {

  private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

  private final BrokerDriver driver;
  private final Clock clock;

  public DeadLetterRouter(BrokerDriver driver, Clock clock) {
    this.driver = driver;
    this.clock = clock;
  }

  /**
   * Wraps {@code original} into a new message for {@code dlqTopic}: same key and body, original
   * headers plus the failure context.
   */
  public BrokerMessage build(BrokerMessage original, String dlqTopic, Throwable error) {
    Map<String, String> headers = new LinkedHashMap<>(original.headers());
    headers.put(MessageHeaders.ORIGINAL_TOPIC, original.topic());
    headers.put(MessageHeaders.ERROR, RetryPolicy.describe(error));
    headers.put(MessageHeaders.FAILED_AT,
        DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
    headers.put(MessageHeaders.RETRY_COUNT, Integer.toString(original.retryCount()));
    return BrokerMessage.outbound(dlqTopic, original.key(), original.body(), headers);
  }

  /**
   * Publishes the dead-letter message. A failed publish is surfaced, never dropped.
   *
   * @throws ProblemException with code {@code DEAD_LETTER_FAILED}
   */
  public BrokerMessage route(BrokerMessage original, String dlqTopic, Throwable error) {
    BrokerMessage deadLetter = build(original, dlqTopic, error);
    try {
      driver.publish(dlqTopic, deadLetter);
    } catch (RuntimeException ex) {
      Map<String, Object> details = new HashMap<>();
      details.put("topic", original.topic());
      details.put("dlqTopic", dlqTopic);
      details.put("partition", original.partition());
      details.put("offset", original.offset());
      details.put("error", ex.getClass().getSimpleName());
      if (ex.getMessage() != null) {
        details.put("message", ex.getMessage());
      }
      throw Problems.deadLetterFailed("Dead-letter publish failed", details, ex);
    }
    log.warn(
        "dead_lettered topic={} dlqTopic={} partition={} offset={} retryCount={} error={}",
        original.topic(),
        dlqTopic,
        original.partition(),
        original.offset(),
        original.retryCount(),
        deadLetter.header(MessageHeaders.ERROR)
    );
    return deadLetter;
  }
}
