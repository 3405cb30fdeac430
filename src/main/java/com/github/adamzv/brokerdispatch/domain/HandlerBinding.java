package com.github.adamzv.brokerdispatch.domain;

import com.github.adamzv.brokerdispatch.ports.MessageHandler;
import java.time.Duration;
import java.util.Map;

/**
 * Binds one topic to one handler, with optional per-topic overrides. A {@code null} override
 * falls back to the adapter-wide {@link DispatchConfig} value.
 */
public record HandlerBinding(
    String topic,
    String handlerName,
    MessageHandler handler,
    Integer maxRetries,
    String dlqTopic,
    Duration retryBackoffUnit
) {

  public HandlerBinding {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Binding topic must not be blank", Map.of());
    }
    if (handlerName == null || handlerName.isBlank()) {
      throw Problems.invalidArgument("Binding handler name must not be blank", Map.of("topic", topic));
    }
    if (handler == null) {
      throw Problems.invalidArgument("Binding handler must not be null", Map.of("topic", topic));
    }
    if (maxRetries != null && maxRetries < 0) {
      throw Problems.invalidArgument(
          "Binding maxRetries must be >= 0",
          Map.of("topic", topic, "maxRetries", maxRetries)
      );
    }
    if (dlqTopic != null && dlqTopic.isBlank()) {
      dlqTopic = null;
    }
    if (retryBackoffUnit != null && retryBackoffUnit.isNegative()) {
      throw Problems.invalidArgument("Binding retryBackoffUnit must be >= 0", Map.of("topic", topic));
    }
  }

  public static HandlerBinding of(String topic, String handlerName, MessageHandler handler) {
    return new HandlerBinding(topic, handlerName, handler, null, null, null);
  }

  public HandlerBinding withMaxRetries(int retries) {
    return new HandlerBinding(topic, handlerName, handler, retries, dlqTopic, retryBackoffUnit);
  }

  public HandlerBinding withDlqTopic(String topicName) {
    return new HandlerBinding(topic, handlerName, handler, maxRetries, topicName, retryBackoffUnit);
  }

  public HandlerBinding withRetryBackoffUnit(Duration unit) {
    return new HandlerBinding(topic, handlerName, handler, maxRetries, dlqTopic, unit);
  }
}
