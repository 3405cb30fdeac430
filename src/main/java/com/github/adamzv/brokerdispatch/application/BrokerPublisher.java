package com.github.adamzv.brokerdispatch.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes application payloads through the driver. {@code byte[]} goes out unchanged,
 * {@code String} as UTF-8, anything else as JSON.
 */
public class BrokerPublisher {

  private final BrokerDriver driver;
  private final ObjectMapper objectMapper;

  public BrokerPublisher(BrokerDriver driver, ObjectMapper objectMapper) {
    this.driver = driver;
    this.objectMapper = objectMapper;
  }

  public BrokerMessage publish(String topic, Object payload) {
    return publish(topic, null, payload, Map.of());
  }

  public BrokerMessage publishWithKey(String topic, String key, Object payload) {
    return publish(topic, key, payload, Map.of());
  }

  public BrokerMessage publish(String topic, String key, Object payload, Map<String, String> headers) {
    String normalizedTopic = requireTopic(topic);
    BrokerMessage message = BrokerMessage.outbound(
        normalizedTopic,
        key == null ? null : key.getBytes(StandardCharsets.UTF_8),
        encode(normalizedTopic, payload),
        sanitizeHeaders(headers)
    );
    driver.publish(normalizedTopic, message);
    return message;
  }

  public List<BrokerMessage> publishBatch(String topic, List<?> payloads) {
    String normalizedTopic = requireTopic(topic);
    if (payloads == null || payloads.isEmpty()) {
      return List.of();
    }
    List<BrokerMessage> messages = new ArrayList<>(payloads.size());
    for (Object payload : payloads) {
      messages.add(BrokerMessage.outbound(normalizedTopic, null, encode(normalizedTopic, payload), Map.of()));
    }
    driver.publishBatch(normalizedTopic, messages);
    return List.copyOf(messages);
  }

  private String requireTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
    return topic.trim();
  }

  private byte[] encode(String topic, Object payload) {
    if (payload == null) {
      throw Problems.invalidArgument("Payload must not be null", Map.of("topic", topic));
    }
    if (payload instanceof byte[] bytes) {
      return bytes;
    }
    if (payload instanceof String text) {
      return text.getBytes(StandardCharsets.UTF_8);
    }
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw Problems.invalidArgument(
          "Payload could not be serialized to JSON",
          Map.of("topic", topic, "error", ex.getOriginalMessage())
      );
    }
  }

  private Map<String, String> sanitizeHeaders(Map<String, String> headers) {
    if (headers == null || headers.isEmpty()) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw Problems.invalidArgument("Header names must not be blank", Map.of());
      }
      copy.put(key, entry.getValue() == null ? "" : entry.getValue());
    }
    return copy;
  }
}
