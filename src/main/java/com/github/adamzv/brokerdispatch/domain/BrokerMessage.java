package com.github.adamzv.brokerdispatch.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message flowing through the dispatch pipeline.
 *
 * <p>Topic, key, body, partition and offset are fixed once a driver hands the message over.
 * The retry count and headers only change through {@link #nextAttempt(String)}, which returns
 * a fresh copy for republishing; handlers see an immutable view.
 *
 * <p>Partition and offset are {@code -1} for messages that have not been received from a
 * broker yet (for example messages built for publishing).
 */
public record BrokerMessage(
    String topic,
    byte[] key,
    byte[] body,
    Map<String, String> headers,
    int partition,
    long offset,
    Instant timestamp,
    int retryCount
) {

  public static final int UNASSIGNED_PARTITION = -1;
  public static final long UNASSIGNED_OFFSET = -1L;

  public BrokerMessage {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Message topic must not be blank", Map.of());
    }
    if (retryCount < 0) {
      throw Problems.invalidArgument("Retry count must be non-negative", Map.of("retryCount", retryCount));
    }
    key = key == null ? null : key.clone();
    body = body == null ? new byte[0] : body.clone();
    headers = headers == null || headers.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    timestamp = timestamp == null ? Instant.now() : timestamp;
  }

  /**
   * Builds a message for publishing; the broker assigns partition and offset.
   */
  public static BrokerMessage outbound(String topic, byte[] key, byte[] body, Map<String, String> headers) {
    return new BrokerMessage(topic, key, body, headers, UNASSIGNED_PARTITION, UNASSIGNED_OFFSET, Instant.now(), 0);
  }

  public static BrokerMessage outbound(String topic, byte[] body) {
    return outbound(topic, null, body, Map.of());
  }

  /**
   * Builds a message as delivered by a driver. The retry count is recovered from the
   * {@value MessageHeaders#RETRY_COUNT} header so it survives a republish round trip.
   */
  public static BrokerMessage received(String topic,
                                       byte[] key,
                                       byte[] body,
                                       Map<String, String> headers,
                                       int partition,
                                       long offset,
                                       Instant timestamp) {
    return new BrokerMessage(topic, key, body, headers, partition, offset, timestamp, parseRetryCount(headers));
  }

  @Override
  public byte[] key() {
    return key == null ? null : key.clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public String header(String name) {
    return headers.get(name);
  }

  /**
   * Copy for the next delivery attempt: retry count incremented, retry headers stamped.
   * Partition and offset are reset since the copy is published anew.
   */
  public BrokerMessage nextAttempt(String lastError) {
    int next = retryCount + 1;
    Map<String, String> stamped = new LinkedHashMap<>(headers);
    stamped.put(MessageHeaders.RETRY_COUNT, Integer.toString(next));
    stamped.put(MessageHeaders.LAST_ERROR, lastError == null ? "" : lastError);
    return new BrokerMessage(topic, key, body, stamped, UNASSIGNED_PARTITION, UNASSIGNED_OFFSET, Instant.now(), next);
  }

  /**
   * Same content addressed to another topic, as a fresh outbound message.
   */
  public BrokerMessage withTopic(String newTopic) {
    return new BrokerMessage(newTopic, key, body, headers, UNASSIGNED_PARTITION, UNASSIGNED_OFFSET, timestamp, retryCount);
  }

  static int parseRetryCount(Map<String, String> headers) {
    if (headers == null) {
      return 0;
    }
    String raw = headers.get(MessageHeaders.RETRY_COUNT);
    if (raw == null || raw.isBlank()) {
      return 0;
    }
    try {
      return Math.max(0, Integer.parseInt(raw.trim()));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof BrokerMessage that)) {
      return false;
    }
    return partition == that.partition
        && offset == that.offset
        && retryCount == that.retryCount
        && topic.equals(that.topic)
        && Arrays.equals(key, that.key)
        && Arrays.equals(body, that.body)
        && headers.equals(that.headers)
        && timestamp.equals(that.timestamp);
  }

  @Override
  public int hashCode() {
    int result = topic.hashCode();
    result = 31 * result + Arrays.hashCode(key);
    result = 31 * result + Arrays.hashCode(body);
    result = 31 * result + headers.hashCode();
    result = 31 * result + Integer.hashCode(partition);
    result = 31 * result + Long.hashCode(offset);
    result = 31 * result + Integer.hashCode(retryCount);
    return result;
  }

  @Override
  public String toString() {
    return "BrokerMessage[topic=" + topic
        + ", partition=" + partition
        + ", offset=" + offset
        + ", retryCount=" + retryCount
        + ", bodyBytes=" + body.length
        + ", headers=" + headers + "]";
  }
}
