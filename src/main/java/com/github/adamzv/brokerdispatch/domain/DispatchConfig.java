package com.github.adamzv.brokerdispatch.domain;

import java.time.Duration;
import java.util.Map;

public record DispatchConfig(
    String groupId,
    boolean autoAck,
    int maxRetries,
    Duration retryBackoffUnit,
    boolean dlqEnabled,
    String dlqSuffix,
    Duration shutdownTimeout
) {

  public static final String DEFAULT_GROUP_ID = "broker-dispatch-consumer";
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_RETRY_BACKOFF_UNIT = Duration.ofSeconds(1);
  public static final String DEFAULT_DLQ_SUFFIX = ".dlq";
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  public DispatchConfig {
    if (groupId == null || groupId.isBlank()) {
      throw Problems.invalidArgument("Consumer group id must not be blank", Map.of());
    }
    if (maxRetries < 0) {
      throw Problems.invalidArgument("maxRetries must be >= 0", Map.of("maxRetries", maxRetries));
    }
    if (retryBackoffUnit == null || retryBackoffUnit.isNegative()) {
      throw Problems.invalidArgument("retryBackoffUnit must be >= 0", Map.of());
    }
    if (dlqEnabled && (dlqSuffix == null || dlqSuffix.isBlank())) {
      throw Problems.invalidArgument("dlqSuffix must not be blank when dead-lettering is enabled", Map.of());
    }
    if (shutdownTimeout == null || shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
      throw Problems.invalidArgument("shutdownTimeout must be positive", Map.of());
    }
  }

  public static DispatchConfig defaults() {
    return new DispatchConfig(
        DEFAULT_GROUP_ID,
        true,
        DEFAULT_MAX_RETRIES,
        DEFAULT_RETRY_BACKOFF_UNIT,
        true,
        DEFAULT_DLQ_SUFFIX,
        DEFAULT_SHUTDOWN_TIMEOUT
    );
  }

  public DispatchConfig withAutoAck(boolean value) {
    return new DispatchConfig(groupId, value, maxRetries, retryBackoffUnit, dlqEnabled, dlqSuffix, shutdownTimeout);
  }

  public DispatchConfig withRetries(int retries, Duration backoffUnit) {
    return new DispatchConfig(groupId, autoAck, retries, backoffUnit, dlqEnabled, dlqSuffix, shutdownTimeout);
  }

  public DispatchConfig withDeadLetter(boolean enabled, String suffix) {
    return new DispatchConfig(groupId, autoAck, maxRetries, retryBackoffUnit, enabled, suffix, shutdownTimeout);
  }
}
