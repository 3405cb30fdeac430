package com.github.adamzv.brokerdispatch.support;

import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "broker")
public record BrokerProperties(
    @DefaultValue("true")
    boolean enabled,
    @DefaultValue("kafka")
    @Pattern(regexp = "kafka|memory", message = "broker.driver must be kafka or memory")
    String driver,
    @DefaultValue(DispatchConfig.DEFAULT_GROUP_ID)
    @NotBlank(message = "broker.groupId must not be blank")
    String groupId,
    @DefaultValue("true")
    boolean autoAck,
    @DefaultValue("3")
    @PositiveOrZero(message = "broker.maxRetries must be >= 0")
    int maxRetries,
    @DefaultValue("1s")
    @NotNull
    Duration retryBackoffUnit,
    @DefaultValue("true")
    boolean dlqEnabled,
    @DefaultValue(DispatchConfig.DEFAULT_DLQ_SUFFIX)
    String dlqSuffix,
    @DefaultValue("30s")
    @NotNull
    Duration shutdownTimeout
) {

  public DispatchConfig toDomain() {
    return new DispatchConfig(groupId, autoAck, maxRetries, retryBackoffUnit, dlqEnabled, dlqSuffix, shutdownTimeout);
  }

  @AssertTrue(message = "broker.dlqSuffix must not be blank when broker.dlqEnabled is true")
  public boolean isDlqSuffixPresent() {
    return !dlqEnabled || (dlqSuffix != null && !dlqSuffix.isBlank());
  }

  @AssertTrue(message = "broker.retryBackoffUnit must be >= 0 and broker.shutdownTimeout > 0")
  public boolean isDurationsValid() {
    return retryBackoffUnit != null && !retryBackoffUnit.isNegative()
        && shutdownTimeout != null && !shutdownTimeout.isZero() && !shutdownTimeout.isNegative();
  }
}
