package com.github.adamzv.brokerdispatch.support;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotBlank(message = "kafka.bootstrapServers must not be blank")
    String bootstrapServers,
    @DefaultValue("broker-dispatch")
    @NotBlank(message = "kafka.clientId must not be blank")
    String clientId,
    @DefaultValue("earliest")
    @Pattern(regexp = "earliest|latest|none", message = "kafka.autoOffsetReset must be earliest, latest or none")
    String autoOffsetReset,
    @DefaultValue("300ms")
    @NotNull
    Duration pollTimeout,
    @DefaultValue("10s")
    @NotNull
    Duration sendTimeout,
    @DefaultValue("5s")
    @NotNull
    Duration adminTimeout,
    @DefaultValue("1s")
    @NotNull
    Duration reconnectBackoff,
    @DefaultValue("true")
    boolean verifyOnConnect
) {

  public static KafkaProperties of(String bootstrapServers) {
    return new KafkaProperties(
        bootstrapServers,
        "broker-dispatch",
        "earliest",
        Duration.ofMillis(300),
        Duration.ofSeconds(10),
        Duration.ofSeconds(5),
        Duration.ofSeconds(1),
        true
    );
  }

  public KafkaProperties withoutConnectVerification() {
    return new KafkaProperties(bootstrapServers, clientId, autoOffsetReset, pollTimeout, sendTimeout,
        adminTimeout, reconnectBackoff, false);
  }

  public KafkaProperties withReconnectBackoff(Duration backoff) {
    return new KafkaProperties(bootstrapServers, clientId, autoOffsetReset, pollTimeout, sendTimeout,
        adminTimeout, backoff, verifyOnConnect);
  }
}
