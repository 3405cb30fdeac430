package com.github.adamzv.brokerdispatch.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.brokerdispatch.adapters.kafka.KafkaBrokerDriver;
import com.github.adamzv.brokerdispatch.adapters.memory.InMemoryBrokerDriver;
import com.github.adamzv.brokerdispatch.application.BackoffSleeper;
import com.github.adamzv.brokerdispatch.application.BrokerAdapter;
import com.github.adamzv.brokerdispatch.application.BrokerPublisher;
import com.github.adamzv.brokerdispatch.application.DeadLetterRouter;
import com.github.adamzv.brokerdispatch.application.DispatchMetrics;
import com.github.adamzv.brokerdispatch.application.RetryPolicy;
import com.github.adamzv.brokerdispatch.application.TopicRegistry;
import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.HandlerBinding;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.stream.Collectors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({BrokerProperties.class, KafkaProperties.class})
@ConditionalOnProperty(prefix = "broker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApplicationConfig {

  private static final Duration MEMORY_REDELIVERY_BACKOFF = Duration.ofMillis(100);

  private final BrokerProperties brokerProperties;

  public ApplicationConfig(BrokerProperties brokerProperties) {
    this.brokerProperties = brokerProperties;
  }

  @Bean
  public DispatchConfig dispatchConfig() {
    return brokerProperties.toDomain();
  }

  @Bean
  @ConditionalOnProperty(prefix = "broker", name = "driver", havingValue = "kafka", matchIfMissing = true)
  public BrokerDriver kafkaBrokerDriver(KafkaProperties kafkaProperties, DispatchConfig dispatchConfig) {
    return new KafkaBrokerDriver(kafkaProperties, dispatchConfig.autoAck());
  }

  @Bean
  @ConditionalOnProperty(prefix = "broker", name = "driver", havingValue = "memory")
  public BrokerDriver inMemoryBrokerDriver(DispatchConfig dispatchConfig) {
    return new InMemoryBrokerDriver(dispatchConfig.autoAck(), MEMORY_REDELIVERY_BACKOFF);
  }

  @Bean
  public TopicRegistry topicRegistry(ObjectProvider<HandlerBinding> bindings, DispatchConfig dispatchConfig) {
    return TopicRegistry.from(bindings.orderedStream().collect(Collectors.toList()), dispatchConfig);
  }

  @Bean
  public RetryPolicy retryPolicy() {
    return new RetryPolicy();
  }

  @Bean
  public Clock brokerClock() {
    return Clock.systemUTC();
  }

  @Bean
  public DeadLetterRouter deadLetterRouter(BrokerDriver brokerDriver, Clock brokerClock) {
    return new DeadLetterRouter(brokerDriver, brokerClock);
  }

  @Bean
  public BackoffSleeper backoffSleeper() {
    return BackoffSleeper.cancellable();
  }

  @Bean
  public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new DispatchMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public BrokerAdapter brokerAdapter(BrokerDriver brokerDriver,
                                     TopicRegistry topicRegistry,
                                     DispatchConfig dispatchConfig,
                                     RetryPolicy retryPolicy,
                                     DeadLetterRouter deadLetterRouter,
                                     BackoffSleeper backoffSleeper,
                                     DispatchMetrics dispatchMetrics) {
    return new BrokerAdapter(brokerDriver, topicRegistry, dispatchConfig, retryPolicy, deadLetterRouter,
        backoffSleeper, dispatchMetrics);
  }

  @Bean
  public BrokerPublisher brokerPublisher(BrokerDriver brokerDriver, ObjectProvider<ObjectMapper> objectMapper) {
    return new BrokerPublisher(brokerDriver, objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  public AdapterLifecycle adapterLifecycle(BrokerAdapter brokerAdapter) {
    return new AdapterLifecycle(brokerAdapter);
  }
}
