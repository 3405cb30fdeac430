package com.github.adamzv.brokerdispatch.support;

import com.github.adamzv.brokerdispatch.application.BrokerAdapter;
import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final ObjectProvider<BrokerAdapter> brokerAdapter;
  private final Environment environment;

  public StartupLogger(ObjectProvider<BrokerAdapter> brokerAdapter, Environment environment) {
    this.brokerAdapter = brokerAdapter;
    this.environment = environment;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    String applicationName = environment.getProperty("spring.application.name", "broker-dispatch");
    BrokerAdapter adapter = brokerAdapter.getIfAvailable();
    if (adapter == null) {
      log.info("broker_adapter_disabled name={}", applicationName);
      return;
    }
    DispatchConfig dispatchConfig = adapter.config();
    log.info(
        "broker_adapter_ready name={} driver={} state={} group={} topics={} policy={{autoAck={}, maxRetries={}, retryBackoffUnit={}, dlqEnabled={}, dlqSuffix={}}}",
        applicationName,
        adapter.driver().name(),
        adapter.state(),
        dispatchConfig.groupId(),
        adapter.subscribedTopics(),
        dispatchConfig.autoAck(),
        dispatchConfig.maxRetries(),
        dispatchConfig.retryBackoffUnit(),
        dispatchConfig.dlqEnabled(),
        dispatchConfig.dlqSuffix()
    );
  }
}
