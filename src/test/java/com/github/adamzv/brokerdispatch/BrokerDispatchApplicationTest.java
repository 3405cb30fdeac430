package com.github.adamzv.brokerdispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.brokerdispatch.application.BrokerAdapter;
import com.github.adamzv.brokerdispatch.application.BrokerPublisher;
import com.github.adamzv.brokerdispatch.domain.AdapterState;
import com.github.adamzv.brokerdispatch.domain.HandlerBinding;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

@SpringBootTest(properties = {
    "broker.driver=memory",
    "broker.group-id=context-test",
    "broker.retry-backoff-unit=10ms"
})
class BrokerDispatchApplicationTest {

  static final List<String> RECEIVED = new CopyOnWriteArrayList<>();
  static final CountDownLatch LATCH = new CountDownLatch(1);

  @TestConfiguration
  static class Handlers {

    @Bean
    HandlerBinding ordersBinding() {
      return HandlerBinding.of("orders", "order-handler", message -> {
        RECEIVED.add(new String(message.body(), StandardCharsets.UTF_8));
        LATCH.countDown();
      });
    }
  }

  @Autowired
  private BrokerAdapter brokerAdapter;

  @Autowired
  private BrokerPublisher brokerPublisher;

  @Test
  void adapterStartsWithContextAndDispatchesPublishedMessages() throws Exception {
    assertTrue(brokerAdapter.isRunning());
    assertEquals("memory", brokerAdapter.driver().name());
    assertEquals(List.of("orders"), brokerAdapter.subscribedTopics());

    brokerPublisher.publish("orders", "order-1");

    assertTrue(LATCH.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("order-1"), RECEIVED);
    assertEquals(AdapterState.CONSUMING, brokerAdapter.state());
  }
}
