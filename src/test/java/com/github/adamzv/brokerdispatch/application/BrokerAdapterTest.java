package com.github.adamzv.brokerdispatch.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.brokerdispatch.adapters.memory.InMemoryBrokerDriver;
import com.github.adamzv.brokerdispatch.domain.AdapterState;
import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.HandlerBinding;
import com.github.adamzv.brokerdispatch.domain.MessageHeaders;
import com.github.adamzv.brokerdispatch.domain.ProblemCodes;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.MessageHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BrokerAdapterTest {

  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final DispatchConfig CONFIG = DispatchConfig.defaults()
      .withRetries(2, Duration.ofMillis(10));

  private InMemoryBrokerDriver driver;
  private RecordingSleeper sleeper;
  private BrokerAdapter adapter;

  @BeforeEach
  void setUp() {
    driver = new InMemoryBrokerDriver(true, Duration.ofMillis(10));
    sleeper = new RecordingSleeper();
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.stop();
    }
  }

  @Test
  void failingHandlerIsRetriedWithLinearBackoffThenDeadLettered() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> {
      attempts.incrementAndGet();
      throw new IllegalStateException("inventory service down");
    }));

    adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", "order-1".getBytes(StandardCharsets.UTF_8)));

    assertTrue(driver.awaitPublished("orders.dlq", 1, WAIT));
    adapter.stop();

    assertEquals(3, attempts.get());
    assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeper.requested);
    List<BrokerMessage> deadLetters = driver.published("orders.dlq");
    assertEquals(1, deadLetters.size());
    BrokerMessage deadLetter = deadLetters.get(0);
    assertEquals("orders", deadLetter.header(MessageHeaders.ORIGINAL_TOPIC));
    assertEquals("2", deadLetter.header(MessageHeaders.RETRY_COUNT));
    assertEquals("inventory service down", deadLetter.header(MessageHeaders.ERROR));
    assertEquals("order-1", new String(deadLetter.body(), StandardCharsets.UTF_8));
    assertEquals(3, driver.published("orders").size());
    assertEquals(3L, driver.committedOffset(CONFIG.groupId(), "orders"));
  }

  @Test
  void handlerSucceedingOnThirdAttemptIsNotDeadLettered() throws Exception {
    List<Integer> retryCounts = new CopyOnWriteArrayList<>();
    CountDownLatch succeeded = new CountDownLatch(1);
    DispatchConfig config = CONFIG.withRetries(3, Duration.ofMillis(10));
    adapter = adapter(config, sleeper, HandlerBinding.of("orders", "order", message -> {
      retryCounts.add(message.retryCount());
      if (retryCounts.size() < 3) {
        throw new IllegalStateException("not yet");
      }
      succeeded.countDown();
    }));

    adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", new byte[0]));
    assertTrue(succeeded.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    adapter.stop();

    assertEquals(List.of(0, 1, 2), retryCounts);
    assertEquals("2", driver.published("orders").get(2).header(MessageHeaders.RETRY_COUNT));
    assertTrue(driver.published("orders.dlq").isEmpty());
    assertEquals(3L, driver.committedOffset(config.groupId(), "orders"));
  }

  @Test
  void stopIsIdempotentAndDisconnectsOnce() {
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));
    adapter.start();

    adapter.stop();
    adapter.stop();

    assertEquals(AdapterState.STOPPED, adapter.state());
    assertFalse(adapter.isRunning());
    assertEquals(1, driver.disconnectCount());
    assertFalse(driver.isConnected());
  }

  @Test
  void stopBeforeStartIsNoOp() {
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));

    adapter.stop();

    assertEquals(AdapterState.IDLE, adapter.state());
    assertEquals(0, driver.disconnectCount());
  }

  @Test
  void secondStartWhileRunningIsRejected() {
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));
    adapter.start();

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.start());

    assertEquals(ProblemCodes.ALREADY_RUNNING, exception.problem().code());
    assertTrue(adapter.isRunning());
  }

  @Test
  void connectFailureIsThrownAndDriverCleanedUp() {
    driver.failConnect(Problems.brokerUnavailable("broker down", Map.of()));
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.start());

    assertEquals(ProblemCodes.BROKER_UNAVAILABLE, exception.problem().code());
    assertEquals(AdapterState.STOPPED, adapter.state());
    assertEquals(1, driver.disconnectCount());
  }

  @Test
  void startWithoutHandlersFails() {
    adapter = new BrokerAdapter(
        driver,
        TopicRegistry.from(List.of(), CONFIG),
        CONFIG,
        new RetryPolicy(),
        new DeadLetterRouter(driver, Clock.systemUTC()),
        sleeper,
        new DispatchMetrics(new SimpleMeterRegistry())
    );

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.start());

    assertEquals(ProblemCodes.NO_HANDLERS, exception.problem().code());
    assertEquals(1, driver.disconnectCount());
    assertFalse(driver.isConnected());
  }

  @Test
  void subscribeFailureCompletesRunExceptionally() throws Exception {
    driver.failSubscribe(Problems.subscribeFailed("group rejected", Map.of(), null));
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));

    CompletableFuture<Void> run = adapter.start();

    ExecutionException exception = assertThrows(ExecutionException.class, () -> run.get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    ProblemException problem = assertInstanceOf(ProblemException.class, exception.getCause());
    assertEquals(ProblemCodes.SUBSCRIBE_FAILED, problem.problem().code());
    assertEquals(AdapterState.STOPPED, adapter.state());
    assertEquals(1, driver.disconnectCount());
  }

  @Test
  void blockingRunRethrowsSubscribeFailure() {
    driver.failSubscribe(Problems.subscribeFailed("group rejected", Map.of(), null));
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.run(CancellationToken.create()));

    assertEquals(ProblemCodes.SUBSCRIBE_FAILED, exception.problem().code());
  }

  @Test
  void restartResumesAfterCommittedMessages() throws Exception {
    List<String> bodies = new CopyOnWriteArrayList<>();
    CountDownLatch firstSeen = new CountDownLatch(1);
    CountDownLatch secondSeen = new CountDownLatch(2);
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> {
      bodies.add(new String(message.body(), StandardCharsets.UTF_8));
      firstSeen.countDown();
      secondSeen.countDown();
    }));

    adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", "first".getBytes(StandardCharsets.UTF_8)));
    assertTrue(firstSeen.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    adapter.stop();

    adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", "second".getBytes(StandardCharsets.UTF_8)));
    assertTrue(secondSeen.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    adapter.stop();

    assertEquals(List.of("first", "second"), bodies);
    assertEquals(2, driver.connectCount());
    assertEquals(2, driver.disconnectCount());
  }

  @Test
  void stopInterruptsLongBackoffWithoutRepublishing() throws Exception {
    CountDownLatch failed = new CountDownLatch(1);
    DispatchConfig slow = CONFIG.withRetries(3, Duration.ofMinutes(10));
    adapter = adapter(slow, BackoffSleeper.cancellable(), HandlerBinding.of("orders", "order", message -> {
      failed.countDown();
      throw new IllegalStateException("boom");
    }));

    adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", "payload".getBytes(StandardCharsets.UTF_8)));
    assertTrue(failed.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));

    long startedAt = System.nanoTime();
    adapter.stop();
    long stoppedAfterMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

    assertTrue(stoppedAfterMs < WAIT.toMillis(), "stop took " + stoppedAfterMs + "ms");
    assertEquals(AdapterState.STOPPED, adapter.state());
    assertEquals(1, driver.published("orders").size());
    assertEquals(0L, driver.committedOffset(slow.groupId(), "orders"));
  }

  @Test
  void cancellingParentTokenStopsRun() throws Exception {
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", message -> { }));
    CancellationToken parent = CancellationToken.create();

    CompletableFuture<Void> run = adapter.start(parent);
    parent.cancel();
    run.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

    assertEquals(AdapterState.STOPPED, adapter.state());
    assertEquals(1, driver.disconnectCount());
  }

  @Test
  void handlerMayStopItsOwnAdapter() throws Exception {
    AtomicReference<BrokerAdapter> self = new AtomicReference<>();
    MessageHandler stopping = message -> self.get().stop();
    adapter = adapter(CONFIG, sleeper, HandlerBinding.of("orders", "order", stopping));
    self.set(adapter);

    CompletableFuture<Void> run = adapter.start();
    driver.publish("orders", BrokerMessage.outbound("orders", new byte[0]));
    run.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

    assertEquals(AdapterState.STOPPED, adapter.state());
    assertEquals(1L, driver.committedOffset(CONFIG.groupId(), "orders"));
  }

  @Test
  void exposesSubscribedTopicsAndDriver() {
    adapter = adapter(CONFIG, sleeper,
        HandlerBinding.of("payments", "pay", message -> { }),
        HandlerBinding.of("orders", "order", message -> { }));

    assertEquals(List.of("orders", "payments"), adapter.subscribedTopics());
    assertEquals("memory", adapter.driver().name());
    assertEquals(AdapterState.IDLE, adapter.state());
  }

  private BrokerAdapter adapter(DispatchConfig config, BackoffSleeper backoffSleeper, HandlerBinding... bindings) {
    return new BrokerAdapter(
        driver,
        TopicRegistry.from(List.of(bindings), config),
        config,
        new RetryPolicy(),
        new DeadLetterRouter(driver, Clock.systemUTC()),
        backoffSleeper,
        new DispatchMetrics(new SimpleMeterRegistry())
    );
  }
}
