package com.github.adamzv.brokerdispatch.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.HandlerBinding;
import com.github.adamzv.brokerdispatch.domain.ProblemCodes;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.TopicPolicy;
import com.github.adamzv.brokerdispatch.ports.MessageHandler;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TopicRegistryTest {

  private static final MessageHandler NOOP = message -> { };
  private static final DispatchConfig CONFIG = DispatchConfig.defaults();

  @Test
  void topicsAreSortedAndIndependentOfRegistrationOrder() {
    TopicRegistry forward = TopicRegistry.from(List.of(
        HandlerBinding.of("payments", "pay", NOOP),
        HandlerBinding.of("orders", "order", NOOP)
    ), CONFIG);
    TopicRegistry reverse = TopicRegistry.from(List.of(
        HandlerBinding.of("orders", "order", NOOP),
        HandlerBinding.of("payments", "pay", NOOP)
    ), CONFIG);

    assertEquals(List.of("orders", "payments"), forward.topics());
    assertEquals(forward.topics(), reverse.topics());
  }

  @Test
  void identicalDuplicatesCollapse() {
    TopicRegistry registry = TopicRegistry.from(List.of(
        HandlerBinding.of("orders", "order", NOOP),
        HandlerBinding.of("orders", "order", NOOP)
    ), CONFIG);

    assertEquals(List.of("orders"), registry.topics());
  }

  @Test
  void conflictingHandlersForOneTopicAreRejected() {
    List<HandlerBinding> bindings = List.of(
        HandlerBinding.of("orders", "order", NOOP),
        HandlerBinding.of("orders", "audit", NOOP)
    );

    ProblemException exception = assertThrows(ProblemException.class, () -> TopicRegistry.from(bindings, CONFIG));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }

  @Test
  void defaultsApplyWithoutOverrides() {
    TopicRegistry registry = TopicRegistry.from(List.of(HandlerBinding.of("orders", "order", NOOP)), CONFIG);

    TopicPolicy policy = registry.route("orders").orElseThrow().policy();

    assertEquals(3, policy.maxRetries());
    assertEquals(Duration.ofSeconds(1), policy.retryBackoffUnit());
    assertEquals("orders.dlq", policy.dlqTopic());
  }

  @Test
  void overridesWinIncludingZeroRetries() {
    HandlerBinding binding = HandlerBinding.of("orders", "order", NOOP)
        .withMaxRetries(0)
        .withDlqTopic("orders-parking")
        .withRetryBackoffUnit(Duration.ofMillis(250));

    TopicPolicy policy = TopicRegistry.from(List.of(binding), CONFIG).route("orders").orElseThrow().policy();

    assertEquals(0, policy.maxRetries());
    assertEquals("orders-parking", policy.dlqTopic());
    assertEquals(Duration.ofMillis(250), policy.retryBackoffUnit());
  }

  @Test
  void explicitDeadLetterTopicIsKeptWhenDeadLetteringIsDisabled() {
    DispatchConfig disabled = CONFIG.withDeadLetter(false, ".dlq");
    TopicRegistry registry = TopicRegistry.from(List.of(
        HandlerBinding.of("orders", "order", NOOP).withDlqTopic("orders-parking"),
        HandlerBinding.of("payments", "pay", NOOP)
    ), disabled);

    assertEquals("orders-parking", registry.route("orders").orElseThrow().policy().dlqTopic());
    assertNull(registry.route("payments").orElseThrow().policy().dlqTopic());
  }

  @Test
  void emptyRegistryHasNoRoutes() {
    TopicRegistry registry = TopicRegistry.from(List.of(), CONFIG);

    assertTrue(registry.isEmpty());
    assertTrue(registry.route("orders").isEmpty());
  }
}
