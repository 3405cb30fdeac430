package com.github.adamzv.brokerdispatch.application;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.MessageHeaders;
import com.github.adamzv.brokerdispatch.domain.ProblemCodes;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeadLetterRouterTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30.750Z"), ZoneOffset.UTC);

  private RecordingBrokerDriver driver;
  private DeadLetterRouter router;

  @BeforeEach
  void setUp() {
    driver = new RecordingBrokerDriver();
    router = new DeadLetterRouter(driver, CLOCK);
  }

  @Test
  void deadLetterCarriesOriginalPayloadAndFailureContext() {
    BrokerMessage original = BrokerMessage.received(
        "orders",
        "order-1".getBytes(StandardCharsets.UTF_8),
        "{\"id\":1}".getBytes(StandardCharsets.UTF_8),
        Map.of("trace-id", "abc", MessageHeaders.RETRY_COUNT, "2"),
        1,
        12L,
        Instant.EPOCH
    );

    router.route(original, "orders.dlq", new IllegalStateException("inventory service down"));

    assertEquals(1, driver.published.size());
    BrokerMessage deadLetter = driver.published.get(0);
    assertEquals("orders.dlq", deadLetter.topic());
    assertArrayEquals(original.key(), deadLetter.key());
    assertArrayEquals(original.body(), deadLetter.body());
    assertEquals("abc", deadLetter.header("trace-id"));
    assertEquals("orders", deadLetter.header(MessageHeaders.ORIGINAL_TOPIC));
    assertEquals("inventory service down", deadLetter.header(MessageHeaders.ERROR));
    assertEquals("2024-05-01T10:15:30Z", deadLetter.header(MessageHeaders.FAILED_AT));
    assertEquals("2", deadLetter.header(MessageHeaders.RETRY_COUNT));
  }

  @Test
  void errorWithoutMessageFallsBackToClassName() {
    BrokerMessage dead = router.build(BrokerMessage.outbound("orders", new byte[0]), "orders.dlq", new NullPointerException());

    assertEquals(NullPointerException.class.getName(), dead.header(MessageHeaders.ERROR));
  }

  @Test
  void publishFailureIsSurfaced() {
    driver.failingTopics.add("orders.dlq");

    ProblemException exception = assertThrows(
        ProblemException.class,
        () -> router.route(BrokerMessage.outbound("orders", new byte[0]), "orders.dlq", new RuntimeException("boom"))
    );

    assertEquals(ProblemCodes.DEAD_LETTER_FAILED, exception.problem().code());
    assertEquals("orders.dlq", exception.problem().details().get("dlqTopic"));
  }
}
