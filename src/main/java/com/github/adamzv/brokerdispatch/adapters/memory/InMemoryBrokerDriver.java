package com.github.adamzv.brokerdispatch.adapters.memory;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.DispatchOutcome;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import com.github.adamzv.brokerdispatch.ports.MessageCallback;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process broker for development and tests. Every topic is a single partition log; a
 * consumer group keeps a committed offset per topic and resumes from it in the next session.
 *
 * <p>Failures can be injected for connect, subscribe and publish.
 */
public class InMemoryBrokerDriver implements BrokerDriver {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBrokerDriver.class);

  private static final Duration IDLE_WAIT = Duration.ofMillis(50);

  private final boolean autoCommit;
  private final Duration redeliveryBackoff;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Map<String, List<BrokerMessage>> logs = new HashMap<>();
  private final Map<String, Map<String, Long>> committed = new HashMap<>();
  private final Map<String, String> groupByTopic = new HashMap<>();
  private final Set<CancellationToken> sessions = new HashSet<>();
  private final List<BrokerMessage> acked = new ArrayList<>();
  private final List<BrokerMessage> nacked = new ArrayList<>();
  private final Map<String, Integer> publishFailures = new HashMap<>();

  private boolean connected;
  private int connectCount;
  private int disconnectCount;
  private ProblemException connectFailure;
  private ProblemException subscribeFailure;

  public InMemoryBrokerDriver() {
    this(true, Duration.ofMillis(100));
  }

  /**
   * @param autoCommit commit a message's offset once its callback settled it
   * @param redeliveryBackoff pause before redelivering a message whose callback threw
   */
  public InMemoryBrokerDriver(boolean autoCommit, Duration redeliveryBackoff) {
    this.autoCommit = autoCommit;
    this.redeliveryBackoff = redeliveryBackoff;
  }

  @Override
  public String name() {
    return "memory";
  }

  @Override
  public void connect() {
    lock.lock();
    try {
      if (connectFailure != null) {
        throw connectFailure;
      }
      if (!connected) {
        connected = true;
        connectCount++;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void disconnect() {
    List<CancellationToken> active;
    lock.lock();
    try {
      connected = false;
      disconnectCount++;
      active = List.copyOf(sessions);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    active.forEach(CancellationToken::cancel);
  }

  @Override
  public boolean isConnected() {
    lock.lock();
    try {
      return connected;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void ping() {
    if (!isConnected()) {
      throw Problems.notConnected("In-memory broker is not connected", Map.of("driver", name()));
    }
  }

  @Override
  public void publish(String topic, BrokerMessage message) {
    lock.lock();
    try {
      requireConnected(topic);
      Integer remaining = publishFailures.get(topic);
      if (remaining != null && remaining > 0) {
        publishFailures.put(topic, remaining - 1);
        throw Problems.brokerUnavailable("Injected publish failure", Map.of("topic", topic));
      }
      List<BrokerMessage> entries = logs.computeIfAbsent(topic, ignored -> new ArrayList<>());
      entries.add(BrokerMessage.received(
          topic,
          message.key(),
          message.body(),
          message.headers(),
          0,
          entries.size(),
          Instant.now()
      ));
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void publishBatch(String topic, List<BrokerMessage> messages) {
    for (BrokerMessage message : messages) {
      publish(topic, message);
    }
  }

  @Override
  public void consumeGroup(String groupId,
                           List<String> topics,
                           MessageCallback callback,
                           CancellationToken cancellation) {
    CancellationToken session = CancellationToken.linkedTo(cancellation);
    Map<String, Long> positions = new HashMap<>();
    lock.lock();
    try {
      if (subscribeFailure != null) {
        throw subscribeFailure;
      }
      if (!connected) {
        throw Problems.subscribeFailed("In-memory broker is not connected", Map.of("group", groupId), null);
      }
      if (topics == null || topics.isEmpty()) {
        throw Problems.subscribeFailed("No topics to subscribe to", Map.of("group", groupId), null);
      }
      sessions.add(session);
      Map<String, Long> groupOffsets = committed.computeIfAbsent(groupId, ignored -> new HashMap<>());
      for (String topic : topics) {
        groupByTopic.put(topic, groupId);
        positions.put(topic, groupOffsets.getOrDefault(topic, 0L));
      }
    } finally {
      lock.unlock();
    }
    session.onCancel(this::wakeUp);
    log.info("memory_group_joined group={} topics={}", groupId, topics);

    try {
      int firstTopic = 0;
      while (!session.isCancelled()) {
        BrokerMessage next = awaitNext(topics, firstTopic, positions, session);
        if (next == null) {
          break;
        }
        // rotate so a busy topic cannot starve the others
        firstTopic = (topics.indexOf(next.topic()) + 1) % topics.size();
        positions.put(next.topic(), next.offset() + 1);

        DispatchOutcome outcome;
        try {
          outcome = callback.onMessage(next);
        } catch (RuntimeException ex) {
          log.warn("memory_callback_failed group={} topic={} offset={} error={}",
              groupId, next.topic(), next.offset(), ex.getMessage());
          positions.put(next.topic(), next.offset());
          session.await(redeliveryBackoff);
          continue;
        }
        if (!outcome.isSettled()) {
          positions.put(next.topic(), next.offset());
          continue;
        }
        if (autoCommit) {
          commit(groupId, next);
        }
      }
    } finally {
      session.unlink();
      lock.lock();
      try {
        sessions.remove(session);
        for (String topic : topics) {
          groupByTopic.remove(topic, groupId);
        }
      } finally {
        lock.unlock();
      }
      log.info("memory_group_left group={}", groupId);
    }
  }

  @Override
  public void ack(BrokerMessage message) {
    lock.lock();
    try {
      String groupId = groupByTopic.get(message.topic());
      if (groupId == null) {
        throw Problems.notConnected("No consumer group session for topic", Map.of("topic", message.topic()));
      }
      acked.add(message);
    } finally {
      lock.unlock();
    }
    commitFor(message);
  }

  @Override
  public void nack(BrokerMessage message, boolean requeue) {
    lock.lock();
    try {
      nacked.add(message);
    } finally {
      lock.unlock();
    }
    if (requeue) {
      publish(message.topic(), message);
      return;
    }
    commitFor(message);
  }

  public List<BrokerMessage> published(String topic) {
    lock.lock();
    try {
      return List.copyOf(logs.getOrDefault(topic, List.of()));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until {@code topic} holds at least {@code count} messages.
   */
  public boolean awaitPublished(String topic, int count, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    lock.lock();
    try {
      while (logs.getOrDefault(topic, List.of()).size() < count) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        changed.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public List<BrokerMessage> acked() {
    lock.lock();
    try {
      return List.copyOf(acked);
    } finally {
      lock.unlock();
    }
  }

  public List<BrokerMessage> nacked() {
    lock.lock();
    try {
      return List.copyOf(nacked);
    } finally {
      lock.unlock();
    }
  }

  public long committedOffset(String groupId, String topic) {
    lock.lock();
    try {
      return committed.getOrDefault(groupId, Map.of()).getOrDefault(topic, 0L);
    } finally {
      lock.unlock();
    }
  }

  public int connectCount() {
    lock.lock();
    try {
      return connectCount;
    } finally {
      lock.unlock();
    }
  }

  public int disconnectCount() {
    lock.lock();
    try {
      return disconnectCount;
    } finally {
      lock.unlock();
    }
  }

  public void failConnect(ProblemException failure) {
    lock.lock();
    try {
      connectFailure = failure;
    } finally {
      lock.unlock();
    }
  }

  public void failSubscribe(ProblemException failure) {
    lock.lock();
    try {
      subscribeFailure = failure;
    } finally {
      lock.unlock();
    }
  }

  public void failPublishes(String topic, int count) {
    lock.lock();
    try {
      publishFailures.put(topic, count);
    } finally {
      lock.unlock();
    }
  }

  private BrokerMessage awaitNext(List<String> topics,
                                  int firstTopic,
                                  Map<String, Long> positions,
                                  CancellationToken session) {
    lock.lock();
    try {
      while (!session.isCancelled()) {
        for (int i = 0; i < topics.size(); i++) {
          String topic = topics.get((firstTopic + i) % topics.size());
          List<BrokerMessage> entries = logs.getOrDefault(topic, List.of());
          long position = positions.getOrDefault(topic, 0L);
          if (position < entries.size()) {
            return entries.get((int) position);
          }
        }
        changed.await(IDLE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      }
      return null;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      session.cancel();
      return null;
    } finally {
      lock.unlock();
    }
  }

  private void commitFor(BrokerMessage message) {
    lock.lock();
    try {
      String groupId = groupByTopic.get(message.topic());
      if (groupId != null) {
        commit(groupId, message);
      }
    } finally {
      lock.unlock();
    }
  }

  private void commit(String groupId, BrokerMessage message) {
    lock.lock();
    try {
      committed.computeIfAbsent(groupId, ignored -> new HashMap<>())
          .merge(message.topic(), message.offset() + 1, Math::max);
    } finally {
      lock.unlock();
    }
  }

  private void wakeUp() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void requireConnected(String topic) {
    if (!connected) {
      throw Problems.notConnected("In-memory broker is not connected", Map.of("topic", topic));
    }
  }
}
