package com.github.adamzv.brokerdispatch.adapters.kafka;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.DispatchOutcome;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.ports.BrokerDriver;
import com.github.adamzv.brokerdispatch.ports.MessageCallback;
import com.github.adamzv.brokerdispatch.support.KafkaProperties;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partition-offset reference driver on the plain Kafka clients.
 *
 * <p>Offsets are committed explicitly, never by the client's auto-commit: after a settled
 * callback when {@code autoCommit} is on, otherwise only through {@link #ack(BrokerMessage)}.
 * Commits are staged and flushed by the polling thread, since the consumer is single-threaded.
 * Kafka has no negative acknowledgment, so {@code nack(requeue=true)} republishes.
 */
public class KafkaBrokerDriver implements BrokerDriver {

  private static final Logger log = LoggerFactory.getLogger(KafkaBrokerDriver.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final KafkaProperties kafkaProperties;
  private final boolean autoCommit;
  private final KafkaClients clients;

  private final Object lock = new Object();
  private final Map<TopicPartition, Long> pendingCommits = new ConcurrentHashMap<>();
  private Producer<byte[], byte[]> producer;
  private Admin admin;
  private boolean connected;
  private volatile Consumer<byte[], byte[]> activeConsumer;

  public KafkaBrokerDriver(KafkaProperties kafkaProperties, boolean autoCommit) {
    this(kafkaProperties, autoCommit, new KafkaClients());
  }

  public KafkaBrokerDriver(KafkaProperties kafkaProperties, boolean autoCommit, KafkaClients clients) {
    this.kafkaProperties = kafkaProperties;
    this.autoCommit = autoCommit;
    this.clients = clients;
  }

  @Override
  public String name() {
    return "kafka";
  }

  @Override
  public void connect() {
    synchronized (lock) {
      if (connected) {
        return;
      }
      try {
        producer = clients.producer(producerProperties());
        if (kafkaProperties.verifyOnConnect()) {
          admin = clients.admin(adminProperties());
          describeCluster(admin, "connect");
        }
      } catch (KafkaException ex) {
        closeQuietly();
        throw Problems.brokerUnavailable(
            "Failed to connect to Kafka",
            errorDetails(Map.of(), ex),
            ex
        );
      } catch (ProblemException ex) {
        closeQuietly();
        throw ex;
      }
      connected = true;
      log.info("kafka_connected bootstrapServers={} clientId={}", kafkaProperties.bootstrapServers(), kafkaProperties.clientId());
    }
  }

  @Override
  public void disconnect() {
    Consumer<byte[], byte[]> consumer = activeConsumer;
    if (consumer != null) {
      consumer.wakeup();
    }
    List<RuntimeException> failures = new ArrayList<>();
    synchronized (lock) {
      if (producer != null) {
        try {
          producer.close(CLOSE_TIMEOUT);
        } catch (RuntimeException ex) {
          failures.add(ex);
        }
        producer = null;
      }
      if (admin != null) {
        try {
          admin.close(CLOSE_TIMEOUT);
        } catch (RuntimeException ex) {
          failures.add(ex);
        }
        admin = null;
      }
      connected = false;
    }
    if (!failures.isEmpty()) {
      RuntimeException first = failures.get(0);
      ProblemException problem = Problems.brokerUnavailable(
          "Kafka clients did not close cleanly",
          errorDetails(Map.of(), first),
          first
      );
      failures.stream().skip(1).forEach(problem::addSuppressed);
      throw problem;
    }
    log.info("kafka_disconnected bootstrapServers={}", kafkaProperties.bootstrapServers());
  }

  @Override
  public boolean isConnected() {
    synchronized (lock) {
      return connected;
    }
  }

  @Override
  public void ping() {
    Admin current;
    synchronized (lock) {
      if (!connected) {
        throw Problems.notConnected("Kafka driver is not connected", Map.of("bootstrapServers", kafkaProperties.bootstrapServers()));
      }
      if (admin == null) {
        admin = clients.admin(adminProperties());
      }
      current = admin;
    }
    describeCluster(current, "ping");
  }

  @Override
  public void publish(String topic, BrokerMessage message) {
    await(send(producer(), topic, message), topic);
  }

  @Override
  public void publishBatch(String topic, List<BrokerMessage> messages) {
    Producer<byte[], byte[]> current = producer();
    List<Future<RecordMetadata>> pending = new ArrayList<>(messages.size());
    for (BrokerMessage message : messages) {
      pending.add(send(current, topic, message));
    }
    current.flush();
    for (Future<RecordMetadata> future : pending) {
      await(future, topic);
    }
  }

  @Override
  public void consumeGroup(String groupId,
                           List<String> topics,
                           MessageCallback callback,
                           CancellationToken cancellation) {
    if (!isConnected()) {
      throw Problems.subscribeFailed("Kafka driver is not connected", Map.of("group", groupId), null);
    }
    Consumer<byte[], byte[]> consumer;
    try {
      consumer = clients.consumer(consumerProperties(groupId));
    } catch (KafkaException ex) {
      throw Problems.subscribeFailed("Failed to create Kafka consumer", errorDetails(Map.of("group", groupId), ex), ex);
    }
    try {
      consumer.subscribe(topics, new CommitOnRevoke(consumer));
    } catch (RuntimeException ex) {
      closeConsumer(consumer, groupId);
      throw Problems.subscribeFailed(
          "Failed to subscribe consumer group",
          errorDetails(Map.of("group", groupId, "topics", topics), ex),
          ex
      );
    }

    pendingCommits.clear();
    activeConsumer = consumer;
    CancellationToken.Registration wakeup = cancellation.onCancel(consumer::wakeup);
    log.info("kafka_group_joined group={} topics={}", groupId, topics);
    try {
      pollLoop(groupId, consumer, callback, cancellation);
    } finally {
      wakeup.remove();
      commitPending(consumer);
      activeConsumer = null;
      closeConsumer(consumer, groupId);
      log.info("kafka_group_left group={}", groupId);
    }
  }

  @Override
  public void ack(BrokerMessage message) {
    if (activeConsumer == null) {
      throw Problems.notConnected(
          "No active consumer group session",
          Map.of("topic", message.topic(), "partition", message.partition(), "offset", message.offset())
      );
    }
    stageCommit(message);
  }

  @Override
  public void nack(BrokerMessage message, boolean requeue) {
    if (requeue) {
      publish(message.topic(), message);
      return;
    }
    if (activeConsumer != null) {
      stageCommit(message);
    }
  }

  private void pollLoop(String groupId,
                        Consumer<byte[], byte[]> consumer,
                        MessageCallback callback,
                        CancellationToken cancellation) {
    while (!cancellation.isCancelled()) {
      ConsumerRecords<byte[], byte[]> records;
      try {
        records = consumer.poll(kafkaProperties.pollTimeout());
      } catch (WakeupException ex) {
        continue;
      } catch (AuthenticationException | AuthorizationException | InvalidTopicException ex) {
        throw Problems.subscribeFailed(
            "Kafka rejected the consumer group session",
            errorDetails(Map.of("group", groupId), ex),
            ex
        );
      } catch (KafkaException ex) {
        log.warn("kafka_poll_failed group={} error={} message={} backoffMs={}",
            groupId, ex.getClass().getSimpleName(), ex.getMessage(), kafkaProperties.reconnectBackoff().toMillis());
        cancellation.await(kafkaProperties.reconnectBackoff());
        continue;
      }

      for (TopicPartition partition : records.partitions()) {
        if (cancellation.isCancelled()) {
          break;
        }
        deliverPartition(groupId, consumer, partition, records.records(partition), callback, cancellation);
        commitPending(consumer);
      }
    }
  }

  private void deliverPartition(String groupId,
                                Consumer<byte[], byte[]> consumer,
                                TopicPartition partition,
                                List<ConsumerRecord<byte[], byte[]>> records,
                                MessageCallback callback,
                                CancellationToken cancellation) {
    for (ConsumerRecord<byte[], byte[]> record : records) {
      if (cancellation.isCancelled()) {
        return;
      }
      BrokerMessage message = toMessage(record);
      DispatchOutcome outcome;
      try {
        outcome = callback.onMessage(message);
      } catch (RuntimeException ex) {
        log.error("kafka_callback_failed group={} topic={} partition={} offset={} error={} message={}",
            groupId, record.topic(), record.partition(), record.offset(), ex.getClass().getSimpleName(), ex.getMessage());
        consumer.seek(partition, record.offset());
        cancellation.await(kafkaProperties.reconnectBackoff());
        return;
      }
      if (!outcome.isSettled()) {
        consumer.seek(partition, record.offset());
        return;
      }
      if (autoCommit) {
        stageCommit(message);
      }
    }
  }

  private void stageCommit(BrokerMessage message) {
    pendingCommits.merge(new TopicPartition(message.topic(), message.partition()), message.offset() + 1, Math::max);
  }

  private void commitPending(Consumer<byte[], byte[]> consumer) {
    commitPending(consumer, pendingCommits.keySet());
  }

  private void commitPending(Consumer<byte[], byte[]> consumer, Collection<TopicPartition> partitions) {
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    for (TopicPartition partition : List.copyOf(partitions)) {
      Long offset = pendingCommits.remove(partition);
      if (offset != null) {
        offsets.put(partition, new OffsetAndMetadata(offset));
      }
    }
    if (offsets.isEmpty()) {
      return;
    }
    try {
      commitSync(consumer, offsets);
    } catch (KafkaException ex) {
      // uncommitted offsets are redelivered to the group
      log.warn("kafka_commit_failed offsets={} error={} message={}", offsets, ex.getClass().getSimpleName(), ex.getMessage());
    }
  }

  private void commitSync(Consumer<byte[], byte[]> consumer, Map<TopicPartition, OffsetAndMetadata> offsets) {
    try {
      consumer.commitSync(offsets);
    } catch (WakeupException ex) {
      // the wakeup was meant for poll; it is cleared once thrown
      consumer.commitSync(offsets);
    }
  }

  private BrokerMessage toMessage(ConsumerRecord<byte[], byte[]> record) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (Header header : record.headers()) {
      byte[] value = header.value();
      headers.put(header.key(), value == null ? "" : new String(value, StandardCharsets.UTF_8));
    }
    return BrokerMessage.received(
        record.topic(),
        record.key(),
        record.value(),
        headers,
        record.partition(),
        record.offset(),
        Instant.ofEpochMilli(Math.max(0L, record.timestamp()))
    );
  }

  private ProducerRecord<byte[], byte[]> toRecord(String topic, BrokerMessage message) {
    ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, message.key(), message.body());
    message.headers().forEach((key, value) -> {
      byte[] headerValue = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
      record.headers().add(new RecordHeader(key, headerValue));
    });
    return record;
  }

  private Producer<byte[], byte[]> producer() {
    synchronized (lock) {
      if (!connected || producer == null) {
        throw Problems.notConnected("Kafka driver is not connected", Map.of("bootstrapServers", kafkaProperties.bootstrapServers()));
      }
      return producer;
    }
  }

  private Future<RecordMetadata> send(Producer<byte[], byte[]> current, String topic, BrokerMessage message) {
    try {
      return current.send(toRecord(topic, message));
    } catch (KafkaException ex) {
      throw translateSendFailure(topic, ex);
    }
  }

  private void await(Future<RecordMetadata> pending, String topic) {
    try {
      pending.get(kafkaProperties.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while publishing", Map.of("topic", topic), ex);
    } catch (TimeoutException ex) {
      throw Problems.brokerUnavailable(
          "Timed out waiting for Kafka publish acknowledgement",
          Map.of("topic", topic, "bootstrapServers", kafkaProperties.bootstrapServers()),
          ex
      );
    } catch (ExecutionException ex) {
      throw translateSendFailure(topic, ex.getCause());
    }
  }

  private ProblemException translateSendFailure(String topic, Throwable cause) {
    if (cause instanceof RecordTooLargeException) {
      return Problems.invalidArgument(
          "Kafka rejected message because it exceeds broker limits",
          Map.of("topic", topic)
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.brokerUnavailable("Kafka publish failed", errorDetails(Map.of("topic", topic), cause), cause);
    }
    return Problems.operationFailed("Unexpected error during publish", errorDetails(Map.of("topic", topic), cause), cause);
  }

  private void describeCluster(Admin client, String operation) {
    DescribeClusterOptions options = new DescribeClusterOptions()
        .timeoutMs(Math.toIntExact(kafkaProperties.adminTimeout().toMillis()));
    try {
      client.describeCluster(options).nodes().get(kafkaProperties.adminTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing " + operation, Map.of(), ex);
    } catch (TimeoutException ex) {
      throw Problems.brokerUnavailable(
          "Timed out contacting Kafka during " + operation,
          errorDetails(Map.of(), ex),
          ex
      );
    } catch (ExecutionException ex) {
      throw Problems.brokerUnavailable(
          "Kafka cluster check failed during " + operation,
          errorDetails(Map.of(), ex.getCause()),
          ex.getCause()
      );
    }
  }

  private void closeConsumer(Consumer<byte[], byte[]> consumer, String groupId) {
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("kafka_consumer_close_failed group={} error={} message={}", groupId, ex.getClass().getSimpleName(), ex.getMessage());
    }
  }

  private void closeQuietly() {
    if (producer != null) {
      try {
        producer.close(Duration.ZERO);
      } catch (KafkaException ex) {
        log.debug("kafka_producer_close_failed message={}", ex.getMessage());
      }
      producer = null;
    }
    if (admin != null) {
      try {
        admin.close(Duration.ZERO);
      } catch (KafkaException ex) {
        log.debug("kafka_admin_close_failed message={}", ex.getMessage());
      }
      admin = null;
    }
  }

  private Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-producer");
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return props;
  }

  private Properties consumerProperties(String groupId) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-" + groupId);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, kafkaProperties.autoOffsetReset());
    props.put(ConsumerConfig.RECONNECT_BACKOFF_MS_CONFIG, Math.toIntExact(kafkaProperties.reconnectBackoff().toMillis()));
    return props;
  }

  private Properties adminProperties() {
    Properties props = new Properties();
    int timeoutMs = Math.toIntExact(kafkaProperties.adminTimeout().toMillis());
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-admin");
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
    return props;
  }

  private Map<String, Object> errorDetails(Map<String, Object> base, Throwable cause) {
    Map<String, Object> merged = new HashMap<>(base);
    merged.put("bootstrapServers", kafkaProperties.bootstrapServers());
    if (cause != null) {
      merged.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        merged.put("message", cause.getMessage());
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  private final class CommitOnRevoke implements ConsumerRebalanceListener {

    private final Consumer<byte[], byte[]> consumer;

    private CommitOnRevoke(Consumer<byte[], byte[]> consumer) {
      this.consumer = consumer;
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      commitPending(consumer, partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("kafka_partitions_assigned partitions={}", partitions);
    }
  }
}
