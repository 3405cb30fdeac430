package com.github.adamzv.brokerdispatch.adapters.kafka;

import java.util.Properties;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

/**
 * Creates the Kafka clients used by {@link KafkaBrokerDriver}. Tests override it to hand in
 * {@code MockProducer} / {@code MockConsumer}.
 */
public class KafkaClients {

  public Producer<byte[], byte[]> producer(Properties props) {
    return new KafkaProducer<>(props);
  }

  public Consumer<byte[], byte[]> consumer(Properties props) {
    return new KafkaConsumer<>(props);
  }

  public Admin admin(Properties props) {
    return AdminClient.create(props);
  }
}
