package com.github.adamzv.brokerdispatch.ports;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.CancellationToken;
import com.github.adamzv.brokerdispatch.domain.ProblemException;
import java.util.List;

/**
 * Contract a broker technology implements to be driven by the dispatch pipeline.
 *
 * <p>All failures are reported as {@link ProblemException}.
 */
public interface BrokerDriver {

  /**
   * Short identifier of the broker technology, e.g. {@code "kafka"}.
   */
  String name();

  /**
   * Opens connections. Idempotent. A failure is fatal to adapter startup and is not retried here.
   */
  void connect() throws ProblemException;

  /**
   * Releases every resource the driver holds. Idempotent, and safe to call without a prior
   * successful {@link #connect()}.
   */
  void disconnect() throws ProblemException;

  boolean isConnected();

  /**
   * Hands {@code message} to the broker for {@code topic}. Returns once the driver accepted it.
   */
  void publish(String topic, BrokerMessage message) throws ProblemException;

  void publishBatch(String topic, List<BrokerMessage> messages) throws ProblemException;

  /**
   * Joins consumer group {@code groupId} on {@code topics} and blocks the calling thread,
   * invoking {@code callback} once per inbound message, in delivery order, on that same thread,
   * until {@code cancellation} fires. Transient receive failures are retried internally.
   * A message whose callback returns an unsettled outcome or throws is not committed.
   *
   * @throws ProblemException if the subscription cannot be established
   */
  void consumeGroup(String groupId,
                    List<String> topics,
                    MessageCallback callback,
                    CancellationToken cancellation) throws ProblemException;

  /**
   * Commits consumption progress up to and including {@code message}.
   */
  void ack(BrokerMessage message) throws ProblemException;

  /**
   * Signals failed processing. Brokers without native negative acknowledgment implement
   * {@code requeue=true} by republishing to the message's own topic; {@code requeue=false}
   * lets the message go.
   */
  void nack(BrokerMessage message, boolean requeue) throws ProblemException;

  /**
   * Lightweight connectivity check.
   */
  void ping() throws ProblemException;
}
