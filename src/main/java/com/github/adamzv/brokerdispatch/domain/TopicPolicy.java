package com.github.adamzv.brokerdispatch.domain;

import java.time.Duration;

/**
 * Effective failure policy for one topic, resolved once when the registry is built.
 *
 * @param dlqTopic dead-letter destination, or {@code null} when exhausted messages are dropped
 */
public record TopicPolicy(
    int maxRetries,
    Duration retryBackoffUnit,
    String dlqTopic
) {
}
