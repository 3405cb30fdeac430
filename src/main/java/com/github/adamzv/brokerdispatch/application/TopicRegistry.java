package com.github.adamzv.brokerdispatch.application;

import com.github.adamzv.brokerdispatch.domain.DispatchConfig;
import com.github.adamzv.brokerdispatch.domain.HandlerBinding;
import com.github.adamzv.brokerdispatch.domain.Problems;
import com.github.adamzv.brokerdispatch.domain.TopicPolicy;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Topic to handler lookup built once from the registered bindings. Read-only afterwards, so
 * the dispatch thread uses it without locking.
 *
 * <p>The topic list is sorted, which makes the result independent of registration order.
 */
public final class TopicRegistry {

  private final List<String> topics;
  private final Map<String, Route> routes;

  private TopicRegistry(TreeMap<String, Route> routes) {
    this.topics = List.copyOf(routes.keySet());
    this.routes = Map.copyOf(routes);
  }

  public static TopicRegistry from(Collection<HandlerBinding> bindings, DispatchConfig config) {
    Objects.requireNonNull(config, "config");
    TreeMap<String, Route> routes = new TreeMap<>();
    if (bindings == null) {
      return new TopicRegistry(routes);
    }
    for (HandlerBinding binding : bindings) {
      if (binding == null) {
        continue;
      }
      Route existing = routes.get(binding.topic());
      if (existing != null) {
        if (!sameRegistration(existing.binding(), binding)) {
          throw Problems.invalidArgument(
              "Topic is bound to conflicting handlers",
              Map.of(
                  "topic", binding.topic(),
                  "handler", existing.binding().handlerName(),
                  "conflictingHandler", binding.handlerName()
              )
          );
        }
        continue;
      }
      routes.put(binding.topic(), new Route(binding, resolvePolicy(binding, config)));
    }
    return new TopicRegistry(routes);
  }

  static TopicPolicy resolvePolicy(HandlerBinding binding, DispatchConfig config) {
    int maxRetries = binding.maxRetries() != null ? binding.maxRetries() : config.maxRetries();
    Duration backoff = binding.retryBackoffUnit() != null ? binding.retryBackoffUnit() : config.retryBackoffUnit();
    String dlqTopic = binding.dlqTopic();
    if (dlqTopic == null && config.dlqEnabled()) {
      dlqTopic = binding.topic() + config.dlqSuffix();
    }
    return new TopicPolicy(maxRetries, backoff, dlqTopic);
  }

  private static boolean sameRegistration(HandlerBinding left, HandlerBinding right) {
    return left.handlerName().equals(right.handlerName())
        && Objects.equals(left.maxRetries(), right.maxRetries())
        && Objects.equals(left.dlqTopic(), right.dlqTopic())
        && Objects.equals(left.retryBackoffUnit(), right.retryBackoffUnit());
  }

  public List<String> topics() {
    return topics;
  }

  public boolean isEmpty() {
    return topics.isEmpty();
  }

  public Optional<Route> route(String topic) {
    return Optional.ofNullable(routes.get(topic));
  }

  public record Route(HandlerBinding binding, TopicPolicy policy) {}
}
