package com.github.adamzv.brokerdispatch.application;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public class DispatchMetrics {

  static final String MESSAGES = "broker_dispatch_messages_total";
  static final String FAILURES = "broker_dispatch_failures_total";
  static final String HANDLER_DURATION = "broker_dispatch_handler_duration_seconds";

  private final MeterRegistry meterRegistry;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public Timer.Sample startHandler() {
    return Timer.start(meterRegistry);
  }

  public void handlerFinished(String topic, Timer.Sample sample, boolean success) {
    sample.stop(meterRegistry.timer(HANDLER_DURATION, "topic", topic, "result", success ? "success" : "failure"));
  }

  public void outcome(String topic, String outcome) {
    meterRegistry.counter(MESSAGES, "topic", topic, "outcome", outcome).increment();
  }

  public void failure(String topic, String code) {
    meterRegistry.counter(FAILURES, "topic", topic, "code", code == null ? "UNKNOWN" : code).increment();
  }
}
