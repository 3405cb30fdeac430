package com.github.adamzv.brokerdispatch.support;

import com.github.adamzv.brokerdispatch.application.BrokerAdapter;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the broker adapter with the application context and stops it on shutdown. Startup
 * errors propagate and fail the context refresh.
 */
public class AdapterLifecycle implements SmartLifecycle {

  private final BrokerAdapter brokerAdapter;

  public AdapterLifecycle(BrokerAdapter brokerAdapter) {
    this.brokerAdapter = brokerAdapter;
  }

  @Override
  public void start() {
    brokerAdapter.start();
  }

  @Override
  public void stop() {
    brokerAdapter.stop();
  }

  @Override
  public boolean isRunning() {
    return brokerAdapter.isRunning();
  }

  // after web servers and other consumers of published messages are up
  @Override
  public int getPhase() {
    return DEFAULT_PHASE - 1024;
  }
}
