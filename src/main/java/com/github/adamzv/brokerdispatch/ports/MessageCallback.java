package com.github.adamzv.brokerdispatch.ports;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;
import com.github.adamzv.brokerdispatch.domain.DispatchOutcome;

@FunctionalInterface
public interface MessageCallback {

  DispatchOutcome onMessage(BrokerMessage message);
}
