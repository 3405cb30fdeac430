package com.github.adamzv.brokerdispatch.ports;

import com.github.adamzv.brokerdispatch.domain.BrokerMessage;

/**
 * Application code bound to a topic. Returning normally means success; any exception means
 * failure and sends the message down the retry path.
 */
@FunctionalInterface
public interface MessageHandler {

  void handle(BrokerMessage message) throws Exception;
}
