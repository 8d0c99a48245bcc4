package com.williamcallahan.llmgateway.service;

/**
 * Sink for gateway lifecycle events. Called synchronously from the gateway flow, in order.
 */
@FunctionalInterface
public interface LlmEventEmitter {

    /**
     * Delivers one event.
     *
     * @param event event to deliver
     */
    void emit(LlmEvent event);
}
