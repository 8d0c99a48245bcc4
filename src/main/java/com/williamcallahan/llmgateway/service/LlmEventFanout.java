package com.williamcallahan.llmgateway.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fan-out of serialized events for one run to any number of live subscribers.
 *
 * <p>Each subscriber gets its own bounded buffer. A subscriber whose buffer is full is dropped
 * rather than allowed to stall the gateway. There is no replay: a subscriber sees only events
 * published after it subscribed.</p>
 */
public final class LlmEventFanout {
    private static final Logger log = LoggerFactory.getLogger(LlmEventFanout.class);

    private final int maxBufferSize;
    private final GatewayTelemetry telemetry;
    private final Set<Sinks.Many<String>> subscribers = new LinkedHashSet<>();
    private boolean closed;

    /**
     * Creates an open fan-out.
     *
     * @param maxBufferSize per-subscriber buffered event limit
     * @param telemetry receives subscriber count changes
     */
    public LlmEventFanout(int maxBufferSize, GatewayTelemetry telemetry) {
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("maxBufferSize must be positive");
        }
        this.maxBufferSize = maxBufferSize;
        this.telemetry = telemetry;
    }

    /**
     * Registers a subscriber. Cancelling the returned flux unsubscribes it.
     *
     * @return serialized events published from now on; completes immediately when closed
     */
    public Flux<String> subscribe() {
        // Exact capacity; Reactor's queue factory rounds small sizes up
        Sinks.Many<String> subscriberSink =
                Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(maxBufferSize));
        synchronized (this) {
            if (closed) {
                return Flux.empty();
            }
            subscribers.add(subscriberSink);
        }
        telemetry.recordEventSubscribers(1);
        return subscriberSink.asFlux().doOnCancel(() -> unsubscribe(subscriberSink));
    }

    /**
     * Publishes to every active subscriber; subscribers that cannot accept the event are dropped.
     *
     * @param payload serialized event
     */
    public void publish(String payload) {
        List<Sinks.Many<String>> stale = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return;
            }
            for (Sinks.Many<String> subscriberSink : subscribers) {
                Sinks.EmitResult emitResult = subscriberSink.tryEmitNext(payload);
                if (emitResult.isFailure()) {
                    stale.add(subscriberSink);
                }
            }
            stale.forEach(subscribers::remove);
        }
        for (Sinks.Many<String> staleSink : stale) {
            log.warn("[LLM] Dropping event subscriber that could not keep up");
            staleSink.tryEmitComplete();
            telemetry.recordEventSubscribers(-1);
        }
    }

    /**
     * Completes every subscriber and refuses new ones.
     */
    public void close() {
        List<Sinks.Many<String>> remaining;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            remaining = new ArrayList<>(subscribers);
            subscribers.clear();
        }
        for (Sinks.Many<String> subscriberSink : remaining) {
            subscriberSink.tryEmitComplete();
            telemetry.recordEventSubscribers(-1);
        }
    }

    /** Returns the number of active subscribers. */
    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void unsubscribe(Sinks.Many<String> subscriberSink) {
        boolean removed;
        synchronized (this) {
            removed = subscribers.remove(subscriberSink);
        }
        if (removed) {
            telemetry.recordEventSubscribers(-1);
        }
    }
}
