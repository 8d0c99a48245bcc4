package com.williamcallahan.llmgateway.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Verifies live delivery, bounded buffering and subscriber lifecycle of the event fan-out.
 */
class LlmEventFanoutTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final GatewayTelemetry telemetry = new MicrometerGatewayTelemetry(meterRegistry, ObservationRegistry.NOOP);

    @Test
    void everySubscriberReceivesEventsPublishedAfterSubscribing() {
        LlmEventFanout fanout = new LlmEventFanout(16, telemetry);
        fanout.publish("before");
        Flux<String> first = fanout.subscribe();
        Flux<String> second = fanout.subscribe();

        fanout.publish("one");
        fanout.publish("two");
        fanout.close();

        StepVerifier.create(first).expectNext("one", "two").verifyComplete();
        StepVerifier.create(second).expectNext("one", "two").verifyComplete();
    }

    @Test
    void slowSubscriberIsDroppedWithoutAffectingOthers() {
        LlmEventFanout fanout = new LlmEventFanout(2, telemetry);
        Flux<String> stalled = fanout.subscribe();
        List<String> received = new CopyOnWriteArrayList<>();
        Disposable live = fanout.subscribe().subscribe(received::add);

        for (int index = 0; index < 10; index++) {
            fanout.publish("event-" + index);
        }

        assertEquals(10, received.size());
        assertEquals(1, fanout.subscriberCount());
        StepVerifier.create(stalled).expectNextCount(2).verifyComplete();
        live.dispose();
    }

    @Test
    void bufferLimitIsExactForSmallSizes() {
        LlmEventFanout fanout = new LlmEventFanout(3, telemetry);
        Flux<String> stalled = fanout.subscribe();

        for (int index = 0; index < 5; index++) {
            fanout.publish("event-" + index);
        }

        assertEquals(0, fanout.subscriberCount());
        StepVerifier.create(stalled).expectNext("event-0", "event-1", "event-2").verifyComplete();
    }

    @Test
    void cancellingUnsubscribes() {
        LlmEventFanout fanout = new LlmEventFanout(8, telemetry);
        Disposable subscription = fanout.subscribe().subscribe();
        assertEquals(1, fanout.subscriberCount());
        assertEquals(1.0, meterRegistry.get("llm.sse.consumers").gauge().value());

        subscription.dispose();

        assertEquals(0, fanout.subscriberCount());
        assertEquals(0.0, meterRegistry.get("llm.sse.consumers").gauge().value());
    }

    @Test
    void closedFanoutRefusesSubscribersAndIgnoresEvents() {
        LlmEventFanout fanout = new LlmEventFanout(8, telemetry);
        fanout.close();
        fanout.publish("late");

        assertTrue(fanout.isClosed());
        StepVerifier.create(fanout.subscribe()).verifyComplete();
    }
}
