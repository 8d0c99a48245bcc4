package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.ProviderEvent;
import com.williamcallahan.llmgateway.domain.llm.ProviderUsage;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Open handle on a provider's event sequence.
 *
 * <p>The sequence is pull-based, forward-only and single-pass. {@link #cancel()} is idempotent
 * and never throws: a failing cancel action is logged so it cannot mask the reason the stream
 * was stopped. {@link #close()} releases the upstream once the consumer is done, without
 * signalling cancellation to the provider.</p>
 */
public final class ProviderStream {
    private static final Logger log = LoggerFactory.getLogger(ProviderStream.class);

    /** Demand requested from a Flux-backed provider ahead of the consumer. */
    private static final int FLUX_PREFETCH = 32;

    private final Iterator<ProviderEvent> events;
    private final StreamCancellation cancelAction;
    private final Runnable release;
    private final ProviderUsage usage;
    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);

    private ProviderStream(
            Iterator<ProviderEvent> events, StreamCancellation cancelAction, Runnable release, ProviderUsage usage) {
        this.events = Objects.requireNonNull(events, "events");
        this.cancelAction = cancelAction;
        this.release = release;
        this.usage = usage == null ? new ProviderUsage() : usage;
    }

    /**
     * Wraps a blocking iterator of events.
     *
     * @param events event source, consumed at most once
     * @param cancelAction optional provider cancel action
     * @param usage optional initial usage snapshot
     * @return open stream
     */
    public static ProviderStream of(Iterator<ProviderEvent> events, StreamCancellation cancelAction, ProviderUsage usage) {
        return new ProviderStream(events, cancelAction, null, usage);
    }

    /** Wraps a fixed list of events with no cancel action. */
    public static ProviderStream of(List<? extends ProviderEvent> events) {
        return of(List.<ProviderEvent>copyOf(events).iterator(), null, null);
    }

    /**
     * Adapts a reactive provider into a pull-based stream. Cancelling the stream cancels the
     * upstream subscription before running {@code cancelAction}.
     *
     * @param events provider events
     * @param cancelAction optional provider cancel action
     * @param usage optional initial usage snapshot
     * @return open stream; callers must not read it from a non-blocking Reactor thread
     */
    public static ProviderStream fromFlux(Flux<ProviderEvent> events, StreamCancellation cancelAction, ProviderUsage usage) {
        Stream<ProviderEvent> blockingEvents = events.toStream(FLUX_PREFETCH);
        return new ProviderStream(blockingEvents.iterator(), cancelAction, blockingEvents::close, usage);
    }

    /**
     * Reads the next event.
     *
     * @return next event, or empty when the provider closed the sequence or the stream was canceled
     */
    public Optional<ProviderEvent> next() {
        if (canceled.get() || released.get() || !events.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(events.next());
    }

    /** Returns the mutable usage snapshot. */
    public ProviderUsage usage() {
        return usage;
    }

    /** Returns whether {@link #cancel()} has been called. */
    public boolean isCanceled() {
        return canceled.get();
    }

    /**
     * Stops the provider. Safe to call more than once and from any thread.
     */
    public void cancel() {
        if (!canceled.compareAndSet(false, true)) {
            return;
        }
        releaseUpstream();
        if (cancelAction == null) {
            return;
        }
        try {
            cancelAction.cancel();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.warn("[LLM] Provider cancel interrupted");
        } catch (Exception cancelFailure) {
            log.warn("[LLM] Provider cancel action failed: {}", cancelFailure.toString());
        }
    }

    /**
     * Releases the upstream subscription after the consumer has finished reading. The provider's
     * cancel action is not run. Safe to call more than once and after {@link #cancel()}.
     */
    public void close() {
        releaseUpstream();
    }

    private void releaseUpstream() {
        if (release == null || !released.compareAndSet(false, true)) {
            return;
        }
        try {
            release.run();
        } catch (RuntimeException releaseFailure) {
            log.warn("[LLM] Releasing provider subscription failed: {}", releaseFailure.toString());
        }
    }
}
