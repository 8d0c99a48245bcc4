package com.williamcallahan.llmgateway.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag, polled by the gateway once per streamed event.
 */
public final class CancellationToken {
    private final AtomicBoolean canceled = new AtomicBoolean(false);

    /** Returns a fresh, unset token. */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /** Requests cancellation. Idempotent. */
    public void cancel() {
        canceled.set(true);
    }

    public boolean isCanceled() {
        return canceled.get();
    }
}
