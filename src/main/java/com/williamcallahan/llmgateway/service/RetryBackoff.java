package com.williamcallahan.llmgateway.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive uniform jitter: {@code base * 2^attemptIndex + U(0, jitter)}.
 */
public final class RetryBackoff {

    /** Caps the exponent so very long retry budgets cannot overflow the delay. */
    private static final int MAX_EXPONENT = 20;

    private final long baseMillis;
    private final long jitterMillis;
    private final DoubleSupplier unitRandom;

    /**
     * Creates a backoff using thread-local randomness.
     *
     * @param baseMillis base delay, floored at zero
     * @param jitterMillis upper bound of additive jitter, floored at zero
     */
    public RetryBackoff(long baseMillis, long jitterMillis) {
        this(baseMillis, jitterMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a backoff with an explicit random source.
     *
     * @param unitRandom supplier of values in {@code [0, 1)}
     */
    public RetryBackoff(long baseMillis, long jitterMillis, DoubleSupplier unitRandom) {
        this.baseMillis = Math.max(0L, baseMillis);
        this.jitterMillis = Math.max(0L, jitterMillis);
        this.unitRandom = unitRandom;
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attemptIndex 0-based index of the retry (first retry is 0)
     * @return delay to wait
     */
    public Duration delayFor(int attemptIndex) {
        int exponent = Math.min(Math.max(0, attemptIndex), MAX_EXPONENT);
        long exponentialMillis = saturatedMultiply(baseMillis, 1L << exponent);
        long jitter = jitterMillis == 0 ? 0 : (long) (unitRandom.getAsDouble() * jitterMillis);
        return Duration.ofMillis(saturatedAdd(exponentialMillis, jitter));
    }

    private static long saturatedMultiply(long left, long right) {
        try {
            return Math.multiplyExact(left, right);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedAdd(long left, long right) {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
