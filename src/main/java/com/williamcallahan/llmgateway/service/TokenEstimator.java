package com.williamcallahan.llmgateway.service;

/**
 * Approximates token counts for providers that do not report usage.
 *
 * <p>Budget caps act on these estimates, so a more accurate tokenizer can be swapped in as a
 * bean without touching the gateway.</p>
 */
@FunctionalInterface
public interface TokenEstimator {

    /**
     * Estimates tokens in a text fragment.
     *
     * @param text prompt or streamed delta (may be null)
     * @return estimated token count, zero for blank input
     */
    int estimate(String text);
}
