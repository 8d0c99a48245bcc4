package com.williamcallahan.llmgateway.domain.llm;

import java.util.Objects;

/**
 * Successful outcome of a gateway call.
 *
 * @param provider provider that produced the result
 * @param model model that produced the result
 * @param tokensPrompt prompt tokens (reported or estimated)
 * @param tokensCompletion completion tokens (reported or estimated)
 * @param finishReason {@code stop}, {@code stop_on_budget}, {@code canceled} or a provider reason
 * @param costUsd reported cost, when known
 * @param error {@code budget_exhausted} when the stream was cut by a budget cap, otherwise null
 * @param text concatenated token deltas received before the stream ended
 */
public record CallSummary(
        String provider,
        String model,
        int tokensPrompt,
        int tokensCompletion,
        String finishReason,
        Double costUsd,
        String error,
        String text) {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_STOP_ON_BUDGET = "stop_on_budget";
    public static final String FINISH_CANCELED = "canceled";
    public static final String ERROR_BUDGET_EXHAUSTED = "budget_exhausted";

    public CallSummary {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(finishReason, "finishReason");
        text = text == null ? "" : text;
    }

    /** Returns whether the stream was cut short by a token or cost cap. */
    public boolean budgetExhausted() {
        return FINISH_STOP_ON_BUDGET.equals(finishReason);
    }
}
