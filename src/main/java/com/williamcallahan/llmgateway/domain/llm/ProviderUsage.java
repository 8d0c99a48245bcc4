package com.williamcallahan.llmgateway.domain.llm;

/**
 * Mutable usage snapshot attached to an open provider stream.
 *
 * <p>Adapters may seed it with prompt-token counts known before the first event; the gateway
 * writes running totals back as events arrive. Fields are volatile because adapters commonly
 * update them from their own I/O threads.</p>
 */
public final class ProviderUsage {
    private volatile Integer promptTokens;
    private volatile Integer completionTokens;
    private volatile Double costUsd;

    public ProviderUsage() {
    }

    public ProviderUsage(Integer promptTokens, Integer completionTokens, Double costUsd) {
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.costUsd = costUsd;
    }

    /** Returns a snapshot that only reports a prompt-token count. */
    public static ProviderUsage ofPromptTokens(int promptTokens) {
        return new ProviderUsage(promptTokens, null, null);
    }

    public Integer promptTokens() {
        return promptTokens;
    }

    public Integer completionTokens() {
        return completionTokens;
    }

    public Double costUsd() {
        return costUsd;
    }

    public void setPromptTokens(Integer promptTokens) {
        this.promptTokens = promptTokens;
    }

    public void setCompletionTokens(Integer completionTokens) {
        this.completionTokens = completionTokens;
    }

    public void setCostUsd(Double costUsd) {
        this.costUsd = costUsd;
    }

    @Override
    public String toString() {
        return "ProviderUsage{promptTokens=" + promptTokens
                + ", completionTokens=" + completionTokens
                + ", costUsd=" + costUsd + '}';
    }
}
