package com.williamcallahan.llmgateway.domain.llm;

import java.util.Objects;

/**
 * Event read from a provider stream.
 *
 * <p>Any number of {@link Token} events may arrive; exactly one {@link Complete} or
 * {@link Error} terminates the stream.</p>
 */
public sealed interface ProviderEvent permits ProviderEvent.Token, ProviderEvent.Complete, ProviderEvent.Error {

    /** Creates a token event without usage. */
    static Token token(String delta) {
        return new Token(delta, UsageReport.none());
    }

    /** Creates a token event carrying reported usage. */
    static Token token(String delta, UsageReport usage) {
        return new Token(delta, usage);
    }

    /** Creates a terminal event with the given finish reason and no usage. */
    static Complete complete(String finishReason) {
        return new Complete(finishReason, UsageReport.none());
    }

    static Complete complete(String finishReason, UsageReport usage) {
        return new Complete(finishReason, usage);
    }

    /** Creates a terminal failure event. */
    static Error error(String message, boolean retryable, String category, boolean violation) {
        return new Error(message, retryable, category, violation);
    }

    /**
     * Text delta.
     *
     * @param delta streamed text (never null)
     * @param usage usage counters reported with this delta
     */
    record Token(String delta, UsageReport usage) implements ProviderEvent {
        public Token {
            delta = delta == null ? "" : delta;
            usage = usage == null ? UsageReport.none() : usage;
        }
    }

    /**
     * Terminal success.
     *
     * @param finishReason provider finish reason, or null to default to {@code stop}
     * @param usage final usage counters
     */
    record Complete(String finishReason, UsageReport usage) implements ProviderEvent {
        public Complete {
            usage = usage == null ? UsageReport.none() : usage;
        }
    }

    /**
     * Terminal failure reported in-band by the provider.
     *
     * @param message human-readable failure
     * @param retryable whether the same provider may succeed on re-attempt
     * @param category failure category
     * @param violation whether a hard policy boundary was hit
     */
    record Error(String message, boolean retryable, String category, boolean violation) implements ProviderEvent {
        public Error {
            message = Objects.requireNonNullElse(message, "provider_error");
            category = category == null || category.isBlank() ? "provider_error" : category;
        }
    }
}
