package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.domain.llm.CallSummary;
import java.util.Objects;

/**
 * Result of one provider attempt. The gateway loop branches on the variant instead of relying
 * on exceptions to move between attempts and chain entries.
 */
sealed interface AttemptOutcome
        permits AttemptOutcome.Success, AttemptOutcome.RetryableFailure, AttemptOutcome.TerminalFailure {

    /** 1-based attempt number against the current chain entry. */
    int attempt();

    /**
     * Classifies a failure: retryable non-violations may be re-attempted, everything else is
     * terminal for the chain entry.
     */
    static AttemptOutcome failure(LlmProviderException failure, int attempt) {
        if (failure.isRetryable() && !failure.isViolation()) {
            return new RetryableFailure(failure, attempt);
        }
        return new TerminalFailure(failure, attempt);
    }

    /** Attempt produced a summary; this includes budget aborts and cancellations. */
    record Success(CallSummary summary, int attempt) implements AttemptOutcome {
        public Success {
            Objects.requireNonNull(summary, "summary");
        }
    }

    /** Transient failure; the same provider may be tried again. */
    record RetryableFailure(LlmProviderException failure, int attempt) implements AttemptOutcome {
        public RetryableFailure {
            Objects.requireNonNull(failure, "failure");
        }
    }

    /** Failure that ends work on the current chain entry. */
    record TerminalFailure(LlmProviderException failure, int attempt) implements AttemptOutcome {
        public TerminalFailure {
            Objects.requireNonNull(failure, "failure");
        }
    }
}
