package com.williamcallahan.llmgateway.service;

import java.util.Optional;

/**
 * Tracks completion-token and USD cost totals for one attempt against the configured caps.
 */
public final class BudgetEnforcer {

    /**
     * Cap that ended a stream early.
     */
    public enum BudgetBreach {
        TOKEN_CAP("token_cap"),
        COST_CAP("cost_cap");

        private final String reason;

        BudgetBreach(String reason) {
            this.reason = reason;
        }

        /** Returns the wire value used in {@code budget_exhausted} events. */
        public String reason() {
            return reason;
        }
    }

    private final Integer tokenCap;
    private final Double costCapUsd;

    /**
     * Creates an enforcer; a null cap is not enforced.
     *
     * @param tokenCap completion-token cap
     * @param costCapUsd cost cap in USD
     */
    public BudgetEnforcer(Integer tokenCap, Double costCapUsd) {
        this.tokenCap = tokenCap;
        this.costCapUsd = costCapUsd;
    }

    /**
     * Builds an enforcer whose token cap is the smaller of the global cap and the caller's
     * per-call max tokens.
     *
     * @param globalTokenCap configured cap, may be null
     * @param callMaxTokens caller's max tokens, may be null
     * @param costCapUsd configured cost cap, may be null
     * @return enforcer for one attempt
     */
    public static BudgetEnforcer forCall(Integer globalTokenCap, Integer callMaxTokens, Double costCapUsd) {
        Integer effectiveTokenCap = globalTokenCap;
        if (callMaxTokens != null) {
            effectiveTokenCap = globalTokenCap == null ? callMaxTokens : Math.min(globalTokenCap, callMaxTokens);
        }
        return new BudgetEnforcer(effectiveTokenCap, costCapUsd);
    }

    /**
     * Checks running totals against the caps. The token cap is checked first.
     *
     * @param completionTokens running completion-token count
     * @param costUsd running cost
     * @return the breached cap, if any
     */
    public Optional<BudgetBreach> check(int completionTokens, double costUsd) {
        if (tokenCap != null && completionTokens >= tokenCap) {
            return Optional.of(BudgetBreach.TOKEN_CAP);
        }
        if (costCapUsd != null && costUsd >= costCapUsd) {
            return Optional.of(BudgetBreach.COST_CAP);
        }
        return Optional.empty();
    }

    public Integer tokenCap() {
        return tokenCap;
    }

    public Double costCapUsd() {
        return costCapUsd;
    }
}
