package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.config.AppProperties;

/**
 * Retry and budget settings applied to every call.
 *
 * @param retryMax retries allowed per chain entry after the first attempt
 * @param backoff delay between retries
 * @param tokensCap global completion-token cap, or null
 * @param costCapUsd cost cap in USD, or null
 */
public record GatewaySettings(int retryMax, RetryBackoff backoff, Integer tokensCap, Double costCapUsd) {
    public GatewaySettings {
        if (retryMax < 0) {
            throw new IllegalArgumentException("retryMax must not be negative");
        }
        if (backoff == null) {
            backoff = new RetryBackoff(0, 0);
        }
    }

    /**
     * Reads settings from the bound {@code app.gateway} properties.
     *
     * @param gateway gateway properties
     * @return settings snapshot
     */
    public static GatewaySettings from(AppProperties.Gateway gateway) {
        return new GatewaySettings(
                gateway.getRetryMax(),
                new RetryBackoff(gateway.getRetryBackoffBaseMs(), gateway.getRetryBackoffJitterMs()),
                gateway.getTokensCap(),
                gateway.getCostCapUsd());
    }
}
