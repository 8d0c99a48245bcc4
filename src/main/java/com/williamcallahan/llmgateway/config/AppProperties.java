package com.williamcallahan.llmgateway.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Gateway gateway = new Gateway();
    private Artifacts artifacts = new Artifacts();
    private Events events = new Events();

    public Gateway getGateway() {
        return gateway;
    }

    public void setGateway(Gateway gateway) {
        this.gateway = gateway;
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(Artifacts artifacts) {
        this.artifacts = artifacts;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    /**
     * Rejects settings the gateway cannot run with.
     *
     * @throws IllegalArgumentException when a value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (gateway.retryMax < 0) {
            throw new IllegalArgumentException("app.gateway.retry-max must be >= 0");
        }
        if (gateway.tokensCap != null && gateway.tokensCap <= 0) {
            throw new IllegalArgumentException("app.gateway.tokens-cap must be > 0 when set");
        }
        if (gateway.costCapUsd != null && gateway.costCapUsd <= 0) {
            throw new IllegalArgumentException("app.gateway.cost-cap-usd must be > 0 when set");
        }
        if (gateway.activeTimeLimitSeconds != null && gateway.activeTimeLimitSeconds <= 0) {
            throw new IllegalArgumentException("app.gateway.active-time-limit-seconds must be > 0 when set");
        }
        for (int index = 0; index < gateway.providerChain.size(); index++) {
            ChainEntry entry = gateway.providerChain.get(index);
            if (entry == null || entry.getProvider() == null || entry.getProvider().isBlank()) {
                throw new IllegalArgumentException("app.gateway.provider-chain[" + index + "].provider is required");
            }
        }
        if (artifacts.rootDir == null || artifacts.rootDir.isBlank()) {
            throw new IllegalArgumentException("app.artifacts.root-dir is required");
        }
        if (events.maxBufferSize <= 0) {
            throw new IllegalArgumentException("app.events.max-buffer-size must be > 0");
        }
        if (events.heartbeatSeconds <= 0) {
            throw new IllegalArgumentException("app.events.heartbeat-seconds must be > 0");
        }
    }

    public static class Gateway {
        private int retryMax = 2;
        private long retryBackoffBaseMs = 250;
        private long retryBackoffJitterMs = 100;
        private Integer tokensCap;
        private Double costCapUsd;
        private Long activeTimeLimitSeconds;
        private String defaultProvider;
        private String defaultModel;
        private List<ChainEntry> providerChain = new ArrayList<>();

        public int getRetryMax() { return retryMax; }
        public void setRetryMax(int retryMax) { this.retryMax = retryMax; }

        public long getRetryBackoffBaseMs() { return retryBackoffBaseMs; }
        public void setRetryBackoffBaseMs(long retryBackoffBaseMs) { this.retryBackoffBaseMs = retryBackoffBaseMs; }

        public long getRetryBackoffJitterMs() { return retryBackoffJitterMs; }
        public void setRetryBackoffJitterMs(long retryBackoffJitterMs) { this.retryBackoffJitterMs = retryBackoffJitterMs; }

        public Integer getTokensCap() { return tokensCap; }
        public void setTokensCap(Integer tokensCap) { this.tokensCap = tokensCap; }

        public Double getCostCapUsd() { return costCapUsd; }
        public void setCostCapUsd(Double costCapUsd) { this.costCapUsd = costCapUsd; }

        public Long getActiveTimeLimitSeconds() { return activeTimeLimitSeconds; }
        public void setActiveTimeLimitSeconds(Long activeTimeLimitSeconds) {
            this.activeTimeLimitSeconds = activeTimeLimitSeconds;
        }

        public String getDefaultProvider() { return defaultProvider; }
        public void setDefaultProvider(String defaultProvider) { this.defaultProvider = defaultProvider; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public List<ChainEntry> getProviderChain() { return providerChain; }
        public void setProviderChain(List<ChainEntry> providerChain) {
            this.providerChain = providerChain == null ? new ArrayList<>() : providerChain;
        }
    }

    /**
     * One {@code provider}/{@code model} pair in the configured fallback chain.
     */
    public static class ChainEntry {
        private String provider;
        private String model;

        public ChainEntry() {
        }

        public ChainEntry(String provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class Artifacts {
        private String rootDir = "./data";

        public String getRootDir() { return rootDir; }
        public void setRootDir(String rootDir) { this.rootDir = rootDir; }
    }

    public static class Events {
        private int maxBufferSize = 256;
        private int heartbeatSeconds = 20;

        public int getMaxBufferSize() { return maxBufferSize; }
        public void setMaxBufferSize(int maxBufferSize) { this.maxBufferSize = maxBufferSize; }

        public int getHeartbeatSeconds() { return heartbeatSeconds; }
        public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    }
}
