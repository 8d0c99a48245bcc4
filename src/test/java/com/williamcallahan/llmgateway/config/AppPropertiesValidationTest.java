package com.williamcallahan.llmgateway.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of gateway, artifact and event settings.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNegativeRetryMax() {
        AppProperties appProperties = new AppProperties();
        appProperties.getGateway().setRetryMax(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveCaps() {
        AppProperties tokenCap = new AppProperties();
        tokenCap.getGateway().setTokensCap(0);
        AppProperties costCap = new AppProperties();
        costCap.getGateway().setCostCapUsd(-0.5);

        assertThrows(IllegalArgumentException.class, tokenCap::validateConfiguration);
        assertThrows(IllegalArgumentException.class, costCap::validateConfiguration);
    }

    @Test
    void rejectsChainEntryWithoutProvider() {
        AppProperties appProperties = new AppProperties();
        appProperties.getGateway().setProviderChain(List.of(new AppProperties.ChainEntry(" ", "m-1")));

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveEventBufferAndHeartbeat() {
        AppProperties buffer = new AppProperties();
        buffer.getEvents().setMaxBufferSize(0);
        AppProperties heartbeat = new AppProperties();
        heartbeat.getEvents().setHeartbeatSeconds(0);

        assertThrows(IllegalArgumentException.class, buffer::validateConfiguration);
        assertThrows(IllegalArgumentException.class, heartbeat::validateConfiguration);
    }

    @Test
    void rejectsBlankArtifactRoot() {
        AppProperties appProperties = new AppProperties();
        appProperties.getArtifacts().setRootDir("");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
