package com.williamcallahan.llmgateway.config;

import com.williamcallahan.llmgateway.service.ArtifactStore;
import com.williamcallahan.llmgateway.service.ConfiguredProviderChainResolver;
import com.williamcallahan.llmgateway.service.ContentHasher;
import com.williamcallahan.llmgateway.service.FileSystemArtifactStore;
import com.williamcallahan.llmgateway.service.GatewayObservers;
import com.williamcallahan.llmgateway.service.GatewaySettings;
import com.williamcallahan.llmgateway.service.GatewayTelemetry;
import com.williamcallahan.llmgateway.service.LlmActiveTimeBudget;
import com.williamcallahan.llmgateway.service.LlmActiveWindowListener;
import com.williamcallahan.llmgateway.service.LlmEventStreams;
import com.williamcallahan.llmgateway.service.LlmGatewayService;
import com.williamcallahan.llmgateway.service.MicrometerGatewayTelemetry;
import com.williamcallahan.llmgateway.service.ProviderChainResolver;
import com.williamcallahan.llmgateway.service.ProviderStreamFactory;
import com.williamcallahan.llmgateway.service.ProviderStreamRegistry;
import com.williamcallahan.llmgateway.service.RequestAuditService;
import com.williamcallahan.llmgateway.service.RunAttemptSequencer;
import com.williamcallahan.llmgateway.service.Sleeper;
import com.williamcallahan.llmgateway.service.TokenEstimator;
import com.williamcallahan.llmgateway.service.WordCountTokenEstimator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the gateway and its collaborators. Every collaborator is a replaceable bean; provider
 * adapters are picked up from any {@link ProviderStreamFactory} beans, keyed by bean name.
 */
@Configuration
public class GatewayConfig {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ArtifactStore artifactStore(AppProperties appProperties) {
        String rootDir = appProperties.getArtifacts().getRootDir();
        try {
            FileSystemArtifactStore store = new FileSystemArtifactStore(rootDir);
            log.info("[LLM] Artifact store rooted at {}", store.getRootDir());
            return store;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize artifact store at " + rootDir, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayTelemetry gatewayTelemetry(
            MeterRegistry meterRegistry, ObjectProvider<ObservationRegistry> observationRegistry) {
        return new MicrometerGatewayTelemetry(
                meterRegistry, observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenEstimator tokenEstimator() {
        return new WordCountTokenEstimator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderChainResolver providerChainResolver(AppProperties appProperties) {
        return new ConfiguredProviderChainResolver(appProperties);
    }

    @Bean
    public ProviderStreamRegistry providerStreamRegistry(ListableBeanFactory beanFactory) {
        Map<String, ProviderStreamFactory> providerFactories = beanFactory.getBeansOfType(ProviderStreamFactory.class);
        ProviderStreamRegistry registry = new ProviderStreamRegistry(providerFactories);
        log.info("[LLM] Registered stream adapters: {}", registry.registeredProviders());
        return registry;
    }

    @Bean
    public RequestAuditService requestAuditService(ArtifactStore artifactStore, RunAttemptSequencer sequencer) {
        return new RequestAuditService(artifactStore, sequencer);
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmActiveWindowListener llmActiveWindowListener(AppProperties appProperties) {
        Long limitSeconds = appProperties.getGateway().getActiveTimeLimitSeconds();
        return new LlmActiveTimeBudget(limitSeconds == null ? null : Duration.ofSeconds(limitSeconds));
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD_SLEEP;
    }

    @Bean
    public LlmGatewayService llmGatewayService(
            ProviderChainResolver chainResolver,
            ProviderStreamRegistry providerStreamRegistry,
            LlmEventStreams eventStreams,
            RequestAuditService requestAuditService,
            GatewayTelemetry gatewayTelemetry,
            ContentHasher contentHasher,
            TokenEstimator tokenEstimator,
            Sleeper retrySleeper,
            LlmActiveWindowListener activeWindowListener,
            AppProperties appProperties) {
        return new LlmGatewayService(
                chainResolver,
                providerStreamRegistry,
                new GatewayObservers(eventStreams, requestAuditService, gatewayTelemetry),
                contentHasher,
                tokenEstimator,
                GatewaySettings.from(appProperties.getGateway()),
                retrySleeper,
                activeWindowListener);
    }
}
