package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.support.AsciiTextNormalizer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider-name to stream adapter table. Names are case-insensitive.
 *
 * <p>Populated at startup and safe to extend while calls are in flight.</p>
 */
public class ProviderStreamRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderStreamRegistry.class);

    private final Map<String, ProviderStreamFactory> factories = new ConcurrentHashMap<>();

    public ProviderStreamRegistry() {
    }

    /**
     * Creates a registry seeded with adapters.
     *
     * @param initialFactories adapters keyed by provider name
     */
    public ProviderStreamRegistry(Map<String, ProviderStreamFactory> initialFactories) {
        initialFactories.forEach(this::register);
    }

    /**
     * Registers or replaces the adapter for a provider.
     *
     * @param providerName provider name
     * @param factory stream adapter
     */
    public void register(String providerName, ProviderStreamFactory factory) {
        Objects.requireNonNull(factory, "factory");
        String key = normalize(providerName);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("providerName cannot be blank");
        }
        ProviderStreamFactory previous = factories.put(key, factory);
        if (previous != null) {
            log.info("[LLM] Replaced stream adapter for provider={}", key);
        }
    }

    /**
     * Looks up the adapter for a provider.
     *
     * @param providerName provider name, any case
     * @return adapter when registered
     */
    public Optional<ProviderStreamFactory> find(String providerName) {
        return Optional.ofNullable(factories.get(normalize(providerName)));
    }

    /** Returns the registered provider names, lowercased. */
    public Set<String> registeredProviders() {
        return Set.copyOf(factories.keySet());
    }

    private static String normalize(String providerName) {
        return AsciiTextNormalizer.toLowerAscii(providerName).trim();
    }
}
