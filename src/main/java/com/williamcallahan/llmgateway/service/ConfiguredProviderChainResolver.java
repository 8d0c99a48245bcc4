package com.williamcallahan.llmgateway.service;

import com.williamcallahan.llmgateway.config.AppProperties;
import com.williamcallahan.llmgateway.domain.llm.ProviderHandle;
import com.williamcallahan.llmgateway.support.AsciiTextNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves provider chains from {@code app.gateway.*} settings.
 *
 * <p>The hinted (or default) provider comes first, followed by the configured fallback chain.
 * Entries repeating an earlier {@code provider:model} label are skipped. A bare hint is read as
 * a provider name when it matches a configured provider, otherwise as a model for the default
 * provider.</p>
 */
public class ConfiguredProviderChainResolver implements ProviderChainResolver {
    private final AppProperties.Gateway gateway;

    public ConfiguredProviderChainResolver(AppProperties appProperties) {
        this.gateway = appProperties.getGateway();
    }

    @Override
    public List<ProviderHandle> resolve(String providerHint) {
        List<String[]> candidates = new ArrayList<>();
        String[] hinted = parseHint(providerHint);
        if (hinted != null) {
            candidates.add(hinted);
        } else if (!isBlank(gateway.getDefaultProvider())) {
            candidates.add(new String[] {gateway.getDefaultProvider(), gateway.getDefaultModel()});
        }
        for (AppProperties.ChainEntry chainEntry : gateway.getProviderChain()) {
            if (!isBlank(chainEntry.getProvider())) {
                candidates.add(new String[] {chainEntry.getProvider(), chainEntry.getModel()});
            }
        }

        Set<String> seenLabels = new LinkedHashSet<>();
        List<ProviderHandle> chain = new ArrayList<>(candidates.size());
        for (String[] candidate : candidates) {
            String provider = candidate[0].trim();
            String model = isBlank(candidate[1]) ? null : candidate[1].trim();
            String label = AsciiTextNormalizer.toLowerAscii(provider) + ":" + (model == null ? "" : model);
            if (seenLabels.add(label)) {
                chain.add(new ProviderHandle(provider, model, chain.size()));
            }
        }
        return List.copyOf(chain);
    }

    private String[] parseHint(String providerHint) {
        if (isBlank(providerHint)) {
            return null;
        }
        String hint = providerHint.trim();
        int separator = hint.indexOf(':');
        if (separator > 0) {
            return new String[] {hint.substring(0, separator), hint.substring(separator + 1)};
        }
        if (isKnownProvider(hint)) {
            return new String[] {hint, modelForProvider(hint)};
        }
        if (isBlank(gateway.getDefaultProvider())) {
            return null;
        }
        return new String[] {gateway.getDefaultProvider(), hint};
    }

    private boolean isKnownProvider(String name) {
        String normalized = AsciiTextNormalizer.toLowerAscii(name);
        if (normalized.equals(AsciiTextNormalizer.toLowerAscii(gateway.getDefaultProvider()))) {
            return true;
        }
        for (AppProperties.ChainEntry chainEntry : gateway.getProviderChain()) {
            if (normalized.equals(AsciiTextNormalizer.toLowerAscii(chainEntry.getProvider()))) {
                return true;
            }
        }
        return false;
    }

    private String modelForProvider(String name) {
        String normalized = AsciiTextNormalizer.toLowerAscii(name);
        if (normalized.equals(AsciiTextNormalizer.toLowerAscii(gateway.getDefaultProvider()))) {
            return gateway.getDefaultModel();
        }
        for (AppProperties.ChainEntry chainEntry : gateway.getProviderChain()) {
            if (normalized.equals(AsciiTextNormalizer.toLowerAscii(chainEntry.getProvider()))) {
                return chainEntry.getModel();
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
