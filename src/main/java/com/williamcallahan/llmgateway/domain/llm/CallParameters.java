package com.williamcallahan.llmgateway.domain.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-attempt parameters for an LLM call.
 *
 * <p>Provider and model are optional hints on the way in; the gateway fills both from the
 * selected chain entry before an attempt is made. Vendor-specific values such as the system
 * prompt travel in {@code extra}.</p>
 *
 * @param provider provider name, or null when the chain resolver should decide
 * @param model model name, or null to take the chain entry's model
 * @param temperature sampling temperature, when set
 * @param topP nucleus sampling value, when set
 * @param maxTokens per-call completion token limit, when set
 * @param extra open extension map for vendor-specific fields
 */
public record CallParameters(
        String provider, String model, Double temperature, Double topP, Integer maxTokens, Map<String, Object> extra) {

    /** Extension keys whose string value is treated as the system instructions. */
    private static final String[] INSTRUCTION_KEYS = {"system", "system_prompt", "instructions"};

    public CallParameters {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /** Returns parameters with every field unset. */
    public static CallParameters empty() {
        return builder().build();
    }

    /** Creates a builder with no fields set. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy targeted at the given chain entry. A caller-specified model wins over the
     * entry's model.
     *
     * @param handle selected chain entry
     * @return parameters with provider and model resolved
     */
    public CallParameters forHandle(ProviderHandle handle) {
        String resolvedModel = model != null && !model.isBlank() ? model : handle.model();
        return new CallParameters(handle.provider(), resolvedModel, temperature, topP, maxTokens, extra);
    }

    /**
     * Builds the provider hint used for chain resolution: {@code provider:model}, {@code provider},
     * or {@code model}, whichever is available.
     *
     * @return hint string or null when neither is set
     */
    public String providerHint() {
        boolean hasProvider = provider != null && !provider.isBlank();
        boolean hasModel = model != null && !model.isBlank();
        if (hasProvider && hasModel) {
            return provider + ":" + model;
        }
        if (hasProvider) {
            return provider;
        }
        return hasModel ? model : null;
    }

    /**
     * Returns the system instructions carried in the extension map, if any.
     *
     * @return first string value under a known instruction key, or null
     */
    public String instructions() {
        for (String key : INSTRUCTION_KEYS) {
            if (extra.get(key) instanceof String instructionText) {
                return instructionText;
            }
        }
        return null;
    }

    /**
     * Renders the non-null fields as an insertion-ordered map suitable for redaction and hashing.
     * Instruction text is left out; it is hashed on its own.
     *
     * @return mutable map view of these parameters
     */
    public Map<String, Object> toMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (provider != null) {
            fields.put("provider", provider);
        }
        if (model != null) {
            fields.put("model", model);
        }
        if (temperature != null) {
            fields.put("temperature", temperature);
        }
        if (topP != null) {
            fields.put("topP", topP);
        }
        if (maxTokens != null) {
            fields.put("maxTokens", maxTokens);
        }
        Map<String, Object> extraFields = new LinkedHashMap<>(extra);
        for (String key : INSTRUCTION_KEYS) {
            extraFields.remove(key);
        }
        fields.put("extra", extraFields);
        return fields;
    }

    /**
     * Fluent builder that avoids positional construction of the parameter fields.
     */
    public static final class Builder {
        private String provider;
        private String model;
        private Double temperature;
        private Double topP;
        private Integer maxTokens;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        /** Adds one vendor-specific field. */
        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public CallParameters build() {
            return new CallParameters(provider, model, temperature, topP, maxTokens, extra);
        }
    }
}
