package com.williamcallahan.llmgateway.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Masks credential-like values in parameter maps before they are hashed, persisted or logged.
 *
 * <p>A key is treated as a credential when its lowercase form contains {@code key},
 * {@code secret}, {@code token} or {@code password}. Nested maps and lists are walked
 * recursively; the input is never modified.</p>
 */
public final class ParameterRedactor {

    /** Replacement written in place of a credential value. */
    public static final String MASK = "***";

    private static final String[] SECRET_KEY_FRAGMENTS = {"key", "secret", "token", "password"};

    private ParameterRedactor() {
    }

    /**
     * Returns whether a map key names a credential.
     *
     * @param key map key
     * @return true when the value must be masked
     */
    public static boolean isSecretKey(String key) {
        return AsciiTextNormalizer.containsAnyIgnoreCase(key, SECRET_KEY_FRAGMENTS);
    }

    /**
     * Produces a redacted deep copy of a parameter map.
     *
     * @param parameters map to redact
     * @return insertion-ordered copy with credential values masked
     */
    public static Map<String, Object> redact(Map<String, ?> parameters) {
        Map<String, Object> redacted = new LinkedHashMap<>();
        if (parameters == null) {
            return redacted;
        }
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            String key = entry.getKey();
            redacted.put(key, isSecretKey(key) ? MASK : redactValue(entry.getValue()));
        }
        return redacted;
    }

    private static Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nestedMap) {
            Map<String, Object> redacted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : nestedMap.entrySet()) {
                String key = String.valueOf(entry.getKey());
                redacted.put(key, isSecretKey(key) ? MASK : redactValue(entry.getValue()));
            }
            return redacted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> redacted = new ArrayList<>(collection.size());
            for (Object element : collection) {
                redacted.add(redactValue(element));
            }
            return redacted;
        }
        return value;
    }
}
