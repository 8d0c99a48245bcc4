package com.williamcallahan.llmgateway.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies canonical, redaction-aware hashing of prompts and parameter maps.
 */
class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void hashingIsIdempotentAndKeyOrderInsensitive() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("model", "m-1");
        first.put("temperature", 0.2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("temperature", 0.2);
        second.put("model", "m-1");

        assertEquals(hasher.hashParameters(first), hasher.hashParameters(first));
        assertEquals(hasher.hashParameters(first), hasher.hashParameters(second));
    }

    @Test
    void changingNonSecretFieldChangesHash() {
        String cooler = hasher.hashParameters(Map.of("model", "m-1", "temperature", 0.2));
        String warmer = hasher.hashParameters(Map.of("model", "m-1", "temperature", 0.9));

        assertNotEquals(cooler, warmer);
    }

    @Test
    void callsDifferingOnlyInSecretsHashTheSame() {
        String first = hasher.hashParameters(Map.of(
                "model", "m-1", "api_key", "sk-one", "extra", Map.of("Secret", "a", "auth_token", "x")));
        String second = hasher.hashParameters(Map.of(
                "model", "m-1", "api_key", "sk-two", "extra", Map.of("Secret", "b", "auth_token", "y")));

        assertEquals(first, second);
    }

    @Test
    void canonicalJsonSortsKeysWithoutWhitespace() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("b", 1);
        payload.put("a", Map.of("z", true, "y", "v"));

        assertEquals("{\"a\":{\"y\":\"v\",\"z\":true},\"b\":1}", hasher.canonicalJson(payload));
    }

    @Test
    void hashesCarryAlgorithmTag() {
        assertTrue(hasher.hashPrompt("hello").startsWith(ContentHasher.ALGORITHM_TAG));
        assertEquals(ContentHasher.ALGORITHM_TAG
                        + "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                hasher.hashPrompt(""));
        assertFalse(hasher.hashParameters(Map.of()).isBlank());
    }

    @Test
    void absentInstructionsHashToNull() {
        assertNull(hasher.hashText(null));
        assertNull(hasher.hashText(""));
        assertEquals(hasher.hashPrompt("rules"), hasher.hashText("rules"));
    }
}
