package com.williamcallahan.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.williamcallahan.llmgateway.support.ParameterRedactor;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Produces algorithm-tagged SHA-256 hashes for prompts, instructions and parameter maps.
 *
 * <p>Parameter maps are redacted and serialized as canonical JSON (keys sorted at every level,
 * no whitespace) so that equal logical inputs always hash the same.</p>
 */
@Component
public class ContentHasher {

    /** Prefix identifying the digest algorithm in every hash string. */
    public static final String ALGORITHM_TAG = "sha256:";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    /**
     * Generates the hex SHA-256 digest of UTF-8 text.
     *
     * @param text the text to hash
     * @return lowercase hexadecimal digest
     */
    public String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Hashes text with the algorithm tag.
     *
     * @param text text to hash, may be null
     * @return tagged hash, or null for null or empty text
     */
    public String hashText(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        return ALGORITHM_TAG + sha256(text);
    }

    /**
     * Hashes a prompt; an empty prompt hashes to the digest of zero bytes.
     *
     * @param prompt prompt text
     * @return tagged hash, never null
     */
    public String hashPrompt(String prompt) {
        return ALGORITHM_TAG + sha256(prompt == null ? "" : prompt);
    }

    /**
     * Redacts and hashes a parameter map.
     *
     * @param parameters parameter map
     * @return tagged hash of the canonical redacted JSON
     */
    public String hashParameters(Map<String, ?> parameters) {
        return ALGORITHM_TAG + sha256(canonicalJson(ParameterRedactor.redact(parameters)));
    }

    /**
     * Serializes a map as canonical JSON with sorted keys and no inserted whitespace.
     *
     * @param payload map to serialize
     * @return canonical JSON text
     */
    public String canonicalJson(Map<String, ?> payload) {
        try {
            return canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize parameters", e);
        }
    }
}
