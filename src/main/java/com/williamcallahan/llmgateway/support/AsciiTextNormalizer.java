package com.williamcallahan.llmgateway.support;

/**
 * Provides locale-independent ASCII lowercasing for technical identifiers.
 *
 * Provider names and parameter keys are matched case-insensitively; converting only A-Z keeps
 * those comparisons stable regardless of the JVM default locale (the Turkish dotless i being
 * the usual trap with {@code toLowerCase()}).
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Returns whether the ASCII-lowercased text contains any of the given lowercase fragments.
     *
     * @param text text to inspect (may be null)
     * @param lowercaseFragments fragments, already lowercase
     * @return true on the first match
     */
    public static boolean containsAnyIgnoreCase(String text, String... lowercaseFragments) {
        String normalized = toLowerAscii(text);
        for (String fragment : lowercaseFragments) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
