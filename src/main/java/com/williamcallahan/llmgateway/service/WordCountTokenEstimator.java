package com.williamcallahan.llmgateway.service;

import java.util.regex.Pattern;

/**
 * Counts whitespace-separated words, with at least one token for any non-blank text.
 */
public final class WordCountTokenEstimator implements TokenEstimator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public int estimate(String text) {
        if (text == null) {
            return 0;
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return 0;
        }
        return Math.max(1, WHITESPACE.split(stripped).length);
    }
}
