package com.vivek.core.iteration;

/**
 * Word-based token approximation: whitespace-separated words times 1.3, rounded down.
 */
public final class TokenEstimator {

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = text.trim().split("\\s+").length;
        return (int) (words * 1.3);
    }
}
