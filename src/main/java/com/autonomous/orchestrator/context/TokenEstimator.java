package com.autonomous.orchestrator.context;

/**
 * Rough token estimate: about four ASCII characters or two non-ASCII characters per token.
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int ascii = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) < 128) {
                ascii++;
            }
        }
        int nonAscii = text.length() - ascii;
        return ascii / 4 + nonAscii / 2 + 1;
    }
}
