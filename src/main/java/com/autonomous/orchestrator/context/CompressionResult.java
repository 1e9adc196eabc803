package com.autonomous.orchestrator.context;

import lombok.Value;

@Value
public class CompressionResult {
    boolean compressed;
    int turnsSummarized;
    int turnsKept;
    int tokensBefore;
    int tokensAfter;

    static CompressionResult unchanged(int tokens, int turns) {
        return new CompressionResult(false, 0, turns, tokens, tokens);
    }
}
