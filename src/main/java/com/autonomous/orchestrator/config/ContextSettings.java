package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContextSettings {
    @Builder.Default
    int maxTokens = 200_000;
    @Builder.Default
    double compressThresholdRatio = 0.7;
    @Builder.Default
    double compressTargetRatio = 0.3;
    @Builder.Default
    String compressModel = "gemini-2.0-flash";
    // most recent turns always kept verbatim, whatever their size
    @Builder.Default
    int minTailTurns = 2;
    @Builder.Default
    int summaryMaxOutputTokens = 2000;

    public int thresholdTokens() {
        return (int) (maxTokens * compressThresholdRatio);
    }

    public int targetTokens() {
        return (int) (maxTokens * compressTargetRatio);
    }
}
