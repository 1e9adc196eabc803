package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@Value
@Builder
public class LlmSettings {
    @Builder.Default
    String defaultProvider = "google";
    @Builder.Default
    String defaultModel = "gemini-2.5-flash";
    @Builder.Default
    double temperature = 0.7;
    @Builder.Default
    int maxOutputTokens = 8192;
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(120);
    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    long retryBaseMillis = 1000;
    @Builder.Default
    int maxToolRounds = 10;
    @Singular
    Map<String, ProviderSettings> providers;

    public Optional<ProviderSettings> provider(String name) {
        return Optional.ofNullable(providers.get(name));
    }
}
