package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

/**
 * Credentials and endpoint for one provider. A direct {@code apiKey} wins over {@code apiKeyEnv}.
 */
@Value
@Builder
public class ProviderSettings {
    String name;
    String apiKey;
    String apiKeyEnv;
    String baseUrl;

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
            String fromEnv = System.getenv(apiKeyEnv);
            return fromEnv == null ? "" : fromEnv;
        }
        return "";
    }
}
