package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.config.LlmSettings;
import com.autonomous.orchestrator.config.ProviderSettings;
import com.autonomous.orchestrator.exception.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the adapter for a model by its provider key. Adapters are created on first use and
 * shared; they hold no per-conversation state.
 */
@Slf4j
public class ProviderFactory {

    private final LlmSettings settings;
    private final ModelCatalog catalog;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Map<String, LlmProvider> adapters = new ConcurrentHashMap<>();

    public ProviderFactory(LlmSettings settings, ModelCatalog catalog) {
        this.settings = settings;
        this.catalog = catalog;
        this.mapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(20))
            .build();
    }

    public LlmProvider forModel(String model) {
        String providerName = catalog.resolveProvider(model, settings.getDefaultProvider());
        return adapters.computeIfAbsent(providerName, this::create);
    }

    private LlmProvider create(String providerName) {
        ProviderSettings provider = settings.provider(providerName)
            .orElseThrow(() -> new ProviderException("Provider '" + providerName + "' is not configured", false));
        String apiKey = provider.resolveApiKey();
        if (apiKey.isBlank()) {
            throw new ProviderException("API key not found for provider '" + providerName
                + "'. Set api-key or the environment variable '" + provider.getApiKeyEnv() + "'.", false);
        }
        log.info("Creating {} provider adapter", providerName);
        if ("anthropic".equals(providerName)) {
            return new AnthropicProvider(mapper, httpClient,
                baseUrlOr(provider, AnthropicProvider.DEFAULT_BASE_URL), apiKey, settings.getRequestTimeout());
        }
        return new OpenAiCompatibleProvider(mapper, httpClient, providerName,
            baseUrlOr(provider, OpenAiCompatibleProvider.defaultBaseUrl(providerName)), apiKey,
            settings.getRequestTimeout());
    }

    private static String baseUrlOr(ProviderSettings provider, String fallback) {
        return provider.getBaseUrl() == null || provider.getBaseUrl().isBlank() ? fallback : provider.getBaseUrl();
    }
}
