package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.exception.ProviderException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared JSON-over-HTTP plumbing for provider adapters.
 */
public abstract class AbstractHttpProvider implements LlmProvider {

    protected static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final String providerName;
    protected final String baseUrl;
    protected final String apiKey;
    protected final Duration requestTimeout;

    protected AbstractHttpProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                   String baseUrl, String apiKey, Duration requestTimeout) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.providerName = providerName;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    protected JsonNode postJson(String url, JsonNode payload, Map<String, String> headers) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
            headers.forEach(builder::header);

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new ProviderException(providerName + " request failed (" + status + "): "
                    + abbreviate(response.body()), isRetryableStatus(status));
            }
            return mapper.readTree(response.body());
        } catch (IOException e) {
            // transport failures and timeouts are worth another attempt
            throw new ProviderException(providerName + " request failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerName + " request interrupted", false, e);
        }
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    protected Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (IOException e) {
            return Map.of("raw", json);
        }
    }

    private static String normalizeBaseUrl(String url) {
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
