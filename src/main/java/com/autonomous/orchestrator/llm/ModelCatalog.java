package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.model.ModelInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Known models with their provider, context window and pricing. Immutable after loading.
 */
public class ModelCatalog {

    private static final String DEFAULT_RESOURCE = "/models.yaml";

    private final Map<String, ModelInfo> byName;
    private final List<ModelInfo> ordered;

    public ModelCatalog(List<ModelInfo> models) {
        Map<String, ModelInfo> index = new LinkedHashMap<>();
        for (ModelInfo model : models) {
            index.put(model.getName(), model);
        }
        this.byName = Map.copyOf(index);
        this.ordered = List.copyOf(models);
    }

    public static ModelCatalog loadDefault() {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = ModelCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Model catalog resource not found: " + DEFAULT_RESOURCE);
            }
            Map<String, List<ModelInfo>> document = yamlMapper.readValue(in, new TypeReference<>() {
            });
            return new ModelCatalog(document.getOrDefault("models", List.of()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model catalog", e);
        }
    }

    public Optional<ModelInfo> find(String model) {
        return Optional.ofNullable(byName.get(model));
    }

    public List<ModelInfo> list(String provider) {
        if (provider == null || provider.isBlank()) {
            return ordered;
        }
        return ordered.stream()
            .filter(m -> m.getProvider().equalsIgnoreCase(provider))
            .collect(Collectors.toList());
    }

    /**
     * Provider for a model: the catalog entry, else a name-prefix guess, else {@code defaultProvider}.
     */
    public String resolveProvider(String model, String defaultProvider) {
        Optional<ModelInfo> info = find(model);
        if (info.isPresent()) {
            return info.get().getProvider();
        }
        if (model.startsWith("gemini")) {
            return "google";
        } else if (model.startsWith("gpt") || model.startsWith("o3") || model.startsWith("o4")) {
            return "openai";
        } else if (model.startsWith("claude")) {
            return "anthropic";
        } else if (model.startsWith("grok")) {
            return "xai";
        } else if (model.contains("/")) {
            return "openrouter";
        }
        return defaultProvider;
    }

    /**
     * Cost in USD; zero for models without pricing.
     */
    public double cost(String model, long promptTokens, long completionTokens) {
        return find(model)
            .map(m -> promptTokens * m.getInputPricePer1m() / 1_000_000.0
                + completionTokens * m.getOutputPricePer1m() / 1_000_000.0)
            .orElse(0.0);
    }

    public String format(List<ModelInfo> models) {
        if (models.isEmpty()) {
            return "No models found.";
        }
        StringBuilder out = new StringBuilder();
        String currentProvider = "";
        for (ModelInfo m : models) {
            if (!m.getProvider().equals(currentProvider)) {
                if (!currentProvider.isEmpty()) {
                    out.append("\n");
                }
                out.append(m.getProvider().toUpperCase()).append("\n");
                currentProvider = m.getProvider();
            }
            String window = m.getContextWindow() >= 1_000_000
                ? (m.getContextWindow() / 1_000_000) + "M"
                : (m.getContextWindow() / 1000) + "K";
            out.append(String.format("  %-32s %6s  $%.3f / $%.3f%n",
                m.getName(), window, m.getInputPricePer1m(), m.getOutputPricePer1m()));
        }
        return out.toString().trim();
    }
}
