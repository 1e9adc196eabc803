package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.UnknownAgentException;
import com.autonomous.orchestrator.model.AgentConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Agent definitions, one YAML file per agent under {@code orchestrator.agents-path}.
 */
@Slf4j
@Service
public class AgentConfigStore {

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");

    @Value("${orchestrator.agents-path:config/agents}")
    private String configPath;

    private final Map<String, AgentConfig> configs = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public AgentConfigStore() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadConfigs() {
        configs.clear();
        File configDir = new File(configPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.warn("Agent config directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;

        for (File file : yamlFiles) {
            try {
                AgentConfig config = yamlMapper.readValue(file, AgentConfig.class);
                if (config.getId() == null || config.getId().isBlank()) {
                    config = config.toBuilder().id(stripExtension(file.getName())).build();
                }
                checkId(config.getId());
                if (config.getWorkspace() == null || config.getWorkspace().isBlank()) {
                    config = config.toBuilder().workspace("agents/" + config.getId()).build();
                }
                configs.put(config.getId(), config);
                log.info("Loaded config for agent: {}", config.getId());
            } catch (Exception e) {
                log.error("Failed to load agent config from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public Optional<AgentConfig> getConfig(String agentId) {
        return Optional.ofNullable(configs.get(agentId));
    }

    public AgentConfig require(String agentId) {
        return getConfig(agentId).orElseThrow(() -> new UnknownAgentException(agentId));
    }

    public Map<String, AgentConfig> getAllConfigs() {
        return new TreeMap<>(configs);
    }

    public AgentConfig add(AgentConfig config) {
        checkId(config.getId());
        if (configs.containsKey(config.getId())) {
            throw new IllegalArgumentException("Agent '" + config.getId() + "' already exists");
        }
        AgentConfig stored = config.getWorkspace() == null || config.getWorkspace().isBlank()
            ? config.toBuilder().workspace("agents/" + config.getId()).build()
            : config;
        write(stored);
        configs.put(stored.getId(), stored);
        log.info("Added agent '{}'", stored.getId());
        return stored;
    }

    public AgentConfig update(AgentConfig config) {
        require(config.getId());
        write(config);
        configs.put(config.getId(), config);
        return config;
    }

    public void delete(String agentId) {
        require(agentId);
        try {
            Files.deleteIfExists(fileFor(agentId));
            Files.deleteIfExists(Path.of(configPath, agentId + ".yml"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete config for agent '" + agentId + "'", e);
        }
        configs.remove(agentId);
        log.info("Deleted agent '{}'", agentId);
    }

    private void write(AgentConfig config) {
        try {
            Path file = fileFor(config.getId());
            Files.createDirectories(file.getParent());
            yamlMapper.writeValue(file.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write config for agent '" + config.getId() + "'", e);
        }
    }

    private Path fileFor(String agentId) {
        checkId(agentId);
        return Path.of(configPath, agentId + ".yaml");
    }

    // ids name files under the config directory
    private static void checkId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (!VALID_ID.matcher(agentId).matches()) {
            throw new IllegalArgumentException("Agent id '" + agentId + "' may only contain letters, digits, '-' and '_'");
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
