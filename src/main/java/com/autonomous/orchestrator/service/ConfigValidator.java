package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.config.LlmSettings;
import com.autonomous.orchestrator.config.ProviderSettings;
import com.autonomous.orchestrator.model.AgentConfig;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the loaded configuration for problems that would stop agents from working.
 */
@Service
public class ConfigValidator {

    private final AgentConfigStore configs;
    private final DaemonSettings daemonSettings;
    private final LlmSettings llmSettings;

    public ConfigValidator(AgentConfigStore configs, DaemonSettings daemonSettings, LlmSettings llmSettings) {
        this.configs = configs;
        this.daemonSettings = daemonSettings;
        this.llmSettings = llmSettings;
    }

    /**
     * @return one line per problem; empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Map<String, AgentConfig> agents = configs.getAllConfigs();
        if (agents.isEmpty()) {
            problems.add("No agents configured");
        } else if (!agents.containsKey(daemonSettings.getDefaultAgent())) {
            problems.add("Default agent '" + daemonSettings.getDefaultAgent() + "' is not configured");
        }
        for (AgentConfig agent : agents.values()) {
            if (agent.getWorkspace() == null || agent.getWorkspace().isBlank()) {
                problems.add("Agent '" + agent.getId() + "': workspace is empty");
            }
            if (agent.getSandbox() == null) {
                problems.add("Agent '" + agent.getId() + "': sandbox mode is missing");
            }
        }
        if (llmSettings.provider(llmSettings.getDefaultProvider()).isEmpty()) {
            problems.add("Default provider '" + llmSettings.getDefaultProvider() + "' is not configured");
        }
        for (ProviderSettings provider : llmSettings.getProviders().values()) {
            if (provider.resolveApiKey().isBlank()) {
                problems.add("Provider '" + provider.getName() + "': no API key (set api-key or "
                    + (provider.getApiKeyEnv() == null ? "api-key-env" : "$" + provider.getApiKeyEnv()) + ")");
            }
        }
        return problems;
    }
}
