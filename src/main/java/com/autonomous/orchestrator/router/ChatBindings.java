package com.autonomous.orchestrator.router;

import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.service.AgentConfigStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which agent a chat talks to. A {@code /agent} switch wins over the agents' configured
 * bindings, which win over the default agent.
 */
class ChatBindings {

    private final AgentConfigStore configs;
    private final String defaultAgent;
    private final Map<String, String> overrides = new ConcurrentHashMap<>();

    ChatBindings(AgentConfigStore configs, String defaultAgent) {
        this.configs = configs;
        this.defaultAgent = defaultAgent;
    }

    String resolve(String source, String chatId) {
        String override = overrides.get(key(source, chatId));
        if (override != null) {
            return override;
        }
        for (AgentConfig config : configs.getAllConfigs().values()) {
            if (config.bindingFor(source, chatId).isPresent()) {
                return config.getId();
            }
        }
        return defaultAgent;
    }

    void bind(String source, String chatId, String agentId) {
        overrides.put(key(source, chatId), agentId);
    }

    private static String key(String source, String chatId) {
        return source + "\u0000" + chatId;
    }
}
