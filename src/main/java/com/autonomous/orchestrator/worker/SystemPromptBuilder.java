package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.model.AgentConfig;

final class SystemPromptBuilder {

    private SystemPromptBuilder() {
    }

    static String build(AgentConfig config, String model, AgentWorkspace workspace) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(config.getName()).append(" (agent id: ").append(config.getId())
            .append("), running on model ").append(model).append(".\n");
        prompt.append("Workspace: ").append(workspace.getRoot()).append("\n");
        prompt.append("Sandbox: ").append(config.getSandbox().describe()).append("\n");
        prompt.append("Dangerous shell commands are refused until the user explicitly confirms them; "
            + "only then call execute_shell again with confirmed=true.\n");
        appendSection(prompt, "Rules", workspace.readRules());
        appendSection(prompt, "Skills", workspace.readSkills());
        appendSection(prompt, "Memory", workspace.readMemory());
        return prompt.toString();
    }

    private static void appendSection(StringBuilder prompt, String title, String content) {
        if (content != null && !content.isBlank()) {
            prompt.append("\n## ").append(title).append("\n\n").append(content.strip()).append("\n");
        }
    }
}
