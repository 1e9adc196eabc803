package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.exception.CommandTimedOutException;
import com.autonomous.orchestrator.exception.SandboxViolationException;
import com.autonomous.orchestrator.llm.ToolDefinition;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.TaskItem;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.sandbox.SandboxEnforcer;
import com.autonomous.orchestrator.sandbox.ShellResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tools an agent may call during a completion. Every shell command goes through the
 * agent's {@link SandboxEnforcer}; sandbox rejections come back to the model as tool output.
 */
@Slf4j
class WorkerTools {

    static final String EXECUTE_SHELL = "execute_shell";
    static final String READ_MEMORY = "read_memory";
    static final String WRITE_MEMORY = "write_memory";
    static final String READ_TASKS = "read_tasks";

    private final AgentConfig config;
    private final AgentWorkspace workspace;
    private final SandboxEnforcer sandbox;
    private final boolean shellEnabled;

    WorkerTools(AgentConfig config, AgentWorkspace workspace, SandboxEnforcer sandbox, boolean shellEnabled) {
        this.config = config;
        this.workspace = workspace;
        this.sandbox = sandbox;
        this.shellEnabled = shellEnabled;
    }

    List<ToolDefinition> definitions() {
        List<ToolDefinition> tools = new ArrayList<>();
        if (shellEnabled && config.hasTool("shell")) {
            tools.add(new ToolDefinition(EXECUTE_SHELL,
                "Execute a shell command in the agent workspace. " + config.getSandbox().describe()
                    + " Dangerous commands are refused unless confirmed is true, which you may only set "
                    + "after the user explicitly approved that exact command.",
                objectSchema(Map.of(
                    "command", Map.of("type", "string", "description", "The shell command to run"),
                    "confirmed", Map.of("type", "boolean", "description", "True once the user confirmed a dangerous command")),
                    List.of("command"))));
        }
        if (config.hasTool("memory")) {
            tools.add(new ToolDefinition(READ_MEMORY, "Read the agent's long-term memory file (memory.md).",
                objectSchema(Map.of(), List.of())));
            tools.add(new ToolDefinition(WRITE_MEMORY,
                "Write to the agent's long-term memory file. Use mode 'append' to add a timestamped entry "
                    + "or 'overwrite' to replace the whole file.",
                objectSchema(Map.of(
                    "content", Map.of("type", "string", "description", "Text to write"),
                    "mode", Map.of("type", "string", "enum", List.of("append", "overwrite"))),
                    List.of("content"))));
        }
        if (config.hasTool("task")) {
            tools.add(new ToolDefinition(READ_TASKS, "Read the agent's task list (task.md).",
                objectSchema(Map.of(), List.of())));
        }
        return tools;
    }

    /**
     * Runs one tool call. Never throws for tool-level failures; they are reported as text.
     */
    String handle(ToolCall call) {
        log.debug("[{}] tool call {} {}", config.getId(), call.getName(), call.getArguments());
        return switch (call.getName()) {
            case EXECUTE_SHELL -> executeShell(call);
            case READ_MEMORY -> {
                String memory = workspace.readMemory();
                yield memory.isBlank() ? "(memory is empty)" : memory;
            }
            case WRITE_MEMORY -> writeMemory(call);
            case READ_TASKS -> readTasks();
            default -> "Error: unknown tool '" + call.getName() + "'";
        };
    }

    private String executeShell(ToolCall call) {
        if (!shellEnabled || !config.hasTool("shell")) {
            return "Error: shell tool is disabled for this agent";
        }
        String command = call.stringArgument("command", "");
        if (command.isBlank()) {
            return "Error: command is required";
        }
        try {
            ShellResult result = sandbox.execute(command, null, call.booleanArgument("confirmed"));
            return result.toToolOutput();
        } catch (SandboxViolationException | CommandTimedOutException e) {
            return "Error: " + e.getMessage();
        }
    }

    private String writeMemory(ToolCall call) {
        String content = call.stringArgument("content", "");
        String mode = call.stringArgument("mode", "append");
        try {
            if ("overwrite".equals(mode)) {
                workspace.writeMemory(content);
                return "Memory overwritten.";
            }
            workspace.appendMemory(content);
            return "Memory entry appended.";
        } catch (IOException e) {
            log.warn("[{}] memory write failed: {}", config.getId(), e.getMessage());
            return "Error: cannot write memory: " + e.getMessage();
        }
    }

    private String readTasks() {
        List<TaskItem> tasks = workspace.tasks();
        if (tasks.isEmpty()) {
            return "(no tasks)";
        }
        StringBuilder text = new StringBuilder();
        for (TaskItem task : tasks) {
            text.append(task.isDone() ? "- [x] " : "- [ ] ").append(task.getDescription()).append("\n");
        }
        return text.toString();
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }
}
