package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.TaskItem;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text files of one agent: rules.md, skills.md, memory.md, task.md and the shell history.
 */
@Slf4j
public class AgentWorkspace {

    static final String RULES = "rules.md";
    static final String SKILLS = "skills.md";
    static final String MEMORY = "memory.md";
    static final String TASKS = "task.md";
    static final String SHELL_HISTORY = ".shell_history";

    private static final DateTimeFormatter MEMORY_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    @Getter
    private final Path root;

    public AgentWorkspace(Path root) {
        this.root = root;
    }

    /**
     * Creates the workspace and writes default files that do not exist yet. Existing files are left alone.
     */
    public void initialize(AgentConfig config) {
        try {
            Files.createDirectories(root);
            writeIfAbsent(RULES, "# Agent Rules\n\n"
                + "## Identity\n\n"
                + "- You are **" + config.getName() + "**, a helpful personal AI assistant.\n"
                + "- You refer to the user as **" + config.getHumanName() + "**.\n\n"
                + "## Behavior\n\n"
                + "- Be concise and direct in your responses.\n"
                + "- When executing shell commands, explain what you're doing before running them.\n"
                + "- Always ask for confirmation before performing destructive operations.\n");
            writeIfAbsent(SKILLS, "# Skills\n\n<!-- Define agent-specific skills and workflows here. -->\n");
            writeIfAbsent(MEMORY, "");
            writeIfAbsent(TASKS, "# Tasks\n\n<!-- Add tasks as: - [ ] task description -->\n");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot initialize workspace " + root, e);
        }
    }

    public String readRules() {
        return read(RULES);
    }

    public String readSkills() {
        return read(SKILLS);
    }

    public String readMemory() {
        return read(MEMORY);
    }

    public String readTaskFile() {
        return read(TASKS);
    }

    public void writeMemory(String content) throws IOException {
        Files.writeString(root.resolve(MEMORY), content, StandardCharsets.UTF_8);
    }

    public void appendMemory(String entry) throws IOException {
        String stamp = ZonedDateTime.now(ZoneOffset.UTC).format(MEMORY_STAMP);
        Files.writeString(root.resolve(MEMORY), "\n### [" + stamp + "]\n" + entry + "\n", StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Markdown checkbox items of task.md, in file order.
     */
    public List<TaskItem> tasks() {
        List<TaskItem> items = new ArrayList<>();
        for (String line : readTaskFile().split("\\R")) {
            String stripped = line.strip();
            if (stripped.length() < 5 || !stripped.startsWith("- [") || stripped.charAt(4) != ']') {
                continue;
            }
            String mark = stripped.substring(3, 4).toLowerCase(Locale.ROOT);
            String description = stripped.substring(5).strip();
            if (description.isEmpty() || !(mark.equals(" ") || mark.equals("x"))) {
                continue;
            }
            items.add(new TaskItem(description, mark.equals("x")));
        }
        return items;
    }

    public List<TaskItem> pendingTasks() {
        return tasks().stream().filter(t -> !t.isDone()).toList();
    }

    public Path shellHistoryFile() {
        return root.resolve(SHELL_HISTORY);
    }

    private String read(String name) {
        Path file = root.resolve(name);
        if (!Files.exists(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private void writeIfAbsent(String name, String content) throws IOException {
        Path file = root.resolve(name);
        if (!Files.exists(file)) {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        }
    }
}
