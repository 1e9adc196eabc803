package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.TaskItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentWorkspaceTest {

    @TempDir
    Path tempDir;

    private AgentWorkspace workspace;

    @BeforeEach
    void setUp() {
        workspace = new AgentWorkspace(tempDir.resolve("alpha"));
    }

    @Test
    void shouldCreateDefaultFilesWithIdentity() {
        workspace.initialize(AgentConfig.builder().id("alpha").name("Owl").humanName("Ada").build());

        assertTrue(workspace.readRules().contains("**Owl**"));
        assertTrue(workspace.readRules().contains("**Ada**"));
        assertTrue(workspace.readSkills().startsWith("# Skills"));
        assertEquals("", workspace.readMemory());
        assertTrue(workspace.tasks().isEmpty());
    }

    @Test
    void shouldNotOverwriteExistingFiles() throws Exception {
        Files.createDirectories(workspace.getRoot());
        Files.writeString(workspace.getRoot().resolve(AgentWorkspace.RULES), "custom rules");

        workspace.initialize(AgentConfig.builder().id("alpha").build());

        assertEquals("custom rules", workspace.readRules());
    }

    @Test
    void missingFilesShouldReadAsEmpty() {
        assertEquals("", workspace.readMemory());
        assertEquals("", workspace.readTaskFile());
    }

    @Test
    void shouldParseCheckboxTasks() throws Exception {
        workspace.initialize(AgentConfig.builder().id("alpha").build());
        Files.writeString(workspace.getRoot().resolve(AgentWorkspace.TASKS), String.join("\n",
            "# Tasks",
            "- [ ] water the plants",
            "  - [X] pay rent",
            "- [ ]",
            "- [?] not a task",
            "* [ ] other bullet style",
            "- [ ] call the bank"));

        List<TaskItem> tasks = workspace.tasks();

        assertEquals(3, tasks.size());
        assertEquals(new TaskItem("pay rent", true), tasks.get(1));
        assertEquals(List.of(new TaskItem("water the plants", false), new TaskItem("call the bank", false)),
            workspace.pendingTasks());
    }

    @Test
    void appendedMemoryShouldBeTimestamped() throws Exception {
        workspace.initialize(AgentConfig.builder().id("alpha").build());

        workspace.appendMemory("likes green tea");
        workspace.appendMemory("birthday in May");

        String memory = workspace.readMemory();
        assertTrue(memory.matches("(?s)\\n### \\[\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} UTC]\\nlikes green tea\\n.*"));
        assertTrue(memory.indexOf("likes green tea") < memory.indexOf("birthday in May"));

        workspace.writeMemory("fresh start");
        assertEquals("fresh start", workspace.readMemory());
    }
}
