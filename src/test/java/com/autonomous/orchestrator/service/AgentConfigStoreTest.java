package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.UnknownAgentException;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.ChannelBinding;
import com.autonomous.orchestrator.model.SandboxMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentConfigStoreTest {

    private AgentConfigStore configStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        configStore = new AgentConfigStore();
        configStore.setConfigPath(tempDir.toString());
    }

    @Test
    void shouldLoadConfigFromYaml() throws Exception {
        File configFile = tempDir.resolve("research.yaml").toFile();
        try (FileWriter writer = new FileWriter(configFile)) {
            writer.write("id: research\n");
            writer.write("name: Owl\n");
            writer.write("human_name: Ada\n");
            writer.write("workspace: /tmp/agents/research\n");
            writer.write("model: gpt-4o\n");
            writer.write("sandbox: restricted\n");
            writer.write("channels:\n");
            writer.write("  - source: slack\n");
            writer.write("    chat_id: C0123ABC\n");
            writer.write("    allowed_user_ids: [U1]\n");
        }

        configStore.loadConfigs();
        Optional<AgentConfig> config = configStore.getConfig("research");

        assertTrue(config.isPresent());
        assertEquals("Owl", config.get().getName());
        assertEquals("Ada", config.get().getHumanName());
        assertEquals(SandboxMode.RESTRICTED, config.get().getSandbox());
        assertTrue(config.get().bindingFor("slack", "C0123ABC").isPresent());
        assertFalse(config.get().bindingFor("slack", "C0123ABC").get().allowsUser("U2"));
    }

    @Test
    void shouldDefaultIdWorkspaceAndSandbox() throws Exception {
        Files.writeString(tempDir.resolve("helper.yml"), "name: Helper\n");

        configStore.loadConfigs();
        AgentConfig config = configStore.require("helper");

        assertEquals("agents/helper", config.getWorkspace());
        assertEquals(SandboxMode.CONFINED, config.getSandbox());
        assertTrue(config.hasTool("shell"));
    }

    @Test
    void shouldSkipInvalidFiles() throws Exception {
        Files.writeString(tempDir.resolve("broken.yaml"), "sandbox: jail\n");
        Files.writeString(tempDir.resolve("good.yaml"), "name: Good\n");

        configStore.loadConfigs();

        assertTrue(configStore.getConfig("broken").isEmpty());
        assertTrue(configStore.getConfig("good").isPresent());
    }

    @Test
    void shouldReturnEmptyForUnknownAgent() {
        configStore.loadConfigs();

        assertFalse(configStore.getConfig("UNKNOWN").isPresent());
        assertThrows(UnknownAgentException.class, () -> configStore.require("UNKNOWN"));
    }

    @Test
    void addedAgentShouldSurviveReload() {
        configStore.add(AgentConfig.builder()
            .id("writer")
            .sandbox(SandboxMode.NORMAL)
            .channels(List.of(ChannelBinding.builder().source("slack").chatId("C9").build()))
            .build());

        configStore.loadConfigs();
        AgentConfig reloaded = configStore.require("writer");

        assertEquals(SandboxMode.NORMAL, reloaded.getSandbox());
        assertEquals("agents/writer", reloaded.getWorkspace());
        assertEquals("C9", reloaded.homeChannel().orElseThrow().getChatId());
    }

    @Test
    void shouldRejectDuplicateAndBlankIds() {
        configStore.add(AgentConfig.builder().id("one").build());

        assertThrows(IllegalArgumentException.class, () -> configStore.add(AgentConfig.builder().id("one").build()));
        assertThrows(IllegalArgumentException.class, () -> configStore.add(AgentConfig.builder().build()));
    }

    @Test
    void shouldRejectIdsThatAreNotPlainFileNames() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> configStore.add(AgentConfig.builder().id("../escaped").build()));
        assertThrows(IllegalArgumentException.class, () -> configStore.add(AgentConfig.builder().id("a/b").build()));
        assertThrows(IllegalArgumentException.class, () -> configStore.add(AgentConfig.builder().id("two words").build()));
        assertFalse(Files.exists(tempDir.resolveSibling("escaped.yaml")));

        Files.writeString(tempDir.resolve("sneaky.yaml"), "id: ../sneaky\nname: Sneaky\n");
        configStore.loadConfigs();
        assertTrue(configStore.getAllConfigs().isEmpty());

        assertEquals("ok_agent-2", configStore.add(AgentConfig.builder().id("ok_agent-2").build()).getId());
    }

    @Test
    void shouldUpdateAndDelete() {
        configStore.add(AgentConfig.builder().id("one").build());

        configStore.update(configStore.require("one").toBuilder().model("grok-3").build());
        assertEquals("grok-3", configStore.require("one").getModel());

        configStore.delete("one");
        assertFalse(Files.exists(tempDir.resolve("one.yaml")));
        assertTrue(configStore.getAllConfigs().isEmpty());
        assertThrows(UnknownAgentException.class, () -> configStore.delete("one"));
    }
}
