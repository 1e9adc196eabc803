package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Identity and policy of one agent. Immutable once a worker has been started with it;
 * changes take effect on the next start or restart.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentConfig {

    public static final List<String> DEFAULT_TOOLS = List.of("shell", "memory", "task");

    String id;

    @Builder.Default
    String name = "Turtle";

    @Builder.Default
    @JsonProperty("human_name")
    String humanName = "Human";

    String workspace;

    String model;

    @Builder.Default
    SandboxMode sandbox = SandboxMode.CONFINED;

    @Builder.Default
    List<String> tools = DEFAULT_TOOLS;

    @Builder.Default
    List<ChannelBinding> channels = List.of();

    public Path workspacePath() {
        return Path.of(workspace).toAbsolutePath().normalize();
    }

    public boolean hasTool(String tool) {
        return tools != null && tools.contains(tool);
    }

    public Optional<ChannelBinding> bindingFor(String source, String chatId) {
        return channels.stream().filter(b -> b.matches(source, chatId)).findFirst();
    }

    public Optional<ChannelBinding> homeChannel() {
        return channels.stream().findFirst();
    }
}
