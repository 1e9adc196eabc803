package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class DaemonSettings {
    @Builder.Default
    String defaultAgent = "default";
    @Builder.Default
    Path dataDir = Path.of("data");
    // null disables the pid file
    Path pidFile;
    @Builder.Default
    int statsTimeoutSeconds = 10;
}
