package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ShellSettings {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int timeoutSeconds = 30;
    @Builder.Default
    int maxOutputChars = 10_000;
    @Builder.Default
    List<String> dangerousCommands = List.of(
        "rm", "rmdir", "chmod", "chown", "sudo", "su", "shutdown", "reboot", "kill", "mkfs", "dd");
    @Builder.Default
    List<String> blockedCommands = List.of("rm -rf /", "rm -rf ~", ":(){ :|:& };:");
    @Builder.Default
    int historyMaxEntries = 10_000;
    @Builder.Default
    long historyMaxFileBytes = 50L * 1024 * 1024;
    @Builder.Default
    boolean historyRecordOutput = true;
    @Builder.Default
    int historyOutputMaxChars = 500;
}
