package com.autonomous.orchestrator.sandbox;

import lombok.Value;

@Value
public class ShellResult {
    String command;
    int exitCode;
    String stdout;
    String stderr;
    boolean truncated;

    public String toToolOutput() {
        StringBuilder output = new StringBuilder();
        if (!stdout.isEmpty()) {
            output.append("stdout:\n").append(stdout).append("\n");
        }
        if (!stderr.isEmpty()) {
            output.append("stderr:\n").append(stderr).append("\n");
        }
        if (truncated) {
            output.append("(output truncated)\n");
        }
        output.append("exit_code: ").append(exitCode);
        return output.toString();
    }
}
