package com.autonomous.orchestrator.exception;

public class BlockedCommandException extends SandboxViolationException {

    public BlockedCommandException(String command, String pattern) {
        super(command, "Command blocked: matches '" + pattern + "'. This command is never executed.");
    }
}
