package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class ConfirmationRequiredException extends SandboxViolationException {

    private final String dangerousCommand;

    public ConfirmationRequiredException(String command, String dangerousCommand) {
        super(command, "Command '" + dangerousCommand + "' requires explicit user confirmation before execution.");
        this.dangerousCommand = dangerousCommand;
    }
}
