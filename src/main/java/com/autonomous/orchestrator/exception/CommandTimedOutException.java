package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class CommandTimedOutException extends OrchestratorException {

    private final String command;
    private final int timeoutSeconds;

    public CommandTimedOutException(String command, int timeoutSeconds) {
        super("Command timed out after " + timeoutSeconds + " seconds: " + command);
        this.command = command;
        this.timeoutSeconds = timeoutSeconds;
    }
}
