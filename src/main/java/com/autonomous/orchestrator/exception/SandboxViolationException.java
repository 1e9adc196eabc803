package com.autonomous.orchestrator.exception;

import lombok.Getter;

/**
 * A shell command was refused before any subprocess was spawned.
 */
@Getter
public abstract class SandboxViolationException extends OrchestratorException {

    private final String command;

    protected SandboxViolationException(String command, String message) {
        super(message);
        this.command = command;
    }
}
