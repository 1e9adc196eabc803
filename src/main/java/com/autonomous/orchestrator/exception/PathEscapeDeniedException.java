package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class PathEscapeDeniedException extends SandboxViolationException {

    private final String path;

    public PathEscapeDeniedException(String command, String path) {
        super(command, "Path '" + path + "' resolves outside the agent workspace.");
        this.path = path;
    }
}
