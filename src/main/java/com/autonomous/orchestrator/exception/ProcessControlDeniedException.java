package com.autonomous.orchestrator.exception;

public class ProcessControlDeniedException extends SandboxViolationException {

    public ProcessControlDeniedException(String command, String tool) {
        super(command, "Process management via '" + tool + "' is not allowed in this sandbox mode.");
    }
}
