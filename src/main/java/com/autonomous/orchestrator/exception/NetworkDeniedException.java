package com.autonomous.orchestrator.exception;

public class NetworkDeniedException extends SandboxViolationException {

    public NetworkDeniedException(String command, String tool) {
        super(command, "Network access via '" + tool + "' is not allowed in restricted mode.");
    }
}
