package com.autonomous.orchestrator.exception;

/**
 * Resource exhaustion at daemon level. The daemon shuts down when this escapes.
 */
public class DaemonFatalException extends OrchestratorException {

    public DaemonFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
