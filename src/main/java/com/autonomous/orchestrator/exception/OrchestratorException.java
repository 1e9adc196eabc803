package com.autonomous.orchestrator.exception;

/**
 * Base type for every failure the daemon reports to callers.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
