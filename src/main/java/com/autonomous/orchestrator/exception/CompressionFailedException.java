package com.autonomous.orchestrator.exception;

public class CompressionFailedException extends OrchestratorException {

    public CompressionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
