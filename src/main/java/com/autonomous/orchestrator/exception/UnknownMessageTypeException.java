package com.autonomous.orchestrator.exception;

public class UnknownMessageTypeException extends OrchestratorException {

    public UnknownMessageTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
