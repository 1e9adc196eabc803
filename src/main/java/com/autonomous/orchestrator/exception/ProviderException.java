package com.autonomous.orchestrator.exception;

import lombok.Getter;

/**
 * Failure reported by an LLM provider adapter. Retryable failures (rate limits,
 * 5xx, transport errors) are retried by the worker with backoff.
 */
@Getter
public class ProviderException extends OrchestratorException {

    private final boolean retryable;

    public ProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
