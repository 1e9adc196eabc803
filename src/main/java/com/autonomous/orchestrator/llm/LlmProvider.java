package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.exception.ProviderException;

/**
 * Completion service for one provider. Implementations are stateless and may be shared.
 */
public interface LlmProvider {

    String getProviderName();

    /**
     * @throws ProviderException with {@code retryable} set for rate limits and transient failures
     */
    Completion complete(CompletionRequest request);
}
