package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class WorkerUnavailableException extends OrchestratorException {

    private final String agentId;

    public WorkerUnavailableException(String agentId, String reason) {
        super("Agent '" + agentId + "' is unavailable: " + reason);
        this.agentId = agentId;
    }
}
