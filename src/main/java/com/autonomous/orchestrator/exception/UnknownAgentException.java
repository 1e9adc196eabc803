package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class UnknownAgentException extends OrchestratorException {

    private final String agentId;

    public UnknownAgentException(String agentId) {
        super("Unknown agent: " + agentId);
        this.agentId = agentId;
    }
}
