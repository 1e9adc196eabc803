package com.autonomous.orchestrator.model;

public enum WorkerState {
    STARTING,
    RUNNING,
    RESTARTING,
    STOPPED,
    CRASHED,
    // crash-loop limit exceeded; stays here until an explicit start or restart
    DEGRADED;

    public boolean acceptsMessages() {
        return this == RUNNING || this == STARTING;
    }
}
