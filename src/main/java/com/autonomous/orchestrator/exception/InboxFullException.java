package com.autonomous.orchestrator.exception;

/**
 * Backpressure signal: the worker's inbox is at capacity and the message was not enqueued.
 */
public class InboxFullException extends WorkerUnavailableException {

    public InboxFullException(String agentId, int capacity) {
        super(agentId, "inbox is full (" + capacity + " pending messages)");
    }
}
