package com.autonomous.orchestrator.worker;

/**
 * One incarnation of an agent's worker. {@link #run()} consumes the inbox until the shutdown
 * message and returns normally; any exception or error escaping it is a crash.
 */
public interface Worker extends Runnable {

    String getAgentId();

    /**
     * Forcibly releases what the worker holds outside the JVM, such as running shell commands.
     * Called after the grace period of a stop expires or after a crash.
     */
    void terminate();
}
