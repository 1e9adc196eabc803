package com.autonomous.orchestrator.supervisor;

import com.autonomous.orchestrator.config.SupervisorSettings;
import com.autonomous.orchestrator.model.WorkerState;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.protocol.OutboundMessage;
import com.autonomous.orchestrator.worker.Worker;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Supervisor-side record of one agent. Lives from the first start until the agent is removed;
 * each (re)start replaces the incarnation fields and bumps the generation so callbacks of an
 * older incarnation can be recognised and ignored.
 */
public class WorkerHandle {

    @Getter
    private final String agentId;
    @Getter
    private final BlockingQueue<OutboundMessage> outbox = new LinkedBlockingQueue<>();
    final RestartPolicy restartPolicy;

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile Mailbox mailbox;
    volatile Worker worker;
    volatile ExecutorService executor;
    volatile CompletableFuture<Void> completion;
    volatile boolean stopRequested;
    volatile long generation;

    private volatile Instant startedAt;
    private volatile int restartCount;
    private volatile Instant lastCrashAt;
    private volatile String lastCrashReason;

    WorkerHandle(String agentId, SupervisorSettings settings) {
        this.agentId = agentId;
        this.restartPolicy = new RestartPolicy(settings);
    }

    public WorkerState getState() {
        return state;
    }

    void setState(WorkerState state) {
        this.state = state;
    }

    Mailbox mailbox() {
        return mailbox;
    }

    long beginIncarnation(Mailbox mailbox, Worker worker) {
        this.mailbox = mailbox;
        this.worker = worker;
        this.stopRequested = false;
        this.startedAt = Instant.now();
        return ++generation;
    }

    void recordCrash(Instant at, Throwable cause) {
        lastCrashAt = at;
        lastCrashReason = cause == null ? "exited without shutdown" : cause.toString();
    }

    void incrementRestarts() {
        restartCount++;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public Instant getLastCrashAt() {
        return lastCrashAt;
    }

    WorkerStatus status() {
        boolean live = state == WorkerState.RUNNING || state == WorkerState.STARTING;
        Instant started = startedAt;
        Mailbox inbox = mailbox;
        return WorkerStatus.builder()
            .agentId(agentId)
            .state(state)
            .startedAt(started)
            .uptimeSeconds(live && started != null ? Duration.between(started, Instant.now()).getSeconds() : 0)
            .restartCount(restartCount)
            .lastCrashAt(lastCrashAt)
            .lastCrashReason(lastCrashReason)
            .inboxSize(inbox == null ? 0 : inbox.size())
            .build();
    }
}
