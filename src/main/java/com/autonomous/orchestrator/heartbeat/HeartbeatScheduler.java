package com.autonomous.orchestrator.heartbeat;

import com.autonomous.orchestrator.config.HeartbeatSettings;
import com.autonomous.orchestrator.model.WorkerState;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Puts a heartbeat check into the inbox of every running agent at a fixed interval. Delivery
 * is best effort: an agent that is not running or has a full inbox is skipped for that tick.
 */
@Slf4j
@Service
public class HeartbeatScheduler {

    private final WorkerSupervisor supervisor;
    private final HeartbeatSettings settings;
    private ScheduledExecutorService timer;

    public HeartbeatScheduler(WorkerSupervisor supervisor, HeartbeatSettings settings) {
        this.supervisor = supervisor;
        this.settings = settings;
    }

    public synchronized void start() {
        if (!settings.isEnabled()) {
            log.info("Heartbeat disabled");
            return;
        }
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long interval = settings.getIntervalSeconds();
        timer.scheduleAtFixedRate(this::tickSafely, interval, interval, TimeUnit.SECONDS);
        log.info("Heartbeat every {}s", interval);
    }

    public synchronized void stop() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }

    /**
     * One heartbeat round. Returns the number of agents that received the check.
     */
    public int tick() {
        int delivered = 0;
        for (WorkerStatus status : supervisor.status()) {
            if (status.getState() != WorkerState.RUNNING) {
                log.debug("[{}] heartbeat skipped, agent is {}", status.getAgentId(), status.getState());
                continue;
            }
            if (supervisor.tryRoute(status.getAgentId(), new InboundMessage.HeartbeatCheck())) {
                delivered++;
            } else {
                log.warn("[{}] heartbeat dropped", status.getAgentId());
            }
        }
        return delivered;
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception would cancel the fixed-rate schedule
            log.error("Heartbeat tick failed: {}", e.getMessage(), e);
        }
    }
}
