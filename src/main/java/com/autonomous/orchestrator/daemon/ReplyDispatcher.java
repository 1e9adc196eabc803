package com.autonomous.orchestrator.daemon;

import com.autonomous.orchestrator.channel.ChannelRegistry;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.protocol.OutboundMessage;
import com.autonomous.orchestrator.supervisor.WorkerHandle;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains every worker's outbox: replies go to their channel, stats replies complete the
 * request waiting for them.
 */
@Slf4j
public class ReplyDispatcher {

    private static final long POLL_MILLIS = 50;

    private final WorkerSupervisor supervisor;
    private final ChannelRegistry channels;
    private final Map<String, CompletableFuture<Map<String, Object>>> pendingStats = new ConcurrentHashMap<>();
    private ScheduledExecutorService executor;

    public ReplyDispatcher(WorkerSupervisor supervisor, ChannelRegistry channels) {
        this.supervisor = supervisor;
        this.channels = channels;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reply-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::dispatchSafely, POLL_MILLIS, POLL_MILLIS, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops polling after one last drain.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        dispatchSafely();
    }

    /**
     * Asks the worker for its stats and waits for the correlated reply.
     *
     * @throws WorkerUnavailableException if the worker does not answer within {@code timeout}
     */
    public Map<String, Object> requestStats(String agentId, Duration timeout) {
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<Map<String, Object>> future = new CompletableFuture<>();
        pendingStats.put(requestId, future);
        try {
            supervisor.route(agentId, InboundMessage.GetStats.builder().requestId(requestId).build());
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new WorkerUnavailableException(agentId, "no stats reply within " + timeout.getSeconds() + "s");
        } catch (ExecutionException e) {
            throw new WorkerUnavailableException(agentId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException(agentId, "interrupted while waiting for stats");
        } finally {
            pendingStats.remove(requestId);
        }
    }

    /**
     * Drains all outboxes once. Returns the number of messages handled.
     */
    public int dispatch() {
        int handled = 0;
        for (WorkerHandle handle : supervisor.handles()) {
            List<OutboundMessage> drained = new ArrayList<>();
            handle.getOutbox().drainTo(drained);
            for (OutboundMessage message : drained) {
                deliver(message);
                handled++;
            }
        }
        return handled;
    }

    private void dispatchSafely() {
        try {
            dispatch();
        } catch (RuntimeException e) {
            log.error("Reply dispatch failed: {}", e.getMessage(), e);
        }
    }

    private void deliver(OutboundMessage message) {
        if (message instanceof OutboundMessage.Reply reply) {
            if (reply.getChatId() == null) {
                log.info("[{}] reply without chat ({}): {}", reply.getAgentId(), reply.getSource(), reply.getContent());
                return;
            }
            channels.send(reply.getSource(), reply.getChatId(), reply.getContent());
        } else if (message instanceof OutboundMessage.StatsReply stats) {
            CompletableFuture<Map<String, Object>> future = pendingStats.get(stats.getRequestId());
            if (future == null) {
                log.debug("[{}] late stats reply {} ignored", stats.getAgentId(), stats.getRequestId());
                return;
            }
            future.complete(stats.getPayload());
        }
    }
}
