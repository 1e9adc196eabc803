package com.autonomous.orchestrator.supervisor;

import com.autonomous.orchestrator.config.SupervisorSettings;
import com.autonomous.orchestrator.exception.DaemonFatalException;
import com.autonomous.orchestrator.exception.UnknownAgentException;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.WorkerState;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.worker.Worker;
import com.autonomous.orchestrator.worker.WorkerFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the lifecycle of every agent worker. Each worker runs on its own thread; a crash
 * in one never touches another.
 *
 * <p>Lifecycle operations for the same agent are serialized by a per-agent lock. Routing
 * takes no lock and never blocks: it either enqueues or fails immediately.
 */
@Slf4j
public class WorkerSupervisor {

    private final AgentConfigStore configs;
    private final WorkerFactory factory;
    private final SupervisorSettings settings;
    private final Map<String, WorkerHandle> handles = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "supervisor");
        thread.setDaemon(true);
        return thread;
    });
    private volatile Consumer<DaemonFatalException> fatalHandler = e -> log.error("Fatal: {}", e.getMessage(), e);

    public WorkerSupervisor(AgentConfigStore configs, WorkerFactory factory, SupervisorSettings settings) {
        this.configs = configs;
        this.factory = factory;
        this.settings = settings;
    }

    public void setFatalHandler(Consumer<DaemonFatalException> fatalHandler) {
        this.fatalHandler = fatalHandler;
    }

    /**
     * Starts the agent's worker. A no-op when it is already running; an explicit start also
     * clears the crash history of a degraded agent.
     *
     * @throws UnknownAgentException if no configuration exists for {@code agentId}
     */
    public WorkerStatus start(String agentId) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            AgentConfig config = configs.require(agentId);
            WorkerHandle handle = handles.computeIfAbsent(agentId, id -> new WorkerHandle(id, settings));
            if (handle.getState() == WorkerState.RUNNING || handle.getState() == WorkerState.STARTING) {
                return handle.status();
            }
            handle.restartPolicy.reset();
            launch(handle, config);
            return handle.status();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues shutdown and waits up to the grace period for the worker to exit; after that
     * the worker thread is interrupted and its subprocesses are killed.
     */
    public WorkerStatus stop(String agentId) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            WorkerHandle handle = requireHandle(agentId);
            stopLocked(handle);
            return handle.status();
        } finally {
            lock.unlock();
        }
    }

    public WorkerStatus restart(String agentId) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            AgentConfig config = configs.require(agentId);
            WorkerHandle handle = handles.computeIfAbsent(agentId, id -> new WorkerHandle(id, settings));
            stopLocked(handle);
            handle.restartPolicy.reset();
            handle.incrementRestarts();
            launch(handle, config);
            log.info("[{}] worker restarted (restart #{})", agentId, handle.getRestartCount());
            return handle.status();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the agent if needed and forgets its handle.
     */
    public void remove(String agentId) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            WorkerHandle handle = handles.get(agentId);
            if (handle != null) {
                stopLocked(handle);
                handles.remove(agentId);
            }
        } finally {
            lock.unlock();
        }
        locks.remove(agentId);
    }

    /**
     * Delivers a message to the agent's inbox without blocking.
     *
     * @throws UnknownAgentException      if the agent is neither running nor configured
     * @throws WorkerUnavailableException if the worker is not accepting messages or its inbox is full
     */
    public void route(String agentId, InboundMessage message) {
        WorkerHandle handle = handles.get(agentId);
        if (handle == null) {
            if (configs.getConfig(agentId).isPresent()) {
                throw new WorkerUnavailableException(agentId, "not started");
            }
            throw new UnknownAgentException(agentId);
        }
        WorkerState state = handle.getState();
        Mailbox mailbox = handle.mailbox();
        if (!state.acceptsMessages() || mailbox == null) {
            throw new WorkerUnavailableException(agentId, state.name().toLowerCase(Locale.ROOT));
        }
        mailbox.offer(message);
    }

    /**
     * Like {@link #route} but reports failure as {@code false}; used for periodic, droppable messages.
     */
    public boolean tryRoute(String agentId, InboundMessage message) {
        try {
            route(agentId, message);
            return true;
        } catch (WorkerUnavailableException | UnknownAgentException e) {
            log.debug("[{}] {} not delivered: {}", agentId, message.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /**
     * Starts every configured agent. A failure of one agent is logged and does not stop the others.
     */
    public void startAll() {
        for (String agentId : configs.getAllConfigs().keySet()) {
            try {
                start(agentId);
            } catch (DaemonFatalException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("[{}] failed to start: {}", agentId, e.getMessage(), e);
            }
        }
    }

    public void stopAll() {
        for (String agentId : new ArrayList<>(handles.keySet())) {
            try {
                stop(agentId);
            } catch (RuntimeException e) {
                log.error("[{}] failed to stop cleanly: {}", agentId, e.getMessage(), e);
            }
        }
    }

    public void shutdown() {
        stopAll();
        scheduler.shutdownNow();
    }

    public List<WorkerStatus> status() {
        List<WorkerStatus> statuses = new ArrayList<>();
        for (WorkerHandle handle : handles.values()) {
            statuses.add(handle.status());
        }
        statuses.sort((a, b) -> a.getAgentId().compareTo(b.getAgentId()));
        return statuses;
    }

    public WorkerStatus status(String agentId) {
        return requireHandle(agentId).status();
    }

    public WorkerState stateOf(String agentId) {
        WorkerHandle handle = handles.get(agentId);
        return handle == null ? WorkerState.STOPPED : handle.getState();
    }

    public Collection<WorkerHandle> handles() {
        return List.copyOf(handles.values());
    }

    private void launch(WorkerHandle handle, AgentConfig config) {
        String agentId = handle.getAgentId();
        handle.setState(WorkerState.STARTING);
        Mailbox mailbox = new Mailbox(agentId, settings.getInboxCapacity());
        Worker worker;
        try {
            worker = factory.create(config, mailbox, handle.getOutbox());
        } catch (RuntimeException e) {
            handle.setState(WorkerState.CRASHED);
            handle.recordCrash(Instant.now(), e);
            throw e;
        }

        ExecutorService executor;
        CompletableFuture<Void> completion;
        try {
            executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "agent-" + agentId));
            completion = CompletableFuture.runAsync(worker, executor);
        } catch (OutOfMemoryError e) {
            handle.setState(WorkerState.CRASHED);
            DaemonFatalException fatal = new DaemonFatalException("Cannot create worker thread for agent '" + agentId + "'", e);
            fatalHandler.accept(fatal);
            throw fatal;
        }
        // lets the thread end once the worker returns
        executor.shutdown();

        long generation = handle.beginIncarnation(mailbox, worker);
        handle.executor = executor;
        handle.completion = completion;
        handle.setState(WorkerState.RUNNING);
        // async: the exit callback takes the agent lock, which a concurrent stop may be holding
        completion.whenCompleteAsync((ignored, error) -> onWorkerExit(agentId, generation, error), scheduler);
        log.info("[{}] worker running", agentId);
    }

    private void stopLocked(WorkerHandle handle) {
        WorkerState state = handle.getState();
        handle.stopRequested = true;
        if (state != WorkerState.RUNNING && state != WorkerState.STARTING) {
            // also cancels a pending automatic restart
            handle.generation++;
            handle.setState(WorkerState.STOPPED);
            return;
        }
        Mailbox mailbox = handle.mailbox();
        if (mailbox != null) {
            mailbox.close();
        }
        Duration grace = settings.getStopGracePeriod();
        try {
            handle.completion.get(grace.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[{}] worker stopped", handle.getAgentId());
        } catch (TimeoutException e) {
            log.warn("[{}] worker did not stop within {} ms, forcing termination", handle.getAgentId(), grace.toMillis());
            forceTerminate(handle);
        } catch (ExecutionException e) {
            log.warn("[{}] worker failed while stopping: {}", handle.getAgentId(), e.getCause().toString());
            handle.worker.terminate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceTerminate(handle);
        }
        handle.setState(WorkerState.STOPPED);
    }

    private void forceTerminate(WorkerHandle handle) {
        handle.executor.shutdownNow();
        handle.worker.terminate();
    }

    private void onWorkerExit(String agentId, long generation, Throwable error) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            WorkerHandle handle = handles.get(agentId);
            if (handle == null || handle.generation != generation) {
                return;
            }
            // a shutdown routed straight to the inbox ends the worker like a stop
            boolean shutdownConsumed = error == null && handle.mailbox() != null && handle.mailbox().isClosed();
            if (handle.stopRequested || shutdownConsumed) {
                handle.setState(WorkerState.STOPPED);
                log.info("[{}] worker exited", agentId);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
            Instant now = Instant.now();
            handle.setState(WorkerState.CRASHED);
            handle.recordCrash(now, cause);
            handle.worker.terminate();
            if (handle.mailbox() != null) {
                handle.mailbox().close();
            }
            log.error("[{}] worker crashed: {}", agentId, cause == null ? "exited without shutdown" : cause.toString(), cause);

            if (!handle.restartPolicy.recordCrash(now)) {
                handle.setState(WorkerState.DEGRADED);
                log.error("[{}] crashed {} times within {}, no further automatic restarts", agentId,
                    handle.restartPolicy.crashesInWindow(), settings.getRestartWindow());
                return;
            }
            Duration delay = handle.restartPolicy.nextDelay();
            handle.setState(WorkerState.RESTARTING);
            log.info("[{}] restarting in {} ms", agentId, delay.toMillis());
            scheduler.schedule(() -> autoRestart(agentId, generation), delay.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    private void autoRestart(String agentId, long generation) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            WorkerHandle handle = handles.get(agentId);
            if (handle == null || handle.generation != generation || handle.getState() != WorkerState.RESTARTING) {
                return;
            }
            handle.incrementRestarts();
            launch(handle, configs.require(agentId));
        } catch (DaemonFatalException e) {
            log.error("[{}] automatic restart aborted: {}", agentId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] automatic restart failed: {}", agentId, e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private WorkerHandle requireHandle(String agentId) {
        WorkerHandle handle = handles.get(agentId);
        if (handle == null) {
            if (configs.getConfig(agentId).isPresent()) {
                throw new WorkerUnavailableException(agentId, "not started");
            }
            throw new UnknownAgentException(agentId);
        }
        return handle;
    }

    private ReentrantLock lockFor(String agentId) {
        return locks.computeIfAbsent(agentId, id -> new ReentrantLock());
    }
}
