package com.autonomous.orchestrator.daemon;

import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.exception.DaemonFatalException;
import com.autonomous.orchestrator.heartbeat.HeartbeatScheduler;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Boot and shutdown sequence. Agents start once the application is ready; on shutdown the
 * heartbeat stops first, then every worker is stopped and the last replies are flushed.
 */
@Slf4j
@Component
public class AgentDaemon {

    private final WorkerSupervisor supervisor;
    private final HeartbeatScheduler heartbeat;
    private final ReplyDispatcher dispatcher;
    private final AgentConfigStore configs;
    private final DaemonSettings settings;
    private final ConfigurableApplicationContext context;
    private volatile boolean running;

    public AgentDaemon(WorkerSupervisor supervisor, HeartbeatScheduler heartbeat, ReplyDispatcher dispatcher,
                       AgentConfigStore configs, DaemonSettings settings, ConfigurableApplicationContext context) {
        this.supervisor = supervisor;
        this.heartbeat = heartbeat;
        this.dispatcher = dispatcher;
        this.configs = configs;
        this.settings = settings;
        this.context = context;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        supervisor.setFatalHandler(this::onFatal);
        writePidFile();
        ensureDefaultAgent();
        dispatcher.start();
        try {
            supervisor.startAll();
        } catch (DaemonFatalException e) {
            onFatal(e);
            return;
        }
        heartbeat.start();
        running = true;
        log.info("Daemon started with {} agent(s)", supervisor.status().size());
    }

    @PreDestroy
    public void stop() {
        log.info("Daemon shutting down");
        running = false;
        heartbeat.stop();
        supervisor.stopAll();
        dispatcher.stop();
        deletePidFile();
    }

    public boolean isRunning() {
        return running;
    }

    private void ensureDefaultAgent() {
        String defaultAgent = settings.getDefaultAgent();
        if (configs.getConfig(defaultAgent).isEmpty()) {
            log.info("Creating default agent '{}'", defaultAgent);
            configs.add(AgentConfig.builder().id(defaultAgent).build());
        }
    }

    private void onFatal(DaemonFatalException e) {
        log.error("Fatal daemon error, shutting down: {}", e.getMessage(), e);
        // exit from another thread: closing the context waits for beans this thread may be inside
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "daemon-exit");
        exit.start();
    }

    private void writePidFile() {
        Path pidFile = settings.getPidFile();
        if (pidFile == null) {
            return;
        }
        try {
            if (pidFile.getParent() != null) {
                Files.createDirectories(pidFile.getParent());
            }
            Files.writeString(pidFile, Long.toString(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot write pid file {}: {}", pidFile, e.getMessage());
        }
    }

    private void deletePidFile() {
        Path pidFile = settings.getPidFile();
        if (pidFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(pidFile);
        } catch (IOException e) {
            log.warn("Cannot delete pid file {}: {}", pidFile, e.getMessage());
        }
    }
}
