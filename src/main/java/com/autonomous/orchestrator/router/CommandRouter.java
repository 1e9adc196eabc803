package com.autonomous.orchestrator.router;

import com.autonomous.orchestrator.channel.ChannelRegistry;
import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.daemon.ReplyDispatcher;
import com.autonomous.orchestrator.exception.UnknownAgentException;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.ChannelBinding;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.service.TokenLedgerService;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for every chat message. Text starting with {@code /} is a system command handled
 * here and never reaches an agent's conversation; anything else is routed to the agent bound
 * to the chat.
 *
 * <p>{@link #deliver} never blocks the calling listener. Routing is a non-blocking enqueue, and
 * so are the commands that only touch the inbox or the chat binding, e.g. {@code /reset}; those
 * run on the caller's thread so a chat's commands and messages reach the worker in the order
 * they were sent. Commands that wait, replies and error replies run on a small executor.
 */
@Slf4j
@Service
public class CommandRouter {

    static final String HELP_TEXT = String.join("\n",
        "Available commands:",
        "/start - Welcome message",
        "/help - Show this help",
        "/reset - Clear the conversation context",
        "/context - Show context window usage",
        "/restart - Restart this agent",
        "/usage - Show token usage and cost",
        "/status - Show agent status",
        "/model list [provider] - List available models",
        "/model <name> - Switch this agent's model",
        "/agent [id] - Show or switch the agent for this chat");

    private final WorkerSupervisor supervisor;
    private final AgentConfigStore configs;
    private final ReplyDispatcher dispatcher;
    private final ChannelRegistry channels;
    private final TokenLedgerService ledger;
    private final ModelCatalog catalog;
    private final DaemonSettings daemonSettings;
    private final ChatBindings bindings;
    private final ExecutorService executor;

    public CommandRouter(WorkerSupervisor supervisor, AgentConfigStore configs, ReplyDispatcher dispatcher,
                         ChannelRegistry channels, TokenLedgerService ledger, ModelCatalog catalog,
                         DaemonSettings daemonSettings) {
        this.supervisor = supervisor;
        this.configs = configs;
        this.dispatcher = dispatcher;
        this.channels = channels;
        this.ledger = ledger;
        this.catalog = catalog;
        this.daemonSettings = daemonSettings;
        this.bindings = new ChatBindings(configs, daemonSettings.getDefaultAgent());
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "router-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void deliver(String source, String chatId, String userId, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        String agentId = bindings.resolve(source, chatId);
        if (!isAllowed(agentId, source, chatId, userId)) {
            log.warn("Ignoring message from unauthorized user {} on {}:{}", userId, source, chatId);
            return;
        }

        if (SystemCommand.isCommand(text)) {
            if (SystemCommand.parse(text).isBlocking()) {
                executor.execute(() -> channels.send(source, chatId, handleCommand(source, chatId, userId, text)));
            } else {
                replyAsync(source, chatId, handleCommand(source, chatId, userId, text));
            }
            return;
        }

        try {
            supervisor.route(agentId, InboundMessage.UserMessage.builder()
                .content(text)
                .source(source)
                .chatId(chatId)
                .userId(userId)
                .build());
        } catch (UnknownAgentException e) {
            replyAsync(source, chatId, "Agent '" + agentId + "' does not exist. Use /agent to pick another one.");
        } catch (WorkerUnavailableException e) {
            log.warn("Message for {} not delivered: {}", agentId, e.getMessage());
            replyAsync(source, chatId, e.getMessage() + ". Try /restart or /status.");
        }
    }

    /**
     * Runs one system command for the chat and returns the reply text. Blocks while a command
     * waits for its worker, e.g. {@code /context}.
     */
    public String handleCommand(String source, String chatId, String userId, String text) {
        SystemCommand command = SystemCommand.parse(text);
        String agentId = bindings.resolve(source, chatId);
        log.info("Command /{} for agent {} from {}:{}", command.getName(), agentId, source, chatId);
        try {
            return switch (command.getName()) {
                case "start" -> handleStart(agentId);
                case "help" -> HELP_TEXT;
                case "reset" -> handleReset(agentId);
                case "context" -> handleContext(agentId);
                case "restart" -> handleRestart(agentId);
                case "usage" -> ledger.formatUsage(agentId, ledger.usageFor(agentId));
                case "status" -> handleStatus(agentId);
                case "model" -> handleModel(agentId, command);
                case "agent" -> handleAgent(source, chatId, agentId, command);
                default -> "Unknown command: /" + command.getName() + "\n\n" + HELP_TEXT;
            };
        } catch (UnknownAgentException e) {
            return "Agent '" + e.getAgentId() + "' does not exist.";
        } catch (WorkerUnavailableException e) {
            return e.getMessage();
        }
    }

    private String handleStart(String agentId) {
        String name = configs.getConfig(agentId).map(AgentConfig::getName).orElse(agentId);
        return "Hello! I'm " + name + ". Send me a message to get started, or /help for commands.";
    }

    private String handleReset(String agentId) {
        supervisor.route(agentId, new InboundMessage.ResetContext());
        return "Context has been reset.";
    }

    private String handleContext(String agentId) {
        Map<String, Object> stats = dispatcher.requestStats(agentId,
            Duration.ofSeconds(daemonSettings.getStatsTimeoutSeconds()));
        return String.format("Context (agent: %s)%n  Model: %s%n  Turns: %s%n  Tokens: ~%s / %s (%.1f%%)%n"
                + "  Compressions: %s%n  Pending tasks: %s",
            agentId, stats.get("model"), stats.get("turns"), stats.get("estimated_tokens"), stats.get("max_tokens"),
            toDouble(stats.get("usage_ratio")) * 100, stats.get("compression_count"), stats.get("pending_tasks"));
    }

    private String handleRestart(String agentId) {
        WorkerStatus status = supervisor.restart(agentId);
        return "Agent " + agentId + " restarted (" + status.getState().name().toLowerCase() + ").";
    }

    private String handleStatus(String agentId) {
        WorkerStatus status = supervisor.status(agentId);
        StringBuilder out = new StringBuilder();
        out.append("Agent: ").append(agentId).append("\n");
        out.append("State: ").append(status.getState().name().toLowerCase()).append("\n");
        out.append("Uptime: ").append(status.getUptimeSeconds()).append("s\n");
        out.append("Restarts: ").append(status.getRestartCount()).append("\n");
        out.append("Inbox: ").append(status.getInboxSize());
        if (status.getLastCrashAt() != null) {
            out.append("\nLast crash: ").append(status.getLastCrashAt()).append(" (").append(status.getLastCrashReason()).append(")");
        }
        return out.toString();
    }

    private String handleModel(String agentId, SystemCommand command) {
        String arg = command.arg(0);
        if (arg == null) {
            return "Usage: /model list [provider] | /model <name>";
        }
        if ("list".equalsIgnoreCase(arg)) {
            return catalog.format(catalog.list(command.arg(1)));
        }
        supervisor.route(agentId, InboundMessage.SetModel.builder().model(arg).build());
        if (catalog.find(arg).isEmpty()) {
            return "Model switched to " + arg + " (not in the catalog, pricing unknown).";
        }
        return "Model switched to " + arg + ".";
    }

    private String handleAgent(String source, String chatId, String currentAgent, SystemCommand command) {
        String target = command.arg(0);
        if (target == null) {
            StringBuilder out = new StringBuilder("Current agent: ").append(currentAgent).append("\nAgents:");
            configs.getAllConfigs().keySet().forEach(id ->
                out.append("\n  ").append(id).append(" (").append(supervisor.stateOf(id).name().toLowerCase()).append(")"));
            return out.toString();
        }
        configs.require(target);
        bindings.bind(source, chatId, target);
        return "This chat now talks to agent " + target + ".";
    }

    private boolean isAllowed(String agentId, String source, String chatId, String userId) {
        Optional<ChannelBinding> binding = configs.getConfig(agentId).flatMap(c -> c.bindingFor(source, chatId));
        return binding.map(b -> b.allowsUser(userId)).orElse(true);
    }

    private void replyAsync(String source, String chatId, String text) {
        executor.execute(() -> channels.send(source, chatId, text));
    }

    private static double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
