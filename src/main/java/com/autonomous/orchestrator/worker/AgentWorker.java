package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.config.LlmSettings;
import com.autonomous.orchestrator.context.CompressionResult;
import com.autonomous.orchestrator.context.ContextCompressor;
import com.autonomous.orchestrator.context.Transcript;
import com.autonomous.orchestrator.exception.CompressionFailedException;
import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.llm.Completion;
import com.autonomous.orchestrator.llm.CompletionRequest;
import com.autonomous.orchestrator.llm.ProviderFactory;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.ChannelBinding;
import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.TaskItem;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.protocol.OutboundMessage;
import com.autonomous.orchestrator.sandbox.SandboxEnforcer;
import com.autonomous.orchestrator.service.TokenLedgerService;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

/**
 * Runs one agent: takes inbox messages strictly in order, drives the model and its tools, and
 * puts replies on the outbox. Owns its transcript, workspace and sandbox; shares nothing
 * mutable with other workers.
 */
@Slf4j
public class AgentWorker implements Worker {

    static final String HEARTBEAT_SOURCE = "heartbeat";

    private final AgentConfig config;
    private final Mailbox inbox;
    private final BlockingQueue<OutboundMessage> outbox;
    private final AgentWorkspace workspace;
    private final WorkerTools tools;
    private final SandboxEnforcer sandbox;
    private final ContextCompressor compressor;
    private final ProviderFactory providers;
    private final TokenLedgerService ledger;
    private final LlmSettings llmSettings;
    private final int maxContextTokens;

    @Getter
    private final Transcript transcript = new Transcript();
    @Getter
    private volatile String model;

    private long sessionRequests;
    private long sessionPromptTokens;
    private long sessionCompletionTokens;
    private double sessionCostUsd;

    @Builder
    AgentWorker(AgentConfig config, Mailbox inbox, BlockingQueue<OutboundMessage> outbox, AgentWorkspace workspace,
                SandboxEnforcer sandbox, boolean shellEnabled, ContextCompressor compressor, ProviderFactory providers,
                TokenLedgerService ledger, LlmSettings llmSettings, int maxContextTokens) {
        this.config = config;
        this.inbox = inbox;
        this.outbox = outbox;
        this.workspace = workspace;
        this.sandbox = sandbox;
        this.tools = new WorkerTools(config, workspace, sandbox, shellEnabled);
        this.compressor = compressor;
        this.providers = providers;
        this.ledger = ledger;
        this.llmSettings = llmSettings;
        this.maxContextTokens = maxContextTokens;
        this.model = config.getModel() == null || config.getModel().isBlank()
            ? llmSettings.getDefaultModel() : config.getModel();
    }

    @Override
    public String getAgentId() {
        return config.getId();
    }

    @Override
    public void run() {
        log.info("[{}] worker started (model {}, sandbox {})", config.getId(), model, config.getSandbox().key());
        try {
            while (true) {
                InboundMessage message = inbox.take();
                if (message instanceof InboundMessage.Shutdown) {
                    log.info("[{}] shutdown received, worker exiting", config.getId());
                    return;
                }
                handle(message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] worker interrupted, exiting", config.getId());
        }
    }

    @Override
    public void terminate() {
        sandbox.terminateAll();
    }

    void handle(InboundMessage message) {
        if (message instanceof InboundMessage.UserMessage user) {
            onUserMessage(user);
        } else if (message instanceof InboundMessage.ResetContext) {
            transcript.clear();
            log.info("[{}] context reset", config.getId());
        } else if (message instanceof InboundMessage.SetModel setModel) {
            onSetModel(setModel);
        } else if (message instanceof InboundMessage.GetStats stats) {
            outbox.add(OutboundMessage.StatsReply.builder()
                .requestId(stats.getRequestId())
                .agentId(config.getId())
                .payload(stats())
                .build());
        } else if (message instanceof InboundMessage.HeartbeatCheck) {
            onHeartbeat();
        }
    }

    private void onUserMessage(InboundMessage.UserMessage message) {
        compressBeforeTurn();
        transcript.append(Role.USER, message.getContent());
        String reply;
        try {
            reply = converse();
        } catch (ProviderException e) {
            log.error("[{}] provider call failed: {}", config.getId(), e.getMessage());
            reply = "Error: " + e.getMessage();
        }
        reply(reply, message.getSource(), message.getChatId());
    }

    private void onSetModel(InboundMessage.SetModel message) {
        if (message.getModel() == null || message.getModel().isBlank()) {
            log.warn("[{}] ignoring set_model without a model, keeping {}", config.getId(), model);
            return;
        }
        String previous = model;
        model = message.getModel();
        transcript.append(Role.SYSTEM, "[System] Model switched from " + previous + " to " + model + ".");
        log.info("[{}] model switched {} -> {}", config.getId(), previous, model);
    }

    private void onHeartbeat() {
        List<TaskItem> pending = workspace.pendingTasks();
        if (pending.isEmpty()) {
            log.debug("[{}] heartbeat: no pending tasks", config.getId());
            return;
        }
        StringBuilder reminder = new StringBuilder("[Heartbeat] You have ")
            .append(pending.size()).append(" pending task(s) in task.md:\n");
        for (TaskItem task : pending) {
            reminder.append("- [ ] ").append(task.getDescription()).append("\n");
        }
        reminder.append("Work on them now if you can, and report progress.");

        compressBeforeTurn();
        // sent with the user role so every provider answers it
        transcript.append(Role.USER, reminder.toString());
        String reply;
        try {
            reply = converse();
        } catch (ProviderException e) {
            log.error("[{}] heartbeat completion failed: {}", config.getId(), e.getMessage());
            return;
        }
        Optional<ChannelBinding> home = config.homeChannel();
        if (home.isPresent()) {
            reply(reply, home.get().getSource(), home.get().getChatId());
        } else {
            reply(reply, HEARTBEAT_SOURCE, null);
        }
    }

    private void compressBeforeTurn() {
        try {
            CompressionResult result = compressor.compressIfNeeded(transcript);
            if (result.isCompressed()) {
                log.debug("[{}] transcript now {} turns", config.getId(), transcript.size());
            }
        } catch (CompressionFailedException e) {
            log.warn("[{}] context compression failed, continuing uncompressed: {}", config.getId(), e.getMessage());
        }
    }

    /**
     * Completes the transcript, running tool calls until the model answers with text.
     */
    private String converse() {
        for (int round = 0; round < llmSettings.getMaxToolRounds(); round++) {
            Completion completion = completeWithRetry(CompletionRequest.builder()
                .model(model)
                .systemPrompt(SystemPromptBuilder.build(config, model, workspace))
                .turns(transcript.turns())
                .maxOutputTokens(llmSettings.getMaxOutputTokens())
                .temperature(llmSettings.getTemperature())
                .tools(tools.definitions())
                .build());
            recordUsage(model, completion);

            if (!completion.hasToolCalls()) {
                String text = completion.getText() == null ? "" : completion.getText();
                transcript.appendAssistant(text, List.of());
                return text;
            }
            transcript.appendAssistant(completion.getText(), completion.getToolCalls());
            for (ToolCall call : completion.getToolCalls()) {
                transcript.appendToolResult(call, tools.handle(call));
            }
        }
        String notice = "Stopped after " + llmSettings.getMaxToolRounds() + " tool rounds without a final answer.";
        transcript.appendAssistant(notice, List.of());
        return notice;
    }

    private Completion completeWithRetry(CompletionRequest request) {
        int attempt = 0;
        while (true) {
            try {
                return providers.forModel(request.getModel()).complete(request);
            } catch (ProviderException e) {
                if (!e.isRetryable() || attempt >= llmSettings.getMaxRetries()) {
                    throw e;
                }
                long delay = llmSettings.getRetryBaseMillis() * (1L << attempt);
                attempt++;
                log.warn("[{}] provider error (attempt {}/{}), retrying in {} ms: {}", config.getId(), attempt,
                    llmSettings.getMaxRetries(), delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException("Interrupted while waiting to retry", false, interrupted);
                }
            }
        }
    }

    void recordUsage(String usedModel, Completion completion) {
        double cost = ledger.record(config.getId(), usedModel, completion.getPromptTokens(),
            completion.getCompletionTokens()).getCostUsd();
        sessionRequests++;
        sessionPromptTokens += completion.getPromptTokens();
        sessionCompletionTokens += completion.getCompletionTokens();
        sessionCostUsd += cost;
    }

    Map<String, Object> stats() {
        int tokens = transcript.totalTokens();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", config.getId());
        payload.put("model", model);
        payload.put("sandbox", config.getSandbox().key());
        payload.put("turns", transcript.size());
        payload.put("estimated_tokens", tokens);
        payload.put("max_tokens", maxContextTokens);
        payload.put("usage_ratio", maxContextTokens == 0 ? 0.0 : (double) tokens / maxContextTokens);
        payload.put("compression_count", transcript.compressionCount());
        payload.put("needs_compression", compressor.needsCompression(transcript));
        payload.put("pending_tasks", workspace.pendingTasks().size());
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("requests", sessionRequests);
        session.put("prompt_tokens", sessionPromptTokens);
        session.put("completion_tokens", sessionCompletionTokens);
        session.put("cost_usd", sessionCostUsd);
        payload.put("session", session);
        return payload;
    }

    private void reply(String content, String source, String chatId) {
        outbox.add(OutboundMessage.Reply.builder()
            .agentId(config.getId())
            .content(content)
            .source(source)
            .chatId(chatId)
            .build());
    }
}
