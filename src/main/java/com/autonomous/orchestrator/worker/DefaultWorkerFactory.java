package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.config.ContextSettings;
import com.autonomous.orchestrator.config.LlmSettings;
import com.autonomous.orchestrator.config.ShellSettings;
import com.autonomous.orchestrator.context.ContextCompressor;
import com.autonomous.orchestrator.context.LlmSummarizer;
import com.autonomous.orchestrator.llm.ProviderFactory;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.protocol.OutboundMessage;
import com.autonomous.orchestrator.sandbox.SandboxEnforcer;
import com.autonomous.orchestrator.sandbox.ShellHistory;
import com.autonomous.orchestrator.service.TokenLedgerService;

import java.util.concurrent.BlockingQueue;

/**
 * Builds a fresh {@link AgentWorker} per incarnation: workspace files are created if missing,
 * the transcript starts empty.
 */
public class DefaultWorkerFactory implements WorkerFactory {

    private final ShellSettings shellSettings;
    private final ContextSettings contextSettings;
    private final LlmSettings llmSettings;
    private final ProviderFactory providers;
    private final TokenLedgerService ledger;

    public DefaultWorkerFactory(ShellSettings shellSettings, ContextSettings contextSettings, LlmSettings llmSettings,
                                ProviderFactory providers, TokenLedgerService ledger) {
        this.shellSettings = shellSettings;
        this.contextSettings = contextSettings;
        this.llmSettings = llmSettings;
        this.providers = providers;
        this.ledger = ledger;
    }

    @Override
    public Worker create(AgentConfig config, Mailbox inbox, BlockingQueue<OutboundMessage> outbox) {
        AgentWorkspace workspace = new AgentWorkspace(config.workspacePath());
        workspace.initialize(config);

        ShellHistory history = new ShellHistory(workspace.shellHistoryFile(), shellSettings);
        SandboxEnforcer sandbox = new SandboxEnforcer(config.getSandbox(), workspace.getRoot(), shellSettings, history);
        LlmSummarizer summarizer = new LlmSummarizer(providers, contextSettings, (model, completion) ->
            ledger.record(config.getId(), model, completion.getPromptTokens(), completion.getCompletionTokens()));

        return AgentWorker.builder()
            .config(config)
            .inbox(inbox)
            .outbox(outbox)
            .workspace(workspace)
            .sandbox(sandbox)
            .shellEnabled(shellSettings.isEnabled())
            .compressor(new ContextCompressor(contextSettings, summarizer))
            .providers(providers)
            .ledger(ledger)
            .llmSettings(llmSettings)
            .maxContextTokens(contextSettings.getMaxTokens())
            .build();
    }
}
