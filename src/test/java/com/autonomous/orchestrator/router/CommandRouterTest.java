package com.autonomous.orchestrator.router;

import com.autonomous.orchestrator.channel.ChannelRegistry;
import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.daemon.ReplyDispatcher;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.ChannelBinding;
import com.autonomous.orchestrator.model.WorkerState;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.service.TokenLedgerService;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CommandRouterTest {

    @TempDir
    Path tempDir;

    private WorkerSupervisor supervisor;
    private ReplyDispatcher dispatcher;
    private ChannelRegistry channels;
    private TokenLedgerService ledger;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        AgentConfigStore configs = new AgentConfigStore();
        configs.setConfigPath(tempDir.resolve("agents").toString());
        configs.add(AgentConfig.builder().id("default").name("Turtle").build());
        configs.add(AgentConfig.builder().id("research").name("Owl")
            .channels(List.of(ChannelBinding.builder().source("slack").chatId("C_RESEARCH").allowedUserId("U1").build()))
            .build());

        supervisor = mock(WorkerSupervisor.class);
        dispatcher = mock(ReplyDispatcher.class);
        channels = mock(ChannelRegistry.class);
        DaemonSettings daemonSettings = DaemonSettings.builder().dataDir(tempDir.resolve("data")).build();
        ledger = new TokenLedgerService(daemonSettings, ModelCatalog.loadDefault());
        router = new CommandRouter(supervisor, configs, dispatcher, channels, ledger, ModelCatalog.loadDefault(),
            daemonSettings);
    }

    @AfterEach
    void tearDown() {
        router.shutdown();
    }

    @Test
    void plainMessageShouldGoToDefaultAgent() {
        router.deliver("slack", "C1", "U9", "hello there");

        verify(supervisor).route(eq("default"), argThat(message ->
            message instanceof InboundMessage.UserMessage user
                && user.getContent().equals("hello there")
                && user.getChatId().equals("C1")
                && user.getUserId().equals("U9")));
    }

    @Test
    void boundChatShouldGoToItsAgent() {
        router.deliver("slack", "C_RESEARCH", "U1", "find papers");

        verify(supervisor).route(eq("research"), any(InboundMessage.UserMessage.class));
    }

    @Test
    void userOutsideAllowListShouldBeIgnored() {
        router.deliver("slack", "C_RESEARCH", "U2", "find papers");
        router.deliver("slack", "C_RESEARCH", "U2", "/reset");

        verifyNoInteractions(supervisor);
        verify(channels, after(200).never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void systemCommandShouldBeAnsweredWithoutReachingAgent() {
        router.deliver("slack", "C1", "U9", "/help");

        verify(channels, timeout(2000)).send("slack", "C1", CommandRouter.HELP_TEXT);
        verify(supervisor, never()).route(anyString(), any());
    }

    @Test
    void commandsAndMessagesFromOneChatShouldKeepArrivalOrder() {
        router.deliver("slack", "C1", "U9", "/reset");
        router.deliver("slack", "C1", "U9", "hi again");
        router.deliver("slack", "C1", "U9", "/model gpt-4o");
        router.deliver("slack", "C1", "U9", "/model gemini-2.5-pro");
        router.deliver("slack", "C1", "U9", "/agent research");
        router.deliver("slack", "C1", "U9", "still there?");

        InOrder inOrder = inOrder(supervisor);
        inOrder.verify(supervisor).route(eq("default"), any(InboundMessage.ResetContext.class));
        inOrder.verify(supervisor).route(eq("default"), argThat(message ->
            message instanceof InboundMessage.UserMessage user && user.getContent().equals("hi again")));
        inOrder.verify(supervisor).route(eq("default"), argThat(message ->
            message instanceof InboundMessage.SetModel setModel && setModel.getModel().equals("gpt-4o")));
        inOrder.verify(supervisor).route(eq("default"), argThat(message ->
            message instanceof InboundMessage.SetModel setModel && setModel.getModel().equals("gemini-2.5-pro")));
        inOrder.verify(supervisor).route(eq("research"), argThat(message ->
            message instanceof InboundMessage.UserMessage user && user.getContent().equals("still there?")));
        verify(channels, timeout(2000)).send("slack", "C1", "Context has been reset.");
    }

    @Test
    void unavailableWorkerShouldProduceErrorReply() {
        doThrow(new WorkerUnavailableException("default", "degraded"))
            .when(supervisor).route(eq("default"), any());

        router.deliver("slack", "C1", "U9", "hello");

        verify(channels, timeout(2000)).send(eq("slack"), eq("C1"), contains("Try /restart or /status"));
    }

    @Test
    void agentCommandShouldSwitchChat() {
        assertEquals("This chat now talks to agent research.",
            router.handleCommand("slack", "C1", "U9", "/agent research"));

        router.deliver("slack", "C1", "U9", "hi");

        verify(supervisor).route(eq("research"), any(InboundMessage.UserMessage.class));
        assertEquals("Agent 'ghost' does not exist.", router.handleCommand("slack", "C1", "U9", "/agent ghost"));
    }

    @Test
    void agentCommandWithoutArgumentShouldListAgents() {
        when(supervisor.stateOf("default")).thenReturn(WorkerState.RUNNING);
        when(supervisor.stateOf("research")).thenReturn(WorkerState.DEGRADED);

        String reply = router.handleCommand("slack", "C1", "U9", "/agent");

        assertTrue(reply.startsWith("Current agent: default"));
        assertTrue(reply.contains("research (degraded)"));
    }

    @Test
    void startShouldGreetWithAgentName() {
        assertTrue(router.handleCommand("slack", "C_RESEARCH", "U1", "/start").startsWith("Hello! I'm Owl."));
    }

    @Test
    void resetShouldRouteResetContext() {
        assertEquals("Context has been reset.", router.handleCommand("slack", "C1", "U9", "/reset"));

        verify(supervisor).route(eq("default"), any(InboundMessage.ResetContext.class));
    }

    @Test
    void contextShouldFormatWorkerStats() {
        when(dispatcher.requestStats(eq("default"), any())).thenReturn(Map.of(
            "model", "gpt-4o", "turns", 4, "estimated_tokens", 120, "max_tokens", 200000,
            "usage_ratio", 0.0006, "compression_count", 1, "pending_tasks", 2));

        String reply = router.handleCommand("slack", "C1", "U9", "/context");

        assertTrue(reply.contains("Model: gpt-4o"));
        assertTrue(reply.contains("Turns: 4"));
        assertTrue(reply.contains("Tokens: ~120 / 200000"));
        assertTrue(reply.contains("Pending tasks: 2"));
    }

    @Test
    void contextShouldReportUnavailableWorker() {
        when(dispatcher.requestStats(eq("default"), any()))
            .thenThrow(new WorkerUnavailableException("default", "no stats reply within 10s"));

        assertEquals("Agent 'default' is unavailable: no stats reply within 10s",
            router.handleCommand("slack", "C1", "U9", "/context"));
    }

    @Test
    void restartAndStatusShouldDescribeWorker() {
        WorkerStatus status = WorkerStatus.builder().agentId("default").state(WorkerState.RUNNING)
            .uptimeSeconds(42).restartCount(1).inboxSize(0).build();
        when(supervisor.restart("default")).thenReturn(status);
        when(supervisor.status("default")).thenReturn(status);

        assertEquals("Agent default restarted (running).", router.handleCommand("slack", "C1", "U9", "/restart"));
        String reply = router.handleCommand("slack", "C1", "U9", "/status");
        assertTrue(reply.contains("State: running"));
        assertTrue(reply.contains("Uptime: 42s"));
        assertTrue(reply.contains("Restarts: 1"));
    }

    @Test
    void modelCommandShouldSwitchOrList() {
        assertEquals("Model switched to gpt-4o.", router.handleCommand("slack", "C1", "U9", "/model gpt-4o"));
        assertTrue(router.handleCommand("slack", "C1", "U9", "/model my-local-model").contains("not in the catalog"));
        assertTrue(router.handleCommand("slack", "C1", "U9", "/model list anthropic").startsWith("ANTHROPIC"));
        assertTrue(router.handleCommand("slack", "C1", "U9", "/model").startsWith("Usage:"));

        verify(supervisor).route(eq("default"), argThat(message ->
            message instanceof InboundMessage.SetModel set && set.getModel().equals("gpt-4o")));
    }

    @Test
    void usageShouldReadLedger() {
        ledger.record("default", "gpt-4o", 1000, 100);

        String reply = router.handleCommand("slack", "C1", "U9", "/usage");

        assertTrue(reply.contains("Token usage (agent: default)"));
        assertTrue(reply.contains("Requests: 1"));
    }

    @Test
    void unknownCommandShouldShowHelp() {
        assertEquals("Unknown command: /dance\n\n" + CommandRouter.HELP_TEXT,
            router.handleCommand("slack", "C1", "U9", "/Dance now"));
    }
}
