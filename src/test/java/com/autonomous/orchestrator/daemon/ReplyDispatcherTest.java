package com.autonomous.orchestrator.daemon;

import com.autonomous.orchestrator.channel.ChannelRegistry;
import com.autonomous.orchestrator.config.SupervisorSettings;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.protocol.OutboundMessage;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.supervisor.WorkerHandle;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import com.autonomous.orchestrator.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReplyDispatcherTest {

    @TempDir
    Path tempDir;

    private WorkerSupervisor supervisor;
    private ChannelRegistry channels;
    private ReplyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        AgentConfigStore configs = new AgentConfigStore();
        configs.setConfigPath(tempDir.toString());
        configs.add(AgentConfig.builder().id("alpha").build());
        configs.add(AgentConfig.builder().id("mute").build());
        supervisor = new WorkerSupervisor(configs, StatsWorker::new,
            SupervisorSettings.builder().stopGracePeriod(Duration.ofSeconds(1)).build());
        supervisor.start("alpha");
        supervisor.start("mute");
        channels = mock(ChannelRegistry.class);
        dispatcher = new ReplyDispatcher(supervisor, channels);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
        supervisor.shutdown();
    }

    @Test
    void repliesShouldGoToTheirChannelInOrder() {
        BlockingQueue<OutboundMessage> outbox = outboxOf("alpha");
        outbox.add(reply("first", "C1"));
        outbox.add(reply("second", "C1"));

        assertEquals(2, dispatcher.dispatch());

        InOrder inOrder = inOrder(channels);
        inOrder.verify(channels).send("slack", "C1", "first");
        inOrder.verify(channels).send("slack", "C1", "second");
    }

    @Test
    void replyWithoutChatShouldOnlyBeLogged() {
        outboxOf("alpha").add(reply("pending task report", null));

        assertEquals(1, dispatcher.dispatch());

        verify(channels, never()).send(anyString(), any(), anyString());
    }

    @Test
    void statsRequestShouldBeAnsweredByWorker() {
        dispatcher.start();

        Map<String, Object> stats = dispatcher.requestStats("alpha", Duration.ofSeconds(5));

        assertEquals(3, stats.get("turns"));
    }

    @Test
    void statsRequestShouldTimeOutWhenWorkerIsSilent() {
        dispatcher.start();

        assertThrows(WorkerUnavailableException.class, () -> dispatcher.requestStats("mute", Duration.ofMillis(200)));
    }

    @Test
    void lateStatsReplyShouldBeIgnored() {
        outboxOf("alpha").add(OutboundMessage.StatsReply.builder().requestId("gone").agentId("alpha").payload(Map.of()).build());

        assertEquals(1, dispatcher.dispatch());

        verifyNoInteractions(channels);
    }

    @Test
    void stopShouldDrainRemainingReplies() {
        outboxOf("alpha").add(reply("last words", "C1"));
        dispatcher.start();

        dispatcher.stop();

        verify(channels).send("slack", "C1", "last words");
    }

    private BlockingQueue<OutboundMessage> outboxOf(String agentId) {
        return supervisor.handles().stream()
            .filter(h -> h.getAgentId().equals(agentId))
            .map(WorkerHandle::getOutbox)
            .findFirst()
            .orElseThrow();
    }

    private static OutboundMessage reply(String content, String chatId) {
        return OutboundMessage.Reply.builder().agentId("alpha").content(content).source("slack").chatId(chatId).build();
    }

    /**
     * Answers stats requests unless it is the "mute" agent; ignores everything else.
     */
    static class StatsWorker implements Worker {
        private final AgentConfig config;
        private final Mailbox inbox;
        private final BlockingQueue<OutboundMessage> outbox;

        StatsWorker(AgentConfig config, Mailbox inbox, BlockingQueue<OutboundMessage> outbox) {
            this.config = config;
            this.inbox = inbox;
            this.outbox = outbox;
        }

        @Override
        public String getAgentId() {
            return config.getId();
        }

        @Override
        public void terminate() {
        }

        @Override
        public void run() {
            try {
                while (true) {
                    InboundMessage message = inbox.take();
                    if (message instanceof InboundMessage.Shutdown) {
                        return;
                    }
                    if (message instanceof InboundMessage.GetStats stats && !"mute".equals(config.getId())) {
                        outbox.add(OutboundMessage.StatsReply.builder()
                            .requestId(stats.getRequestId())
                            .agentId(config.getId())
                            .payload(Map.of("turns", 3))
                            .build());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
