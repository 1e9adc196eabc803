package com.autonomous.orchestrator.worker;

import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.protocol.Mailbox;
import com.autonomous.orchestrator.protocol.OutboundMessage;

import java.util.concurrent.BlockingQueue;

@FunctionalInterface
public interface WorkerFactory {

    Worker create(AgentConfig config, Mailbox inbox, BlockingQueue<OutboundMessage> outbox);
}
