package com.autonomous.orchestrator.protocol;

import com.autonomous.orchestrator.exception.InboxFullException;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * FIFO inbox of one worker incarnation. Any number of threads may offer; only the worker takes.
 *
 * <p>Offers never block: a full inbox is rejected with {@link InboxFullException}. Closing the
 * mailbox enqueues the terminal {@link InboundMessage.Shutdown} (capacity does not apply to it)
 * and rejects every later offer, so shutdown is always the last message the worker sees.
 */
public class Mailbox {

    private final String agentId;
    private final int capacity;
    private final LinkedBlockingQueue<InboundMessage> queue = new LinkedBlockingQueue<>();
    private boolean closed;

    public Mailbox(String agentId, int capacity) {
        this.agentId = agentId;
        this.capacity = capacity;
    }

    public synchronized void offer(InboundMessage message) {
        if (message instanceof InboundMessage.Shutdown) {
            close();
            return;
        }
        if (closed) {
            throw new WorkerUnavailableException(agentId, "shutting down");
        }
        if (queue.size() >= capacity) {
            throw new InboxFullException(agentId, capacity);
        }
        queue.add(message);
    }

    /**
     * @return true if this call enqueued the shutdown message
     */
    public synchronized boolean close() {
        if (closed) {
            return false;
        }
        closed = true;
        queue.add(new InboundMessage.Shutdown());
        return true;
    }

    public InboundMessage take() throws InterruptedException {
        return queue.take();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
