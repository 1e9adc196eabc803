package com.autonomous.orchestrator.protocol;

import com.autonomous.orchestrator.exception.InboxFullException;
import com.autonomous.orchestrator.exception.WorkerUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailboxTest {

    @Test
    void shouldDeliverInEnqueueOrder() throws Exception {
        Mailbox mailbox = new Mailbox("a", 10);
        for (int i = 0; i < 5; i++) {
            mailbox.offer(message("m" + i));
        }

        List<String> taken = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            taken.add(((InboundMessage.UserMessage) mailbox.take()).getContent());
        }
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), taken);
    }

    @Test
    void shouldRejectWhenFullWithoutBlocking() {
        Mailbox mailbox = new Mailbox("a", 2);
        mailbox.offer(message("1"));
        mailbox.offer(message("2"));

        assertThrows(InboxFullException.class, () -> mailbox.offer(message("3")));
        assertEquals(2, mailbox.size());
    }

    @Test
    void shutdownShouldBeLastAndRejectLaterOffers() throws Exception {
        Mailbox mailbox = new Mailbox("a", 2);
        mailbox.offer(message("1"));
        mailbox.offer(message("2"));

        // capacity does not apply to shutdown
        assertTrue(mailbox.close());
        assertFalse(mailbox.close());
        assertThrows(WorkerUnavailableException.class, () -> mailbox.offer(message("late")));

        assertInstanceOf(InboundMessage.UserMessage.class, mailbox.take());
        assertInstanceOf(InboundMessage.UserMessage.class, mailbox.take());
        assertInstanceOf(InboundMessage.Shutdown.class, mailbox.take());
        assertEquals(0, mailbox.size());
    }

    @Test
    void offeringShutdownClosesMailbox() {
        Mailbox mailbox = new Mailbox("a", 1);
        mailbox.offer(new InboundMessage.Shutdown());

        assertTrue(mailbox.isClosed());
    }

    private static InboundMessage message(String content) {
        return InboundMessage.UserMessage.builder().content(content).source("cli").chatId("c").build();
    }
}
