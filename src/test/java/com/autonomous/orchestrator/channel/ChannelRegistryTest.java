package com.autonomous.orchestrator.channel;

import com.autonomous.orchestrator.exception.ChannelSendFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChannelRegistryTest {

    @Mock
    private ChatChannel slack;
    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        when(slack.getSource()).thenReturn("slack");
        registry = new ChannelRegistry(List.of(slack));
    }

    @Test
    void shouldSendThroughOwningChannel() {
        assertTrue(registry.send("slack", "C1", "hello"));

        verify(slack).send("C1", "hello");
    }

    @Test
    void sendFailureShouldBeReportedNotThrown() {
        doThrow(new ChannelSendFailedException("slack", "C1", "channel_not_found")).when(slack).send("C1", "hello");

        assertFalse(registry.send("slack", "C1", "hello"));
    }

    @Test
    void unknownSourceShouldBeDropped() {
        assertFalse(registry.send("telegram", "42", "hello"));
        assertTrue(registry.channel("telegram").isEmpty());
        assertTrue(registry.channel(null).isEmpty());
    }
}
