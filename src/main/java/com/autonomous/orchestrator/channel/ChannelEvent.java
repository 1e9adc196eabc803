package com.autonomous.orchestrator.channel;

import lombok.Value;

/**
 * A user message received from a chat channel, before routing.
 */
@Value
public class ChannelEvent {
    String source;
    String chatId;
    String userId;
    String text;
}
