package com.autonomous.orchestrator.channel;

import com.autonomous.orchestrator.exception.ChannelSendFailedException;

/**
 * Outbound side of a chat integration, keyed by its source name.
 */
public interface ChatChannel {

    String getSource();

    /**
     * @throws ChannelSendFailedException if the channel rejected or could not deliver the text
     */
    void send(String chatId, String text);
}
