package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class ChannelSendFailedException extends OrchestratorException {

    private final String source;
    private final String chatId;

    public ChannelSendFailedException(String source, String chatId, String reason) {
        super("Failed to send reply to " + source + ":" + chatId + ": " + reason);
        this.source = source;
        this.chatId = chatId;
    }

    public ChannelSendFailedException(String source, String chatId, Throwable cause) {
        super("Failed to send reply to " + source + ":" + chatId + ": " + cause.getMessage(), cause);
        this.source = source;
        this.chatId = chatId;
    }
}
