package com.autonomous.orchestrator.channel;

import com.autonomous.orchestrator.exception.ChannelSendFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends replies to whichever channel owns the source. Failures are logged here and never retried.
 */
@Slf4j
@Component
public class ChannelRegistry {

    private final Map<String, ChatChannel> channels = new ConcurrentHashMap<>();

    public ChannelRegistry(List<ChatChannel> channels) {
        channels.forEach(this::register);
    }

    public void register(ChatChannel channel) {
        channels.put(channel.getSource(), channel);
    }

    public Optional<ChatChannel> channel(String source) {
        return Optional.ofNullable(source == null ? null : channels.get(source));
    }

    /**
     * @return true if the channel accepted the text
     */
    public boolean send(String source, String chatId, String text) {
        Optional<ChatChannel> channel = channel(source);
        if (channel.isEmpty()) {
            log.warn("No channel for source '{}', reply to chat {} dropped: {}", source, chatId, abbreviate(text));
            return false;
        }
        try {
            channel.get().send(chatId, text);
            return true;
        } catch (ChannelSendFailedException e) {
            log.error("Reply dropped: {}", e.getMessage());
            return false;
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
