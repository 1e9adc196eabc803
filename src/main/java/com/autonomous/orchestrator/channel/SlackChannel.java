package com.autonomous.orchestrator.channel;

import com.autonomous.orchestrator.exception.ChannelSendFailedException;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

@Service
public class SlackChannel implements ChatChannel {

    public static final String SOURCE = "slack";

    private static final Pattern LEADING_MENTION = Pattern.compile("^\\s*<@[A-Z0-9]+>\\s*");
    private static final int SEEN_EVENTS = 1000;

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack = Slack.getInstance();

    // Slack delivers a mention as both app_mention and message, and retries slow acks
    private final Set<String> seenMessages = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > SEEN_EVENTS;
        }
    });

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    @Override
    public String getSource() {
        return SOURCE;
    }

    /**
     * Extracts a user message from an Events API payload. Bot messages, edits and repeated
     * deliveries of the same message yield nothing.
     */
    public Optional<ChannelEvent> toChannelEvent(Map<String, Object> payload) {
        Object raw = payload.get("event");
        if (!(raw instanceof Map)) {
            return Optional.empty();
        }
        Map<String, Object> event = (Map<String, Object>) raw;
        String type = (String) event.get("type");
        if (!"app_mention".equals(type) && !"message".equals(type)) {
            return Optional.empty();
        }
        if (event.get("bot_id") != null || event.get("subtype") != null) {
            return Optional.empty();
        }

        String text = (String) event.get("text");
        String channel = (String) event.get("channel");
        String user = (String) event.get("user");
        String ts = (String) event.get("ts");
        if (text == null || channel == null) {
            return Optional.empty();
        }
        if (ts != null && !markSeen(channel + ":" + ts)) {
            return Optional.empty();
        }
        return Optional.of(new ChannelEvent(SOURCE, channel, user, LEADING_MENTION.matcher(text).replaceFirst("")));
    }

    @Override
    public void send(String chatId, String text) {
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(chatId)
                .text(text)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                throw new ChannelSendFailedException(SOURCE, chatId, response.getError());
            }
        } catch (IOException | SlackApiException e) {
            throw new ChannelSendFailedException(SOURCE, chatId, e);
        }
    }

    private synchronized boolean markSeen(String key) {
        return seenMessages.add(key);
    }
}
