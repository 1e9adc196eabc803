package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Binds an agent to one chat on one channel source, optionally limited to a set of users.
 */
@Value
@Builder
@Jacksonized
public class ChannelBinding {
    String source;

    @JsonProperty("chat_id")
    String chatId;

    @Singular
    @JsonProperty("allowed_user_ids")
    List<String> allowedUserIds;

    public boolean matches(String source, String chatId) {
        return this.source != null && this.source.equals(source)
            && this.chatId != null && this.chatId.equals(chatId);
    }

    public boolean allowsUser(String userId) {
        return allowedUserIds == null || allowedUserIds.isEmpty() || allowedUserIds.contains(userId);
    }
}
