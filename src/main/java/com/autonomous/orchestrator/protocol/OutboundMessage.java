package com.autonomous.orchestrator.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OutboundMessage.Reply.class, name = "reply"),
    @JsonSubTypes.Type(value = OutboundMessage.StatsReply.class, name = "stats_reply")
})
public sealed interface OutboundMessage permits OutboundMessage.Reply, OutboundMessage.StatsReply {

    @Value
    @Builder
    @Jacksonized
    class Reply implements OutboundMessage {
        @JsonProperty("agent_id")
        String agentId;
        String content;
        String source;
        @JsonProperty("chat_id")
        String chatId;
    }

    @Value
    @Builder
    @Jacksonized
    class StatsReply implements OutboundMessage {
        @JsonProperty("request_id")
        String requestId;
        @JsonProperty("agent_id")
        String agentId;
        Map<String, Object> payload;
    }
}
