package com.autonomous.orchestrator.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Messages a worker accepts on its inbox. The set is closed: the JSON codec refuses any
 * {@code type} tag not listed here.
 *
 * <p>{@link Shutdown} is terminal. Once a worker takes it from the inbox it finishes the
 * current turn, flushes its outbox and exits; nothing enqueued after it is ever processed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InboundMessage.UserMessage.class, name = "message"),
    @JsonSubTypes.Type(value = InboundMessage.ResetContext.class, name = "reset_context"),
    @JsonSubTypes.Type(value = InboundMessage.SetModel.class, name = "set_model"),
    @JsonSubTypes.Type(value = InboundMessage.GetStats.class, name = "get_stats"),
    @JsonSubTypes.Type(value = InboundMessage.HeartbeatCheck.class, name = "heartbeat_check"),
    @JsonSubTypes.Type(value = InboundMessage.Shutdown.class, name = "shutdown")
})
public sealed interface InboundMessage permits InboundMessage.UserMessage, InboundMessage.ResetContext,
    InboundMessage.SetModel, InboundMessage.GetStats, InboundMessage.HeartbeatCheck, InboundMessage.Shutdown {

    @Value
    @Builder
    @Jacksonized
    class UserMessage implements InboundMessage {
        String content;
        String source;
        @JsonProperty("chat_id")
        String chatId;
        @JsonProperty("user_id")
        String userId;
    }

    @Value
    class ResetContext implements InboundMessage {
    }

    @Value
    @Builder
    @Jacksonized
    class SetModel implements InboundMessage {
        String model;
    }

    @Value
    @Builder
    @Jacksonized
    class GetStats implements InboundMessage {
        @JsonProperty("request_id")
        String requestId;
    }

    @Value
    class HeartbeatCheck implements InboundMessage {
    }

    @Value
    class Shutdown implements InboundMessage {
    }
}
