package com.autonomous.orchestrator.protocol;

import com.autonomous.orchestrator.exception.UnknownMessageTypeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolCodecTest {

    private final ProtocolCodec codec = new ProtocolCodec();

    @Test
    void shouldDecodeUserMessage() {
        InboundMessage message = codec.decodeInbound(
            "{\"type\":\"message\",\"content\":\"hello\",\"source\":\"slack\",\"chat_id\":\"C1\",\"user_id\":\"U1\"}");

        InboundMessage.UserMessage user = assertInstanceOf(InboundMessage.UserMessage.class, message);
        assertEquals("hello", user.getContent());
        assertEquals("C1", user.getChatId());
        assertEquals("U1", user.getUserId());
    }

    @Test
    void shouldDecodeTagOnlyMessages() {
        assertInstanceOf(InboundMessage.ResetContext.class, codec.decodeInbound("{\"type\":\"reset_context\"}"));
        assertInstanceOf(InboundMessage.HeartbeatCheck.class, codec.decodeInbound("{\"type\":\"heartbeat_check\"}"));
        assertInstanceOf(InboundMessage.Shutdown.class, codec.decodeInbound("{\"type\":\"shutdown\"}"));
    }

    @Test
    void shouldRejectUnknownType() {
        UnknownMessageTypeException e = assertThrows(UnknownMessageTypeException.class,
            () -> codec.decodeInbound("{\"type\":\"format_disk\"}"));
        assertTrue(e.getMessage().contains("format_disk"));
    }

    @Test
    void shouldRejectMissingTypeAndUnknownFields() {
        assertThrows(UnknownMessageTypeException.class, () -> codec.decodeInbound("{\"content\":\"hi\"}"));
        assertThrows(UnknownMessageTypeException.class,
            () -> codec.decodeInbound("{\"type\":\"set_model\",\"model\":\"gpt-4o\",\"force\":true}"));
    }

    @Test
    void shouldRejectSetModelWithoutModel() {
        assertThrows(IllegalArgumentException.class, () -> codec.decodeInbound("{\"type\":\"set_model\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> codec.decodeInbound("{\"type\":\"set_model\",\"model\":\" \"}"));
        InboundMessage.SetModel setModel = assertInstanceOf(InboundMessage.SetModel.class,
            codec.decodeInbound("{\"type\":\"set_model\",\"model\":\"gpt-4o\"}"));
        assertEquals("gpt-4o", setModel.getModel());
    }

    @Test
    void shouldEncodeWithTypeTag() {
        String json = codec.encode(OutboundMessage.Reply.builder()
            .agentId("default").content("hi").source("slack").chatId("C1").build());

        assertTrue(json.contains("\"type\":\"reply\""));
        assertTrue(json.contains("\"agent_id\":\"default\""));
        assertTrue(codec.encode(new InboundMessage.ResetContext()).contains("\"type\":\"reset_context\""));
    }
}
