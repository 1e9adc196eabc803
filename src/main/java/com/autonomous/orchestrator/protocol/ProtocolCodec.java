package com.autonomous.orchestrator.protocol;

import com.autonomous.orchestrator.exception.UnknownMessageTypeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.springframework.stereotype.Component;

/**
 * JSON form of the worker protocol, used by the control API.
 */
@Component
public class ProtocolCodec {

    private final ObjectMapper mapper;

    public ProtocolCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        // tag-only variants such as reset_context have no fields
        this.mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public InboundMessage decodeInbound(String json) {
        InboundMessage message;
        try {
            message = mapper.readValue(json, InboundMessage.class);
        } catch (InvalidTypeIdException e) {
            throw new UnknownMessageTypeException("Unknown inbound message type: " + e.getTypeId(), e);
        } catch (JsonProcessingException e) {
            throw new UnknownMessageTypeException("Malformed inbound message: " + e.getOriginalMessage(), e);
        }
        if (message instanceof InboundMessage.SetModel setModel
            && (setModel.getModel() == null || setModel.getModel().isBlank())) {
            throw new IllegalArgumentException("set_model requires a non-blank model");
        }
        return message;
    }

    public String encode(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }
}
