package com.autonomous.orchestrator.model;

import lombok.Value;

import java.util.Map;

@Value
public class ToolCall {
    String id;
    String name;
    Map<String, Object> arguments;

    public String stringArgument(String key, String fallback) {
        Object value = arguments == null ? null : arguments.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public boolean booleanArgument(String key) {
        Object value = arguments == null ? null : arguments.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
