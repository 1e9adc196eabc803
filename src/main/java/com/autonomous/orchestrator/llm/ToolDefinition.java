package com.autonomous.orchestrator.llm;

import lombok.Value;

import java.util.Map;

/**
 * A function the model may call; {@code parameters} is a JSON schema object.
 */
@Value
public class ToolDefinition {
    String name;
    String description;
    Map<String, Object> parameters;
}
