package com.autonomous.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a conversation transcript.
 */
@Value
@Builder
public class Turn {
    Role role;
    String content;
    int tokenCount;
    @Builder.Default
    Instant timestamp = Instant.now();
    @Builder.Default
    List<ToolCall> toolCalls = List.of();
    // set on TOOL turns only
    String toolCallId;
    String toolName;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
