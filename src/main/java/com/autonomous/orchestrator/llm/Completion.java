package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.model.ToolCall;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Completion {
    @Builder.Default
    String text = "";
    @Builder.Default
    List<ToolCall> toolCalls = List.of();
    long promptTokens;
    long completionTokens;
    String model;
    String finishReason;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
