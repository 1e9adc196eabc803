package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.model.Turn;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionRequest {
    String model;
    String systemPrompt;
    List<Turn> turns;
    @Builder.Default
    int maxOutputTokens = 8192;
    @Builder.Default
    double temperature = 0.7;
    @Builder.Default
    List<ToolDefinition> tools = List.of();
}
