package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

@Data
public class UsageSummary {
    private long requests;
    private long promptTokens;
    private long completionTokens;
    private double costUsd;
    private Map<String, UsageSummary> byModel = new TreeMap<>();

    public void add(UsageRecord record) {
        accumulate(record);
        byModel.computeIfAbsent(record.getModel() == null ? "unknown" : record.getModel(), k -> new UsageSummary())
            .accumulate(record);
    }

    private void accumulate(UsageRecord record) {
        requests++;
        promptTokens += record.getPromptTokens();
        completionTokens += record.getCompletionTokens();
        costUsd += record.getCostUsd();
    }
}
