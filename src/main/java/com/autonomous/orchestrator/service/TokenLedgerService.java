package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.model.UsageRecord;
import com.autonomous.orchestrator.model.UsageSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only usage ledger shared by all workers. Each provider call becomes one JSON line;
 * entries are never rewritten.
 */
@Slf4j
public class TokenLedgerService {

    static final String LEDGER_FILE = "token_usage.jsonl";

    private final Path ledgerFile;
    private final ModelCatalog catalog;
    private final ObjectMapper mapper;

    public TokenLedgerService(DaemonSettings settings, ModelCatalog catalog) {
        this.ledgerFile = settings.getDataDir().resolve(LEDGER_FILE);
        this.catalog = catalog;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public double calculateCost(String model, long promptTokens, long completionTokens) {
        return catalog.cost(model, promptTokens, completionTokens);
    }

    public UsageRecord record(String agentId, String model, long promptTokens, long completionTokens) {
        UsageRecord entry = UsageRecord.builder()
            .timestamp(Instant.now())
            .agentId(agentId)
            .model(model)
            .promptTokens(promptTokens)
            .completionTokens(completionTokens)
            .costUsd(calculateCost(model, promptTokens, completionTokens))
            .build();
        persistEntry(entry);
        return entry;
    }

    public UsageSummary usageFor(String agentId) {
        UsageSummary summary = new UsageSummary();
        for (UsageRecord entry : readAll()) {
            if (agentId == null || agentId.equals(entry.getAgentId())) {
                summary.add(entry);
            }
        }
        return summary;
    }

    public String formatUsage(String agentId, UsageSummary usage) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("Token usage (agent: %s)%n", agentId));
        out.append(String.format("  Requests: %d%n", usage.getRequests()));
        out.append(String.format("  Prompt tokens: %,d%n", usage.getPromptTokens()));
        out.append(String.format("  Completion tokens: %,d%n", usage.getCompletionTokens()));
        out.append(String.format("  Total cost: $%.4f", usage.getCostUsd()));
        if (!usage.getByModel().isEmpty()) {
            out.append(String.format("%n  By model:"));
            usage.getByModel().forEach((model, stats) -> out.append(String.format(
                "%n    %s: %d calls, %,d+%,d tokens, $%.4f",
                model, stats.getRequests(), stats.getPromptTokens(), stats.getCompletionTokens(), stats.getCostUsd())));
        }
        return out.toString();
    }

    // one write call per entry under a lock keeps lines whole across concurrent workers
    private synchronized void persistEntry(UsageRecord entry) {
        try {
            Files.createDirectories(ledgerFile.getParent());
            Files.writeString(ledgerFile, mapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to persist usage entry for agent '{}': {}", entry.getAgentId(), e.getMessage());
        }
    }

    private synchronized List<UsageRecord> readAll() {
        if (!Files.exists(ledgerFile)) {
            return List.of();
        }
        try (Stream<String> lines = Files.lines(ledgerFile, StandardCharsets.UTF_8)) {
            return lines.filter(line -> !line.isBlank())
                .map(this::parse)
                .filter(entry -> entry != null)
                .toList();
        } catch (IOException e) {
            log.error("Failed to read usage ledger {}: {}", ledgerFile, e.getMessage());
            return List.of();
        }
    }

    private UsageRecord parse(String line) {
        try {
            return mapper.readValue(line, UsageRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed ledger line: {}", e.getOriginalMessage());
            return null;
        }
    }
}
