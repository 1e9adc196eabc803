package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.model.UsageRecord;
import com.autonomous.orchestrator.model.UsageSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenLedgerServiceTest {

    private TokenLedgerService ledger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ledger = new TokenLedgerService(DaemonSettings.builder().dataDir(tempDir).build(), ModelCatalog.loadDefault());
    }

    @Test
    void shouldCalculateCostFromCatalogPrices() {
        // gemini-2.5-flash: $0.15/M input, $0.60/M output
        assertEquals(0.00075, ledger.calculateCost("gemini-2.5-flash", 1000, 1000), 0.000001);
        assertEquals(0.0, ledger.calculateCost("unknown-model", 1000, 1000));
    }

    @Test
    void shouldAppendOneLinePerCall() throws Exception {
        UsageRecord recorded = ledger.record("alpha", "gpt-4o", 100, 50);
        ledger.record("beta", "gpt-4o", 10, 5);

        List<String> lines = Files.readAllLines(tempDir.resolve(TokenLedgerService.LEDGER_FILE));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"agent_id\":\"alpha\""));
        assertTrue(recorded.getCostUsd() > 0);
    }

    @Test
    void shouldAggregatePerAgentAndModel() {
        ledger.record("alpha", "gpt-4o", 100, 50);
        ledger.record("alpha", "gemini-2.5-flash", 200, 20);
        ledger.record("beta", "gpt-4o", 1, 1);

        UsageSummary alpha = ledger.usageFor("alpha");
        UsageSummary all = ledger.usageFor(null);

        assertEquals(2, alpha.getRequests());
        assertEquals(300, alpha.getPromptTokens());
        assertEquals(70, alpha.getCompletionTokens());
        assertEquals(2, alpha.getByModel().size());
        assertEquals(3, all.getRequests());
    }

    @Test
    void shouldSkipMalformedLines() throws Exception {
        ledger.record("alpha", "gpt-4o", 100, 50);
        Files.writeString(tempDir.resolve(TokenLedgerService.LEDGER_FILE), "not json\n",
            StandardOpenOption.APPEND);
        ledger.record("alpha", "gpt-4o", 100, 50);

        assertEquals(2, ledger.usageFor("alpha").getRequests());
    }

    @Test
    void concurrentWritersShouldNotLoseEntries() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            String agent = "agent-" + (i % 4);
            pool.execute(() -> ledger.record(agent, "gpt-4o-mini", 10, 10));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(100, ledger.usageFor(null).getRequests());
        assertEquals(25, ledger.usageFor("agent-2").getRequests());
    }

    @Test
    void shouldFormatUsage() {
        ledger.record("alpha", "gpt-4o", 1000, 500);

        String text = ledger.formatUsage("alpha", ledger.usageFor("alpha"));

        assertTrue(text.contains("Token usage (agent: alpha)"));
        assertTrue(text.contains("Requests: 1"));
        assertTrue(text.contains("gpt-4o: 1 calls"));
    }
}
