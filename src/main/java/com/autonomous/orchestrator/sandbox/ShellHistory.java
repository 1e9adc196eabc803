package com.autonomous.orchestrator.sandbox;

import com.autonomous.orchestrator.config.ShellSettings;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-agent shell history, one JSON object per line. Bounded by entry count and file
 * size; the oldest entries are rotated out first.
 */
@Slf4j
public class ShellHistory {

    private final Path file;
    private final ShellSettings settings;
    private final ObjectMapper mapper;
    private int entryCount = -1;

    public ShellHistory(Path file, ShellSettings settings) {
        this.file = file;
        this.settings = settings;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public synchronized void record(String command, Integer exitCode, String status, String output) {
        Entry entry = Entry.builder()
            .timestamp(Instant.now())
            .command(command)
            .exitCode(exitCode)
            .status(status)
            .output(settings.isHistoryRecordOutput() ? truncate(output, settings.getHistoryOutputMaxChars()) : null)
            .build();
        try {
            Files.createDirectories(file.getParent());
            if (entryCount < 0) {
                entryCount = Files.exists(file) ? readLines().size() : 0;
            }
            Files.writeString(file, mapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            entryCount++;
            if (entryCount > settings.getHistoryMaxEntries() || Files.size(file) > settings.getHistoryMaxFileBytes()) {
                rotate();
            }
        } catch (IOException e) {
            log.warn("Failed to record shell history in {}: {}", file, e.getMessage());
        }
    }

    public synchronized List<Entry> entries() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>();
        for (String line : readLines()) {
            entries.add(mapper.readValue(line, Entry.class));
        }
        return entries;
    }

    private void rotate() throws IOException {
        List<String> lines = readLines();
        long size = 0;
        int keepFrom = lines.size();
        // walk back from the newest entry while both bounds hold; always keep the newest
        for (int i = lines.size() - 1; i >= 0; i--) {
            long lineBytes = lines.get(i).getBytes(StandardCharsets.UTF_8).length + 1L;
            int kept = lines.size() - i;
            if (keepFrom < lines.size()
                && (kept > settings.getHistoryMaxEntries() || size + lineBytes > settings.getHistoryMaxFileBytes())) {
                break;
            }
            size += lineBytes;
            keepFrom = i;
        }
        List<String> kept = lines.subList(keepFrom, lines.size());
        Files.write(file, kept, StandardCharsets.UTF_8);
        log.debug("Rotated shell history {}: dropped {} oldest entries", file, keepFrom);
        entryCount = kept.size();
    }

    private List<String> readLines() throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return null;
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private Instant timestamp;
        private String command;
        @JsonProperty("exit_code")
        private Integer exitCode;
        private String status;
        private String output;
    }
}
