package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WorkerStatus {
    @JsonProperty("agent_id")
    String agentId;
    WorkerState state;
    @JsonProperty("started_at")
    Instant startedAt;
    @JsonProperty("uptime_seconds")
    long uptimeSeconds;
    @JsonProperty("restart_count")
    int restartCount;
    @JsonProperty("last_crash_at")
    Instant lastCrashAt;
    @JsonProperty("last_crash_reason")
    String lastCrashReason;
    @JsonProperty("inbox_size")
    int inboxSize;
}
