package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HeartbeatSettings {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int intervalSeconds = 300;
}
