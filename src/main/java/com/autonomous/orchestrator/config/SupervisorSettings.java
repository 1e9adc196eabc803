package com.autonomous.orchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SupervisorSettings {
    @Builder.Default
    int inboxCapacity = 100;
    @Builder.Default
    Duration stopGracePeriod = Duration.ofSeconds(10);
    @Builder.Default
    Duration restartBackoffBase = Duration.ofSeconds(1);
    @Builder.Default
    Duration restartBackoffMax = Duration.ofSeconds(60);
    @Builder.Default
    int maxRestarts = 5;
    @Builder.Default
    Duration restartWindow = Duration.ofMinutes(5);
}
