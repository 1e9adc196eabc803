package com.autonomous.orchestrator.supervisor;

import com.autonomous.orchestrator.config.SupervisorSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Crash bookkeeping of one agent: exponential restart backoff and the crash-loop limit.
 * Not thread-safe; guarded by the supervisor's per-agent lock.
 */
class RestartPolicy {

    private final SupervisorSettings settings;
    private final Deque<Instant> crashes = new ArrayDeque<>();

    RestartPolicy(SupervisorSettings settings) {
        this.settings = settings;
    }

    /**
     * Records a crash at {@code now}.
     *
     * @return true if the agent may still be restarted automatically
     */
    boolean recordCrash(Instant now) {
        crashes.addLast(now);
        Instant windowStart = now.minus(settings.getRestartWindow());
        while (!crashes.isEmpty() && crashes.peekFirst().isBefore(windowStart)) {
            crashes.removeFirst();
        }
        return crashes.size() <= settings.getMaxRestarts();
    }

    /**
     * Delay before the next restart: base doubled per crash in the window, capped at the maximum.
     */
    Duration nextDelay() {
        int exponent = Math.max(0, Math.min(crashes.size() - 1, 30));
        Duration delay = settings.getRestartBackoffBase().multipliedBy(1L << exponent);
        return delay.compareTo(settings.getRestartBackoffMax()) > 0 ? settings.getRestartBackoffMax() : delay;
    }

    int crashesInWindow() {
        return crashes.size();
    }

    void reset() {
        crashes.clear();
    }
}
