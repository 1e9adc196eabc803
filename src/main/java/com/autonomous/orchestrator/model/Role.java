package com.autonomous.orchestrator.model;

import java.util.Locale;

public enum Role {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
