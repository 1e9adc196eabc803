package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SandboxMode {
    NORMAL,
    CONFINED,
    RESTRICTED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SandboxMode fromKey(String key) {
        if (key == null || key.isBlank()) {
            return CONFINED;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sandbox mode: " + key + " (expected normal, confined or restricted)");
        }
    }

    public boolean confinesFilesystem() {
        return this != NORMAL;
    }

    public String describe() {
        return switch (this) {
            case NORMAL -> "No restrictions beyond blocked and dangerous commands.";
            case CONFINED -> "Confined: network allowed, filesystem limited to the workspace, process management denied.";
            case RESTRICTED -> "Restricted: no network, filesystem limited to the workspace, process management denied.";
        };
    }
}
