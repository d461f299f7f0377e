package com.pluginmarket.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a build record. Transitions only move forward:
 * pending → building → success | failed. Success and failed are terminal.
 */
public enum BuildStatus {

    PENDING,
    BUILDING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * A record may move from pending straight to a terminal state (the builder
     * can fail before it reports progress), but never backwards and never out
     * of a terminal state.
     */
    public boolean canTransitionTo(BuildStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return target.ordinal() > this.ordinal();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BuildStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Build status is required");
        }
        return BuildStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
