package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity rollup summarizing a set of findings.
 *
 * <p>{@link #UNKNOWN} is reserved for degraded AI batch results where the
 * service returned no structured payload. Overall scan risk is always one of
 * {@link #SAFE}, {@link #WARNING} or {@link #CRITICAL}.
 *
 * @since 1.0.0
 */
public enum RiskLevel {
    SAFE("safe"),
    WARNING("warning"),
    CRITICAL("critical"),
    UNKNOWN("unknown");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RiskLevel fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.wireName.equals(normalized)) {
                return level;
            }
        }
        return UNKNOWN;
    }
}
