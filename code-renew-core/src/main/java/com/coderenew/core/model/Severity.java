package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a deprecation entry or a reported issue.
 *
 * <p>Ordered from most to least severe. {@link #INFO} only appears on issues
 * reported by the analysis service; catalogue entries use the four upper levels.
 *
 * @since 1.0.0
 */
public enum Severity {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    INFO("info");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lowercase name used in JSON payloads and reports.
     *
     * @return wire name (e.g. "critical")
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a severity string leniently.
     *
     * <p>Unknown or blank values map to {@link #MEDIUM}.
     *
     * @param value severity string, case-insensitive
     * @return parsed severity
     */
    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.wireName.equals(normalized)) {
                return severity;
            }
        }
        return MEDIUM;
    }

    /**
     * Returns true if this severity is at least as severe as the given one.
     *
     * @param other severity to compare with
     * @return true if this is equally or more severe
     */
    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}
