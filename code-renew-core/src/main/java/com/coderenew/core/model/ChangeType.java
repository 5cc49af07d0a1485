package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of change a {@link DeprecatedItem} describes.
 *
 * @since 1.0.0
 */
public enum ChangeType {
    DEPRECATED_FUNCTION("deprecated_function"),
    REMOVED_FUNCTION("removed_function"),
    DEPRECATED_HOOK("deprecated_hook"),
    BREAKING_CHANGE("breaking_change"),
    SECURITY_ISSUE("security_issue");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a change type string.
     *
     * <p>Unknown values fall back to {@link #DEPRECATED_FUNCTION}, which is how
     * records from the remote knowledge service with newer change kinds are read.
     *
     * @param value change type string (e.g. "removed_function")
     * @return parsed change type
     */
    @JsonCreator
    public static ChangeType fromString(String value) {
        if (value == null) {
            return DEPRECATED_FUNCTION;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ChangeType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return DEPRECATED_FUNCTION;
    }
}
