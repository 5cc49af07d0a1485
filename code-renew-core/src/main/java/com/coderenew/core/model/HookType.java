package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * WordPress hook registration kind.
 */
public enum HookType {
    /** Registered via {@code add_action()}. */
    ACTION("action"),

    /** Registered via {@code add_filter()}. */
    FILTER("filter");

    private final String wireName;

    HookType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
