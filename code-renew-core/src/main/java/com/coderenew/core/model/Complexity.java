package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rough structural complexity of a source file, derived from its function and class count.
 */
public enum Complexity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    Complexity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Classifies a file by the number of functions and classes it declares.
     *
     * @param declarations function count plus class count
     * @return HIGH above 20, MEDIUM above 10, otherwise LOW
     */
    public static Complexity of(int declarations) {
        if (declarations > 20) {
            return HIGH;
        }
        if (declarations > 10) {
            return MEDIUM;
        }
        return LOW;
    }
}
