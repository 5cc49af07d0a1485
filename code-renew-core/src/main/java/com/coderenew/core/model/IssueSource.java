package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a {@link ScanIssue}.
 */
public enum IssueSource {
    /** Found by the local pattern analyzer. */
    STATIC("static"),

    /** Reported by the generative analysis service. */
    AI("ai");

    private final String wireName;

    IssueSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
