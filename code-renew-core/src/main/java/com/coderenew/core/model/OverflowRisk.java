package com.coderenew.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Likelihood that a project overflows the per-batch context budget.
 */
public enum OverflowRisk {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    OverflowRisk(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Classifies a token total against the batch ceiling.
     *
     * @param totalTokens estimated tokens for the whole project
     * @param batchCeiling maximum tokens per batch
     * @return HIGH above 10x the ceiling, MEDIUM above 3x, otherwise LOW
     */
    public static OverflowRisk of(long totalTokens, long batchCeiling) {
        if (totalTokens > batchCeiling * 10) {
            return HIGH;
        }
        if (totalTokens > batchCeiling * 3) {
            return MEDIUM;
        }
        return LOW;
    }
}
