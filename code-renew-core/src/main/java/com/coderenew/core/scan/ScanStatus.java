package com.coderenew.core.scan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a scan.
 *
 * <p>Allowed transitions: {@code PENDING -> PROCESSING}, {@code PENDING -> FAILED},
 * {@code PROCESSING -> COMPLETED}, {@code PROCESSING -> FAILED}. Terminal states
 * have no outgoing transitions.
 */
public enum ScanStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    ScanStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns true if a scan in this state may move to {@code next}.
     *
     * @param next candidate state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ScanStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
