package com.coderenew.core.scan;

import java.util.Objects;
import java.util.UUID;

/**
 * Mutable handle on one scan run.
 *
 * <p>Tracks the lifecycle state and lets another thread request cancellation.
 * Cancellation only stops dispatch of further batches; a call already in flight
 * runs to completion.
 *
 * <p>Thread-safe.
 */
public final class ScanSession {

    private final String id;
    private final String versionFrom;
    private final String versionTo;

    private ScanStatus status = ScanStatus.PENDING;
    private String failureReason;
    private volatile boolean cancelled;

    public ScanSession(String id, String versionFrom, String versionTo) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.versionFrom = Objects.requireNonNull(versionFrom, "versionFrom must not be null");
        this.versionTo = Objects.requireNonNull(versionTo, "versionTo must not be null");
    }

    /**
     * Creates a session with a random identifier.
     *
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return new pending session
     */
    public static ScanSession create(String versionFrom, String versionTo) {
        return new ScanSession(UUID.randomUUID().toString(), versionFrom, versionTo);
    }

    public String getId() {
        return id;
    }

    public String getVersionFrom() {
        return versionFrom;
    }

    public String getVersionTo() {
        return versionTo;
    }

    public synchronized ScanStatus getStatus() {
        return status;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    /**
     * Moves the session to another state.
     *
     * @param next target state
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transitionTo(ScanStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal scan transition " + status + " -> " + next + " for " + id);
        }
        status = next;
    }

    /**
     * Moves the session to {@link ScanStatus#FAILED} and records why.
     *
     * @param reason failure description
     * @throws IllegalStateException if the session already reached a terminal state
     */
    public synchronized void fail(String reason) {
        transitionTo(ScanStatus.FAILED);
        failureReason = reason;
    }

    /**
     * Requests that no further batches be dispatched.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
