package org.omniroute.gig.engine.domain.service;

import java.util.Objects;

/**
 * Unchecked failure of an allocation operation, tagged with a {@link Reason}.
 */
public final class AllocationException extends RuntimeException {

    /**
     * Failure taxonomy surfaced to callers.
     */
    public enum Reason {
        /** Task, offer or worker does not exist. */
        NOT_FOUND,
        /** Offer no longer pending or task no longer offerable. */
        INVALID_STATE,
        /** Offer belongs to another worker. */
        UNAUTHORIZED,
        /** Offer is past its expiry. */
        EXPIRED,
        /** A collaborator failed before any offer was persisted. */
        COLLABORATOR_FAILURE,
        /** The calling thread was interrupted while waiting on a broadcast. */
        INTERRUPTED
    }

    private final Reason reason;

    public AllocationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public AllocationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason getReason() {
        return reason;
    }

    static AllocationException notFound(String what, Object id) {
        return new AllocationException(Reason.NOT_FOUND, what + " not found: " + id);
    }

    static AllocationException invalidState(String message) {
        return new AllocationException(Reason.INVALID_STATE, message);
    }
}
