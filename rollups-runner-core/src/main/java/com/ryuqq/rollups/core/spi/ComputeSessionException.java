package com.ryuqq.rollups.core.spi;

/**
 * Failure reported by a {@link ComputeSession} implementation.
 *
 * <p>Every failure carries a {@link Reason} so that callers can tell the kinds apart
 * without parsing messages.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ComputeSessionException extends RuntimeException {

    /**
     * Failure kinds of {@link ComputeSession}.
     */
    public enum Reason {
        /** The compute engine cannot be reached, or no session is active. */
        SESSION_UNREACHABLE,

        /** A session is already running. */
        ALREADY_ACTIVE,

        /** The snapshot cannot be loaded. */
        INVALID_SNAPSHOT,

        /** The input was refused (wrong epoch or index). */
        REJECTED_INPUT,

        /** The epoch could not be closed or its checkpoint written. */
        CHECKPOINT_FAILED,

        /** The epoch has not been finished yet. */
        CLAIM_NOT_READY
    }

    private final Reason reason;

    /**
     * Creates an exception without a cause.
     *
     * @param reason failure kind
     * @param message detail message
     * @throws IllegalArgumentException if reason is null
     */
    public ComputeSessionException(Reason reason, String message) {
        this(reason, message, null);
    }

    /**
     * Creates an exception wrapping a lower-level cause.
     *
     * @param reason failure kind
     * @param message detail message
     * @param cause underlying failure (nullable)
     * @throws IllegalArgumentException if reason is null
     */
    public ComputeSessionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + reason + "]: " + getMessage();
    }
}
