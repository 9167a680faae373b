package com.ryuqq.rollups.core.spi;

/**
 * Failure reported by a {@link EventLog} implementation.
 *
 * <p>Every failure carries a {@link Reason} so that callers can tell the kinds apart
 * without parsing messages.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventLogException extends RuntimeException {

    /**
     * Failure kinds of {@link EventLog}.
     */
    public enum Reason {
        /** The requested event does not exist in the log. */
        NOT_FOUND,

        /** The log cannot be reached, or the read was interrupted. */
        LOG_UNAVAILABLE,

        /** A claim for the epoch was already published. */
        DUPLICATE_CLAIM
    }

    private final Reason reason;

    /**
     * Creates an exception without a cause.
     *
     * @param reason failure kind
     * @param message detail message
     * @throws IllegalArgumentException if reason is null
     */
    public EventLogException(Reason reason, String message) {
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
    public EventLogException(Reason reason, String message, Throwable cause) {
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
