package com.ryuqq.rollups.core.spi;

/**
 * Failure reported by a {@link SnapshotStore} implementation.
 *
 * <p>Every failure carries a {@link Reason} so that callers can tell the kinds apart
 * without parsing messages.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SnapshotStoreException extends RuntimeException {

    /**
     * Failure kinds of {@link SnapshotStore}.
     */
    public enum Reason {
        /** The store cannot be reached or read. */
        STORE_UNAVAILABLE,

        /** No snapshot exists (first run), or nothing was written at a location. */
        NOT_FOUND,

        /** A fresh location could not be allocated. */
        ALLOCATION_FAILED
    }

    private final Reason reason;

    /**
     * Creates an exception without a cause.
     *
     * @param reason failure kind
     * @param message detail message
     * @throws IllegalArgumentException if reason is null
     */
    public SnapshotStoreException(Reason reason, String message) {
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
    public SnapshotStoreException(Reason reason, String message, Throwable cause) {
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
