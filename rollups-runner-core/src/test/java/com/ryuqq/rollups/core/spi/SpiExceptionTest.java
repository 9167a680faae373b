package com.ryuqq.rollups.core.spi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SPI 예외 (SnapshotStoreException, EventLogException, ComputeSessionException) 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SpiExceptionTest {

    @Test
    void snapshotStoreException_KeepsReasonMessageAndCause() {
        RuntimeException cause = new RuntimeException("io");

        SnapshotStoreException exception =
            new SnapshotStoreException(SnapshotStoreException.Reason.ALLOCATION_FAILED, "disk full", cause);

        assertEquals(SnapshotStoreException.Reason.ALLOCATION_FAILED, exception.getReason());
        assertEquals("disk full", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    void snapshotStoreException_NullReason_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new SnapshotStoreException(null, "x"));
        assertEquals("reason cannot be null", exception.getMessage());
    }

    @Test
    void eventLogException_ToString_IncludesReason() {
        EventLogException exception = new EventLogException(EventLogException.Reason.DUPLICATE_CLAIM, "epoch 3");

        assertEquals("EventLogException[DUPLICATE_CLAIM]: epoch 3", exception.toString());
        assertNull(exception.getCause());
    }

    @Test
    void eventLogException_NullReason_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new EventLogException(null, "x", null));
    }

    @Test
    void computeSessionException_ToString_IncludesReason() {
        ComputeSessionException exception =
            new ComputeSessionException(ComputeSessionException.Reason.CLAIM_NOT_READY, "epoch 2");

        assertEquals("ComputeSessionException[CLAIM_NOT_READY]: epoch 2", exception.toString());
        assertEquals(ComputeSessionException.Reason.CLAIM_NOT_READY, exception.getReason());
    }

    @Test
    void computeSessionException_NullReason_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ComputeSessionException(null, "x"));
    }
}
