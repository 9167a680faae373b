package com.ryuqq.rollups.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InputMetadata / EpochClaim 검증 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InputMetadataTest {

    @Test
    void constructor_ValidValues_KeepsFields() {
        InputMetadata metadata = new InputMetadata("0xabc", 120, 1_700_000_000L, 3, 1);

        assertEquals("0xabc", metadata.msgSender());
        assertEquals(120, metadata.blockNumber());
        assertEquals(1_700_000_000L, metadata.timestamp());
        assertEquals(3, metadata.epochIndex());
        assertEquals(1, metadata.inputIndex());
    }

    @Test
    void constructor_NullSender_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new InputMetadata(null, 0, 0, 0, 0));
        assertEquals("msgSender cannot be null", exception.getMessage());
    }

    @Test
    void constructor_NegativeBlockNumber_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new InputMetadata("0xabc", -1, 0, 0, 0));
        assertEquals("blockNumber must be non-negative (current: -1)", exception.getMessage());
    }

    @Test
    void constructor_NegativeTimestamp_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InputMetadata("0xabc", 0, -5, 0, 0));
    }

    @Test
    void constructor_NegativeEpochIndex_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InputMetadata("0xabc", 0, 0, -1, 0));
    }

    @Test
    void constructor_NegativeInputIndex_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new InputMetadata("0xabc", 0, 0, 0, -2));
        assertEquals("inputIndex must be non-negative (current: -2)", exception.getMessage());
    }

    @Test
    void epochClaim_NegativeEpoch_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EpochClaim.of(-1, new byte[]{1}));
    }

    @Test
    void epochClaim_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> EpochClaim.of(0, null));
        assertEquals("value cannot be null or empty", exception.getMessage());
    }

    @Test
    void epochClaim_ValueIsCopiedOnCreateAndRead() {
        byte[] source = {1, 2};
        EpochClaim claim = EpochClaim.of(0, source);

        source[0] = 9;
        claim.value()[1] = 9;

        assertArrayEquals(new byte[]{1, 2}, claim.value());
    }
}
