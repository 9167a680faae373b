package com.ryuqq.rollups.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventIdTest {

    @Test
    void of_StreamOffset_CreatesEventId() {
        // Given
        String value = "1700000000000-0";

        // When
        EventId eventId = EventId.of(value);

        // Then
        assertEquals(value, eventId.getValue());
        assertFalse(eventId.isInitial());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EventId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EventId.of("  "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EventId.of("1".repeat(256)));
    }

    @Test
    void initial_EqualsZeroOffset() {
        // When
        EventId zero = EventId.of("0");

        // Then
        assertEquals(EventId.INITIAL, zero);
        assertTrue(zero.isInitial());
        assertEquals(EventId.INITIAL.hashCode(), zero.hashCode());
    }

    @Test
    void equals_DifferentValues_NotEqual() {
        assertNotEquals(EventId.of("1-0"), EventId.of("2-0"));
    }

    @Test
    void toString_ReturnsRawValue() {
        assertEquals("5-0", EventId.of("5-0").toString());
    }
}
