package com.ryuqq.fsmkit.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event Value Object 테스트.
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
class EventTest {

    @Test
    void of_ValidValue_CreatesEvent() {
        // When
        Event event = Event.of("SUBMIT");

        // Then
        assertEquals("SUBMIT", event.getValue());
        assertTrue(event.isValid());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Event.of(null));
    }

    @Test
    void normalize_Idempotent() {
        // Given
        Event event = Event.of("  SUBMIT ");

        // When
        Event once = event.normalize();

        // Then
        assertEquals(Event.of("SUBMIT"), once);
        assertEquals(once, once.normalize());
    }

    @Test
    void isValid_InvalidCharacter_Invalid() {
        // When & Then
        assertFalse(Event.of("BAD@EVENT").isValid());
        assertFalse(Event.of("").isValid());
    }

    @Test
    void isValid_LengthBoundary() {
        // When & Then
        assertTrue(Event.of("e".repeat(64)).isValid());
        assertFalse(Event.of("e".repeat(65)).isValid());
    }
}
