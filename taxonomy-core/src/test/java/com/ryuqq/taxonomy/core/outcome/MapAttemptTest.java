package com.ryuqq.taxonomy.core.outcome;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MapAttempt Sealed Interface 테스트.
 *
 * @author Taxonomy Team
 * @since 1.0.0
 */
class MapAttemptTest {

    @Test
    void mapped_ExposesValue() {
        // When
        MapAttempt<String> attempt = MapAttempt.mapped("web");

        // Then
        assertTrue(attempt.isMapped());
        assertInstanceOf(Mapped.class, attempt);
        assertEquals("web", attempt.valueOrNull());
        assertEquals(Optional.of("web"), attempt.toOptional());
    }

    @Test
    void mapped_NullValue_IsStillMapped() {
        MapAttempt<String> attempt = MapAttempt.mapped(null);

        assertTrue(attempt.isMapped());
        assertNull(attempt.valueOrNull());
        assertTrue(attempt.toOptional().isEmpty());
    }

    @Test
    void unmapped_HasNoValue() {
        // Given
        RuntimeException cause = new RuntimeException("boom");

        // When
        MapAttempt<String> attempt = MapAttempt.unmapped("no mapper", cause);

        // Then
        assertFalse(attempt.isMapped());
        assertNull(attempt.valueOrNull());
        assertTrue(attempt.toOptional().isEmpty());
        Unmapped<String> unmapped = assertInstanceOf(Unmapped.class, attempt);
        assertEquals("no mapper", unmapped.reason());
        assertSame(cause, unmapped.cause());
    }

    @Test
    void unmapped_BlankReason_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Unmapped.of(" ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void unmapped_Of_HasNullCause() {
        Unmapped<Object> unmapped = Unmapped.of("skipped");

        assertNull(unmapped.cause());
    }
}
