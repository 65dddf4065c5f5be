package io.requeue.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UtcTimestampsTest {

    @Test
    void zoneLessValueIsUtc() {
        assertEquals(Instant.parse("2024-03-10T12:30:00Z"), UtcTimestamps.parse("2024-03-10T12:30:00"));
    }

    @Test
    void fractionalSecondsKept() {
        assertEquals(Instant.parse("2024-03-10T12:30:00.125Z"), UtcTimestamps.parse("2024-03-10T12:30:00.125"));
    }

    @Test
    void explicitOffsetsApplied() {
        assertEquals(Instant.parse("2024-03-10T12:30:00Z"), UtcTimestamps.parse("2024-03-10T12:30:00Z"));
        assertEquals(Instant.parse("2024-03-10T10:30:00Z"), UtcTimestamps.parse("2024-03-10T12:30:00+02:00"));
    }

    @Test
    void surroundingWhitespaceTolerated() {
        assertEquals(Instant.parse("2024-03-10T12:30:00Z"), UtcTimestamps.parse(" 2024-03-10T12:30:00 "));
    }

    @Test
    void garbageRejected() {
        assertThrows(IllegalArgumentException.class, () -> UtcTimestamps.parse("2024-13-45"));
        assertThrows(NullPointerException.class, () -> UtcTimestamps.parse(null));
    }

    @Test
    void formatsAsIsoInstant() {
        assertEquals("2024-03-10T12:30:00Z", UtcTimestamps.format(Instant.parse("2024-03-10T12:30:00Z")));
    }
}
