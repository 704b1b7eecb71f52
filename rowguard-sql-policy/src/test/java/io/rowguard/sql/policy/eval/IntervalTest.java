package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PredicateEvaluationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class IntervalTest {

    @Test
    void testParseUnits() {
        assertEquals(Interval.ofMicros(24 * Interval.MICROS_PER_HOUR), Interval.parse("24 hours"));
        assertEquals(Interval.ofDays(1), Interval.parse("1 day"));
        assertEquals(new Interval(14, 0, 0), Interval.parse("1 year 2 mons"));
        assertEquals(new Interval(0, 0, 2 * Interval.MICROS_PER_HOUR + 30 * Interval.MICROS_PER_MINUTE),
                Interval.parse("2 hours 30 minutes"));
        assertEquals(new Interval(0, 1, 2 * Interval.MICROS_PER_HOUR), Interval.parse("1 day 02:00:00"));
        assertEquals(Interval.ofDays(-3), Interval.parse("3 days ago"));
    }

    @Test
    void testParseRejectsGarbage() {
        assertThrows(PredicateEvaluationException.class, () -> Interval.parse(""));
        assertThrows(PredicateEvaluationException.class, () -> Interval.parse("3 fortnights"));
        assertThrows(PredicateEvaluationException.class, () -> Interval.parse("yesterday"));
    }

    @Test
    void testCalendarArithmetic() {
        var jan31 = Instant.parse("2024-01-31T00:00:00Z");
        assertEquals(Instant.parse("2024-02-29T00:00:00Z"), Interval.ofMonths(1).addTo(jan31));
        assertEquals(Instant.parse("2024-01-30T00:00:00Z"), Interval.ofDays(1).subtractFrom(jan31));
        assertEquals(Instant.parse("2024-01-30T23:00:00Z"), Interval.parse("1 hour").subtractFrom(jan31));
    }

    @Test
    void testComparisonNormalizesMonths() {
        assertEquals(0, Interval.ofMonths(1).compareTo(Interval.ofDays(30)));
        assertTrue(Interval.ofDays(1).compareTo(Interval.parse("23 hours")) > 0);
        // structurally different even though equal in length
        assertNotEquals(Interval.ofDays(1), Interval.parse("24 hours"));
        assertEquals(0, Interval.ofDays(1).compareTo(Interval.parse("24 hours")));
    }

    @Test
    void testPlusAndMultiply() {
        assertEquals(new Interval(1, 2, 0), Interval.ofMonths(1).plus(Interval.ofDays(2)));
        assertEquals(Interval.ofDays(4), Interval.ofDays(2).multiply(2));
        assertEquals(Interval.ofDays(-2), Interval.ofDays(2).negate());
    }
}
