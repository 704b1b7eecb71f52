package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PredicateEvaluationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValuesTest {

    @Test
    void testNormalize() {
        assertEquals(5L, Values.normalize(5));
        assertEquals(5L, Values.normalize((short) 5));
        assertEquals(1.5d, Values.normalize(1.5f));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"),
                Values.normalize(java.sql.Timestamp.from(Instant.parse("2024-01-01T00:00:00Z"))));
        assertNull(Values.normalize(null));
    }

    @Test
    void testNumericEqualityAcrossTypes() {
        assertTrue(Values.equal(1, 1L));
        assertTrue(Values.equal(1L, new BigDecimal("1.00")));
        assertTrue(Values.equal(2.0d, 2L));
        assertNull(Values.equal(null, 1L));
        assertFalse(Values.equal("a", "b"));
    }

    @Test
    void testStringLiteralCoercion() {
        var instant = Instant.parse("2024-01-15T10:00:00Z");
        assertTrue(Values.compare(instant, "2024-01-01") > 0);
        assertEquals(0, Values.compare(LocalDate.parse("2024-01-15"), "2024-01-15"));
        assertEquals(0, Values.compare("42", 42L));
    }

    @Test
    void testIncomparableTypes() {
        assertThrows(PredicateEvaluationException.class, () -> Values.compare(true, LocalDate.parse("2024-01-01")));
        assertThrows(PredicateEvaluationException.class, () -> Values.toBoolean("yes"));
    }

    @Test
    void testArithmetic() {
        assertEquals(7L, Values.arithmetic("+", 3L, 4));
        assertNull(Values.arithmetic("%", 3L, 0L));
        assertNull(Values.arithmetic("+", null, 1L));
        assertEquals(2.5d, Values.arithmetic("/", 5L, 2L));
        assertThrows(ArithmeticException.class, () -> Values.arithmetic("+", Long.MAX_VALUE, 1L));
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"),
                Values.arithmetic("+", Instant.parse("2024-01-01T00:00:00Z"), Interval.ofDays(1)));
        assertEquals(Interval.ofMicros(Interval.MICROS_PER_HOUR),
                Values.arithmetic("-", Instant.parse("2024-01-01T01:00:00Z"), Instant.parse("2024-01-01T00:00:00Z")));
        assertThrows(PredicateEvaluationException.class, () -> Values.arithmetic("*", "a", true));
    }

    @Test
    void testCast() {
        assertEquals(12L, Values.cast("12", "INTEGER", null));
        assertEquals(true, Values.cast("yes", "BOOLEAN", null));
        assertEquals(LocalDate.parse("2024-01-15"), Values.cast(Instant.parse("2024-01-15T22:00:00Z"), "DATE", null));
        assertThrows(PredicateEvaluationException.class, () -> Values.cast("300", "TINYINT", null));
        assertThrows(PredicateEvaluationException.class, () -> Values.cast("abc", "INTEGER", null));
        assertNull(Values.cast(null, "INTEGER", null));
    }

    @Test
    void testLike() {
        assertTrue(Values.like("report.pdf", "%.pdf", false));
        assertTrue(Values.like("a.b", "a_b", false));
        assertFalse(Values.like("axb", "a.b", false));
        assertTrue(Values.like("README", "read%", true));
        assertNull(Values.like(null, "%", false));
    }

    @Test
    void testJsonExtract() {
        var doc = Map.of("org", Map.of("id", 7L), "tags", List.of("a", "b"));
        assertEquals(Map.of("id", 7L), Values.jsonExtract(doc, "org", false));
        assertEquals("7", Values.jsonExtract(Values.jsonExtract(doc, "org", false), "id", true));
        assertEquals(7L, Values.jsonExtract(doc, "$.org.id", false));
        assertEquals("b", Values.jsonExtract(Values.jsonExtract(doc, "tags", false), -1L, true));
        assertEquals("x", Values.jsonExtract("{\"k\": \"x\"}", "k", true));
        assertNull(Values.jsonExtract(doc, "missing", true));
    }
}
