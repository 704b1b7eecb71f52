package io.rowguard.sql.policy.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.rowguard.sql.policy.PredicateEvaluationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

import static io.rowguard.sql.commons.ExpressionConstants.*;

/**
 * Value model of the evaluator. Row and claim values are normalized to: {@code String}, {@code Long},
 * {@code BigInteger}, {@code BigDecimal}, {@code Double}, {@code Boolean}, {@code Instant}, {@code LocalDate},
 * {@link Interval}, {@code List} and {@code Map}. Null is SQL NULL.
 */
public final class Values {

    private static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS]");

    private static final Set<String> TRUE_STRINGS = Set.of("t", "true", "y", "yes", "on", "1");
    private static final Set<String> FALSE_STRINGS = Set.of("f", "false", "n", "no", "off", "0");

    private static final Pattern TRAILING_OFFSET = Pattern.compile("([+-])(\\d{2})(?::?(\\d{2}))?$");

    private Values() {
    }

    public static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof BigInteger b && b.bitLength() < 64) {
            return b.longValue();
        }
        if (value instanceof Character || value instanceof UUID || value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof java.sql.Date d) {
            return d.toLocalDate();
        }
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (value instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (value instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Duration d) {
            return Interval.ofMicros(d.toNanos() / 1000);
        }
        if (value instanceof JsonNode node) {
            return fromJson(node);
        }
        return value;
    }

    /**
     * Boolean view of a predicate result; null stays null (UNKNOWN).
     *
     * @throws PredicateEvaluationException if the value is not a boolean
     */
    public static Boolean toBoolean(Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new PredicateEvaluationException("expected a BOOLEAN value but got " + typeName(value) + " " + value);
    }

    /**
     * Three valued equality.
     */
    public static Boolean equal(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Map<?, ?> || left instanceof List<?> || right instanceof Map<?, ?> || right instanceof List<?>) {
            return left.equals(right);
        }
        return compare(left, right) == 0;
    }

    /**
     * Orders two non null values, coercing string literals to the other side's type the way DuckDB
     * casts them implicitly.
     *
     * @throws PredicateEvaluationException if the values are not comparable
     */
    public static int compare(Object left, Object right) {
        left = normalize(left);
        right = normalize(right);
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        if (left instanceof Interval l && right instanceof Interval r) {
            return l.compareTo(r);
        }
        if (isTemporal(left) && isTemporal(right)) {
            if (left instanceof LocalDate l && right instanceof LocalDate r) {
                return l.compareTo(r);
            }
            return toInstant(left).compareTo(toInstant(right));
        }
        if (left instanceof String s) {
            return compare(coerceLiteral(s, right), right);
        }
        if (right instanceof String s) {
            return compare(left, coerceLiteral(s, left));
        }
        throw new PredicateEvaluationException("cannot compare " + typeName(left) + " with " + typeName(right));
    }

    /**
     * Result of a DuckDB comparison type, null when either side is null, except for the distinct forms.
     */
    public static Boolean compare(String comparisonType, Object left, Object right) {
        switch (comparisonType) {
            case COMPARE_TYPE_DISTINCT_FROM -> {
                if (left == null || right == null) {
                    return (left == null) != (right == null);
                }
                return !equal(left, right);
            }
            case COMPARE_TYPE_NOT_DISTINCT_FROM -> {
                if (left == null || right == null) {
                    return left == null && right == null;
                }
                return equal(left, right);
            }
            default -> {
            }
        }
        if (left == null || right == null) {
            return null;
        }
        return switch (comparisonType) {
            case COMPARE_TYPE_EQUAL -> equal(left, right);
            case COMPARE_TYPE_NOTEQUAL -> !equal(left, right);
            case COMPARE_TYPE_LESSTHAN -> compare(left, right) < 0;
            case COMPARE_TYPE_LESSTHANOREQUALTO -> compare(left, right) <= 0;
            case COMPARE_TYPE_GREATERTHAN -> compare(left, right) > 0;
            case COMPARE_TYPE_GREATERTHANOREQUALTO -> compare(left, right) >= 0;
            default -> throw new PredicateEvaluationException("unsupported comparison: " + comparisonType);
        };
    }

    /**
     * Arithmetic operator. Any null operand gives null; division by zero gives null.
     */
    public static Object arithmetic(String operator, Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        left = normalize(left);
        right = normalize(right);
        if (left instanceof Number l && right instanceof Number r) {
            return numeric(operator, l, r);
        }
        switch (operator) {
            case "+" -> {
                if (isTemporal(left) && (right instanceof Interval || right instanceof String)) {
                    return toInterval(right).addTo(toInstant(left));
                }
                if (isTemporal(right) && (left instanceof Interval || left instanceof String)) {
                    return toInterval(left).addTo(toInstant(right));
                }
                if (left instanceof LocalDate d && right instanceof Long n) {
                    return d.plusDays(n);
                }
                if (left instanceof Interval l && right instanceof Interval r) {
                    return l.plus(r);
                }
            }
            case "-" -> {
                if (isTemporal(left) && (right instanceof Interval || right instanceof String)) {
                    return toInterval(right).subtractFrom(toInstant(left));
                }
                if (left instanceof LocalDate l && right instanceof LocalDate r) {
                    return r.until(l, java.time.temporal.ChronoUnit.DAYS);
                }
                if (isTemporal(left) && isTemporal(right)) {
                    return Interval.ofMicros(java.time.temporal.ChronoUnit.MICROS.between(toInstant(right), toInstant(left)));
                }
                if (left instanceof LocalDate d && right instanceof Long n) {
                    return d.minusDays(n);
                }
                if (left instanceof Interval l && right instanceof Interval r) {
                    return l.plus(r.negate());
                }
            }
            case "*" -> {
                if (left instanceof Interval i && right instanceof Number n) {
                    return i.multiply(n.doubleValue());
                }
                if (right instanceof Interval i && left instanceof Number n) {
                    return i.multiply(n.doubleValue());
                }
            }
            case "/" -> {
                if (left instanceof Interval i && right instanceof Number n) {
                    return n.doubleValue() == 0 ? null : i.multiply(1 / n.doubleValue());
                }
            }
            default -> {
            }
        }
        throw new PredicateEvaluationException("operator " + operator + " is not defined for "
                + typeName(left) + " and " + typeName(right));
    }

    public static Object negate(Object value) {
        value = normalize(value);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return Math.negateExact(l);
        }
        if (value instanceof Double d) {
            return -d;
        }
        if (value instanceof BigDecimal b) {
            return b.negate();
        }
        if (value instanceof BigInteger b) {
            return b.negate();
        }
        if (value instanceof Interval i) {
            return i.negate();
        }
        throw new PredicateEvaluationException("cannot negate " + typeName(value));
    }

    /**
     * {@code CAST(value AS type)}.
     *
     * @param typeInfo DuckDB type_info, used for the DECIMAL scale; may be null
     */
    public static Object cast(Object value, String type, JsonNode typeInfo) {
        value = normalize(value);
        if (value == null) {
            return null;
        }
        try {
            switch (type) {
                case TYPE_BOOLEAN -> {
                    if (value instanceof Boolean) {
                        return value;
                    }
                    if (value instanceof Number n) {
                        return toBigDecimal(n).signum() != 0;
                    }
                    if (value instanceof String s) {
                        var lower = s.trim().toLowerCase(Locale.ROOT);
                        if (TRUE_STRINGS.contains(lower)) {
                            return true;
                        }
                        if (FALSE_STRINGS.contains(lower)) {
                            return false;
                        }
                    }
                }
                case TYPE_VARCHAR, "UUID" -> {
                    return toText(value);
                }
                case TYPE_TINYINT, TYPE_SMALLINT, TYPE_INTEGER, TYPE_BIGINT, "UTINYINT", "USMALLINT", "UINTEGER" -> {
                    return checkRange(type, toIntegral(value));
                }
                case TYPE_HUGEINT, "UBIGINT", "UHUGEINT" -> {
                    return normalize(toBigDecimal(numeric(value)).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact());
                }
                case TYPE_DOUBLE, TYPE_FLOAT -> {
                    return numeric(value).doubleValue();
                }
                case TYPE_DECIMAL -> {
                    var decimal = toBigDecimal(numeric(value));
                    if (typeInfo != null && typeInfo.has(FIELD_SCALE)) {
                        decimal = decimal.setScale(typeInfo.get(FIELD_SCALE).asInt(), RoundingMode.HALF_UP);
                    }
                    return decimal;
                }
                case TYPE_INTERVAL -> {
                    return toInterval(value);
                }
                case TYPE_TIMESTAMP, TYPE_TIMESTAMP_TZ, "TIMESTAMP_TZ", "TIMESTAMPTZ", "TIMESTAMP_MS", "TIMESTAMP_S", "TIMESTAMP_NS" -> {
                    return toInstant(value instanceof String s ? parseTimestamp(s) : value);
                }
                case TYPE_DATE -> {
                    if (value instanceof LocalDate) {
                        return value;
                    }
                    if (value instanceof String s) {
                        var t = s.trim();
                        return t.length() == 10 ? LocalDate.parse(t) : LocalDate.ofInstant(parseTimestamp(t), ZoneOffset.UTC);
                    }
                    if (value instanceof Instant i) {
                        return LocalDate.ofInstant(i, ZoneOffset.UTC);
                    }
                }
                case "JSON" -> {
                    return value instanceof String s ? fromJson(objectMapper.readTree(s)) : value;
                }
                default -> throw new PredicateEvaluationException("unsupported cast to " + type);
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException | JsonProcessingException e) {
            throw new PredicateEvaluationException("could not convert " + typeName(value) + " " + value + " to " + type, e);
        }
        throw new PredicateEvaluationException("could not convert " + typeName(value) + " " + value + " to " + type);
    }

    public static String toText(Object value) {
        value = normalize(value);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof BigDecimal b) {
            return b.toPlainString();
        }
        if (value instanceof Instant i) {
            return TIMESTAMP_FORMAT.format(i.atOffset(ZoneOffset.UTC)) + "+00";
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new PredicateEvaluationException("could not convert value to JSON text", e);
            }
        }
        return value.toString();
    }

    /**
     * SQL LIKE with {@code %} and {@code _} wildcards.
     */
    public static Boolean like(Object value, Object pattern, boolean caseInsensitive) {
        if (value == null || pattern == null) {
            return null;
        }
        var regex = new StringBuilder();
        for (char c : toText(pattern).toCharArray()) {
            switch (c) {
                case '%' -> regex.append(".*");
                case '_' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        int flags = Pattern.DOTALL | (caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
        return Pattern.compile(regex.toString(), flags).matcher(toText(value)).matches();
    }

    /**
     * JSON field or element access, {@code ->} and {@code ->>}.
     */
    public static Object jsonExtract(Object document, Object key, boolean asText) {
        document = normalize(document);
        if (document == null || key == null) {
            return null;
        }
        if (document instanceof String s) {
            document = cast(s, "JSON", null);
        }
        Object result = null;
        if (document instanceof Map<?, ?> map) {
            var path = toText(key);
            if (path.startsWith("$.")) {
                Object current = map;
                for (var part : path.substring(2).split("\\.")) {
                    current = current instanceof Map<?, ?> m ? m.get(part) : null;
                }
                result = current;
            } else {
                result = map.get(path);
            }
        } else if (document instanceof List<?> list && normalize(key) instanceof Long index) {
            int i = (int) (index < 0 ? list.size() + index : index);
            result = i >= 0 && i < list.size() ? list.get(i) : null;
        }
        result = normalize(result);
        return asText ? toText(result) : result;
    }

    public static boolean isTemporal(Object value) {
        return value instanceof Instant || value instanceof LocalDate;
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return TYPE_VARCHAR;
        }
        if (value instanceof Long) {
            return TYPE_BIGINT;
        }
        if (value instanceof BigInteger) {
            return TYPE_HUGEINT;
        }
        if (value instanceof Double) {
            return TYPE_DOUBLE;
        }
        if (value instanceof BigDecimal) {
            return TYPE_DECIMAL;
        }
        if (value instanceof Boolean) {
            return TYPE_BOOLEAN;
        }
        if (value instanceof Instant) {
            return TYPE_TIMESTAMP_TZ;
        }
        if (value instanceof LocalDate) {
            return TYPE_DATE;
        }
        if (value instanceof Interval) {
            return TYPE_INTERVAL;
        }
        if (value instanceof List<?>) {
            return "LIST";
        }
        if (value instanceof Map<?, ?>) {
            return "JSON";
        }
        return value.getClass().getSimpleName();
    }

    static Instant parseTimestamp(String text) {
        var t = text.trim();
        try {
            if (t.length() == 10) {
                return LocalDate.parse(t).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            t = t.replaceFirst(" ", "T").replace(" ", "");
            if (t.endsWith("Z")) {
                return Instant.parse(t);
            }
            var m = TRAILING_OFFSET.matcher(t);
            if (m.find() && m.start() > 10) {
                var minutes = m.group(3) == null ? "00" : m.group(3);
                var iso = t.substring(0, m.start()) + m.group(1) + m.group(2) + ":" + minutes;
                return OffsetDateTime.parse(iso).toInstant();
            }
            return LocalDateTime.parse(t).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new PredicateEvaluationException("invalid timestamp: \"" + text + "\"", e);
        }
    }

    private static Object coerceLiteral(String literal, Object target) {
        if (target instanceof Number) {
            try {
                return normalize(new BigDecimal(literal.trim()));
            } catch (NumberFormatException e) {
                throw new PredicateEvaluationException("could not convert \"" + literal + "\" to a number", e);
            }
        }
        if (target instanceof Boolean) {
            return cast(literal, TYPE_BOOLEAN, null);
        }
        if (target instanceof LocalDate) {
            return cast(literal, TYPE_DATE, null);
        }
        if (target instanceof Instant) {
            return parseTimestamp(literal);
        }
        if (target instanceof Interval) {
            return Interval.parse(literal);
        }
        throw new PredicateEvaluationException("cannot compare " + TYPE_VARCHAR + " with " + typeName(target));
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant i) {
            return i;
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        throw new PredicateEvaluationException("expected a timestamp but got " + typeName(value));
    }

    private static Interval toInterval(Object value) {
        if (value instanceof Interval i) {
            return i;
        }
        if (value instanceof String s) {
            return Interval.parse(s);
        }
        throw new PredicateEvaluationException("expected an interval but got " + typeName(value));
    }

    private static Number numeric(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof String s) {
            return new BigDecimal(s.trim());
        }
        throw new PredicateEvaluationException("expected a number but got " + typeName(value));
    }

    private static long toIntegral(Object value) {
        var n = numeric(value);
        if (n instanceof Long l) {
            return l;
        }
        return toBigDecimal(n).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static Long checkRange(String type, long value) {
        long min;
        long max;
        switch (type) {
            case TYPE_TINYINT -> { min = Byte.MIN_VALUE; max = Byte.MAX_VALUE; }
            case TYPE_SMALLINT -> { min = Short.MIN_VALUE; max = Short.MAX_VALUE; }
            case TYPE_INTEGER -> { min = Integer.MIN_VALUE; max = Integer.MAX_VALUE; }
            case "UTINYINT" -> { min = 0; max = 255; }
            case "USMALLINT" -> { min = 0; max = 65535; }
            case "UINTEGER" -> { min = 0; max = 4294967295L; }
            default -> { min = Long.MIN_VALUE; max = Long.MAX_VALUE; }
        }
        if (value < min || value > max) {
            throw new PredicateEvaluationException("value " + value + " is out of range for " + type);
        }
        return value;
    }

    private static Object numeric(String operator, Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r && !operator.equals("/")) {
            switch (operator) {
                case "+" -> {
                    return Math.addExact(l, r);
                }
                case "-" -> {
                    return Math.subtractExact(l, r);
                }
                case "*" -> {
                    return Math.multiplyExact(l, r);
                }
                case "//" -> {
                    return r == 0 ? null : Math.floorDiv(l, r);
                }
                case "%" -> {
                    return r == 0 ? null : l % r;
                }
                default -> throw new PredicateEvaluationException("unsupported arithmetic operator " + operator);
            }
        }
        if (left instanceof Double || right instanceof Double) {
            double l = left.doubleValue();
            double r = right.doubleValue();
            return switch (operator) {
                case "+" -> l + r;
                case "-" -> l - r;
                case "*" -> l * r;
                case "/" -> r == 0 ? null : l / r;
                case "//" -> r == 0 ? null : Math.floor(l / r);
                case "%" -> r == 0 ? null : l % r;
                default -> throw new PredicateEvaluationException("unsupported arithmetic operator " + operator);
            };
        }
        if (operator.equals("/") && !(left instanceof BigDecimal) && !(right instanceof BigDecimal)) {
            return right.doubleValue() == 0 ? null : left.doubleValue() / right.doubleValue();
        }
        var l = toBigDecimal(left);
        var r = toBigDecimal(right);
        return switch (operator) {
            case "+" -> normalizeDecimal(l.add(r), left, right);
            case "-" -> normalizeDecimal(l.subtract(r), left, right);
            case "*" -> normalizeDecimal(l.multiply(r), left, right);
            case "/" -> r.signum() == 0 ? null : l.divide(r, MathContext.DECIMAL64);
            case "//" -> r.signum() == 0 ? null : normalize(l.divideToIntegralValue(r).toBigInteger());
            case "%" -> r.signum() == 0 ? null : l.remainder(r);
            default -> throw new PredicateEvaluationException("unsupported arithmetic operator " + operator);
        };
    }

    private static Object normalizeDecimal(BigDecimal result, Number left, Number right) {
        if (left instanceof BigDecimal || right instanceof BigDecimal) {
            return result;
        }
        return normalize(result.toBigIntegerExact());
    }

    private static int compareNumbers(Number left, Number right) {
        if ((left instanceof Double d && !Double.isFinite(d)) || (right instanceof Double e && !Double.isFinite(e))) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        if (left instanceof Long l && right instanceof Long r) {
            return Long.compare(l, r);
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal b) {
            return b;
        }
        if (n instanceof BigInteger b) {
            return new BigDecimal(b);
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static Object fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isIntegralNumber()) {
            return normalize(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isArray()) {
            return objectMapper.convertValue(node, new TypeReference<List<Object>>() { });
        }
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() { });
    }
}
