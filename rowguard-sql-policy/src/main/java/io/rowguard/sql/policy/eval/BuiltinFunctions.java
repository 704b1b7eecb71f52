package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PredicateEvaluationException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Allow-listed functions and operators a predicate may call. Anything not listed here, in the
 * {@code auth} schema or among the registered definer functions fails evaluation.
 */
final class BuiltinFunctions {

    @FunctionalInterface
    interface Builtin {
        Object apply(List<Object> args, EvaluationContext context);
    }

    private static final Map<String, Builtin> FUNCTIONS = new HashMap<>();

    // SQL keywords the parser reads as column references when written without parentheses
    private static final Set<String> KEYWORDS = Set.of("current_date", "current_timestamp");

    static {
        // operators
        register("+", 1, 2, (a, c) -> a.size() == 1 ? Values.normalize(a.get(0)) : Values.arithmetic("+", a.get(0), a.get(1)));
        register("-", 1, 2, (a, c) -> a.size() == 1 ? Values.negate(a.get(0)) : Values.arithmetic("-", a.get(0), a.get(1)));
        register("*", 2, 2, (a, c) -> Values.arithmetic("*", a.get(0), a.get(1)));
        register("/", 2, 2, (a, c) -> Values.arithmetic("/", a.get(0), a.get(1)));
        register("//", 2, 2, (a, c) -> Values.arithmetic("//", a.get(0), a.get(1)));
        register("%", 2, 2, (a, c) -> Values.arithmetic("%", a.get(0), a.get(1)));
        register("||", 2, 2, (a, c) -> a.get(0) == null || a.get(1) == null ? null : Values.toText(a.get(0)) + Values.toText(a.get(1)));
        register("~~", 2, 2, (a, c) -> Values.like(a.get(0), a.get(1), false));
        register("!~~", 2, 2, (a, c) -> not(Values.like(a.get(0), a.get(1), false)));
        register("~~*", 2, 2, (a, c) -> Values.like(a.get(0), a.get(1), true));
        register("!~~*", 2, 2, (a, c) -> not(Values.like(a.get(0), a.get(1), true)));
        register("->", 2, 2, (a, c) -> Values.jsonExtract(a.get(0), a.get(1), false));
        register("->>", 2, 2, (a, c) -> Values.jsonExtract(a.get(0), a.get(1), true));
        alias("~~", "like");
        alias("!~~", "not_like");
        alias("~~*", "ilike");
        alias("!~~*", "not_ilike");
        alias("->", "json_extract");
        alias("->>", "json_extract_string");

        // time
        register("now", 0, 0, (a, c) -> c.now());
        alias("now", "current_timestamp");
        alias("now", "get_current_timestamp");
        alias("now", "transaction_timestamp");
        register("current_date", 0, 0, (a, c) -> LocalDate.ofInstant(c.now(), ZoneOffset.UTC));
        alias("current_date", "today");
        register("to_years", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofMonths(Math.multiplyExact(n, 12))));
        register("to_months", 1, 1, (a, c) -> interval(a.get(0), Interval::ofMonths));
        register("to_weeks", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofDays(Math.multiplyExact(n, 7))));
        register("to_days", 1, 1, (a, c) -> interval(a.get(0), Interval::ofDays));
        register("to_hours", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofMicros(Math.multiplyExact(n, Interval.MICROS_PER_HOUR))));
        register("to_minutes", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofMicros(Math.multiplyExact(n, Interval.MICROS_PER_MINUTE))));
        register("to_seconds", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofMicros(Math.multiplyExact(n, Interval.MICROS_PER_SECOND))));
        register("to_milliseconds", 1, 1, (a, c) -> interval(a.get(0), n -> Interval.ofMicros(Math.multiplyExact(n, 1000L))));
        register("to_microseconds", 1, 1, (a, c) -> interval(a.get(0), Interval::ofMicros));

        // strings
        register("lower", 1, 1, (a, c) -> a.get(0) == null ? null : Values.toText(a.get(0)).toLowerCase(Locale.ROOT));
        alias("lower", "lcase");
        register("upper", 1, 1, (a, c) -> a.get(0) == null ? null : Values.toText(a.get(0)).toUpperCase(Locale.ROOT));
        alias("upper", "ucase");
        register("length", 1, 1, (a, c) -> length(a.get(0)));
        alias("length", "len");
        register("trim", 1, 2, (a, c) -> trim(a, true, true));
        register("ltrim", 1, 2, (a, c) -> trim(a, true, false));
        register("rtrim", 1, 2, (a, c) -> trim(a, false, true));
        register("concat", 1, Integer.MAX_VALUE, (a, c) -> {
            var sb = new StringBuilder();
            for (var v : a) {
                if (v != null) {
                    sb.append(Values.toText(v));
                }
            }
            return sb.toString();
        });
        register("starts_with", 2, 2, (a, c) -> strings(a, String::startsWith));
        alias("starts_with", "prefix");
        register("ends_with", 2, 2, (a, c) -> strings(a, String::endsWith));
        alias("ends_with", "suffix");
        register("contains", 2, 2, (a, c) -> a.get(0) instanceof List<?> ? listContains(a) : strings(a, String::contains));
        register("regexp_matches", 2, 2, (a, c) -> regexpMatches(a));

        // lists and misc
        register("list_contains", 2, 2, (a, c) -> listContains(a));
        alias("list_contains", "list_has");
        alias("list_contains", "array_contains");
        alias("list_contains", "array_has");
        register("coalesce", 1, Integer.MAX_VALUE, (a, c) -> {
            for (var v : a) {
                if (v != null) {
                    return v;
                }
            }
            return null;
        });
        register("ifnull", 2, 2, (a, c) -> a.get(0) != null ? a.get(0) : a.get(1));
        register("nullif", 2, 2, (a, c) -> Boolean.TRUE.equals(Values.equal(a.get(0), a.get(1))) ? null : a.get(0));
    }

    private BuiltinFunctions() {
    }

    static boolean isKeyword(String name) {
        return KEYWORDS.contains(name.toLowerCase(Locale.ROOT));
    }

    static boolean isBuiltin(String name) {
        return FUNCTIONS.containsKey(name.toLowerCase(Locale.ROOT));
    }

    static Object call(String name, List<Object> args, EvaluationContext context) {
        var fn = FUNCTIONS.get(name.toLowerCase(Locale.ROOT));
        if (fn == null) {
            throw new PredicateEvaluationException("function " + name + " does not exist or is not allowed in policies");
        }
        try {
            return fn.apply(args, context);
        } catch (ArithmeticException e) {
            throw new PredicateEvaluationException("numeric overflow in " + name, e);
        }
    }

    private static void register(String name, int minArgs, int maxArgs, Builtin builtin) {
        FUNCTIONS.put(name, (args, context) -> {
            if (args.size() < minArgs || args.size() > maxArgs) {
                throw new PredicateEvaluationException("wrong number of arguments for " + name + ": " + args.size());
            }
            return builtin.apply(args, context);
        });
    }

    private static void alias(String existing, String alias) {
        FUNCTIONS.put(alias, FUNCTIONS.get(existing));
    }

    private static Boolean not(Boolean value) {
        return value == null ? null : !value;
    }

    private static Object interval(Object amount, java.util.function.LongFunction<Interval> factory) {
        var value = Values.normalize(amount);
        if (value == null) {
            return null;
        }
        return factory.apply((Long) Values.cast(value, "BIGINT", null));
    }

    private static Object length(Object value) {
        value = Values.normalize(value);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            return (long) list.size();
        }
        var text = Values.toText(value);
        return (long) text.codePointCount(0, text.length());
    }

    private static Object trim(List<Object> args, boolean left, boolean right) {
        if (args.get(0) == null || (args.size() > 1 && args.get(1) == null)) {
            return null;
        }
        var text = Values.toText(args.get(0));
        var chars = args.size() > 1 ? Values.toText(args.get(1)) : " ";
        int start = 0;
        int end = text.length();
        while (left && start < end && chars.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (right && end > start && chars.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }

    private static Object strings(List<Object> args, java.util.function.BiPredicate<String, String> test) {
        if (args.get(0) == null || args.get(1) == null) {
            return null;
        }
        return test.test(Values.toText(args.get(0)), Values.toText(args.get(1)));
    }

    private static Object listContains(List<Object> args) {
        var list = Values.normalize(args.get(0));
        var element = args.get(1);
        if (list == null || element == null) {
            return null;
        }
        if (!(list instanceof List<?> values)) {
            throw new PredicateEvaluationException("expected a LIST but got " + Values.typeName(list));
        }
        for (var v : values) {
            if (Boolean.TRUE.equals(Values.equal(Values.normalize(v), element))) {
                return true;
            }
        }
        return false;
    }

    private static Object regexpMatches(List<Object> args) {
        if (args.get(0) == null || args.get(1) == null) {
            return null;
        }
        try {
            return Pattern.compile(Values.toText(args.get(1))).matcher(Values.toText(args.get(0))).find();
        } catch (PatternSyntaxException e) {
            throw new PredicateEvaluationException("invalid regular expression: " + args.get(1), e);
        }
    }
}
