package io.rowguard.sql.policy.eval;

import io.rowguard.sql.policy.PredicateEvaluationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * DuckDB style interval: months, days and microseconds kept apart, so {@code 1 month} is not
 * {@code 30 days} when added to a timestamp. Ordering normalizes a month to 30 days and a day to 24 hours.
 */
public record Interval(int months, int days, long micros) implements Comparable<Interval> {

    public static final long MICROS_PER_SECOND = 1_000_000L;
    public static final long MICROS_PER_MINUTE = 60 * MICROS_PER_SECOND;
    public static final long MICROS_PER_HOUR = 60 * MICROS_PER_MINUTE;
    public static final long MICROS_PER_DAY = 24 * MICROS_PER_HOUR;

    private static final Pattern NUMBER_UNIT = Pattern.compile("([+-]?\\d+(?:\\.\\d+)?)([a-z]*)");
    private static final Pattern CLOCK = Pattern.compile("([+-]?)(\\d+):(\\d{1,2})(?::(\\d{1,2})(?:\\.(\\d{1,6}))?)?");

    public static Interval ofDays(long days) {
        return new Interval(0, Math.toIntExact(days), 0);
    }

    public static Interval ofMicros(long micros) {
        return new Interval(0, 0, micros);
    }

    public static Interval ofMonths(long months) {
        return new Interval(Math.toIntExact(months), 0, 0);
    }

    /**
     * Parses interval text such as {@code 1 day}, {@code 2 hours 30 minutes}, {@code 1 year 2 mons},
     * {@code 1 day 02:00:00} or {@code 3 days ago}.
     *
     * @throws PredicateEvaluationException if the text is not an interval
     */
    public static Interval parse(String text) {
        var tokens = text.trim().toLowerCase(Locale.ROOT).split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            throw invalid(text);
        }
        long months = 0;
        long days = 0;
        long micros = 0;
        boolean ago = false;
        for (int i = 0; i < tokens.length; i++) {
            var token = tokens[i];
            if (token.equals("ago") && i == tokens.length - 1) {
                ago = true;
                continue;
            }
            var clock = CLOCK.matcher(token);
            if (clock.matches()) {
                long value = Long.parseLong(clock.group(2)) * MICROS_PER_HOUR
                        + Long.parseLong(clock.group(3)) * MICROS_PER_MINUTE;
                if (clock.group(4) != null) {
                    value += Long.parseLong(clock.group(4)) * MICROS_PER_SECOND;
                }
                if (clock.group(5) != null) {
                    value += Long.parseLong((clock.group(5) + "00000").substring(0, 6));
                }
                micros += "-".equals(clock.group(1)) ? -value : value;
                continue;
            }
            var m = NUMBER_UNIT.matcher(token);
            if (!m.matches()) {
                throw invalid(text);
            }
            var amount = new BigDecimal(m.group(1));
            var unit = m.group(2);
            if (unit.isEmpty()) {
                if (i + 1 >= tokens.length) {
                    throw invalid(text);
                }
                unit = tokens[++i];
            }
            switch (unit) {
                case "millennium", "millennia", "millenniums" -> months += amount.multiply(BigDecimal.valueOf(12000)).longValue();
                case "century", "centuries" -> months += amount.multiply(BigDecimal.valueOf(1200)).longValue();
                case "decade", "decades" -> months += amount.multiply(BigDecimal.valueOf(120)).longValue();
                case "y", "yr", "yrs", "year", "years" -> months += amount.multiply(BigDecimal.valueOf(12)).longValue();
                case "mon", "mons", "month", "months" -> months += amount.longValue();
                case "w", "week", "weeks" -> days += amount.multiply(BigDecimal.valueOf(7)).longValue();
                case "d", "day", "days" -> days += amount.longValue();
                case "h", "hr", "hrs", "hour", "hours" -> micros += scale(amount, MICROS_PER_HOUR);
                case "m", "min", "mins", "minute", "minutes" -> micros += scale(amount, MICROS_PER_MINUTE);
                case "s", "sec", "secs", "second", "seconds" -> micros += scale(amount, MICROS_PER_SECOND);
                case "ms", "msec", "msecs", "millisecond", "milliseconds" -> micros += scale(amount, 1000);
                case "us", "usec", "usecs", "microsecond", "microseconds" -> micros += amount.longValue();
                default -> throw invalid(text);
            }
        }
        var result = new Interval(Math.toIntExact(months), Math.toIntExact(days), micros);
        return ago ? result.negate() : result;
    }

    public Interval plus(Interval other) {
        return new Interval(Math.addExact(months, other.months), Math.addExact(days, other.days),
                Math.addExact(micros, other.micros));
    }

    public Interval negate() {
        return new Interval(-months, -days, -micros);
    }

    public Interval multiply(double factor) {
        return new Interval((int) Math.round(months * factor), (int) Math.round(days * factor),
                Math.round(micros * factor));
    }

    public Instant addTo(Instant instant) {
        return instant.atZone(ZoneOffset.UTC)
                .plusMonths(months)
                .plusDays(days)
                .plus(micros, ChronoUnit.MICROS)
                .toInstant();
    }

    public Instant subtractFrom(Instant instant) {
        return negate().addTo(instant);
    }

    /**
     * Length in microseconds with a month counted as 30 days.
     */
    public BigDecimal normalizedMicros() {
        return BigDecimal.valueOf(months).multiply(BigDecimal.valueOf(30 * MICROS_PER_DAY))
                .add(BigDecimal.valueOf(days).multiply(BigDecimal.valueOf(MICROS_PER_DAY)))
                .add(BigDecimal.valueOf(micros));
    }

    @Override
    public int compareTo(Interval o) {
        return normalizedMicros().compareTo(o.normalizedMicros());
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        if (months != 0) {
            int years = months / 12;
            int mons = months % 12;
            if (years != 0) {
                sb.append(years).append(Math.abs(years) == 1 ? " year " : " years ");
            }
            if (mons != 0) {
                sb.append(mons).append(Math.abs(mons) == 1 ? " month " : " months ");
            }
        }
        if (days != 0) {
            sb.append(days).append(Math.abs(days) == 1 ? " day " : " days ");
        }
        if (micros != 0 || sb.length() == 0) {
            long abs = Math.abs(micros);
            sb.append(micros < 0 ? "-" : "")
                    .append(String.format("%02d:%02d:%02d", abs / MICROS_PER_HOUR, (abs % MICROS_PER_HOUR) / MICROS_PER_MINUTE,
                            (abs % MICROS_PER_MINUTE) / MICROS_PER_SECOND));
            if (abs % MICROS_PER_SECOND != 0) {
                sb.append(String.format(".%06d", abs % MICROS_PER_SECOND));
            }
        }
        return sb.toString().trim();
    }

    private static long scale(BigDecimal amount, long unit) {
        return amount.multiply(BigDecimal.valueOf(unit)).longValue();
    }

    private static PredicateEvaluationException invalid(String text) {
        return new PredicateEvaluationException("invalid interval: \"" + text + "\"");
    }
}
