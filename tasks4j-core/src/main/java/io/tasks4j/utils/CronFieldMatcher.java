package io.tasks4j.utils;

import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Matches integer values against a single cron-field expression.
 * <p>
 * Supported syntax (comma separated list of items):
 * <ul>
 *   <li>{@code *} any value</li>
 *   <li>{@code 5} a single value, or a name when the field defines names (e.g. "mon")</li>
 *   <li>{@code 1-5} an inclusive range</li>
 *   <li>{@code *}{@code /2}, {@code 1-9/2}, {@code 3/2} a stepped range</li>
 * </ul>
 * Used for the fields Quartz cannot express the way jobs declare them: day-of-week with
 * Monday = 0, and ISO week-of-year.
 */
public final class CronFieldMatcher {

    private static final Map<String, Integer> WEEKDAY_NAMES = Map.of(
            "mon", 0,
            "tue", 1,
            "wed", 2,
            "thu", 3,
            "fri", 4,
            "sat", 5,
            "sun", 6
    );

    private final String expression;
    private final BitSet values;

    private CronFieldMatcher(String expression, BitSet values) {
        this.expression = expression;
        this.values = values;
    }

    /**
     * Day-of-week field: {@code 0..6} or {@code mon..sun}, Monday first.
     */
    public static CronFieldMatcher dayOfWeek(String expression) {
        return compile(expression, 0, 6, WEEKDAY_NAMES);
    }

    /**
     * ISO-8601 week-of-year field: {@code 1..53}.
     */
    public static CronFieldMatcher isoWeek(String expression) {
        return compile(expression, 1, 53, Map.of());
    }

    public static CronFieldMatcher compile(String expression, int min, int max, Map<String, Integer> names) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(names, "names must not be null");
        String s = expression.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron field must not be empty");
        }

        BitSet bits = new BitSet(max + 1);
        for (String item : s.split(",")) {
            addItem(expression, item.trim(), min, max, names, bits);
        }
        return new CronFieldMatcher(expression, bits);
    }

    public boolean matches(int value) {
        return value >= 0 && values.get(value);
    }

    public String expression() {
        return expression;
    }

    private static void addItem(String expression, String item, int min, int max,
                                Map<String, Integer> names, BitSet bits) {
        if (item.isEmpty()) {
            throw new IllegalArgumentException("Empty list item in cron field: " + expression);
        }

        String range = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = parseNumber(expression, item.substring(slash + 1));
            if (step <= 0) {
                throw new IllegalArgumentException("Step must be positive in cron field: " + expression);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = min;
            to = max;
        } else if (range.indexOf('-') > 0) {
            String[] bounds = range.split("-", 2);
            from = parseValue(expression, bounds[0], names);
            to = parseValue(expression, bounds[1], names);
        } else {
            from = parseValue(expression, range, names);
            to = (slash >= 0) ? max : from;
        }

        if (from < min || to > max || from > to) {
            throw new IllegalArgumentException(
                    "Cron field value out of range [" + min + "-" + max + "]: " + expression);
        }

        for (int v = from; v <= to; v += step) {
            bits.set(v);
        }
    }

    private static int parseValue(String expression, String token, Map<String, Integer> names) {
        Integer named = names.get(token);
        if (named != null) {
            return named;
        }
        return parseNumber(expression, token);
    }

    private static int parseNumber(String expression, String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value '" + token + "' in cron field: " + expression);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
