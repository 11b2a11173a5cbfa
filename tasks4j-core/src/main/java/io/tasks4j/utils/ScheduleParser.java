package io.tasks4j.utils;

import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.IntervalTrigger;
import io.tasks4j.core.OnceTrigger;
import io.tasks4j.core.Trigger;
import io.tasks4j.core.UnparsableScheduleException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses short natural-language schedules into {@link Trigger}s.
 * <p>
 * Supported phrasings, tried in this order (first match wins):
 * <ol>
 *   <li>"every day at 7:00", "daily at 7" - {@link CronTrigger} on hour and minute</li>
 *   <li>"every 10 minutes" - {@link IntervalTrigger}</li>
 *   <li>"every 2 hours" - {@link IntervalTrigger}</li>
 *   <li>"tomorrow at 9", "tomorrow at 9:30" - {@link OnceTrigger}, seconds zeroed</li>
 *   <li>"in 30 minutes" - {@link OnceTrigger} relative to now</li>
 *   <li>"in 2 hours" - {@link OnceTrigger} relative to now</li>
 * </ol>
 * Matching is case-insensitive and looks for the phrase anywhere in the text. Once a phrase's keywords
 * match, the number or time that follows must be well formed; a malformed value fails the parse instead
 * of falling through to later phrasings.
 */
public final class ScheduleParser {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final Pattern COUNT = Pattern.compile("^\\d+$");

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b(?:every\\s+day|daily)\\s+at\\b(.*)$"),
                    (text, value, ctx) -> {
                        LocalTime time = parseTimeOfDay(text, value);
                        return CronTrigger.daily(time.getHour(), time.getMinute(), ctx.zone());
                    }),
            new Rule(Pattern.compile("\\bevery\\b(.*?)\\bminutes?\\b"),
                    (text, value, ctx) -> new IntervalTrigger(Duration.ofMinutes(parseCount(text, value)), ctx.now())),
            new Rule(Pattern.compile("\\bevery\\b(.*?)\\bhours?\\b"),
                    (text, value, ctx) -> new IntervalTrigger(Duration.ofHours(parseCount(text, value)), ctx.now())),
            new Rule(Pattern.compile("\\btomorrow\\s+at\\b(.*)$"),
                    (text, value, ctx) -> {
                        LocalTime time = parseTimeOfDay(text, value);
                        ZonedDateTime tomorrow = ctx.now().atZone(ctx.zone())
                                .toLocalDate()
                                .plusDays(1)
                                .atTime(time)
                                .atZone(ctx.zone());
                        return new OnceTrigger(tomorrow.toInstant());
                    }),
            new Rule(Pattern.compile("\\bin\\b(.*?)\\bminutes?\\b"),
                    (text, value, ctx) -> new OnceTrigger(ctx.now().plus(Duration.ofMinutes(parseCount(text, value))))),
            new Rule(Pattern.compile("\\bin\\b(.*?)\\bhours?\\b"),
                    (text, value, ctx) -> new OnceTrigger(ctx.now().plus(Duration.ofHours(parseCount(text, value)))))
    );

    private ScheduleParser() {
    }

    /**
     * Convenience overload: uses system default timezone and {@link Instant#now()}.
     */
    public static Trigger parse(String text) {
        return parse(text, ZoneId.systemDefault(), Instant.now());
    }

    /**
     * Convenience overload: uses {@link Instant#now()}.
     */
    public static Trigger parse(String text, ZoneId zone) {
        return parse(text, zone, Instant.now());
    }

    /**
     * Parse a schedule phrase.
     *
     * @param text schedule phrase, e.g. "every day at 7:00"
     * @param zone wall-clock zone for "at" times; if null, system default is used
     * @param now  base instant for relative phrases ("in 30 minutes") and interval starts
     * @throws UnparsableScheduleException if no phrasing matches or its value is malformed
     */
    public static Trigger parse(String text, ZoneId zone, Instant now) {
        if (text == null) {
            throw new UnparsableScheduleException("null", "schedule text must not be null");
        }
        Objects.requireNonNull(now, "now must not be null");

        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new UnparsableScheduleException(text, "schedule text must not be empty");
        }

        Context ctx = new Context(zone != null ? zone : ZoneId.systemDefault(), now);
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(normalized);
            if (m.find()) {
                try {
                    return rule.builder().build(text, m.group(1).trim(), ctx);
                } catch (ArithmeticException | DateTimeException ex) {
                    throw new UnparsableScheduleException(text, "value out of range: " + ex.getMessage());
                }
            }
        }
        throw new UnparsableScheduleException(text, "no supported phrasing found");
    }

    /**
     * Returns true if the text can be parsed by {@link #parse(String, ZoneId, Instant)}.
     */
    public static boolean isParsable(String text) {
        try {
            parse(text);
            return true;
        } catch (UnparsableScheduleException ignored) {
            return false;
        }
    }

    private static LocalTime parseTimeOfDay(String text, String value) {
        Matcher m = TIME_OF_DAY.matcher(value);
        if (!m.matches()) {
            throw new UnparsableScheduleException(text, "expected H or H:MM but got '" + value + "'");
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = (m.group(2) == null) ? 0 : Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new UnparsableScheduleException(text, "time of day out of range: " + value);
        }
        return LocalTime.of(hour, minute);
    }

    private static long parseCount(String text, String value) {
        if (!COUNT.matcher(value).matches()) {
            throw new UnparsableScheduleException(text, "expected a whole number but got '" + value + "'");
        }
        long n;
        try {
            n = Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new UnparsableScheduleException(text, "number out of range: " + value);
        }
        if (n <= 0) {
            throw new UnparsableScheduleException(text, "number must be positive: " + value);
        }
        return n;
    }

    private record Context(ZoneId zone, Instant now) {
    }

    @FunctionalInterface
    private interface TriggerFactory {
        Trigger build(String text, String value, Context ctx);
    }

    private record Rule(Pattern pattern, TriggerFactory builder) {
    }
}
