package io.tasks4j.core;

import io.tasks4j.utils.CronFieldMatcher;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Calendar trigger: fires whenever the wall-clock time in {@link #zone()} matches every constrained field.
 *
 * <p>Each field is either {@code null} (unconstrained) or a cron-field expression. Fields coarser than the
 * finest constrained field match any value; finer ones default to their minimum, so
 * {@code hour=7, minute=0} fires once a day at 07:00:00 rather than every second of that minute.
 * {@code week} and {@code dayOfWeek} always default to any value.
 *
 * <p>Field syntax:
 * <ul>
 *   <li>second/minute/hour/day/month/year: Quartz field syntax (e.g. "0", "*&#47;5", "1-5", "JAN", "L")</li>
 *   <li>dayOfWeek: "0-6" or "mon-sun", Monday first</li>
 *   <li>week: ISO week of year, "1-53"</li>
 * </ul>
 * The search for the next fire time gives up {@value #SEARCH_WINDOW_YEARS} years after the reference time.
 */
public final class CronTrigger implements Trigger {

    public static final int SEARCH_WINDOW_YEARS = 4;

    private final String second;
    private final String minute;
    private final String hour;
    private final String day;
    private final String month;
    private final String dayOfWeek;
    private final String week;
    private final String year;
    private final ZoneId zone;

    private final String quartzExpression;
    private final CronFieldMatcher dayOfWeekMatcher;
    private final CronFieldMatcher weekMatcher;

    private CronTrigger(Builder b) {
        this.second = b.second;
        this.minute = b.minute;
        this.hour = b.hour;
        this.day = b.day;
        this.month = b.month;
        this.dayOfWeek = b.dayOfWeek;
        this.week = b.week;
        this.year = b.year;
        this.zone = (b.zone != null) ? b.zone : ZoneId.systemDefault();

        // coarse -> fine: year, month, week, day, dayOfWeek, hour, minute, second
        String[] given = {year, month, week, day, dayOfWeek, hour, minute, second};
        String[] defaults = {"*", "1", "*", "1", "*", "0", "0", "0"};
        int finest = -1;
        for (int i = 0; i < given.length; i++) {
            if (given[i] != null) {
                finest = i;
            }
        }
        String[] effective = new String[given.length];
        for (int i = 0; i < given.length; i++) {
            if (given[i] != null) {
                effective[i] = given[i];
            } else {
                effective[i] = (i > finest) ? defaults[i] : "*";
            }
        }

        this.quartzExpression = String.join(" ",
                effective[7], effective[6], effective[5], effective[3], effective[1], "?", effective[0]);
        this.dayOfWeekMatcher = "*".equals(effective[4]) ? null : CronFieldMatcher.dayOfWeek(effective[4]);
        this.weekMatcher = "*".equals(effective[2]) ? null : CronFieldMatcher.isoWeek(effective[2]);

        // validate eagerly
        compile();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every day at {@code hour:minute}.
     */
    public static CronTrigger daily(int hour, int minute, ZoneId zone) {
        return builder()
                .hour(String.valueOf(hour))
                .minute(String.valueOf(minute))
                .zone(zone)
                .build();
    }

    /**
     * Every week on {@code dayOfWeek} at {@code hour:minute}.
     */
    public static CronTrigger weekly(DayOfWeek dayOfWeek, int hour, int minute, ZoneId zone) {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
        return builder()
                .dayOfWeek(dayOfWeek.name().substring(0, 3).toLowerCase(Locale.ROOT))
                .hour(String.valueOf(hour))
                .minute(String.valueOf(minute))
                .zone(zone)
                .build();
    }

    @Override
    public TriggerType type() {
        return TriggerType.CRON;
    }

    @Override
    public Instant nextFireAfter(Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");

        Instant limit = reference.atZone(zone).plusYears(SEARCH_WINDOW_YEARS).toInstant();
        CronExpression expression = compile();

        Date cursor = Date.from(reference);
        while (true) {
            Date next = expression.getNextValidTimeAfter(cursor);
            if (next == null || next.toInstant().isAfter(limit)) {
                throw new NoMatchException(describe().toString(), reference, limit);
            }

            ZonedDateTime candidate = next.toInstant().atZone(zone);
            if (matchesDayFilters(candidate)) {
                return candidate.toInstant();
            }

            // the remaining seconds of this day cannot match either
            Instant startOfNextDay = candidate.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
            cursor = Date.from(startOfNextDay.minusSeconds(1));
        }
    }

    private boolean matchesDayFilters(ZonedDateTime candidate) {
        if (dayOfWeekMatcher != null
                && !dayOfWeekMatcher.matches(candidate.getDayOfWeek().getValue() - 1)) {
            return false;
        }
        return weekMatcher == null || weekMatcher.matches(candidate.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private CronExpression compile() {
        try {
            CronExpression exp = new CronExpression(quartzExpression);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron fields " + fieldsToString() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "cron");
        summary.putAll(fields());
        summary.put("timezone", zone.getId());
        return summary;
    }

    private Map<String, String> fields() {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfSet(fields, "year", year);
        putIfSet(fields, "month", month);
        putIfSet(fields, "week", week);
        putIfSet(fields, "day", day);
        putIfSet(fields, "day_of_week", dayOfWeek);
        putIfSet(fields, "hour", hour);
        putIfSet(fields, "minute", minute);
        putIfSet(fields, "second", second);
        return fields;
    }

    private static void putIfSet(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private String fieldsToString() {
        return fields().toString();
    }

    public String second() {
        return second;
    }

    public String minute() {
        return minute;
    }

    public String hour() {
        return hour;
    }

    public String day() {
        return day;
    }

    public String month() {
        return month;
    }

    public String dayOfWeek() {
        return dayOfWeek;
    }

    public String week() {
        return week;
    }

    public String year() {
        return year;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronTrigger other)) return false;
        return Objects.equals(second, other.second)
                && Objects.equals(minute, other.minute)
                && Objects.equals(hour, other.hour)
                && Objects.equals(day, other.day)
                && Objects.equals(month, other.month)
                && Objects.equals(dayOfWeek, other.dayOfWeek)
                && Objects.equals(week, other.week)
                && Objects.equals(year, other.year)
                && zone.equals(other.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(second, minute, hour, day, month, dayOfWeek, week, year, zone);
    }

    @Override
    public String toString() {
        return "CronTrigger" + describe();
    }

    public static final class Builder {
        private String second;
        private String minute;
        private String hour;
        private String day;
        private String month;
        private String dayOfWeek;
        private String week;
        private String year;
        private ZoneId zone;

        private Builder() {
        }

        public Builder second(String second) {
            this.second = normalize(second);
            return this;
        }

        public Builder minute(String minute) {
            this.minute = normalize(minute);
            return this;
        }

        public Builder hour(String hour) {
            this.hour = normalize(hour);
            return this;
        }

        public Builder day(String day) {
            this.day = normalize(day);
            return this;
        }

        public Builder month(String month) {
            this.month = normalize(month);
            return this;
        }

        public Builder dayOfWeek(String dayOfWeek) {
            this.dayOfWeek = normalize(dayOfWeek);
            return this;
        }

        public Builder week(String week) {
            this.week = normalize(week);
            return this;
        }

        public Builder year(String year) {
            this.year = normalize(year);
            return this;
        }

        /**
         * Zone the fields are evaluated in. Null means system default.
         */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder timezone(String timezone) {
            this.zone = (timezone == null || timezone.isBlank()) ? null : ZoneId.of(timezone);
            return this;
        }

        /**
         * @throws IllegalStateException    if no field is constrained
         * @throws IllegalArgumentException if a field is malformed
         */
        public CronTrigger build() {
            if (second == null && minute == null && hour == null && day == null && month == null
                    && dayOfWeek == null && week == null && year == null) {
                throw new IllegalStateException("CronTrigger must constrain at least one field");
            }
            return new CronTrigger(this);
        }

        private static String normalize(String field) {
            return (field == null || field.isBlank()) ? null : field.trim();
        }
    }
}
