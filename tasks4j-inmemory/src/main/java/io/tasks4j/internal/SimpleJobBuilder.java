package io.tasks4j.internal;

import io.tasks4j.JobBuilder;
import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.IntervalTrigger;
import io.tasks4j.core.JobSpec;
import io.tasks4j.core.OnceTrigger;
import io.tasks4j.core.Trigger;
import io.tasks4j.utils.ScheduleParser;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Default {@link JobBuilder} implementation used by the in-memory scheduler.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String id;
    private final String command;
    private final Predicate<JobSpec> persister;
    private final Supplier<Instant> clock;

    private ZoneId zone;
    private Trigger trigger;

    public SimpleJobBuilder(String id, String command, Predicate<JobSpec> persister,
                            ZoneId defaultZone, Supplier<Instant> clock) {
        this.id = Objects.requireNonNull(id, "job id must not be null");
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.zone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
    }

    @Override
    public JobBuilder timezone(String timezone) {
        if (timezone != null && !timezone.isBlank()) {
            this.zone = ZoneId.of(timezone);
        }
        return this;
    }

    @Override
    public JobBuilder at(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.trigger = new OnceTrigger(time);
        return this;
    }

    @Override
    public JobBuilder repeatEvery(Duration period) {
        return repeatEvery(period, clock.get());
    }

    @Override
    public JobBuilder repeatEvery(Duration period, Instant start) {
        Objects.requireNonNull(start, "start must not be null");
        this.trigger = new IntervalTrigger(period, start);
        return this;
    }

    @Override
    public JobBuilder repeatAt(String timeOfDay) {
        this.trigger = timeOfDay(parseTimeOfDay(timeOfDay)).build();
        return this;
    }

    @Override
    public JobBuilder weeklyOn(DayOfWeek dayOfWeek, String timeOfDay) {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
        this.trigger = timeOfDay(parseTimeOfDay(timeOfDay))
                .dayOfWeek(dayOfWeek.name().substring(0, 3).toLowerCase(Locale.ROOT))
                .build();
        return this;
    }

    @Override
    public JobBuilder cron(CronTrigger trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        return this;
    }

    @Override
    public JobBuilder schedule(String text) {
        this.trigger = ScheduleParser.parse(text, zone, clock.get());
        return this;
    }

    @Override
    public JobBuilder trigger(Trigger trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        return this;
    }

    @Override
    public JobSpec build() {
        if (trigger == null) {
            throw new IllegalStateException("No trigger configured for job: " + id);
        }
        return new JobSpec(id, command, trigger);
    }

    @Override
    public boolean save() {
        return persister.test(build());
    }

    private CronTrigger.Builder timeOfDay(LocalTime lt) {
        CronTrigger.Builder cron = CronTrigger.builder()
                .hour(String.valueOf(lt.getHour()))
                .minute(String.valueOf(lt.getMinute()))
                .zone(zone);
        // second 0 is implied by the cron field defaults
        if (lt.getSecond() != 0) {
            cron.second(String.valueOf(lt.getSecond()));
        }
        return cron;
    }

    private LocalTime parseTimeOfDay(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        String s = timeOfDay.trim();
        LocalTime parsed;
        try {
            if (s.matches("^\\d{1,2}$")) {
                return LocalTime.of(Integer.parseInt(s), 0);
            }
            if (s.matches("^\\d:\\d{2}(:\\d{2})?$")) {
                s = "0" + s;
            }
            parsed = LocalTime.parse(s);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timeOfDay. Expected H, H:mm or H:mm:ss: " + timeOfDay);
        }
        if (parsed.getNano() != 0) {
            throw new IllegalArgumentException("Invalid timeOfDay. Fractional seconds are not supported: " + timeOfDay);
        }
        return parsed;
    }
}
