package io.tasks4j.internal;

import io.tasks4j.JobBuilder;
import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.IntervalTrigger;
import io.tasks4j.core.JobSpec;
import io.tasks4j.core.OnceTrigger;
import io.tasks4j.core.UnparsableScheduleException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleJobBuilderTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final AtomicReference<JobSpec> saved = new AtomicReference<>();

    private JobBuilder builder(String id, String command) {
        return new SimpleJobBuilder(id, command, spec -> {
            saved.set(spec);
            return true;
        }, ZoneOffset.UTC, () -> NOW);
    }

    @Test
    void atShouldBuildOnceTrigger() {
        JobSpec spec = builder("alarm", "wake me up").at(NOW.plusSeconds(60)).build();

        assertThat(spec.id()).isEqualTo("alarm");
        assertThat(spec.command()).isEqualTo("wake me up");
        assertThat(spec.trigger()).isEqualTo(new OnceTrigger(NOW.plusSeconds(60)));
    }

    @Test
    void repeatEveryShouldStartFromNow() {
        JobSpec spec = builder("poll", "check the mail").repeatEvery(Duration.ofMinutes(5)).build();

        assertThat(spec.trigger()).isEqualTo(new IntervalTrigger(Duration.ofMinutes(5), NOW));
    }

    @Test
    void repeatAtShouldAcceptShortForms() {
        CronTrigger fromHour = (CronTrigger) builder("a", "x").repeatAt("7").build().trigger();
        CronTrigger fromShortTime = (CronTrigger) builder("a", "x").repeatAt("7:05").build().trigger();

        assertThat(fromHour.hour()).isEqualTo("7");
        assertThat(fromHour.minute()).isEqualTo("0");
        assertThat(fromShortTime.hour()).isEqualTo("7");
        assertThat(fromShortTime.minute()).isEqualTo("5");
    }

    @Test
    void secondsShouldReachTheCronTrigger() {
        CronTrigger daily = (CronTrigger) builder("a", "x").repeatAt("13:30:45").build().trigger();
        CronTrigger weekly = (CronTrigger) builder("a", "x").weeklyOn(DayOfWeek.FRIDAY, "8:15:30").build().trigger();

        assertThat(daily.second()).isEqualTo("45");
        assertThat(daily.nextFireAfter(NOW)).isEqualTo(Instant.parse("2026-01-01T13:30:45Z"));
        assertThat(weekly.second()).isEqualTo("30");
        assertThat(weekly.nextFireAfter(NOW)).isEqualTo(Instant.parse("2026-01-02T08:15:30Z"));
        assertThat(((CronTrigger) builder("a", "x").repeatAt("13:30:00").build().trigger()).second()).isNull();
    }

    @Test
    void timezoneShouldApplyToCalendarTriggers() {
        CronTrigger cron = (CronTrigger) builder("a", "x")
                .timezone("Asia/Taipei")
                .weeklyOn(DayOfWeek.FRIDAY, "18:30")
                .build()
                .trigger();

        assertThat(cron.zone()).isEqualTo(ZoneId.of("Asia/Taipei"));
        assertThat(cron.dayOfWeek()).isEqualTo("fri");
        assertThat(cron.hour()).isEqualTo("18");
        assertThat(cron.minute()).isEqualTo("30");
    }

    @Test
    void scheduleShouldParseNaturalLanguage() {
        JobSpec spec = builder("a", "x").schedule("in 2 hours").build();

        assertThat(spec.trigger()).isEqualTo(new OnceTrigger(NOW.plus(Duration.ofHours(2))));
    }

    @Test
    void lastTriggerCallWins() {
        JobSpec spec = builder("a", "x")
                .at(NOW.plusSeconds(5))
                .repeatEvery(Duration.ofSeconds(30))
                .build();

        assertThat(spec.trigger()).isInstanceOf(IntervalTrigger.class);
    }

    @Test
    void saveShouldHandSpecToPersister() {
        boolean accepted = builder("a", "x").repeatAt("06:45").save();

        assertThat(accepted).isTrue();
        assertThat(saved.get()).isNotNull();
        assertThat(saved.get().id()).isEqualTo("a");
    }

    @Test
    void invalidInputShouldBeRejected() {
        assertThatThrownBy(() -> builder("a", "x").build()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder("a", "x").repeatAt("25:00")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder("a", "x").repeatAt("13:30:45.5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder("a", "x").schedule("sometime")).isInstanceOf(UnparsableScheduleException.class);
        assertThatThrownBy(() -> builder(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder("a", "x").repeatEvery(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
