package io.tasks4j;

import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.JobSpec;
import io.tasks4j.core.Trigger;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;

/**
 * Fluent builder for configuring a job before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + add to the scheduler</li>
 * </ul>
 * The last trigger-setting call wins.
 */
public interface JobBuilder {

    /**
     * Set the IANA time zone used by repeatAt/weeklyOn/schedule(text). Null means the scheduler default.
     */
    JobBuilder timezone(String timezone);

    /**
     * Run once at the specified absolute time.
     */
    JobBuilder at(Instant time);

    /**
     * Repeat every period, starting from registration time.
     */
    JobBuilder repeatEvery(Duration period);

    JobBuilder repeatEvery(Duration period, Instant start);

    /**
     * Run every day at a fixed local time ("H", "H:mm" or "H:mm:ss").
     */
    JobBuilder repeatAt(String timeOfDay);

    JobBuilder weeklyOn(DayOfWeek dayOfWeek, String timeOfDay);

    JobBuilder cron(CronTrigger trigger);

    /**
     * Natural-language schedule, e.g. "every 10 minutes" or "tomorrow at 9".
     */
    JobBuilder schedule(String text);

    JobBuilder trigger(Trigger trigger);

    /**
     * Build an immutable job spec (not registered).
     */
    JobSpec build();

    /**
     * Build + register.
     *
     * @return true when the scheduler accepted the job
     */
    boolean save();
}
