package io.tasks4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Describes when a job fires.
 *
 * <p>Triggers are immutable. {@link #nextFireAfter(Instant)} depends only on the trigger and the
 * reference instant, so it can be evaluated any number of times without side effects.
 */
public sealed interface Trigger permits OnceTrigger, IntervalTrigger, CronTrigger {

    TriggerType type();

    /**
     * Earliest instant strictly after {@code reference} at which this trigger fires.
     *
     * @return the next fire time, or {@code null} if the trigger will never fire again
     * @throws NoMatchException if a calendar search gives up before finding a match
     */
    Instant nextFireAfter(Instant reference);

    /**
     * Human-readable summary, e.g. {@code {type=interval, period=PT10M, start=...}}.
     */
    Map<String, Object> describe();
}
