package io.tasks4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fires at {@code start + k * period} for k = 0, 1, 2, ...
 *
 * <p>Fire times are anchored to {@code start}: a late tick never shifts later ones, and missed ticks
 * are skipped instead of replayed.
 */
public record IntervalTrigger(Duration period, Instant start) implements Trigger {

    public IntervalTrigger {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(start, "start must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration: " + period);
        }
    }

    @Override
    public TriggerType type() {
        return TriggerType.INTERVAL;
    }

    @Override
    public Instant nextFireAfter(Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        if (reference.isBefore(start)) {
            return start;
        }
        long elapsedPeriods = Duration.between(start, reference).dividedBy(period);
        return start.plus(period.multipliedBy(elapsedPeriods + 1));
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "interval");
        summary.put("period", period.toString());
        summary.put("start", start.toString());
        return summary;
    }
}
