package io.tasks4j.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fires exactly once at {@code at}.
 */
public record OnceTrigger(Instant at) implements Trigger {

    public OnceTrigger {
        Objects.requireNonNull(at, "at must not be null");
    }

    @Override
    public TriggerType type() {
        return TriggerType.ONCE;
    }

    @Override
    public Instant nextFireAfter(Instant reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        return at.isAfter(reference) ? at : null;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "once");
        summary.put("at", at.toString());
        return summary;
    }
}
