package io.tasks4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of a registered job.
 *
 * <p>JSON shape: {@code {id, command, next_run_time, trigger_type, trigger, stalled}} with
 * {@code next_run_time} as an ISO-8601 string.
 *
 * @param nextRunAt next scheduled run; never null for a registered job
 * @param trigger   summary from {@link Trigger#describe()}
 * @param stalled   true when the trigger could not compute another run; the job no longer fires
 */
@JsonPropertyOrder({"id", "command", "next_run_time", "trigger_type", "trigger", "stalled"})
public record JobInfo(
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonIgnore Instant nextRunAt,
        @JsonProperty("trigger_type") TriggerType triggerType,
        @JsonProperty("trigger") Map<String, Object> trigger,
        @JsonProperty("stalled") boolean stalled
) {
    public JobInfo {
        trigger = (trigger == null || trigger.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(trigger));
    }

    @JsonProperty("next_run_time")
    public String nextRunTime() {
        return nextRunAt == null ? null : nextRunAt.toString();
    }
}
