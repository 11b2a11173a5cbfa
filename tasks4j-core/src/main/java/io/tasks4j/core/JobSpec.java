package io.tasks4j.core;

import java.util.Objects;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no scheduling state.
 */
public record JobSpec(
        String id,
        String command,
        Trigger trigger
) {
    public JobSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
    }
}
