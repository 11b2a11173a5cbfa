package io.tasks4j.core;

import java.time.Instant;

/**
 * A cron search found no matching time within its search window.
 */
public class NoMatchException extends SchedulerException {

    public NoMatchException(String expression, Instant reference, Instant searchedUntil) {
        super("Cron fields " + expression + " match no time between " + reference + " and " + searchedUntil);
    }
}
