package io.tasks4j.core;

/**
 * A trigger has no future fire time at registration, e.g. a one-shot time that already passed.
 */
public class TriggerExhaustedException extends SchedulerException {

    public TriggerExhaustedException(String jobId, Trigger trigger) {
        super("Trigger for job '" + jobId + "' will never fire: " + trigger.describe());
    }
}
