package io.tasks4j.core;

/**
 * An operation needs a running scheduler or a registered command callback and has neither.
 */
public class SchedulerConfigurationException extends SchedulerException {

    public SchedulerConfigurationException(String message) {
        super(message);
    }
}
