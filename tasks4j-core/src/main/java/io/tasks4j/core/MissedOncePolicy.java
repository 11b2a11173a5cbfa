package io.tasks4j.core;

/**
 * What to do with a one-shot job whose time has already passed when it is registered.
 */
public enum MissedOncePolicy {
    /**
     * Refuse the job; {@code addJob} returns false.
     */
    REJECT,
    /**
     * Register the job as due now; it fires on the next tick and is then exhausted.
     */
    FIRE_IMMEDIATELY
}
