package io.tasks4j.core;

/**
 * Schedule text matched no known phrasing, or its number/time part was malformed.
 */
public class UnparsableScheduleException extends SchedulerException {

    private final String text;

    public UnparsableScheduleException(String text, String reason) {
        super("Unparsable schedule '" + text + "': " + reason);
        this.text = text;
    }

    public String text() {
        return text;
    }
}
