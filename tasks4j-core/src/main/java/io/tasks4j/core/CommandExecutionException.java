package io.tasks4j.core;

/**
 * The command callback failed for a fired job. Logged by the scheduler, never rethrown.
 */
public class CommandExecutionException extends SchedulerException {

    private final String jobId;

    public CommandExecutionException(String jobId, String command, Throwable cause) {
        super("Command failed for job '" + jobId + "': " + command, cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
