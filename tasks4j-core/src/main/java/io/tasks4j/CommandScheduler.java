package io.tasks4j;

import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.JobInfo;
import io.tasks4j.core.Trigger;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs pair a caller-supplied id with a command string and a {@link Trigger}. When a job becomes
 * due the command is handed to the registered {@link CommandCallback}.
 *
 * <p>Job operations only take effect while the scheduler is running. They report failure through
 * their return value and never throw for scheduling problems.
 */
public interface CommandScheduler extends AutoCloseable {
    void start();

    /**
     * Stop the timing loop and discard every registered job.
     */
    void stop();

    boolean isRunning();

    /**
     * Register the callback used to execute fired commands. Replaces any previous callback.
     */
    void setCommandCallback(CommandCallback callback);

    /**
     * Create a job builder. Nothing is registered until {@link JobBuilder#save()} is called.
     */
    JobBuilder create(String id, String command);

    /**
     * Insert a job, or atomically replace the job registered under the same id.
     *
     * @return true when the job is registered
     */
    boolean addJob(String id, String command, Trigger trigger);

    /**
     * @return false when no such job exists or the scheduler is not running
     */
    boolean removeJob(String id);

    /**
     * Snapshot of the registered jobs. Empty when the scheduler is not running.
     */
    List<JobInfo> getJobs();

    Optional<JobInfo> getJob(String id);

    boolean scheduleOnce(String id, String command, Instant at);

    boolean scheduleInterval(String id, String command, Duration period);

    boolean scheduleInterval(String id, String command, Duration period, Instant start);

    boolean scheduleCron(String id, String command, CronTrigger trigger);

    /**
     * Run every day at {@code hour:minute} in the scheduler's time zone.
     */
    boolean scheduleDaily(String id, String command, int hour, int minute);

    boolean scheduleWeekly(String id, String command, DayOfWeek dayOfWeek, int hour, int minute);

    /**
     * Schedule from a phrase such as "every day at 7:00" or "in 30 minutes".
     *
     * @return false when the phrase is not understood
     */
    boolean scheduleFromText(String id, String command, String text);

    @Override
    default void close() {
        if (isRunning()) {
            stop();
        }
    }
}
