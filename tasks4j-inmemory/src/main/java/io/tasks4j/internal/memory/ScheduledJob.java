package io.tasks4j.internal.memory;

import io.tasks4j.core.JobInfo;
import io.tasks4j.core.Trigger;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A registered job as tracked by {@link InMemoryCommandScheduler}.
 *
 * <p>{@code nextRunAt} and {@code stalled} are only touched while holding the scheduler's job lock.
 * The running-instance counter is shared with worker threads.
 */
final class ScheduledJob {

    private final String id;
    private final String command;
    private final Trigger trigger;
    private final AtomicInteger runningInstances = new AtomicInteger();

    private Instant nextRunAt;
    private boolean stalled;

    ScheduledJob(String id, String command, Trigger trigger, Instant nextRunAt) {
        this.id = id;
        this.command = command;
        this.trigger = trigger;
        this.nextRunAt = nextRunAt;
    }

    String id() {
        return id;
    }

    String command() {
        return command;
    }

    Trigger trigger() {
        return trigger;
    }

    Instant nextRunAt() {
        return nextRunAt;
    }

    void nextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    boolean isStalled() {
        return stalled;
    }

    void markStalled() {
        this.stalled = true;
    }

    boolean isDue(Instant now) {
        return !stalled && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    boolean tryAcquireInstance(int maxInstances) {
        while (true) {
            int current = runningInstances.get();
            if (current >= maxInstances) {
                return false;
            }
            if (runningInstances.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void releaseInstance() {
        runningInstances.decrementAndGet();
    }

    JobInfo snapshot() {
        return new JobInfo(id, command, nextRunAt, trigger.type(), trigger.describe(), stalled);
    }
}
