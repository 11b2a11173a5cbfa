package io.tasks4j.internal.memory;

import io.tasks4j.CommandCallback;
import io.tasks4j.CommandScheduler;
import io.tasks4j.JobBuilder;
import io.tasks4j.config.SchedulerProperties;
import io.tasks4j.core.CommandExecutionException;
import io.tasks4j.core.CronTrigger;
import io.tasks4j.core.JobInfo;
import io.tasks4j.core.JobSpec;
import io.tasks4j.core.MissedOncePolicy;
import io.tasks4j.core.NoMatchException;
import io.tasks4j.core.SchedulerConfigurationException;
import io.tasks4j.core.Trigger;
import io.tasks4j.core.TriggerExhaustedException;
import io.tasks4j.internal.SimpleJobBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * In-process command scheduler.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-time jobs (run at a specific Instant)</li>
 *   <li>Recurring jobs (fixed interval / cron fields / natural-language phrases)</li>
 *   <li>Commands run on a worker pool so a slow command never delays due-job detection</li>
 * </ul>
 *
 * <p>Jobs live in memory only: {@link #stop()} discards them.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.setCommandCallback(commandProcessor::process);
 * scheduler.start();
 *
 * scheduler.scheduleFromText("lights-off", "turn off the lights", "every day at 23:00");
 * scheduler.create("coffee", "start the coffee machine")
 *          .repeatAt("7:00")
 *          .save();
 *
 * scheduler.stop();
 * }</pre>
 */
public class InMemoryCommandScheduler implements CommandScheduler {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCommandScheduler.class);

    private final SchedulerProperties props;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    // guards jobs and every ScheduledJob's nextRunAt/stalled
    private final Object lock = new Object();
    private final Map<String, ScheduledJob> jobs = new HashMap<>();

    private final Semaphore wakeSignal = new Semaphore(0);

    private volatile CommandCallback callback;
    private volatile ZoneId zone;

    private volatile ExecutorService workerPool;
    private Thread tickerThread;

    public InMemoryCommandScheduler(SchedulerProperties props) {
        this(props, Clock.systemUTC());
    }

    public InMemoryCommandScheduler(SchedulerProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = props.resolveZone();
    }

    /**
     * Start the timing loop and worker pool. Calling it on a running scheduler only logs a warning.
     */
    @Override
    public synchronized void start() {
        if (started.get()) {
            log.warn("scheduler start ignored: already running");
            return;
        }

        Duration tick = Objects.requireNonNull(props.getTickInterval(), "tasks4j.scheduler.tickInterval must not be null");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tasks4j.scheduler.tickInterval must be a positive duration");
        }
        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "tasks4j.scheduler.shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("tasks4j.scheduler.shutdownTimeout must not be negative");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("tasks4j.scheduler.maxConcurrency must be positive");
        }
        if (props.getMaxInstances() <= 0) {
            throw new IllegalArgumentException("tasks4j.scheduler.maxInstances must be positive");
        }
        Objects.requireNonNull(props.getMissedOncePolicy(), "tasks4j.scheduler.missedOncePolicy must not be null");
        this.zone = props.resolveZone();

        log.info("scheduler starting with tickInterval={}, maxConcurrency={}, maxInstances={}, timezone={}, missedOncePolicy={}",
                tick,
                props.getMaxConcurrency(),
                props.getMaxInstances(),
                zone,
                props.getMissedOncePolicy());

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("tasks4j.worker");
            t.setDaemon(true);
            return t;
        });

        wakeSignal.drainPermits();
        started.set(true);

        tickerThread = new Thread(this::tickerLoop);
        tickerThread.setName("tasks4j.ticker");
        tickerThread.setDaemon(true);
        tickerThread.start();

        log.info("scheduler started");
    }

    /**
     * Stop the timing loop and drop all jobs. Commands already running are allowed to finish.
     */
    @Override
    public synchronized void stop() {
        if (!started.get()) {
            log.warn("scheduler stop ignored: not running");
            return;
        }

        log.info("scheduler stopping...");

        int discarded;
        synchronized (lock) {
            started.set(false);
            discarded = jobs.size();
            jobs.clear();
        }

        if (tickerThread != null) {
            tickerThread.interrupt();
            try {
                tickerThread.join(props.getTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            tickerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("scheduler stopped with commands still running; they will complete in the background");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                workerPool = null;
            }
        }

        log.info("scheduler stopped, discarded jobs={}", discarded);
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void setCommandCallback(CommandCallback callback) {
        this.callback = callback;
        log.debug("scheduler command callback {}", callback == null ? "cleared" : "registered");
    }

    /**
     * Create a job builder. Nothing is registered until {@code save()} is called.
     */
    @Override
    public JobBuilder create(String id, String command) {
        return new SimpleJobBuilder(id, command, this::addJob, zone, this::nowInstant);
    }

    @Override
    public boolean addJob(String id, String command, Trigger trigger) {
        if (id == null || id.isBlank() || command == null || trigger == null) {
            log.warn("scheduler addJob rejected id={}: id, command and trigger are required", id);
            return false;
        }
        return addJob(new JobSpec(id, command, trigger));
    }

    private boolean addJob(JobSpec spec) {
        Instant firstRun;
        try {
            ensureRunning();
            firstRun = initialRunAt(spec, nowInstant());
        } catch (RuntimeException e) {
            log.warn("scheduler addJob rejected id={} msg={}", spec.id(), e.getMessage());
            return false;
        }

        ScheduledJob previous;
        synchronized (lock) {
            if (!started.get()) {
                log.warn("scheduler addJob rejected id={}: scheduler stopped", spec.id());
                return false;
            }
            previous = jobs.put(spec.id(), new ScheduledJob(spec.id(), spec.command(), spec.trigger(), firstRun));
        }
        wakeSignal.release();

        log.info("scheduler job {} id={} nextRunAt={} trigger={}",
                previous == null ? "added" : "replaced",
                spec.id(),
                firstRun,
                spec.trigger().describe());
        return true;
    }

    private void ensureRunning() {
        if (!started.get()) {
            throw new SchedulerConfigurationException("scheduler is not running");
        }
    }

    private Instant initialRunAt(JobSpec spec, Instant now) {
        Instant next = spec.trigger().nextFireAfter(now);
        if (next != null) {
            return next;
        }
        if (!spec.trigger().type().isRecurring()
                && props.getMissedOncePolicy() == MissedOncePolicy.FIRE_IMMEDIATELY) {
            return now;
        }
        throw new TriggerExhaustedException(spec.id(), spec.trigger());
    }

    @Override
    public boolean removeJob(String id) {
        if (id == null) {
            return false;
        }
        ScheduledJob removed;
        synchronized (lock) {
            if (!started.get()) {
                log.warn("scheduler removeJob rejected id={}: scheduler is not running", id);
                return false;
            }
            removed = jobs.remove(id);
        }
        if (removed == null) {
            log.debug("scheduler removeJob id={} not found", id);
            return false;
        }
        log.info("scheduler job removed id={}", id);
        return true;
    }

    @Override
    public List<JobInfo> getJobs() {
        List<JobInfo> snapshot = new ArrayList<>();
        synchronized (lock) {
            if (!started.get()) {
                return List.of();
            }
            for (ScheduledJob job : jobs.values()) {
                snapshot.add(job.snapshot());
            }
        }
        snapshot.sort(Comparator.comparing(JobInfo::id));
        return List.copyOf(snapshot);
    }

    @Override
    public Optional<JobInfo> getJob(String id) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            if (!started.get()) {
                return Optional.empty();
            }
            ScheduledJob job = jobs.get(id);
            return job == null ? Optional.empty() : Optional.of(job.snapshot());
        }
    }

    @Override
    public boolean scheduleOnce(String id, String command, Instant at) {
        return saveQuietly(id, () -> this.create(id, command).at(at));
    }

    @Override
    public boolean scheduleInterval(String id, String command, Duration period) {
        return saveQuietly(id, () -> this.create(id, command).repeatEvery(period));
    }

    @Override
    public boolean scheduleInterval(String id, String command, Duration period, Instant start) {
        return saveQuietly(id, () -> this.create(id, command).repeatEvery(period, start));
    }

    @Override
    public boolean scheduleCron(String id, String command, CronTrigger trigger) {
        return saveQuietly(id, () -> this.create(id, command).cron(trigger));
    }

    @Override
    public boolean scheduleDaily(String id, String command, int hour, int minute) {
        return saveQuietly(id, () -> this.create(id, command).trigger(CronTrigger.daily(hour, minute, zone)));
    }

    @Override
    public boolean scheduleWeekly(String id, String command, DayOfWeek dayOfWeek, int hour, int minute) {
        return saveQuietly(id, () -> this.create(id, command).trigger(CronTrigger.weekly(dayOfWeek, hour, minute, zone)));
    }

    @Override
    public boolean scheduleFromText(String id, String command, String text) {
        return saveQuietly(id, () -> this.create(id, command).schedule(text));
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private boolean saveQuietly(String id, Supplier<JobBuilder> builder) {
        try {
            return builder.get().save();
        } catch (RuntimeException e) {
            log.warn("scheduler could not schedule id={} msg={}", id, e.getMessage());
            return false;
        }
    }

    private void tickerLoop() {
        long maxSleepMs = props.getTickInterval().toMillis();
        while (started.get()) {
            long sleepMs;
            try {
                sleepMs = tickOnce(maxSleepMs);
            } catch (Exception e) {
                log.error("scheduler tick failed msg={}", e.getMessage(), e);
                sleepMs = maxSleepMs;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (sleepMs > 0 && wakeSignal.tryAcquire(sleepMs, TimeUnit.MILLISECONDS)) {
                    wakeSignal.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("scheduler ticker exited");
    }

    /**
     * Dispatch every due job and compute how long the ticker may sleep.
     */
    private long tickOnce(long maxSleepMs) {
        Instant now = nowInstant();
        Instant earliest = null;

        synchronized (lock) {
            if (!started.get()) {
                return 0;
            }

            Iterator<ScheduledJob> it = jobs.values().iterator();
            while (it.hasNext()) {
                ScheduledJob job = it.next();
                if (job.isDue(now)) {
                    dispatch(job);
                    if (!reschedule(job, now)) {
                        it.remove();
                        continue;
                    }
                }
                if (!job.isStalled() && (earliest == null || job.nextRunAt().isBefore(earliest))) {
                    earliest = job.nextRunAt();
                }
            }
        }

        if (earliest == null) {
            return maxSleepMs;
        }
        Duration untilDue = Duration.between(now, earliest);
        if (untilDue.compareTo(Duration.ofMillis(maxSleepMs)) >= 0) {
            return maxSleepMs;
        }
        return Math.max(1, untilDue.toMillis());
    }

    /**
     * @return false when the job is exhausted and must leave the active set
     */
    private boolean reschedule(ScheduledJob job, Instant firedAt) {
        Instant next;
        try {
            next = job.trigger().nextFireAfter(firedAt);
        } catch (NoMatchException | ArithmeticException | DateTimeException e) {
            job.markStalled();
            log.error("scheduler job stalled id={} msg={}", job.id(), e.getMessage());
            return true;
        }

        if (next == null) {
            log.info("scheduler job exhausted id={}", job.id());
            return false;
        }
        job.nextRunAt(next);
        return true;
    }

    private void dispatch(ScheduledJob job) {
        CommandCallback cb = this.callback;
        if (cb == null) {
            log.warn("scheduler skipped job id={}: no command callback registered", job.id());
            return;
        }

        if (!job.tryAcquireInstance(props.getMaxInstances())) {
            log.warn("scheduler skipped job id={}: previous run still in progress (maxInstances={})",
                    job.id(), props.getMaxInstances());
            return;
        }

        try {
            workerPool.execute(() -> runCommand(job, cb));
        } catch (RejectedExecutionException e) {
            job.releaseInstance();
            log.error("scheduler worker pool rejected job id={}", job.id(), e);
        }
    }

    private void runCommand(ScheduledJob job, CommandCallback cb) {
        try {
            Instant startedAt = nowInstant();
            log.debug("scheduler job started id={} command={} at={}", job.id(), job.command(), startedAt);
            String result = cb.execute(job.command());
            log.debug("scheduler job succeeded id={} result={} tookMs={}",
                    job.id(), result, Duration.between(startedAt, nowInstant()).toMillis());
        } catch (Exception e) {
            CommandExecutionException failure = new CommandExecutionException(job.id(), job.command(), e);
            log.error("scheduler job failed id={} msg={}", job.id(), e.getMessage(), failure);
        } finally {
            job.releaseInstance();
        }
    }
}
