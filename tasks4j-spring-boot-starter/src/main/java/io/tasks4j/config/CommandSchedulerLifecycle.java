package io.tasks4j.config;

import io.tasks4j.CommandCallback;
import io.tasks4j.CommandScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>A {@link CommandCallback} bean, when present, is registered before the scheduler starts.
 */
public class CommandSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CommandSchedulerLifecycle.class);

    private final CommandScheduler scheduler;
    private final CommandCallback callback;
    private volatile boolean running = false;

    public CommandSchedulerLifecycle(CommandScheduler scheduler, CommandCallback callback) {
        this.scheduler = scheduler;
        this.callback = callback;
    }

    @Override
    public void start() {
        if (callback != null) {
            scheduler.setCommandCallback(callback);
        } else {
            log.warn("No CommandCallback bean found; jobs will be skipped until one is registered");
        }
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
