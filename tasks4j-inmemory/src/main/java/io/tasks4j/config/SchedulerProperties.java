package io.tasks4j.config;

import io.tasks4j.core.MissedOncePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for the command scheduler.
 */
@ConfigurationProperties(prefix = "tasks4j.scheduler")
public class SchedulerProperties {
    private Duration tickInterval = Duration.ofSeconds(1);
    private int maxConcurrency = 4; // worker threads
    private int maxInstances = 1; // per job
    private Duration shutdownTimeout = Duration.ofSeconds(5);
    private String timezone;
    private MissedOncePolicy missedOncePolicy = MissedOncePolicy.REJECT;

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public void setMaxInstances(int maxInstances) {
        this.maxInstances = maxInstances;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public MissedOncePolicy getMissedOncePolicy() {
        return missedOncePolicy;
    }

    public void setMissedOncePolicy(MissedOncePolicy missedOncePolicy) {
        this.missedOncePolicy = missedOncePolicy;
    }

    /**
     * Zone for cron triggers and schedule phrases. Null or blank timezone means system default.
     */
    public ZoneId resolveZone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("tasks4j.scheduler.timezone is not a valid zone id: " + timezone, ex);
        }
    }
}
