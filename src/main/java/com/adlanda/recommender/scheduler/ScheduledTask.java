package com.adlanda.recommender.scheduler;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * A named recurring job.
 *
 * @param name         Unique task name, used by {@code runNow}
 * @param interval     Delay between the end of one run and the start of the next
 * @param initialDelay Delay before the first run after the scheduler starts
 * @param action       The work; its return value is reported as the run result
 */
public record ScheduledTask(String name, Duration interval, Duration initialDelay, Callable<?> action) {

    public ScheduledTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Task interval must be positive: " + name);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            initialDelay = interval;
        }
    }

    public static ScheduledTask every(String name, Duration interval, Callable<?> action) {
        return new ScheduledTask(name, interval, interval, action);
    }
}
