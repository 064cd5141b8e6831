package com.adlanda.recommender.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the scheduler and its tasks.
 */
public record SchedulerStatus(boolean running, List<TaskStatus> tasks) {

    /**
     * @param nextRun     Next scheduled start, null while the scheduler is stopped
     * @param lastRun     Start of the most recent execution, null if never run
     * @param lastSuccess Outcome of the most recent execution, null if never run
     */
    public record TaskStatus(
            String name,
            Duration interval,
            boolean executing,
            Instant nextRun,
            Instant lastRun,
            Boolean lastSuccess
    ) {}

    public List<String> taskNames() {
        return tasks.stream().map(TaskStatus::name).toList();
    }
}
