package com.adlanda.recommender.scheduler;

/**
 * Outcome of one task execution.
 *
 * @param result The task's return value on success
 * @param error  Failure reason, null on success
 */
public record TaskRunResult(
        String taskName,
        boolean success,
        long durationMs,
        Object result,
        String error
) {
    static final String ALREADY_RUNNING = "already running";

    public static TaskRunResult success(String taskName, long durationMs, Object result) {
        return new TaskRunResult(taskName, true, durationMs, result, null);
    }

    public static TaskRunResult failure(String taskName, long durationMs, String error) {
        return new TaskRunResult(taskName, false, durationMs, null, error);
    }

    public boolean wasAlreadyRunning() {
        return !success && ALREADY_RUNNING.equals(error);
    }
}
