package com.adlanda.recommender.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs named tasks on fixed intervals.
 *
 * A task never runs twice at the same time: a cadence run that finds the task
 * still executing is skipped, and {@link #runNow} reports "already running".
 * A failing task is logged and keeps its schedule.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final Map<String, TaskState> tasks = new LinkedHashMap<>();
    private final Clock clock;
    private final Supplier<ScheduledExecutorService> executorFactory;
    private final Duration runNowTimeout;
    private final ExecutorService manualExecutor;

    private ScheduledExecutorService executor;

    public TaskScheduler(List<ScheduledTask> tasks, Clock clock, Duration runNowTimeout) {
        this(tasks, clock, runNowTimeout,
                () -> Executors.newScheduledThreadPool(Math.max(1, tasks.size()), daemonThreads("scheduler")));
    }

    public TaskScheduler(List<ScheduledTask> tasks,
                         Clock clock,
                         Duration runNowTimeout,
                         Supplier<ScheduledExecutorService> executorFactory) {
        for (ScheduledTask task : tasks) {
            if (this.tasks.putIfAbsent(task.name(), new TaskState(task)) != null) {
                throw new IllegalArgumentException("Duplicate task name: " + task.name());
            }
        }
        this.clock = clock;
        this.runNowTimeout = runNowTimeout;
        this.executorFactory = executorFactory;
        this.manualExecutor = Executors.newCachedThreadPool(daemonThreads("task-run"));
    }

    /**
     * Starts the recurring schedule.
     *
     * @return false if the scheduler was already running
     */
    public synchronized boolean start() {
        if (executor != null) {
            log.info("Scheduler already running");
            return false;
        }

        executor = executorFactory.get();
        Instant now = clock.instant();
        for (TaskState state : tasks.values()) {
            ScheduledTask task = state.task;
            state.nextRun = now.plus(task.initialDelay());
            state.future = executor.scheduleWithFixedDelay(
                    () -> runScheduled(state),
                    task.initialDelay().toMillis(),
                    task.interval().toMillis(),
                    TimeUnit.MILLISECONDS);
            log.info("Scheduled task '{}' every {} (first run at {})", task.name(), task.interval(), state.nextRun);
        }
        log.info("Scheduler started with {} tasks", tasks.size());
        return true;
    }

    /**
     * Stops the recurring schedule. Executions in progress are interrupted.
     *
     * @return false if the scheduler was not running
     */
    public synchronized boolean stop() {
        if (executor == null) {
            log.info("Scheduler already stopped");
            return false;
        }

        for (TaskState state : tasks.values()) {
            if (state.future != null) {
                state.future.cancel(false);
                state.future = null;
            }
            state.nextRun = null;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Scheduler stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /**
     * Runs a task immediately, outside its cadence, waiting at most the
     * configured timeout for it to finish.
     */
    public TaskRunResult runNow(String taskName) {
        TaskState state = tasks.get(taskName);
        if (state == null) {
            return TaskRunResult.failure(taskName, 0, "unknown task");
        }
        if (!state.executing.compareAndSet(false, true)) {
            log.info("Task '{}' is already running, not starting it again", taskName);
            return TaskRunResult.failure(taskName, 0, TaskRunResult.ALREADY_RUNNING);
        }

        long startMillis = clock.millis();
        Future<TaskRunResult> future;
        try {
            future = manualExecutor.submit(() -> execute(state, "manual"));
        } catch (RejectedExecutionException e) {
            state.executing.set(false);
            return TaskRunResult.failure(taskName, 0, "scheduler is shut down");
        }

        try {
            return future.get(runNowTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Task '{}' did not finish within {}", taskName, runNowTimeout);
            return TaskRunResult.failure(taskName, clock.millis() - startMillis,
                    "timed out after " + runNowTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskRunResult.failure(taskName, clock.millis() - startMillis, "interrupted");
        } catch (ExecutionException e) {
            return TaskRunResult.failure(taskName, clock.millis() - startMillis, String.valueOf(e.getCause()));
        }
    }

    public SchedulerStatus status() {
        boolean running = isRunning();
        List<SchedulerStatus.TaskStatus> statuses = new ArrayList<>();
        for (TaskState state : tasks.values()) {
            TaskRunResult last = state.lastResult;
            statuses.add(new SchedulerStatus.TaskStatus(
                    state.task.name(),
                    state.task.interval(),
                    state.executing.get(),
                    running ? state.nextRun : null,
                    state.lastRun,
                    last != null ? last.success() : null));
        }
        return new SchedulerStatus(running, List.copyOf(statuses));
    }

    /**
     * Stops the schedule and the manual-run threads.
     */
    public void shutdown() {
        stop();
        manualExecutor.shutdownNow();
    }

    private void runScheduled(TaskState state) {
        if (!state.executing.compareAndSet(false, true)) {
            log.info("Skipping scheduled run of '{}', previous run still executing", state.task.name());
            return;
        }
        execute(state, "scheduled");
    }

    /**
     * Runs a task whose executing flag the caller has already claimed.
     */
    private TaskRunResult execute(TaskState state, String trigger) {
        String name = state.task.name();
        Instant startedAt = clock.instant();
        long startMillis = clock.millis();
        state.lastRun = startedAt;
        log.info("Running task '{}' ({})", name, trigger);

        TaskRunResult result;
        try {
            Object value = state.task.action().call();
            long duration = clock.millis() - startMillis;
            log.info("Task '{}' completed in {}ms", name, duration);
            result = TaskRunResult.success(name, duration, value);
        } catch (Exception e) {
            long duration = clock.millis() - startMillis;
            log.error("Task '{}' failed after {}ms: {}", name, duration, e.getMessage(), e);
            result = TaskRunResult.failure(name, duration, e.getMessage() != null ? e.getMessage() : e.toString());
        } finally {
            state.executing.set(false);
            if (state.future != null) {
                state.nextRun = clock.instant().plus(state.task.interval());
            }
        }
        state.lastResult = result;
        return result;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class TaskState {
        private final ScheduledTask task;
        private final AtomicBoolean executing = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;
        private volatile Instant nextRun;
        private volatile Instant lastRun;
        private volatile TaskRunResult lastResult;

        private TaskState(ScheduledTask task) {
            this.task = task;
        }
    }
}
