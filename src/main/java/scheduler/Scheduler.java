package scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import guildupdater.GuildSync;
import guildupdater.SyncReport;
import logs.DiscordLog;
import utils.SyncConfig;
import utils.UtilsConfig;

/**
 * Runs tasks at fixed intervals on a single thread, so two guild syncs never overlap.
 * Supports resetting timers if tasks are run early for any reason.
 */
public class Scheduler {

    public static final String GUILD_SYNC_TASK = "GuildSync";

    private final ScheduledExecutorService executor;
    private final TimeUnit unit;
    private final Map<String, ScheduledTask> scheduledTasks;
    private final DiscordLog discordLogger;

    public Scheduler(DiscordLog discordLogger) {
        this(Executors.newSingleThreadScheduledExecutor(), TimeUnit.HOURS, discordLogger);
    }

    /**
     * @param unit Unit of every interval passed to this scheduler
     */
    public Scheduler(ScheduledExecutorService executor, TimeUnit unit, DiscordLog discordLogger) {
        this.executor = executor;
        this.unit = unit;
        this.scheduledTasks = new LinkedHashMap<>();
        this.discordLogger = discordLogger;
    }

    /**
     * Represents a scheduled task with its future and interval
     */
    private static class ScheduledTask {
        private ScheduledFuture<?> future;
        private final long interval;
        private final Runnable task;

        ScheduledTask(ScheduledFuture<?> future, long interval, Runnable task) {
            this.future = future;
            this.interval = interval;
            this.task = task;
        }

        void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }

        long getInterval() {
            return interval;
        }

        Runnable getTask() {
            return task;
        }

        void setFuture(ScheduledFuture<?> future) {
            this.future = future;
        }
    }

    /**
     * Schedules the guild sync. Each run reloads the configuration, so .env edits apply to the next run.
     * @param intervalHours How often to sync
     */
    public void scheduleGuildSync(long intervalHours) {
        Runnable task = () -> {
            try {
                discordLogger.logInfo("Starting scheduled guild sync");
                SyncReport report = GuildSync.fromConfig(SyncConfig.load(), discordLogger).sync();
                discordLogger.logInfo("Completed scheduled guild sync: " + report.getSucceeded() + " guild(s) synced");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                discordLogger.logWarning("Scheduled guild sync interrupted");
            } catch (Exception e) {
                discordLogger.logError("Error in scheduled guild sync: " + e.getMessage() + "\n"
                        + UtilsConfig.getStackTraceAsString(e));
            } finally {
                discordLogger.flush();
            }
        };

        scheduleTask(GUILD_SYNC_TASK, task, intervalHours);
    }

    /**
     * Schedules a task to run now and then at the given interval
     *
     * @param taskName Unique identifier for the task
     * @param task The task to run
     * @param interval How often to run the task
     */
    public synchronized void scheduleTask(String taskName, Runnable task, long interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        // Cancel existing task if it exists
        if (scheduledTasks.containsKey(taskName)) {
            scheduledTasks.get(taskName).cancel();
        }

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(task, 0, interval, unit);
        scheduledTasks.put(taskName, new ScheduledTask(future, interval, task));
        discordLogger.logInfo("Scheduled task '" + taskName + "' to run every " + interval + " " + unitName());
    }

    /**
     * Runs a task now and resets its timer to a full interval
     *
     * @param taskName The name of the task to run early
     * @return false if no such task is scheduled
     */
    public synchronized boolean runTaskEarly(String taskName) {
        ScheduledTask scheduledTask = scheduledTasks.get(taskName);
        if (scheduledTask == null) {
            discordLogger.logWarning("Task '" + taskName + "' not found");
            return false;
        }

        discordLogger.logInfo("Running task '" + taskName + "' early and resetting timer");
        scheduledTask.cancel();

        // same thread as the scheduled runs, so this queues behind a run in progress
        executor.execute(scheduledTask.getTask());

        ScheduledFuture<?> newFuture = executor.scheduleAtFixedRate(
                scheduledTask.getTask(),
                scheduledTask.getInterval(),
                scheduledTask.getInterval(),
                unit);
        scheduledTask.setFuture(newFuture);
        discordLogger.logInfo("Reset timer for task '" + taskName + "' - next run in "
                + scheduledTask.getInterval() + " " + unitName());
        return true;
    }

    /**
     * Stops a scheduled task
     * @return false if no such task is scheduled
     */
    public synchronized boolean stopTask(String taskName) {
        ScheduledTask task = scheduledTasks.remove(taskName);
        if (task == null) {
            discordLogger.logWarning("Task '" + taskName + "' not found");
            return false;
        }
        task.cancel();
        discordLogger.logInfo("Stopped task: " + taskName);
        return true;
    }

    /**
     * Lists all currently scheduled tasks
     * @return task name → interval
     */
    public synchronized Map<String, Long> listTasks() {
        Map<String, Long> tasks = new LinkedHashMap<>();
        for (Map.Entry<String, ScheduledTask> entry : scheduledTasks.entrySet()) {
            tasks.put(entry.getKey(), entry.getValue().getInterval());
        }
        if (tasks.isEmpty()) {
            discordLogger.logInfo("No tasks scheduled");
        } else {
            for (Map.Entry<String, Long> entry : tasks.entrySet()) {
                discordLogger.logInfo("Scheduled: " + entry.getKey() + " (every " + entry.getValue() + " " + unitName() + ")");
            }
        }
        return Collections.unmodifiableMap(tasks);
    }

    /**
     * Shuts down the scheduler, waiting up to a minute for a running task
     */
    public void shutdown() {
        discordLogger.logInfo("Shutting down scheduler...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    discordLogger.logError("Scheduler pool did not terminate");
                }
            }
        } catch (InterruptedException ie) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        discordLogger.logInfo("Scheduler shutdown complete");
    }

    private String unitName() {
        return unit.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Usage: Scheduler [intervalHours]; defaults to every 24 hours
     */
    public static void main(String[] args) {
        long intervalHours = args.length > 0 ? Long.parseLong(args[0]) : 24;
        DiscordLog discordLogger = DiscordLog.fromConfig(SyncConfig.load());
        Scheduler scheduler = new Scheduler(discordLogger);
        scheduler.scheduleGuildSync(intervalHours);

        // Add shutdown hook to clean up when the program exits
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown));

        try {
            Thread.sleep(Long.MAX_VALUE);
        } catch (InterruptedException e) {
            scheduler.shutdown();
            Thread.currentThread().interrupt();
        }
    }
}
