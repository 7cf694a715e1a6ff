package io.cronlog4j;

/**
 * Main entry point for running registered jobs.
 *
 * <p>Each call decides per job whether it is due, runs it at most once and appends the outcome
 * to the {@link JobRunLog}. Nothing is returned: the run log is the only result.
 *
 * <p>Typical usage from an external trigger (system cron, Kubernetes CronJob, scheduler bean):
 * <pre>{@code
 * cronlog.runAll(false);
 * cronlog.run("reports.daily", true); // ignore the schedule
 * }</pre>
 *
 * <p>No locking is done: two processes calling this at the same time may both run a job.
 */
public interface Cronlog {

    /**
     * Run every registered job that is due, in registration order.
     * An invalid job is logged and skipped; the remaining jobs still run.
     */
    void runAll(boolean force);

    /**
     * Run one job by code.
     *
     * @throws io.cronlog4j.core.InvalidJobException when no job is registered under {@code code}
     */
    void run(String code, boolean force);
}
