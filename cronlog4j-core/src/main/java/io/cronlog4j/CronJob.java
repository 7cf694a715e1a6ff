package io.cronlog4j;

import io.cronlog4j.core.Schedule;

/**
 * A periodic job definition.
 *
 * <p>{@link #code()} identifies the job in the run log and must stay stable across releases,
 * e.g. "reports.daily".
 */
public interface CronJob {
    String code();

    Schedule schedule();

    /**
     * Run the job body once.
     *
     * @return short status text stored with a successful run (may be null or empty)
     * @throws Exception any failure; the runner records it and never rethrows it.
     *                   Throw {@link io.cronlog4j.core.JobFailedException} to keep a partial status text.
     */
    String execute() throws Exception;
}
