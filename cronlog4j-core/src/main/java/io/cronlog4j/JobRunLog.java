package io.cronlog4j;

import io.cronlog4j.core.JobRunRecord;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Durable history of job runs.
 *
 * <p>The runner only needs four operations, so any store that can filter by code and sort by
 * start time can back it (MongoDB collection, SQL table, in-memory list for tests).
 *
 * <p>Implementations do not need to coordinate reads and writes: the runner reads a snapshot,
 * decides, and appends later.
 */
public interface JobRunLog {

    /**
     * Persist a finished run. Called exactly once per execution attempt.
     */
    void append(JobRunRecord record);

    /**
     * Most recent run of {@code code} by start time, successful or not.
     */
    Optional<JobRunRecord> findLatest(String code);

    /**
     * Most recent successful run of {@code code} that was not triggered by a fixed run time.
     */
    Optional<JobRunRecord> findLatestSuccessfulIntervalRun(String code);

    /**
     * Whether a run of {@code code} tagged with {@code ranAtTime} started on {@code date}.
     *
     * @param zone zone in which {@code date} is a calendar day
     */
    boolean existsForRunAtTime(String code, LocalTime ranAtTime, LocalDate date, ZoneId zone);
}
