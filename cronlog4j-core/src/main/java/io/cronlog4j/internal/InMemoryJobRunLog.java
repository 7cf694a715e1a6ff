package io.cronlog4j.internal;

import io.cronlog4j.JobRunLog;
import io.cronlog4j.core.JobRunRecord;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * {@link JobRunLog} kept in memory. History is lost with the process, so this is meant for tests,
 * examples and single-run tools.
 */
public class InMemoryJobRunLog implements JobRunLog {

    private static final Comparator<JobRunRecord> BY_START_TIME = Comparator.comparing(JobRunRecord::startTime);

    private final List<JobRunRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(JobRunRecord record) {
        records.add(Objects.requireNonNull(record, "record must not be null"));
    }

    @Override
    public Optional<JobRunRecord> findLatest(String code) {
        return latest(r -> r.code().equals(code));
    }

    @Override
    public Optional<JobRunRecord> findLatestSuccessfulIntervalRun(String code) {
        return latest(r -> r.code().equals(code) && r.succeeded() && !r.ranAtFixedTime());
    }

    @Override
    public boolean existsForRunAtTime(String code, LocalTime ranAtTime, LocalDate date, ZoneId zone) {
        Objects.requireNonNull(ranAtTime, "ranAtTime must not be null");
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        return records.stream().anyMatch(r -> r.code().equals(code)
                && ranAtTime.equals(r.ranAtTime())
                && r.startTime().atZone(zone).toLocalDate().equals(date));
    }

    /**
     * All records of {@code code} in insertion order.
     */
    public List<JobRunRecord> findAll(String code) {
        return records.stream().filter(r -> r.code().equals(code)).toList();
    }

    public int size() {
        return records.size();
    }

    private Optional<JobRunRecord> latest(Predicate<JobRunRecord> filter) {
        // ties go to the record appended last
        return records.stream()
                .filter(filter)
                .reduce((a, b) -> BY_START_TIME.compare(b, a) >= 0 ? b : a);
    }
}
