package io.cronlog4j.internal.mongo;

import io.cronlog4j.JobRunLog;
import io.cronlog4j.core.JobRunRecord;
import io.cronlog4j.utils.TimeOfDayParser;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for the run log.
 *
 * <p>Records are insert-only: this class never updates or deletes a run. Retention (TTL index,
 * archiving) is left to the deployment.
 *
 * <p>"Latest" queries sort by {@code startTime} descending, then {@code _id} descending so that
 * runs sharing a start time resolve to the one inserted last.
 */
public class MongoJobRunLog implements JobRunLog {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoJobRunLog(MongoTemplate mongoTemplate) {
        this(mongoTemplate, JobRunDocument.DEFAULT_COLLECTION);
    }

    public MongoJobRunLog(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }

    @Override
    public void append(JobRunRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        mongoTemplate.insert(toDocument(record), collection);
    }

    @Override
    public Optional<JobRunRecord> findLatest(String code) {
        return findLatest(Criteria.where("code").is(code));
    }

    @Override
    public Optional<JobRunRecord> findLatestSuccessfulIntervalRun(String code) {
        return findLatest(Criteria.where("code").is(code)
                .and("succeeded").is(true)
                .and("ranAtTime").is(null));
    }

    @Override
    public boolean existsForRunAtTime(String code, LocalTime ranAtTime, LocalDate date, ZoneId zone) {
        Objects.requireNonNull(ranAtTime, "ranAtTime must not be null");
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant nextDayStart = date.plusDays(1).atStartOfDay(zone).toInstant();

        Query q = new Query(Criteria.where("code").is(code)
                .and("ranAtTime").is(TimeOfDayParser.format(ranAtTime))
                .and("startTime").gte(dayStart).lt(nextDayStart));
        return mongoTemplate.exists(q, JobRunDocument.class, collection);
    }

    private Optional<JobRunRecord> findLatest(Criteria criteria) {
        Query q = new Query(criteria)
                .with(Sort.by(Sort.Order.desc("startTime"), Sort.Order.desc("_id")))
                .limit(1);
        JobRunDocument doc = mongoTemplate.findOne(q, JobRunDocument.class, collection);
        return Optional.ofNullable(doc).map(MongoJobRunLog::toRecord);
    }

    static JobRunDocument toDocument(JobRunRecord record) {
        JobRunDocument doc = new JobRunDocument();
        doc.setCode(record.code());
        doc.setStartTime(record.startTime());
        doc.setEndTime(record.endTime());
        doc.setSucceeded(record.succeeded());
        doc.setMessage(record.message());
        doc.setRanAtTime(TimeOfDayParser.format(record.ranAtTime()));
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobRunRecord)}.
     */
    static JobRunRecord toRecord(JobRunDocument doc) {
        LocalTime ranAtTime = doc.getRanAtTime() == null ? null : TimeOfDayParser.parse(doc.getRanAtTime());
        return new JobRunRecord(
                doc.getCode(),
                doc.getStartTime(),
                doc.getEndTime(),
                doc.isSucceeded(),
                doc.getMessage(),
                ranAtTime
        );
    }
}
