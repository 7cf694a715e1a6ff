package io.cronlog4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted job runs.
 *
 * <p>ranAtTime is stored as "HH:mm" and written as null for interval runs, so
 * "not a fixed-time run" can be queried with {@code ranAtTime: null}.
 */
@Document(collection = JobRunDocument.DEFAULT_COLLECTION)
public class JobRunDocument {

    public static final String DEFAULT_COLLECTION = "cron_job_logs";

    @Id
    private String id;

    private String code;
    private Instant startTime;
    private Instant endTime;
    private boolean succeeded;
    private String message;

    @Field(write = Field.Write.ALWAYS)
    private String ranAtTime;

    public JobRunDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public void setSucceeded(boolean succeeded) {
        this.succeeded = succeeded;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getRanAtTime() {
        return ranAtTime;
    }

    public void setRanAtTime(String ranAtTime) {
        this.ranAtTime = ranAtTime;
    }
}
