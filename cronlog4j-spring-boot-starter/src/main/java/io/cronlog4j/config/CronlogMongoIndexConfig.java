package io.cronlog4j.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;
import java.util.Objects;

/**
 * MongoDB index definitions for the run log.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code cronlog.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code cron_job_logs} by default)</h3>
 * <ul>
 *   <li><b>idx_code_startTime</b>: { code: 1, startTime: -1 }
 *       <br/>Used by the latest-run lookup.</li>
 *   <li><b>idx_code_success_startTime</b>: { code: 1, succeeded: 1, ranAtTime: 1, startTime: -1 }
 *       <br/>Used by the latest successful interval run lookup.</li>
 *   <li><b>idx_code_ranAtTime_startTime</b>: { code: 1, ranAtTime: 1, startTime: 1 }
 *       <br/>Used by the once-per-day check of fixed run times.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.cron_job_logs.createIndex({ code: 1, startTime: -1 }, { name: "idx_code_startTime" });
 * db.cron_job_logs.createIndex({ code: 1, succeeded: 1, ranAtTime: 1, startTime: -1 }, { name: "idx_code_success_startTime" });
 * db.cron_job_logs.createIndex({ code: 1, ranAtTime: 1, startTime: 1 }, { name: "idx_code_ranAtTime_startTime" });
 * </pre>
 */
public class CronlogMongoIndexConfig {

    public static final String IDX_CODE_START_TIME = "idx_code_startTime";
    public static final String IDX_CODE_SUCCESS_START_TIME = "idx_code_success_startTime";
    public static final String IDX_CODE_RAN_AT_TIME_START_TIME = "idx_code_ranAtTime_startTime";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public CronlogMongoIndexConfig(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    /**
     * Manually ensure required indexes for the run log.
     */
    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(collection);
        for (Index index : requiredIndexes()) {
            ops.ensureIndex(index);
        }
    }

    public static List<Index> requiredIndexes() {
        return List.of(codeStartTimeIndex(), codeSuccessStartTimeIndex(), codeRanAtTimeStartTimeIndex());
    }

    /**
     * Keys: code ASC, startTime DESC
     */
    public static Index codeStartTimeIndex() {
        return new Index()
                .on("code", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.DESC)
                .named(IDX_CODE_START_TIME);
    }

    /**
     * Keys: code ASC, succeeded ASC, ranAtTime ASC, startTime DESC
     */
    public static Index codeSuccessStartTimeIndex() {
        return new Index()
                .on("code", Sort.Direction.ASC)
                .on("succeeded", Sort.Direction.ASC)
                .on("ranAtTime", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.DESC)
                .named(IDX_CODE_SUCCESS_START_TIME);
    }

    /**
     * Keys: code ASC, ranAtTime ASC, startTime ASC
     */
    public static Index codeRanAtTimeStartTimeIndex() {
        return new Index()
                .on("code", Sort.Direction.ASC)
                .on("ranAtTime", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.ASC)
                .named(IDX_CODE_RAN_AT_TIME_START_TIME);
    }
}
