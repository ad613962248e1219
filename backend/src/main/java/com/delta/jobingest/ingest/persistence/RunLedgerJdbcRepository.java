package com.delta.jobingest.ingest.persistence;

import com.delta.jobingest.ingest.model.CycleStatsSnapshot;
import com.delta.jobingest.ingest.model.PipelinePassRecord;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.RunStatus;
import com.delta.jobingest.ingest.model.SourceRunCounts;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Persistence for run records and pipeline passes. Finalizing updates only match rows still
 * in the RUNNING state, so a finalized row never changes again.
 */
@Repository
public class RunLedgerJdbcRepository {
    private static final RowMapper<RunRecord> RUN_MAPPER = (rs, rowNum) -> {
        long passId = rs.getLong("pass_id");
        Long nullablePassId = rs.wasNull() ? null : passId;
        return new RunRecord(
            rs.getLong("id"),
            rs.getString("source_name"),
            nullablePassId,
            toInstant(rs.getTimestamp("start_time")),
            toInstant(rs.getTimestamp("end_time")),
            RunStatus.from(rs.getString("status")),
            rs.getInt("postings_added"),
            rs.getInt("postings_updated"),
            rs.getInt("postings_expired"),
            rs.getInt("duplicates_skipped"),
            rs.getInt("postings_failed"),
            rs.getString("error_message")
        );
    };

    private static final RowMapper<PipelinePassRecord> PASS_MAPPER = (rs, rowNum) -> new PipelinePassRecord(
        rs.getLong("id"),
        rs.getString("pass_trigger"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getString("status"),
        new CycleStatsSnapshot(
            rs.getInt("postings_added"),
            rs.getInt("postings_updated"),
            rs.getInt("postings_expired"),
            rs.getInt("sources_run"),
            rs.getInt("sources_failed")
        )
    );

    private static final String RUN_COLUMNS = """
        id, source_name, pass_id, start_time, end_time, status, postings_added, postings_updated,
        postings_expired, duplicates_skipped, postings_failed, error_message
        """;

    private static final String PASS_COLUMNS = """
        id, pass_trigger, started_at, finished_at, status, sources_run, sources_failed,
        postings_added, postings_updated, postings_expired
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public RunLedgerJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(String sourceName, Long passId, Instant startTime) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceName", sourceName)
            .addValue("passId", passId)
            .addValue("startTime", toTimestamp(startTime))
            .addValue("status", RunStatus.RUNNING.name());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO run_records (source_name, pass_id, start_time, status)
                VALUES (:sourceName, :passId, :startTime, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM run_records
                    WHERE source_name = :sourceName
                      AND start_time = :startTime
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert run record for " + sourceName);
            }
        }
        return id;
    }

    /**
     * Returns the number of rows finalized: 1 on the first call for a run, 0 afterwards.
     */
    public int completeRun(
        long runId,
        Instant endTime,
        RunStatus status,
        SourceRunCounts counts,
        String errorMessage
    ) {
        SourceRunCounts safeCounts = counts == null ? SourceRunCounts.empty() : counts;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("endTime", toTimestamp(endTime))
            .addValue("status", status.name())
            .addValue("added", safeCounts.added())
            .addValue("updated", safeCounts.updated())
            .addValue("expired", safeCounts.expired())
            .addValue("duplicates", safeCounts.duplicatesSkipped())
            .addValue("failed", safeCounts.failed())
            .addValue("errorMessage", errorMessage);
        return jdbc.update(
            """
                UPDATE run_records
                SET end_time = :endTime,
                    status = :status,
                    postings_added = :added,
                    postings_updated = :updated,
                    postings_expired = :expired,
                    duplicates_skipped = :duplicates,
                    postings_failed = :failed,
                    error_message = :errorMessage
                WHERE id = :runId
                  AND status = 'RUNNING'
                """,
            params
        );
    }

    public RunRecord findRun(long runId) {
        List<RunRecord> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM run_records WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            RUN_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<RunRecord> findRecentRuns(String sourceName, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        if (sourceName == null || sourceName.isBlank()) {
            return jdbc.query(
                "SELECT " + RUN_COLUMNS + """
                    FROM run_records
                    ORDER BY start_time DESC, id DESC
                    LIMIT :limit
                    """,
                params,
                RUN_MAPPER
            );
        }
        params.addValue("sourceName", sourceName.trim());
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM run_records
                WHERE source_name = :sourceName
                ORDER BY start_time DESC, id DESC
                LIMIT :limit
                """,
            params,
            RUN_MAPPER
        );
    }

    public List<RunRecord> findRunsForPass(long passId) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM run_records
                WHERE pass_id = :passId
                ORDER BY id
                """,
            new MapSqlParameterSource("passId", passId),
            RUN_MAPPER
        );
    }

    public List<RunRecord> findRunningRunsStartedBefore(Instant cutoff) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM run_records
                WHERE status = 'RUNNING'
                  AND start_time < :cutoff
                ORDER BY id
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff)),
            RUN_MAPPER
        );
    }

    public long insertPass(String trigger, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("trigger", trigger)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", "RUNNING");

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO pipeline_passes (pass_trigger, started_at, status)
                VALUES (:trigger, :startedAt, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM pipeline_passes
                    WHERE started_at = :startedAt
                      AND pass_trigger = :trigger
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert pipeline pass");
            }
        }
        return id;
    }

    public int completePass(long passId, Instant finishedAt, String status, CycleStatsSnapshot stats) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("passId", passId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("sourcesRun", stats.sourcesRun())
            .addValue("sourcesFailed", stats.sourcesFailed())
            .addValue("added", stats.postingsAdded())
            .addValue("updated", stats.postingsUpdated())
            .addValue("expired", stats.postingsExpired());
        return jdbc.update(
            """
                UPDATE pipeline_passes
                SET finished_at = :finishedAt,
                    status = :status,
                    sources_run = :sourcesRun,
                    sources_failed = :sourcesFailed,
                    postings_added = :added,
                    postings_updated = :updated,
                    postings_expired = :expired
                WHERE id = :passId
                  AND status = 'RUNNING'
                """,
            params
        );
    }

    public PipelinePassRecord findPass(long passId) {
        List<PipelinePassRecord> rows = jdbc.query(
            "SELECT " + PASS_COLUMNS + " FROM pipeline_passes WHERE id = :passId",
            new MapSqlParameterSource("passId", passId),
            PASS_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<PipelinePassRecord> findRecentPasses(int limit) {
        return jdbc.query(
            "SELECT " + PASS_COLUMNS + """
                FROM pipeline_passes
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            PASS_MAPPER
        );
    }

    public PipelinePassRecord findLatestPass() {
        List<PipelinePassRecord> rows = findRecentPasses(1);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<PipelinePassRecord> findRunningPassesStartedBefore(Instant cutoff) {
        return jdbc.query(
            "SELECT " + PASS_COLUMNS + """
                FROM pipeline_passes
                WHERE status = 'RUNNING'
                  AND started_at < :cutoff
                ORDER BY id
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff)),
            PASS_MAPPER
        );
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
