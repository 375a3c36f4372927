package com.telemetra.service.storage.impl;

import com.telemetra.service.core.job.IngestionJob;
import com.telemetra.service.core.job.IngestionJobRepository;
import com.telemetra.service.core.job.JobStatus;
import com.telemetra.service.core.normalize.PayloadFormat;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcIngestionJobRepository implements IngestionJobRepository {

    private static final String COLUMNS =
            """
            id, organization_id, file_name, source_format, payload_ref, status, total_rows, processed_rows,
            failed_rows, rejected_rows, progress, error_message, logs, created_at, updated_at, started_at, finished_at
            """;

    static final String INSERT_SQL =
            """
            insert into ingestion_jobs(
                  id, organization_id, file_name, source_format, payload_ref, status,
                  processed_rows, failed_rows, rejected_rows, progress, created_at, updated_at
            ) values (
                  :id, :tenant, :file_name, :source_format, :payload_ref, 'pending',
                  0, 0, 0, 0, :now, :now
            )
            """;

    static final String CLAIM_SQL =
            """
            update ingestion_jobs
               set status = 'processing', started_at = :now, updated_at = :now
             where id = :id and status = 'pending'
            """;

    static final String TOTAL_SQL =
            """
            update ingestion_jobs
               set total_rows = :total, updated_at = :now
             where id = :id and status = 'processing'
            """;

    static final String PROGRESS_SQL =
            """
            update ingestion_jobs
               set processed_rows = greatest(processed_rows, :processed),
                   failed_rows = greatest(failed_rows, :failed),
                   rejected_rows = greatest(rejected_rows, :rejected),
                   progress = greatest(progress, :progress),
                   updated_at = :now
             where id = :id and status = 'processing'
            """;

    static final String COMPLETE_SQL =
            """
            update ingestion_jobs
               set status = 'completed',
                   processed_rows = greatest(processed_rows, :processed),
                   failed_rows = greatest(failed_rows, :failed),
                   rejected_rows = greatest(rejected_rows, :rejected),
                   total_rows = :total,
                   progress = 100,
                   updated_at = :now,
                   finished_at = :now
             where id = :id and status = 'processing'
            """;

    // a line that would push the log past :max_log is dropped
    static final String APPEND_LOG_SQL =
            """
            update ingestion_jobs
               set logs = case when length(logs) + length(:line) <= :max_log then logs || :line else logs end,
                   updated_at = :now
             where id = :id and status = 'processing'
            """;

    static final String FAIL_SQL =
            """
            update ingestion_jobs
               set status = 'failed', error_message = :error,
                   logs = case when length(logs) + length(:line) <= :max_log then logs || :line else logs end,
                   updated_at = :now, finished_at = :now
             where id = :id and status in ('pending', 'processing')
            """;

    static final String FAIL_STALE_SQL =
            """
            update ingestion_jobs
               set status = 'failed', error_message = :error,
                   logs = case when length(logs) + length(:line) <= :max_log then logs || :line else logs end,
                   updated_at = :now, finished_at = :now
             where status = 'processing' and updated_at < :stale_before
            returning payload_ref
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public void insert(IngestionJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", job.id())
                .addValue("tenant", job.tenantId())
                .addValue("file_name", job.fileName())
                .addValue("source_format", job.sourceFormat().wireValue())
                .addValue("payload_ref", job.payloadRef())
                .addValue("now", ts(job.createdAt()));
        jdbc.update(INSERT_SQL, params);
    }

    @Override
    public Optional<IngestionJob> findById(UUID jobId) {
        String sql = "select " + COLUMNS + " from ingestion_jobs where id = :id";
        List<IngestionJob> rows = jdbc.query(sql, new MapSqlParameterSource("id", jobId), this::mapJob);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<IngestionJob> findByTenant(UUID tenantId, UUID jobId) {
        String sql = "select " + COLUMNS + " from ingestion_jobs where id = :id and organization_id = :tenant";
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("id", jobId).addValue("tenant", tenantId);
        return jdbc.query(sql, params, this::mapJob).stream().findFirst();
    }

    @Override
    public List<IngestionJob> findRecent(UUID tenantId, int limit) {
        String sql = "select " + COLUMNS
                + " from ingestion_jobs where organization_id = :tenant order by created_at desc limit :limit";
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("tenant", tenantId).addValue("limit", limit);
        return jdbc.query(sql, params, this::mapJob);
    }

    @Override
    public List<UUID> findPendingIds(int limit) {
        String sql = "select id from ingestion_jobs where status = 'pending' order by created_at limit :limit";
        return jdbc.query(sql, new MapSqlParameterSource("limit", limit), (rs, n) -> rs.getObject("id", UUID.class));
    }

    @Override
    public boolean claim(UUID jobId, Instant now) {
        return jdbc.update(CLAIM_SQL, idAndNow(jobId, now)) == 1;
    }

    @Override
    public boolean updateTotal(UUID jobId, long totalRows, Instant now) {
        return jdbc.update(TOTAL_SQL, idAndNow(jobId, now).addValue("total", totalRows)) == 1;
    }

    @Override
    public boolean updateProgress(
            UUID jobId, long processedRows, long failedRows, long rejectedRows, int progress, Instant now) {
        MapSqlParameterSource params = idAndNow(jobId, now)
                .addValue("processed", processedRows)
                .addValue("failed", failedRows)
                .addValue("rejected", rejectedRows)
                .addValue("progress", progress);
        return jdbc.update(PROGRESS_SQL, params) == 1;
    }

    @Override
    public boolean complete(
            UUID jobId, long processedRows, long failedRows, long rejectedRows, long totalRows, Instant now) {
        MapSqlParameterSource params = idAndNow(jobId, now)
                .addValue("processed", processedRows)
                .addValue("failed", failedRows)
                .addValue("rejected", rejectedRows)
                .addValue("total", totalRows);
        return jdbc.update(COMPLETE_SQL, params) == 1;
    }

    @Override
    public boolean appendLog(UUID jobId, String message, Instant now) {
        return jdbc.update(APPEND_LOG_SQL, withLogLine(idAndNow(jobId, now), message, now)) == 1;
    }

    @Override
    public boolean fail(UUID jobId, String errorMessage, Instant now) {
        MapSqlParameterSource params =
                withLogLine(idAndNow(jobId, now).addValue("error", errorMessage), "Error: " + errorMessage, now);
        return jdbc.update(FAIL_SQL, params) == 1;
    }

    @Override
    public List<String> failStale(Instant staleBefore, String errorMessage, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("error", errorMessage)
                .addValue("now", ts(now))
                .addValue("stale_before", ts(staleBefore));
        return jdbc.queryForList(FAIL_STALE_SQL, withLogLine(params, "Error: " + errorMessage, now), String.class);
    }

    private static MapSqlParameterSource withLogLine(MapSqlParameterSource params, String message, Instant now) {
        return params.addValue("line", IngestionJob.logLine(now, message))
                .addValue("max_log", IngestionJob.MAX_LOG_CHARS);
    }

    private static MapSqlParameterSource idAndNow(UUID jobId, Instant now) {
        return new MapSqlParameterSource().addValue("id", jobId).addValue("now", ts(now));
    }

    private IngestionJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        long total = rs.getLong("total_rows");
        Long totalRows = rs.wasNull() ? null : total;
        return IngestionJob.builder()
                .id(rs.getObject("id", UUID.class))
                .tenantId(rs.getObject("organization_id", UUID.class))
                .fileName(rs.getString("file_name"))
                .sourceFormat(PayloadFormat.fromWire(rs.getString("source_format")))
                .payloadRef(rs.getString("payload_ref"))
                .status(JobStatus.fromWire(rs.getString("status")))
                .totalRows(totalRows)
                .processedRows(rs.getLong("processed_rows"))
                .failedRows(rs.getLong("failed_rows"))
                .rejectedRows(rs.getLong("rejected_rows"))
                .progress(rs.getInt("progress"))
                .errorMessage(rs.getString("error_message"))
                .logs(rs.getString("logs"))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .updatedAt(instant(rs.getTimestamp("updated_at")))
                .startedAt(instant(rs.getTimestamp("started_at")))
                .finishedAt(instant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
