package com.delta.prospector.company.persistence;

import com.delta.prospector.company.model.ExportArtifact;
import com.delta.prospector.company.model.ExportRunState;
import com.delta.prospector.company.model.ExportStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ExportRunRepository {
    private static final int MAX_FAILURE_REASON_LENGTH = 1000;

    private static final String RUN_COLUMNS = """
        id, status, start_page, current_page, last_successful_page, total_companies,
        failure_reason, resumed_from_run_id, filters_json, created_at, updated_at, finished_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ExportRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = QueryCacheRepository.detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertRun(int startPage, Long resumedFromRunId, String filtersJson, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", ExportStatus.PROCESSING.name())
            .addValue("startPage", startPage)
            .addValue("lastSuccessfulPage", Math.max(0, startPage - 1))
            .addValue("resumedFromRunId", resumedFromRunId)
            .addValue("filtersJson", filtersJson)
            .addValue("now", toTimestamp(now));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO export_runs (
                    status,
                    start_page,
                    current_page,
                    last_successful_page,
                    total_companies,
                    resumed_from_run_id,
                    filters_json,
                    created_at,
                    updated_at
                )
                VALUES (
                    :status,
                    :startPage,
                    0,
                    :lastSuccessfulPage,
                    0,
                    :resumedFromRunId,
                    :filtersJson,
                    :now,
                    :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert export run: no generated id");
        }
        return key.longValue();
    }

    /**
     * Records one fetched page. {@code last_successful_page} only ever moves forward.
     */
    public void recordPage(long runId, int page, int itemCount, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("page", page)
            .addValue("itemCount", Math.max(0, itemCount))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE export_runs
                SET current_page = :page,
                    last_successful_page = CASE
                        WHEN last_successful_page < :page THEN :page
                        ELSE last_successful_page
                    END,
                    total_companies = total_companies + :itemCount,
                    updated_at = :now
                WHERE id = :runId
                  AND status = 'PROCESSING'
                """,
            params
        );
    }

    public void markCurrentPage(long runId, int page, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("page", page)
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE export_runs
                SET current_page = :page,
                    updated_at = :now
                WHERE id = :runId
                  AND status = 'PROCESSING'
                """,
            params
        );
    }

    /**
     * Moves a PROCESSING run to a terminal status. Returns false when the run was already terminal.
     */
    public boolean finishRun(long runId, ExportStatus status, String failureReason, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", status.name())
            .addValue("failureReason", truncate(failureReason))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE export_runs
                SET status = :status,
                    failure_reason = :failureReason,
                    updated_at = :now,
                    finished_at = :now
                WHERE id = :runId
                  AND status = 'PROCESSING'
                """,
            params
        );
        return updated > 0;
    }

    public ExportRunState findRun(long runId) {
        List<ExportRunState> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM export_runs WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            runMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public ExportRunState findLatestRun() {
        List<ExportRunState> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM export_runs ORDER BY id DESC LIMIT 1",
            new MapSqlParameterSource(),
            runMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ExportRunState> findProcessingRuns() {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM export_runs WHERE status = 'PROCESSING' ORDER BY id ASC",
            new MapSqlParameterSource(),
            runMapper()
        );
    }

    public void saveArtifact(ExportArtifact artifact) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", artifact.runId())
            .addValue("fileName", artifact.fileName())
            .addValue("contentType", artifact.contentType())
            .addValue("content", artifact.content())
            .addValue("startPage", artifact.startPage())
            .addValue("endPage", artifact.endPage())
            .addValue("companyCount", artifact.companyCount())
            .addValue("createdAt", toTimestamp(artifact.createdAt()));

        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO export_artifacts (
                        export_run_id, file_name, content_type, content,
                        start_page, end_page, company_count, created_at
                    )
                    VALUES (
                        :runId, :fileName, :contentType, :content,
                        :startPage, :endPage, :companyCount, :createdAt
                    )
                    ON CONFLICT (export_run_id)
                    DO UPDATE SET
                        file_name = EXCLUDED.file_name,
                        content_type = EXCLUDED.content_type,
                        content = EXCLUDED.content,
                        start_page = EXCLUDED.start_page,
                        end_page = EXCLUDED.end_page,
                        company_count = EXCLUDED.company_count,
                        created_at = EXCLUDED.created_at
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO export_artifacts (
                    export_run_id, file_name, content_type, content,
                    start_page, end_page, company_count, created_at
                )
                KEY(export_run_id)
                VALUES (
                    :runId, :fileName, :contentType, :content,
                    :startPage, :endPage, :companyCount, :createdAt
                )
                """,
            params
        );
    }

    public ExportArtifact findArtifact(long runId) {
        List<ExportArtifact> rows = jdbc.query(
            """
                SELECT export_run_id, file_name, content_type, content,
                       start_page, end_page, company_count, created_at
                FROM export_artifacts
                WHERE export_run_id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> new ExportArtifact(
                rs.getLong("export_run_id"),
                rs.getString("file_name"),
                rs.getString("content_type"),
                rs.getBytes("content"),
                rs.getInt("start_page"),
                rs.getInt("end_page"),
                rs.getInt("company_count"),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private RowMapper<ExportRunState> runMapper() {
        return (rs, rowNum) -> new ExportRunState(
            rs.getLong("id"),
            parseStatus(rs.getString("status")),
            rs.getInt("start_page"),
            rs.getInt("current_page"),
            rs.getInt("last_successful_page"),
            rs.getInt("total_companies"),
            rs.getString("failure_reason"),
            getNullableLong(rs, "resumed_from_run_id"),
            rs.getString("filters_json"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("finished_at"))
        );
    }

    private ExportStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return ExportStatus.IDLE;
        }
        try {
            return ExportStatus.valueOf(raw.trim());
        } catch (IllegalArgumentException e) {
            return ExportStatus.IDLE;
        }
    }

    private Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= MAX_FAILURE_REASON_LENGTH ? trimmed : trimmed.substring(0, MAX_FAILURE_REASON_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
