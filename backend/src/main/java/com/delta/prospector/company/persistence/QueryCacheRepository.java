package com.delta.prospector.company.persistence;

import com.delta.prospector.company.model.CacheEntry;
import com.delta.prospector.company.model.QueryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Repository
public class QueryCacheRepository {
    private static final Logger log = LoggerFactory.getLogger(QueryCacheRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public QueryCacheRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public CacheEntry find(String fingerprint) {
        List<CacheEntry> rows = jdbc.query(
            """
                SELECT fingerprint, kind, payload_json, fetched_at, expires_at
                FROM query_cache_entries
                WHERE fingerprint = :fingerprint
                """,
            new MapSqlParameterSource("fingerprint", fingerprint),
            (rs, rowNum) -> new CacheEntry(
                rs.getString("fingerprint"),
                parseKind(rs.getString("kind")),
                rs.getString("payload_json"),
                toInstant(rs.getTimestamp("fetched_at")),
                toInstant(rs.getTimestamp("expires_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void upsert(CacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fingerprint", entry.fingerprint())
            .addValue("kind", entry.kind().name())
            .addValue("payloadJson", entry.payloadJson())
            .addValue("fetchedAt", toTimestamp(entry.fetchedAt()))
            .addValue("expiresAt", toTimestamp(entry.expiresAt()));

        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO query_cache_entries (fingerprint, kind, payload_json, fetched_at, expires_at)
                    VALUES (:fingerprint, :kind, :payloadJson, :fetchedAt, :expiresAt)
                    ON CONFLICT (fingerprint)
                    DO UPDATE SET
                        kind = EXCLUDED.kind,
                        payload_json = EXCLUDED.payload_json,
                        fetched_at = EXCLUDED.fetched_at,
                        expires_at = EXCLUDED.expires_at
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO query_cache_entries (fingerprint, kind, payload_json, fetched_at, expires_at)
                KEY(fingerprint)
                VALUES (:fingerprint, :kind, :payloadJson, :fetchedAt, :expiresAt)
                """,
            params
        );
    }

    public int delete(String fingerprint) {
        return jdbc.update(
            "DELETE FROM query_cache_entries WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource("fingerprint", fingerprint)
        );
    }

    public int deleteAll() {
        return jdbc.getJdbcTemplate().update("DELETE FROM query_cache_entries");
    }

    public int deleteExpired(Instant now) {
        return jdbc.update(
            "DELETE FROM query_cache_entries WHERE expires_at <= :now",
            new MapSqlParameterSource("now", toTimestamp(now))
        );
    }

    public long count() {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM query_cache_entries", Long.class);
        return value == null ? 0L : value;
    }

    private QueryKind parseKind(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return QueryKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to H2-compatible upserts", e);
            return false;
        }
    }
}
