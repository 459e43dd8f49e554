package com.tubedigest.feed.persistence;

import com.tubedigest.feed.model.CycleRunMeta;
import com.tubedigest.feed.model.Source;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class FeedJdbcRepository {
    private static final RowMapper<Source> SOURCE_MAPPER = (rs, rowNum) -> new Source(
        rs.getLong("source_id"),
        rs.getString("channel_ref"),
        rs.getString("name"),
        rs.getString("url"),
        rs.getBoolean("active"),
        toInstant(rs.getTimestamp("watermark")),
        toInstant(rs.getTimestamp("created_at"))
    );

    private static final RowMapper<CycleRunMeta> RUN_MAPPER = (rs, rowNum) -> new CycleRunMeta(
        rs.getLong("run_id"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getString("status"),
        rs.getString("trigger_name"),
        rs.getInt("quota"),
        rs.getInt("processed_count"),
        rs.getInt("skipped_count"),
        rs.getInt("deferred_count"),
        rs.getString("notes")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public FeedJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("sources", countTable("sources"));
        counts.put("processed_videos", countTable("processed_videos"));
        counts.put("cycle_runs", countTable("cycle_runs"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public long insertSource(String channelRef, String name, String url, Instant watermark, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("channelRef", channelRef)
            .addValue("name", name)
            .addValue("url", url)
            .addValue("watermark", toTimestamp(watermark))
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO sources (channel_ref, name, url, active, watermark, created_at)
                VALUES (:channelRef, :name, :url, TRUE, :watermark, :createdAt)
                """,
            params,
            keyHolder,
            new String[] {"source_id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Source inserted = findSourceByChannelRef(channelRef);
        if (inserted == null) {
            throw new IllegalStateException("Failed to insert source " + channelRef);
        }
        return inserted.sourceId();
    }

    public Source findSourceById(long sourceId) {
        List<Source> rows = jdbc.query(
            """
                SELECT source_id, channel_ref, name, url, active, watermark, created_at
                FROM sources
                WHERE source_id = :sourceId
                """,
            new MapSqlParameterSource("sourceId", sourceId),
            SOURCE_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Source findSourceByChannelRef(String channelRef) {
        List<Source> rows = jdbc.query(
            """
                SELECT source_id, channel_ref, name, url, active, watermark, created_at
                FROM sources
                WHERE channel_ref = :channelRef
                """,
            new MapSqlParameterSource("channelRef", channelRef),
            SOURCE_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Source findSourceByUrl(String url) {
        List<Source> rows = jdbc.query(
            """
                SELECT source_id, channel_ref, name, url, active, watermark, created_at
                FROM sources
                WHERE url = :url
                ORDER BY source_id
                LIMIT 1
                """,
            new MapSqlParameterSource("url", url),
            SOURCE_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Source> findActiveSources() {
        return jdbc.query(
            """
                SELECT source_id, channel_ref, name, url, active, watermark, created_at
                FROM sources
                WHERE active = TRUE
                ORDER BY source_id ASC
                """,
            new MapSqlParameterSource(),
            SOURCE_MAPPER
        );
    }

    public List<Source> findAllSources() {
        return jdbc.query(
            """
                SELECT source_id, channel_ref, name, url, active, watermark, created_at
                FROM sources
                ORDER BY source_id ASC
                """,
            new MapSqlParameterSource(),
            SOURCE_MAPPER
        );
    }

    /**
     * Moves the watermark forward only. Returns the number of rows changed, which is 0
     * when the stored watermark is already at or past {@code watermark} or the source
     * does not exist.
     */
    public int advanceWatermark(long sourceId, Instant watermark) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceId", sourceId)
            .addValue("watermark", toTimestamp(watermark));
        return jdbc.update(
            """
                UPDATE sources
                SET watermark = :watermark
                WHERE source_id = :sourceId
                  AND watermark < :watermark
                """,
            params
        );
    }

    public int setSourceActive(long sourceId, boolean active) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceId", sourceId)
            .addValue("active", active);
        return jdbc.update(
            """
                UPDATE sources
                SET active = :active
                WHERE source_id = :sourceId
                """,
            params
        );
    }

    public long insertCycleRun(Instant startedAt, String status, String trigger, int quota, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("trigger", trigger)
            .addValue("quota", quota)
            .addValue("notes", notes);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO cycle_runs (
                    started_at,
                    status,
                    trigger_name,
                    quota,
                    processed_count,
                    skipped_count,
                    deferred_count,
                    notes
                )
                VALUES (
                    :startedAt,
                    :status,
                    :trigger,
                    :quota,
                    0,
                    0,
                    0,
                    :notes
                )
                """,
            params,
            keyHolder,
            new String[] {"run_id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT run_id
                    FROM cycle_runs
                    WHERE started_at = :startedAt
                      AND status = :status
                    ORDER BY run_id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert cycle run");
            }
        }
        return id;
    }

    public void completeCycleRun(
        long runId,
        Instant finishedAt,
        String status,
        int processedCount,
        int skippedCount,
        int deferredCount,
        String notes
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("processedCount", processedCount)
            .addValue("skippedCount", skippedCount)
            .addValue("deferredCount", deferredCount)
            .addValue("notes", truncate(notes, 1024));
        jdbc.update(
            """
                UPDATE cycle_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    processed_count = :processedCount,
                    skipped_count = :skippedCount,
                    deferred_count = :deferredCount,
                    notes = :notes
                WHERE run_id = :runId
                """,
            params
        );
    }

    public CycleRunMeta findCycleRun(long runId) {
        List<CycleRunMeta> rows = jdbc.query(
            """
                SELECT run_id, started_at, finished_at, status, trigger_name, quota,
                       processed_count, skipped_count, deferred_count, notes
                FROM cycle_runs
                WHERE run_id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            RUN_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CycleRunMeta> findRecentCycleRuns(int limit) {
        int safeLimit = limit <= 0 ? 10 : limit;
        return jdbc.query(
            """
                SELECT run_id, started_at, finished_at, status, trigger_name, quota,
                       processed_count, skipped_count, deferred_count, notes
                FROM cycle_runs
                ORDER BY started_at DESC, run_id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            RUN_MAPPER
        );
    }

    public List<CycleRunMeta> findRunningCycleRuns() {
        return jdbc.query(
            """
                SELECT run_id, started_at, finished_at, status, trigger_name, quota,
                       processed_count, skipped_count, deferred_count, notes
                FROM cycle_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, run_id ASC
                """,
            new MapSqlParameterSource(),
            RUN_MAPPER
        );
    }

    static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
