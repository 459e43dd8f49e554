package com.tubedigest.feed.persistence;

import com.tubedigest.feed.model.ProcessedRecord;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.tubedigest.feed.persistence.FeedJdbcRepository.toInstant;
import static com.tubedigest.feed.persistence.FeedJdbcRepository.toTimestamp;

/**
 * The dedup ledger table. Rows are inserted once and never updated; the primary key
 * on {@code video_id} is what makes a racing second insert fail.
 */
@Repository
public class ProcessedVideoRepository {
    private static final String COLUMNS =
        "video_id, source_id, run_id, title, summary, skip_reason, link, published_at, processed_at";

    private static final RowMapper<ProcessedRecord> RECORD_MAPPER = (rs, rowNum) -> new ProcessedRecord(
        rs.getString("video_id"),
        rs.getLong("source_id"),
        rs.getObject("run_id") == null ? null : rs.getLong("run_id"),
        rs.getString("title"),
        rs.getString("summary"),
        rs.getString("skip_reason"),
        rs.getString("link"),
        toInstant(rs.getTimestamp("published_at")),
        toInstant(rs.getTimestamp("processed_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ProcessedVideoRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean exists(String videoId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM processed_videos WHERE video_id = :videoId",
            new MapSqlParameterSource("videoId", videoId),
            Long.class
        );
        return count != null && count > 0;
    }

    /**
     * Plain insert. A duplicate {@code video_id} surfaces as Spring's
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insert(ProcessedRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("videoId", record.videoId())
            .addValue("sourceId", record.sourceId())
            .addValue("runId", record.runId())
            .addValue("title", record.title())
            .addValue("summary", record.summary())
            .addValue("skipReason", record.skipReason())
            .addValue("link", record.link())
            .addValue("publishedAt", toTimestamp(record.publishedAt()))
            .addValue("processedAt", toTimestamp(record.processedAt()));
        jdbc.update(
            """
                INSERT INTO processed_videos (
                    video_id, source_id, run_id, title, summary, skip_reason, link, published_at, processed_at
                )
                VALUES (
                    :videoId, :sourceId, :runId, :title, :summary, :skipReason, :link, :publishedAt, :processedAt
                )
                """,
            params
        );
    }

    public ProcessedRecord findById(String videoId) {
        List<ProcessedRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM processed_videos WHERE video_id = :videoId",
            new MapSqlParameterSource("videoId", videoId),
            RECORD_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ProcessedRecord> findByRun(long runId) {
        return jdbc.query(
            """
                SELECT %s
                FROM processed_videos
                WHERE run_id = :runId
                ORDER BY published_at ASC, video_id ASC
                """.formatted(COLUMNS),
            new MapSqlParameterSource("runId", runId),
            RECORD_MAPPER
        );
    }

    public List<ProcessedRecord> findLatest(int limit) {
        int safeLimit = limit <= 0 ? 20 : Math.min(limit, 500);
        return jdbc.query(
            """
                SELECT %s
                FROM processed_videos
                ORDER BY processed_at DESC, video_id ASC
                LIMIT :limit
                """.formatted(COLUMNS),
            new MapSqlParameterSource("limit", safeLimit),
            RECORD_MAPPER
        );
    }

    public List<ProcessedRecord> findSummarizedBetween(Instant fromInclusive, Instant toExclusive) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("from", toTimestamp(fromInclusive))
            .addValue("to", toTimestamp(toExclusive));
        return jdbc.query(
            """
                SELECT %s
                FROM processed_videos
                WHERE summary IS NOT NULL
                  AND processed_at >= :from
                  AND processed_at < :to
                ORDER BY published_at ASC, video_id ASC
                """.formatted(COLUMNS),
            params,
            RECORD_MAPPER
        );
    }
}
