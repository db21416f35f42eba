package com.apod.pipeline.etl.persistence;

import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.MediaType;
import com.apod.pipeline.etl.model.Provenance;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class ApodJdbcRepository {
    private static final RowMapper<ApodRecord> RECORD_MAPPER = (rs, rowNum) -> {
        Timestamp retrievedAt = rs.getTimestamp("retrieved_at");
        MediaType mediaType = MediaType.fromWireValue(rs.getString("media_type"));
        return new ApodRecord(
            rs.getDate("apod_date").toLocalDate(),
            rs.getString("title"),
            rs.getString("url"),
            rs.getString("hdurl"),
            mediaType == null ? MediaType.IMAGE : mediaType,
            rs.getString("explanation"),
            rs.getString("copyright"),
            retrievedAt == null ? null : retrievedAt.toInstant(),
            Provenance.fromWireValue(rs.getString("provenance"))
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public ApodJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public void upsert(ApodRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("date", Date.valueOf(record.date()))
            .addValue("title", record.title())
            .addValue("url", record.mediaUrl())
            .addValue("hdurl", record.highDefUrl())
            .addValue("mediaType", record.mediaType() == null ? null : record.mediaType().wireValue())
            .addValue("explanation", record.explanation())
            .addValue("copyright", record.attribution())
            .addValue("provenance", record.provenance() == null ? null : record.provenance().wireValue())
            .addValue("retrievedAt", record.retrievedAt() == null ? null : Timestamp.from(record.retrievedAt()))
            .addValue("now", Timestamp.from(Instant.now()));

        String update = """
            UPDATE apod_data
            SET title = :title,
                url = :url,
                hdurl = :hdurl,
                media_type = :mediaType,
                explanation = :explanation,
                copyright = :copyright,
                provenance = :provenance,
                retrieved_at = :retrievedAt,
                updated_at = :now
            WHERE apod_date = :date
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO apod_data
                            (apod_date, title, url, hdurl, media_type, explanation, copyright,
                             provenance, retrieved_at, created_at, updated_at)
                        VALUES (:date, :title, :url, :hdurl, :mediaType, :explanation, :copyright,
                                :provenance, :retrievedAt, :now, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }

    public int countByDate(LocalDate date) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM apod_data
                WHERE apod_date = :date
                """,
            new MapSqlParameterSource().addValue("date", Date.valueOf(date)),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public long countAll() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM apod_data", Long.class);
        return count == null ? 0L : count;
    }

    public Optional<ApodRecord> findByDate(LocalDate date) {
        List<ApodRecord> rows = jdbc.query(
            """
                SELECT apod_date, title, url, hdurl, media_type, explanation, copyright,
                       provenance, retrieved_at
                FROM apod_data
                WHERE apod_date = :date
                """,
            new MapSqlParameterSource().addValue("date", Date.valueOf(date)),
            RECORD_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ApodRecord> findNewest(int limit) {
        return jdbc.query(
            """
                SELECT apod_date, title, url, hdurl, media_type, explanation, copyright,
                       provenance, retrieved_at
                FROM apod_data
                ORDER BY apod_date DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            RECORD_MAPPER
        );
    }
}
