package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.RepositoryConflictException;
import com.europeanalysis.stats.model.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@Slf4j
@RequiredArgsConstructor
public class DataSourceRepository {

    private static final String COLUMNS = "id, name, source_type, url, last_updated, created_at";

    private static final RowMapper<DataSource> ROW_MAPPER = (rs, n) -> DataSource.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .sourceType(rs.getString("source_type"))
            .url(rs.getString("url"))
            .lastUpdated(JdbcSupport.instant(rs, "last_updated"))
            .createdAt(JdbcSupport.instant(rs, "created_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public DataSource getOrCreate(String name, String sourceType, String url) {
        Optional<DataSource> existing = findByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }

        int inserted = jdbcTemplate.update("""
                INSERT INTO data_sources (name, source_type, url, created_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """,
                name, sourceType, url, JdbcSupport.timestamp(Instant.now()));
        if (inserted > 0) {
            log.info("Created new data source: {} ({})", name, url);
        }

        return findByName(name).orElseThrow(() ->
                new RepositoryConflictException("Data source " + name + " not found after insert"));
    }

    /**
     * Moves last_updated forward only. Returns false when the stored value is
     * already at or after {@code at} (a slower run finishing late).
     */
    public boolean markUpdated(long sourceId, Instant at) {
        int rows = jdbcTemplate.update("""
                UPDATE data_sources SET last_updated = ?
                WHERE id = ? AND (last_updated IS NULL OR last_updated < ?)
                """,
                JdbcSupport.timestamp(at), sourceId, JdbcSupport.timestamp(at));
        return rows > 0;
    }

    public Optional<DataSource> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM data_sources WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    public Optional<DataSource> findByName(String name) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM data_sources WHERE name = ?", ROW_MAPPER, name)
                .stream()
                .findFirst();
    }

    public List<DataSource> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM data_sources ORDER BY name", ROW_MAPPER);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM data_sources", Long.class);
        return count == null ? 0 : count;
    }
}
