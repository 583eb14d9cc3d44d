package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.RepositoryConflictException;
import com.europeanalysis.stats.model.Region;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Regions are created on first sight and never updated: the first writer's
 * name and level win, concurrent creators all get the same row back.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class RegionRepository {

    private static final String COLUMNS = "id, code, name, region_level, parent_code";

    private static final RowMapper<Region> ROW_MAPPER = (rs, n) -> Region.builder()
            .id(rs.getLong("id"))
            .code(rs.getString("code"))
            .name(rs.getString("name"))
            .level(rs.getString("region_level"))
            .parentCode(rs.getString("parent_code"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Region getOrCreate(String code, String name, String level, String parentCode) {
        Optional<Region> existing = findByCode(code);
        if (existing.isPresent()) {
            return existing.get();
        }

        int inserted = jdbcTemplate.update("""
                INSERT INTO regions (code, name, region_level, parent_code, created_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """,
                code, name == null ? code : name, level, parentCode, JdbcSupport.timestamp(Instant.now()));
        if (inserted > 0) {
            log.info("Created new region: {} ({}, {})", code, name, level);
        }

        return findByCode(code).orElseThrow(() ->
                new RepositoryConflictException("Region " + code + " not found after insert"));
    }

    public Optional<Region> findByCode(String code) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM regions WHERE code = ?", ROW_MAPPER, code)
                .stream()
                .findFirst();
    }

    public List<Region> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM regions ORDER BY code", ROW_MAPPER);
    }

    /** Case-insensitive substring match on code or name. */
    public List<Region> search(String query) {
        String pattern = "%" + query.toLowerCase(Locale.ROOT) + "%";
        return jdbcTemplate.query("SELECT " + COLUMNS
                        + " FROM regions WHERE LOWER(code) LIKE ? OR LOWER(name) LIKE ? ORDER BY code",
                ROW_MAPPER, pattern, pattern);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM regions", Long.class);
        return count == null ? 0 : count;
    }
}
