package com.europeanalysis.stats.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Idempotent DDL for the unified store. Runs on every startup.
 *
 * Key design notes:
 *  - facts are unique on (source_id, natural_key); natural_key joins region,
 *    period and dimension values with '*' for nulls, so nullable dimensions
 *    still take part in the uniqueness check
 *  - raw_snapshots is append-only and never touched by fact deletes
 *  - column names avoid YEAR/MONTH/VALUE so the same DDL runs on H2 in tests
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatsSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring stats schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS regions
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                code            VARCHAR(64)   NOT NULL,
                name            VARCHAR(512)  NOT NULL,
                region_level    VARCHAR(32),
                parent_code     VARCHAR(64),
                created_at      TIMESTAMP     NOT NULL,
                CONSTRAINT uq_regions_code UNIQUE (code)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS data_sources
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name            VARCHAR(255)  NOT NULL,
                source_type     VARCHAR(32)   NOT NULL,
                url             VARCHAR(2048),
                last_updated    TIMESTAMP,
                created_at      TIMESTAMP     NOT NULL,
                CONSTRAINT uq_data_sources_name UNIQUE (name)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS raw_snapshots
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                dataset_id      VARCHAR(128)  NOT NULL,
                page_index      INTEGER       NOT NULL,
                request_uri     VARCHAR(4096) NOT NULL,
                query_params    TEXT,
                retrieved_at    TIMESTAMP     NOT NULL,
                content_hash    VARCHAR(64)   NOT NULL,
                payload         BYTEA         NOT NULL,
                CONSTRAINT uq_raw_snapshots UNIQUE (dataset_id, retrieved_at, content_hash)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS demographic_facts
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_id       BIGINT        NOT NULL REFERENCES data_sources (id),
                region_id       BIGINT        NOT NULL REFERENCES regions (id),
                natural_key     VARCHAR(512)  NOT NULL,
                period_year     INTEGER       NOT NULL,
                sex             VARCHAR(16),
                age_min         INTEGER,
                age_max         INTEGER,
                population      BIGINT        NOT NULL,
                created_at      TIMESTAMP     NOT NULL,
                updated_at      TIMESTAMP     NOT NULL,
                CONSTRAINT uq_demographic_facts_key UNIQUE (source_id, natural_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS industrial_facts
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_id       BIGINT        NOT NULL REFERENCES data_sources (id),
                region_id       BIGINT        NOT NULL REFERENCES regions (id),
                natural_key     VARCHAR(512)  NOT NULL,
                period_year     INTEGER       NOT NULL,
                period_month    INTEGER,
                nace_code       VARCHAR(64),
                unit            VARCHAR(64),
                obs_value       DOUBLE PRECISION NOT NULL,
                created_at      TIMESTAMP     NOT NULL,
                updated_at      TIMESTAMP     NOT NULL,
                CONSTRAINT uq_industrial_facts_key UNIQUE (source_id, natural_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingestion_runs
            (
                run_id              VARCHAR(36)   PRIMARY KEY,
                dataset_id          VARCHAR(128)  NOT NULL,
                state               VARCHAR(16)   NOT NULL,
                start_page          INTEGER       NOT NULL,
                started_at          TIMESTAMP,
                completed_at        TIMESTAMP,
                pages_persisted     INTEGER       NOT NULL,
                last_persisted_page INTEGER       NOT NULL,
                records_fetched     INTEGER       NOT NULL,
                records_written     INTEGER       NOT NULL,
                records_dropped     INTEGER       NOT NULL,
                error_message       TEXT
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_demographic_region_year ON demographic_facts (region_id, period_year)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_industrial_region_period ON industrial_facts (region_id, period_year, period_month)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_raw_snapshots_dataset ON raw_snapshots (dataset_id, retrieved_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ingestion_runs_dataset ON ingestion_runs (dataset_id, started_at)");

        log.info("Stats schema ready.");
    }
}
