package com.europeanalysis.stats.storage;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Fresh in-memory H2 database in PostgreSQL mode with the schema applied,
 * plus the repositories wired over it.
 */
public final class TestDatabase {

    public final JdbcTemplate jdbcTemplate;
    public final TransactionTemplate transactionTemplate;

    private TestDatabase(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    public static TestDatabase create() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID()
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1",
                "sa", "");
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        new StatsSchema(jdbcTemplate).ensureSchema();
        return new TestDatabase(jdbcTemplate, transactionTemplate);
    }

    public RegionRepository regions() {
        return new RegionRepository(jdbcTemplate);
    }

    public DataSourceRepository dataSources() {
        return new DataSourceRepository(jdbcTemplate);
    }

    public RawSnapshotRepository snapshots() {
        return new RawSnapshotRepository(jdbcTemplate);
    }

    public FactRepository facts() {
        return new FactRepository(jdbcTemplate, transactionTemplate);
    }

    public IngestionRunRepository runs() {
        return new IngestionRunRepository(jdbcTemplate);
    }

    public long count(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }
}
