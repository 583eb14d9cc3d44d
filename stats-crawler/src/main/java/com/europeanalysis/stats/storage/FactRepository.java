package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.RepositoryConflictException;
import com.europeanalysis.stats.model.DatasetFamily;
import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.FactFilter;
import com.europeanalysis.stats.model.FactRecord;
import com.europeanalysis.stats.model.FactStatistics;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fact tables: transactional upsert by natural key, filtered reads and aggregates.
 *
 * Upsert strategy: within one transaction, UPDATE each fact by
 * (source_id, natural_key) and batch-INSERT the ones no row matched. Writers
 * of the same dataset are serialized by the dataset lock, so the only way the
 * INSERT can hit the unique key is a writer outside that discipline; that is
 * reported as a {@link RepositoryConflictException} and the batch rolls back.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class FactRepository {

    private static final int BATCH_SIZE = 1000;

    private static final RowMapper<DemographicFact> DEMOGRAPHIC_MAPPER = (rs, n) -> DemographicFact.builder()
            .id(rs.getLong("id"))
            .sourceId(rs.getLong("source_id"))
            .regionId(rs.getLong("region_id"))
            .regionCode(rs.getString("region_code"))
            .regionName(rs.getString("region_name"))
            .year(rs.getInt("period_year"))
            .sex(rs.getString("sex"))
            .ageMin(JdbcSupport.nullableInt(rs, "age_min"))
            .ageMax(JdbcSupport.nullableInt(rs, "age_max"))
            .population(rs.getLong("population"))
            .build();

    private static final RowMapper<IndustrialFact> INDUSTRIAL_MAPPER = (rs, n) -> IndustrialFact.builder()
            .id(rs.getLong("id"))
            .sourceId(rs.getLong("source_id"))
            .regionId(rs.getLong("region_id"))
            .regionCode(rs.getString("region_code"))
            .regionName(rs.getString("region_name"))
            .year(rs.getInt("period_year"))
            .month(JdbcSupport.nullableInt(rs, "period_month"))
            .naceCode(rs.getString("nace_code"))
            .unit(rs.getString("unit"))
            .value(rs.getDouble("obs_value"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Insert-or-update every fact in one transaction. Facts repeating a natural
     * key within the batch collapse to the last one. All facts must belong to
     * the same family.
     */
    public UpsertResult upsertFacts(List<? extends FactRecord> facts, long sourceId) {
        if (facts.isEmpty()) {
            return UpsertResult.EMPTY;
        }
        DatasetFamily family = facts.get(0).family();
        Map<String, FactRecord> unique = new LinkedHashMap<>();
        for (FactRecord fact : facts) {
            if (fact.family() != family) {
                throw new IllegalArgumentException("Mixed fact families in one batch: " + family + " and " + fact.family());
            }
            if (fact.getRegionId() == null) {
                throw new IllegalArgumentException("Fact without a resolved region: " + fact.naturalKey());
            }
            unique.put(fact.naturalKey(), fact);
        }
        if (unique.size() < facts.size()) {
            log.debug("Collapsed {} in-batch duplicates for source {}", facts.size() - unique.size(), sourceId);
        }

        UpsertResult result = transactionTemplate.execute(status -> {
            Timestamp now = JdbcSupport.timestamp(Instant.now());
            List<FactRecord> toInsert = new ArrayList<>();
            int updated = 0;

            for (FactRecord fact : unique.values()) {
                int rows = updateMeasure(fact, sourceId, now);
                if (rows == 0) {
                    toInsert.add(fact);
                } else if (rows == 1) {
                    updated++;
                } else {
                    throw new RepositoryConflictException(rows + " rows share natural key "
                            + fact.naturalKey() + " for source " + sourceId);
                }
            }

            try {
                insertAll(family, toInsert, sourceId, now);
            } catch (DuplicateKeyException e) {
                throw new RepositoryConflictException("Concurrent insert of " + family
                        + " facts for source " + sourceId, e);
            }
            return new UpsertResult(toInsert.size(), updated);
        });

        log.debug("Upserted {} {} facts for source {}: {} inserted, {} updated",
                unique.size(), family, sourceId, result.inserted(), result.updated());
        return result;
    }

    /**
     * Removes all facts of one source from both fact tables. Raw snapshots stay.
     */
    public int deleteBySource(long sourceId) {
        Integer deleted = transactionTemplate.execute(status ->
                jdbcTemplate.update("DELETE FROM demographic_facts WHERE source_id = ?", sourceId)
                        + jdbcTemplate.update("DELETE FROM industrial_facts WHERE source_id = ?", sourceId));
        log.info("Deleted {} facts for source {}", deleted, sourceId);
        return deleted == null ? 0 : deleted;
    }

    private int updateMeasure(FactRecord fact, long sourceId, Timestamp now) {
        return switch (fact.family()) {
            case DEMOGRAPHIC -> jdbcTemplate.update(
                    "UPDATE demographic_facts SET population = ?, updated_at = ? WHERE source_id = ? AND natural_key = ?",
                    ((DemographicFact) fact).getPopulation(), now, sourceId, fact.naturalKey());
            case INDUSTRIAL -> jdbcTemplate.update(
                    "UPDATE industrial_facts SET obs_value = ?, updated_at = ? WHERE source_id = ? AND natural_key = ?",
                    ((IndustrialFact) fact).getValue(), now, sourceId, fact.naturalKey());
        };
    }

    private void insertAll(DatasetFamily family, List<FactRecord> facts, long sourceId, Timestamp now) {
        if (facts.isEmpty()) {
            return;
        }
        switch (family) {
            case DEMOGRAPHIC -> jdbcTemplate.batchUpdate("""
                    INSERT INTO demographic_facts
                    (source_id, region_id, natural_key, period_year, sex, age_min, age_max, population, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, facts, BATCH_SIZE, (ps, record) -> {
                DemographicFact f = (DemographicFact) record;
                ps.setLong(1, sourceId);
                ps.setLong(2, f.getRegionId());
                ps.setString(3, f.naturalKey());
                ps.setInt(4, f.getYear());
                ps.setString(5, f.getSex());
                ps.setObject(6, f.getAgeMin(), Types.INTEGER);
                ps.setObject(7, f.getAgeMax(), Types.INTEGER);
                ps.setLong(8, f.getPopulation());
                ps.setTimestamp(9, now);
                ps.setTimestamp(10, now);
            });
            case INDUSTRIAL -> jdbcTemplate.batchUpdate("""
                    INSERT INTO industrial_facts
                    (source_id, region_id, natural_key, period_year, period_month, nace_code, unit, obs_value, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, facts, BATCH_SIZE, (ps, record) -> {
                IndustrialFact f = (IndustrialFact) record;
                ps.setLong(1, sourceId);
                ps.setLong(2, f.getRegionId());
                ps.setString(3, f.naturalKey());
                ps.setInt(4, f.getYear());
                ps.setObject(5, f.getMonth(), Types.INTEGER);
                ps.setString(6, f.getNaceCode());
                ps.setString(7, f.getUnit());
                ps.setDouble(8, f.getValue());
                ps.setTimestamp(9, now);
                ps.setTimestamp(10, now);
            });
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public List<DemographicFact> queryDemographics(FactFilter filter) {
        JdbcSupport.Where where = demographicWhere(filter);
        String sql = """
                SELECT f.id, f.source_id, f.region_id, r.code AS region_code, r.name AS region_name,
                       f.period_year, f.sex, f.age_min, f.age_max, f.population
                FROM demographic_facts f JOIN regions r ON r.id = f.region_id
                """ + where.sql() + " ORDER BY r.code, f.period_year, f.sex, f.age_min, f.id LIMIT ?";
        return jdbcTemplate.query(sql, DEMOGRAPHIC_MAPPER, withLimit(where, filter));
    }

    public List<IndustrialFact> queryIndustrial(FactFilter filter) {
        JdbcSupport.Where where = industrialWhere(filter);
        String sql = """
                SELECT f.id, f.source_id, f.region_id, r.code AS region_code, r.name AS region_name,
                       f.period_year, f.period_month, f.nace_code, f.unit, f.obs_value
                FROM industrial_facts f JOIN regions r ON r.id = f.region_id
                """ + where.sql() + " ORDER BY f.period_year DESC, f.period_month DESC, r.code, f.nace_code, f.id LIMIT ?";
        return jdbcTemplate.query(sql, INDUSTRIAL_MAPPER, withLimit(where, filter));
    }

    public FactStatistics demographicStatistics(FactFilter filter) {
        return statistics("demographic_facts", "population", demographicWhere(filter), null);
    }

    public FactStatistics industrialStatistics(FactFilter filter) {
        JdbcSupport.Where where = industrialWhere(filter);
        List<String> naceCodes = jdbcTemplate.queryForList(
                "SELECT DISTINCT f.nace_code FROM industrial_facts f JOIN regions r ON r.id = f.region_id"
                        + where.sql() + " AND f.nace_code IS NOT NULL ORDER BY f.nace_code",
                String.class, where.args().toArray());
        return statistics("industrial_facts", "obs_value", where, naceCodes);
    }

    public long countDemographic() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM demographic_facts", Long.class);
        return count == null ? 0 : count;
    }

    public long countIndustrial() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM industrial_facts", Long.class);
        return count == null ? 0 : count;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private FactStatistics statistics(String table, String measure, JdbcSupport.Where where, List<String> naceCodes) {
        String sql = "SELECT COUNT(*), MIN(f.period_year), MAX(f.period_year), "
                + "COUNT(DISTINCT f.region_id), COUNT(DISTINCT f.source_id), "
                + "MIN(f." + measure + "), MAX(f." + measure + "), SUM(f." + measure + "), AVG(f." + measure + ") "
                + "FROM " + table + " f JOIN regions r ON r.id = f.region_id" + where.sql();

        return jdbcTemplate.queryForObject(sql, (rs, n) -> {
            Integer minYear = JdbcSupport.nullableInt(rs, 2);
            Integer maxYear = JdbcSupport.nullableInt(rs, 3);
            return FactStatistics.builder()
                    .totalRecords(rs.getLong(1))
                    .minYear(minYear)
                    .maxYear(maxYear)
                    .yearsCovered(FactStatistics.yearsCovered(minYear, maxYear))
                    .regionCount(rs.getLong(4))
                    .sourceCount(rs.getLong(5))
                    .valueMin(JdbcSupport.nullableDouble(rs, 6))
                    .valueMax(JdbcSupport.nullableDouble(rs, 7))
                    .valueSum(JdbcSupport.nullableDouble(rs, 8))
                    .valueAverage(JdbcSupport.nullableDouble(rs, 9))
                    .naceCodes(naceCodes)
                    .build();
        }, where.args().toArray());
    }

    private JdbcSupport.Where demographicWhere(FactFilter filter) {
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("r.code = ?", filter.getRegionCode())
                .and("f.period_year = ?", filter.getYear())
                .and("f.source_id = ?", filter.getSourceId());
        if (filter.getSex() != null && ("T".equalsIgnoreCase(filter.getSex()) || isTotal(filter.getSex()))) {
            where.andRaw("f.sex IS NULL");
        } else {
            where.and("f.sex = ?", filter.getSex());
        }
        return where;
    }

    private JdbcSupport.Where industrialWhere(FactFilter filter) {
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("r.code = ?", filter.getRegionCode())
                .and("f.period_year = ?", filter.getYear())
                .and("f.period_month = ?", filter.getMonth())
                .and("f.source_id = ?", filter.getSourceId());
        if (isTotal(filter.getNaceCode())) {
            where.andRaw("f.nace_code IS NULL");
        } else {
            where.and("f.nace_code = ?", filter.getNaceCode());
        }
        return where;
    }

    // "TOTAL" in a filter selects the stored total row, which has a null dimension
    private static boolean isTotal(String code) {
        return "TOTAL".equalsIgnoreCase(code);
    }

    private static Object[] withLimit(JdbcSupport.Where where, FactFilter filter) {
        List<Object> args = new ArrayList<>(where.args());
        args.add(filter.getLimit() == null ? Integer.MAX_VALUE : filter.getLimit());
        return args.toArray();
    }
}
