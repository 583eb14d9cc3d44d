package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.DataSource;
import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.FactFilter;
import com.europeanalysis.stats.model.FactStatistics;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.IngestionRun;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.storage.DataSourceRepository;
import com.europeanalysis.stats.storage.FactRepository;
import com.europeanalysis.stats.storage.IngestionRunRepository;
import com.europeanalysis.stats.storage.RawSnapshotRepository;
import com.europeanalysis.stats.storage.RegionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the store: validates query parameters and delegates to the repositories.
 *
 * Limits default to 1000 rows and are capped at 10000.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FactQueryService {

    public static final int DEFAULT_LIMIT = 1000;
    public static final int MAX_LIMIT = 10_000;

    private final FactRepository factRepository;
    private final RegionRepository regionRepository;
    private final DataSourceRepository dataSourceRepository;
    private final RawSnapshotRepository snapshotRepository;
    private final IngestionRunRepository runRepository;

    public List<DemographicFact> demographics(String regionCode, Integer year, String sex, Long sourceId, Integer limit) {
        FactFilter filter = FactFilter.builder()
                .regionCode(blankToNull(regionCode))
                .year(year)
                .sex(blankToNull(sex))
                .sourceId(sourceId)
                .limit(checkLimit(limit))
                .build();
        log.debug("Demographic query {}", filter);
        return factRepository.queryDemographics(filter);
    }

    public List<IndustrialFact> industrial(String regionCode, Integer year, Integer month, String naceCode,
                                           Long sourceId, Integer limit) {
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be between 1 and 12, got " + month);
        }
        FactFilter filter = FactFilter.builder()
                .regionCode(blankToNull(regionCode))
                .year(year)
                .month(month)
                .naceCode(blankToNull(naceCode))
                .sourceId(sourceId)
                .limit(checkLimit(limit))
                .build();
        log.debug("Industrial query {}", filter);
        return factRepository.queryIndustrial(filter);
    }

    public FactStatistics demographicStatistics(String regionCode, Integer year) {
        return factRepository.demographicStatistics(FactFilter.builder()
                .regionCode(blankToNull(regionCode))
                .year(year)
                .build());
    }

    public FactStatistics industrialStatistics(String regionCode, Integer year) {
        return factRepository.industrialStatistics(FactFilter.builder()
                .regionCode(blankToNull(regionCode))
                .year(year)
                .build());
    }

    /** Row counts across the whole store. */
    public Map<String, Object> overview() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_sources", dataSourceRepository.count());
        result.put("total_regions", regionRepository.count());
        result.put("demographic_records", factRepository.countDemographic());
        result.put("industrial_records", factRepository.countIndustrial());
        result.put("raw_snapshots", snapshotRepository.count());
        return result;
    }

    public List<DataSource> sources() {
        return dataSourceRepository.findAll();
    }

    public List<Region> regions(String query) {
        String q = blankToNull(query);
        return q == null ? regionRepository.findAll() : regionRepository.search(q);
    }

    public List<IngestionRun> runHistory(String datasetId, Integer limit) {
        int checked = checkLimit(limit);
        String id = blankToNull(datasetId);
        return id == null ? runRepository.findRecent(checked) : runRepository.findByDataset(id, checked);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static int checkLimit(Integer limit) {
        if (limit == null) return DEFAULT_LIMIT;
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return limit;
    }

    private static String blankToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
