package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.FactFilter;
import com.europeanalysis.stats.model.FactStatistics;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.RawSnapshot;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.model.UpsertResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactRepositoryTest {

    private TestDatabase db;
    private FactRepository facts;
    private Region germany;
    private Region france;
    private long sourceId;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        facts = db.facts();
        germany = db.regions().getOrCreate("DE", "Germany", "country", null);
        france = db.regions().getOrCreate("FR", "France", "country", null);
        sourceId = db.dataSources().getOrCreate("eurostat:demo_pjan", "api", "http://upstream.test/data/demo_pjan").getId();
    }

    @Test
    void reapplyingTheSameBatchUpdatesInPlace() {
        List<DemographicFact> batch = List.of(
                population(germany, 2023, "M", 0, 5, 1_000_000),
                population(germany, 2023, "F", 0, 5, 2_000_000));

        UpsertResult first = facts.upsertFacts(batch, sourceId);
        UpsertResult second = facts.upsertFacts(batch, sourceId);

        assertThat(first).isEqualTo(new UpsertResult(2, 0));
        assertThat(second).isEqualTo(new UpsertResult(0, 2));
        assertThat(db.count("demographic_facts")).isEqualTo(2);
    }

    @Test
    void revisedValueOverwritesTheStoredOne() {
        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 2_000_000)), sourceId);
        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 2_000_500)), sourceId);

        List<DemographicFact> stored = facts.queryDemographics(FactFilter.builder().regionCode("DE").build());

        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getPopulation()).isEqualTo(2_000_500);
        assertThat(stored.get(0).getRegionName()).isEqualTo("Germany");
    }

    @Test
    void inBatchDuplicatesCollapseToTheLast() {
        UpsertResult result = facts.upsertFacts(List.of(
                population(germany, 2022, null, null, null, 10),
                population(germany, 2022, null, null, null, 20)), sourceId);

        assertThat(result.total()).isEqualTo(1);
        assertThat(facts.queryDemographics(FactFilter.none()).get(0).getPopulation()).isEqualTo(20);
    }

    @Test
    void nullDimensionsAreDistinctKeys() {
        facts.upsertFacts(List.of(
                population(germany, 2023, null, null, null, 3_000_000),
                population(germany, 2023, "F", null, null, 1_600_000),
                population(germany, 2023, "F", 85, null, 100_000)), sourceId);

        assertThat(db.count("demographic_facts")).isEqualTo(3);
        List<DemographicFact> totals = facts.queryDemographics(FactFilter.builder().sex("T").build());
        assertThat(totals).extracting(DemographicFact::getPopulation).containsExactly(3_000_000L);
    }

    @Test
    void sameKeyFromAnotherSourceIsASeparateFact() {
        long otherSource = db.dataSources().getOrCreate("census", "api", null).getId();

        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 1)), sourceId);
        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 2)), otherSource);

        assertThat(db.count("demographic_facts")).isEqualTo(2);
        assertThat(facts.queryDemographics(FactFilter.builder().sourceId(otherSource).build()))
                .extracting(DemographicFact::getPopulation).containsExactly(2L);
    }

    @Test
    void factWithoutRegionIsRejected() {
        DemographicFact unresolved = population(germany, 2023, "M", 0, 5, 1).toBuilder().regionId(null).build();

        assertThatThrownBy(() -> facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 1), unresolved), sourceId))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(db.count("demographic_facts")).isZero();
    }

    @Test
    void failedBatchRollsBackEntirely() {
        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 1)), sourceId);
        List<DemographicFact> batch = List.of(
                population(germany, 2023, "F", 0, 5, 2),
                population(germany, 2023, "M", 0, 5, 3),
                population(germany, 2023, "M", 5, 10, 4).toBuilder().regionId(9_999L).build());

        assertThatThrownBy(() -> facts.upsertFacts(batch, sourceId)).isInstanceOf(RuntimeException.class);

        assertThat(db.count("demographic_facts")).isEqualTo(1);
        assertThat(facts.queryDemographics(FactFilter.none()).get(0).getPopulation()).isEqualTo(1);
    }

    @Test
    void industrialQueriesFilterAndOrderNewestFirst() {
        facts.upsertFacts(List.of(
                production(germany, 2024, 1, "C", 97.4),
                production(germany, 2024, 2, "C", 98.1),
                production(france, 2024, 2, "C", 101.0),
                production(germany, 2024, 2, null, 99.5)), sourceId);

        List<IndustrialFact> february = facts.queryIndustrial(FactFilter.builder().year(2024).month(2).build());
        List<IndustrialFact> manufacturing = facts.queryIndustrial(FactFilter.builder().naceCode("C").limit(2).build());
        List<IndustrialFact> total = facts.queryIndustrial(FactFilter.builder().naceCode("TOTAL").build());

        assertThat(february).hasSize(3);
        assertThat(manufacturing).hasSize(2).allSatisfy(f -> assertThat(f.getMonth()).isEqualTo(2));
        assertThat(total).extracting(IndustrialFact::getValue).containsExactly(99.5);
    }

    @Test
    void statisticsSummariseTheFilteredRows() {
        facts.upsertFacts(List.of(
                population(germany, 2019, null, null, null, 100),
                population(germany, 2023, null, null, null, 300),
                population(france, 2021, null, null, null, 200)), sourceId);
        facts.upsertFacts(List.of(
                production(germany, 2024, 1, "C", 90.0),
                production(germany, 2024, 1, "B", 110.0)), sourceId);

        FactStatistics all = facts.demographicStatistics(FactFilter.none());
        FactStatistics germanOnly = facts.demographicStatistics(FactFilter.builder().regionCode("DE").build());
        FactStatistics industrial = facts.industrialStatistics(FactFilter.none());
        FactStatistics empty = facts.demographicStatistics(FactFilter.builder().year(1990).build());

        assertThat(all.getTotalRecords()).isEqualTo(3);
        assertThat(all.getYearsCovered()).isEqualTo("2019-2023");
        assertThat(all.getRegionCount()).isEqualTo(2);
        assertThat(all.getValueSum()).isEqualTo(600.0);
        assertThat(all.getValueAverage()).isEqualTo(200.0);
        assertThat(germanOnly.getValueMax()).isEqualTo(300.0);
        assertThat(industrial.getNaceCodes()).containsExactly("B", "C");
        assertThat(empty.getTotalRecords()).isZero();
        assertThat(empty.getYearsCovered()).isEqualTo("N/A");
        assertThat(empty.getValueSum()).isNull();
    }

    @Test
    void deleteBySourceKeepsSnapshots() {
        facts.upsertFacts(List.of(population(germany, 2023, "F", 0, 5, 1)), sourceId);
        facts.upsertFacts(List.of(production(germany, 2024, 1, "C", 90.0)), sourceId);
        db.snapshots().archive(RawSnapshot.builder()
                .datasetId("demo_pjan").pageIndex(0).requestUri("http://upstream.test/data/demo_pjan")
                .queryParams("{}").retrievedAt(Instant.now()).payload("{}".getBytes(StandardCharsets.UTF_8)).contentHash("abc").build());

        int deleted = facts.deleteBySource(sourceId);

        assertThat(deleted).isEqualTo(2);
        assertThat(db.count("demographic_facts") + db.count("industrial_facts")).isZero();
        assertThat(db.snapshots().countByDataset("demo_pjan")).isEqualTo(1);
    }

    private static DemographicFact population(Region region, int year, String sex, Integer ageMin, Integer ageMax,
                                              long population) {
        return DemographicFact.builder()
                .regionId(region.getId())
                .regionCode(region.getCode())
                .year(year)
                .sex(sex)
                .ageMin(ageMin)
                .ageMax(ageMax)
                .population(population)
                .build();
    }

    private static IndustrialFact production(Region region, int year, Integer month, String nace, double value) {
        return IndustrialFact.builder()
                .regionId(region.getId())
                .regionCode(region.getCode())
                .year(year)
                .month(month)
                .naceCode(nace)
                .unit("I21")
                .value(value)
                .build();
    }
}
