package com.europeanalysis.stats.service;

import com.europeanalysis.stats.TestFixtures;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.FactRecord;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.NormalizationResult;
import com.europeanalysis.stats.model.RawRecord;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.model.SkipReason;
import com.europeanalysis.stats.storage.RegionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FactNormalizerTest {

    private RegionRepository regions;
    private FactNormalizer normalizer;

    @BeforeEach
    void setUp() {
        regions = mock(RegionRepository.class);
        when(regions.getOrCreate(anyString(), anyString(), anyString(), nullable(String.class)))
                .thenAnswer(inv -> Region.builder()
                        .id((long) Math.abs(inv.getArgument(0, String.class).hashCode()))
                        .code(inv.getArgument(0))
                        .name(inv.getArgument(1))
                        .level(inv.getArgument(2))
                        .parentCode(inv.getArgument(3))
                        .build());
        normalizer = new FactNormalizer(regions, TestFixtures.properties());
    }

    @Test
    void unparseableValueIsDroppedAndTheRestSurvive() {
        DatasetDescriptor descriptor = TestFixtures.populationRecords();
        List<RawRecord> records = List.of(
                record("region_code", "DE", "year", "2023", "sex", "M", "age_min", "0", "age_max", "5", "value", "1000000"),
                record("region_code", "DE", "year", "2023", "sex", "F", "age_min", "0", "age_max", "5", "value", "2000000"),
                record("region_code", "DE", "year", "2023", "sex", "T", "age_min", "0", "age_max", "5", "value", "N/A"));

        NormalizationResult result = normalizer.normalizeBatch(records, descriptor);

        assertThat(result.facts()).hasSize(2);
        assertThat(result.dropped()).isEqualTo(1);
        assertThat(result.dropReasons()).containsEntry(SkipReason.UNPARSEABLE_VALUE, 1);
        DemographicFact female = (DemographicFact) result.facts().get(1);
        assertThat(female.getRegionCode()).isEqualTo("DE");
        assertThat(female.getYear()).isEqualTo(2023);
        assertThat(female.getSex()).isEqualTo("F");
        assertThat(female.getAgeMin()).isEqualTo(0);
        assertThat(female.getAgeMax()).isEqualTo(5);
        assertThat(female.getPopulation()).isEqualTo(2_000_000L);
        verify(regions, times(1)).getOrCreate(eq("DE"), eq("DE"), eq("country"), isNull());
    }

    @Test
    void eurostatAgeCodesMapToBands() {
        assertBand("TOTAL", null, null);
        assertBand("Y5-9", 5, 10);
        assertBand("5-9", 5, 10);
        assertBand("Y_GE85", 85, null);
        assertBand("85+", 85, null);
        assertBand("Y_LT5", 0, 5);
        assertBand("under 5", 0, 5);
        assertBand("Y7", 7, 8);
        assertBand("7", 7, 8);
        assertThat(FactNormalizer.parseAge("UNK", null)).isNull();
        assertThat(FactNormalizer.parseAge("UNK", "85 years or over")).isEqualTo(new FactNormalizer.AgeBand(85, null));
    }

    @Test
    void sexCodesAndLabelsNormalize() {
        assertThat(FactNormalizer.normalizeSex("T", null)).isNull();
        assertThat(FactNormalizer.normalizeSex("total", null)).isNull();
        assertThat(FactNormalizer.normalizeSex("m", null)).isEqualTo("M");
        assertThat(FactNormalizer.normalizeSex("1", "Women")).isEqualTo("F");
        assertThat(FactNormalizer.normalizeSex("unk", "Unknown")).isEqualTo("UNK");
    }

    @Test
    void timePeriodsParseAnnualAndMonthly() {
        assertThat(FactNormalizer.parsePeriod("2023")).isEqualTo(new FactNormalizer.Period(2023, null));
        assertThat(FactNormalizer.parsePeriod("2023M01")).isEqualTo(new FactNormalizer.Period(2023, 1));
        assertThat(FactNormalizer.parsePeriod("2023-01")).isEqualTo(new FactNormalizer.Period(2023, 1));
        assertThat(FactNormalizer.parsePeriod("2023M1")).isEqualTo(new FactNormalizer.Period(2023, 1));
        assertThat(FactNormalizer.parsePeriod("202312")).isEqualTo(new FactNormalizer.Period(2023, 12));
        assertThat(FactNormalizer.parsePeriod("2023M13")).isNull();
        assertThat(FactNormalizer.parsePeriod("2023-Q1")).isNull();
        assertThat(FactNormalizer.parsePeriod("latest")).isNull();
    }

    @Test
    void demographicJsonStatRecordsNormalize() {
        DatasetDescriptor descriptor = TestFixtures.demoPjan();
        RawRecord raw = new RawRecord(
                Map.of("sex", "F", "age", "Y_GE85", "geo", "DE1", "time", "2022", "value", "1234568"),
                Map.of("geo", "Baden-Württemberg"));

        Optional<FactRecord> fact = normalizer.normalizeRecord(raw, descriptor);

        assertThat(fact).isPresent();
        DemographicFact demographic = (DemographicFact) fact.get();
        assertThat(demographic.getAgeMin()).isEqualTo(85);
        assertThat(demographic.getAgeMax()).isNull();
        assertThat(demographic.getPopulation()).isEqualTo(1_234_568L);
        assertThat(demographic.getRegionName()).isEqualTo("Baden-Württemberg");
        verify(regions).getOrCreate("DE1", "Baden-Württemberg", "nuts1", "DE");
    }

    @Test
    void missingDeclaredAxisOrBadTimeDropsTheRecord() {
        DatasetDescriptor descriptor = TestFixtures.demoPjan();
        List<RawRecord> records = List.of(
                record("age", "TOTAL", "geo", "DE", "time", "2023", "value", "1"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "1850", "value", "1"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "soon", "value", "1"),
                record("sex", "F", "age", "Y_OPEN", "geo", "DE", "time", "2023", "value", "1"),
                record("sex", "F", "age", "TOTAL", "time", "2023", "value", "1"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "2023", "value", "Infinity"));

        NormalizationResult result = normalizer.normalizeBatch(records, descriptor);

        assertThat(result.facts()).isEmpty();
        assertThat(result.dropReasons())
                .containsEntry(SkipReason.MISSING_DIMENSION, 2)
                .containsEntry(SkipReason.YEAR_OUT_OF_RANGE, 1)
                .containsEntry(SkipReason.UNPARSEABLE_TIME, 1)
                .containsEntry(SkipReason.UNPARSEABLE_AGE, 1)
                .containsEntry(SkipReason.UNPARSEABLE_VALUE, 1);
        verify(regions, never()).getOrCreate(anyString(), anyString(), anyString(), nullable(String.class));
    }

    @Test
    void industrialRecordsKeepMonthNaceAndUnit() {
        DatasetDescriptor descriptor = TestFixtures.industrialProduction();
        List<RawRecord> records = List.of(
                record("geo", "DE", "TIME_PERIOD", "2024-03", "nace_r2", "nace_c", "unit", "I21", "OBS_VALUE", "97.4"),
                record("geo", "DE", "TIME_PERIOD", "2024-03", "nace_r2", "TOTAL", "unit", "I21", "OBS_VALUE", "99.0"),
                record("geo", "EU27_2020", "TIME_PERIOD", "2024-03", "nace_r2", "B-D", "OBS_VALUE", "100.1"));

        List<FactRecord> facts = normalizer.normalizeBatch(records, descriptor).facts();

        assertThat(facts).hasSize(3);
        IndustrialFact manufacturing = (IndustrialFact) facts.get(0);
        assertThat(manufacturing.getYear()).isEqualTo(2024);
        assertThat(manufacturing.getMonth()).isEqualTo(3);
        assertThat(manufacturing.getNaceCode()).isEqualTo("C");
        assertThat(manufacturing.getUnit()).isEqualTo("I21");
        assertThat(manufacturing.getValue()).isEqualTo(97.4);
        assertThat(((IndustrialFact) facts.get(1)).getNaceCode()).isNull();
        assertThat(((IndustrialFact) facts.get(2)).getUnit()).isNull();
        assertThat(manufacturing.naturalKey()).isEqualTo("DE|2024|3|C|I21");
        // one lookup per distinct region code in the batch
        verify(regions, times(1)).getOrCreate(eq("DE"), anyString(), anyString(), nullable(String.class));
        verify(regions).getOrCreate("EU27_2020", "EU27_2020", "aggregate", null);
    }

    @Test
    void seriesDifferingOnlyInAnUnmappedDimensionAreCountedAsDuplicates() {
        DatasetDescriptor descriptor = TestFixtures.industrialProduction();
        List<RawRecord> records = List.of(
                record("geo", "DE", "TIME_PERIOD", "2024-03", "nace_r2", "C", "unit", "I21", "s_adj", "SCA", "OBS_VALUE", "97.4"),
                record("geo", "DE", "TIME_PERIOD", "2024-03", "nace_r2", "C", "unit", "I21", "s_adj", "NSA", "OBS_VALUE", "104.2"),
                record("geo", "DE", "TIME_PERIOD", "2024-04", "nace_r2", "C", "unit", "I21", "s_adj", "SCA", "OBS_VALUE", "98.0"));

        NormalizationResult result = normalizer.normalizeBatch(records, descriptor);

        assertThat(result.facts()).extracting(f -> ((IndustrialFact) f).getValue()).containsExactly(97.4, 98.0);
        assertThat(result.dropReasons()).containsExactly(Map.entry(SkipReason.DUPLICATE_KEY, 1));
        assertThat(result.dropped()).isEqualTo(1);
    }

    @Test
    void wideRowSplitsIntoOneFactPerSex() {
        DatasetDescriptor descriptor = TestFixtures.populationWide("classpath:fixtures/population_wide.csv", null);
        List<RawRecord> records = List.of(
                record("region_code", "DE", "year", "2022", "male", "41000000", "female", "42000000", "total", ""),
                record("region_code", "FR", "year", "2022", "male", "33000000", "female", "35000000", "total", "68000000"),
                record("region_code", "IT", "year", "2022", "male", "n/a", "female", "30000000"),
                record("region_code", "ES", "year", "2022", "male", "", "female", " "));

        NormalizationResult result = normalizer.normalizeBatch(records, descriptor);

        assertThat(result.facts())
                .extracting(f -> ((DemographicFact) f).getRegionCode() + ":" + ((DemographicFact) f).getSex()
                        + "=" + ((DemographicFact) f).getPopulation())
                .containsExactly("DE:M=41000000", "DE:F=42000000",
                        "FR:M=33000000", "FR:F=35000000", "FR:null=68000000");
        assertThat(result.dropReasons()).containsExactly(Map.entry(SkipReason.UNPARSEABLE_VALUE, 2));
        assertThat(normalizer.normalizeRecords(records.get(0), descriptor)).hasSize(2);
        assertThat(normalizer.normalizeRecord(records.get(0), descriptor))
                .hasValueSatisfying(f -> assertThat(((DemographicFact) f).getSex()).isEqualTo("M"));
        verify(regions, never()).getOrCreate(eq("IT"), anyString(), anyString(), nullable(String.class));
    }

    @Test
    void populationMustBeAWholeNonNegativeCount() {
        DatasetDescriptor descriptor = TestFixtures.demoPjan();
        List<RawRecord> records = List.of(
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "2020", "value", "12.5"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "2021", "value", "-3"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "2022", "value", "1e19"),
                record("sex", "F", "age", "TOTAL", "geo", "DE", "time", "2023", "value", "1.0E3"));

        NormalizationResult result = normalizer.normalizeBatch(records, descriptor);

        assertThat(result.facts()).singleElement()
                .satisfies(f -> assertThat(((DemographicFact) f).getPopulation()).isEqualTo(1000L));
        assertThat(result.dropReasons()).containsExactly(Map.entry(SkipReason.UNPARSEABLE_VALUE, 3));
        assertThat(FactNormalizer.toPopulation(0x1p63)).isNull();
        assertThat(FactNormalizer.toPopulation(9.0E18)).isEqualTo(9_000_000_000_000_000_000L);
        assertThat(FactNormalizer.toPopulation(-0.0)).isZero();
    }

    @Test
    void regionLevelFollowsCodeShape() {
        assertThat(FactNormalizer.regionLevel("FR")).isEqualTo("country");
        assertThat(FactNormalizer.regionLevel("FR1")).isEqualTo("nuts1");
        assertThat(FactNormalizer.regionLevel("FR10")).isEqualTo("nuts2");
        assertThat(FactNormalizer.regionLevel("FR101")).isEqualTo("nuts3");
        assertThat(FactNormalizer.regionLevel("EA20")).isEqualTo("aggregate");
        assertThat(FactNormalizer.parentCode("FR101")).isEqualTo("FR10");
        assertThat(FactNormalizer.parentCode("FR")).isNull();
    }

    private static void assertBand(String code, Integer min, Integer max) {
        assertThat(FactNormalizer.parseAge(code, null))
                .as(code)
                .isEqualTo(new FactNormalizer.AgeBand(min, max));
    }

    private static RawRecord record(String... kv) {
        Map<String, String> fields = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            fields.put(kv[i], kv[i + 1]);
        }
        return RawRecord.of(fields);
    }
}
