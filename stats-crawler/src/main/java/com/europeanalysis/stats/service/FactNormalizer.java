package com.europeanalysis.stats.service;

import com.europeanalysis.stats.config.StatsCrawlerProperties;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.DatasetFamily;
import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.DimensionMapping;
import com.europeanalysis.stats.model.FactRecord;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.NormalizationResult;
import com.europeanalysis.stats.model.RawRecord;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.model.SkipReason;
import com.europeanalysis.stats.storage.RegionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw upstream records onto the unified fact model.
 *
 * Key design notes:
 *  - a record missing geo, time or any axis its descriptor declares is dropped,
 *    never defaulted
 *  - totals ("T", "TOTAL") become null dimensions, so every dataset stores its
 *    totals the same way
 *  - regions are resolved last, once the record is known to be valid, so
 *    dropped records never create regions
 *  - a wide record with male and female columns yields one fact per sex, plus
 *    a total when the value column is filled
 *  - within a page the first fact for a natural key wins; later ones are
 *    dropped as DUPLICATE_KEY, which exposes series that differ only in an
 *    unmapped dimension
 */
@Component
@Slf4j
public class FactNormalizer {

    private static final String TOTAL = "TOTAL";

    // 2^63; a double at or above it does not fit a long
    private static final double LONG_LIMIT = 0x1p63;

    // 2023 | 2023M01, 2023-01, 2023M1 | 202301
    private static final Pattern ANNUAL  = Pattern.compile("^(\\d{4})$");
    private static final Pattern MONTHLY = Pattern.compile("^(\\d{4})(?:(?:M|-)(\\d{1,2})|(\\d{2}))$");

    // matched against lower-cased codes with the Eurostat "Y" prefix removed, and against labels
    private static final Pattern AGE_RANGE  = Pattern.compile("^(?:from\\s*)?(\\d{1,3})\\s*(?:-|to)\\s*(\\d{1,3})(?:\\s*years?)?$");
    private static final Pattern AGE_OPEN   = Pattern.compile("^(?:_?ge(\\d{1,3})|(\\d{1,3})\\s*\\+|(\\d{1,3})\\s*(?:years?\\s*)?(?:and|or)\\s*over)(?:\\s*years?)?$");
    private static final Pattern AGE_UNDER  = Pattern.compile("^(?:_?lt(\\d{1,3})|(?:under|less than)\\s*(\\d{1,3}))(?:\\s*years?)?$");
    private static final Pattern AGE_SINGLE = Pattern.compile("^(\\d{1,3})(?:\\s*years?)?$");

    private final RegionRepository regionRepository;
    private final int minYear;
    private final int maxYear;

    public FactNormalizer(RegionRepository regionRepository, StatsCrawlerProperties properties) {
        this.regionRepository = regionRepository;
        this.minYear = properties.getIngestion().getMinYear();
        this.maxYear = properties.getIngestion().getMaxYear();
    }

    /**
     * Normalize a single record. Empty when the record is dropped; for a
     * sex-split record this is the first fact produced.
     */
    public Optional<FactRecord> normalizeRecord(RawRecord raw, DatasetDescriptor descriptor) {
        return normalizeRecords(raw, descriptor).stream().findFirst();
    }

    /**
     * Every fact one record yields: none when dropped, one per filled sex
     * column for sex-split datasets, otherwise exactly one.
     */
    public List<FactRecord> normalizeRecords(RawRecord raw, DatasetDescriptor descriptor) {
        return normalize(raw, descriptor, new HashMap<>(), reason -> { });
    }

    /**
     * Normalize one page of records. Regions are looked up once per distinct
     * code in the batch; drops are counted per reason and logged as a summary.
     */
    public NormalizationResult normalizeBatch(List<RawRecord> records, DatasetDescriptor descriptor) {
        Map<String, Region> regions = new HashMap<>();
        Map<SkipReason, Integer> dropReasons = new EnumMap<>(SkipReason.class);
        Map<String, FactRecord> byKey = new LinkedHashMap<>();
        Consumer<SkipReason> onSkip = reason -> dropReasons.merge(reason, 1, Integer::sum);

        for (RawRecord raw : records) {
            for (FactRecord fact : normalize(raw, descriptor, regions, onSkip)) {
                FactRecord first = byKey.putIfAbsent(fact.naturalKey(), fact);
                if (first != null) {
                    log.debug("{}: dropping duplicate of {} from record {}",
                            descriptor.getId(), fact.naturalKey(), raw.getFields());
                    onSkip.accept(SkipReason.DUPLICATE_KEY);
                }
            }
        }
        List<FactRecord> facts = new ArrayList<>(byKey.values());

        NormalizationResult result = new NormalizationResult(
                Collections.unmodifiableList(facts), Collections.unmodifiableMap(dropReasons));
        if (result.dropped() > 0) {
            log.info("{}: {} facts from {} records, dropped {} {}",
                    descriptor.getId(), facts.size(), records.size(), result.dropped(), dropReasons);
        } else {
            log.debug("{}: {} facts from {} records", descriptor.getId(), facts.size(), records.size());
        }
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<FactRecord> normalize(RawRecord raw, DatasetDescriptor descriptor,
                                           Map<String, Region> regions, Consumer<SkipReason> onSkip) {
        DimensionMapping dims = descriptor.getDimensions();

        String geo = trimToNull(raw.get(dims.getGeo()));
        String time = trimToNull(raw.get(dims.getTime()));
        if (geo == null || time == null) {
            return skip(SkipReason.MISSING_DIMENSION, raw, descriptor, onSkip);
        }
        geo = geo.toUpperCase(Locale.ROOT);

        Period period = parsePeriod(time);
        if (period == null) {
            period = parsePeriod(raw.label(dims.getTime()));
        }
        if (period == null) {
            return skip(SkipReason.UNPARSEABLE_TIME, raw, descriptor, onSkip);
        }
        if (period.year() < minYear || period.year() > maxYear) {
            return skip(SkipReason.YEAR_OUT_OF_RANGE, raw, descriptor, onSkip);
        }

        String sex = null;
        if (dims.hasSex()) {
            String code = trimToNull(raw.get(dims.getSex()));
            if (code == null) {
                return skip(SkipReason.MISSING_DIMENSION, raw, descriptor, onSkip);
            }
            sex = normalizeSex(code, raw.label(dims.getSex()));
        }

        AgeBand age = AgeBand.ALL;
        if (dims.hasAgeCode()) {
            String code = trimToNull(raw.get(dims.getAge()));
            if (code == null) {
                return skip(SkipReason.MISSING_DIMENSION, raw, descriptor, onSkip);
            }
            age = parseAge(code, raw.label(dims.getAge()));
        } else if (dims.hasAgeBounds()) {
            String min = trimToNull(raw.get(dims.getAgeMin()));
            if (min == null) {
                return skip(SkipReason.MISSING_DIMENSION, raw, descriptor, onSkip);
            }
            age = ageFromBounds(min, trimToNull(raw.get(dims.getAgeMax())));
        }
        if (age == null) {
            return skip(SkipReason.UNPARSEABLE_AGE, raw, descriptor, onSkip);
        }

        String industry = null;
        if (dims.hasIndustry()) {
            String code = trimToNull(raw.get(dims.getIndustry()));
            if (code == null) {
                return skip(SkipReason.MISSING_DIMENSION, raw, descriptor, onSkip);
            }
            industry = normalizeNace(code);
        }
        String unit = dims.hasUnit() ? trimToNull(raw.get(dims.getUnit())) : null;

        // sex code (null for the total) -> value, in column order
        Map<String, Double> values = new LinkedHashMap<>();
        if (dims.hasSexSplit()) {
            String[][] columns = {{"M", dims.getMale()}, {"F", dims.getFemale()}, {null, descriptor.getValueField()}};
            for (String[] column : columns) {
                String text = trimToNull(raw.get(column[1]));
                if (text == null) {
                    continue;
                }
                Double value = parseValue(text);
                if (value == null) {
                    return skip(SkipReason.UNPARSEABLE_VALUE, raw, descriptor, onSkip);
                }
                values.put(column[0], value);
            }
        } else {
            Double value = parseValue(raw.get(descriptor.getValueField()));
            if (value != null) {
                values.put(sex, value);
            }
        }
        if (values.isEmpty()) {
            return skip(SkipReason.UNPARSEABLE_VALUE, raw, descriptor, onSkip);
        }
        if (descriptor.getFamily() == DatasetFamily.DEMOGRAPHIC
                && values.values().stream().anyMatch(v -> toPopulation(v) == null)) {
            return skip(SkipReason.UNPARSEABLE_VALUE, raw, descriptor, onSkip);
        }

        String geoLabel = trimToNull(raw.label(dims.getGeo()));
        Region region = regions.computeIfAbsent(geo, code -> regionRepository.getOrCreate(
                code, geoLabel == null ? code : geoLabel, regionLevel(code), parentCode(code)));

        List<FactRecord> facts = new ArrayList<>(values.size());
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            facts.add(switch (descriptor.getFamily()) {
                case DEMOGRAPHIC -> DemographicFact.builder()
                        .regionId(region.getId())
                        .regionCode(region.getCode())
                        .regionName(region.getName())
                        .year(period.year())
                        .sex(entry.getKey())
                        .ageMin(age.min())
                        .ageMax(age.max())
                        .population(toPopulation(entry.getValue()))
                        .build();
                case INDUSTRIAL -> IndustrialFact.builder()
                        .regionId(region.getId())
                        .regionCode(region.getCode())
                        .regionName(region.getName())
                        .year(period.year())
                        .month(period.month())
                        .naceCode(industry)
                        .unit(unit)
                        .value(entry.getValue())
                        .build();
            });
        }
        return facts;
    }

    private List<FactRecord> skip(SkipReason reason, RawRecord raw, DatasetDescriptor descriptor,
                                  Consumer<SkipReason> onSkip) {
        log.debug("{}: dropping {} record {}", descriptor.getId(), reason, raw.getFields());
        onSkip.accept(reason);
        return List.of();
    }

    // ── Parsing helpers ──────────────────────────────────────────────────────

    record Period(int year, Integer month) {
    }

    /** Age band with inclusive min and exclusive max; null max is open-ended, both null is all ages. */
    record AgeBand(Integer min, Integer max) {
        static final AgeBand ALL = new AgeBand(null, null);
    }

    static Period parsePeriod(String text) {
        if (text == null || text.isBlank()) return null;
        String t = text.trim().toUpperCase(Locale.ROOT);

        Matcher annual = ANNUAL.matcher(t);
        if (annual.matches()) {
            return new Period(Integer.parseInt(annual.group(1)), null);
        }
        Matcher monthly = MONTHLY.matcher(t);
        if (monthly.matches()) {
            int month = Integer.parseInt(monthly.group(2) != null ? monthly.group(2) : monthly.group(3));
            if (month < 1 || month > 12) return null;
            return new Period(Integer.parseInt(monthly.group(1)), month);
        }
        return null;
    }

    /** "M"/"F" for male and female, null for totals; other codes pass through upper-cased. */
    static String normalizeSex(String code, String label) {
        String normalized = sexFromText(code);
        if (normalized == null && label != null) {
            normalized = sexFromText(label);
        }
        if (normalized == null) {
            return code.trim().toUpperCase(Locale.ROOT);
        }
        return TOTAL.equals(normalized) ? null : normalized;
    }

    private static String sexFromText(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "t", "total", "both", "both sexes", "all" -> TOTAL;
            case "m", "male", "males", "men" -> "M";
            case "f", "female", "females", "women" -> "F";
            default -> null;
        };
    }

    /** Parses the code, falling back to the label. Null when neither is understood. */
    static AgeBand parseAge(String code, String label) {
        AgeBand band = parseAgeText(code);
        return band != null || label == null ? band : parseAgeText(label);
    }

    private static AgeBand parseAgeText(String text) {
        String t = text.trim().toLowerCase(Locale.ROOT);
        if (t.equals("total") || t.equals("t")) {
            return AgeBand.ALL;
        }
        if (t.startsWith("y") && !t.startsWith("year")) {
            t = t.substring(1);
        }

        Matcher m = AGE_RANGE.matcher(t);
        if (m.matches()) {
            int lo = Integer.parseInt(m.group(1));
            int hi = Integer.parseInt(m.group(2));
            return hi < lo ? null : new AgeBand(lo, hi + 1);
        }
        m = AGE_OPEN.matcher(t);
        if (m.matches()) {
            return new AgeBand(Integer.parseInt(firstGroup(m)), null);
        }
        m = AGE_UNDER.matcher(t);
        if (m.matches()) {
            int bound = Integer.parseInt(firstGroup(m));
            return bound == 0 ? null : new AgeBand(0, bound);
        }
        m = AGE_SINGLE.matcher(t);
        if (m.matches()) {
            int age = Integer.parseInt(m.group(1));
            return new AgeBand(age, age + 1);
        }
        return null;
    }

    private static AgeBand ageFromBounds(String minText, String maxText) {
        Integer min = parseInt(minText);
        Integer max = maxText == null ? null : parseInt(maxText);
        if (min == null || min < 0 || (maxText != null && max == null) || (max != null && max <= min)) {
            return null;
        }
        return new AgeBand(min, max);
    }

    /** Upper-cased, "NACE_" prefix removed; the total becomes null. */
    static String normalizeNace(String code) {
        String c = code.trim().toUpperCase(Locale.ROOT);
        if (c.startsWith("NACE_")) {
            c = c.substring("NACE_".length());
        }
        return c.isEmpty() || c.equals(TOTAL) ? null : c;
    }

    static Double parseValue(String text) {
        String t = trimToNull(text);
        if (t == null) return null;
        try {
            double value = Double.parseDouble(t);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Head count for a value: null unless it is a whole, non-negative number that fits a long. */
    static Long toPopulation(double value) {
        if (!Double.isFinite(value) || value < 0 || value >= LONG_LIMIT || value != Math.rint(value)) {
            return null;
        }
        return (long) value;
    }

    /** Level implied by the shape of a NUTS/ISO code; EU and euro-area groupings are aggregates. */
    static String regionLevel(String code) {
        if (code.contains("_") || ((code.startsWith("EU") || code.startsWith("EA")) && code.length() > 2)) {
            return "aggregate";
        }
        return switch (code.length()) {
            case 2 -> "country";
            case 3 -> "nuts1";
            case 4 -> "nuts2";
            case 5 -> "nuts3";
            default -> "other";
        };
    }

    static String parentCode(String code) {
        return regionLevel(code).startsWith("nuts") ? code.substring(0, code.length() - 1) : null;
    }

    private static String firstGroup(Matcher m) {
        for (int g = 1; g <= m.groupCount(); g++) {
            if (m.group(g) != null) return m.group(g);
        }
        throw new IllegalStateException("No group matched in " + m.pattern());
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
