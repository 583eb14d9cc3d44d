package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Population count for one region, year, sex and age band.
 *
 * Key design notes:
 *  - sex null means both sexes (upstream "T"/"TOTAL")
 *  - ageMin is inclusive and ageMax exclusive; ageMax null is an open band (85+)
 *  - both age bounds null means all ages
 */
@Value
@Builder(toBuilder = true)
public class DemographicFact implements FactRecord {

    // ── Identity (populated on read) ────────────────────────────────────────
    Long id;
    Long sourceId;

    // ── Location ────────────────────────────────────────────────────────────
    Long regionId;
    String regionCode;
    String regionName;

    // ── Period ──────────────────────────────────────────────────────────────
    int year;

    // ── Dimensions ──────────────────────────────────────────────────────────
    String sex;
    Integer ageMin;
    Integer ageMax;

    // ── Measure ─────────────────────────────────────────────────────────────
    long population;

    @Override
    public DatasetFamily family() {
        return DatasetFamily.DEMOGRAPHIC;
    }

    @Override
    public String naturalKey() {
        return String.join("|",
                regionCode,
                String.valueOf(year),
                FactRecord.keyPart(sex),
                FactRecord.keyPart(ageMin),
                FactRecord.keyPart(ageMax));
    }
}
