package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Industrial, turnover or energy observation for one region and period.
 *
 * naceCode carries whichever classification the dataset is broken down by
 * (NACE rev.2 for production and turnover, energy balance codes for energy);
 * null means the total. The unit is part of the key so that datasets
 * published in several units do not overwrite each other.
 */
@Value
@Builder(toBuilder = true)
public class IndustrialFact implements FactRecord {

    // ── Identity (populated on read) ────────────────────────────────────────
    Long id;
    Long sourceId;

    // ── Location ────────────────────────────────────────────────────────────
    Long regionId;
    String regionCode;
    String regionName;

    // ── Period ──────────────────────────────────────────────────────────────
    int year;
    /** 1-12 for monthly series, null for annual ones. */
    Integer month;

    // ── Dimensions ──────────────────────────────────────────────────────────
    String naceCode;
    String unit;

    // ── Measure ─────────────────────────────────────────────────────────────
    double value;

    @Override
    public DatasetFamily family() {
        return DatasetFamily.INDUSTRIAL;
    }

    @Override
    public String naturalKey() {
        return String.join("|",
                regionCode,
                String.valueOf(year),
                FactRecord.keyPart(month),
                FactRecord.keyPart(naceCode),
                FactRecord.keyPart(unit));
    }
}
