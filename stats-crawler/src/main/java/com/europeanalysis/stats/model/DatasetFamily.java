package com.europeanalysis.stats.model;

/**
 * Fact shape a dataset normalizes into. Each family has its own fact table.
 */
public enum DatasetFamily {
    /** Population counts by region, year, sex and age band. */
    DEMOGRAPHIC,
    /** Indices and volumes by region, year/month, classification code and unit. */
    INDUSTRIAL
}
