package com.europeanalysis.stats.model;

public enum PayloadFormat {
    /** JSON-stat 2.0 dataset, the Eurostat dissemination API default. */
    JSON_STAT,
    /** Array of flat JSON objects, or an object holding one under "data". */
    JSON_RECORDS,
    /** Header-row CSV (SDMX-CSV compatible). */
    CSV
}
