package com.europeanalysis.stats.model;

/**
 * Common view over the normalized fact shapes.
 *
 * The natural key identifies a fact within its source; re-ingesting the same
 * upstream slice yields the same key and overwrites the stored value.
 */
public interface FactRecord {

    String NULL_KEY_PART = "*";

    DatasetFamily family();

    /** Region code, period and dimension values joined with '|'; null parts as '*'. */
    String naturalKey();

    Long getRegionId();

    String getRegionCode();

    int getYear();

    static String keyPart(Object part) {
        return part == null ? NULL_KEY_PART : part.toString();
    }
}
