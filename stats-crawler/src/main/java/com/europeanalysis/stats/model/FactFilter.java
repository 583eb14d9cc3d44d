package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-side filter. Null fields do not constrain the query.
 */
@Value
@Builder
public class FactFilter {

    String regionCode;
    Integer year;
    Integer month;
    String sex;
    String naceCode;
    Long sourceId;
    Integer limit;

    public static FactFilter none() {
        return FactFilter.builder().build();
    }
}
