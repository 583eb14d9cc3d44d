package com.europeanalysis.stats.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Flat aggregate summary over a filtered fact table.
 */
@Value
@Builder
public class FactStatistics {

    long totalRecords;
    Integer minYear;
    Integer maxYear;
    /** "2019-2023", or "N/A" when the table is empty. */
    String yearsCovered;
    long regionCount;
    long sourceCount;
    Double valueMin;
    Double valueMax;
    Double valueSum;
    Double valueAverage;

    /** Industrial data only. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<String> naceCodes;

    public static String yearsCovered(Integer minYear, Integer maxYear) {
        return minYear != null && maxYear != null ? minYear + "-" + maxYear : "N/A";
    }
}
