package com.europeanalysis.stats.model;

import java.util.List;
import java.util.Map;

public record NormalizationResult(List<FactRecord> facts, Map<SkipReason, Integer> dropReasons) {

    public int dropped() {
        return dropReasons.values().stream().mapToInt(Integer::intValue).sum();
    }
}
