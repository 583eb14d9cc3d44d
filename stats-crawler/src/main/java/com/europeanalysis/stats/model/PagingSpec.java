package com.europeanalysis.stats.model;

import lombok.Value;

import java.util.List;

/**
 * Splits one dataset fetch into pages: page n sends {@code param=values[n]}.
 */
@Value
public class PagingSpec {

    String param;
    List<String> values;

    public int pageCount() {
        return values.size();
    }
}
