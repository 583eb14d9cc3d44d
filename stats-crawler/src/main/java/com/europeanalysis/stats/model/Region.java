package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Geographic unit keyed by its NUTS/ISO-style code. The parent is referenced
 * by code only and need not exist.
 */
@Value
@Builder
public class Region {

    Long id;
    String code;
    String name;
    /** aggregate | country | nuts1 | nuts2 | nuts3 | other */
    String level;
    String parentCode;
}
