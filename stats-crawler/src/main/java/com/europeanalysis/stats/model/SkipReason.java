package com.europeanalysis.stats.model;

/**
 * Why a raw record was left out of a normalized batch. Skips are counted, never thrown.
 */
public enum SkipReason {
    MISSING_DIMENSION,
    UNPARSEABLE_TIME,
    YEAR_OUT_OF_RANGE,
    UNPARSEABLE_AGE,
    UNPARSEABLE_VALUE,
    /** Same natural key as an earlier fact on the page, e.g. series differing only in an unmapped dimension. */
    DUPLICATE_KEY
}
