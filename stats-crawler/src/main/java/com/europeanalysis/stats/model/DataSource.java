package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DataSource {

    Long id;
    String name;
    String sourceType;
    String url;
    /** Null until the first completed ingestion run. */
    Instant lastUpdated;
    Instant createdAt;
}
