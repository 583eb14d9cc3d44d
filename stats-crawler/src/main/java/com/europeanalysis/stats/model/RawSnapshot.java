package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Archived provenance for one fetched page. Append-only.
 */
@Value
@Builder
public class RawSnapshot {

    Long id;
    String datasetId;
    int pageIndex;
    String requestUri;
    /** Query parameters as JSON. */
    String queryParams;
    Instant retrievedAt;
    /** Bytes exactly as received, before any charset decoding. */
    byte[] payload;
    /** SHA-256 of the received bytes, lower-case hex. */
    String contentHash;
}
