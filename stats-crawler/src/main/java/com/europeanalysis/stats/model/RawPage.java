package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.Charset;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single fetched page: the exact request, the bytes received and the records
 * parsed from them.
 */
@Value
@Builder
public class RawPage {

    String datasetId;
    int pageIndex;
    String requestUri;
    Map<String, List<String>> queryParams;
    Instant retrievedAt;
    byte[] payload;
    Charset charset;
    String contentHash;
    List<RawRecord> records;

    /** True once the paging values are exhausted or this page came back empty. */
    boolean lastPage;

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
