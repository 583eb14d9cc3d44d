package com.europeanalysis.stats;

import lombok.Getter;

/**
 * A dataset id that is not present in the registry. Raised before a run starts.
 */
@Getter
public class UnknownDatasetException extends StatsCrawlerException {

    private final String datasetId;

    public UnknownDatasetException(String datasetId) {
        super("Unknown dataset: " + datasetId);
        this.datasetId = datasetId;
    }
}
