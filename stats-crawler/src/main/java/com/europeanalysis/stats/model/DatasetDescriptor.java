package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Static description of one upstream dataset. Instances are built once by the
 * registry and hold only unmodifiable collections.
 */
@Value
@Builder(toBuilder = true)
public class DatasetDescriptor {

    /** Upstream dataset id, e.g. demo_pjan. Unique within the registry. */
    String id;

    String title;

    DatasetFamily family;

    /** Name of the DataSource row facts from this dataset are attributed to. */
    String sourceName;

    PayloadFormat format;

    /** Path segment appended to the API base URL. */
    String path;

    /** Resource location of a local extract; null for datasets served by the API. */
    String resource;

    /** Charset name used to decode a local extract. */
    String encoding;

    DimensionMapping dimensions;

    String valueField;

    /** Query parameters sent with every page, in declaration order. */
    Map<String, String> defaultParams;

    /** Null for datasets fetched in a single request. */
    PagingSpec paging;

    public boolean isPaged() {
        return paging != null;
    }

    public boolean isFileBacked() {
        return resource != null;
    }
}
