package com.europeanalysis.stats.service;

import com.europeanalysis.stats.UnknownDatasetException;
import com.europeanalysis.stats.config.StatsCrawlerProperties;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.DatasetFamily;
import com.europeanalysis.stats.model.DimensionMapping;
import com.europeanalysis.stats.model.PagingSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalogue of ingestable datasets, built once from the {@code stats-crawler.datasets}
 * configuration and read-only afterwards.
 *
 * Key design notes:
 *  - descriptors are validated at startup; a bad entry fails the context
 *  - iteration order follows declaration order in the configuration
 *  - lookups are lock-free, the backing map is never mutated after construction
 */
@Component
@Slf4j
public class DatasetRegistry {

    private final Map<String, DatasetDescriptor> descriptors;

    @Autowired
    public DatasetRegistry(StatsCrawlerProperties properties) {
        this(properties.getDatasets().stream().map(DatasetRegistry::toDescriptor).toList());
        log.info("Dataset registry loaded: {}", descriptors.keySet());
    }

    private DatasetRegistry(List<DatasetDescriptor> entries) {
        Map<String, DatasetDescriptor> byId = new LinkedHashMap<>();
        for (DatasetDescriptor descriptor : entries) {
            validate(descriptor);
            if (byId.putIfAbsent(descriptor.getId(), descriptor) != null) {
                throw new IllegalStateException("Duplicate dataset id: " + descriptor.getId());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    public static DatasetRegistry of(List<DatasetDescriptor> descriptors) {
        return new DatasetRegistry(descriptors);
    }

    public DatasetDescriptor lookup(String datasetId) {
        DatasetDescriptor descriptor = datasetId == null ? null : descriptors.get(datasetId);
        if (descriptor == null) {
            throw new UnknownDatasetException(datasetId);
        }
        return descriptor;
    }

    public boolean contains(String datasetId) {
        return datasetId != null && descriptors.containsKey(datasetId);
    }

    public List<DatasetDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static DatasetDescriptor toDescriptor(StatsCrawlerProperties.Dataset entry) {
        String id = entry.getId();
        String resource = emptyToNull(entry.getResource());
        StatsCrawlerProperties.Dimensions dims = entry.getDimensions();
        StatsCrawlerProperties.Paging paging = entry.getPaging();

        return DatasetDescriptor.builder()
                .id(id)
                .title(isBlank(entry.getTitle()) ? id : entry.getTitle())
                .family(entry.getFamily())
                .sourceName(isBlank(entry.getSourceName())
                        ? (resource == null ? "eurostat:" : "file:") + id
                        : entry.getSourceName())
                .format(entry.getFormat())
                .path(isBlank(entry.getPath()) ? id : entry.getPath())
                .resource(resource)
                .encoding(isBlank(entry.getEncoding()) ? "UTF-8" : entry.getEncoding().trim())
                .dimensions(dims == null ? null : DimensionMapping.builder()
                        .geo(emptyToNull(dims.getGeo()))
                        .time(emptyToNull(dims.getTime()))
                        .sex(emptyToNull(dims.getSex()))
                        .age(emptyToNull(dims.getAge()))
                        .ageMin(emptyToNull(dims.getAgeMin()))
                        .ageMax(emptyToNull(dims.getAgeMax()))
                        .industry(emptyToNull(dims.getIndustry()))
                        .unit(emptyToNull(dims.getUnit()))
                        .male(emptyToNull(dims.getMale()))
                        .female(emptyToNull(dims.getFemale()))
                        .build())
                .valueField(entry.getValueField())
                .defaultParams(Collections.unmodifiableMap(new LinkedHashMap<>(entry.getDefaultParams())))
                .paging(paging == null || isBlank(paging.getParam())
                        ? null
                        : new PagingSpec(paging.getParam(), List.copyOf(paging.getValues())))
                .build();
    }

    private static void validate(DatasetDescriptor d) {
        if (isBlank(d.getId())) {
            throw new IllegalStateException("Dataset entry without an id");
        }
        String id = d.getId();
        if (d.getFamily() == null) {
            throw new IllegalStateException("Dataset " + id + ": family is required");
        }
        if (d.getFormat() == null) {
            throw new IllegalStateException("Dataset " + id + ": format is required");
        }
        if (isBlank(d.getValueField())) {
            throw new IllegalStateException("Dataset " + id + ": value-field is required");
        }
        DimensionMapping dims = d.getDimensions();
        if (dims == null || dims.getGeo() == null || dims.getTime() == null) {
            throw new IllegalStateException("Dataset " + id + ": geo and time dimensions are required");
        }
        if (dims.hasAgeCode() && dims.hasAgeBounds()) {
            throw new IllegalStateException("Dataset " + id + ": map age either as a code or as bounds, not both");
        }
        if (dims.getAgeMax() != null && !dims.hasAgeBounds()) {
            throw new IllegalStateException("Dataset " + id + ": age-max requires age-min");
        }
        if ((dims.getMale() == null) != (dims.getFemale() == null)) {
            throw new IllegalStateException("Dataset " + id + ": male and female columns are mapped together");
        }
        if (dims.hasSexSplit() && (dims.hasSex() || d.getFamily() != DatasetFamily.DEMOGRAPHIC)) {
            throw new IllegalStateException("Dataset " + id
                    + ": male/female columns apply to demographic datasets without a sex axis");
        }
        if (d.isPaged() && d.getPaging().getValues().isEmpty()) {
            throw new IllegalStateException("Dataset " + id + ": paging on '"
                    + d.getPaging().getParam() + "' declares no values");
        }
        if (d.isFileBacked() && d.isPaged()) {
            throw new IllegalStateException("Dataset " + id + ": a local resource cannot be paged");
        }
        if (d.getEncoding() != null && !isSupportedCharset(d.getEncoding())) {
            throw new IllegalStateException("Dataset " + id + ": unsupported encoding " + d.getEncoding());
        }
    }

    private static boolean isSupportedCharset(String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String emptyToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
