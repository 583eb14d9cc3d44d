package com.europeanalysis.stats.model;

import lombok.Value;

import java.util.Map;

/**
 * One flattened upstream observation: field name to raw text, plus display
 * labels where the payload carried them. Fields the descriptor does not map
 * are kept as-is and ignored by normalization.
 */
@Value
public class RawRecord {

    Map<String, String> fields;
    Map<String, String> labels;

    public static RawRecord of(Map<String, String> fields) {
        return new RawRecord(fields, Map.of());
    }

    public String get(String field) {
        return field == null ? null : fields.get(field);
    }

    public String label(String field) {
        return field == null ? null : labels.get(field);
    }
}
