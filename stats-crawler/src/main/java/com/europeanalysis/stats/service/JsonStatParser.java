package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.PayloadFormat;
import com.europeanalysis.stats.model.RawRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a JSON-stat 2.0 dataset (the Eurostat dissemination API format)
 * into one record per observation.
 *
 * The value cube is stored row-major over the dimensions listed in "id", the
 * last dimension varying fastest. "value" is either a dense array or a sparse
 * object keyed by linear index; null cells are not observations and are
 * skipped. Each record maps every dimension id to its category code and
 * {@code value} to the observation, with category labels alongside.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonStatParser implements PayloadParser {

    static final String VALUE_FIELD = "value";

    private final ObjectMapper objectMapper;

    @Override
    public PayloadFormat format() {
        return PayloadFormat.JSON_STAT;
    }

    @Override
    public List<RawRecord> parse(byte[] payload, Charset charset) throws IOException {
        JsonNode root = objectMapper.readTree(new String(payload, charset));
        if (root == null || !root.isObject()) {
            throw new IOException("JSON-stat payload is not an object");
        }

        JsonNode ids = root.path("id");
        JsonNode sizes = root.path("size");
        if (!ids.isArray() || !sizes.isArray() || ids.size() != sizes.size() || ids.isEmpty()) {
            throw new IOException("JSON-stat payload has missing or inconsistent 'id'/'size'");
        }

        int dims = ids.size();
        String[] dimIds = new String[dims];
        int[] dimSizes = new int[dims];
        List<String[]> codes = new ArrayList<>(dims);
        List<Map<String, String>> labels = new ArrayList<>(dims);
        long total = 1;

        for (int d = 0; d < dims; d++) {
            dimIds[d] = ids.get(d).asText();
            dimSizes[d] = sizes.get(d).asInt(-1);
            if (dimSizes[d] < 0) {
                throw new IOException("JSON-stat size for '" + dimIds[d] + "' is not a number");
            }
            JsonNode category = root.path("dimension").path(dimIds[d]).path("category");
            String[] dimCodes = categoryCodes(dimIds[d], category, dimSizes[d]);
            codes.add(dimCodes);
            labels.add(categoryLabels(category.path("label")));
            total *= dimSizes[d];
        }

        JsonNode values = root.path(VALUE_FIELD);
        List<RawRecord> records = new ArrayList<>();

        if (values.isArray()) {
            if (values.size() != total) {
                throw new IOException("JSON-stat value array has " + values.size()
                        + " cells, expected " + total);
            }
            for (int i = 0; i < values.size(); i++) {
                addRecord(records, i, values.get(i), dimIds, dimSizes, codes, labels);
            }
        } else if (values.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> cells = values.fields();
            while (cells.hasNext()) {
                Map.Entry<String, JsonNode> cell = cells.next();
                long index;
                try {
                    index = Long.parseLong(cell.getKey());
                } catch (NumberFormatException e) {
                    throw new IOException("JSON-stat sparse value key is not an index: " + cell.getKey());
                }
                if (index < 0 || index >= total) {
                    throw new IOException("JSON-stat sparse value index out of range: " + index);
                }
                addRecord(records, index, cell.getValue(), dimIds, dimSizes, codes, labels);
            }
        } else if (!values.isMissingNode() && !values.isNull()) {
            throw new IOException("JSON-stat 'value' is neither an array nor an object");
        }

        log.debug("Flattened JSON-stat payload {} into {} records", List.of(dimIds), records.size());
        return records;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void addRecord(List<RawRecord> out, long linearIndex, JsonNode value,
                           String[] dimIds, int[] dimSizes,
                           List<String[]> codes, List<Map<String, String>> labels) {
        if (value == null || value.isNull()) {
            return;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, String> fieldLabels = new HashMap<>();

        long remainder = linearIndex;
        for (int d = dimIds.length - 1; d >= 0; d--) {
            int position = (int) (remainder % dimSizes[d]);
            remainder /= dimSizes[d];
            String code = codes.get(d)[position];
            fields.put(dimIds[d], code);
            String label = labels.get(d).get(code);
            if (label != null) {
                fieldLabels.put(dimIds[d], label);
            }
        }
        fields.put(VALUE_FIELD, value.asText());
        out.add(new RawRecord(fields, fieldLabels));
    }

    private String[] categoryCodes(String dimId, JsonNode category, int size) throws IOException {
        JsonNode index = category.path("index");
        JsonNode label = category.path("label");
        String[] result = new String[size];
        if (index.isArray()) {
            for (int i = 0; i < index.size() && i < size; i++) {
                result[i] = index.get(i).asText();
            }
        } else if (index.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = index.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                int position = entry.getValue().asInt(-1);
                if (position < 0 || position >= size) {
                    throw new IOException("JSON-stat category position out of range for '" + dimId + "'");
                }
                result[position] = entry.getKey();
            }
        } else if (size == 1 && label.isObject() && label.size() == 1) {
            // single-category dimensions may omit the index; the only label key is the code
            result[0] = label.fieldNames().next();
        } else {
            throw new IOException("JSON-stat dimension '" + dimId + "' has no category index");
        }
        for (String code : result) {
            if (code == null) {
                throw new IOException("JSON-stat dimension '" + dimId + "' index does not cover its size");
            }
        }
        return result;
    }

    private Map<String, String> categoryLabels(JsonNode label) {
        Map<String, String> result = new HashMap<>();
        if (label.isObject()) {
            label.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        }
        return result;
    }
}
