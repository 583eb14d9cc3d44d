package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.PayloadFormat;
import com.europeanalysis.stats.model.RawRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain JSON record lists: either a top-level array of objects or an object
 * wrapping that array under "data". Scalar properties become fields; nested
 * objects and nulls are ignored.
 */
@Component
@RequiredArgsConstructor
public class JsonRecordsParser implements PayloadParser {

    private final ObjectMapper objectMapper;

    @Override
    public PayloadFormat format() {
        return PayloadFormat.JSON_RECORDS;
    }

    @Override
    public List<RawRecord> parse(byte[] payload, Charset charset) throws IOException {
        JsonNode root = objectMapper.readTree(new String(payload, charset));
        JsonNode rows = root != null && root.isObject() ? root.path("data") : root;
        if (rows == null || !rows.isArray()) {
            throw new IOException("Expected a JSON array of records or an object with a 'data' array");
        }

        List<RawRecord> records = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                throw new IOException("Record list contains a non-object element: " + row.getNodeType());
            }
            Map<String, String> fields = new LinkedHashMap<>();
            row.fields().forEachRemaining(e -> {
                if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                    fields.put(e.getKey(), e.getValue().asText());
                }
            });
            records.add(RawRecord.of(fields));
        }
        return records;
    }
}
