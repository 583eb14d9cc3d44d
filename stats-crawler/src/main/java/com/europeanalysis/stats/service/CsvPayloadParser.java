package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.PayloadFormat;
import com.europeanalysis.stats.model.RawRecord;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header-row CSV, as served by the SDMX-CSV endpoints (columns such as
 * geo, TIME_PERIOD, OBS_VALUE). Each data row becomes one record keyed by the
 * header names.
 *
 * Rows shorter than the header keep only the columns they have; the
 * normalizer drops them if a mapped column is missing.
 */
@Component
@Slf4j
public class CsvPayloadParser implements PayloadParser {

    private static final String BOM = "\uFEFF";

    @Override
    public PayloadFormat format() {
        return PayloadFormat.CSV;
    }

    @Override
    public List<RawRecord> parse(byte[] payload, Charset charset) throws IOException {
        List<RawRecord> records = new ArrayList<>();
        int ragged = 0;

        try (CSVReader reader = new CSVReader(new InputStreamReader(new ByteArrayInputStream(payload), charset))) {
            String[] header = reader.readNext();
            if (header == null) {
                return records;
            }
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].replace(BOM, "").trim();
            }

            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                if (row.length != header.length) ragged++;

                Map<String, String> fields = new LinkedHashMap<>();
                for (int i = 0; i < header.length && i < row.length; i++) {
                    fields.put(header[i], row[i].trim());
                }
                records.add(RawRecord.of(fields));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }

        if (ragged > 0) {
            log.debug("CSV payload: {} records, {} with a column count differing from the header",
                    records.size(), ragged);
        }
        return records;
    }
}
