package com.samsung.ees.infra.api.remotedb.widetable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.ees.infra.api.remotedb.config.ExtractionConfig;
import com.samsung.ees.infra.api.remotedb.executor.ScalarValues;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.repository.DeviceDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls configured fields out of a device row's JSON payload.
 * A payload that cannot be decoded yields no fields; it never fails the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayloadFieldExtractor {
    private final ObjectMapper objectMapper;

    /**
     * @param sourceType device type selecting the field list; {@code default} is used when it has no entry
     * @param payload    JSON text, a {@link JsonNode} or an already decoded {@link Map}
     * @return output field name to value, without entries for absent or null keys
     */
    public Map<String, Object> extract(String sourceType, Object payload, ExtractionConfig config) {
        JsonNode document = decode(payload);
        if (document == null) {
            return Collections.emptyMap();
        }

        Map<String, Object> extracted = new LinkedHashMap<>();
        for (String key : config.fieldsFor(sourceType)) {
            JsonNode value = document.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            extracted.put(config.outputNameFor(key), payloadValue(value));
        }
        return extracted;
    }

    /**
     * Reduces device rows to the configured main table fields plus extracted payload fields,
     * dropping the raw payload column.
     */
    public RowSet flatten(RowSet deviceRows, ExtractionConfig config) {
        List<Row> rows = new ArrayList<>(deviceRows.getTotalRows());
        for (Row row : deviceRows.getRows()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String field : config.getMainTableFields()) {
                if (row.contains(field)) {
                    values.put(field, row.get(field));
                }
            }
            Object payload = row.get(DeviceDataRepository.PAYLOAD_COLUMN);
            if (payload != null) {
                values.putAll(extract(row.getString("device_type"), payload, config));
            }
            rows.add(new Row(values));
        }
        return new RowSet(rows);
    }

    // payload text stays text; only result document text is reparsed into numbers
    private static Object payloadValue(JsonNode value) {
        return value.isTextual() ? value.textValue() : ScalarValues.fromJson(value);
    }

    private JsonNode decode(Object payload) {
        if (payload == null) {
            return null;
        }
        JsonNode document;
        try {
            if (payload instanceof JsonNode) {
                document = (JsonNode) payload;
            } else if (payload instanceof Map) {
                document = objectMapper.valueToTree(payload);
            } else {
                String text = payload.toString();
                if (text.isBlank()) {
                    return null;
                }
                document = objectMapper.readTree(text);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to parse payload_json: {}", e.getMessage());
            return null;
        }
        if (document == null || !document.isObject()) {
            log.warn("Ignoring payload that is not a JSON object: {}", document == null ? "empty" : document.getNodeType());
            return null;
        }
        return document;
    }
}
