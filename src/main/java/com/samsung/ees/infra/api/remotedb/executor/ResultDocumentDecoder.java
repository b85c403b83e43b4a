package com.samsung.ees.infra.api.remotedb.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.ees.infra.api.remotedb.exception.RemoteExecutionException;
import com.samsung.ees.infra.api.remotedb.exception.ResultDecodeException;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the helper's JSON result document into a {@link RowSet}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultDocumentDecoder {
    static final String ERROR_KEY = "error";

    private final ObjectMapper objectMapper;

    public RowSet decode(String document) {
        if (document == null || document.isBlank()) {
            log.warn("Query returned no results");
            return RowSet.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse result document: {}", abbreviate(document));
            throw new ResultDecodeException("Failed to parse query results: " + e.getOriginalMessage(), e);
        }

        if (root.isObject() && root.has(ERROR_KEY)) {
            throw new RemoteExecutionException("SQL query failed: " + root.get(ERROR_KEY).asText());
        }
        if (!root.isArray()) {
            throw new ResultDecodeException("Query returned unexpected format: " + root.getNodeType(), null);
        }

        List<Row> rows = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new ResultDecodeException("Result row is not an object: " + element.getNodeType(), null);
            }
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), ScalarValues.fromJson(field.getValue()));
            }
            rows.add(new Row(values));
        }
        log.info("Query returned {} rows", rows.size());
        return new RowSet(rows);
    }

    /**
     * Extracts the message of a {@code {"error": "..."}} document, or {@code null} if the text is not one.
     */
    public String errorMessage(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text.trim());
            if (node != null && node.isObject() && node.has(ERROR_KEY)) {
                return node.get(ERROR_KEY).asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Remote error output is not a JSON document: {}", abbreviate(text));
        }
        return null;
    }

    private static String abbreviate(String text) {
        return text.length() <= 500 ? text : text.substring(0, 500) + "...";
    }
}
