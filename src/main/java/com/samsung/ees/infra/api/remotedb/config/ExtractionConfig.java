package com.samsung.ees.infra.api.remotedb.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which device table columns are carried into wide tables and which fields are pulled out of
 * each device type's JSON payload.
 *
 * <pre>
 * main_table_fields = ["id", "device_sn", "activePower"]
 *
 * [extract_from_payload]
 * default = ["soc"]
 * inverter = ["soc", "temp"]
 *
 * [field_name_mapping]
 * temp = "temperature"
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionConfig {
    public static final String DEFAULT_SOURCE_TYPE = "default";

    /**
     * Row bookkeeping columns. Never carried into a wide table as a per-device measurement.
     */
    public static final Set<String> METADATA_FIELDS = Set.of("id", "device_sn", "device_type", "timestamp", "local_timestamp");

    static final List<String> DEFAULT_MAIN_TABLE_FIELDS = List.of(
            "id", "device_sn", "device_type", "timestamp", "local_timestamp",
            "activePower", "reactivePower", "powerFactor");

    private final List<String> mainTableFields;
    private final Map<String, List<String>> extractFromPayload;
    private final Map<String, String> fieldNameMapping;

    @JsonCreator
    public ExtractionConfig(@JsonProperty("main_table_fields") List<String> mainTableFields,
                            @JsonProperty("extract_from_payload") Map<String, List<String>> extractFromPayload,
                            @JsonProperty("field_name_mapping") Map<String, String> fieldNameMapping) {
        this.mainTableFields = mainTableFields == null ? DEFAULT_MAIN_TABLE_FIELDS : List.copyOf(mainTableFields);
        this.extractFromPayload = extractFromPayload == null ? Map.of() : Map.copyOf(extractFromPayload);
        this.fieldNameMapping = fieldNameMapping == null ? Map.of() : Map.copyOf(fieldNameMapping);
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(null, null, null);
    }

    /**
     * Payload keys to extract for a device type, falling back to the {@code default} list.
     */
    public List<String> fieldsFor(String sourceType) {
        List<String> fields = sourceType == null ? null : extractFromPayload.get(sourceType);
        if (fields == null) {
            fields = extractFromPayload.get(DEFAULT_SOURCE_TYPE);
        }
        return fields == null ? List.of() : fields;
    }

    public String outputNameFor(String payloadKey) {
        return fieldNameMapping.getOrDefault(payloadKey, payloadKey);
    }

    /**
     * Measurement columns copied from device rows into a wide table.
     */
    public List<String> carriedMeasurementFields() {
        return mainTableFields.stream()
                .filter(field -> !METADATA_FIELDS.contains(field))
                .collect(Collectors.toList());
    }
}
