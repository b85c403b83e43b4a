package com.samsung.ees.infra.api.remotedb.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigTest {

    @Test
    void defaults_shouldCarryStandardMeasurementsAndExtractNothing() {
        ExtractionConfig config = ExtractionConfig.defaults();

        assertEquals(List.of("activePower", "reactivePower", "powerFactor"), config.carriedMeasurementFields());
        assertTrue(config.fieldsFor("pcs").isEmpty());
        assertEquals("soc", config.outputNameFor("soc"));
    }

    @Test
    void fieldsFor_shouldPreferTypeEntryOverDefault() {
        ExtractionConfig config = new ExtractionConfig(null,
                Map.of("default", List.of("soc"), "meter", List.of("frequency")), null);

        assertEquals(List.of("frequency"), config.fieldsFor("meter"));
        assertEquals(List.of("soc"), config.fieldsFor("bms"));
        assertEquals(List.of("soc"), config.fieldsFor(null));
    }

    @Test
    void carriedMeasurementFields_shouldSkipMetadataColumns() {
        ExtractionConfig config = new ExtractionConfig(
                List.of("id", "timestamp", "device_sn", "soc", "local_timestamp", "device_type", "voltage"), null, null);

        assertEquals(List.of("soc", "voltage"), config.carriedMeasurementFields());
    }
}
