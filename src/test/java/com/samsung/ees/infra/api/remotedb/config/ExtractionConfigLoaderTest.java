package com.samsung.ees.infra.api.remotedb.config;

import com.samsung.ees.infra.api.remotedb.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigLoaderTest {

    private ExtractionConfigLoader loaderFor(String location) {
        RemoteQueryProperties properties = new RemoteQueryProperties();
        properties.setExtractionConfig(location);
        return new ExtractionConfigLoader(new DefaultResourceLoader(), properties);
    }

    @Test
    void getConfig_shouldReadTomlDocument() {
        ExtractionConfig config = loaderFor("classpath:config/test-extraction.toml").getConfig();

        assertEquals(List.of("id", "device_sn", "local_timestamp", "activePower"), config.getMainTableFields());
        assertEquals(List.of("soc", "soh"), config.fieldsFor("bms"));
        assertEquals(List.of("soc"), config.fieldsFor("pcs"));
        assertEquals(Map.of("soh", "stateOfHealth"), config.getFieldNameMapping());
    }

    @Test
    void getConfig_shouldReadBundledDocument() {
        ExtractionConfig config = loaderFor("classpath:extraction-config.toml").getConfig();

        assertEquals("temperature", config.outputNameFor("temp"));
        assertFalse(config.fieldsFor(ExtractionConfig.DEFAULT_SOURCE_TYPE).isEmpty());
    }

    @Test
    void getConfig_whenDocumentMissing_shouldFallBackToDefaults() {
        ExtractionConfig config = loaderFor("classpath:config/does-not-exist.toml").getConfig();

        assertEquals(ExtractionConfig.defaults(), config);
    }

    @Test
    void getConfig_whenDocumentBroken_shouldFallBackToDefaults() {
        ExtractionConfig config = loaderFor("classpath:config/broken-extraction.toml").getConfig();

        assertEquals(ExtractionConfig.defaults(), config);
    }

    @Test
    void load_whenDocumentMissingOrBroken_shouldThrowConfigurationException() {
        assertThrows(ConfigurationException.class, () -> loaderFor("classpath:config/does-not-exist.toml").load());
        assertThrows(ConfigurationException.class, () -> loaderFor("classpath:config/broken-extraction.toml").load());
    }

    @Test
    void reload_shouldPickUpChangedDocument(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("extraction.toml");
        Files.writeString(file, "[extract_from_payload]\ndefault = [\"soc\"]\n");
        ExtractionConfigLoader loader = loaderFor(file.toUri().toString());
        assertEquals(List.of("soc"), loader.getConfig().fieldsFor("any"));

        Files.writeString(file, "[extract_from_payload]\ndefault = [\"voltage\"]\n");
        assertEquals(List.of("soc"), loader.getConfig().fieldsFor("any"));
        assertEquals(List.of("voltage"), loader.reload().fieldsFor("any"));
    }
}
