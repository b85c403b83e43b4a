package com.samsung.ees.infra.api.remotedb.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.samsung.ees.infra.api.remotedb.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the payload extraction config from a TOML document.
 * The first successful (or defaulted) load is cached until {@link #reload()} is called.
 */
@Slf4j
@Component
public class ExtractionConfigLoader {
    private final ResourceLoader resourceLoader;
    private final String location;
    private final TomlMapper tomlMapper = new TomlMapper();

    private volatile ExtractionConfig cached;

    public ExtractionConfigLoader(ResourceLoader resourceLoader, RemoteQueryProperties properties) {
        this.resourceLoader = resourceLoader;
        this.location = properties.getExtractionConfig();
    }

    /**
     * Returns the active config; a missing or broken document degrades to {@link ExtractionConfig#defaults()}.
     */
    public ExtractionConfig getConfig() {
        ExtractionConfig config = cached;
        if (config == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = loadOrDefault();
                }
                config = cached;
            }
        }
        return config;
    }

    public synchronized ExtractionConfig reload() {
        cached = loadOrDefault();
        return cached;
    }

    /**
     * Strict variant of {@link #getConfig()} that reports why the document could not be used.
     */
    public ExtractionConfig load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Extraction config not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ExtractionConfig config = tomlMapper.readValue(in, ExtractionConfig.class);
            log.info("Loaded extraction config from {}", location);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read extraction config " + location, e);
        }
    }

    private ExtractionConfig loadOrDefault() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.warn("{}; falling back to built-in defaults", e.getMessage(), e.getCause());
            return ExtractionConfig.defaults();
        }
    }
}
