package com.trading.fincalc.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link KernelSettings} from JSON.
 *
 * <p>
 * Numbers are read as {@link java.math.BigDecimal} so thresholds such as
 * {@code 1e-10} keep their exact decimal value.
 */
public final class KernelSettingsLoader {
    private static final Logger log = LogManager.getLogger(KernelSettingsLoader.class);

    /** Classpath resource consulted by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "fincalc-kernel.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private KernelSettingsLoader() {
        // Utility class
    }

    /** Loads the default classpath resource, or defaults when it is absent. */
    public static KernelSettings load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /** Loads a classpath resource, or defaults when it is absent. */
    public static KernelSettings loadResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null)
            cl = KernelSettingsLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using default kernel settings", resource);
                return new KernelSettings();
            }
            KernelSettings settings = MAPPER.readValue(in, KernelSettings.class).validate();
            log.info("Loaded kernel settings from classpath:{} (precision={}, domainPolicy={})",
                    resource, settings.getPrecision(), settings.getDomainPolicy());
            return settings;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load kernel settings from classpath:" + resource, e);
        }
    }

    /** Loads settings from a JSON file. */
    public static KernelSettings load(Path path) {
        try {
            KernelSettings settings = parse(Files.readString(path));
            log.info("Loaded kernel settings from {}", path);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load kernel settings from " + path, e);
        }
    }

    /** Parses settings from a JSON string. Missing fields keep their defaults. */
    public static KernelSettings parse(String json) {
        try {
            return MAPPER.readValue(json, KernelSettings.class).validate();
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid kernel settings: " + e.getMessage(), e);
        }
    }
}
