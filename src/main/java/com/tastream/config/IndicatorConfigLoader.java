package com.tastream.config;

import com.tastream.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Reads {@link IndicatorSetConfig} documents from JSON.
 *
 * <pre>{@code
 * {
 *   "name": "nifty-1m",
 *   "indicators": [
 *     { "type": "RSI", "params": { "period": 14 } },
 *     { "type": "BOLLINGER", "params": { "period": 20, "multiplier": 2.0 } }
 *   ]
 * }
 * }</pre>
 *
 * <p>Only the document shape is checked here. Parameter domains are validated when the
 * indicators are built.
 */
public final class IndicatorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IndicatorConfigLoader.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private IndicatorConfigLoader() {}

    public static IndicatorSetConfig load(InputStream in) {
        IndicatorSetConfig config;
        try {
            config = MAPPER.readValue(in, IndicatorSetConfig.class);
        } catch (JacksonException e) {
            throw new ConfigurationException("Malformed indicator set configuration: " + e.getMessage(), e);
        }
        validate(config);
        log.debug(
                "Loaded indicator set '{}' with {} definitions", config.getName(), config.getIndicators().size());
        return config;
    }

    public static IndicatorSetConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read indicator set configuration " + path, e);
        }
    }

    /** Loads a configuration from the classpath, e.g. {@code indicators/default.json}. */
    public static IndicatorSetConfig loadResource(String resource) {
        InputStream in = IndicatorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Indicator set configuration not found on classpath: " + resource);
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read indicator set configuration " + resource, e);
        }
    }

    private static void validate(IndicatorSetConfig config) {
        if (config == null) {
            throw new ConfigurationException("Indicator set configuration is empty");
        }
        if (config.getIndicators() == null) {
            throw new ConfigurationException("Indicator set '" + config.getName() + "' has no indicator list");
        }
        for (int i = 0; i < config.getIndicators().size(); i++) {
            IndicatorDefinition definition = config.getIndicators().get(i);
            if (definition == null || definition.getType() == null) {
                throw new ConfigurationException(
                        "Indicator #" + i + " of set '" + config.getName() + "' has no type");
            }
            if (definition.getParams() == null) {
                definition.setParams(new HashMap<>());
            }
        }
    }
}
