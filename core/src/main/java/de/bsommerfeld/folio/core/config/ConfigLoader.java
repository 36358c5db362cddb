package de.bsommerfeld.folio.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link BrowserConfig} from a JSON file. A missing file yields the
 * defaults; a present but broken one is fatal.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param configPath file to read, typically {@code <app-data>/config.json}
     * @return validated configuration
     * @throws ConfigurationException if the file cannot be parsed or fails validation
     */
    public BrowserConfig load(Path configPath) {
        BrowserConfig config;
        if (Files.isRegularFile(configPath)) {
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            try {
                config = mapper.readValue(configPath.toFile(), BrowserConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration: " + configPath, e);
            }
        } else {
            LOG.info("No configuration at {}, using defaults", configPath.toAbsolutePath());
            config = new BrowserConfig();
        }
        config.validate();
        return config;
    }
}
