package com.govsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and validates {@link MonitorsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_MONITORS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so a broken watchlist
 * stops the process at startup instead of surfacing mid-pass.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorsLoader.class);

    public static final String ENV_MONITORS_PATH = "MONITORS_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "monitors.yml";

    private MonitorsLoader() {
    }

    /**
     * Load using {@value #ENV_MONITORS_PATH} when it points to an existing
     * file, otherwise the bundled {@value #DEFAULT_RESOURCE}.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static MonitorsConfig load() {
        return load(System.getenv(ENV_MONITORS_PATH));
    }

    /**
     * @param overridePath file path to prefer, may be {@code null}
     * @return parsed and validated configuration
     */
    public static MonitorsConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading monitors from path: {}", overridePath);
            return fromFile(overridePath);
        }
        LOG.info("Loading monitors from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitorsConfig fromFile(String path) {
        return YamlDocuments.fromFile(path, "Monitors", MonitorsLoader::parseAndValidate);
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitorsConfig fromClasspath(String resource) {
        return YamlDocuments.fromClasspath(resource, MonitorsLoader::parseAndValidate);
    }

    private static MonitorsConfig parseAndValidate(InputStream is) {
        MonitorsConfig config = YamlDocuments.parse(is, MonitorsConfig.class);

        if (config == null || config.getSources().isEmpty()) {
            LOG.warn("No governance sources defined in configuration");
            config = new MonitorsConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} source(s), {} enabled", config.getSources().size(), config.enabledSources().size());
        return config;
    }
}
