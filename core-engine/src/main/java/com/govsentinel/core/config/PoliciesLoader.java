package com.govsentinel.core.config;

import com.govsentinel.core.policy.TransitionPolicyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the per-family status tables from {@code policies.yml}.
 *
 * <p>
 * The bundled resource covers the built-in families; {@value #ENV_POLICIES_PATH}
 * may point to a replacement file.
 * </p>
 *
 * @since 1.0.0
 */
public final class PoliciesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PoliciesLoader.class);

    public static final String ENV_POLICIES_PATH = "POLICIES_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "policies.yml";

    private PoliciesLoader() {
    }

    /**
     * @return a factory over the environment-selected or bundled tables
     * @throws IllegalStateException if a table is invalid
     */
    public static TransitionPolicyFactory load() {
        String envPath = System.getenv(ENV_POLICIES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading policies from environment path: {}", envPath);
            return fromFile(envPath);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static TransitionPolicyFactory fromFile(String path) {
        return YamlDocuments.fromFile(path, "Policies", PoliciesLoader::parse);
    }

    public static TransitionPolicyFactory fromClasspath(String resource) {
        return YamlDocuments.fromClasspath(resource, PoliciesLoader::parse);
    }

    private static TransitionPolicyFactory parse(InputStream is) {
        PoliciesConfig config = YamlDocuments.parse(is, PoliciesConfig.class);
        if (config == null || config.getPolicies().isEmpty()) {
            throw new IllegalStateException("No transition policies defined");
        }
        return new TransitionPolicyFactory(config.getPolicies());
    }
}
