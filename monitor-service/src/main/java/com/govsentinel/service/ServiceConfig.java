package com.govsentinel.service;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.dispatch.ChannelRouter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable process configuration for the monitor service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured entirely through container env vars or a shell
 * environment. Per-source settings live in {@code monitors.yml}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} in
 * tests. {@link Builder#build()} validates ranges; credentials are checked
 * later, per source, so one missing channel does not stop every source.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String PROD_STATE_DIR = "proposal_tracking";
    public static final String TEST_STATE_DIR = "test_proposal_tracking";

    // ---------------------------------------------------------------
    // Slack
    // ---------------------------------------------------------------
    private final String slackBotToken;
    private final String appChannel;
    private final String netChannel;
    private final String testChannel;
    private final boolean disableLinkPreviews;

    // ---------------------------------------------------------------
    // Runtime
    // ---------------------------------------------------------------
    private final boolean testMode;
    private final Path dataDir;
    private final String monitorsConfigPath;
    private final Duration httpTimeout;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.slackBotToken = b.slackBotToken;
        this.appChannel = b.appChannel;
        this.netChannel = b.netChannel;
        this.testChannel = b.testChannel;
        this.disableLinkPreviews = b.disableLinkPreviews;
        this.testMode = b.testMode;
        this.dataDir = b.dataDir;
        this.monitorsConfigPath = b.monitorsConfigPath;
        this.httpTimeout = Duration.ofSeconds(b.httpTimeoutSeconds);
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric env var cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .slackBotToken(env("SLACK_BOT_TOKEN", ""))
                    .appChannel(env("SLACK_APP_CHANNEL", ""))
                    .netChannel(env("SLACK_NET_CHANNEL", ""))
                    .testChannel(env("SLACK_TEST_CHANNEL", ""))
                    .disableLinkPreviews(Boolean.parseBoolean(env("SLACK_DISABLE_LINK_PREVIEWS", "true")))
                    .testMode(Boolean.parseBoolean(env("GOVSENTINEL_TEST_MODE", "false")))
                    .dataDir(Path.of(env("GOVSENTINEL_DATA_DIR", "data")))
                    .monitorsConfigPath(env("MONITORS_CONFIG_PATH", ""))
                    .httpTimeoutSeconds(parseIntEnv("HTTP_TIMEOUT_SECONDS", "30"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    /**
     * @return {@code <dataDir>/proposal_tracking}, or
     *         {@code <dataDir>/test_proposal_tracking} in test mode
     */
    public Path stateDirectory() {
        return dataDir.resolve(testMode ? TEST_STATE_DIR : PROD_STATE_DIR);
    }

    public Path stateFile(String source) {
        return stateDirectory().resolve(source + "_state.json");
    }

    public Path adminAlertsFile(String source) {
        return stateDirectory().resolve(source + "_admin_alerts.json");
    }

    /**
     * @return router over the configured app / net / test channels
     */
    public ChannelRouter channelRouter() {
        Map<String, String> channels = new HashMap<>();
        channels.put(ScopeDefinition.CHANNEL_APP, appChannel);
        channels.put(ScopeDefinition.CHANNEL_NET, netChannel);
        channels.values().removeIf(Objects::isNull);
        return new ChannelRouter(channels, testMode, testChannel);
    }

    public boolean hasSlackCredentials() {
        return slackBotToken != null && !slackBotToken.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSlackBotToken() {
        return slackBotToken;
    }

    public String getAppChannel() {
        return appChannel;
    }

    public String getNetChannel() {
        return netChannel;
    }

    public String getTestChannel() {
        return testChannel;
    }

    public boolean isDisableLinkPreviews() {
        return disableLinkPreviews;
    }

    public boolean isTestMode() {
        return testMode;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public String getMonitorsConfigPath() {
        return monitorsConfigPath;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks the health port is in [1, 65535], the HTTP
     * timeout is positive and the data directory is set.
     * </p>
     */
    public static class Builder {
        private String slackBotToken = "";
        private String appChannel = "";
        private String netChannel = "";
        private String testChannel = "";
        private boolean disableLinkPreviews = true;
        private boolean testMode;
        private Path dataDir = Path.of("data");
        private String monitorsConfigPath = "";
        private int httpTimeoutSeconds = 30;
        private int healthPort = 8080;

        public Builder slackBotToken(String v) {
            this.slackBotToken = v;
            return this;
        }

        public Builder appChannel(String v) {
            this.appChannel = v;
            return this;
        }

        public Builder netChannel(String v) {
            this.netChannel = v;
            return this;
        }

        public Builder testChannel(String v) {
            this.testChannel = v;
            return this;
        }

        public Builder disableLinkPreviews(boolean v) {
            this.disableLinkPreviews = v;
            return this;
        }

        public Builder testMode(boolean v) {
            this.testMode = v;
            return this;
        }

        public Builder dataDir(Path v) {
            this.dataDir = v;
            return this;
        }

        public Builder monitorsConfigPath(String v) {
            this.monitorsConfigPath = v;
            return this;
        }

        public Builder httpTimeoutSeconds(int v) {
            this.httpTimeoutSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(dataDir, "dataDir required");
            if (httpTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "httpTimeoutSeconds must be >= 1, got: " + httpTimeoutSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "slackBotToken=" + (hasSlackCredentials() ? "***" : "<unset>") +
                ", appChannel='" + appChannel + '\'' +
                ", netChannel='" + netChannel + '\'' +
                ", testChannel='" + testChannel + '\'' +
                ", testMode=" + testMode +
                ", dataDir=" + dataDir +
                ", httpTimeout=" + httpTimeout +
                ", healthPort=" + healthPort +
                '}';
    }
}
