package com.govsentinel.core.dispatch;

import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.ScopeDefinition;

import java.util.Map;
import java.util.Objects;

/**
 * Maps a scope's channel label ({@code app} / {@code net}) to a concrete
 * channel id. In test mode every message goes to the test channel.
 *
 * @since 1.0.0
 */
public class ChannelRouter {

    private final Map<String, String> channelsByLabel;
    private final boolean testMode;
    private final String testChannel;

    /**
     * @param channelsByLabel channel id per label; blank ids count as missing
     * @param testMode        route everything to {@code testChannel}
     * @param testChannel     test channel id, required in test mode
     */
    public ChannelRouter(Map<String, String> channelsByLabel, boolean testMode, String testChannel) {
        this.channelsByLabel = Map.copyOf(Objects.requireNonNull(channelsByLabel, "channelsByLabel must not be null"));
        this.testMode = testMode;
        this.testChannel = testChannel;
    }

    /**
     * Router that sends every label to the same channel.
     */
    public static ChannelRouter single(String channel) {
        return new ChannelRouter(Map.of(ScopeDefinition.CHANNEL_APP, channel, ScopeDefinition.CHANNEL_NET, channel),
                false, null);
    }

    /**
     * @throws ConfigurationException if no channel is configured for the
     *                                scope's label
     */
    public String resolve(ScopeDefinition scope) {
        if (testMode) {
            return require(testChannel, "test");
        }
        return require(channelsByLabel.get(scope.getChannel()), scope.getChannel());
    }

    /**
     * Fail-fast check used at orchestrator construction.
     *
     * @throws ConfigurationException if any scope is unroutable
     */
    public void verify(Iterable<ScopeDefinition> scopes) {
        for (ScopeDefinition scope : scopes) {
            resolve(scope);
        }
    }

    public boolean isTestMode() {
        return testMode;
    }

    private static String require(String channel, String label) {
        if (channel == null || channel.isBlank()) {
            throw new ConfigurationException("No channel configured for label '" + label + "'");
        }
        return channel;
    }
}
