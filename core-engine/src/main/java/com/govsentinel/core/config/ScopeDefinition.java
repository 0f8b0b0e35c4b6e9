package com.govsentinel.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One watched sub-source: a Snapshot space, a Tally organisation, a Cosmos
 * chain, an XRPL network.
 *
 * <p>
 * Populated by SnakeYAML from {@code monitors.yml}; call {@link #validate()}
 * after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ScopeDefinition {

    public static final String CHANNEL_APP = "app";
    public static final String CHANNEL_NET = "net";

    private String id;
    private String displayName;
    private String actionLinkBase;
    private String channel = CHANNEL_APP;

    public ScopeDefinition() {
    }

    public ScopeDefinition(String id, String displayName, String actionLinkBase, String channel) {
        this.id = id;
        this.displayName = displayName;
        this.actionLinkBase = actionLinkBase;
        setChannel(channel);
    }

    /**
     * Shorthand for an app-channel scope displayed under its own id.
     */
    public static ScopeDefinition of(String id) {
        return new ScopeDefinition(id, id, null, CHANNEL_APP);
    }

    /**
     * @throws IllegalStateException if the id is blank, contains {@code ':'}
     *                               or the channel label is unknown
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("Scope 'id' is required");
        } else if (id.indexOf(':') >= 0) {
            errors.add("Scope id '" + id + "' must not contain ':'");
        }
        if (!CHANNEL_APP.equals(channel) && !CHANNEL_NET.equals(channel)) {
            errors.add("Scope '" + id + "' channel must be 'app' or 'net', was '" + channel + "'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid ScopeDefinition: " + String.join("; ", errors));
        }
    }

    /**
     * @return display name, falling back to the id
     */
    public String displayNameOrId() {
        return displayName != null && !displayName.isBlank() ? displayName : id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getActionLinkBase() {
        return actionLinkBase;
    }

    public void setActionLinkBase(String actionLinkBase) {
        this.actionLinkBase = actionLinkBase;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel != null ? channel.trim().toLowerCase(Locale.ROOT) : CHANNEL_APP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScopeDefinition that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(actionLinkBase, that.actionLinkBase)
                && Objects.equals(channel, that.channel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, actionLinkBase, channel);
    }

    @Override
    public String toString() {
        return "ScopeDefinition{id='" + id + "', displayName='" + displayName
                + "', channel='" + channel + "'}";
    }
}
