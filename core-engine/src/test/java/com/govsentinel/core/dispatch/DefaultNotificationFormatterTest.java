package com.govsentinel.core.dispatch;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultNotificationFormatterTest {

    private final DefaultNotificationFormatter formatter = new DefaultNotificationFormatter();

    @Test
    @DisplayName("Should prefer the entity URL as action link")
    void shouldPreferEntityUrl() {
        ScopeDefinition scope = new ScopeDefinition("uniswap", "Uniswap", "https://www.tally.xyz/gov/uniswap", "app");
        WatchedEntity entity = WatchedEntity.builder().id("42").status("active")
                .title("Fee switch").url("https://example.org/p/42").build();

        Notification n = formatter.formatEntity(TransitionOutcome.NOTIFY_INITIAL, scope, entity);

        assertThat(n.getTitle()).isEqualTo("Uniswap Proposal Active");
        assertThat(n.getBody()).isEqualTo("Fee switch");
        assertThat(n.getActionLink()).contains("https://example.org/p/42");
        assertThat(n.getActionText()).contains("View Proposal");
    }

    @Test
    @DisplayName("Should build the action link from the scope base when the entity has no URL")
    void shouldBuildLinkFromScopeBase() {
        ScopeDefinition scope = new ScopeDefinition("aave.eth", "Aave", "https://snapshot.org/#/aave.eth/", "app");

        Notification n = formatter.formatEntity(TransitionOutcome.NOTIFY_TERMINAL, scope,
                WatchedEntity.of("0xabc", "closed"));

        assertThat(n.getActionLink()).contains("https://snapshot.org/#/aave.eth/proposal/0xabc");
        assertThat(n.getBody()).isEqualTo("0xabc");
    }

    @Test
    @DisplayName("Should omit the action link when neither URL nor base is known")
    void shouldOmitLinkWithoutBase() {
        Notification n = formatter.formatEntity(TransitionOutcome.NOTIFY_UPDATE, ScopeDefinition.of("mainnet"),
                WatchedEntity.of("amendment-1", "voting"));

        assertThat(n.getTitle()).isEqualTo("mainnet Proposal Update");
        assertThat(n.getActionLink()).isEmpty();
    }

    @Test
    @DisplayName("Should name the scope and source in admin alerts")
    void shouldFormatAdminAlert() {
        Notification n = formatter.formatAdmin(new ScopeDefinition("gone.eth", "Gone", null, "app"), "snapshot");

        assertThat(n.getKind()).isEqualTo(TransitionOutcome.NOTIFY_ADMIN);
        assertThat(n.getBody()).contains("snapshot").contains("gone.eth");
    }
}
