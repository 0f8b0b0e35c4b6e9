package com.govsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityKeyTest {

    @Test
    @DisplayName("Should render as scope:id and parse back")
    void shouldRenderAndParse() {
        EntityKey key = EntityKey.of("aave.eth", "0xabc");

        assertThat(key.asString()).isEqualTo("aave.eth:0xabc");
        assertThat(EntityKey.parse("aave.eth:0xabc")).isEqualTo(key);
    }

    @Test
    @DisplayName("Should split on the first separator only")
    void shouldSplitOnFirstSeparator() {
        EntityKey key = EntityKey.parse("cosmoshub:proposal:42");

        assertThat(key.scope()).isEqualTo("cosmoshub");
        assertThat(key.entityId()).isEqualTo("proposal:42");
    }

    @Test
    @DisplayName("Should reject scopes containing the separator")
    void shouldRejectScopeWithSeparator() {
        assertThatThrownBy(() -> EntityKey.of("a:b", "1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject malformed stored keys")
    void shouldRejectMalformedKeys() {
        assertThatThrownBy(() -> EntityKey.parse("no-separator"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EntityKey.parse(":id"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EntityKey.parse("scope:"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
