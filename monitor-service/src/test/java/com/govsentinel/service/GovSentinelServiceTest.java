package com.govsentinel.service;

import com.govsentinel.core.config.MonitorsConfig;
import com.govsentinel.core.config.MonitorsLoader;
import com.govsentinel.core.config.SourceDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for source selection in {@link GovSentinelService}.
 */
class GovSentinelServiceTest {

    private final MonitorsConfig monitors = MonitorsLoader.fromClasspath("monitors.yml");

    @Test
    @DisplayName("Should run every enabled source when no names are given")
    void shouldSelectEnabledSources() {
        List<SourceDefinition> selected = GovSentinelService.selectSources(monitors, List.of());

        assertThat(selected).extracting(SourceDefinition::getName).containsExactly("snapshot");
    }

    @Test
    @DisplayName("Should run only the named sources")
    void shouldSelectNamedSources() {
        List<SourceDefinition> selected = GovSentinelService.selectSources(monitors, List.of("snapshot"));

        assertThat(selected).hasSize(1);
    }

    @Test
    @DisplayName("Should reject an unknown source name")
    void shouldRejectUnknownSource() {
        assertThatThrownBy(() -> GovSentinelService.selectSources(monitors, List.of("aragon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("aragon");
    }
}
