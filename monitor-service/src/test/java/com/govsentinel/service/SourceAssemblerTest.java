package com.govsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.PoliciesLoader;
import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.dispatch.Notifier;
import com.govsentinel.core.model.SendResult;
import com.govsentinel.core.orchestrator.OrchestratorState;
import com.govsentinel.core.policy.TransitionPolicyFactory;
import com.govsentinel.core.store.JsonMappers;
import com.govsentinel.service.snapshot.SnapshotFetcherProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SourceAssembler}.
 */
class SourceAssemblerTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = JsonMappers.create();
    private final TransitionPolicyFactory policies = PoliciesLoader.fromClasspath("policies.yml");
    private final FetcherRegistry fetchers = new FetcherRegistry(List.of(new SnapshotFetcherProvider()));
    private final Notifier notifier = n -> SendResult.delivered("T1");

    private ServiceConfig config() {
        return new ServiceConfig.Builder()
                .dataDir(dataDir)
                .slackBotToken("xoxb-test")
                .appChannel("C-APP")
                .build();
    }

    private static SourceDefinition source(String name, String family, String channel) {
        SourceDefinition definition = new SourceDefinition();
        definition.setName(name);
        definition.setFamily(family);
        definition.setScopes(List.of(new ScopeDefinition("aave.eth", "Aave", null, channel)));
        return definition;
    }

    @Test
    @DisplayName("Should assemble an idle orchestrator for a routable Snapshot source")
    void shouldAssembleSource() {
        SourceAssembler assembler = new SourceAssembler(config(), policies, fetchers, notifier, mapper);

        try (SourceRuntime runtime = assembler.assemble(source("snapshot", "snapshot", "app"))) {
            assertThat(runtime.getName()).isEqualTo("snapshot");
            assertThat(runtime.getOrchestrator().state()).isEqualTo(OrchestratorState.IDLE);
            assertThat(runtime.getRestartDelay()).hasSeconds(60);
        }
    }

    @Test
    @DisplayName("Should refuse to assemble without Slack credentials")
    void shouldRequireNotifier() {
        SourceAssembler assembler = new SourceAssembler(config(), policies, fetchers, null, mapper);

        assertThatThrownBy(() -> assembler.assemble(source("snapshot", "snapshot", "app")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("SLACK_BOT_TOKEN");
    }

    @Test
    @DisplayName("Should refuse a source whose family has no policy")
    void shouldRequireKnownFamily() {
        SourceAssembler assembler = new SourceAssembler(config(), policies, fetchers, notifier, mapper);

        assertThatThrownBy(() -> assembler.assemble(source("snapshot", "aragon", "app")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("aragon");
    }

    @Test
    @DisplayName("Should refuse a source with no fetcher")
    void shouldRequireFetcher() {
        SourceAssembler assembler = new SourceAssembler(config(), policies, fetchers, notifier, mapper);

        assertThatThrownBy(() -> assembler.assemble(source("tally", "tally", "app")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No fetcher");
    }

    @Test
    @DisplayName("Should refuse a source with a scope routed to an unconfigured channel")
    void shouldRequireRoutableScopes() {
        SourceAssembler assembler = new SourceAssembler(config(), policies, fetchers, notifier, mapper);

        assertThatThrownBy(() -> assembler.assemble(source("snapshot", "snapshot", "net")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("net");
    }
}
