package com.govsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.MonitorsConfig;
import com.govsentinel.core.config.MonitorsLoader;
import com.govsentinel.core.config.PoliciesLoader;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.dispatch.Notifier;
import com.govsentinel.core.policy.TransitionPolicyFactory;
import com.govsentinel.core.store.JsonMappers;
import com.govsentinel.service.slack.SlackNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point for the governance monitor service.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   env → ServiceConfig
 *   monitors.yml + policies.yml → SourceDefinitions, TransitionPolicies
 *   per source: Fetcher + EntityStore + AlertDispatcher → SourceOrchestrator
 *   MonitorSupervisor runs each orchestrator on its own thread
 * </pre>
 *
 * <h3>Arguments</h3>
 * <p>
 * Optional source names restrict the run to those sources, e.g.
 * {@code java -jar monitor-service.jar snapshot}. With none, every enabled
 * source runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class GovSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(GovSentinelService.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private GovSentinelService() {
        // entry point, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting GovSentinel with config: {}", config);
        if (config.isTestMode()) {
            LOG.warn("Test mode: all messages go to the test channel, state under {}", config.stateDirectory());
        }

        // 2. Load sources and policies
        MonitorsConfig monitors = MonitorsLoader.load(config.getMonitorsConfigPath());
        TransitionPolicyFactory policies = PoliciesLoader.load();
        List<SourceDefinition> sources = selectSources(monitors, Arrays.asList(args));
        if (sources.isEmpty()) {
            throw new IllegalStateException(
                    "No enabled sources defined. Provide sources via "
                            + MonitorsLoader.ENV_MONITORS_PATH
                            + " or a classpath monitors.yml file.");
        }
        LOG.info("Loaded {} source(s) and policy families {}", sources.size(), policies.families());

        // 3. Assemble orchestrators
        ObjectMapper mapper = JsonMappers.create();
        MonitorSupervisor supervisor = new MonitorSupervisor();
        SourceAssembler assembler = new SourceAssembler(config, policies,
                FetcherRegistry.fromServiceLoader(), createNotifier(config, mapper), mapper);
        for (SourceDefinition source : sources) {
            try {
                supervisor.register(assembler.assemble(source));
            } catch (ConfigurationException | IllegalArgumentException e) {
                supervisor.registerFailure(source.getName(), e.getMessage());
            }
        }

        // 4. Start health server (for K8s probes) with shutdown hook
        HealthServer healthServer = new HealthServer(supervisor, mapper);
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            supervisor.stop();
            try {
                supervisor.await(SHUTDOWN_GRACE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            supervisor.close();
            healthServer.stop();
        }, "govsentinel-shutdown"));

        // 5. Run until every source finishes
        supervisor.start();
        while (!supervisor.await(Duration.ofHours(1))) {
            LOG.debug("Sources still running: {}", supervisor.statuses());
        }
        LOG.info("All sources finished: {}", supervisor.statuses());
        supervisor.close();
        healthServer.stop();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static List<SourceDefinition> selectSources(MonitorsConfig monitors, List<String> requested) {
        if (requested.isEmpty()) {
            return monitors.enabledSources();
        }
        List<SourceDefinition> selected = new ArrayList<>();
        for (String name : requested) {
            selected.add(monitors.source(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown source: '" + name + "'")));
        }
        return selected;
    }

    private static Notifier createNotifier(ServiceConfig config, ObjectMapper mapper) {
        if (!config.hasSlackCredentials()) {
            return null;
        }
        return SlackNotifier.builder()
                .botToken(config.getSlackBotToken())
                .disableLinkPreviews(config.isDisableLinkPreviews())
                .timeout(config.getHttpTimeout())
                .mapper(mapper)
                .build();
    }
}
