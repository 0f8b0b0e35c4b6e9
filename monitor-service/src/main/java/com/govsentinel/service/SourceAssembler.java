package com.govsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.dispatch.AlertDispatcher;
import com.govsentinel.core.dispatch.ChannelRouter;
import com.govsentinel.core.dispatch.Notifier;
import com.govsentinel.core.orchestrator.Fetcher;
import com.govsentinel.core.orchestrator.SourceOrchestrator;
import com.govsentinel.core.orchestrator.SourceSettings;
import com.govsentinel.core.policy.TransitionPolicy;
import com.govsentinel.core.policy.TransitionPolicyFactory;
import com.govsentinel.core.ratelimit.TimeLimiter;
import com.govsentinel.core.store.AdminAlertRegistry;
import com.govsentinel.core.store.EntityStore;
import com.govsentinel.core.store.JsonFileEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires one {@link SourceOrchestrator} per configured source.
 *
 * <p>
 * Each source gets its own state file, admin-alert file, rate limiter and
 * time limiter. The notifier and channel router are shared.
 * </p>
 *
 * @since 1.0.0
 */
public class SourceAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(SourceAssembler.class);

    private final ServiceConfig config;
    private final TransitionPolicyFactory policies;
    private final FetcherRegistry fetchers;
    private final Notifier notifier;
    private final ObjectMapper mapper;

    /**
     * @param notifier shared notifier; {@code null} when credentials are
     *                 missing, which fails every source at assembly
     */
    public SourceAssembler(ServiceConfig config, TransitionPolicyFactory policies, FetcherRegistry fetchers,
            Notifier notifier, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.fetchers = Objects.requireNonNull(fetchers, "fetchers must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.notifier = notifier;
    }

    /**
     * @throws ConfigurationException if the source cannot run: no notifier,
     *                                unknown family, no fetcher, or an
     *                                unroutable scope
     */
    public SourceRuntime assemble(SourceDefinition definition) {
        String name = definition.getName();
        if (notifier == null) {
            throw new ConfigurationException("SLACK_BOT_TOKEN is not set; cannot start source '" + name + "'");
        }
        if (!policies.supports(definition.getFamily())) {
            throw new ConfigurationException(
                    "Source '" + name + "' uses unknown policy family '" + definition.getFamily() + "'");
        }
        FetcherProvider provider = fetchers.resolve(definition)
                .orElseThrow(() -> new ConfigurationException(
                        "No fetcher available for source '" + name + "' (family '" + definition.getFamily()
                                + "'); known: " + fetchers.names()));

        SourceSettings settings = SourceSettings.from(definition);
        TransitionPolicy policy = policies.forFamily(definition.getFamily());
        ChannelRouter router = config.channelRouter();
        router.verify(settings.getScopes());

        Fetcher fetcher = provider.create(definition, config, mapper);
        EntityStore store = new JsonFileEntityStore(config.stateFile(name), mapper);
        AdminAlertRegistry adminAlerts = new AdminAlertRegistry(config.adminAlertsFile(name), mapper);
        TimeLimiter timeLimiter = new TimeLimiter(name + "-io");

        AlertDispatcher dispatcher = AlertDispatcher.builder()
                .source(name)
                .store(store)
                .adminAlerts(adminAlerts)
                .notifier(notifier)
                .router(router)
                .timeLimiter(timeLimiter)
                .sendTimeout(settings.getSendTimeout())
                .build();

        SourceOrchestrator orchestrator = SourceOrchestrator.builder()
                .settings(settings)
                .fetcher(fetcher)
                .policy(policy)
                .store(store)
                .dispatcher(dispatcher)
                .timeLimiter(timeLimiter)
                .build();

        LOG.info("Assembled source '{}' (family={}, scopes={}, state={})",
                name, policy.getFamily(), settings.getScopes().size(), config.stateFile(name));
        return new SourceRuntime(orchestrator, timeLimiter, settings.getPollInterval());
    }
}
