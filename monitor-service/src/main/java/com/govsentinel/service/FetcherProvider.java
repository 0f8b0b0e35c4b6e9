package com.govsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.orchestrator.Fetcher;

/**
 * Service provider for upstream clients.
 *
 * <p>
 * A provider is matched against a source's {@code name} first and its
 * policy {@code family} second, so a source named {@code snapshot-labs}
 * with family {@code snapshot} still finds the Snapshot client.
 * </p>
 *
 * <p>
 * Registration: list the implementation in
 * {@code META-INF/services/com.govsentinel.service.FetcherProvider}.
 * </p>
 *
 * @see java.util.ServiceLoader
 * @since 1.0.0
 */
public interface FetcherProvider {

    /**
     * @return source name or policy family this provider serves
     */
    String name();

    Fetcher create(SourceDefinition source, ServiceConfig config, ObjectMapper mapper);
}
