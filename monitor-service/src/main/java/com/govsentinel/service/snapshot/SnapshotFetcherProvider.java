package com.govsentinel.service.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.orchestrator.Fetcher;
import com.govsentinel.service.FetcherProvider;
import com.govsentinel.service.ServiceConfig;

public class SnapshotFetcherProvider implements FetcherProvider {

    @Override
    public String name() {
        return "snapshot";
    }

    @Override
    public Fetcher create(SourceDefinition source, ServiceConfig config, ObjectMapper mapper) {
        return SnapshotFetcher.builder()
                .mapper(mapper)
                .timeout(config.getHttpTimeout())
                .build();
    }
}
