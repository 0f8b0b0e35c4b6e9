package com.govsentinel.core.fakes;

import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.orchestrator.Fetcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory upstream: a current batch per scope, queued failures and
 * tracked-entity answers.
 */
public class ScriptedFetcher implements Fetcher {

    private final Map<String, List<WatchedEntity>> batches = new HashMap<>();
    private final Set<String> invalid = new HashSet<>();
    private final Map<String, Deque<RuntimeException>> failures = new HashMap<>();
    private final Map<String, WatchedEntity> tracked = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    public synchronized ScriptedFetcher batch(String scope, WatchedEntity... entities) {
        batches.put(scope, Arrays.asList(entities));
        invalid.remove(scope);
        return this;
    }

    public synchronized ScriptedFetcher invalid(String scope) {
        invalid.add(scope);
        return this;
    }

    public synchronized ScriptedFetcher failNext(String scope, RuntimeException e) {
        failures.computeIfAbsent(scope, k -> new ArrayDeque<>()).add(e);
        return this;
    }

    public synchronized ScriptedFetcher tracked(String scope, WatchedEntity entity) {
        tracked.put(scope + ":" + entity.getId(), entity);
        return this;
    }

    @Override
    public synchronized List<WatchedEntity> fetchBatch(String scope) {
        calls.add("batch:" + scope);
        Deque<RuntimeException> queued = failures.get(scope);
        if (queued != null && !queued.isEmpty()) {
            throw queued.poll();
        }
        if (invalid.contains(scope)) {
            return null;
        }
        return batches.getOrDefault(scope, List.of());
    }

    @Override
    public synchronized Optional<WatchedEntity> fetchTracked(String scope, String entityId) {
        calls.add("tracked:" + scope + ":" + entityId);
        return Optional.ofNullable(tracked.get(scope + ":" + entityId));
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }
}
