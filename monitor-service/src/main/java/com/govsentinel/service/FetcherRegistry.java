package com.govsentinel.service;

import com.govsentinel.core.config.SourceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Lookup of {@link FetcherProvider}s by source name or policy family.
 *
 * @since 1.0.0
 */
public final class FetcherRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FetcherRegistry.class);

    private final Map<String, FetcherProvider> providers = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if two providers share a name
     */
    public FetcherRegistry(List<FetcherProvider> providers) {
        for (FetcherProvider provider : providers) {
            String key = provider.name().toLowerCase(Locale.ROOT);
            if (this.providers.putIfAbsent(key, provider) != null) {
                throw new IllegalArgumentException("Duplicate fetcher provider: '" + key + "'");
            }
        }
    }

    /**
     * Discover providers registered under {@code META-INF/services}.
     */
    public static FetcherRegistry fromServiceLoader() {
        List<FetcherProvider> found = new ArrayList<>();
        ServiceLoader.load(FetcherProvider.class).forEach(found::add);
        FetcherRegistry registry = new FetcherRegistry(found);
        LOG.info("Loaded fetcher providers: {}", registry.names());
        return registry;
    }

    public Optional<FetcherProvider> resolve(SourceDefinition source) {
        FetcherProvider byName = source.getName() != null
                ? providers.get(source.getName().toLowerCase(Locale.ROOT))
                : null;
        if (byName != null) {
            return Optional.of(byName);
        }
        return source.getFamily() != null
                ? Optional.ofNullable(providers.get(source.getFamily().toLowerCase(Locale.ROOT)))
                : Optional.empty();
    }

    public Set<String> names() {
        return Set.copyOf(providers.keySet());
    }
}
