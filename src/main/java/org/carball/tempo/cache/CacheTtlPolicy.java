package org.carball.tempo.cache;

import org.carball.tempo.config.OptimizerConfig;

import java.util.Locale;

/**
 * Content-aware TTL heuristic. An explicit TTL from the caller always wins; otherwise the first
 * marker found in the queryId decides.
 */
public class CacheTtlPolicy {

    private final OptimizerConfig config;

    public CacheTtlPolicy(OptimizerConfig config) {
        this.config = config;
    }

    public long ttlFor(String queryId, Long explicitTtlMs) {
        if (explicitTtlMs != null) {
            return explicitTtlMs;
        }

        String id = queryId.toLowerCase(Locale.ROOT);
        if (id.contains("user")) return config.getUserTtlMs();
        if (id.contains("static")) return config.getStaticTtlMs();
        if (id.contains("api")) return config.getApiTtlMs();
        if (id.contains("content")) return config.getContentTtlMs();
        if (id.contains("subscription")) return config.getSubscriptionTtlMs();
        return config.getDefaultTtlMs();
    }

    public long ttlFor(String queryId) {
        return ttlFor(queryId, null);
    }
}
