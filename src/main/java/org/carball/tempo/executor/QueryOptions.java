package org.carball.tempo.executor;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-call caching options. A non-null {@code ttlMs} overrides the TTL heuristic.
 */
@Value
@Builder
public class QueryOptions {

    public static final QueryOptions DEFAULTS = QueryOptions.builder().build();

    Long ttlMs;

    @Builder.Default
    List<String> tags = List.of();

    public static QueryOptions tagged(String... tags) {
        return QueryOptions.builder().tags(List.of(tags)).build();
    }
}
