package org.carball.tempo.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One observed execution of a logical query. Never mutated after creation. The timestamp is
 * always supplied by the caller, normally from the optimizer's clock.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuerySample(
        String queryId,
        String rawQueryText,
        double executionTimeMs,
        Instant timestamp,
        Long resultCount,
        boolean cacheHit
) {

    public QuerySample {
        if (queryId == null || queryId.isBlank()) {
            throw new IllegalArgumentException("queryId must not be blank");
        }
        if (executionTimeMs < 0 || Double.isNaN(executionTimeMs)) {
            throw new IllegalArgumentException("executionTimeMs must be non-negative: " + executionTimeMs);
        }
        if (rawQueryText == null) {
            rawQueryText = queryId;
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    public static QuerySample miss(String queryId, String rawQueryText, double executionTimeMs,
                                   Instant timestamp, Long resultCount) {
        return new QuerySample(queryId, rawQueryText, executionTimeMs, timestamp, resultCount, false);
    }

    public static QuerySample hit(String queryId, String rawQueryText, double executionTimeMs, Instant timestamp) {
        return new QuerySample(queryId, rawQueryText, executionTimeMs, timestamp, null, true);
    }
}
