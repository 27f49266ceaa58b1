package org.carball.tempo.cache;

import java.time.Instant;
import java.util.Set;

/**
 * A cached query result. Valid iff {@code now - storedAt < ttlMs}.
 */
public record CacheEntry(
        String key,
        Object value,
        Instant storedAt,
        long ttlMs,
        Set<String> tags
) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public boolean isValidAt(Instant now) {
        return ageMs(now) < ttlMs;
    }

    public long remainingMs(Instant now) {
        return ttlMs - ageMs(now);
    }

    private long ageMs(Instant now) {
        return now.toEpochMilli() - storedAt.toEpochMilli();
    }
}
