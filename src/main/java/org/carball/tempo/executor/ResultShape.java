package org.carball.tempo.executor;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Size inspection for opaque query results.
 */
public final class ResultShape {

    private ResultShape() {
        // Utility class - prevent instantiation
    }

    /**
     * Element count of collections, maps and arrays; 1 for any other value, 0 for null.
     */
    public static long sizeOf(Object result) {
        if (result == null) {
            return 0;
        }
        if (result instanceof Collection<?> collection) {
            return collection.size();
        }
        if (result instanceof Map<?, ?> map) {
            return map.size();
        }
        if (result.getClass().isArray()) {
            return Array.getLength(result);
        }
        return 1;
    }

    /**
     * Read-only copy of list, set and map results, preserving iteration order and null elements.
     * Any other value is returned as is.
     */
    public static Object readOnlyCopy(Object result) {
        if (result instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (result instanceof Set<?> set) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(set));
        }
        if (result instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        return result;
    }
}
