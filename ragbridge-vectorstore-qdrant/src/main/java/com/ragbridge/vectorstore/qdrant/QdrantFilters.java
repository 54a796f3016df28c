package com.ragbridge.vectorstore.qdrant;

import com.ragbridge.host.MetadataFilters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates the {@link MetadataFilters} grammar into a Qdrant filter object
 * ({@code {"must": [...], "must_not": [...]}}).
 */
final class QdrantFilters {

    private QdrantFilters() {
    }

    /**
     * @return the Qdrant filter, or null when {@code filters} is null or empty (match everything)
     * @throws IllegalArgumentException for an invalid filter
     */
    static Map<String, Object> toQdrant(Map<String, Object> filters) {
        MetadataFilters.validate(filters);
        if (filters == null || filters.isEmpty()) return null;
        List<Object> must = new ArrayList<>();
        List<Object> mustNot = new ArrayList<>();
        for (Map.Entry<String, Object> e : filters.entrySet()) {
            String key = e.getKey();
            Object condition = e.getValue();
            if (condition instanceof Map) {
                Map<String, Object> range = new LinkedHashMap<>();
                for (Map.Entry<?, ?> op : ((Map<?, ?>) condition).entrySet()) {
                    String name = String.valueOf(op.getKey());
                    switch (name) {
                        case MetadataFilters.EQ:
                            must.add(match(key, "value", op.getValue()));
                            break;
                        case MetadataFilters.NE:
                            mustNot.add(match(key, "value", op.getValue()));
                            break;
                        case MetadataFilters.IN:
                            must.add(match(key, "any", new ArrayList<>((Collection<?>) op.getValue())));
                            break;
                        default:
                            range.put(name.substring(1), op.getValue());
                    }
                }
                if (!range.isEmpty()) {
                    Map<String, Object> c = new LinkedHashMap<>();
                    c.put("key", key);
                    c.put("range", range);
                    must.add(c);
                }
            } else if (condition instanceof Collection) {
                must.add(match(key, "any", new ArrayList<>((Collection<?>) condition)));
            } else {
                must.add(match(key, "value", condition));
            }
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        if (!must.isEmpty()) filter.put("must", must);
        if (!mustNot.isEmpty()) filter.put("must_not", mustNot);
        return filter;
    }

    private static Map<String, Object> match(String key, String kind, Object value) {
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("key", key);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(kind, value);
        c.put("match", m);
        return c;
    }
}
