package io.kneo.programmer.model.schedule;

import java.util.LinkedHashMap;
import java.util.Map;

public record PoolDefinition(Map<String, Object> match, String order) {

    public static final String ORDER_SEQUENTIAL = "sequential";

    public PoolDefinition {
        match = match == null ? Map.of() : match;
        order = order == null ? ORDER_SEQUENTIAL : order;
    }

    public static PoolDefinition fromDsl(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return new PoolDefinition(Map.of(), null);
        }
        Map<String, Object> match = new LinkedHashMap<>();
        if (map.get("match") instanceof Map<?, ?> criteria) {
            criteria.forEach((key, value) -> match.put(String.valueOf(key), value));
        }
        Object order = map.get("order");
        return new PoolDefinition(match, order == null ? null : order.toString());
    }
}
