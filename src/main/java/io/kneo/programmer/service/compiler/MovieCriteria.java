package io.kneo.programmer.service.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed {@code movie_selector}.
 */
public record MovieCriteria(List<String> pools,
                            List<String> ratingInclude,
                            List<String> ratingExclude,
                            Integer maxDurationSec,
                            Long seed) {

    public MovieCriteria {
        pools = List.copyOf(pools);
        ratingInclude = List.copyOf(ratingInclude);
        ratingExclude = List.copyOf(ratingExclude);
    }

    public static MovieCriteria fromSelector(Map<String, Object> selector) {
        List<String> pools = new ArrayList<>();
        String single = DslValues.string(selector, "pool");
        if (single != null) {
            pools.add(single);
        }
        pools.addAll(DslValues.strings(selector.get("pools")));
        pools.addAll(DslValues.strings(selector.get("collections")));
        Map<String, Object> rating = DslValues.map(selector, "rating");
        return new MovieCriteria(pools,
                DslValues.strings(rating.get("include")),
                DslValues.strings(rating.get("exclude")),
                DslValues.integer(selector, "max_duration_sec"),
                DslValues.longValue(selector, "seed"));
    }

    public String firstPool() {
        return pools.isEmpty() ? null : pools.get(0);
    }

    public Map<String, Object> provenance() {
        Map<String, Object> selector = new LinkedHashMap<>();
        selector.put("pools", pools);
        if (!ratingInclude.isEmpty() || !ratingExclude.isEmpty()) {
            Map<String, Object> rating = new LinkedHashMap<>();
            rating.put("include", ratingInclude);
            rating.put("exclude", ratingExclude);
            selector.put("rating", rating);
        }
        if (seed != null) {
            selector.put("seed", seed);
        }
        return selector;
    }

    @Override
    public String toString() {
        return String.format("pools=%s, rating.include=%s, rating.exclude=%s, max_duration_sec=%s",
                pools, ratingInclude, ratingExclude, maxDurationSec);
    }
}
