package io.kneo.programmer.service.compiler;

import java.util.Map;

public enum BlockKind {
    EPISODE_BLOCK,
    MOVIE_BLOCK,
    MOVIE_MARATHON,
    POOL_BLOCK;

    public static final String MOVIE_BLOCK_KEY = "movie_block";
    public static final String MOVIE_SELECTOR_KEY = "movie_selector";
    public static final String MOVIE_MARATHON_KEY = "movie_marathon";
    public static final String POOL_BLOCK_KEY = "block";
    public static final String SLOTS_KEY = "slots";

    public static BlockKind of(Map<String, Object> fragment) {
        if (fragment.containsKey(MOVIE_MARATHON_KEY)) {
            return MOVIE_MARATHON;
        }
        if (fragment.containsKey(MOVIE_BLOCK_KEY) || fragment.containsKey(MOVIE_SELECTOR_KEY)) {
            return MOVIE_BLOCK;
        }
        if (fragment.containsKey(POOL_BLOCK_KEY)) {
            return POOL_BLOCK;
        }
        if (fragment.containsKey(SLOTS_KEY)) {
            return EPISODE_BLOCK;
        }
        return null;
    }

    /**
     * The node that carries {@code start} and the block's own settings.
     */
    public static Map<String, Object> body(Map<String, Object> fragment) {
        BlockKind kind = of(fragment);
        if (kind == MOVIE_MARATHON) {
            return DslValues.map(fragment, MOVIE_MARATHON_KEY);
        }
        if (kind == POOL_BLOCK) {
            return DslValues.map(fragment, POOL_BLOCK_KEY);
        }
        if (kind == MOVIE_BLOCK && fragment.get(MOVIE_BLOCK_KEY) instanceof Map) {
            Map<String, Object> inner = DslValues.map(fragment, MOVIE_BLOCK_KEY);
            return inner.containsKey("start") ? inner : fragment;
        }
        return fragment;
    }

    public static String start(Map<String, Object> fragment) {
        return DslValues.string(body(fragment), "start");
    }
}
