package io.kneo.programmer.service.compiler;

import java.util.List;
import java.util.Random;

public final class EpisodeSelector {
    public static final String MODE_SEQUENTIAL = "sequential";
    public static final String MODE_RANDOM = "random";
    public static final String MODE_WEIGHTED = "weighted";

    private EpisodeSelector() {
    }

    /**
     * Picks one member of the pool. Sequential picks read the shared counter but do not advance
     * it; the caller advances once the episode is actually placed.
     */
    public static String select(CompileContext ctx, String poolId, String mode, Long seed) {
        List<String> ids = ctx.getPools().resolvePool(poolId);
        if (MODE_RANDOM.equals(mode) || MODE_WEIGHTED.equals(mode)) {
            Random rng = ctx.randomFor(seed);
            return ids.get(rng.nextInt(ids.size()));
        }
        return sequential(ctx, poolId, ids, seed);
    }

    static String sequential(CompileContext ctx, String poolId, List<String> ids, Long seed) {
        long offset = seed == null ? 0 : seed;
        int index = (int) Math.floorMod(offset + ctx.counter(poolId), (long) ids.size());
        return ids.get(index);
    }
}
