package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.service.exceptions.CompileError;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generic time-ranged block filled from one or more pools. Items that would run past the end
 * are not placed.
 */
public class PoolBlockCompiler implements BlockCompiler {
    public static final String MODE_SEQUENTIAL = "sequential";
    public static final String MODE_SHUFFLE = "shuffle";
    public static final String MODE_RANDOM = "random";
    private static final long FULL_DAY_SEC = 24 * 3600;

    record WeightedPool(String name, double weight) {
    }

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.POOL_BLOCK;
    }

    @Override
    public List<ProgramBlockOutput> compile(Map<String, Object> fragment, CompileContext ctx) {
        Map<String, Object> body = BlockKind.body(fragment);
        ZonedDateTime start = ctx.at(DslValues.string(body, "start"));
        ZonedDateTime end = end(body, start, ctx);
        String mode = DslValues.string(body, "mode", MODE_SEQUENTIAL);
        String blockTitle = DslValues.string(body, "title");
        List<WeightedPool> pools = pools(body);
        if (pools.isEmpty()) {
            throw new CompileError("block at " + body.get("start") + " names no pool");
        }
        Random rng = ctx.randomFor(DslValues.longValue(body, "seed"));

        List<ProgramBlockOutput> out = new ArrayList<>();
        ZonedDateTime cursor = start;
        int turn = 0;
        while (cursor.isBefore(end)) {
            String poolName;
            String assetId;
            boolean sequential = !MODE_RANDOM.equals(mode);
            if (MODE_RANDOM.equals(mode)) {
                poolName = weightedPick(pools, rng);
                List<String> ids = ctx.getPools().resolvePool(poolName);
                assetId = ids.get(rng.nextInt(ids.size()));
            } else {
                poolName = MODE_SHUFFLE.equals(mode) ? pools.get(turn % pools.size()).name() : pools.get(0).name();
                turn++;
                assetId = EpisodeSelector.sequential(ctx, poolName, ctx.getPools().resolvePool(poolName), null);
            }
            AssetMetadata meta = ctx.lookup(assetId);
            int slot = BroadcastTimes.gridCeil(meta.durationSec(), ctx.getGridSeconds());
            ZonedDateTime next = cursor.plusSeconds(slot);
            if (next.isAfter(end)) {
                break;
            }
            Map<String, Object> selector = new LinkedHashMap<>();
            selector.put("mode", mode);
            if (blockTitle != null) {
                selector.put("block", blockTitle);
            }
            String title = meta.title() != null ? meta.title() : assetId;
            out.add(block(title, assetId, cursor, slot, meta.durationSec(), poolName, selector));
            if (sequential) {
                ctx.advance(poolName);
            }
            cursor = next;
        }
        return out;
    }

    static ZonedDateTime end(Map<String, Object> body, ZonedDateTime start, CompileContext ctx) {
        String endClock = DslValues.string(body, "end");
        if (endClock != null) {
            ZonedDateTime end = ctx.at(endClock);
            if (end.isEqual(start)) {
                return start.plusSeconds(FULL_DAY_SEC);
            }
            return end.isBefore(start) ? end.plusDays(1) : end;
        }
        Object duration = body.get("duration");
        if (duration == null) {
            return start.plusSeconds(FULL_DAY_SEC);
        }
        long seconds = durationSeconds(duration);
        return start.plusSeconds(seconds <= 0 ? FULL_DAY_SEC : seconds);
    }

    /**
     * Seconds, an ISO-8601 duration such as {@code PT2H}, or {@code HH:MM}.
     */
    static long durationSeconds(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = value.toString().trim();
        if (BroadcastTimes.isClock(text)) {
            return BroadcastTimes.parseClock(text).toSecondOfDay();
        }
        try {
            if (text.startsWith("P") || text.startsWith("p")) {
                return Duration.parse(text).getSeconds();
            }
            return Long.parseLong(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new CompileError("Unreadable block duration '" + text + "'", e);
        }
    }

    static List<WeightedPool> pools(Map<String, Object> body) {
        List<Object> raw = new ArrayList<>();
        Object pool = body.get("pool");
        if (pool instanceof List<?> items) {
            raw.addAll(items);
        } else if (pool != null) {
            raw.add(pool);
        }
        raw.addAll(DslValues.list(body.get("pools")));

        List<WeightedPool> pools = new ArrayList<>();
        for (Object item : raw) {
            if (item instanceof Map<?, ?>) {
                Map<String, Object> entry = DslValues.map(item);
                pools.add(new WeightedPool(DslValues.string(entry, "name"), DslValues.decimal(entry, "weight", 1.0)));
            } else {
                pools.add(new WeightedPool(item.toString(), 1.0));
            }
        }
        return pools;
    }

    private static String weightedPick(List<WeightedPool> pools, Random rng) {
        double total = pools.stream().mapToDouble(p -> Math.max(0, p.weight())).sum();
        if (total <= 0) {
            return pools.get(rng.nextInt(pools.size())).name();
        }
        double roll = rng.nextDouble() * total;
        for (WeightedPool pool : pools) {
            roll -= Math.max(0, pool.weight());
            if (roll < 0) {
                return pool.name();
            }
        }
        return pools.get(pools.size() - 1).name();
    }
}
