package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.ChannelTemplate;
import io.kneo.programmer.service.catalog.AssetResolver;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * State scoped to a single compile call: the seeded generator, the per-pool sequential counters
 * and the pool registry. Never shared between compiles.
 */
@Getter
public class CompileContext {
    private final String channelId;
    private final LocalDate broadcastDay;
    private final ZoneId zone;
    private final ChannelTemplate template;
    private final int dayStartHour;
    private final long seed;
    private final Random random;
    private final Map<String, Integer> sequentialCounters;
    private final PoolRegistry pools;
    private final AssetResolver resolver;
    @Getter(AccessLevel.NONE)
    private final Map<Long, Random> selectorRandoms = new HashMap<>();

    public CompileContext(String channelId, LocalDate broadcastDay, ZoneId zone, ChannelTemplate template,
                          int dayStartHour, long seed, Map<String, Integer> sequentialCounters,
                          PoolRegistry pools, AssetResolver resolver) {
        this.channelId = channelId;
        this.broadcastDay = broadcastDay;
        this.zone = zone;
        this.template = template;
        this.dayStartHour = dayStartHour;
        this.seed = seed;
        this.random = new Random(seed);
        this.sequentialCounters = sequentialCounters;
        this.pools = pools;
        this.resolver = resolver;
    }

    public int getGridSeconds() {
        return template.getGridSeconds();
    }

    public ZonedDateTime at(String clock) {
        return BroadcastTimes.resolve(clock, broadcastDay, zone, dayStartHour);
    }

    public AssetMetadata lookup(String assetId) {
        return resolver.lookup(assetId);
    }

    /**
     * A selector-level seed gets its own generator, shared by every selector carrying the same seed;
     * otherwise the compile-wide one is used.
     */
    public Random randomFor(Long selectorSeed) {
        if (selectorSeed == null) {
            return random;
        }
        return selectorRandoms.computeIfAbsent(selectorSeed, Random::new);
    }

    public int counter(String poolId) {
        return sequentialCounters.getOrDefault(poolId, 0);
    }

    public void advance(String poolId) {
        sequentialCounters.merge(poolId, 1, Integer::sum);
    }
}
