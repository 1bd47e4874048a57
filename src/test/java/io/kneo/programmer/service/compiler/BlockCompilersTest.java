package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.service.exceptions.AssetResolutionError;
import io.kneo.programmer.service.exceptions.CompileError;
import io.kneo.programmer.test.InMemoryAssetResolver;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockCompilersTest {
    private static final String HEADER = """
            channel: test-one
            broadcast_day: "2025-03-03"
            timezone: UTC
            """;

    private final ScheduleCompiler compiler = new ScheduleCompiler();

    private ScheduleOutput compile(String yaml, InMemoryAssetResolver resolver, Map<String, Integer> counters) {
        CompileOptions options = CompileOptions.defaults(17).toBuilder().sequentialCounters(counters).build();
        return compiler.compile(HEADER + yaml, resolver, options);
    }

    private static List<String> ids(ScheduleOutput out) {
        return out.programBlocks().stream().map(ProgramBlockOutput::assetId).toList();
    }

    @Test
    void testLongEpisodePreemptsFollowingSlots() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("d1", "Long One", 2820)
                .episode("d2", "Short Two", 1320)
                .episode("d3", "Short Three", 1320)
                .pool("drama", "d1", "d2", "d3");
        Map<String, Integer> counters = new HashMap<>();

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - episode_selector: { pool: drama }
                        - episode_selector: { pool: drama }
                        - episode_selector: { pool: drama }
                """, resolver, counters);

        List<ProgramBlockOutput> blocks = out.programBlocks();
        assertEquals(List.of("d1", "d2"), ids(out));
        assertEquals(3600, blocks.get(0).slotDurationSec());
        assertEquals(2820, blocks.get(0).episodeDurationSec());
        assertEquals(OffsetDateTime.parse("2025-03-03T07:00Z"), blocks.get(1).startAt());
        assertEquals(2, counters.get("drama"));
    }

    @Test
    void testSequentialWrapsWhenPoolIsShorterThanSlots() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("s1", "Only", 1320)
                .pool("solo", "s1");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - episode_selector: { pool: solo }
                        - episode_selector: { pool: solo }
                        - episode_selector: { pool: solo }
                """, resolver, null);

        assertEquals(List.of("s1", "s1", "s1"), ids(out));
    }

    @Test
    void testSelectorSeedOffsetsSequentialStart() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("a", "A", 1320)
                .episode("b", "B", 1320)
                .episode("c", "C", 1320)
                .pool("abc", "a", "b", "c");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - episode_selector: { pool: abc, mode: sequential, seed: 1 }
                        - episode_selector: { pool: abc, mode: sequential, seed: 1 }
                        - episode_selector: { pool: abc, mode: sequential, seed: 1 }
                """, resolver, null);

        assertEquals(List.of("b", "c", "a"), ids(out));
        assertEquals(Map.of("mode", "sequential", "seed", 1L), out.programBlocks().get(0).selector());
    }

    @Test
    void testDeclaredPoolOrderIsTheDefaultMode() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("e1", "E1", 1320)
                .episode("e2", "E2", 1320)
                .movie("m1", "M1", 6000, "PG");

        ScheduleOutput out = compile("""
                pools:
                  eps:
                    match: { type: episode }
                    order: random
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - episode_selector: { pool: eps }
                        - episode_selector: { pool: eps, mode: sequential }
                """, resolver, null);

        assertEquals("random", out.programBlocks().get(0).selector().get("mode"));
        assertEquals("sequential", out.programBlocks().get(1).selector().get("mode"));
        assertTrue(List.of("e1", "e2").containsAll(ids(out)));
    }

    @Test
    void testRandomSelectionRepeatsForTheSameSeed() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver();
        for (int i = 1; i <= 6; i++) {
            resolver.episode("r" + i, "R" + i, 1320);
        }
        resolver.pool("mixed", "r1", "r2", "r3", "r4", "r5", "r6");
        String yaml = """
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - episode_selector: { pool: mixed, mode: random, seed: 11 }
                        - episode_selector: { pool: mixed, mode: random, seed: 11 }
                        - episode_selector: { pool: mixed, mode: random }
                        - episode_selector: { pool: mixed, mode: random }
                """;

        assertEquals(ids(compile(yaml, resolver, null)), ids(compile(yaml, resolver, null)));
    }

    @Test
    void testMarathonBleedPushesNextBlock() {
        ScheduleOutput out = compile(marathon(true), marathonCatalog(), null);
        List<ProgramBlockOutput> blocks = out.programBlocks();

        assertEquals(3, blocks.size());
        assertEquals(OffsetDateTime.parse("2025-03-03T23:30Z"), blocks.get(1).endAt(), "second movie bleeds past 23:00");
        assertEquals("m-c", blocks.get(2).assetId());
        assertEquals(OffsetDateTime.parse("2025-03-03T23:30Z"), blocks.get(2).startAt(), "late movie moved to the bleed end");
        assertEquals(7200, blocks.get(2).slotDurationSec());
    }

    @Test
    void testMarathonWithoutBleedStopsBeforeEnd() {
        ScheduleOutput out = compile(marathon(false), marathonCatalog(), null);
        List<ProgramBlockOutput> blocks = out.programBlocks();

        assertEquals(2, blocks.size());
        assertEquals(OffsetDateTime.parse("2025-03-03T21:45Z"), blocks.get(0).endAt());
        assertEquals(OffsetDateTime.parse("2025-03-03T23:00Z"), blocks.get(1).startAt());
    }

    @Test
    void testMarathonReusesMoviesOnceAllWereShown() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .movie("m-a", "Movie A", 6000, "PG")
                .movie("m-b", "Movie B", 6300, "PG")
                .pool("marathon", "m-a", "m-b");

        ScheduleOutput out = compile("""
                template: premium_movie
                schedule:
                  all_day:
                    - movie_marathon:
                        start: "12:00"
                        end: "19:00"
                        movie_selector: { pool: marathon, seed: 5 }
                """, resolver, null);

        List<String> ids = ids(out);
        assertEquals(4, ids.size());
        assertTrue(ids.subList(0, 2).containsAll(List.of("m-a", "m-b")), "no repeat before the pool is used up");
    }

    @Test
    void testFullyEnclosedBlockIsRejected() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("long", "Long", 2820)
                .episode("short", "Short", 1320);

        CompileError error = assertThrows(CompileError.class, () -> compile("""
                schedule:
                  all_day:
                    - start: "06:00"
                      slots:
                        - program: long
                    - start: "06:30"
                      slots:
                        - program: short
                """, resolver, null));
        assertTrue(error.getMessage().contains("fully enclosed"), error.getMessage());
    }

    @Test
    void testShuffleRoundRobinsPools() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("a1", "A1", 1320)
                .episode("a2", "A2", 1320)
                .episode("b1", "B1", 1320)
                .pool("pa", "a1", "a2")
                .pool("pb", "b1");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - block:
                        start: "06:00"
                        duration: 7200
                        title: Morning Mix
                        mode: shuffle
                        pool: [pa, pb]
                """, resolver, null);

        assertEquals(List.of("a1", "b1", "a2", "b1"), ids(out));
        assertEquals("pb", out.programBlocks().get(1).collection());
    }

    @Test
    void testPoolBlockNeverRunsPastItsEnd() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("x1", "X1", 2820)
                .episode("x2", "X2", 2820)
                .pool("px", "x1", "x2");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - block:
                        start: "06:00"
                        duration: PT90M
                        pool: px
                """, resolver, null);

        assertEquals(List.of("x1"), ids(out));
    }

    @Test
    void testPoolBlockWithEqualEndFillsTheDay() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .episode("f1", "F1", 1320)
                .episode("f2", "F2", 1500)
                .pool("filler", "f1", "f2");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - block:
                        start: "06:00"
                        end: "06:00"
                        mode: random
                        seed: 3
                        pool:
                          - { name: filler, weight: 2 }
                """, resolver, null);

        List<ProgramBlockOutput> blocks = out.programBlocks();
        assertEquals(48, blocks.size());
        assertEquals(Duration.ofHours(24), Duration.between(blocks.get(0).startAt(), blocks.get(47).endAt()));
    }

    @Test
    void testMovieFiltersLeavingNothingFail() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .movie("short", "Short", 1800, "PG")
                .movie("adult", "Adult", 6000, "R")
                .pool("films", "short", "adult");

        AssetResolutionError error = assertThrows(AssetResolutionError.class, () -> compile("""
                schedule:
                  all_day:
                    - movie_block:
                        start: "20:00"
                        movie_selector:
                          pool: films
                          rating: { exclude: [R] }
                """, resolver, null));
        assertTrue(error.getMessage().contains("pools=[films]"), error.getMessage());
        assertTrue(error.getMessage().contains("rating.exclude=[R]"), error.getMessage());
    }

    @Test
    void testMovieRatingIncludeAndLegacyShape() {
        InMemoryAssetResolver resolver = new InMemoryAssetResolver()
                .movie("r1", "Rated R", 7000, "R")
                .movie("pg1", "Family", 7000, "PG")
                .pool("films", "r1", "pg1");

        ScheduleOutput out = compile("""
                schedule:
                  all_day:
                    - start: "20:00"
                      movie_selector:
                        pools: [films]
                        rating: { include: [PG] }
                        max_duration_sec: 7200
                """, resolver, null);

        assertEquals(List.of("pg1"), ids(out));
        assertEquals("Family", out.programBlocks().get(0).title());
    }

    private static InMemoryAssetResolver marathonCatalog() {
        return new InMemoryAssetResolver()
                .movie("m-a", "Movie A", 6000, "PG")
                .movie("m-b", "Movie B", 6300, "PG")
                .movie("m-c", "Late Movie", 7200, "R")
                .pool("marathon", "m-a", "m-b")
                .pool("late", "m-c");
    }

    private static String marathon(boolean allowBleed) {
        return """
                template: premium_movie
                schedule:
                  all_day:
                    - movie_marathon:
                        start: "20:00"
                        end: "23:00"
                        title: Monday Marathon
                        allow_bleed: %s
                        movie_selector: { pool: marathon, seed: 5 }
                    - movie_block:
                        start: "23:00"
                        movie_selector: { pool: late }
                """.formatted(allowBleed);
    }
}
