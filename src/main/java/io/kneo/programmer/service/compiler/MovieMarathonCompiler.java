package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.service.exceptions.CompileError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Back-to-back movies over {@code [start, end)} without repeats until the candidate set is used
 * up. With {@code allow_bleed} exactly one movie may run past {@code end}; compaction moves
 * whatever follows.
 */
public class MovieMarathonCompiler implements BlockCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(MovieMarathonCompiler.class);

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.MOVIE_MARATHON;
    }

    @Override
    public List<ProgramBlockOutput> compile(Map<String, Object> fragment, CompileContext ctx) {
        Map<String, Object> body = BlockKind.body(fragment);
        ZonedDateTime start = ctx.at(DslValues.string(body, "start"));
        String endClock = DslValues.string(body, "end");
        if (endClock == null) {
            throw new CompileError("movie_marathon at " + body.get("start") + " has no end");
        }
        ZonedDateTime end = ctx.at(endClock);
        if (!end.isAfter(start)) {
            end = end.plusDays(1);
        }
        boolean allowBleed = DslValues.bool(body, "allow_bleed");
        String marathonTitle = DslValues.string(body, "title");
        MovieCriteria criteria = MovieCriteria.fromSelector(DslValues.map(body, BlockKind.MOVIE_SELECTOR_KEY));
        Random rng = ctx.randomFor(criteria.seed());
        Map<String, Object> provenance = new LinkedHashMap<>(criteria.provenance());
        if (marathonTitle != null) {
            provenance.put("marathon", marathonTitle);
        }

        List<ProgramBlockOutput> out = new ArrayList<>();
        Set<String> used = new HashSet<>();
        ZonedDateTime cursor = start;
        while (cursor.isBefore(end)) {
            Optional<String> pick = MovieSelector.selectMovieNoRepeat(ctx, criteria, rng, used);
            if (pick.isEmpty()) {
                LOGGER.debug("Marathon '{}' exhausted {} movies, starting another pass", marathonTitle, used.size());
                used.clear();
                pick = MovieSelector.selectMovieNoRepeat(ctx, criteria, rng, used);
            }
            String movieId = pick.orElseThrow();
            AssetMetadata meta = ctx.lookup(movieId);
            int slot = BroadcastTimes.gridCeil(meta.durationSec(), ctx.getGridSeconds());
            ZonedDateTime next = cursor.plusSeconds(slot);
            boolean crossesEnd = next.isAfter(end);
            if (crossesEnd && !allowBleed) {
                break;
            }
            String title = meta.title() != null ? meta.title() : movieId;
            out.add(block(title, movieId, cursor, slot, meta.durationSec(), criteria.firstPool(), provenance));
            used.add(movieId);
            if (crossesEnd) {
                break;
            }
            cursor = next;
        }
        return out;
    }
}
