package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

public class MovieBlockCompiler implements BlockCompiler {

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.MOVIE_BLOCK;
    }

    @Override
    public List<ProgramBlockOutput> compile(Map<String, Object> fragment, CompileContext ctx) {
        ZonedDateTime start = ctx.at(BlockKind.start(fragment));
        MovieCriteria criteria = MovieCriteria.fromSelector(selectorOf(fragment));
        String movieId = MovieSelector.selectMovie(ctx, criteria, ctx.randomFor(criteria.seed()));
        AssetMetadata meta = ctx.lookup(movieId);
        int slot = BroadcastTimes.gridCeil(meta.durationSec(), ctx.getGridSeconds());
        String title = meta.title() != null ? meta.title() : movieId;
        return List.of(block(title, movieId, start, slot, meta.durationSec(), criteria.firstPool(), criteria.provenance()));
    }

    /**
     * Accepts {@code movie_block.movie_selector}, and the older shape where
     * {@code movie_selector} sits next to {@code start}.
     */
    static Map<String, Object> selectorOf(Map<String, Object> fragment) {
        Map<String, Object> selector = DslValues.map(BlockKind.body(fragment), BlockKind.MOVIE_SELECTOR_KEY);
        if (selector.isEmpty()) {
            selector = DslValues.map(DslValues.map(fragment, BlockKind.MOVIE_BLOCK_KEY), BlockKind.MOVIE_SELECTOR_KEY);
        }
        if (selector.isEmpty()) {
            selector = DslValues.map(fragment, BlockKind.MOVIE_SELECTOR_KEY);
        }
        return selector;
    }
}
