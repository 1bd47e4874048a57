package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import io.kneo.programmer.service.exceptions.AssetResolutionError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

public final class MovieSelector {
    /**
     * Anything shorter is treated as a trailer or broken metadata.
     */
    public static final int MIN_MOVIE_DURATION_SEC = 3600;

    private MovieSelector() {
    }

    public static String selectMovie(CompileContext ctx, MovieCriteria criteria, Random rng) {
        List<String> candidates = candidates(ctx, criteria);
        return candidates.get(rng.nextInt(candidates.size()));
    }

    /**
     * Same filters as {@link #selectMovie}, minus the ids in {@code used}. An empty result means
     * the used set has covered every candidate and the caller should reset it.
     */
    public static Optional<String> selectMovieNoRepeat(CompileContext ctx, MovieCriteria criteria, Random rng,
                                                       Set<String> used) {
        List<String> fresh = new ArrayList<>(candidates(ctx, criteria));
        fresh.removeAll(used);
        if (fresh.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fresh.get(rng.nextInt(fresh.size())));
    }

    private static List<String> candidates(CompileContext ctx, MovieCriteria criteria) {
        if (criteria.pools().isEmpty()) {
            throw new AssetResolutionError("movie_selector names no pool or collection");
        }
        Set<String> union = new LinkedHashSet<>();
        for (String pool : criteria.pools()) {
            union.addAll(ctx.getPools().resolvePool(pool));
        }
        List<String> filtered = new ArrayList<>();
        for (String id : union) {
            AssetMetadata meta;
            try {
                meta = ctx.lookup(id);
            } catch (AssetNotFoundException e) {
                throw new AssetResolutionError(String.format("Pool member '%s' is not in the catalog", id));
            }
            if (accepts(meta, criteria)) {
                filtered.add(id);
            }
        }
        if (filtered.isEmpty()) {
            throw new AssetResolutionError("No movie candidates left after filtering (" + criteria + ")");
        }
        filtered.sort(null);
        return filtered;
    }

    private static boolean accepts(AssetMetadata meta, MovieCriteria criteria) {
        if (!criteria.ratingInclude().isEmpty() && !criteria.ratingInclude().contains(meta.rating())) {
            return false;
        }
        if (meta.rating() != null && criteria.ratingExclude().contains(meta.rating())) {
            return false;
        }
        if (criteria.maxDurationSec() != null && meta.durationSec() > criteria.maxDurationSec()) {
            return false;
        }
        return meta.durationSec() >= MIN_MOVIE_DURATION_SEC;
    }
}
