package io.kneo.programmer.service.catalog;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.catalog.AvailabilityWindow;
import io.kneo.programmer.model.catalog.CatalogAsset;
import io.kneo.programmer.model.catalog.CatalogSnapshot;
import io.kneo.programmer.model.catalog.ChapterMarker;
import io.kneo.programmer.model.catalog.CollectionRecord;
import io.kneo.programmer.model.catalog.ProbeData;
import io.kneo.programmer.model.schedule.PoolDefinition;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import io.kneo.programmer.service.exceptions.AssetResolutionError;
import io.kneo.programmer.util.SlugUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * AssetResolver over one catalog snapshot. Everything is indexed eagerly at construction;
 * afterwards {@link #lookup} and {@link #query} only read. {@link #updateLoudness} is the single
 * write path and holds {@link #writeLock} for its O(1) swap.
 */
public class CatalogAssetResolver implements AssetResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogAssetResolver.class);
    private static final String PLEX_SCHEME = "plex://";

    private static final Comparator<CatalogEntry> DEFAULT_ORDER = Comparator
            .comparing((CatalogEntry e) -> e.getSeriesTitle().toLowerCase(Locale.ROOT))
            .thenComparingInt(e -> e.getSeason() == null ? 0 : e.getSeason())
            .thenComparingInt(e -> e.getEpisode() == null ? 0 : e.getEpisode())
            .thenComparing(CatalogEntry::getCanonicalId);

    private final Map<String, AssetMetadata> assets = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final List<CatalogEntry> catalog;
    private final Map<String, CatalogEntry> entryById = new HashMap<>();
    private final Map<String, PoolDefinition> pools = new ConcurrentHashMap<>();
    private final Set<String> measured = ConcurrentHashMap.newKeySet();
    private final Object writeLock = new Object();

    public CatalogAssetResolver(CatalogSnapshot snapshot) {
        this.catalog = List.copyOf(load(snapshot));
        LOGGER.info("CatalogAssetResolver loaded: {} assets, {} aliases, {} catalog entries",
                assets.size(), aliases.size(), catalog.size());
    }

    private List<CatalogEntry> load(CatalogSnapshot snapshot) {
        Map<String, List<Double>> markers = new HashMap<>();
        snapshot.getMarkers().stream()
                .filter(m -> ChapterMarker.KIND_CHAPTER.equals(m.getKind()))
                .sorted(Comparator.comparingLong(ChapterMarker::getStartMs))
                .forEach(m -> markers.computeIfAbsent(m.getAssetUuid(), k -> new ArrayList<>())
                        .add(m.getStartMs() / 1000.0));

        Map<String, CollectionRecord> collections = new HashMap<>();
        for (CollectionRecord collection : snapshot.getCollections()) {
            collections.put(collection.getUuid(), collection);
        }

        List<CatalogEntry> entries = new ArrayList<>();
        for (CatalogAsset asset : snapshot.getAssets()) {
            if (!asset.isReady()) {
                continue;
            }
            String id = asset.getUuid();
            Map<String, Object> editorial = snapshot.getEditorials().getOrDefault(id, Map.of());
            ProbeData probe = snapshot.getProbes().get(id);

            int durationSec = (int) Math.round((asset.getDurationMs() == null ? 0 : asset.getDurationMs()) / 1000.0);
            String seriesTitle = stringValue(editorial.get("series_title"));
            Integer season = intValue(editorial.get("season_number"));
            Integer episode = intValue(editorial.get("episode_number"));
            String rating = stringValue(editorial.get("content_rating"));
            String title = stringValue(editorial.get("title"));
            String description = stringValue(editorial.get("description"));
            String type = detectType(editorial, seriesTitle);

            Double gain = probe == null ? null : probe.getLoudnessGainDb();
            if (gain != null) {
                measured.add(id);
            }

            AssetMetadata meta = AssetMetadata.builder()
                    .type(type)
                    .durationSec(durationSec)
                    .title(title != null ? title : seriesTitle)
                    .rating(rating)
                    .availability(availability(editorial))
                    .fileUri(resolveFileUri(asset))
                    .chapterMarkersSec(markers.get(id))
                    .description(description)
                    .loudnessGainDb(gain == null ? 0.0 : gain)
                    .build();
            assets.put(id, meta);

            if (asset.getUri() != null) {
                aliases.put(asset.getUri(), id);
            }
            if (seriesTitle != null && !seriesTitle.isBlank() && season != null && episode != null) {
                aliases.put(SlugUtil.episodeAlias(seriesTitle, season, episode), id);
            }

            CollectionRecord collection = collections.get(asset.getCollectionUuid());
            CatalogEntry entry = CatalogEntry.builder()
                    .canonicalId(id)
                    .assetType(type)
                    .durationSec(durationSec)
                    .seriesTitle(seriesTitle)
                    .season(season)
                    .episode(episode)
                    .rating(rating)
                    .sourceName(collection == null ? null : collection.getSourceName())
                    .collectionName(collection == null ? null : collection.getName())
                    .genres(stringList(editorial.get("genres")))
                    .year(intValue(editorial.get("year")))
                    .title(title)
                    .description(description)
                    .meta(meta)
                    .build();
            entries.add(entry);
            entryById.put(id, entry);
        }
        return entries;
    }

    public void registerPools(Map<String, PoolDefinition> definitions) {
        pools.putAll(definitions);
        LOGGER.info("Registered {} pools", definitions.size());
    }

    @Override
    public AssetMetadata lookup(String id) {
        AssetMetadata direct = assets.get(id);
        if (direct != null) {
            return direct;
        }
        String canonical = aliases.get(id);
        if (canonical != null) {
            AssetMetadata aliased = assets.get(canonical);
            if (aliased != null) {
                return aliased;
            }
        }
        PoolDefinition pool = pools.get(id);
        if (pool != null) {
            return AssetMetadata.pool(query(pool.match()));
        }
        throw new AssetNotFoundException(id);
    }

    @Override
    public List<String> query(Map<String, Object> match) {
        List<Predicate<CatalogEntry>> filters = new ArrayList<>();

        Object type = match.get("type");
        if (type != null) {
            List<String> types = stringList(type);
            filters.add(e -> types.contains(e.getAssetType()));
        }

        Object seriesTitle = match.get("series_title");
        if (seriesTitle != null) {
            Set<String> titles = lowerCaseSet(seriesTitle);
            filters.add(e -> titles.contains(e.getSeriesTitle().toLowerCase(Locale.ROOT)));
        }

        Set<Integer> seasons = RangeExpander.expand(match.get("season"));
        if (seasons != null) {
            filters.add(e -> e.getSeason() != null && seasons.contains(e.getSeason()));
        }

        Set<Integer> episodes = RangeExpander.expand(match.get("episode"));
        if (episodes != null) {
            filters.add(e -> e.getEpisode() != null && episodes.contains(e.getEpisode()));
        }

        Integer maxDuration = intValue(match.get("max_duration_sec"));
        if (maxDuration != null) {
            filters.add(e -> e.getDurationSec() <= maxDuration);
        }

        Integer minDuration = intValue(match.get("min_duration_sec"));
        if (minDuration != null) {
            filters.add(e -> e.getDurationSec() >= minDuration);
        }

        if (match.get("rating") instanceof Map<?, ?> rating) {
            List<String> include = stringList(rating.get("include"));
            List<String> exclude = stringList(rating.get("exclude"));
            if (!include.isEmpty()) {
                filters.add(e -> include.contains(e.getRating()));
            }
            if (!exclude.isEmpty()) {
                filters.add(e -> !exclude.contains(e.getRating()));
            }
        }

        Object genre = match.get("genre");
        if (genre != null) {
            Set<String> wanted = lowerCaseSet(genre);
            filters.add(e -> e.getGenres().stream().anyMatch(g -> wanted.contains(g.toLowerCase(Locale.ROOT))));
        }

        Set<Integer> years = RangeExpander.expand(match.get("year"));
        if (years != null) {
            filters.add(e -> e.getYear() != null && years.contains(e.getYear()));
        }

        Object source = match.get("source");
        if (source != null) {
            Set<String> sources = lowerCaseSet(source);
            filters.add(e -> sources.contains(e.getSourceName().toLowerCase(Locale.ROOT)));
        }

        Object collection = match.get("collection");
        if (collection != null) {
            Set<String> collections = lowerCaseSet(collection);
            filters.add(e -> collections.contains(e.getCollectionName().toLowerCase(Locale.ROOT)));
        }

        Predicate<CatalogEntry> combined = filters.stream().reduce(e -> true, Predicate::and);
        return catalog.stream()
                .filter(combined)
                .sorted(DEFAULT_ORDER)
                .map(CatalogEntry::getCanonicalId)
                .collect(Collectors.toList());
    }

    /**
     * @throws AssetNotFoundException when the pool was never registered
     * @throws AssetResolutionError   when the pool matches nothing
     */
    public List<String> resolvePool(String poolName) {
        PoolDefinition pool = pools.get(poolName);
        if (pool == null) {
            throw new AssetNotFoundException(poolName);
        }
        List<String> ids = query(pool.match());
        if (ids.isEmpty()) {
            throw new AssetResolutionError(String.format("Pool '%s' matched 0 assets (match: %s)", poolName, pool.match()));
        }
        return ids;
    }

    public List<String> listPools() {
        return List.copyOf(pools.keySet());
    }

    public void updateLoudness(String id, double gainDb) {
        synchronized (writeLock) {
            String canonical = canonicalId(id);
            AssetMetadata current = assets.get(canonical);
            AssetMetadata updated = current.withLoudnessGainDb(gainDb);
            assets.put(canonical, updated);
            CatalogEntry entry = entryById.get(canonical);
            if (entry != null) {
                entry.replaceMeta(updated);
            }
            measured.add(canonical);
        }
        LOGGER.debug("Loudness gain for {} set to {} dB", id, gainDb);
    }

    public boolean needsLoudnessMeasurement(String id) {
        String canonical = assets.containsKey(id) ? id : aliases.get(id);
        return canonical != null && assets.containsKey(canonical) && !measured.contains(canonical);
    }

    public Map<String, Integer> stats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("assets", assets.size());
        stats.put("aliases", aliases.size());
        stats.put("catalog_entries", catalog.size());
        stats.put("pools", pools.size());
        return stats;
    }

    CatalogEntry entryFor(String id) {
        return entryById.get(canonicalId(id));
    }

    private String canonicalId(String id) {
        if (assets.containsKey(id)) {
            return id;
        }
        String canonical = aliases.get(id);
        if (canonical == null || !assets.containsKey(canonical)) {
            throw new AssetNotFoundException(id);
        }
        return canonical;
    }

    private static String resolveFileUri(CatalogAsset asset) {
        String canonicalUri = asset.getCanonicalUri();
        if (canonicalUri != null && !canonicalUri.startsWith(PLEX_SCHEME)) {
            return canonicalUri;
        }
        return asset.getUri();
    }

    private static String detectType(Map<String, Object> editorial, String seriesTitle) {
        String explicit = stringValue(editorial.get("type"));
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return seriesTitle != null && !seriesTitle.isBlank() ? AssetMetadata.TYPE_EPISODE : AssetMetadata.TYPE_MOVIE;
    }

    private static AvailabilityWindow availability(Map<String, Object> editorial) {
        Instant start = instantValue(editorial.get("available_from"));
        Instant end = instantValue(editorial.get("available_until"));
        if (start == null && end == null) {
            return null;
        }
        return new AvailabilityWindow(start, end);
    }

    private static Instant instantValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            LOGGER.warn("Ignoring unparseable availability timestamp '{}'", value);
            return null;
        }
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer intValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer but got '" + value + "'", e);
        }
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    private static Set<String> lowerCaseSet(Object value) {
        Set<String> result = new HashSet<>();
        for (String item : stringList(value)) {
            result.add(item.toLowerCase(Locale.ROOT));
        }
        return result;
    }
}
