package io.kneo.programmer.service.catalog;

import io.kneo.programmer.model.catalog.AssetMetadata;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Query-side index record. Everything but the metadata reference is fixed at load time.
 */
@Getter
public final class CatalogEntry {
    private final String canonicalId;
    private final String assetType;
    private final int durationSec;
    private final String seriesTitle;
    private final Integer season;
    private final Integer episode;
    private final String rating;
    private final String sourceName;
    private final String collectionName;
    private final List<String> genres;
    private final Integer year;
    private final String title;
    private final String description;
    private volatile AssetMetadata meta;

    @Builder
    CatalogEntry(String canonicalId, String assetType, int durationSec, String seriesTitle, Integer season,
                 Integer episode, String rating, String sourceName, String collectionName, List<String> genres,
                 Integer year, String title, String description, AssetMetadata meta) {
        this.canonicalId = canonicalId;
        this.assetType = assetType;
        this.durationSec = durationSec;
        this.seriesTitle = seriesTitle == null ? "" : seriesTitle;
        this.season = season;
        this.episode = episode;
        this.rating = rating;
        this.sourceName = sourceName == null ? "" : sourceName;
        this.collectionName = collectionName == null ? "" : collectionName;
        this.genres = genres == null ? List.of() : List.copyOf(genres);
        this.year = year;
        this.title = title;
        this.description = description;
        this.meta = meta;
    }

    void replaceMeta(AssetMetadata updated) {
        this.meta = updated;
    }
}
