package io.kneo.programmer.model.catalog;

import lombok.Builder;

import java.util.List;

/**
 * One resolvable unit of content. For pool-typed results {@code tags} carries the
 * ids of the matching assets in query order.
 */
@Builder(toBuilder = true)
public record AssetMetadata(String type,
                            int durationSec,
                            String title,
                            List<String> tags,
                            String rating,
                            AvailabilityWindow availability,
                            String fileUri,
                            List<Double> chapterMarkersSec,
                            String description,
                            double loudnessGainDb) {

    public static final String TYPE_EPISODE = "episode";
    public static final String TYPE_MOVIE = "movie";
    public static final String TYPE_POOL = "pool";

    public AssetMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        chapterMarkersSec = chapterMarkersSec == null ? List.of() : List.copyOf(chapterMarkersSec);
    }

    public static AssetMetadata pool(List<String> memberIds) {
        return AssetMetadata.builder()
                .type(TYPE_POOL)
                .durationSec(0)
                .tags(memberIds)
                .build();
    }

    public AssetMetadata withLoudnessGainDb(double gainDb) {
        return toBuilder().loudnessGainDb(gainDb).build();
    }
}
