package io.kneo.programmer.test;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.service.catalog.AssetResolver;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built catalog for compiler tests. Pools are plain id lists; {@code query} understands
 * {@code type} and {@code collection} only.
 */
public class InMemoryAssetResolver implements AssetResolver {
    private final Map<String, AssetMetadata> assets = new LinkedHashMap<>();
    private final Map<String, String> collections = new LinkedHashMap<>();
    private final Map<String, List<String>> pools = new LinkedHashMap<>();

    public InMemoryAssetResolver episode(String id, String title, int durationSec) {
        return add(id, AssetMetadata.TYPE_EPISODE, title, durationSec, "TV-PG");
    }

    public InMemoryAssetResolver movie(String id, String title, int durationSec, String rating) {
        return add(id, AssetMetadata.TYPE_MOVIE, title, durationSec, rating);
    }

    public InMemoryAssetResolver add(String id, String type, String title, int durationSec, String rating) {
        assets.put(id, AssetMetadata.builder()
                .type(type)
                .title(title)
                .durationSec(durationSec)
                .rating(rating)
                .fileUri("/media/" + id + ".mkv")
                .build());
        return this;
    }

    public InMemoryAssetResolver inCollection(String collection, String... ids) {
        for (String id : ids) {
            collections.put(id, collection);
        }
        return this;
    }

    public InMemoryAssetResolver pool(String name, String... ids) {
        pools.put(name, List.of(ids));
        return this;
    }

    @Override
    public AssetMetadata lookup(String id) {
        AssetMetadata meta = assets.get(id);
        if (meta != null) {
            return meta;
        }
        List<String> members = pools.get(id);
        if (members != null) {
            return AssetMetadata.pool(members);
        }
        throw new AssetNotFoundException(id);
    }

    @Override
    public List<String> query(Map<String, Object> match) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, AssetMetadata> entry : assets.entrySet()) {
            Object type = match.get("type");
            if (type != null && !type.equals(entry.getValue().type())) {
                continue;
            }
            Object collection = match.get("collection");
            if (collection != null && !collection.equals(collections.get(entry.getKey()))) {
                continue;
            }
            result.add(entry.getKey());
        }
        result.sort(null);
        return result;
    }
}
