package io.kneo.programmer.service.catalog;

import io.kneo.programmer.model.catalog.AssetMetadata;

import java.util.List;
import java.util.Map;

public interface AssetResolver {

    /**
     * @throws io.kneo.programmer.service.exceptions.AssetNotFoundException when nothing is known by that id
     */
    AssetMetadata lookup(String id);

    /**
     * Evaluates pool match criteria and returns matching asset ids in a stable order.
     */
    List<String> query(Map<String, Object> match);
}
