package io.kneo.programmer.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.kneo.programmer.model.catalog.CatalogSnapshot;
import io.kneo.programmer.service.exceptions.CatalogLoadException;
import io.kneo.programmer.util.ResourceUtil;

import java.io.UncheckedIOException;

/**
 * Reads a catalog snapshot exported by the persistence layer. JSON and YAML are both accepted;
 * the format follows the file extension.
 */
public class CatalogSnapshotLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public CatalogSnapshot load(String location) {
        String text;
        try {
            text = ResourceUtil.loadAsString(location);
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new CatalogLoadException("Cannot read catalog snapshot at " + location, e);
        }
        return parse(text, isYaml(location));
    }

    public CatalogSnapshot parse(String text, boolean yaml) {
        try {
            CatalogSnapshot snapshot = (yaml ? YAML_MAPPER : JSON_MAPPER).readValue(text, CatalogSnapshot.class);
            return snapshot == null ? new CatalogSnapshot() : snapshot;
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Malformed catalog snapshot: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isYaml(String location) {
        return location.endsWith(".yaml") || location.endsWith(".yml");
    }
}
