package io.kneo.programmer.service.catalog;

import io.kneo.programmer.model.catalog.CatalogSnapshot;
import io.kneo.programmer.service.exceptions.CatalogLoadException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogSnapshotLoaderTest {
    private final CatalogSnapshotLoader loader = new CatalogSnapshotLoader();

    @Test
    void testLoadsJsonFixture() {
        CatalogSnapshot snapshot = loader.load("classpath:catalog/test-catalog.json");

        assertEquals(15, snapshot.getAssets().size());
        assertEquals(3, snapshot.getCollections().size());
        assertEquals(3, snapshot.getMarkers().size());
        assertEquals(-2.5, snapshot.getProbes().get("cheers-101").getLoudnessGainDb());
        assertFalse(snapshot.getAssets().stream().allMatch(a -> a.isReady()), "pending asset is kept in the raw snapshot");
    }

    @Test
    void testParsesYamlAndIgnoresUnknownFields() {
        String yaml = """
                exported_by: catalog-dump
                assets:
                  - uuid: a1
                    state: ready
                    duration_ms: 60000
                    checksum: abc
                editorials:
                  a1:
                    title: Filler
                """;

        CatalogSnapshot snapshot = loader.parse(yaml, true);

        assertEquals(1, snapshot.getAssets().size());
        assertTrue(snapshot.getAssets().get(0).isReady());
        assertEquals("Filler", snapshot.getEditorials().get("a1").get("title"));
        assertTrue(snapshot.getMarkers().isEmpty());
    }

    @Test
    void testMalformedOrMissingSnapshotFails() {
        assertThrows(CatalogLoadException.class, () -> loader.parse("{\"assets\": [", false));
        assertThrows(CatalogLoadException.class, () -> loader.load("classpath:catalog/missing.json"));
    }
}
