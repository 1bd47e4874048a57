package io.kneo.programmer.service.catalog;

import io.kneo.programmer.config.ProgrammerConfig;
import io.kneo.programmer.model.catalog.CatalogSnapshot;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the resolver for the current catalog snapshot. A reload builds a fresh resolver and
 * swaps it in; compiles already running keep the snapshot they started with.
 */
@ApplicationScoped
public class CatalogService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogService.class);

    private final ProgrammerConfig config;
    private final CatalogSnapshotLoader loader = new CatalogSnapshotLoader();
    private final AtomicReference<CatalogAssetResolver> current =
            new AtomicReference<>(new CatalogAssetResolver(new CatalogSnapshot()));

    @Inject
    public CatalogService(ProgrammerConfig config) {
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        config.getCatalogSnapshotPath().ifPresentOrElse(
                this::reload,
                () -> LOGGER.warn("No catalog snapshot configured, starting with an empty catalog"));
    }

    public CatalogAssetResolver reload(String location) {
        LOGGER.info("Loading catalog snapshot from {}", location);
        CatalogAssetResolver resolver = new CatalogAssetResolver(loader.load(location));
        current.set(resolver);
        return resolver;
    }

    public CatalogAssetResolver getResolver() {
        return current.get();
    }

    public void updateLoudness(String assetId, double gainDb) {
        current.get().updateLoudness(assetId, gainDb);
    }

    public boolean needsLoudnessMeasurement(String assetId) {
        return current.get().needsLoudnessMeasurement(assetId);
    }
}
