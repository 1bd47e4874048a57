package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.PoolDefinition;
import io.kneo.programmer.service.catalog.AssetResolver;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import io.kneo.programmer.service.exceptions.AssetResolutionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pools declared by one schedule definition. Names that are not declared pools fall back to the
 * resolver, which knows catalog collections and its own registered pools. Resolution is lazy and
 * memoized for the lifetime of one compile call.
 */
public class PoolRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(PoolRegistry.class);
    private static final String COLLECTION_KEY = "collection";

    private final AssetResolver resolver;
    private final Map<String, PoolDefinition> pools;
    private final Map<String, List<String>> resolved = new HashMap<>();

    public PoolRegistry(AssetResolver resolver, Map<String, PoolDefinition> pools) {
        this.resolver = resolver;
        this.pools = new LinkedHashMap<>(pools);
    }

    public static PoolRegistry fromDsl(AssetResolver resolver, Map<String, Object> poolsNode) {
        Map<String, PoolDefinition> pools = new LinkedHashMap<>();
        poolsNode.forEach((name, raw) -> pools.put(name, PoolDefinition.fromDsl(raw)));
        return new PoolRegistry(resolver, pools);
    }

    public boolean isKnown(String name) {
        if (pools.containsKey(name) || resolved.containsKey(name)) {
            return true;
        }
        try {
            resolved.put(name, evaluate(name));
            return true;
        } catch (AssetNotFoundException e) {
            return false;
        }
    }

    /**
     * @throws AssetResolutionError  when the pool resolves to zero assets
     * @throws AssetNotFoundException when the name is neither a pool nor a known collection
     */
    public List<String> resolvePool(String name) {
        List<String> ids = resolved.computeIfAbsent(name, this::evaluate);
        if (ids.isEmpty()) {
            throw new AssetResolutionError(String.format("Pool/collection '%s' has no assets", name));
        }
        return ids;
    }

    /**
     * Selection order declared on the pool; collections and resolver pools are sequential.
     */
    public String defaultOrder(String name) {
        PoolDefinition pool = pools.get(name);
        return pool == null ? PoolDefinition.ORDER_SEQUENTIAL : pool.order();
    }

    private List<String> evaluate(String name) {
        PoolDefinition pool = pools.get(name);
        if (pool != null) {
            return List.copyOf(resolver.query(pool.match()));
        }
        try {
            AssetMetadata meta = resolver.lookup(name);
            if (AssetMetadata.TYPE_POOL.equals(meta.type())) {
                return meta.tags();
            }
        } catch (AssetNotFoundException e) {
            LOGGER.debug("'{}' is not a resolver pool, trying it as a collection", name);
        }
        List<String> members = resolver.query(Map.of(COLLECTION_KEY, name));
        if (members.isEmpty()) {
            throw new AssetNotFoundException(name);
        }
        return List.copyOf(members);
    }
}
