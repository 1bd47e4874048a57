package io.kneo.programmer.service.horizon;

import io.kneo.programmer.config.ProgrammerConfig;
import io.kneo.programmer.service.ProgrammingService;
import io.kneo.programmer.service.catalog.CatalogService;
import io.kneo.programmer.service.exceptions.CompileError;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class HorizonRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(HorizonRegistry.class);
    private final Map<String, HorizonManager> managers = new ConcurrentHashMap<>();
    private final Map<String, ExecutionWindowStore> stores = new ConcurrentHashMap<>();

    @Inject
    ProgrammerConfig config;

    @Inject
    ProgrammingService programmingService;

    @Inject
    CatalogService catalogService;

    @Inject
    EpgStore epgStore;

    @Inject
    MasterClock clock;

    void onStart(@Observes StartupEvent event) {
        HorizonPolicy policy = HorizonPolicy.from(config);
        config.getChannels().forEach((channelId, settings) -> {
            if (!settings.isEnabled()) {
                LOGGER.info("Channel {} is disabled, no horizon manager", channelId);
                return;
            }
            register(channelId, policy.withZone(zoneOf(channelId)));
        });
        LOGGER.info("Registered {} horizon managers (min_epg={}d, min_exec={}h)",
                managers.size(), policy.minEpgDays(), policy.minExecutionHours());
    }

    HorizonManager register(String channelId, HorizonPolicy policy) {
        ExecutionWindowStore store = new ExecutionWindowStore();
        HorizonManager manager = new HorizonManager(channelId,
                new CompiledScheduleExtender(channelId, programmingService, epgStore),
                new EpgExecutionExtender(channelId, epgStore, catalogService::getResolver),
                clock, policy, store);
        stores.put(channelId, store);
        managers.put(channelId, manager);
        return manager;
    }

    private ZoneId zoneOf(String channelId) {
        try {
            return programmingService.channelZone(channelId);
        } catch (CompileError e) {
            LOGGER.warn("Channel {}: {}, cutting broadcast days in UTC", channelId, e.getMessage());
            return ZoneOffset.UTC;
        }
    }

    public void evaluateAll() {
        Multi.createFrom().iterable(managers.values())
                .onItem().invoke(HorizonManager::evaluateOnce)
                .collect().asList()
                .subscribe().with(
                        evaluated -> LOGGER.debug("Evaluated {} horizons", evaluated.size()),
                        failure -> LOGGER.error("Horizon evaluation failed", failure));
    }

    public Optional<HorizonManager> getManager(String channelId) {
        return Optional.ofNullable(managers.get(channelId));
    }

    public Optional<ExecutionWindowStore> getStore(String channelId) {
        return Optional.ofNullable(stores.get(channelId));
    }

    public Set<String> getChannels() {
        return Set.copyOf(managers.keySet());
    }
}
