package io.kneo.programmer.service.horizon.ticker;

import io.kneo.programmer.service.horizon.HorizonRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class HorizonTicker {
    @Inject
    HorizonRegistry horizonRegistry;

    @Scheduled(every = "${programmer.horizon.evaluation-interval:10s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        horizonRegistry.evaluateAll();
    }
}
