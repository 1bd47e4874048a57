package io.kneo.programmer.service.horizon;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;

@ApplicationScoped
public class SystemMasterClock implements MasterClock {

    @Override
    public Instant nowUtc() {
        return Instant.now();
    }
}
