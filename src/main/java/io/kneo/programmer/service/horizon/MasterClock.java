package io.kneo.programmer.service.horizon;

import java.time.Instant;

public interface MasterClock {

    Instant nowUtc();

    default long nowUtcMillis() {
        return nowUtc().toEpochMilli();
    }
}
