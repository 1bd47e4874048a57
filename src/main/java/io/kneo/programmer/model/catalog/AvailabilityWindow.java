package io.kneo.programmer.model.catalog;

import java.time.Instant;

public record AvailabilityWindow(Instant start, Instant end) {
}
