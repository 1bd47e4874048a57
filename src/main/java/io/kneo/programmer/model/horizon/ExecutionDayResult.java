package io.kneo.programmer.model.horizon;

import java.util.List;

public record ExecutionDayResult(long endUtcMs, List<ExecutionEntry> entries) {

    public ExecutionDayResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
