package io.kneo.programmer.service.compiler;

import lombok.Builder;

import java.time.LocalDate;
import java.util.Map;

/**
 * @param sequentialCounters per-pool counters to continue from; a fresh map is used when null
 * @param broadcastDay       overrides {@code broadcast_day} of the definition when set
 */
@Builder(toBuilder = true)
public record CompileOptions(String dslPath,
                             String gitCommit,
                             long seed,
                             int dayStartHour,
                             Map<String, Integer> sequentialCounters,
                             LocalDate broadcastDay) {

    public static final int DEFAULT_DAY_START_HOUR = 6;

    public static CompileOptions defaults(long seed) {
        return CompileOptions.builder()
                .dslPath("<inline>")
                .gitCommit("0000000")
                .seed(seed)
                .dayStartHour(DEFAULT_DAY_START_HOUR)
                .build();
    }
}
