package io.kneo.programmer.service.horizon;

import io.kneo.programmer.config.ProgrammerConfig;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * @param proactiveThresholdMs extend once remaining execution depth is at or below this, even
 *                             while still above the minimum; 0 disables
 * @param zone                 the channel's own timezone; broadcast days start at
 *                             {@code dayStartHour} local time
 */
public record HorizonPolicy(int minEpgDays, int minExecutionHours, int dayStartHour, long proactiveThresholdMs,
                            ZoneId zone) {

    public HorizonPolicy(int minEpgDays, int minExecutionHours, int dayStartHour, long proactiveThresholdMs) {
        this(minEpgDays, minExecutionHours, dayStartHour, proactiveThresholdMs, ZoneOffset.UTC);
    }

    public static HorizonPolicy from(ProgrammerConfig config) {
        return new HorizonPolicy(config.getMinEpgDays(), config.getMinExecutionHours(),
                config.getProgrammingDayStartHour(), config.getProactiveExtendThresholdMinutes() * 60_000L);
    }

    public HorizonPolicy withZone(ZoneId channelZone) {
        return new HorizonPolicy(minEpgDays, minExecutionHours, dayStartHour, proactiveThresholdMs, channelZone);
    }

    public long minEpgMs() {
        return minEpgDays * 24L * HorizonManager.HOUR_MS;
    }

    public long minExecutionMs() {
        return minExecutionHours * HorizonManager.HOUR_MS;
    }
}
