package io.kneo.programmer.test;

import io.kneo.programmer.model.horizon.ExecutionDayResult;
import io.kneo.programmer.model.horizon.ExecutionEntry;
import io.kneo.programmer.service.horizon.ExecutionExtender;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Covers a whole broadcast day per call with one-hour entries, unless a failure is queued.
 */
public class StubExecutionExtender implements ExecutionExtender {
    private static final long HOUR_MS = 3_600_000L;

    private final String channelId;
    private final int dayStartHour;
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final List<LocalDate> calls = new ArrayList<>();

    public StubExecutionExtender(String channelId, int dayStartHour) {
        this.channelId = channelId;
        this.dayStartHour = dayStartHour;
    }

    @Override
    public ExecutionDayResult extendExecutionDay(LocalDate broadcastDate) {
        calls.add(broadcastDate);
        RuntimeException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
        long dayStart = broadcastDate.atTime(dayStartHour, 0).toInstant(ZoneOffset.UTC).toEpochMilli();
        List<ExecutionEntry> entries = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            long start = dayStart + hour * HOUR_MS;
            entries.add(new ExecutionEntry(channelId + "-" + broadcastDate + "-" + hour, hour, start, start + HOUR_MS,
                    "asset-" + hour, "/media/asset-" + hour + ".mkv", channelId, broadcastDate));
        }
        return new ExecutionDayResult(dayStart + 24 * HOUR_MS, entries);
    }

    public void failNext(RuntimeException failure) {
        failures.add(failure);
    }

    public List<LocalDate> getCalls() {
        return List.copyOf(calls);
    }
}
