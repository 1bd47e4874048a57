package io.kneo.programmer.test;

import io.kneo.programmer.service.horizon.ScheduleExtender;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class StubScheduleExtender implements ScheduleExtender {
    private final Set<LocalDate> resolved = new LinkedHashSet<>();
    private final List<LocalDate> extendCalls = new ArrayList<>();
    private RuntimeException failure;

    @Override
    public boolean epgDayExists(LocalDate broadcastDate) {
        return resolved.contains(broadcastDate);
    }

    @Override
    public void extendEpgDay(LocalDate broadcastDate) {
        extendCalls.add(broadcastDate);
        if (failure != null) {
            throw failure;
        }
        resolved.add(broadcastDate);
    }

    public void failWith(RuntimeException e) {
        this.failure = e;
    }

    public List<LocalDate> getExtendCalls() {
        return List.copyOf(extendCalls);
    }

    public Set<LocalDate> getResolved() {
        return Set.copyOf(resolved);
    }
}
