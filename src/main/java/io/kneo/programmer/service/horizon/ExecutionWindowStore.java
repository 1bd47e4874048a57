package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionEntry;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Execution-ready entries, ordered by start. Written only by the horizon manager; playout
 * consumers read from it and never ask for generation.
 */
public class ExecutionWindowStore {
    private final List<ExecutionEntry> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Adds entries, ignoring block ids already present.
     *
     * @throws IllegalArgumentException if an entry does not name its channel and programming day
     */
    public void addEntries(List<ExecutionEntry> incoming) {
        for (ExecutionEntry entry : incoming) {
            if (!entry.hasLineage()) {
                throw new IllegalArgumentException(String.format(
                        "Execution entry %s has no schedule lineage (channel=%s, programming day=%s)",
                        entry.blockId(), entry.channelId(), entry.programmingDayDate()));
            }
        }
        lock.writeLock().lock();
        try {
            Set<String> known = new HashSet<>();
            entries.forEach(e -> known.add(e.blockId()));
            boolean added = false;
            for (ExecutionEntry entry : incoming) {
                if (known.add(entry.blockId())) {
                    entries.add(entry);
                    added = true;
                }
            }
            if (added) {
                entries.sort(Comparator.comparingLong(ExecutionEntry::startUtcMs));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ExecutionEntry> nextEntry(long afterUtcMs) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(e -> e.startUtcMs() > afterUtcMs).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ExecutionEntry> entryAt(long utcMs) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(e -> e.startUtcMs() <= utcMs && utcMs < e.endUtcMs()).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long windowStart() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() ? 0 : entries.get(0).startUtcMs();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long windowEnd() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).endUtcMs();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ExecutionEntry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasEntriesFor(String channelId, LocalDate programmingDay) {
        lock.readLock().lock();
        try {
            return entries.stream().anyMatch(e -> channelId.equals(e.channelId())
                    && programmingDay.equals(e.programmingDayDate()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when {@code [fromUtcMs, toUtcMs)} is covered without gaps.
     */
    public boolean isContiguous(long fromUtcMs, long toUtcMs) {
        lock.readLock().lock();
        try {
            long covered = fromUtcMs;
            for (ExecutionEntry entry : entries) {
                if (entry.endUtcMs() <= covered) {
                    continue;
                }
                if (entry.startUtcMs() > covered) {
                    return false;
                }
                covered = entry.endUtcMs();
                if (covered >= toUtcMs) {
                    return true;
                }
            }
            return covered >= toUtcMs;
        } finally {
            lock.readLock().unlock();
        }
    }
}
