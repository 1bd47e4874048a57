package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionEntry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionWindowStoreTest {
    private static final LocalDate DAY = LocalDate.of(2025, 1, 6);

    private static ExecutionEntry entry(String id, long start, long end) {
        return new ExecutionEntry(id, 0, start, end, "asset-" + id, null, "retro-one", DAY);
    }

    @Test
    void testEntriesAreOrderedAndIdempotent() {
        ExecutionWindowStore store = new ExecutionWindowStore();

        store.addEntries(List.of(entry("b", 100, 200), entry("a", 0, 100)));
        store.addEntries(List.of(entry("a", 0, 100), entry("c", 200, 300)));

        assertEquals(List.of("a", "b", "c"), store.entries().stream().map(ExecutionEntry::blockId).toList());
        assertEquals(0, store.windowStart());
        assertEquals(300, store.windowEnd());
    }

    @Test
    void testEntriesWithoutLineageAreRejected() {
        ExecutionWindowStore store = new ExecutionWindowStore();
        ExecutionEntry orphan = new ExecutionEntry("x", 0, 0, 100, "asset", null, null, DAY);

        assertThrows(IllegalArgumentException.class, () -> store.addEntries(List.of(entry("ok", 0, 100), orphan)));
        assertTrue(store.entries().isEmpty(), "a rejected batch adds nothing");
    }

    @Test
    void testReadQueries() {
        ExecutionWindowStore store = new ExecutionWindowStore();
        store.addEntries(List.of(entry("a", 0, 100), entry("b", 100, 200), entry("d", 300, 400)));

        assertEquals("b", store.entryAt(150).orElseThrow().blockId());
        assertEquals("b", store.entryAt(100).orElseThrow().blockId());
        assertTrue(store.entryAt(250).isEmpty());
        assertEquals("d", store.nextEntry(100).orElseThrow().blockId());
        assertTrue(store.nextEntry(300).isEmpty());
        assertTrue(store.hasEntriesFor("retro-one", DAY));
        assertFalse(store.hasEntriesFor("retro-one", DAY.plusDays(1)));
    }

    @Test
    void testContiguity() {
        ExecutionWindowStore store = new ExecutionWindowStore();
        store.addEntries(List.of(entry("a", 0, 100), entry("b", 100, 200), entry("d", 300, 400)));

        assertTrue(store.isContiguous(50, 200));
        assertFalse(store.isContiguous(50, 350), "gap between 200 and 300");
        assertTrue(store.isContiguous(300, 400));
        assertFalse(store.isContiguous(0, 500));
    }
}
