package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.service.exceptions.CompileError;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridValidatorTest {
    private static final int GRID = 1800;

    private static ProgramBlockOutput block(String title, String start, int slot) {
        return new ProgramBlockOutput(title, title.toLowerCase(), OffsetDateTime.parse(start), slot, slot);
    }

    @Test
    void testAlignedUtcBlocksPass() {
        assertDoesNotThrow(() -> GridValidator.validateGridAlignment(List.of(
                block("A", "2025-03-03T06:00Z", 1800),
                block("B", "2025-03-03T06:30Z", 5400)), GRID));
    }

    @Test
    void testNonUtcOffsetIsRejected() {
        CompileError error = assertThrows(CompileError.class, () -> GridValidator.validateGridAlignment(
                List.of(block("A", "2025-03-03T07:00+01:00", 1800)), GRID));
        assertTrue(error.getMessage().contains("not UTC"), error.getMessage());
    }

    @Test
    void testMisalignedStartIsRejected() {
        CompileError error = assertThrows(CompileError.class, () -> GridValidator.validateGridAlignment(
                List.of(block("A", "2025-03-03T06:10Z", 1800)), GRID));
        assertTrue(error.getMessage().startsWith("Grid violation"), error.getMessage());
    }

    @Test
    void testMisalignedSlotIsRejected() {
        assertThrows(CompileError.class, () -> GridValidator.validateGridAlignment(
                List.of(block("A", "2025-03-03T06:00Z", 1500)), GRID));
    }

    @Test
    void testPartialOverlapIsShiftedForward() {
        ProgramBlockOutput first = block("Movie", "2025-03-03T20:00Z", 9000);
        ProgramBlockOutput second = block("Show", "2025-03-03T22:00Z", 3600);
        ProgramBlockOutput third = block("News", "2025-03-03T23:00Z", 3600);

        List<ProgramBlockOutput> out = GridValidator.compact(List.of(first, second, third));

        assertSame(first, out.get(0));
        assertEquals(OffsetDateTime.parse("2025-03-03T22:30Z"), out.get(1).startAt());
        assertEquals(OffsetDateTime.parse("2025-03-03T23:30Z"), out.get(2).startAt(), "shift cascades");
        assertEquals(3600, out.get(1).slotDurationSec());
    }

    @Test
    void testContainedBlockIsRejected() {
        CompileError error = assertThrows(CompileError.class, () -> GridValidator.compact(List.of(
                block("Outer", "2025-03-03T20:00Z", 7200),
                block("Inner", "2025-03-03T20:30Z", 1800))));
        assertEquals("Illegal overlap: block 'Inner' is fully enclosed within 'Outer'", error.getMessage());
    }
}
