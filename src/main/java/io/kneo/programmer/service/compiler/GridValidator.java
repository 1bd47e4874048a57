package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.service.exceptions.CompileError;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class GridValidator {

    private GridValidator() {
    }

    /**
     * Fails on the first block that is not in UTC or not on the grid.
     */
    public static void validateGridAlignment(List<ProgramBlockOutput> blocks, int gridSeconds) {
        for (ProgramBlockOutput block : blocks) {
            if (!ZoneOffset.UTC.equals(block.startAt().getOffset())) {
                throw new CompileError(String.format("Block '%s' start_at %s is not UTC", block.title(), block.startAt()));
            }
            long epochSec = block.startAt().toEpochSecond();
            if (epochSec % gridSeconds != 0) {
                throw new CompileError(String.format("Grid violation: block '%s' starts at %s, not a multiple of %ds",
                        block.title(), block.startAt(), gridSeconds));
            }
            if (block.slotDurationSec() <= 0 || block.slotDurationSec() % gridSeconds != 0) {
                throw new CompileError(String.format("Grid violation: block '%s' slot of %ds is not a positive multiple of %ds",
                        block.title(), block.slotDurationSec(), gridSeconds));
            }
        }
    }

    /**
     * Pushes a block that starts before its predecessor ends to the predecessor's end. A block
     * lying entirely inside its predecessor cannot be reconciled.
     */
    public static List<ProgramBlockOutput> compact(List<ProgramBlockOutput> sorted) {
        List<ProgramBlockOutput> out = new ArrayList<>(sorted.size());
        ProgramBlockOutput prev = null;
        for (ProgramBlockOutput block : sorted) {
            ProgramBlockOutput placed = block;
            if (prev != null && block.startAt().isBefore(prev.endAt())) {
                boolean contained = !block.startAt().isBefore(prev.startAt()) && !block.endAt().isAfter(prev.endAt());
                if (contained) {
                    throw new CompileError(String.format("Illegal overlap: block '%s' is fully enclosed within '%s'",
                            block.title(), prev.title()));
                }
                placed = block.withStartAt(prev.endAt());
            }
            out.add(placed);
            prev = placed;
        }
        return out;
    }
}
