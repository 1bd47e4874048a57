package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ProgramBlockOutput;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

public interface BlockCompiler {

    List<ProgramBlockOutput> compile(Map<String, Object> fragment, CompileContext ctx);

    boolean supports(BlockKind kind);

    default ProgramBlockOutput block(String title, String assetId, ZonedDateTime start, int slotSec,
                                     int durationSec, String collection, Map<String, Object> selector) {
        return new ProgramBlockOutput(title, assetId, start.toOffsetDateTime(), slotSec, durationSec, collection, selector);
    }
}
