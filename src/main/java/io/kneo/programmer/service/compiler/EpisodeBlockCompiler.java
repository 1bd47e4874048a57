package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.catalog.AssetMetadata;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.service.exceptions.CompileError;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sitcom-style blocks: one declared slot per grid unit. A long episode preempts the slots it
 * runs over; those slot definitions are skipped without selecting anything.
 */
public class EpisodeBlockCompiler implements BlockCompiler {
    static final String EPISODE_SELECTOR_KEY = "episode_selector";

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.EPISODE_BLOCK;
    }

    @Override
    public List<ProgramBlockOutput> compile(Map<String, Object> fragment, CompileContext ctx) {
        ZonedDateTime blockStart = ctx.at(DslValues.string(fragment, "start"));
        List<Object> slots = DslValues.list(fragment.get(BlockKind.SLOTS_KEY));
        int grid = ctx.getGridSeconds();
        List<ProgramBlockOutput> out = new ArrayList<>();

        int i = 0;
        while (i < slots.size()) {
            Map<String, Object> slot = DslValues.map(slots.get(i));
            ZonedDateTime slotStart = blockStart.plusSeconds((long) i * grid);
            Map<String, Object> selector = DslValues.map(slot, EPISODE_SELECTOR_KEY);

            String poolId = null;
            String mode = null;
            String assetId;
            if (selector.isEmpty()) {
                assetId = DslValues.string(slot, "program");
                if (assetId == null) {
                    throw new CompileError(String.format("Slot %d of block at %s has neither program nor episode_selector",
                            i, fragment.get("start")));
                }
            } else {
                poolId = DslValues.string(selector, "pool", DslValues.string(selector, "collection"));
                mode = DslValues.string(selector, "mode", ctx.getPools().defaultOrder(poolId));
                assetId = EpisodeSelector.select(ctx, poolId, mode, DslValues.longValue(selector, "seed"));
            }

            AssetMetadata meta = ctx.lookup(assetId);
            int slotDuration = BroadcastTimes.gridCeil(meta.durationSec(), grid);
            String title = DslValues.string(slot, "title", meta.title() != null ? meta.title() : assetId);
            out.add(block(title, assetId, slotStart, slotDuration, meta.durationSec(), poolId, provenance(selector, mode)));

            if (poolId != null) {
                ctx.advance(poolId);
            }
            i += slotDuration / grid;
        }
        return out;
    }

    private static Map<String, Object> provenance(Map<String, Object> selector, String mode) {
        Map<String, Object> provenance = new LinkedHashMap<>();
        if (selector.isEmpty()) {
            return provenance;
        }
        provenance.put("mode", mode);
        Long seed = DslValues.longValue(selector, "seed");
        if (seed != null) {
            provenance.put("seed", seed);
        }
        return provenance;
    }
}
