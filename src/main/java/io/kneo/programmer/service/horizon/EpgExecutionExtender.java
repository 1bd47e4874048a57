package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionDayResult;
import io.kneo.programmer.model.horizon.ExecutionEntry;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.service.catalog.AssetResolver;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import io.kneo.programmer.service.exceptions.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Derives execution entries from an already compiled EPG day. Never compiles anything itself.
 */
public class EpgExecutionExtender implements ExecutionExtender {
    private static final Logger LOGGER = LoggerFactory.getLogger(EpgExecutionExtender.class);

    private final String channelId;
    private final EpgStore epgStore;
    private final Supplier<AssetResolver> resolver;

    public EpgExecutionExtender(String channelId, EpgStore epgStore, Supplier<AssetResolver> resolver) {
        this.channelId = channelId;
        this.epgStore = epgStore;
        this.resolver = resolver;
    }

    @Override
    public ExecutionDayResult extendExecutionDay(LocalDate broadcastDate) {
        ScheduleOutput schedule = epgStore.get(channelId, broadcastDate)
                .orElseThrow(() -> new PipelineException(PipelineException.EPG_DAY_MISSING,
                        String.format("No compiled EPG for %s on %s", channelId, broadcastDate)));
        List<ProgramBlockOutput> blocks = schedule.programBlocks();
        if (blocks.isEmpty()) {
            throw new PipelineException(PipelineException.PIPELINE_EXHAUSTED,
                    String.format("EPG for %s on %s has no blocks", channelId, broadcastDate));
        }

        AssetResolver assets = resolver.get();
        List<ExecutionEntry> entries = new ArrayList<>(blocks.size());
        long endMs = 0;
        for (int i = 0; i < blocks.size(); i++) {
            ProgramBlockOutput block = blocks.get(i);
            long start = block.startAt().toInstant().toEpochMilli();
            long end = block.endAt().toInstant().toEpochMilli();
            entries.add(new ExecutionEntry(
                    String.format("%s-%s-%03d", channelId, broadcastDate, i),
                    i,
                    start,
                    end,
                    block.assetId(),
                    fileUri(assets, block.assetId()),
                    channelId,
                    broadcastDate));
            endMs = Math.max(endMs, end);
        }
        return new ExecutionDayResult(endMs, entries);
    }

    private static String fileUri(AssetResolver assets, String assetId) {
        try {
            return assets.lookup(assetId).fileUri();
        } catch (AssetNotFoundException e) {
            LOGGER.warn("Asset {} vanished from the catalog after compilation, entry has no file", assetId);
            return null;
        }
    }
}
