package io.kneo.programmer.model.horizon;

import java.time.LocalDate;

/**
 * One execution-ready block inside the execution window. Lineage fields tie it to the
 * compiled schedule day it was derived from.
 */
public record ExecutionEntry(String blockId,
                             int blockIndex,
                             long startUtcMs,
                             long endUtcMs,
                             String assetId,
                             String fileUri,
                             String channelId,
                             LocalDate programmingDayDate) {

    public boolean hasLineage() {
        return channelId != null && !channelId.isEmpty() && programmingDayDate != null;
    }
}
