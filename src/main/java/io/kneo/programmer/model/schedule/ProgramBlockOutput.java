package io.kneo.programmer.model.schedule;

import io.kneo.programmer.util.ImmutableTree;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One compiled schedule entry. {@code slotDurationSec} is grid-quantized,
 * {@code episodeDurationSec} is the real content length and never exceeds the slot.
 */
public record ProgramBlockOutput(String title,
                                 String assetId,
                                 OffsetDateTime startAt,
                                 int slotDurationSec,
                                 int episodeDurationSec,
                                 String collection,
                                 Map<String, Object> selector) {

    public ProgramBlockOutput {
        selector = selector == null ? null : ImmutableTree.copyOfMap(selector);
    }

    public ProgramBlockOutput(String title, String assetId, OffsetDateTime startAt,
                              int slotDurationSec, int episodeDurationSec) {
        this(title, assetId, startAt, slotDurationSec, episodeDurationSec, null, null);
    }

    public OffsetDateTime endAt() {
        return startAt.plusSeconds(slotDurationSec);
    }

    public ProgramBlockOutput withStartAt(OffsetDateTime newStart) {
        return new ProgramBlockOutput(title, assetId, newStart, slotDurationSec, episodeDurationSec, collection, selector);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("title", title);
        map.put("asset_id", assetId);
        map.put("start_at", startAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        map.put("slot_duration_sec", slotDurationSec);
        map.put("episode_duration_sec", episodeDurationSec);
        if (collection != null && !collection.isEmpty()) {
            map.put("collection", collection);
        }
        if (selector != null && !selector.isEmpty()) {
            map.put("selector", selector);
        }
        return map;
    }
}
