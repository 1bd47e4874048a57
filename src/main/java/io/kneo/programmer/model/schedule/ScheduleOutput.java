package io.kneo.programmer.model.schedule;

import io.kneo.programmer.util.ImmutableTree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ScheduleOutput(String version,
                             String channelId,
                             String broadcastDay,
                             String timezone,
                             ScheduleSource source,
                             List<ProgramBlockOutput> programBlocks,
                             Object notes,
                             String hash) {

    public static final String SCHEMA_VERSION = "program-schedule.v2";

    public ScheduleOutput {
        programBlocks = List.copyOf(programBlocks);
        notes = ImmutableTree.copyOf(notes);
    }

    /**
     * Every field except {@code hash}; this is the exact structure the hash is computed over.
     */
    public Map<String, Object> toHashableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", version);
        map.put("channel_id", channelId);
        map.put("broadcast_day", broadcastDay);
        map.put("timezone", timezone);
        map.put("source", source.toMap());
        map.put("program_blocks", programBlocks.stream().map(ProgramBlockOutput::toMap).toList());
        if (notes != null) {
            map.put("notes", notes);
        }
        return map;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = toHashableMap();
        map.put("hash", hash);
        return map;
    }
}
