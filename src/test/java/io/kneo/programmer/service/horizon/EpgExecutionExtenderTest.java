package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionDayResult;
import io.kneo.programmer.model.horizon.ExecutionEntry;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.model.schedule.ScheduleSource;
import io.kneo.programmer.service.exceptions.PipelineException;
import io.kneo.programmer.test.InMemoryAssetResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EpgExecutionExtenderTest {
    private static final LocalDate DAY = LocalDate.of(2025, 1, 6);

    private EpgStore epgStore;
    private EpgExecutionExtender extender;

    @BeforeEach
    void setUp() {
        epgStore = new EpgStore();
        InMemoryAssetResolver resolver = new InMemoryAssetResolver().episode("ep1", "Pilot", 1320);
        extender = new EpgExecutionExtender("retro-one", epgStore, () -> resolver);
    }

    private static ScheduleOutput day(List<ProgramBlockOutput> blocks) {
        return new ScheduleOutput(ScheduleOutput.SCHEMA_VERSION, "retro-one", DAY.toString(), "UTC",
                new ScheduleSource("<inline>", "0000000", "2.0.0"), blocks, null, "sha256:00");
    }

    @Test
    void testEntriesCarryLineageAndFiles() {
        epgStore.put(day(List.of(
                new ProgramBlockOutput("Pilot", "ep1", OffsetDateTime.parse("2025-01-06T06:00Z"), 1800, 1320),
                new ProgramBlockOutput("Gone", "gone", OffsetDateTime.parse("2025-01-06T06:30Z"), 1800, 1500))));

        ExecutionDayResult result = extender.extendExecutionDay(DAY);

        assertEquals(Instant.parse("2025-01-06T07:00:00Z").toEpochMilli(), result.endUtcMs());
        ExecutionEntry first = result.entries().get(0);
        assertEquals("retro-one-2025-01-06-000", first.blockId());
        assertEquals("retro-one", first.channelId());
        assertEquals(DAY, first.programmingDayDate());
        assertEquals("/media/ep1.mkv", first.fileUri());
        assertEquals(1, result.entries().get(1).blockIndex());
        assertNull(result.entries().get(1).fileUri());
    }

    @Test
    void testMissingDayAndEmptyDayFailWithCodes() {
        PipelineException missing = assertThrows(PipelineException.class, () -> extender.extendExecutionDay(DAY));
        assertEquals(PipelineException.EPG_DAY_MISSING, missing.getErrorCode());

        epgStore.put(day(List.of()));
        PipelineException empty = assertThrows(PipelineException.class, () -> extender.extendExecutionDay(DAY));
        assertEquals(PipelineException.PIPELINE_EXHAUSTED, empty.getErrorCode());
    }
}
