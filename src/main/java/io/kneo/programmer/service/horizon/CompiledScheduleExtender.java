package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.service.ProgrammingService;
import io.kneo.programmer.service.exceptions.CompileError;
import io.kneo.programmer.service.exceptions.PipelineException;

import java.time.LocalDate;

/**
 * Resolves an EPG day by compiling the channel's schedule definition for that date.
 */
public class CompiledScheduleExtender implements ScheduleExtender {
    private final String channelId;
    private final ProgrammingService programmingService;
    private final EpgStore epgStore;

    public CompiledScheduleExtender(String channelId, ProgrammingService programmingService, EpgStore epgStore) {
        this.channelId = channelId;
        this.programmingService = programmingService;
        this.epgStore = epgStore;
    }

    @Override
    public boolean epgDayExists(LocalDate broadcastDate) {
        return epgStore.exists(channelId, broadcastDate);
    }

    @Override
    public void extendEpgDay(LocalDate broadcastDate) {
        try {
            ScheduleOutput schedule = programmingService.compileDay(channelId, broadcastDate);
            epgStore.put(schedule);
        } catch (CompileError e) {
            throw new PipelineException(PipelineException.SCHEDULE_COMPILE_FAILED,
                    String.format("Compiling %s for %s failed: %s", channelId, broadcastDate, e.getMessage()), e);
        }
    }
}
