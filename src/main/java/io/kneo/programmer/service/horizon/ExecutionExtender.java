package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionDayResult;

import java.time.LocalDate;

public interface ExecutionExtender {

    /**
     * Generates execution data for one broadcast day.
     *
     * @return the end of the last generated entry, plus the entries themselves
     * @throws io.kneo.programmer.service.exceptions.PipelineException with the failure's error code
     */
    ExecutionDayResult extendExecutionDay(LocalDate broadcastDate);
}
