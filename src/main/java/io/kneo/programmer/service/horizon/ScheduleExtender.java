package io.kneo.programmer.service.horizon;

import java.time.LocalDate;

/**
 * EPG side of the horizon. Implementations resolve one broadcast day at a time.
 */
public interface ScheduleExtender {

    boolean epgDayExists(LocalDate broadcastDate);

    void extendEpgDay(LocalDate broadcastDate);
}
