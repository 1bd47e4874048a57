package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.schedule.ScheduleOutput;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Compiled schedule days per channel, in memory only.
 */
@ApplicationScoped
public class EpgStore {
    private final Map<String, NavigableMap<LocalDate, ScheduleOutput>> days = new ConcurrentHashMap<>();

    public void put(ScheduleOutput schedule) {
        days.computeIfAbsent(schedule.channelId(), k -> new ConcurrentSkipListMap<>())
                .put(LocalDate.parse(schedule.broadcastDay()), schedule);
    }

    public Optional<ScheduleOutput> get(String channelId, LocalDate broadcastDay) {
        NavigableMap<LocalDate, ScheduleOutput> channelDays = days.get(channelId);
        return channelDays == null ? Optional.empty() : Optional.ofNullable(channelDays.get(broadcastDay));
    }

    public boolean exists(String channelId, LocalDate broadcastDay) {
        return get(channelId, broadcastDay).isPresent();
    }

    public List<LocalDate> dates(String channelId) {
        NavigableMap<LocalDate, ScheduleOutput> channelDays = days.get(channelId);
        return channelDays == null ? List.of() : List.copyOf(channelDays.keySet());
    }
}
