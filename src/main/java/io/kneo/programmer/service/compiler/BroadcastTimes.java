package io.kneo.programmer.service.compiler;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wall-clock times inside a broadcast day. A broadcast day starts at the programming-day start
 * hour, so "02:00" on broadcast day D is 02:00 on calendar day D+1.
 */
public final class BroadcastTimes {
    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");

    private BroadcastTimes() {
    }

    public static LocalTime parseClock(String text) {
        Matcher m = CLOCK.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a HH:MM time: '" + text + "'");
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        int second = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        return LocalTime.of(hour, minute, second);
    }

    public static boolean isClock(String text) {
        return text != null && CLOCK.matcher(text.trim()).matches();
    }

    public static ZonedDateTime resolve(String clock, LocalDate broadcastDay, ZoneId zone, int dayStartHour) {
        LocalTime time = parseClock(clock);
        LocalDate calendarDay = time.getHour() < dayStartHour ? broadcastDay.plusDays(1) : broadcastDay;
        return ZonedDateTime.of(LocalDateTime.of(calendarDay, time), zone);
    }

    /**
     * Seconds since the broadcast day started; orders "23:30" before "01:00".
     */
    public static int offsetInBroadcastDay(String clock, int dayStartHour) {
        LocalTime time = parseClock(clock);
        int seconds = time.toSecondOfDay() - dayStartHour * 3600;
        return seconds < 0 ? seconds + 24 * 3600 : seconds;
    }

    public static boolean isGridAligned(String clock, int gridMinutes) {
        LocalTime time = parseClock(clock);
        return time.getSecond() == 0 && time.getMinute() % gridMinutes == 0;
    }

    public static int gridCeil(int durationSec, int gridSeconds) {
        int slots = Math.max(1, (durationSec + gridSeconds - 1) / gridSeconds);
        return slots * gridSeconds;
    }
}
