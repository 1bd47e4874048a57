package io.kneo.programmer.service.compiler;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Template expansion and day-of-week layer merge. Layers are applied lowest precedence first
 * ({@code all_day}, then {@code weekdays}/{@code weekends}, then the day name) and a later
 * layer replaces only the fragments whose start time it redeclares.
 */
public final class LayerResolver {
    public static final String ALL_DAY = "all_day";
    public static final String WEEKDAYS = "weekdays";
    public static final String WEEKENDS = "weekends";
    public static final String USE_KEY = "use";
    private static final int MAX_TEMPLATE_DEPTH = 8;

    public static final Set<String> SCHEDULE_KEYS = Set.of(ALL_DAY, WEEKDAYS, WEEKENDS,
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private LayerResolver() {
    }

    public static String dayName(DayOfWeek day) {
        return day.name().toLowerCase(Locale.ROOT);
    }

    public static String dayGroup(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? WEEKENDS : WEEKDAYS;
    }

    /**
     * Turns a layer value into a flat fragment list, replacing {@code {use: name}} with the named
     * template. Problems are appended to {@code errors}.
     */
    public static List<Map<String, Object>> expand(Object layer, Map<String, Object> templates, List<String> errors) {
        List<Map<String, Object>> out = new ArrayList<>();
        expandInto(layer, templates, errors, out, 0);
        return out;
    }

    private static void expandInto(Object node, Map<String, Object> templates, List<String> errors,
                                   List<Map<String, Object>> out, int depth) {
        if (node == null) {
            return;
        }
        if (depth > MAX_TEMPLATE_DEPTH) {
            errors.add("Template nesting too deep (cycle?)");
            return;
        }
        if (node instanceof List<?> items) {
            for (Object item : items) {
                expandInto(item, templates, errors, out, depth);
            }
            return;
        }
        Map<String, Object> fragment = DslValues.map(node);
        if (fragment.isEmpty()) {
            errors.add("Schedule entry is not a mapping: " + node);
            return;
        }
        String use = DslValues.string(fragment, USE_KEY);
        if (use != null && fragment.size() == 1) {
            if (!templates.containsKey(use)) {
                errors.add("Unknown template: " + use);
                return;
            }
            expandInto(templates.get(use), templates, errors, out, depth + 1);
            return;
        }
        out.add(fragment);
    }

    public static List<Map<String, Object>> resolveDay(Map<String, Object> schedule, Map<String, Object> templates,
                                                       LocalDate broadcastDay, int dayStartHour, List<String> errors) {
        DayOfWeek dow = broadcastDay.getDayOfWeek();
        Map<LocalTime, Map<String, Object>> merged = new LinkedHashMap<>();
        for (String layerKey : List.of(ALL_DAY, dayGroup(dow), dayName(dow))) {
            for (Map<String, Object> fragment : expand(schedule.get(layerKey), templates, errors)) {
                String start = BlockKind.start(fragment);
                if (!BroadcastTimes.isClock(start)) {
                    errors.add(String.format("Fragment in '%s' has no valid start time: %s", layerKey, start));
                    continue;
                }
                merged.put(BroadcastTimes.parseClock(start), fragment);
            }
        }
        List<Map<String, Object>> ordered = new ArrayList<>(merged.values());
        ordered.sort(Comparator.comparingInt(f -> BroadcastTimes.offsetInBroadcastDay(BlockKind.start(f), dayStartHour)));
        return ordered;
    }
}
