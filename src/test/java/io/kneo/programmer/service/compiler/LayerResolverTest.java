package io.kneo.programmer.service.compiler;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LayerResolverTest {

    private static Map<String, Object> slot(String start, String program) {
        return Map.of("start", start, "slots", List.of(Map.of("program", program)));
    }

    private static List<String> programs(List<Map<String, Object>> fragments) {
        List<String> out = new ArrayList<>();
        for (Map<String, Object> fragment : fragments) {
            List<?> slots = (List<?>) fragment.get("slots");
            out.add(((Map<?, ?>) slots.get(0)).get("program").toString());
        }
        return out;
    }

    @Test
    void testPrecedenceIsAllDayThenGroupThenDayName() {
        Map<String, Object> schedule = Map.of(
                "all_day", List.of(slot("06:00", "base-6"), slot("07:00", "base-7"), slot("08:00", "base-8")),
                "weekdays", List.of(slot("07:00", "weekday-7"), slot("8:00", "weekday-8")),
                "wednesday", List.of(slot("08:00", "wednesday-8")));
        List<String> errors = new ArrayList<>();

        List<Map<String, Object>> day = LayerResolver.resolveDay(schedule, Map.of(), LocalDate.of(2025, 1, 8), 6, errors);

        assertTrue(errors.isEmpty(), errors::toString);
        assertEquals(List.of("base-6", "weekday-7", "wednesday-8"), programs(day));
    }

    @Test
    void testAfterMidnightSortsAtTheEndOfTheBroadcastDay() {
        Map<String, Object> schedule = Map.of("all_day",
                List.of(slot("01:00", "late"), slot("23:30", "night"), slot("06:00", "morning")));

        List<Map<String, Object>> day = LayerResolver.resolveDay(schedule, Map.of(), LocalDate.of(2025, 1, 8), 6,
                new ArrayList<>());

        assertEquals(List.of("morning", "night", "late"), programs(day));
    }

    @Test
    void testTemplatesExpandAtDayLevelAndInsideLists() {
        Map<String, Object> templates = Map.of(
                "morning", List.of(slot("06:00", "m-6"), slot("06:30", "m-630")),
                "evening", slot("19:00", "e-19"));
        Map<String, Object> schedule = Map.of(
                "all_day", Map.of("use", "morning"),
                "saturday", List.of(Map.of("use", "evening"), slot("20:00", "s-20")));

        List<Map<String, Object>> day = LayerResolver.resolveDay(schedule, templates, LocalDate.of(2025, 1, 11), 6,
                new ArrayList<>());

        assertEquals(List.of("m-6", "m-630", "e-19", "s-20"), programs(day));
    }

    @Test
    void testUnknownTemplateIsReported() {
        List<String> errors = new ArrayList<>();

        List<Map<String, Object>> fragments = LayerResolver.expand(List.of(Map.of("use", "missing")), Map.of(), errors);

        assertTrue(fragments.isEmpty());
        assertEquals(List.of("Unknown template: missing"), errors);
    }

    @Test
    void testSelfReferencingTemplateStops() {
        List<String> errors = new ArrayList<>();

        LayerResolver.expand(Map.of("use", "loop"), Map.of("loop", Map.of("use", "loop")), errors);

        assertEquals(1, errors.size());
    }
}
