package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ChannelTemplate;
import io.kneo.programmer.model.schedule.PoolDefinition;
import io.kneo.programmer.service.catalog.RangeExpander;
import io.kneo.programmer.service.exceptions.ValidationError;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks over a parsed definition. Every problem found is reported together in one
 * {@link ValidationError}; nothing is compiled from an invalid definition.
 */
public class DefinitionValidator {
    static final List<String> REQUIRED_FIELDS = List.of("channel", "broadcast_day", "timezone", "schedule");
    static final List<String> RANGE_MATCH_KEYS = List.of("season", "episode", "year");
    static final List<String> INTEGER_MATCH_KEYS = List.of("max_duration_sec", "min_duration_sec");

    private final PoolRegistry pools;

    public DefinitionValidator(PoolRegistry pools) {
        this.pools = pools;
    }

    public void validate(Map<String, Object> dsl) {
        List<String> errors = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (dsl.get(field) == null) {
                errors.add("Missing required field: " + field);
            }
        }
        Object day = dsl.get("broadcast_day");
        if (day != null) {
            try {
                LocalDate.parse(day.toString());
            } catch (DateTimeParseException e) {
                errors.add("broadcast_day is not an ISO date: " + day);
            }
        }
        Object tz = dsl.get("timezone");
        if (tz != null) {
            try {
                ZoneId.of(tz.toString());
            } catch (DateTimeException e) {
                errors.add("Unknown timezone: " + tz);
            }
        }
        Object templateName = dsl.get("template");
        if (templateName != null && !ChannelTemplate.isKnown(templateName.toString())) {
            errors.add("Unknown channel template: " + templateName);
        }
        ChannelTemplate template = ChannelTemplate.fromDsl(templateName);

        Object poolsNode = dsl.get("pools");
        if (poolsNode != null && !(poolsNode instanceof Map)) {
            errors.add("pools must be a mapping");
        }
        DslValues.map(poolsNode).forEach((name, raw) -> checkPoolMatch(name, PoolDefinition.fromDsl(raw), errors));
        Object templatesNode = dsl.get("templates");
        if (templatesNode != null && !(templatesNode instanceof Map)) {
            errors.add("templates must be a mapping");
        }
        Map<String, Object> templates = DslValues.map(templatesNode);

        Object scheduleNode = dsl.get("schedule");
        if (scheduleNode != null && !(scheduleNode instanceof Map)) {
            errors.add("schedule must be a mapping");
        }
        Map<String, Object> schedule = DslValues.map(scheduleNode);
        for (Map.Entry<String, Object> layer : schedule.entrySet()) {
            if (!LayerResolver.SCHEDULE_KEYS.contains(layer.getKey())) {
                errors.add("Unknown schedule key: " + layer.getKey());
                continue;
            }
            for (Map<String, Object> fragment : LayerResolver.expand(layer.getValue(), templates, errors)) {
                checkFragment(layer.getKey(), fragment, template, errors);
            }
        }
        for (Map.Entry<String, Object> named : templates.entrySet()) {
            for (Map<String, Object> fragment : LayerResolver.expand(named.getValue(), templates, errors)) {
                checkFragment("template " + named.getKey(), fragment, template, errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationError(new ArrayList<>(new LinkedHashSet<>(errors)));
        }
    }

    private void checkFragment(String where, Map<String, Object> fragment, ChannelTemplate template, List<String> errors) {
        BlockKind kind = BlockKind.of(fragment);
        if (kind == null) {
            errors.add(String.format("%s: unrecognised block fragment %s", where, fragment.keySet()));
            return;
        }
        String start = BlockKind.start(fragment);
        if (!BroadcastTimes.isClock(start)) {
            errors.add(String.format("%s: block has no valid start time (%s)", where, start));
        } else if (!BroadcastTimes.isGridAligned(start, template.getGridMinutes())) {
            errors.add(String.format("%s: start %s is not aligned to the %d-minute grid of %s",
                    where, start, template.getGridMinutes(), template.getDslName()));
        }
        collect(String.format("%s: block at %s", where, start), errors,
                () -> checkBody(where, kind, start, fragment, errors));
    }

    private void checkBody(String where, BlockKind kind, String start, Map<String, Object> fragment, List<String> errors) {
        Map<String, Object> body = BlockKind.body(fragment);
        switch (kind) {
            case EPISODE_BLOCK -> checkSlots(where, start, fragment, errors);
            case MOVIE_BLOCK -> checkPools(where, MovieCriteria.fromSelector(MovieBlockCompiler.selectorOf(fragment)).pools(), errors);
            case MOVIE_MARATHON -> {
                String end = DslValues.string(body, "end");
                if (!BroadcastTimes.isClock(end)) {
                    errors.add(String.format("%s: movie_marathon at %s needs an end time", where, start));
                }
                checkPools(where, MovieCriteria.fromSelector(DslValues.map(body, BlockKind.MOVIE_SELECTOR_KEY)).pools(), errors);
            }
            case POOL_BLOCK -> {
                String end = DslValues.string(body, "end");
                if (end != null && !BroadcastTimes.isClock(end)) {
                    errors.add(String.format("%s: block at %s has an invalid end time %s", where, start, end));
                }
                String at = String.format("%s: block at %s", where, start);
                collect(at, errors, () -> DslValues.longValue(body, "seed"));
                collect(at, errors, () -> checkPools(where,
                        PoolBlockCompiler.pools(body).stream().map(PoolBlockCompiler.WeightedPool::name).toList(), errors));
            }
        }
    }

    private void checkSlots(String where, String start, Map<String, Object> fragment, List<String> errors) {
        List<Object> slots = DslValues.list(fragment.get(BlockKind.SLOTS_KEY));
        Set<String> referenced = new LinkedHashSet<>();
        for (int i = 0; i < slots.size(); i++) {
            Map<String, Object> slot = DslValues.map(slots.get(i));
            Map<String, Object> selector = DslValues.map(slot, EpisodeBlockCompiler.EPISODE_SELECTOR_KEY);
            if (!selector.isEmpty()) {
                String pool = DslValues.string(selector, "pool", DslValues.string(selector, "collection"));
                if (pool == null) {
                    errors.add(String.format("%s: slot %d at %s has an episode_selector without pool or collection", where, i, start));
                } else {
                    referenced.add(pool);
                }
                collect(String.format("%s: slot %d at %s", where, i, start), errors,
                        () -> DslValues.longValue(selector, "seed"));
            } else if (slot.get("program") == null) {
                errors.add(String.format("%s: slot %d at %s has neither program nor episode_selector", where, i, start));
            }
        }
        if (!referenced.isEmpty()) {
            checkPools(where, List.copyOf(referenced), errors);
        }
    }

    private static void checkPoolMatch(String name, PoolDefinition pool, List<String> errors) {
        for (String key : RANGE_MATCH_KEYS) {
            try {
                RangeExpander.expand(pool.match().get(key));
            } catch (IllegalArgumentException e) {
                errors.add(String.format("pool '%s': %s: %s", name, key, e.getMessage()));
            }
        }
        for (String key : INTEGER_MATCH_KEYS) {
            collect(String.format("pool '%s'", name), errors, () -> DslValues.integer(pool.match(), key));
        }
    }

    /**
     * Runs a check that reads typed values, turning malformed ones into collected errors.
     */
    private static void collect(String at, List<String> errors, Runnable check) {
        try {
            check.run();
        } catch (ValidationError e) {
            e.getErrors().forEach(message -> errors.add(at + ": " + message));
        }
    }

    private void checkPools(String where, List<String> names, List<String> errors) {
        if (names.isEmpty()) {
            errors.add(where + ": selector names no pool or collection");
        }
        for (String name : names) {
            if (name == null || !pools.isKnown(name)) {
                errors.add(String.format("%s: unknown pool or collection '%s'", where, name));
            }
        }
    }
}
