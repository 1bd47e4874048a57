package io.kneo.programmer.service.compiler;

import io.kneo.programmer.model.schedule.ChannelTemplate;
import io.kneo.programmer.model.schedule.ProgramBlockOutput;
import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.model.schedule.ScheduleSource;
import io.kneo.programmer.service.catalog.AssetResolver;
import io.kneo.programmer.service.exceptions.AssetNotFoundException;
import io.kneo.programmer.service.exceptions.AssetResolutionError;
import io.kneo.programmer.service.exceptions.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a schedule definition into one broadcast day of program blocks. Holds no state between
 * calls; everything mutable lives in the {@link CompileContext} of a single call, so concurrent
 * compiles only need their own resolver snapshot and counter map.
 */
public class ScheduleCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleCompiler.class);
    public static final String COMPILER_VERSION = "2.0.0";

    private final BlockCompilerRegistry compilers;

    public ScheduleCompiler() {
        this(BlockCompilerRegistry.defaults());
    }

    public ScheduleCompiler(BlockCompilerRegistry compilers) {
        this.compilers = compilers;
    }

    public ScheduleOutput compile(String definitionYaml, AssetResolver resolver, CompileOptions options) {
        return compile(DslParser.parse(definitionYaml), resolver, options);
    }

    public ScheduleOutput compile(Map<String, Object> definition, AssetResolver resolver, CompileOptions options) {
        Map<String, Object> dsl = new LinkedHashMap<>(definition);
        if (options.broadcastDay() != null) {
            dsl.put("broadcast_day", options.broadcastDay().toString());
        }
        PoolRegistry pools = PoolRegistry.fromDsl(resolver, DslValues.map(dsl, "pools"));
        new DefinitionValidator(pools).validate(dsl);

        String channelId = dsl.get("channel").toString();
        LocalDate broadcastDay = LocalDate.parse(dsl.get("broadcast_day").toString());
        String timezone = dsl.get("timezone").toString();
        ChannelTemplate template = ChannelTemplate.fromDsl(dsl.get("template"));
        Map<String, Integer> counters = options.sequentialCounters() != null
                ? options.sequentialCounters() : new HashMap<>();
        CompileContext ctx = new CompileContext(channelId, broadcastDay, ZoneId.of(timezone), template,
                options.dayStartHour(), options.seed(), counters, pools, resolver);

        List<String> errors = new ArrayList<>();
        List<Map<String, Object>> fragments = LayerResolver.resolveDay(DslValues.map(dsl, "schedule"),
                DslValues.map(dsl, "templates"), broadcastDay, options.dayStartHour(), errors);
        if (!errors.isEmpty()) {
            throw new ValidationError(errors);
        }

        List<ProgramBlockOutput> blocks = new ArrayList<>();
        for (Map<String, Object> fragment : fragments) {
            BlockKind kind = BlockKind.of(fragment);
            try {
                blocks.addAll(compilers.getCompiler(kind).compile(fragment, ctx));
            } catch (AssetNotFoundException e) {
                throw new AssetResolutionError(String.format("%s at %s: %s", kind, BlockKind.start(fragment), e.getMessage()));
            }
        }

        List<ProgramBlockOutput> utc = blocks.stream()
                .map(b -> b.withStartAt(b.startAt().withOffsetSameInstant(ZoneOffset.UTC)))
                .sorted(Comparator.comparing(ProgramBlockOutput::startAt))
                .toList();
        GridValidator.validateGridAlignment(utc, template.getGridSeconds());
        List<ProgramBlockOutput> compacted = GridValidator.compact(utc);
        GridValidator.validateGridAlignment(compacted, template.getGridSeconds());

        ScheduleSource source = new ScheduleSource(options.dslPath(), options.gitCommit(), COMPILER_VERSION);
        ScheduleOutput unhashed = new ScheduleOutput(ScheduleOutput.SCHEMA_VERSION, channelId, broadcastDay.toString(),
                timezone, source, compacted, dsl.get("notes"), null);
        String hash = ScheduleHasher.hash(unhashed.toHashableMap());
        LOGGER.debug("Compiled {} for {}: {} blocks, {}", channelId, broadcastDay, compacted.size(), hash);
        return new ScheduleOutput(unhashed.version(), channelId, unhashed.broadcastDay(), timezone, source,
                compacted, unhashed.notes(), hash);
    }
}
