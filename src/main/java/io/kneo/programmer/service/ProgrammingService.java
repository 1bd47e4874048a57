package io.kneo.programmer.service;

import io.kneo.programmer.config.ProgrammerConfig;
import io.kneo.programmer.model.schedule.ScheduleOutput;
import io.kneo.programmer.service.catalog.CatalogService;
import io.kneo.programmer.service.compiler.CompileOptions;
import io.kneo.programmer.service.compiler.DslParser;
import io.kneo.programmer.service.compiler.ScheduleCompiler;
import io.kneo.programmer.service.exceptions.ChannelNotFoundException;
import io.kneo.programmer.service.exceptions.CompileError;
import io.kneo.programmer.util.ChannelActivityLogger;
import io.kneo.programmer.util.ResourceUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

@ApplicationScoped
public class ProgrammingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgrammingService.class);
    private static final String INLINE_SOURCE = "<request>";

    private final ScheduleCompiler compiler = new ScheduleCompiler();

    @Inject
    ProgrammerConfig config;

    @Inject
    CatalogService catalogService;

    /**
     * Compiles the configured definition of a channel for one broadcast day. The seed is derived
     * from the configured default and the date, so a day always compiles to the same schedule.
     */
    public ScheduleOutput compileDay(String channelId, LocalDate broadcastDay) {
        String dslPath = dslPath(channelId);
        Map<String, Object> definition = loadDefinition(dslPath);
        CompileOptions options = CompileOptions.builder()
                .dslPath(dslPath)
                .gitCommit(config.getGitCommit())
                .seed(config.getDefaultSeed() + broadcastDay.toEpochDay())
                .dayStartHour(config.getProgrammingDayStartHour())
                .broadcastDay(broadcastDay)
                .build();
        ScheduleOutput schedule = compiler.compile(definition, catalogService.getResolver(), options);
        ChannelActivityLogger.logActivity(channelId, "compile", "Compiled %s: %d blocks, %s",
                broadcastDay, schedule.programBlocks().size(), schedule.hash());
        return schedule;
    }

    /**
     * The timezone the channel's definition compiles its days in.
     *
     * @throws CompileError if the definition cannot be read or names no valid zone
     */
    public ZoneId channelZone(String channelId) {
        Object timezone = loadDefinition(dslPath(channelId)).get("timezone");
        if (timezone == null) {
            throw new CompileError("Schedule definition of " + channelId + " has no timezone");
        }
        try {
            return ZoneId.of(timezone.toString());
        } catch (DateTimeException e) {
            throw new CompileError("Invalid timezone " + timezone + " for " + channelId, e);
        }
    }

    public ScheduleOutput compileDefinition(String definitionYaml) {
        CompileOptions options = CompileOptions.builder()
                .dslPath(INLINE_SOURCE)
                .gitCommit(config.getGitCommit())
                .seed(config.getDefaultSeed())
                .dayStartHour(config.getProgrammingDayStartHour())
                .build();
        ScheduleOutput schedule = compiler.compile(definitionYaml, catalogService.getResolver(), options);
        LOGGER.info("Compiled posted definition for {} on {}: {}", schedule.channelId(), schedule.broadcastDay(),
                schedule.hash());
        return schedule;
    }

    private String dslPath(String channelId) {
        ProgrammerConfig.ChannelSettings settings = config.getChannels().get(channelId);
        if (settings == null) {
            throw new ChannelNotFoundException(channelId);
        }
        return settings.getDslPath();
    }

    private static Map<String, Object> loadDefinition(String dslPath) {
        try {
            return DslParser.parse(ResourceUtil.loadAsString(dslPath));
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new CompileError("Cannot read schedule definition " + dslPath, e);
        }
    }
}
