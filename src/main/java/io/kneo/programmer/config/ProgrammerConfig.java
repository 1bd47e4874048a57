package io.kneo.programmer.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Map;
import java.util.Optional;

@ConfigMapping(prefix = "programmer")
public interface ProgrammerConfig {

    @WithName("catalog.snapshot-path")
    Optional<String> getCatalogSnapshotPath();

    @WithName("programming-day-start-hour")
    @WithDefault("6")
    int getProgrammingDayStartHour();

    @WithName("compile.default-seed")
    @WithDefault("42")
    long getDefaultSeed();

    @WithName("compile.git-commit")
    @WithDefault("0000000")
    String getGitCommit();

    @WithName("horizon.min-epg-days")
    @WithDefault("3")
    int getMinEpgDays();

    @WithName("horizon.min-execution-hours")
    @WithDefault("6")
    int getMinExecutionHours();

    @WithName("horizon.proactive-extend-threshold-minutes")
    @WithDefault("0")
    int getProactiveExtendThresholdMinutes();

    @WithName("horizon.evaluation-interval")
    @WithDefault("10s")
    String getEvaluationInterval();

    @WithName("channels")
    Map<String, ChannelSettings> getChannels();

    interface ChannelSettings {
        @WithName("dsl-path")
        String getDslPath();

        @WithName("enabled")
        @WithDefault("true")
        boolean isEnabled();
    }
}
