package io.kneo.programmer.service.horizon;

import io.kneo.programmer.model.horizon.ExecutionDayResult;
import io.kneo.programmer.model.horizon.ExtensionAttempt;
import io.kneo.programmer.model.horizon.ExtensionReason;
import io.kneo.programmer.model.horizon.ExtensionTrigger;
import io.kneo.programmer.model.horizon.HorizonHealthReport;
import io.kneo.programmer.service.exceptions.PipelineException;
import io.kneo.programmer.util.ChannelActivityLogger;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps EPG and execution coverage of one channel at or above the policy minimums. Driven by
 * an external caller through {@link #evaluateOnce()}; calls must not overlap.
 * <p>
 * Extension failures never escape: they are recorded as failed attempts and show up as
 * non-compliance in the health report. Broadcast days are cut in the channel's own zone.
 * <p>
 * The health report, counters and attempt history may be read from other threads while an
 * evaluation runs.
 */
public class HorizonManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(HorizonManager.class);
    public static final long HOUR_MS = 3_600_000L;
    static final int MAX_EXTENSION_DAYS = 30;
    static final int MAX_RECORDED_ATTEMPTS = 500;

    @Getter
    private final String channelId;
    private final ScheduleExtender scheduleExtender;
    private final ExecutionExtender executionExtender;
    private final MasterClock clock;
    @Getter
    private final HorizonPolicy policy;
    private final ExecutionWindowStore store;

    private volatile LocalDate epgFarthestDate;
    @Getter
    private volatile long executionWindowEndUtcMs;
    @Getter
    private volatile long lastEvaluationUtcMs;
    private LocalDate lastBroadcastDate;
    @Getter
    private volatile boolean proactiveExtensionTriggered;

    private final Deque<ExtensionAttempt> attempts = new ArrayDeque<>();
    private final AtomicLong extensionAttemptCount = new AtomicLong();
    private final AtomicLong extensionSuccessCount = new AtomicLong();
    private final AtomicLong extensionFailureCount = new AtomicLong();
    private final AtomicLong extensionForbiddenTriggerCount = new AtomicLong();
    private final AtomicLong epgFailureCount = new AtomicLong();

    public HorizonManager(String channelId, ScheduleExtender scheduleExtender, ExecutionExtender executionExtender,
                          MasterClock clock, HorizonPolicy policy, ExecutionWindowStore store) {
        this.channelId = channelId;
        this.scheduleExtender = scheduleExtender;
        this.executionExtender = executionExtender;
        this.clock = clock;
        this.policy = policy;
        this.store = store;
    }

    public HorizonManager(String channelId, ScheduleExtender scheduleExtender, ExecutionExtender executionExtender,
                          MasterClock clock, HorizonPolicy policy) {
        this(channelId, scheduleExtender, executionExtender, clock, policy, null);
    }

    public void evaluateOnce() {
        long nowMs = clock.nowUtcMillis();
        LocalDate currentDate = broadcastDateFor(nowMs);
        boolean dayRolled = lastBroadcastDate != null && !lastBroadcastDate.equals(currentDate);
        lastEvaluationUtcMs = nowMs;
        lastBroadcastDate = currentDate;

        boolean extended = false;
        if (getEpgWindowEndUtcMs() - nowMs < policy.minEpgMs()) {
            extendEpg(currentDate, nowMs);
            extended = true;
        }

        long depthMs = executionWindowEndUtcMs - nowMs;
        boolean belowMinimum = depthMs < policy.minExecutionMs();
        proactiveExtensionTriggered = !belowMinimum
                && policy.proactiveThresholdMs() > 0
                && depthMs <= policy.proactiveThresholdMs();
        if (belowMinimum || proactiveExtensionTriggered) {
            ExtensionReason reason;
            if (proactiveExtensionTriggered) {
                reason = ExtensionReason.REASON_PROACTIVE_EXTEND;
            } else {
                reason = dayRolled ? ExtensionReason.DAILY_ROLL : ExtensionReason.REASON_TIME_THRESHOLD;
            }
            extendExecution(currentDate, nowMs, reason);
            extended = true;
        }

        if (extended) {
            LOGGER.info("Horizon {}: epg={}h exec={}h min_epg={}d min_exec={}h", channelId,
                    String.format("%.1f", hours(getEpgWindowEndUtcMs() - nowMs)),
                    String.format("%.1f", hours(executionWindowEndUtcMs - nowMs)),
                    policy.minEpgDays(), policy.minExecutionHours());
        }
    }

    /**
     * Extension on behalf of someone other than the policy loop is refused and counted.
     *
     * @return true when the request came from the policy and an evaluation ran
     */
    public boolean requestExtension(ExtensionTrigger trigger) {
        if (trigger != ExtensionTrigger.SCHED_MGR_POLICY) {
            extensionForbiddenTriggerCount.incrementAndGet();
            ChannelActivityLogger.logFailure(channelId, "forbidden_trigger",
                    "Extension requested by %s refused", trigger);
            return false;
        }
        evaluateOnce();
        return true;
    }

    /**
     * Seeds the execution window end, e.g. after a restart with pre-generated coverage.
     */
    public void primeExecutionWindow(long endUtcMs) {
        executionWindowEndUtcMs = endUtcMs;
    }

    public long getEpgWindowEndUtcMs() {
        return epgFarthestDate == null ? 0 : dayEndUtcMs(epgFarthestDate);
    }

    public double getEpgDepthHours() {
        return Math.max(0.0, hours(getEpgWindowEndUtcMs() - clock.nowUtcMillis()));
    }

    public double getExecutionDepthHours() {
        return Math.max(0.0, hours(executionWindowEndUtcMs - clock.nowUtcMillis()));
    }

    /**
     * The most recent attempts, oldest first; at most {@value #MAX_RECORDED_ATTEMPTS} are kept.
     */
    public List<ExtensionAttempt> getAttempts() {
        synchronized (attempts) {
            return List.copyOf(attempts);
        }
    }

    public long getExtensionAttemptCount() {
        return extensionAttemptCount.get();
    }

    public long getExtensionSuccessCount() {
        return extensionSuccessCount.get();
    }

    public long getExtensionFailureCount() {
        return extensionFailureCount.get();
    }

    public long getExtensionForbiddenTriggerCount() {
        return extensionForbiddenTriggerCount.get();
    }

    public long getEpgFailureCount() {
        return epgFailureCount.get();
    }

    public HorizonHealthReport getHealthReport() {
        long nowMs = clock.nowUtcMillis();
        long windowEndMs = executionWindowEndUtcMs;
        long epgDepthMs = getEpgWindowEndUtcMs() - nowMs;
        long execDepthMs = windowEndMs - nowMs;
        boolean generated = store != null && !store.entries().isEmpty();
        boolean coverage = !generated || store.isContiguous(nowMs, Math.min(windowEndMs, store.windowEnd()));
        // the minimum must be playable from now, not just reached by the window end
        boolean playable = !generated || store.isContiguous(nowMs, nowMs + policy.minExecutionMs());
        return new HorizonHealthReport(
                channelId,
                nowMs,
                Math.max(0.0, hours(epgDepthMs)),
                Math.max(0.0, hours(execDepthMs)),
                policy.minEpgDays(),
                policy.minExecutionHours(),
                epgDepthMs >= policy.minEpgMs(),
                execDepthMs >= policy.minExecutionMs() && playable,
                coverage,
                proactiveExtensionTriggered,
                getExtensionAttemptCount(),
                getExtensionSuccessCount(),
                getExtensionFailureCount(),
                getExtensionForbiddenTriggerCount(),
                getEpgFailureCount(),
                lastEvaluationUtcMs);
    }

    LocalDate broadcastDateFor(long utcMs) {
        LocalDateTime t = LocalDateTime.ofInstant(Instant.ofEpochMilli(utcMs), policy.zone());
        return t.getHour() < policy.dayStartHour() ? t.toLocalDate().minusDays(1) : t.toLocalDate();
    }

    long dayEndUtcMs(LocalDate broadcastDate) {
        return broadcastDate.plusDays(1)
                .atTime(policy.dayStartHour(), 0)
                .atZone(policy.zone())
                .toInstant()
                .toEpochMilli();
    }

    private void extendEpg(LocalDate currentDate, long nowMs) {
        long targetEndMs = nowMs + policy.minEpgMs();
        LocalDate next = epgFarthestDate == null ? currentDate : epgFarthestDate.plusDays(1);
        int days = 0;
        while (getEpgWindowEndUtcMs() < targetEndMs && days < MAX_EXTENSION_DAYS) {
            try {
                if (!scheduleExtender.epgDayExists(next)) {
                    ChannelActivityLogger.logActivity(channelId, "extend_epg", "Extending EPG to %s", next);
                    scheduleExtender.extendEpgDay(next);
                }
            } catch (RuntimeException e) {
                epgFailureCount.incrementAndGet();
                ChannelActivityLogger.logFailure(channelId, "extend_epg", "EPG extension for %s failed: %s",
                        next, e.getMessage());
                LOGGER.debug("EPG extension failure detail", e);
                return;
            }
            epgFarthestDate = next;
            next = next.plusDays(1);
            days++;
        }
    }

    private void extendExecution(LocalDate currentDate, long nowMs, ExtensionReason reason) {
        long targetEndMs = nowMs + Math.max(policy.minExecutionMs(), policy.proactiveThresholdMs());
        LocalDate next;
        if (executionWindowEndUtcMs > 0) {
            next = broadcastDateFor(executionWindowEndUtcMs);
            if (dayEndUtcMs(next) <= executionWindowEndUtcMs) {
                next = next.plusDays(1);
            }
        } else {
            next = currentDate;
        }

        int days = 0;
        do {
            ChannelActivityLogger.logActivity(channelId, "extend_execution", "Extending execution to %s (%s)",
                    next, reason);
            extensionAttemptCount.incrementAndGet();
            try {
                ExecutionDayResult result = executionExtender.extendExecutionDay(next);
                if (store != null && !result.entries().isEmpty()) {
                    store.addEntries(result.entries());
                }
                if (result.endUtcMs() > executionWindowEndUtcMs) {
                    executionWindowEndUtcMs = result.endUtcMs();
                }
                extensionSuccessCount.incrementAndGet();
                record(ExtensionAttempt.succeeded(nowMs, reason, next));
            } catch (PipelineException e) {
                recordFailure(nowMs, reason, next, e.getErrorCode(), e);
                return;
            } catch (RuntimeException e) {
                recordFailure(nowMs, reason, next, PipelineException.UNEXPECTED_FAILURE, e);
                return;
            }
            next = next.plusDays(1);
            days++;
        } while (executionWindowEndUtcMs < targetEndMs && days < MAX_EXTENSION_DAYS);
    }

    private void recordFailure(long nowMs, ExtensionReason reason, LocalDate date, String errorCode, Exception e) {
        extensionFailureCount.incrementAndGet();
        record(ExtensionAttempt.failed(nowMs, reason, date, errorCode));
        ChannelActivityLogger.logFailure(channelId, "extend_execution", "Execution extension for %s failed with %s: %s",
                date, errorCode, e.getMessage());
        if (PipelineException.UNEXPECTED_FAILURE.equals(errorCode)) {
            LOGGER.error("Unexpected failure extending execution for {} on {}", channelId, date, e);
        }
    }

    private void record(ExtensionAttempt attempt) {
        synchronized (attempts) {
            if (attempts.size() == MAX_RECORDED_ATTEMPTS) {
                attempts.removeFirst();
            }
            attempts.addLast(attempt);
        }
    }

    private static double hours(long ms) {
        return ms / (double) HOUR_MS;
    }
}
