package io.kneo.programmer.model.horizon;

public record HorizonHealthReport(String channelId,
                                  long evaluatedAtUtcMs,
                                  double epgDepthHours,
                                  double executionDepthHours,
                                  int minEpgDays,
                                  int minExecutionHours,
                                  boolean epgCompliant,
                                  boolean executionCompliant,
                                  boolean coverageCompliant,
                                  boolean proactiveExtensionTriggered,
                                  long extensionAttemptCount,
                                  long extensionSuccessCount,
                                  long extensionFailureCount,
                                  long extensionForbiddenTriggerCount,
                                  long epgFailureCount,
                                  long lastEvaluationUtcMs) {
}
