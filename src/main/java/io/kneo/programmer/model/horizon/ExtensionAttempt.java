package io.kneo.programmer.model.horizon;

import java.time.LocalDate;

public record ExtensionAttempt(long timestampUtcMs,
                               ExtensionReason reasonCode,
                               ExtensionTrigger triggeredBy,
                               LocalDate broadcastDate,
                               boolean success,
                               String errorCode) {

    public static ExtensionAttempt succeeded(long timestampUtcMs, ExtensionReason reason, LocalDate broadcastDate) {
        return new ExtensionAttempt(timestampUtcMs, reason, ExtensionTrigger.SCHED_MGR_POLICY, broadcastDate, true, null);
    }

    public static ExtensionAttempt failed(long timestampUtcMs, ExtensionReason reason, LocalDate broadcastDate,
                                          String errorCode) {
        return new ExtensionAttempt(timestampUtcMs, reason, ExtensionTrigger.SCHED_MGR_POLICY, broadcastDate, false, errorCode);
    }
}
