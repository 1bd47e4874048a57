package io.kneo.programmer.model.horizon;

public enum ExtensionReason {
    REASON_TIME_THRESHOLD,
    DAILY_ROLL,
    REASON_PROACTIVE_EXTEND
}
