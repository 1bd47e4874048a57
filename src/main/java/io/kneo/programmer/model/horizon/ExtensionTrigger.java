package io.kneo.programmer.model.horizon;

/**
 * Who asked for a horizon extension. Only {@link #SCHED_MGR_POLICY} may cause one;
 * the other values exist so that forbidden requests can be named and counted.
 */
public enum ExtensionTrigger {
    SCHED_MGR_POLICY,
    CHANNEL_MANAGER,
    PLAYOUT_CONSUMER,
    OPERATOR
}
