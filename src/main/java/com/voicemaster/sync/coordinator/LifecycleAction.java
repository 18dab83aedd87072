package com.voicemaster.sync.coordinator;

/**
 * What the coordinator did in response to one side of a membership event or a teardown request.
 */
public enum LifecycleAction {
    CREATED,
    MOVED_TO_EXISTING,
    /** Join inside the debounce window of an existing channel; treated as a redelivery. */
    DUPLICATE_IGNORED,
    TORN_DOWN,
    STILL_OCCUPIED,
    /** Row removed because the platform no longer has the channel. */
    PRUNED,
    /** Event did not concern an incubator or a tracked channel, or the row was already gone. */
    IGNORED
}
