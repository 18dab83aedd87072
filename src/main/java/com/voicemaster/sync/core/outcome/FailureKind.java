package com.voicemaster.sync.core.outcome;

/**
 * Typed failure reasons returned to callers of the coordinator.
 *
 * <p>Except for {@link #STORE_UNAVAILABLE} after a successful platform call, none of these
 * leave a partial durable write behind.</p>
 */
public enum FailureKind {

    /** Bad user input; nothing was changed. */
    INVALID_VALUE,

    NOT_OWNER,
    NOT_OWNERLESS,
    NOT_PRESENT,
    NOT_TRACKED,

    /** The guild has no configuration yet ({@code setup} has not run). */
    NOT_CONFIGURED,

    /** An admin change would break the incubator-inside-category rule. */
    INVALID_CONFIGURATION,

    /** The per-channel or per-guild section could not be entered in time; safe to retry. */
    BUSY,

    PLATFORM_UNAVAILABLE,
    FORBIDDEN,

    /** The durable layer failed. Platform side effects already issued are not rolled back. */
    STORE_UNAVAILABLE
}
