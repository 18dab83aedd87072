package com.voicemaster.sync.core.model;

/**
 * =====================================================================
 * AuditEventType
 * =====================================================================
 *
 * Closed set of audit kinds. The enum name is what gets stored in
 * {@code audit_entry.event_type}, so constants must never be renamed.
 */
public enum AuditEventType {

    // Admin configuration
    BOT_SETUP,
    SETUP_REPAIRED,
    SETUP_ERROR,
    CHANNEL_RENAMED,
    CATEGORY_RENAMED,
    CREATION_CHANNEL_CHANGED,
    VOICE_CATEGORY_CHANGED,
    GUILD_DEFAULTS_CHANGED,
    CLEANUP_STATE_CHANGED,

    // Member commands
    LIST_CHANNELS,
    CHANNEL_LOCKED,
    CHANNEL_UNLOCKED,
    CHANNEL_PERMIT,
    CHANNEL_CLAIMED,
    LIVE_CHANNEL_NAME_CHANGED,
    USER_DEFAULT_NAME_SET,
    LIVE_CHANNEL_LIMIT_CHANGED,
    USER_DEFAULT_LIMIT_SET,

    // Lifecycle
    CHANNEL_CREATED,
    CHANNEL_CREATION_FAILED,
    CHANNEL_DELETED,
    /** Platform reported the channel as already gone; only the row was removed. */
    CHANNEL_DELETED_NOT_FOUND,
    CHANNEL_DELETE_ERROR,
    USER_LEFT_OWNED_CHANNEL,
    USER_LEFT_TEMP_CHANNEL,
    USER_MOVED_TO_EXISTING_CHANNEL,
    /** Owned row pointed at a channel the platform no longer has (found on join). */
    STALE_CHANNEL_CLEANUP,

    // Errors and recovery
    CONFIG_ERROR,
    CATEGORY_NOT_FOUND,
    /** Row pruned by the startup reconciliation pass. */
    RECONCILED
}
