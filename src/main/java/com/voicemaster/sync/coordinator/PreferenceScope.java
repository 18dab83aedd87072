package com.voicemaster.sync.coordinator;

/** Where a {@code name}/{@code limit} change was applied. */
public enum PreferenceScope {
    /** The caller's live channel and their stored preference. */
    LIVE_CHANNEL,
    /** Only the stored preference; the caller owns no live channel. */
    PREFERENCE_ONLY
}
