package com.voicemaster.sync.core.platform;

import java.time.Instant;

/**
 * Membership change reported by the platform: a member left {@code fromChannelId}, joined
 * {@code toChannelId}, or both. Either side may be {@code null}.
 */
public record MemberMovedEvent(
        long guildId,
        long userId,
        String displayName,
        Long fromChannelId,
        Long toChannelId,
        Instant occurredAt) {

    public boolean changesChannel() {
        return fromChannelId == null ? toChannelId != null : !fromChannelId.equals(toChannelId);
    }

    public String displayNameOrId() {
        return displayName == null || displayName.isBlank() ? String.valueOf(userId) : displayName;
    }
}
