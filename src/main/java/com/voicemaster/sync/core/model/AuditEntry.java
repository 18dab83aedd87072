package com.voicemaster.sync.core.model;

import java.time.Instant;

/**
 * Immutable audit trail record.
 *
 * <p>{@code id} is assigned by the store and is {@code null} on entries that have not been
 * appended yet. {@code actorId} and {@code channelId} are optional.</p>
 */
public record AuditEntry(
        Long id,
        Instant createdAt,
        long guildId,
        Long actorId,
        AuditEventType eventType,
        Long channelId,
        AuditOutcome outcome,
        String details) {

    public static AuditEntry success(Instant at, long guildId, Long actorId, AuditEventType type,
                                     Long channelId, String details) {
        return new AuditEntry(null, at, guildId, actorId, type, channelId, AuditOutcome.SUCCESS, details);
    }

    public static AuditEntry failure(Instant at, long guildId, Long actorId, AuditEventType type,
                                     Long channelId, String details) {
        return new AuditEntry(null, at, guildId, actorId, type, channelId, AuditOutcome.FAILURE, details);
    }
}
