package com.voicemaster.sync.core.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Registry row for one live provisioned channel.
 *
 * <p>{@code ownerId} is {@code null} while the channel is unclaimed. The permitted set is the
 * persistent allow-list maintained by {@code permit}; it is independent of {@link #locked()}.</p>
 */
public record TemporaryChannel(
        long channelId,
        long guildId,
        Long ownerId,
        boolean locked,
        Set<Long> permittedUserIds,
        Instant createdAt) {

    public TemporaryChannel {
        permittedUserIds = permittedUserIds == null ? Set.of() : Set.copyOf(permittedUserIds);
    }

    public static TemporaryChannel provisioned(long channelId, long guildId, long ownerId, Instant createdAt) {
        return new TemporaryChannel(channelId, guildId, ownerId, false, Set.of(), createdAt);
    }

    public boolean isOwnedBy(long userId) {
        return ownerId != null && ownerId == userId;
    }

    public TemporaryChannel withOwner(Long ownerId) {
        return new TemporaryChannel(channelId, guildId, ownerId, locked, permittedUserIds, createdAt);
    }

    public TemporaryChannel withLocked(boolean locked) {
        return new TemporaryChannel(channelId, guildId, ownerId, locked, permittedUserIds, createdAt);
    }

    public TemporaryChannel withPermitted(long userId) {
        Set<Long> next = new HashSet<>(permittedUserIds);
        next.add(userId);
        return new TemporaryChannel(channelId, guildId, ownerId, locked, next, createdAt);
    }
}
