package com.voicemaster.sync.coordinator;

import java.time.Instant;
import java.util.Set;

/**
 * One line of {@code list}. {@code memberCount} is read from the platform at call time and may
 * be stale by the time it is shown; it is {@code null} when the platform could not be asked.
 */
public record ChannelListing(
        long channelId,
        Long ownerId,
        boolean locked,
        Set<Long> permittedUserIds,
        Integer memberCount,
        Instant createdAt) {
}
