package com.voicemaster.sync.core.store;

import com.voicemaster.sync.core.model.TemporaryChannel;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable mapping of live temporary channel to owner.
 *
 * <p>Only the lifecycle coordinator writes through this interface. At most one row exists per
 * channel id; {@link #insert(TemporaryChannel)} fails with {@link StoreUnavailableException} on a
 * duplicate.</p>
 */
public interface ChannelRegistry {

    Mono<TemporaryChannel> find(long channelId);

    /** Rows owned by the user in the guild, newest first. */
    Flux<TemporaryChannel> findByOwner(long guildId, long ownerId);

    Flux<TemporaryChannel> findByGuild(long guildId);

    Mono<Void> insert(TemporaryChannel channel);

    Mono<Void> updateOwner(long channelId, Long ownerId);

    Mono<Void> updateLocked(long channelId, boolean locked);

    /** Adds the user to the permitted set; a no-op when already present. */
    Mono<Void> addPermitted(long channelId, long userId);

    /**
     * Removes the row together with its permitted set.
     *
     * @return {@code true} if a row was removed
     */
    Mono<Boolean> remove(long channelId);
}
