package com.voicemaster.sync.core.store;

import com.voicemaster.sync.core.model.GuildConfig;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface GuildConfigStore {

    /** Empty when the guild has never been set up. */
    Mono<GuildConfig> find(long guildId);

    Flux<GuildConfig> findAll();

    /** Inserts or replaces the whole row. */
    Mono<Void> save(GuildConfig config);
}
