package com.voicemaster.sync.core.store;

import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.model.UserPreference;

import reactor.core.publisher.Mono;

/**
 * Durable per-guild defaults and per-(guild, user) preferences. Rows never expire.
 *
 * <p>The user-scoped setters create the preference row on first use and leave the other
 * field untouched.</p>
 */
public interface SettingsStore {

    Mono<GuildDefaults> findGuildDefaults(long guildId);

    Mono<Void> saveGuildDefaults(GuildDefaults defaults);

    Mono<UserPreference> findUserPreference(long guildId, long userId);

    Mono<Void> saveUserChannelName(long guildId, long userId, String channelName);

    Mono<Void> saveUserChannelLimit(long guildId, long userId, int userLimit);
}
