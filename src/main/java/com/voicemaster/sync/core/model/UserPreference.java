package com.voicemaster.sync.core.model;

/**
 * A member's own channel defaults inside one guild. Overrides {@link GuildDefaults}.
 */
public record UserPreference(long guildId, long userId, String channelName, Integer userLimit) {
}
