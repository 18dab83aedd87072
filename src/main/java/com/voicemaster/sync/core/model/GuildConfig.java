package com.voicemaster.sync.core.model;

/**
 * Per-guild configuration written by {@code setup} and the {@code edit.*} operations.
 *
 * <p>The incubator channel, when set, must live inside {@link #categoryId()}. A guild is
 * soft-disabled by clearing {@link #incubatorChannelId()}; rows are never deleted.</p>
 */
public record GuildConfig(
        long guildId,
        long ownerId,
        Long categoryId,
        Long incubatorChannelId,
        boolean cleanupOnStartup) {

    public boolean isEnabled() {
        return categoryId != null && incubatorChannelId != null;
    }

    public GuildConfig withCategory(Long categoryId) {
        return new GuildConfig(guildId, ownerId, categoryId, incubatorChannelId, cleanupOnStartup);
    }

    public GuildConfig withIncubator(Long incubatorChannelId) {
        return new GuildConfig(guildId, ownerId, categoryId, incubatorChannelId, cleanupOnStartup);
    }

    public GuildConfig withCleanupOnStartup(boolean cleanupOnStartup) {
        return new GuildConfig(guildId, ownerId, categoryId, incubatorChannelId, cleanupOnStartup);
    }
}
