package com.voicemaster.sync.core.platform;

/**
 * Snapshot of a platform channel as reported by {@link PlatformGateway#channelInfo(long)}.
 *
 * @param parentId enclosing category, {@code null} for top-level channels and categories
 */
public record PlatformChannel(long id, long guildId, ChannelKind kind, Long parentId, String name, int userLimit) {

    public boolean isVoiceIn(long categoryId) {
        return kind == ChannelKind.VOICE && parentId != null && parentId == categoryId;
    }

    public boolean isCategory() {
        return kind == ChannelKind.CATEGORY;
    }
}
