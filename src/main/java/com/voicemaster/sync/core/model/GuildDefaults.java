package com.voicemaster.sync.core.model;

/**
 * Guild-wide defaults for newly provisioned channels.
 *
 * <p>{@code nameTemplate} may contain {@value #USER_PLACEHOLDER}, replaced with the member's
 * display name. Either field may be {@code null} (not set).</p>
 */
public record GuildDefaults(long guildId, String nameTemplate, Integer userLimit) {

    public static final String USER_PLACEHOLDER = "{user}";

    public static final String FALLBACK_NAME_TEMPLATE = USER_PLACEHOLDER + "'s Channel";

    public static GuildDefaults empty(long guildId) {
        return new GuildDefaults(guildId, null, null);
    }
}
