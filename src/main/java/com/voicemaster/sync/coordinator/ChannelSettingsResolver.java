package com.voicemaster.sync.coordinator;

import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.model.UserPreference;

/**
 * Picks name and user limit for a new channel: the member's preference first, then the guild
 * defaults, then the built-in fallback ({@code "{user}'s Channel"}, unlimited).
 *
 * <p>Stored values that no longer pass {@link ChannelConstraints} are skipped.</p>
 */
final class ChannelSettingsResolver {

    record ChannelSettings(String name, int userLimit) {
    }

    private final ChannelConstraints constraints;

    ChannelSettingsResolver(ChannelConstraints constraints) {
        this.constraints = constraints;
    }

    ChannelSettings resolve(GuildDefaults guildDefaults, UserPreference preference, String displayName) {
        String name = null;
        if (preference != null && constraints.checkName(preference.channelName()).isEmpty()) {
            name = preference.channelName().strip();
        }
        if (name == null && guildDefaults != null && guildDefaults.nameTemplate() != null) {
            name = render(guildDefaults.nameTemplate(), displayName);
        }
        if (name == null) {
            name = render(GuildDefaults.FALLBACK_NAME_TEMPLATE, displayName);
        }

        int limit = 0;
        if (preference != null && isUsableLimit(preference.userLimit())) {
            limit = preference.userLimit();
        } else if (guildDefaults != null && isUsableLimit(guildDefaults.userLimit())) {
            limit = guildDefaults.userLimit();
        }
        return new ChannelSettings(name, limit);
    }

    private String render(String template, String displayName) {
        String rendered = template.replace(GuildDefaults.USER_PLACEHOLDER, displayName).strip();
        if (rendered.isEmpty()) {
            rendered = displayName;
        }
        return rendered.length() > constraints.maxNameLength()
                ? rendered.substring(0, constraints.maxNameLength())
                : rendered;
    }

    private boolean isUsableLimit(Integer limit) {
        return limit != null && constraints.checkLimit(limit).isEmpty();
    }
}
