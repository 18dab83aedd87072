package com.voicemaster.sync.core.platform;

import java.util.Optional;
import java.util.Set;

/**
 * Contract over the chat platform's channel objects.
 *
 * <p>Every call is blocking and may fail with {@link PlatformException}; callers run on worker
 * threads, never on a Reactor event loop. Channels can be changed out-of-band by platform
 * admins, so callers must not cache what these methods return.</p>
 *
 * <p>Membership changes arrive separately as {@link MemberMovedEvent}s.</p>
 */
public interface PlatformGateway {

    long createCategory(long guildId, String name);

    /**
     * Creates a voice channel inside the category.
     *
     * @param userLimit 0 for unlimited
     * @return the new channel id
     */
    long createChannel(long guildId, long categoryId, String name, int userLimit);

    void deleteChannel(long channelId);

    void moveMember(long guildId, long userId, long channelId);

    /** Works for voice channels and categories alike. */
    void renameChannel(long channelId, String name);

    void setLimit(long channelId, int userLimit);

    /** Sets an explicit connect/view allow or deny overwrite for the subject. */
    void setPermission(long channelId, PermissionSubject subject, boolean allow);

    Set<Long> currentMembers(long channelId);

    /** Empty when the platform has no such channel. */
    Optional<PlatformChannel> channelInfo(long channelId);
}
