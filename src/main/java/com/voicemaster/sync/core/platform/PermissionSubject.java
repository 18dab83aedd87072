package com.voicemaster.sync.core.platform;

/**
 * Target of a connect/view permission overwrite: the guild's general-member role or a single
 * member.
 */
public record PermissionSubject(Type type, long id) {

    public enum Type {
        ROLE,
        MEMBER
    }

    /** The general-member role shares its id with the guild. */
    public static PermissionSubject everyone(long guildId) {
        return new PermissionSubject(Type.ROLE, guildId);
    }

    public static PermissionSubject member(long userId) {
        return new PermissionSubject(Type.MEMBER, userId);
    }
}
