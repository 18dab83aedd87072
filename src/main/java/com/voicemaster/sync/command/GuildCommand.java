package com.voicemaster.sync.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.voicemaster.sync.coordinator.EditTarget;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * A command issued inside one guild by {@link #actorId()}. The guild comes from the request
 * path; the JSON body carries a {@code type} discriminator.
 *
 * <p>Only presence and shape are checked here. Ranges and lengths are enforced by the
 * coordinator, which reports them as {@code INVALID_VALUE}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GuildCommand.Setup.class, name = "setup"),
        @JsonSubTypes.Type(value = GuildCommand.EditRename.class, name = "edit.rename"),
        @JsonSubTypes.Type(value = GuildCommand.EditSelect.class, name = "edit.select"),
        @JsonSubTypes.Type(value = GuildCommand.EditDefaults.class, name = "edit.defaults"),
        @JsonSubTypes.Type(value = GuildCommand.EditCleanup.class, name = "edit.cleanup"),
        @JsonSubTypes.Type(value = GuildCommand.EditDisable.class, name = "edit.disable"),
        @JsonSubTypes.Type(value = GuildCommand.Name.class, name = "name"),
        @JsonSubTypes.Type(value = GuildCommand.Limit.class, name = "limit"),
        @JsonSubTypes.Type(value = GuildCommand.Lock.class, name = "lock"),
        @JsonSubTypes.Type(value = GuildCommand.Unlock.class, name = "unlock"),
        @JsonSubTypes.Type(value = GuildCommand.Permit.class, name = "permit"),
        @JsonSubTypes.Type(value = GuildCommand.Claim.class, name = "claim"),
        @JsonSubTypes.Type(value = GuildCommand.ListChannels.class, name = "list"),
        @JsonSubTypes.Type(value = GuildCommand.AuditLogQuery.class, name = "auditlog")
})
public sealed interface GuildCommand {

    Long actorId();

    record Setup(
            @NotNull @Positive Long actorId,
            @NotBlank String categoryName,
            @NotBlank String incubatorName) implements GuildCommand {
    }

    record EditRename(
            @NotNull @Positive Long actorId,
            @NotNull EditTarget target,
            @NotBlank String name) implements GuildCommand {
    }

    /** At least one of the two ids must be present. */
    record EditSelect(
            @NotNull @Positive Long actorId,
            @Positive Long incubatorChannelId,
            @Positive Long categoryId) implements GuildCommand {
    }

    record EditDefaults(
            @NotNull @Positive Long actorId,
            String nameTemplate,
            Integer userLimit) implements GuildCommand {
    }

    record EditCleanup(
            @NotNull @Positive Long actorId,
            @NotNull Boolean enabled) implements GuildCommand {
    }

    record EditDisable(@NotNull @Positive Long actorId) implements GuildCommand {
    }

    record Name(
            @NotNull @Positive Long actorId,
            @NotNull String name) implements GuildCommand {
    }

    record Limit(
            @NotNull @Positive Long actorId,
            @NotNull Integer limit) implements GuildCommand {
    }

    record Lock(
            @NotNull @Positive Long actorId,
            @NotNull @Positive Long channelId) implements GuildCommand {
    }

    record Unlock(
            @NotNull @Positive Long actorId,
            @NotNull @Positive Long channelId) implements GuildCommand {
    }

    record Permit(
            @NotNull @Positive Long actorId,
            @NotNull @Positive Long channelId,
            @NotNull @Positive Long userId) implements GuildCommand {
    }

    record Claim(
            @NotNull @Positive Long actorId,
            @NotNull @Positive Long channelId) implements GuildCommand {
    }

    record ListChannels(@NotNull @Positive Long actorId) implements GuildCommand {
    }

    /** {@code count} is optional; the coordinator clamps it. */
    record AuditLogQuery(
            @NotNull @Positive Long actorId,
            Integer count) implements GuildCommand {
    }
}
