package com.voicemaster.sync.r2dbc.entity;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Row of {@code temporary_channel}. The permitted set lives in {@code temporary_channel_permit}.
 */
@Table("temporary_channel")
public class TemporaryChannelEntity {

    @Id
    private Long channelId;

    @Column("guild_id")
    private Long guildId;

    @Column("owner_id")
    private Long ownerId;

    @Column("locked")
    private Boolean locked;

    @Column("created_at")
    private OffsetDateTime createdAt;

    public Long getChannelId() { return channelId; }
    public void setChannelId(Long channelId) { this.channelId = channelId; }

    public Long getGuildId() { return guildId; }
    public void setGuildId(Long guildId) { this.guildId = guildId; }

    public Long getOwnerId() { return ownerId; }
    public void setOwnerId(Long ownerId) { this.ownerId = ownerId; }

    public Boolean getLocked() { return locked; }
    public void setLocked(Boolean locked) { this.locked = locked; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
