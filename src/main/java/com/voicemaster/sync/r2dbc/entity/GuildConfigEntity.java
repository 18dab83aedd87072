package com.voicemaster.sync.r2dbc.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("guild_config")
public class GuildConfigEntity {

    @Id
    private Long guildId;

    @Column("owner_id")
    private Long ownerId;

    @Column("category_id")
    private Long categoryId;

    @Column("incubator_channel_id")
    private Long incubatorChannelId;

    @Column("cleanup_on_startup")
    private Boolean cleanupOnStartup;

    public Long getGuildId() { return guildId; }
    public void setGuildId(Long guildId) { this.guildId = guildId; }

    public Long getOwnerId() { return ownerId; }
    public void setOwnerId(Long ownerId) { this.ownerId = ownerId; }

    public Long getCategoryId() { return categoryId; }
    public void setCategoryId(Long categoryId) { this.categoryId = categoryId; }

    public Long getIncubatorChannelId() { return incubatorChannelId; }
    public void setIncubatorChannelId(Long incubatorChannelId) { this.incubatorChannelId = incubatorChannelId; }

    public Boolean getCleanupOnStartup() { return cleanupOnStartup; }
    public void setCleanupOnStartup(Boolean cleanupOnStartup) { this.cleanupOnStartup = cleanupOnStartup; }
}
