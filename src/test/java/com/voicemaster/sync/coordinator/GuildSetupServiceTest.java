package com.voicemaster.sync.coordinator;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.voicemaster.sync.core.model.AuditEventType;
import com.voicemaster.sync.core.model.GuildConfig;
import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.support.FakePlatformGateway;
import com.voicemaster.sync.support.InMemoryAuditLog;
import com.voicemaster.sync.support.InMemoryGuildConfigStore;
import com.voicemaster.sync.support.InMemorySettingsStore;
import com.voicemaster.sync.support.InMemoryUnitOfWork;
import com.voicemaster.sync.support.MutableClock;

class GuildSetupServiceTest {

    private static final long GUILD = 5L;
    private static final long ADMIN = 50L;

    private FakePlatformGateway platform;
    private InMemoryGuildConfigStore guildConfigs;
    private InMemorySettingsStore settings;
    private InMemoryAuditLog auditLog;
    private InMemoryUnitOfWork unitOfWork;
    private GuildSetupService service;

    @BeforeEach
    void setUp() {
        platform = new FakePlatformGateway();
        guildConfigs = new InMemoryGuildConfigStore();
        settings = new InMemorySettingsStore();
        auditLog = new InMemoryAuditLog();
        unitOfWork = new InMemoryUnitOfWork();

        CoordinatorProperties props = new CoordinatorProperties();
        props.setSectionTimeout(Duration.ofSeconds(2));
        props.setStoreTimeout(Duration.ofSeconds(2));

        service = new GuildSetupService(platform, guildConfigs, settings, auditLog, unitOfWork, props,
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
    }

    private GuildConfig setUpGuild() {
        Outcome<GuildConfig> outcome = service.setup(GUILD, ADMIN, "Voice", "Join to Create");
        assertThat(outcome.isSuccess()).isTrue();
        return outcome.value();
    }

    @Test
    void firstSetupCreatesCategoryAndIncubator() {
        GuildConfig config = setUpGuild();

        assertThat(config.ownerId()).isEqualTo(ADMIN);
        assertThat(config.cleanupOnStartup()).isTrue();
        assertThat(config.isEnabled()).isTrue();
        assertThat(platform.nameOf(config.categoryId())).isEqualTo("Voice");
        assertThat(platform.nameOf(config.incubatorChannelId())).isEqualTo("Join to Create");
        assertThat(guildConfigs.get(GUILD)).isEqualTo(config);
        assertThat(auditLog.count(AuditEventType.BOT_SETUP)).isEqualTo(1);
    }

    @Test
    void setupOnIntactGuildChangesNothing() {
        GuildConfig config = setUpGuild();

        Outcome<GuildConfig> again = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(again.value()).isEqualTo(config);
        assertThat(again.detail()).isEqualTo("Configuration is intact");
        assertThat(platform.calls(FakePlatformGateway.CREATE_CATEGORY)).isEqualTo(1);
        assertThat(platform.calls(FakePlatformGateway.CREATE_CHANNEL)).isEqualTo(1);
    }

    @Test
    void setupRecreatesIncubatorDeletedOutOfBand() {
        GuildConfig config = setUpGuild();
        platform.removeOutOfBand(config.incubatorChannelId());

        Outcome<GuildConfig> repaired = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(repaired.value().categoryId()).isEqualTo(config.categoryId());
        assertThat(repaired.value().incubatorChannelId()).isNotEqualTo(config.incubatorChannelId());
        assertThat(platform.exists(repaired.value().incubatorChannelId())).isTrue();
        assertThat(auditLog.count(AuditEventType.SETUP_REPAIRED)).isEqualTo(1);
    }

    @Test
    void failedIncubatorCreationRemovesTheNewCategory() {
        platform.fail(FakePlatformGateway.CREATE_CHANNEL, PlatformException.Kind.FORBIDDEN);

        Outcome<GuildConfig> outcome = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(outcome.failure()).isEqualTo(FailureKind.FORBIDDEN);
        assertThat(platform.calls(FakePlatformGateway.DELETE_CHANNEL)).isEqualTo(1);
        assertThat(guildConfigs.get(GUILD)).isNull();
        assertThat(auditLog.count(AuditEventType.SETUP_ERROR)).isEqualTo(1);
    }

    @Test
    void storeFailureDuringSetupRemovesCreatedObjects() {
        unitOfWork.setFailing(true);

        Outcome<GuildConfig> failed = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(failed.failure()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
        assertThat(platform.calls(FakePlatformGateway.DELETE_CHANNEL)).isEqualTo(2);
        assertThat(platform.categoryCount()).isZero();
        assertThat(platform.voiceChannelCount()).isZero();

        unitOfWork.setFailing(false);
        GuildConfig config = setUpGuild();

        assertThat(platform.categoryCount()).isEqualTo(1);
        assertThat(platform.voiceChannelCount()).isEqualTo(1);
        assertThat(platform.exists(config.categoryId())).isTrue();
        assertThat(platform.exists(config.incubatorChannelId())).isTrue();
    }

    @Test
    void failedRepairOfIncubatorRemovesRecreatedCategoryOnly() {
        GuildConfig config = setUpGuild();
        platform.removeOutOfBand(config.categoryId());
        platform.fail(FakePlatformGateway.CREATE_CHANNEL, PlatformException.Kind.UNAVAILABLE);

        Outcome<GuildConfig> outcome = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(outcome.failure()).isEqualTo(FailureKind.PLATFORM_UNAVAILABLE);
        assertThat(platform.calls(FakePlatformGateway.DELETE_CHANNEL)).isEqualTo(1);
        assertThat(platform.categoryCount()).isZero();
        assertThat(platform.exists(config.incubatorChannelId())).isTrue();
        assertThat(guildConfigs.get(GUILD)).isEqualTo(config);
    }

    @Test
    void storeFailureDuringRepairRemovesOnlyRecreatedIncubator() {
        GuildConfig config = setUpGuild();
        platform.removeOutOfBand(config.incubatorChannelId());
        unitOfWork.setFailing(true);

        Outcome<GuildConfig> outcome = service.setup(GUILD, ADMIN, "Voice", "Join to Create");

        assertThat(outcome.failure()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
        assertThat(platform.calls(FakePlatformGateway.DELETE_CHANNEL)).isEqualTo(1);
        assertThat(platform.voiceChannelCount()).isZero();
        assertThat(platform.exists(config.categoryId())).isTrue();
        assertThat(guildConfigs.get(GUILD)).isEqualTo(config);
    }

    @Test
    void blankSetupNamesAreRejected() {
        assertThat(service.setup(GUILD, ADMIN, " ", "Join").failure()).isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(platform.calls(FakePlatformGateway.CREATE_CATEGORY)).isZero();
    }

    @Test
    void editsRequireSetup() {
        assertThat(service.editCleanup(GUILD, ADMIN, false).failure()).isEqualTo(FailureKind.NOT_CONFIGURED);
        assertThat(service.editDisable(GUILD, ADMIN).failure()).isEqualTo(FailureKind.NOT_CONFIGURED);
        assertThat(service.editDefaults(GUILD, ADMIN, "{user} room", null).failure())
                .isEqualTo(FailureKind.NOT_CONFIGURED);
        assertThat(service.editRename(GUILD, ADMIN, EditTarget.CATEGORY, "New").failure())
                .isEqualTo(FailureKind.NOT_CONFIGURED);
    }

    @Test
    void renameIncubatorAndCategory() {
        GuildConfig config = setUpGuild();

        assertThat(service.editRename(GUILD, ADMIN, EditTarget.INCUBATOR, "Create Room").isSuccess()).isTrue();
        assertThat(service.editRename(GUILD, ADMIN, EditTarget.CATEGORY, "Rooms").isSuccess()).isTrue();

        assertThat(platform.nameOf(config.incubatorChannelId())).isEqualTo("Create Room");
        assertThat(platform.nameOf(config.categoryId())).isEqualTo("Rooms");
        assertThat(auditLog.types()).contains(AuditEventType.CHANNEL_RENAMED, AuditEventType.CATEGORY_RENAMED);
    }

    @Test
    void renameOfVanishedIncubatorIsInvalidConfiguration() {
        GuildConfig config = setUpGuild();
        platform.removeOutOfBand(config.incubatorChannelId());

        Outcome<GuildConfig> outcome = service.editRename(GUILD, ADMIN, EditTarget.INCUBATOR, "Create");

        assertThat(outcome.failure()).isEqualTo(FailureKind.INVALID_CONFIGURATION);
        assertThat(platform.calls(FakePlatformGateway.RENAME)).isZero();
    }

    @Test
    void selectAcceptsIncubatorInsideCategory() {
        GuildConfig config = setUpGuild();
        long other = platform.addVoice(GUILD, config.categoryId(), "Other incubator");

        Outcome<GuildConfig> outcome = service.editSelect(GUILD, ADMIN, other, null);

        assertThat(outcome.value().incubatorChannelId()).isEqualTo(other);
        assertThat(guildConfigs.get(GUILD).incubatorChannelId()).isEqualTo(other);
        assertThat(auditLog.count(AuditEventType.CREATION_CHANNEL_CHANGED)).isEqualTo(1);
        assertThat(auditLog.count(AuditEventType.VOICE_CATEGORY_CHANGED)).isZero();
    }

    @Test
    void selectRejectsIncubatorOutsideCategory() {
        GuildConfig config = setUpGuild();
        long otherCategory = platform.addCategory(GUILD, "Elsewhere");
        long outside = platform.addVoice(GUILD, otherCategory, "Outside");

        assertThat(service.editSelect(GUILD, ADMIN, outside, null).failure())
                .isEqualTo(FailureKind.INVALID_CONFIGURATION);
        assertThat(service.editSelect(GUILD, ADMIN, null, otherCategory).failure())
                .isEqualTo(FailureKind.INVALID_CONFIGURATION);
        assertThat(service.editSelect(GUILD, ADMIN, null, null).failure()).isEqualTo(FailureKind.INVALID_VALUE);

        assertThat(guildConfigs.get(GUILD)).isEqualTo(config);
    }

    @Test
    void selectCanMoveBothAtOnce() {
        setUpGuild();
        long newCategory = platform.addCategory(GUILD, "New");
        long newIncubator = platform.addVoice(GUILD, newCategory, "New incubator");

        Outcome<GuildConfig> outcome = service.editSelect(GUILD, ADMIN, newIncubator, newCategory);

        assertThat(outcome.value().categoryId()).isEqualTo(newCategory);
        assertThat(outcome.value().incubatorChannelId()).isEqualTo(newIncubator);
        assertThat(auditLog.types()).contains(AuditEventType.CREATION_CHANNEL_CHANGED,
                AuditEventType.VOICE_CATEGORY_CHANGED);
    }

    @Test
    void defaultsAreMergedWithStoredValues() {
        setUpGuild();

        service.editDefaults(GUILD, ADMIN, "{user}'s lounge", null);
        Outcome<GuildDefaults> outcome = service.editDefaults(GUILD, ADMIN, null, 8);

        assertThat(outcome.value()).isEqualTo(new GuildDefaults(GUILD, "{user}'s lounge", 8));
        assertThat(settings.defaults(GUILD)).isEqualTo(outcome.value());
        assertThat(auditLog.count(AuditEventType.GUILD_DEFAULTS_CHANGED)).isEqualTo(2);
    }

    @Test
    void invalidDefaultsAreRejected() {
        setUpGuild();

        assertThat(service.editDefaults(GUILD, ADMIN, null, 500).failure()).isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(service.editDefaults(GUILD, ADMIN, null, null).failure()).isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(settings.defaults(GUILD)).isNull();
    }

    @Test
    void cleanupToggleIsStored() {
        setUpGuild();

        Outcome<GuildConfig> outcome = service.editCleanup(GUILD, ADMIN, false);

        assertThat(outcome.value().cleanupOnStartup()).isFalse();
        assertThat(guildConfigs.get(GUILD).cleanupOnStartup()).isFalse();
        assertThat(auditLog.count(AuditEventType.CLEANUP_STATE_CHANGED)).isEqualTo(1);
    }

    @Test
    void disableClearsIncubatorOnce() {
        GuildConfig config = setUpGuild();

        Outcome<GuildConfig> first = service.editDisable(GUILD, ADMIN);
        Outcome<GuildConfig> second = service.editDisable(GUILD, ADMIN);

        assertThat(first.value().incubatorChannelId()).isNull();
        assertThat(first.value().categoryId()).isEqualTo(config.categoryId());
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.detail()).isEqualTo("Channel creation already disabled");
        assertThat(auditLog.count(AuditEventType.CREATION_CHANNEL_CHANGED)).isEqualTo(1);
        assertThat(platform.exists(config.incubatorChannelId())).isTrue();
    }

    @Test
    void storeOutageLeavesConfigurationUntouched() {
        GuildConfig config = setUpGuild();
        unitOfWork.setFailing(true);

        assertThat(service.editCleanup(GUILD, ADMIN, false).failure()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
        assertThat(guildConfigs.get(GUILD)).isEqualTo(config);
    }
}
