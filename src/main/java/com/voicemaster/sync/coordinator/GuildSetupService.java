package com.voicemaster.sync.coordinator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.voicemaster.sync.core.model.AuditEntry;
import com.voicemaster.sync.core.model.AuditEventType;
import com.voicemaster.sync.core.model.GuildConfig;
import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.PlatformChannel;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.core.platform.PlatformGateway;
import com.voicemaster.sync.core.store.AuditLog;
import com.voicemaster.sync.core.store.GuildConfigStore;
import com.voicemaster.sync.core.store.SettingsStore;
import com.voicemaster.sync.core.store.StoreUnavailableException;
import com.voicemaster.sync.core.store.UnitOfWork;

import reactor.core.publisher.Mono;

/**
 * Admin configuration of a guild: {@code setup} and the {@code edit.*} operations.
 *
 * <p>All operations on one guild run inside that guild's section. Every change is validated
 * against the platform before it is stored; a rejected change leaves the stored configuration
 * as it was.</p>
 */
@Service
public class GuildSetupService {

    private static final Logger log = LoggerFactory.getLogger(GuildSetupService.class);

    private final PlatformGateway platform;
    private final GuildConfigStore guildConfigs;
    private final SettingsStore settings;
    private final AuditLog auditLog;
    private final UnitOfWork unitOfWork;
    private final CoordinatorProperties props;
    private final ChannelConstraints constraints;
    private final Clock clock;
    private final StoreCalls store;

    private final KeyedSections<Long> guildSections = new KeyedSections<>("guild");

    public GuildSetupService(
            PlatformGateway platform,
            GuildConfigStore guildConfigs,
            SettingsStore settings,
            AuditLog auditLog,
            UnitOfWork unitOfWork,
            CoordinatorProperties props,
            Clock clock
    ) {
        this.platform = platform;
        this.guildConfigs = guildConfigs;
        this.settings = settings;
        this.auditLog = auditLog;
        this.unitOfWork = unitOfWork;
        this.props = props;
        this.constraints = ChannelConstraints.from(props);
        this.clock = clock;
        this.store = new StoreCalls(props.getStoreTimeout(), auditLog);
    }

    /**
     * Creates the category and incubator channel for a new guild. On an already configured guild
     * it repairs whatever was removed out-of-band instead; when nothing is missing the stored
     * configuration is returned unchanged.
     */
    public Outcome<GuildConfig> setup(long guildId, long actorId, String categoryName, String incubatorName) {
        Optional<String> problem = constraints.checkName(categoryName)
                .or(() -> constraints.checkName(incubatorName));
        if (problem.isPresent()) {
            return Outcome.fail(FailureKind.INVALID_VALUE, problem.get());
        }
        String category = categoryName.strip();
        String incubator = incubatorName.strip();

        return inGuild(guildId, "setup", () -> {
            GuildConfig existing = store.await(guildConfigs.find(guildId));
            try {
                return existing == null
                        ? firstSetup(guildId, actorId, category, incubator)
                        : repair(existing, actorId, category, incubator);
            } catch (PlatformException e) {
                store.auditQuietly(AuditEntry.failure(clock.instant(), guildId, actorId, AuditEventType.SETUP_ERROR,
                        null, "Setup failed: " + e.getMessage()));
                throw e;
            }
        });
    }

    private Outcome<GuildConfig> firstSetup(long guildId, long actorId, String categoryName, String incubatorName) {
        long categoryId = platform.createCategory(guildId, categoryName);
        long incubatorId;
        try {
            incubatorId = platform.createChannel(guildId, categoryId, incubatorName, 0);
        } catch (PlatformException e) {
            deleteQuietly(categoryId);
            throw e;
        }

        GuildConfig config = new GuildConfig(guildId, actorId, categoryId, incubatorId, true);
        try {
            store.await(unitOfWork.atomically(guildConfigs.save(config)
                    .then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                            AuditEventType.BOT_SETUP, incubatorId, "Bot setup complete. Category: " + categoryId
                                    + ", incubator: " + incubatorId + ".")))));
        } catch (StoreUnavailableException e) {
            deleteQuietly(incubatorId);
            deleteQuietly(categoryId);
            throw e;
        }
        log.info("Guild {} set up category={} incubator={}", guildId, categoryId, incubatorId);
        return Outcome.ok(config);
    }

    private Outcome<GuildConfig> repair(GuildConfig existing, long actorId, String categoryName, String incubatorName) {
        long guildId = existing.guildId();
        List<String> repairs = new ArrayList<>();

        Long categoryId = existing.categoryId();
        Long createdCategory = null;
        if (categoryId == null || platform.channelInfo(categoryId).filter(PlatformChannel::isCategory).isEmpty()) {
            categoryId = platform.createCategory(guildId, categoryName);
            createdCategory = categoryId;
            repairs.add("category recreated as " + categoryId);
        }

        Long incubatorId = existing.incubatorChannelId();
        Long createdIncubator = null;
        long category = categoryId;
        if (incubatorId == null
                || platform.channelInfo(incubatorId).filter(c -> c.isVoiceIn(category)).isEmpty()) {
            try {
                incubatorId = platform.createChannel(guildId, category, incubatorName, 0);
            } catch (PlatformException e) {
                deleteCreated(null, createdCategory);
                throw e;
            }
            createdIncubator = incubatorId;
            repairs.add("incubator recreated as " + incubatorId);
        }

        if (repairs.isEmpty()) {
            return Outcome.ok(existing, "Configuration is intact");
        }

        GuildConfig repaired = existing.withCategory(categoryId).withIncubator(incubatorId);
        String details = "Setup repaired: " + String.join(", ", repairs) + ".";
        try {
            store.await(unitOfWork.atomically(guildConfigs.save(repaired)
                    .then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                            AuditEventType.SETUP_REPAIRED, incubatorId, details)))));
        } catch (StoreUnavailableException e) {
            deleteCreated(createdIncubator, createdCategory);
            throw e;
        }
        log.info("Guild {} {}", guildId, details);
        return Outcome.ok(repaired, details);
    }

    /** Renames the configured incubator channel or category on the platform. */
    public Outcome<GuildConfig> editRename(long guildId, long actorId, EditTarget target, String name) {
        Optional<String> problem = constraints.checkName(name);
        if (problem.isPresent()) {
            return Outcome.fail(FailureKind.INVALID_VALUE, problem.get());
        }
        String value = name.strip();
        return inGuild(guildId, "edit.rename", () -> {
            GuildConfig config = store.await(guildConfigs.find(guildId));
            if (config == null) {
                return notConfigured(guildId);
            }
            Long objectId = target == EditTarget.CATEGORY ? config.categoryId() : config.incubatorChannelId();
            if (objectId == null) {
                return Outcome.fail(FailureKind.INVALID_CONFIGURATION, "No " + describe(target) + " configured");
            }
            Optional<PlatformChannel> current = platform.channelInfo(objectId);
            boolean valid = target == EditTarget.CATEGORY
                    ? current.filter(PlatformChannel::isCategory).isPresent()
                    : config.categoryId() != null && current.filter(c -> c.isVoiceIn(config.categoryId())).isPresent();
            if (!valid) {
                return Outcome.fail(FailureKind.INVALID_CONFIGURATION,
                        "Configured " + describe(target) + " " + objectId + " not found or no longer valid");
            }

            platform.renameChannel(objectId, value);
            AuditEventType type = target == EditTarget.CATEGORY
                    ? AuditEventType.CATEGORY_RENAMED
                    : AuditEventType.CHANNEL_RENAMED;
            store.auditQuietly(AuditEntry.success(clock.instant(), guildId, actorId, type, objectId,
                    describe(target) + " renamed from '" + current.get().name() + "' to '" + value + "'."));
            return Outcome.ok(config);
        });
    }

    /**
     * Re-points the incubator and/or the category to existing platform objects. The resulting
     * pair must satisfy "incubator is a voice channel inside the category".
     */
    public Outcome<GuildConfig> editSelect(long guildId, long actorId, Long incubatorId, Long categoryId) {
        if (incubatorId == null && categoryId == null) {
            return Outcome.fail(FailureKind.INVALID_VALUE, "Select an incubator channel, a category, or both");
        }
        return inGuild(guildId, "edit.select", () -> {
            GuildConfig config = store.await(guildConfigs.find(guildId));
            if (config == null) {
                return notConfigured(guildId);
            }
            Long nextCategory = categoryId != null ? categoryId : config.categoryId();
            Long nextIncubator = incubatorId != null ? incubatorId : config.incubatorChannelId();

            if (nextCategory == null
                    || platform.channelInfo(nextCategory).filter(PlatformChannel::isCategory).isEmpty()) {
                return Outcome.fail(FailureKind.INVALID_CONFIGURATION, "Category " + nextCategory + " is not a category");
            }
            if (nextIncubator != null
                    && platform.channelInfo(nextIncubator).filter(c -> c.isVoiceIn(nextCategory)).isEmpty()) {
                return Outcome.fail(FailureKind.INVALID_CONFIGURATION,
                        "Incubator " + nextIncubator + " is not a voice channel inside category " + nextCategory);
            }

            GuildConfig updated = config.withCategory(nextCategory).withIncubator(nextIncubator);
            Mono<Void> work = guildConfigs.save(updated);
            if (!Objects.equals(config.incubatorChannelId(), nextIncubator)) {
                work = work.then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                        AuditEventType.CREATION_CHANNEL_CHANGED, nextIncubator,
                        "Incubator channel changed from " + config.incubatorChannelId() + " to " + nextIncubator + ".")));
            }
            if (!Objects.equals(config.categoryId(), nextCategory)) {
                work = work.then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                        AuditEventType.VOICE_CATEGORY_CHANGED, nextCategory,
                        "Category changed from " + config.categoryId() + " to " + nextCategory + ".")));
            }
            store.await(unitOfWork.atomically(work));
            log.info("Guild {} selection updated category={} incubator={}", guildId, nextCategory, nextIncubator);
            return Outcome.ok(updated);
        });
    }

    /**
     * Updates the guild-wide name template and/or user limit for new channels. Fields passed as
     * {@code null} keep their stored value.
     */
    public Outcome<GuildDefaults> editDefaults(long guildId, long actorId, String nameTemplate, Integer userLimit) {
        if (nameTemplate == null && userLimit == null) {
            return Outcome.fail(FailureKind.INVALID_VALUE, "Provide a name template, a user limit, or both");
        }
        Optional<String> problem = Optional.empty();
        if (nameTemplate != null) {
            problem = constraints.checkName(nameTemplate);
        }
        if (problem.isEmpty() && userLimit != null) {
            problem = constraints.checkLimit(userLimit);
        }
        if (problem.isPresent()) {
            return Outcome.fail(FailureKind.INVALID_VALUE, problem.get());
        }

        return inGuild(guildId, "edit.defaults", () -> {
            if (store.await(guildConfigs.find(guildId)) == null) {
                return notConfigured(guildId);
            }
            GuildDefaults current = store.await(settings.findGuildDefaults(guildId));
            if (current == null) {
                current = GuildDefaults.empty(guildId);
            }
            GuildDefaults updated = new GuildDefaults(guildId,
                    nameTemplate != null ? nameTemplate.strip() : current.nameTemplate(),
                    userLimit != null ? userLimit : current.userLimit());
            store.await(unitOfWork.atomically(settings.saveGuildDefaults(updated)
                    .then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                            AuditEventType.GUILD_DEFAULTS_CHANGED, null,
                            "Guild defaults set to name '" + updated.nameTemplate() + "', limit "
                                    + updated.userLimit() + ".")))));
            return Outcome.ok(updated);
        });
    }

    /** Turns the startup purge of empty tracked channels on or off. */
    public Outcome<GuildConfig> editCleanup(long guildId, long actorId, boolean cleanupOnStartup) {
        return inGuild(guildId, "edit.cleanup", () -> {
            GuildConfig config = store.await(guildConfigs.find(guildId));
            if (config == null) {
                return notConfigured(guildId);
            }
            GuildConfig updated = config.withCleanupOnStartup(cleanupOnStartup);
            store.await(unitOfWork.atomically(guildConfigs.save(updated)
                    .then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                            AuditEventType.CLEANUP_STATE_CHANGED, null,
                            "Startup cleanup " + (cleanupOnStartup ? "enabled" : "disabled") + ".")))));
            return Outcome.ok(updated);
        });
    }

    /**
     * Soft-disables channel creation by clearing the incubator reference. Existing channels keep
     * their lifecycle.
     */
    public Outcome<GuildConfig> editDisable(long guildId, long actorId) {
        return inGuild(guildId, "edit.disable", () -> {
            GuildConfig config = store.await(guildConfigs.find(guildId));
            if (config == null) {
                return notConfigured(guildId);
            }
            if (config.incubatorChannelId() == null) {
                return Outcome.ok(config, "Channel creation already disabled");
            }
            GuildConfig updated = config.withIncubator(null);
            store.await(unitOfWork.atomically(guildConfigs.save(updated)
                    .then(auditLog.append(AuditEntry.success(clock.instant(), guildId, actorId,
                            AuditEventType.CREATION_CHANNEL_CHANGED, config.incubatorChannelId(),
                            "Channel creation disabled; incubator " + config.incubatorChannelId()
                                    + " unassigned.")))));
            log.info("Guild {} disabled channel creation", guildId);
            return Outcome.ok(updated);
        });
    }

    private <T> Outcome<T> inGuild(long guildId, String operation, Supplier<Outcome<T>> body) {
        return Outcomes.guarded(log, operation,
                () -> guildSections.call(guildId, props.getSectionTimeout(), body));
    }

    /** Removes only the objects this call created; pre-existing ones stay untouched. */
    private void deleteCreated(Long incubatorId, Long categoryId) {
        if (incubatorId != null) {
            deleteQuietly(incubatorId);
        }
        if (categoryId != null) {
            deleteQuietly(categoryId);
        }
    }

    private void deleteQuietly(long channelId) {
        try {
            platform.deleteChannel(channelId);
        } catch (PlatformException e) {
            log.error("Compensating delete of {} failed; object is orphaned on the platform: {}",
                    channelId, e.getMessage());
        }
    }

    private static String describe(EditTarget target) {
        return target == EditTarget.CATEGORY ? "Category" : "Incubator channel";
    }

    private static <T> Outcome<T> notConfigured(long guildId) {
        return Outcome.fail(FailureKind.NOT_CONFIGURED, "Guild " + guildId + " is not set up");
    }
}
