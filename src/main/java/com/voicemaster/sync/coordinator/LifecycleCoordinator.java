package com.voicemaster.sync.coordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.LongConsumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.voicemaster.sync.core.model.AuditEntry;
import com.voicemaster.sync.core.model.AuditEventType;
import com.voicemaster.sync.core.model.GuildConfig;
import com.voicemaster.sync.core.model.TemporaryChannel;
import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.MemberMovedEvent;
import com.voicemaster.sync.core.platform.PermissionSubject;
import com.voicemaster.sync.core.platform.PlatformChannel;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.core.platform.PlatformGateway;
import com.voicemaster.sync.core.store.AuditLog;
import com.voicemaster.sync.core.store.ChannelRegistry;
import com.voicemaster.sync.core.store.GuildConfigStore;
import com.voicemaster.sync.core.store.SettingsStore;
import com.voicemaster.sync.core.store.StoreUnavailableException;
import com.voicemaster.sync.core.store.UnitOfWork;

import reactor.core.publisher.Mono;

/**
 * Owns the lifecycle of temporary channels: provisioning on incubator joins, teardown when
 * empty, and the owner operations (claim, lock, unlock, permit, name, limit).
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Every read-modify-write of a registry row, and every platform call for that channel,
 *       runs inside the channel's section. Different channels never contend.</li>
 *   <li>Provisioning additionally runs inside a per-member section so concurrent or redelivered
 *       joins of the same member cannot create two channels.</li>
 *   <li>Waiting for a section is bounded by {@code section-timeout}; the caller then gets
 *       {@link FailureKind#BUSY}.</li>
 * </ul>
 *
 * <h2>Ordering of side effects</h2>
 * Platform calls are issued before the durable commit they justify. A row change and its audit
 * entry are committed through {@link UnitOfWork} as one unit. When the commit fails after a
 * platform change, the platform change stays (creation is compensated once, best-effort) and the
 * caller receives {@link FailureKind#STORE_UNAVAILABLE}.
 *
 * <p>No method throws; every failure is returned as an {@link Outcome}.</p>
 */
@Service
public class LifecycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleCoordinator.class);

    record MemberKey(long guildId, long userId) {
    }

    private final PlatformGateway platform;
    private final GuildConfigStore guildConfigs;
    private final SettingsStore settings;
    private final ChannelRegistry registry;
    private final AuditLog auditLog;
    private final UnitOfWork unitOfWork;
    private final CoordinatorProperties props;
    private final ChannelConstraints constraints;
    private final ChannelSettingsResolver settingsResolver;
    private final Clock clock;
    private final StoreCalls store;

    private final KeyedSections<Long> channelSections = new KeyedSections<>("channel");
    private final KeyedSections<MemberKey> memberSections = new KeyedSections<>("member");

    /** Channels whose platform delete is in flight; never offered for reuse. */
    private final Set<Long> teardownPending = ConcurrentHashMap.newKeySet();

    public LifecycleCoordinator(
            PlatformGateway platform,
            GuildConfigStore guildConfigs,
            SettingsStore settings,
            ChannelRegistry registry,
            AuditLog auditLog,
            UnitOfWork unitOfWork,
            CoordinatorProperties props,
            Clock clock
    ) {
        this.platform = platform;
        this.guildConfigs = guildConfigs;
        this.settings = settings;
        this.registry = registry;
        this.auditLog = auditLog;
        this.unitOfWork = unitOfWork;
        this.props = props;
        this.constraints = ChannelConstraints.from(props);
        this.settingsResolver = new ChannelSettingsResolver(constraints);
        this.clock = clock;
        this.store = new StoreCalls(props.getStoreTimeout(), auditLog);
    }

    // ---------------------------------------------------------------------
    // Membership events
    // ---------------------------------------------------------------------

    /**
     * Reacts to one membership change. The leave side is handled before the join side, so a
     * member hopping from their own channel into the incubator first releases the old channel.
     */
    public MemberMoveResult onMemberMoved(MemberMovedEvent event) {
        if (!event.changesChannel()) {
            return MemberMoveResult.none();
        }
        Outcome<LifecycleAction> leave = event.fromChannelId() == null
                ? null
                : Outcomes.guarded(log, "leave", () -> handleLeave(event));
        Outcome<LifecycleAction> join = event.toChannelId() == null
                ? null
                : Outcomes.guarded(log, "join", () -> handleJoin(event));
        return new MemberMoveResult(leave, join);
    }

    private Outcome<LifecycleAction> handleLeave(MemberMovedEvent event) {
        long channelId = event.fromChannelId();
        return withChannel(channelId, () -> {
            TemporaryChannel row = store.await(registry.find(channelId));
            if (row == null) {
                return Outcome.ok(LifecycleAction.IGNORED);
            }
            boolean owner = row.isOwnedBy(event.userId());
            store.auditQuietly(AuditEntry.success(now(), row.guildId(), event.userId(),
                    owner ? AuditEventType.USER_LEFT_OWNED_CHANNEL : AuditEventType.USER_LEFT_TEMP_CHANNEL,
                    channelId,
                    "User " + event.displayNameOrId() + " (" + event.userId() + ") left "
                            + (owner ? "their owned" : "temporary") + " channel " + channelId + "."));
            return teardownIfEmpty(row);
        });
    }

    private Outcome<LifecycleAction> handleJoin(MemberMovedEvent event) {
        GuildConfig config = store.await(guildConfigs.find(event.guildId()));
        if (config == null || config.incubatorChannelId() == null
                || !config.incubatorChannelId().equals(event.toChannelId())) {
            return Outcome.ok(LifecycleAction.IGNORED);
        }
        MemberKey key = new MemberKey(event.guildId(), event.userId());
        return memberSections.call(key, props.getSectionTimeout(), () -> provision(event, config));
    }

    private Outcome<LifecycleAction> provision(MemberMovedEvent event, GuildConfig config) {
        long guildId = event.guildId();
        long userId = event.userId();

        TemporaryChannel existing = newestLiveOwned(guildId, userId);
        if (existing != null) {
            Optional<Outcome<LifecycleAction>> reused = reuseExisting(event, existing);
            if (reused.isPresent()) {
                return reused.get();
            }
        }

        if (config.categoryId() == null) {
            store.auditQuietly(AuditEntry.failure(now(), guildId, userId, AuditEventType.CONFIG_ERROR, null,
                    "No temporary channel category configured."));
            return Outcome.fail(FailureKind.NOT_CONFIGURED, "Guild " + guildId + " has no category configured");
        }

        ChannelSettingsResolver.ChannelSettings channelSettings = settingsResolver.resolve(
                store.await(settings.findGuildDefaults(guildId)),
                store.await(settings.findUserPreference(guildId, userId)),
                event.displayNameOrId());

        long channelId;
        try {
            channelId = platform.createChannel(guildId, config.categoryId(), channelSettings.name(),
                    channelSettings.userLimit());
        } catch (PlatformException e) {
            log.warn("Channel creation failed guild={} user={} kind={} err={}",
                    guildId, userId, e.getKind(), e.getMessage());
            if (e.isNotFound()) {
                store.auditQuietly(AuditEntry.failure(now(), guildId, userId, AuditEventType.CATEGORY_NOT_FOUND, null,
                        "Configured category " + config.categoryId() + " not found."));
                return Outcome.fail(FailureKind.INVALID_CONFIGURATION,
                        "Configured category " + config.categoryId() + " not found");
            }
            store.auditQuietly(AuditEntry.failure(now(), guildId, userId, AuditEventType.CHANNEL_CREATION_FAILED, null,
                    "Failed to create channel: " + e.getMessage()));
            return Outcomes.fromPlatform(e);
        }

        return withChannel(channelId, () -> registerAndMove(event, channelId, channelSettings));
    }

    /**
     * Handles a join by a member who already owns a channel. Empty result means the member
     * should get a fresh channel.
     */
    private Optional<Outcome<LifecycleAction>> reuseExisting(MemberMovedEvent event, TemporaryChannel existing) {
        long channelId = existing.channelId();
        Duration age = Duration.between(existing.createdAt(), now());
        if (age.compareTo(props.getCreationDebounce()) < 0) {
            log.debug("Ignoring duplicate join guild={} user={} channel={} age={}ms",
                    event.guildId(), event.userId(), channelId, age.toMillis());
            return Optional.of(Outcome.ok(LifecycleAction.DUPLICATE_IGNORED,
                    "Channel " + channelId + " was provisioned " + age.toMillis() + "ms ago"));
        }

        return withChannel(channelId, () -> {
            TemporaryChannel current = store.await(registry.find(channelId));
            if (current == null || !current.isOwnedBy(event.userId())) {
                return Optional.empty();
            }
            Optional<PlatformChannel> live = platform.channelInfo(channelId);
            if (live.isPresent()) {
                platform.moveMember(event.guildId(), event.userId(), channelId);
                store.auditQuietly(AuditEntry.success(now(), event.guildId(), event.userId(),
                        AuditEventType.USER_MOVED_TO_EXISTING_CHANNEL, channelId,
                        "User " + event.displayNameOrId() + " (" + event.userId()
                                + ") moved to their existing channel " + channelId + "."));
                return Optional.of(Outcome.ok(LifecycleAction.MOVED_TO_EXISTING));
            }

            store.await(unitOfWork.atomically(registry.remove(channelId)
                    .then(auditLog.append(AuditEntry.success(now(), event.guildId(), event.userId(),
                            AuditEventType.STALE_CHANNEL_CLEANUP, channelId,
                            "Stale channel " + channelId + " removed; the platform no longer has it.")))));
            log.info("Removed stale registry row channel={} owner={}", channelId, event.userId());
            return Optional.empty();
        });
    }

    private Outcome<LifecycleAction> registerAndMove(MemberMovedEvent event, long channelId,
                                                     ChannelSettingsResolver.ChannelSettings channelSettings) {
        long guildId = event.guildId();
        long userId = event.userId();
        TemporaryChannel row = TemporaryChannel.provisioned(channelId, guildId, userId, now());

        try {
            store.await(unitOfWork.atomically(registry.insert(row)
                    .then(auditLog.append(AuditEntry.success(now(), guildId, userId, AuditEventType.CHANNEL_CREATED,
                            channelId, "New channel '" + channelSettings.name() + "' created with limit: "
                                    + channelSettings.userLimit() + ".")))));
        } catch (StoreUnavailableException e) {
            log.warn("Registering channel {} failed, removing it again: {}", channelId, e.getMessage());
            compensateCreation(guildId, channelId);
            return Outcome.fail(FailureKind.STORE_UNAVAILABLE, e.getMessage());
        }

        try {
            platform.moveMember(guildId, userId, channelId);
        } catch (PlatformException e) {
            log.warn("Channel {} created but member {} could not be moved: {}", channelId, userId, e.getMessage());
            Outcome<LifecycleAction> cleanup = teardownIfEmpty(row);
            return Outcome.fail(Outcomes.fromPlatform(e).failure(),
                    "Channel created but member could not be moved (cleanup: "
                            + (cleanup.isSuccess() ? cleanup.value() : cleanup.failure()) + ")");
        }

        log.info("Provisioned channel={} guild={} owner={} name='{}' limit={}",
                channelId, guildId, userId, channelSettings.name(), channelSettings.userLimit());
        return Outcome.ok(LifecycleAction.CREATED);
    }

    private void compensateCreation(long guildId, long channelId) {
        try {
            platform.deleteChannel(channelId);
        } catch (PlatformException e) {
            log.error("Compensating delete failed guild={} channel={}; channel is orphaned on the platform: {}",
                    guildId, channelId, e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Teardown, sweep and reconciliation
    // ---------------------------------------------------------------------

    /**
     * Deletes the channel if it is tracked and empty. A no-op for rows that are already gone.
     */
    public Outcome<LifecycleAction> teardown(long channelId) {
        return Outcomes.guarded(log, "teardown", () -> withChannel(channelId, () -> {
            TemporaryChannel row = store.await(registry.find(channelId));
            if (row == null) {
                return Outcome.ok(LifecycleAction.IGNORED);
            }
            return teardownIfEmpty(row);
        }));
    }

    /** Caller must hold the channel section. */
    private Outcome<LifecycleAction> teardownIfEmpty(TemporaryChannel row) {
        Set<Long> members;
        try {
            members = platform.currentMembers(row.channelId());
        } catch (PlatformException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            members = Set.of();
        }
        if (!members.isEmpty()) {
            return Outcome.ok(LifecycleAction.STILL_OCCUPIED);
        }
        return removeChannel(row);
    }

    /**
     * Platform delete first, then row removal together with its audit entry. A crash between the
     * two leaves a row without a channel, which {@link #reconcile()} prunes.
     */
    private Outcome<LifecycleAction> removeChannel(TemporaryChannel row) {
        long channelId = row.channelId();
        teardownPending.add(channelId);
        try {
            AuditEventType type = AuditEventType.CHANNEL_DELETED;
            String details = "Empty temporary channel " + channelId + " deleted.";
            try {
                platform.deleteChannel(channelId);
            } catch (PlatformException e) {
                if (!e.isNotFound()) {
                    store.auditQuietly(AuditEntry.failure(now(), row.guildId(), null,
                            AuditEventType.CHANNEL_DELETE_ERROR, channelId, "Error deleting channel: " + e.getMessage()));
                    log.warn("Teardown of channel {} failed kind={} err={}", channelId, e.getKind(), e.getMessage());
                    return Outcomes.fromPlatform(e);
                }
                type = AuditEventType.CHANNEL_DELETED_NOT_FOUND;
                details = "Stale entry for channel " + channelId + " removed; channel was already gone.";
            }

            store.await(unitOfWork.atomically(registry.remove(channelId)
                    .then(auditLog.append(AuditEntry.success(now(), row.guildId(), null, type, channelId, details)))));
            log.info("Tore down channel={} guild={} ({})", channelId, row.guildId(), type);
            return Outcome.ok(LifecycleAction.TORN_DOWN);
        } finally {
            teardownPending.remove(channelId);
        }
    }

    /**
     * Runs {@link #teardown(long)} over every tracked channel of every configured guild. Catches
     * channels whose last leave event was lost or whose teardown failed earlier.
     *
     * @return number of channels torn down
     */
    public Outcome<Integer> sweep() {
        return Outcomes.guarded(log, "sweep", () -> {
            int tornDown = 0;
            List<GuildConfig> guilds = store.await(guildConfigs.findAll().collectList());
            for (GuildConfig guild : guilds) {
                List<TemporaryChannel> rows = store.await(registry.findByGuild(guild.guildId()).collectList());
                for (TemporaryChannel row : rows) {
                    Outcome<LifecycleAction> result = teardown(row.channelId());
                    if (result.isSuccess() && result.value() == LifecycleAction.TORN_DOWN) {
                        tornDown++;
                    } else if (!result.isSuccess()) {
                        log.warn("Sweep could not tear down channel={} failure={} detail={}",
                                row.channelId(), result.failure(), result.detail());
                    }
                }
            }
            return Outcome.ok(tornDown);
        });
    }

    /**
     * Crash recovery: removes registry rows whose channel the platform no longer has (audit kind
     * {@link AuditEventType#RECONCILED}) and, for guilds with startup cleanup enabled, tears down
     * tracked channels that are empty.
     */
    public Outcome<ReconciliationReport> reconcile() {
        return Outcomes.guarded(log, "reconcile", () -> {
            int pruned = 0;
            int tornDown = 0;
            int failed = 0;
            List<GuildConfig> guilds = store.await(guildConfigs.findAll().collectList());
            for (GuildConfig guild : guilds) {
                List<TemporaryChannel> rows = store.await(registry.findByGuild(guild.guildId()).collectList());
                for (TemporaryChannel row : rows) {
                    Outcome<LifecycleAction> result = Outcomes.guarded(log, "reconcile",
                            () -> withChannel(row.channelId(), () -> reconcileRow(guild, row.channelId())));
                    if (!result.isSuccess()) {
                        failed++;
                    } else if (result.value() == LifecycleAction.PRUNED) {
                        pruned++;
                    } else if (result.value() == LifecycleAction.TORN_DOWN) {
                        tornDown++;
                    }
                }
            }
            log.info("Reconciliation finished guilds={} pruned={} tornDown={} failed={}",
                    guilds.size(), pruned, tornDown, failed);
            return Outcome.ok(new ReconciliationReport(pruned, tornDown, failed));
        });
    }

    private Outcome<LifecycleAction> reconcileRow(GuildConfig guild, long channelId) {
        TemporaryChannel row = store.await(registry.find(channelId));
        if (row == null) {
            return Outcome.ok(LifecycleAction.IGNORED);
        }
        if (platform.channelInfo(channelId).isEmpty()) {
            store.await(unitOfWork.atomically(registry.remove(channelId)
                    .then(auditLog.append(AuditEntry.success(now(), row.guildId(), null, AuditEventType.RECONCILED,
                            channelId, "Registry row for missing channel " + channelId + " removed on startup.")))));
            log.info("Reconciled orphaned row channel={} guild={}", channelId, row.guildId());
            return Outcome.ok(LifecycleAction.PRUNED);
        }
        if (guild.cleanupOnStartup()) {
            return teardownIfEmpty(row);
        }
        return Outcome.ok(LifecycleAction.STILL_OCCUPIED);
    }

    // ---------------------------------------------------------------------
    // Ownership and access
    // ---------------------------------------------------------------------

    /**
     * Transfers an abandoned channel to a member who is inside it. The previous owner must be
     * absent (or the channel unclaimed) and the requester present.
     */
    public Outcome<TemporaryChannel> claim(long guildId, long channelId, long requesterId) {
        return Outcomes.guarded(log, "claim", () -> withChannel(channelId, () -> {
            TemporaryChannel row = store.await(registry.find(channelId));
            if (row == null || row.guildId() != guildId) {
                return notTracked(channelId);
            }
            Set<Long> members = platform.currentMembers(channelId);
            if (row.ownerId() != null && members.contains(row.ownerId())) {
                return Outcome.fail(FailureKind.NOT_OWNERLESS,
                        "Owner " + row.ownerId() + " is still in channel " + channelId);
            }
            if (!members.contains(requesterId)) {
                return Outcome.fail(FailureKind.NOT_PRESENT,
                        "User " + requesterId + " is not in channel " + channelId);
            }

            platform.setPermission(channelId, PermissionSubject.member(requesterId), true);
            store.await(unitOfWork.atomically(registry.updateOwner(channelId, requesterId)
                    .then(auditLog.append(AuditEntry.success(now(), guildId, requesterId,
                            AuditEventType.CHANNEL_CLAIMED, channelId,
                            "User " + requesterId + " claimed channel " + channelId
                                    + " from old owner " + row.ownerId() + ".")))));
            log.info("Channel {} claimed by {} (previous owner {})", channelId, requesterId, row.ownerId());
            return Outcome.ok(row.withOwner(requesterId));
        }));
    }

    /**
     * Denies connect for the general-member role. Explicit allow entries for the owner and every
     * permitted member are re-asserted so they keep access.
     */
    public Outcome<TemporaryChannel> lock(long guildId, long channelId, long callerId) {
        return Outcomes.guarded(log, "lock", () -> withOwnedChannel(guildId, channelId, callerId, row -> {
            platform.setPermission(channelId, PermissionSubject.everyone(guildId), false);
            platform.setPermission(channelId, PermissionSubject.member(callerId), true);
            for (Long permitted : row.permittedUserIds()) {
                platform.setPermission(channelId, PermissionSubject.member(permitted), true);
            }
            store.await(unitOfWork.atomically(registry.updateLocked(channelId, true)
                    .then(auditLog.append(AuditEntry.success(now(), guildId, callerId,
                            AuditEventType.CHANNEL_LOCKED, channelId,
                            "User " + callerId + " locked channel " + channelId + ".")))));
            return Outcome.ok(row.withLocked(true));
        }));
    }

    public Outcome<TemporaryChannel> unlock(long guildId, long channelId, long callerId) {
        return Outcomes.guarded(log, "unlock", () -> withOwnedChannel(guildId, channelId, callerId, row -> {
            platform.setPermission(channelId, PermissionSubject.everyone(guildId), true);
            store.await(unitOfWork.atomically(registry.updateLocked(channelId, false)
                    .then(auditLog.append(AuditEntry.success(now(), guildId, callerId,
                            AuditEventType.CHANNEL_UNLOCKED, channelId,
                            "User " + callerId + " unlocked channel " + channelId + ".")))));
            return Outcome.ok(row.withLocked(false));
        }));
    }

    /**
     * Adds {@code targetUserId} to the channel's allow-list. The grant survives lock/unlock
     * cycles. If the platform rejects the grant, the stored allow-list is left unchanged.
     */
    public Outcome<TemporaryChannel> permit(long guildId, long channelId, long callerId, long targetUserId) {
        return Outcomes.guarded(log, "permit", () -> withOwnedChannel(guildId, channelId, callerId, row -> {
            platform.setPermission(channelId, PermissionSubject.member(targetUserId), true);
            store.await(unitOfWork.atomically(registry.addPermitted(channelId, targetUserId)
                    .then(auditLog.append(AuditEntry.success(now(), guildId, callerId,
                            AuditEventType.CHANNEL_PERMIT, channelId,
                            "User " + callerId + " permitted " + targetUserId + " to join channel "
                                    + channelId + ".")))));
            return Outcome.ok(row.withPermitted(targetUserId));
        }));
    }

    // ---------------------------------------------------------------------
    // Name and limit
    // ---------------------------------------------------------------------

    /**
     * Stores the member's preferred channel name and, if they own a live channel, renames it.
     */
    public Outcome<PreferenceScope> setName(long guildId, long userId, String name) {
        Optional<String> problem = constraints.checkName(name);
        if (problem.isPresent()) {
            return Outcome.fail(FailureKind.INVALID_VALUE, problem.get());
        }
        String value = name.strip();
        return applyPreference("name", guildId, userId,
                channelId -> platform.renameChannel(channelId, value),
                () -> settings.saveUserChannelName(guildId, userId, value),
                AuditEventType.LIVE_CHANNEL_NAME_CHANGED,
                AuditEventType.USER_DEFAULT_NAME_SET,
                "channel name to '" + value + "'");
    }

    /**
     * Stores the member's preferred user limit (0 = unlimited) and, if they own a live channel,
     * applies it there too.
     */
    public Outcome<PreferenceScope> setLimit(long guildId, long userId, int limit) {
        Optional<String> problem = constraints.checkLimit(limit);
        if (problem.isPresent()) {
            return Outcome.fail(FailureKind.INVALID_VALUE, problem.get());
        }
        return applyPreference("limit", guildId, userId,
                channelId -> platform.setLimit(channelId, limit),
                () -> settings.saveUserChannelLimit(guildId, userId, limit),
                AuditEventType.LIVE_CHANNEL_LIMIT_CHANGED,
                AuditEventType.USER_DEFAULT_LIMIT_SET,
                "channel limit to " + (limit == 0 ? "unlimited" : String.valueOf(limit)));
    }

    private Outcome<PreferenceScope> applyPreference(String operation, long guildId, long userId,
                                                     LongConsumer liveChange, Supplier<Mono<Void>> save,
                                                     AuditEventType liveType, AuditEventType preferenceType,
                                                     String change) {
        return Outcomes.guarded(log, operation, () -> {
            TemporaryChannel owned = newestLiveOwned(guildId, userId);
            if (owned == null) {
                return savePreferenceOnly(guildId, userId, save, preferenceType, change);
            }
            long channelId = owned.channelId();
            return withChannel(channelId, () -> {
                TemporaryChannel current = store.await(registry.find(channelId));
                if (current == null || !current.isOwnedBy(userId)) {
                    return savePreferenceOnly(guildId, userId, save, preferenceType, change);
                }
                liveChange.accept(channelId);
                store.await(unitOfWork.atomically(save.get()
                        .then(auditLog.append(AuditEntry.success(now(), guildId, userId, liveType, channelId,
                                "User " + userId + " changed live " + change + ".")))));
                return Outcome.ok(PreferenceScope.LIVE_CHANNEL);
            });
        });
    }

    private Outcome<PreferenceScope> savePreferenceOnly(long guildId, long userId, Supplier<Mono<Void>> save,
                                                        AuditEventType type, String change) {
        store.await(unitOfWork.atomically(save.get()
                .then(auditLog.append(AuditEntry.success(now(), guildId, userId, type, null,
                        "User " + userId + " set default " + change + ".")))));
        return Outcome.ok(PreferenceScope.PREFERENCE_ONLY);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Snapshot of the guild's tracked channels. Member counts are read without holding any
     * section and may already be stale when displayed.
     */
    public Outcome<List<ChannelListing>> list(long guildId, long actorId) {
        return Outcomes.guarded(log, "list", () -> {
            List<TemporaryChannel> rows = store.await(registry.findByGuild(guildId).collectList());
            List<ChannelListing> listings = new ArrayList<>(rows.size());
            for (TemporaryChannel row : rows) {
                Integer memberCount;
                try {
                    memberCount = platform.currentMembers(row.channelId()).size();
                } catch (PlatformException e) {
                    log.debug("Member count unavailable channel={} kind={}", row.channelId(), e.getKind());
                    memberCount = null;
                }
                listings.add(new ChannelListing(row.channelId(), row.ownerId(), row.locked(),
                        row.permittedUserIds(), memberCount, row.createdAt()));
            }
            store.auditQuietly(AuditEntry.success(now(), guildId, actorId, AuditEventType.LIST_CHANNELS, null,
                    "User " + actorId + " listed active temporary channels."));
            return Outcome.ok(listings);
        });
    }

    /**
     * Most recent audit entries, newest first. {@code count} defaults to {@code audit-log-default}
     * and is clamped to {@code [1, audit-log-max]}.
     */
    public Outcome<List<AuditEntry>> recentAudit(long guildId, Integer count) {
        int limit = count == null
                ? props.getAuditLogDefault()
                : Math.max(1, Math.min(count, props.getAuditLogMax()));
        return Outcomes.guarded(log, "auditlog",
                () -> Outcome.ok(store.await(auditLog.latest(guildId, limit).collectList())));
    }

    /** Read-only view of a registry row for other components. */
    public Outcome<TemporaryChannel> trackedChannel(long channelId) {
        return Outcomes.guarded(log, "tracked-channel", () -> {
            TemporaryChannel row = store.await(registry.find(channelId));
            return row == null ? notTracked(channelId) : Outcome.ok(row);
        });
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private <T> T withChannel(long channelId, Supplier<T> body) {
        return channelSections.call(channelId, props.getSectionTimeout(), body);
    }

    private <T> Outcome<T> withOwnedChannel(long guildId, long channelId, long callerId,
                                            Function<TemporaryChannel, Outcome<T>> body) {
        return withChannel(channelId, () -> {
            TemporaryChannel row = store.await(registry.find(channelId));
            if (row == null || row.guildId() != guildId) {
                return notTracked(channelId);
            }
            if (!row.isOwnedBy(callerId)) {
                return Outcome.fail(FailureKind.NOT_OWNER,
                        "User " + callerId + " does not own channel " + channelId);
            }
            return body.apply(row);
        });
    }

    private TemporaryChannel newestLiveOwned(long guildId, long userId) {
        List<TemporaryChannel> owned = store.await(registry.findByOwner(guildId, userId).collectList());
        for (TemporaryChannel row : owned) {
            if (!teardownPending.contains(row.channelId())) {
                return row;
            }
        }
        return null;
    }

    private static <T> Outcome<T> notTracked(long channelId) {
        return Outcome.fail(FailureKind.NOT_TRACKED, "Channel " + channelId + " is not a managed temporary channel");
    }

    private Instant now() {
        return clock.instant();
    }

    int activeSections() {
        return channelSections.activeKeys() + memberSections.activeKeys();
    }
}
