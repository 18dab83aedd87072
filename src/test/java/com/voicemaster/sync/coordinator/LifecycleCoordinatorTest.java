package com.voicemaster.sync.coordinator;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.voicemaster.sync.core.model.AuditEntry;
import com.voicemaster.sync.core.model.AuditEventType;
import com.voicemaster.sync.core.model.GuildConfig;
import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.model.TemporaryChannel;
import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.MemberMovedEvent;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.support.FakePlatformGateway;
import com.voicemaster.sync.support.InMemoryAuditLog;
import com.voicemaster.sync.support.InMemoryChannelRegistry;
import com.voicemaster.sync.support.InMemoryGuildConfigStore;
import com.voicemaster.sync.support.InMemorySettingsStore;
import com.voicemaster.sync.support.InMemoryUnitOfWork;
import com.voicemaster.sync.support.MutableClock;

class LifecycleCoordinatorTest {

    private static final long GUILD = 1L;
    private static final long ADMIN = 9L;
    private static final long ALICE = 100L;
    private static final long BOB = 200L;
    private static final long CAROL = 300L;
    private static final long DAVE = 400L;

    private FakePlatformGateway platform;
    private InMemoryGuildConfigStore guildConfigs;
    private InMemorySettingsStore settings;
    private InMemoryChannelRegistry registry;
    private InMemoryAuditLog auditLog;
    private InMemoryUnitOfWork unitOfWork;
    private MutableClock clock;
    private CoordinatorProperties props;
    private LifecycleCoordinator coordinator;

    private long categoryId;
    private long incubatorId;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        platform = new FakePlatformGateway();
        guildConfigs = new InMemoryGuildConfigStore();
        settings = new InMemorySettingsStore();
        registry = new InMemoryChannelRegistry();
        auditLog = new InMemoryAuditLog();
        unitOfWork = new InMemoryUnitOfWork();
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));

        props = new CoordinatorProperties();
        props.setSectionTimeout(Duration.ofSeconds(2));
        props.setStoreTimeout(Duration.ofSeconds(2));
        props.setCreationDebounce(Duration.ofSeconds(10));
        props.setAuditLogDefault(3);
        props.setAuditLogMax(5);

        coordinator = new LifecycleCoordinator(platform, guildConfigs, settings, registry, auditLog, unitOfWork,
                props, clock);

        categoryId = platform.addCategory(GUILD, "Temp Channels");
        incubatorId = platform.addVoice(GUILD, categoryId, "Join to Create");
        guildConfigs.save(new GuildConfig(GUILD, ADMIN, categoryId, incubatorId, true)).block();

        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    /** Joins the incubator and returns the channel the member was moved into. */
    private long provision(long userId, String name) {
        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, userId, name, incubatorId));
        assertThat(result.join().value()).isEqualTo(LifecycleAction.CREATED);
        return platform.locate(userId);
    }

    // ---------------------------------------------------------------------
    // Provisioning
    // ---------------------------------------------------------------------

    @Test
    void joiningIncubatorCreatesChannelAndMovesOwner() {
        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.join().value()).isEqualTo(LifecycleAction.CREATED);

        Long channelId = platform.locate(ALICE);
        assertThat(channelId).isNotNull().isNotEqualTo(incubatorId);
        assertThat(platform.nameOf(channelId)).isEqualTo("Alice's Channel");

        TemporaryChannel row = registry.get(channelId);
        assertThat(row.ownerId()).isEqualTo(ALICE);
        assertThat(row.locked()).isFalse();
        assertThat(row.permittedUserIds()).isEmpty();
        assertThat(auditLog.count(AuditEventType.CHANNEL_CREATED)).isEqualTo(1);
    }

    @Test
    void newChannelUsesUserPreferenceOverGuildDefaults() {
        settings.saveGuildDefaults(new GuildDefaults(GUILD, "Room of {user}", 4)).block();
        settings.saveUserChannelLimit(GUILD, ALICE, 7).block();

        long channelId = provision(ALICE, "Alice");

        assertThat(platform.nameOf(channelId)).isEqualTo("Room of Alice");
        assertThat(platform.limitOf(channelId)).isEqualTo(7);
    }

    @Test
    void redeliveredJoinWithinDebounceWindowIsIgnored() {
        MemberMovedEvent join = platform.join(GUILD, ALICE, "Alice", incubatorId);

        coordinator.onMemberMoved(join);
        MemberMoveResult second = coordinator.onMemberMoved(join);

        assertThat(second.join().value()).isEqualTo(LifecycleAction.DUPLICATE_IGNORED);
        assertThat(platform.calls(FakePlatformGateway.CREATE_CHANNEL)).isEqualTo(1);
        assertThat(registry.snapshot()).hasSize(1);
    }

    @Test
    void concurrentDuplicateJoinsCreateExactlyOneChannel() throws Exception {
        MemberMovedEvent join = platform.join(GUILD, ALICE, "Alice", incubatorId);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MemberMoveResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return coordinator.onMemberMoved(join);
            }));
        }
        start.countDown();

        int created = 0;
        int ignored = 0;
        for (Future<MemberMoveResult> f : futures) {
            LifecycleAction action = f.get(10, TimeUnit.SECONDS).join().value();
            if (action == LifecycleAction.CREATED) created++;
            if (action == LifecycleAction.DUPLICATE_IGNORED) ignored++;
        }

        assertThat(created).isEqualTo(1);
        assertThat(ignored).isEqualTo(7);
        assertThat(registry.snapshot()).hasSize(1);
        assertThat(platform.voiceChannelCount()).isEqualTo(2);
        assertThat(coordinator.activeSections()).isZero();
    }

    @Test
    void ownerRejoiningIncubatorAfterDebounceIsMovedToExistingChannel() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));
        clock.advance(Duration.ofSeconds(30));

        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.leave().value()).isEqualTo(LifecycleAction.STILL_OCCUPIED);
        assertThat(result.join().value()).isEqualTo(LifecycleAction.MOVED_TO_EXISTING);
        assertThat(platform.locate(ALICE)).isEqualTo(channelId);
        assertThat(platform.calls(FakePlatformGateway.CREATE_CHANNEL)).isEqualTo(1);
        assertThat(auditLog.count(AuditEventType.USER_MOVED_TO_EXISTING_CHANNEL)).isEqualTo(1);
    }

    @Test
    void staleOwnedRowIsRemovedAndFreshChannelProvisioned() {
        long oldChannel = provision(ALICE, "Alice");
        platform.removeOutOfBand(oldChannel);
        clock.advance(Duration.ofSeconds(30));

        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.join().value()).isEqualTo(LifecycleAction.CREATED);
        assertThat(registry.get(oldChannel)).isNull();
        assertThat(registry.snapshot()).hasSize(1);
        assertThat(auditLog.count(AuditEventType.STALE_CHANNEL_CLEANUP)).isEqualTo(1);
    }

    @Test
    void joinIsIgnoredWhenGuildIsNotSetUpOrDisabled() {
        MemberMovedEvent otherGuild = new MemberMovedEvent(77L, ALICE, "Alice", null, 5L, Instant.EPOCH);
        assertThat(coordinator.onMemberMoved(otherGuild).join().value()).isEqualTo(LifecycleAction.IGNORED);

        guildConfigs.save(guildConfigs.get(GUILD).withIncubator(null)).block();
        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.join().value()).isEqualTo(LifecycleAction.IGNORED);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void missingCategoryFailsWithInvalidConfiguration() {
        platform.removeOutOfBand(categoryId);

        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.join().failure()).isEqualTo(FailureKind.INVALID_CONFIGURATION);
        assertThat(auditLog.count(AuditEventType.CATEGORY_NOT_FOUND)).isEqualTo(1);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void platformOutageDuringCreationIsReportedAndAudited() {
        platform.fail(FakePlatformGateway.CREATE_CHANNEL, PlatformException.Kind.UNAVAILABLE);

        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.join().failure()).isEqualTo(FailureKind.PLATFORM_UNAVAILABLE);
        assertThat(auditLog.count(AuditEventType.CHANNEL_CREATION_FAILED)).isEqualTo(1);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void storeFailureAfterCreationDeletesTheNewChannel() {
        unitOfWork.setFailing(true);

        MemberMoveResult result = coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", incubatorId));

        assertThat(result.join().failure()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
        assertThat(registry.snapshot()).isEmpty();
        assertThat(platform.voiceChannelCount()).isEqualTo(1);
        assertThat(platform.locate(ALICE)).isEqualTo(incubatorId);
    }

    // ---------------------------------------------------------------------
    // Teardown and recovery
    // ---------------------------------------------------------------------

    @Test
    void lastMemberLeavingTearsDownChannel() {
        long channelId = provision(ALICE, "Alice");

        MemberMoveResult result = coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        assertThat(result.leave().value()).isEqualTo(LifecycleAction.TORN_DOWN);
        assertThat(platform.exists(channelId)).isFalse();
        assertThat(registry.get(channelId)).isNull();
        assertThat(auditLog.types()).contains(AuditEventType.USER_LEFT_OWNED_CHANNEL, AuditEventType.CHANNEL_DELETED);
    }

    @Test
    void channelStaysWhileOtherMembersRemain() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));

        MemberMoveResult result = coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        assertThat(result.leave().value()).isEqualTo(LifecycleAction.STILL_OCCUPIED);
        assertThat(platform.exists(channelId)).isTrue();
        assertThat(auditLog.count(AuditEventType.USER_LEFT_OWNED_CHANNEL)).isEqualTo(1);
    }

    @Test
    void leavingUntrackedChannelIsIgnored() {
        long lobby = platform.addVoice(GUILD, null, "Lobby");
        platform.join(GUILD, BOB, "Bob", lobby);

        MemberMoveResult result = coordinator.onMemberMoved(platform.leave(GUILD, BOB));

        assertThat(result.leave().value()).isEqualTo(LifecycleAction.IGNORED);
        assertThat(platform.exists(lobby)).isTrue();
    }

    @Test
    void teardownOfChannelDeletedOutOfBandRemovesRow() {
        long channelId = provision(ALICE, "Alice");
        platform.removeOutOfBand(channelId);

        Outcome<LifecycleAction> outcome = coordinator.teardown(channelId);

        assertThat(outcome.value()).isEqualTo(LifecycleAction.TORN_DOWN);
        assertThat(registry.get(channelId)).isNull();
        assertThat(auditLog.count(AuditEventType.CHANNEL_DELETED_NOT_FOUND)).isEqualTo(1);
    }

    @Test
    void failedPlatformDeleteKeepsRowAndAuditsError() {
        long channelId = provision(ALICE, "Alice");
        platform.fail(FakePlatformGateway.DELETE_CHANNEL, PlatformException.Kind.FORBIDDEN);

        MemberMoveResult result = coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        assertThat(result.leave().failure()).isEqualTo(FailureKind.FORBIDDEN);
        assertThat(registry.get(channelId)).isNotNull();
        assertThat(auditLog.count(AuditEventType.CHANNEL_DELETE_ERROR)).isEqualTo(1);
    }

    @Test
    void crashBetweenDeleteAndRowRemovalIsRepairedByReconciliation() {
        long channelId = provision(ALICE, "Alice");
        unitOfWork.setFailing(true);

        MemberMoveResult result = coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        assertThat(result.leave().failure()).isEqualTo(FailureKind.STORE_UNAVAILABLE);
        assertThat(platform.exists(channelId)).isFalse();
        assertThat(registry.get(channelId)).isNotNull();

        unitOfWork.setFailing(false);
        Outcome<ReconciliationReport> report = coordinator.reconcile();

        assertThat(report.value()).isEqualTo(new ReconciliationReport(1, 0, 0));
        assertThat(registry.get(channelId)).isNull();
        assertThat(auditLog.count(AuditEventType.RECONCILED)).isEqualTo(1);
    }

    @Test
    void reconciliationTearsDownEmptyChannelsOnlyWhenCleanupEnabled() {
        long aliceChannel = provision(ALICE, "Alice");
        long bobChannel = provision(BOB, "Bob");
        platform.dropSilently(ALICE);

        guildConfigs.save(guildConfigs.get(GUILD).withCleanupOnStartup(false)).block();
        assertThat(coordinator.reconcile().value()).isEqualTo(new ReconciliationReport(0, 0, 0));
        assertThat(platform.exists(aliceChannel)).isTrue();

        guildConfigs.save(guildConfigs.get(GUILD).withCleanupOnStartup(true)).block();
        assertThat(coordinator.reconcile().value()).isEqualTo(new ReconciliationReport(0, 1, 0));
        assertThat(platform.exists(aliceChannel)).isFalse();
        assertThat(platform.exists(bobChannel)).isTrue();
    }

    @Test
    void sweepTearsDownChannelsWhoseLeaveEventWasLost() {
        long channelId = provision(ALICE, "Alice");
        provision(BOB, "Bob");
        platform.dropSilently(ALICE);

        Outcome<Integer> swept = coordinator.sweep();

        assertThat(swept.value()).isEqualTo(1);
        assertThat(registry.get(channelId)).isNull();
        assertThat(registry.snapshot()).hasSize(1);
    }

    // ---------------------------------------------------------------------
    // Claim
    // ---------------------------------------------------------------------

    @Test
    void claimFailsWhileOwnerIsPresent() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));

        Outcome<TemporaryChannel> outcome = coordinator.claim(GUILD, channelId, BOB);

        assertThat(outcome.failure()).isEqualTo(FailureKind.NOT_OWNERLESS);
        assertThat(registry.get(channelId).ownerId()).isEqualTo(ALICE);
    }

    @Test
    void claimFailsWhenRequesterIsNotInTheChannel() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));
        coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        Outcome<TemporaryChannel> outcome = coordinator.claim(GUILD, channelId, CAROL);

        assertThat(outcome.failure()).isEqualTo(FailureKind.NOT_PRESENT);
        assertThat(registry.get(channelId).ownerId()).isEqualTo(ALICE);
    }

    @Test
    void claimOfUntrackedChannelFails() {
        long lobby = platform.addVoice(GUILD, null, "Lobby");
        platform.join(GUILD, BOB, "Bob", lobby);

        assertThat(coordinator.claim(GUILD, lobby, BOB).failure()).isEqualTo(FailureKind.NOT_TRACKED);
    }

    @Test
    void memberInsideAbandonedChannelCanClaimIt() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));
        coordinator.onMemberMoved(platform.leave(GUILD, ALICE));

        Outcome<TemporaryChannel> outcome = coordinator.claim(GUILD, channelId, BOB);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value().ownerId()).isEqualTo(BOB);
        assertThat(registry.get(channelId).ownerId()).isEqualTo(BOB);
        assertThat(platform.canConnect(channelId, BOB)).isTrue();
        assertThat(auditLog.count(AuditEventType.CHANNEL_CLAIMED)).isEqualTo(1);

        assertThat(coordinator.lock(GUILD, channelId, ALICE).failure()).isEqualTo(FailureKind.NOT_OWNER);
        assertThat(coordinator.lock(GUILD, channelId, BOB).isSuccess()).isTrue();
    }

    // ---------------------------------------------------------------------
    // Lock / unlock / permit
    // ---------------------------------------------------------------------

    @Test
    void permitSurvivesUnlockAndRelock() {
        long channelId = provision(ALICE, "Alice");

        assertThat(coordinator.lock(GUILD, channelId, ALICE).isSuccess()).isTrue();
        assertThat(platform.canConnect(channelId, CAROL)).isFalse();
        assertThat(platform.canConnect(channelId, ALICE)).isTrue();

        assertThat(coordinator.permit(GUILD, channelId, ALICE, CAROL).isSuccess()).isTrue();
        assertThat(platform.canConnect(channelId, CAROL)).isTrue();

        assertThat(coordinator.unlock(GUILD, channelId, ALICE).value().locked()).isFalse();
        assertThat(platform.canConnect(channelId, DAVE)).isTrue();

        Outcome<TemporaryChannel> relocked = coordinator.lock(GUILD, channelId, ALICE);
        assertThat(relocked.value().locked()).isTrue();
        assertThat(platform.canConnect(channelId, CAROL)).isTrue();
        assertThat(platform.canConnect(channelId, DAVE)).isFalse();

        TemporaryChannel row = registry.get(channelId);
        assertThat(row.locked()).isTrue();
        assertThat(row.permittedUserIds()).containsExactly(CAROL);
        assertThat(auditLog.types()).contains(AuditEventType.CHANNEL_LOCKED, AuditEventType.CHANNEL_PERMIT,
                AuditEventType.CHANNEL_UNLOCKED);
    }

    @Test
    void onlyOwnerCanLockOrPermit() {
        long channelId = provision(ALICE, "Alice");
        int overwritesBefore = platform.calls(FakePlatformGateway.SET_PERMISSION);

        assertThat(coordinator.lock(GUILD, channelId, BOB).failure()).isEqualTo(FailureKind.NOT_OWNER);
        assertThat(coordinator.permit(GUILD, channelId, BOB, CAROL).failure()).isEqualTo(FailureKind.NOT_OWNER);
        assertThat(coordinator.unlock(GUILD, 999L, ALICE).failure()).isEqualTo(FailureKind.NOT_TRACKED);

        assertThat(platform.calls(FakePlatformGateway.SET_PERMISSION)).isEqualTo(overwritesBefore);
        assertThat(registry.get(channelId).locked()).isFalse();
    }

    @Test
    void rejectedPermitLeavesAllowListUnchanged() {
        long channelId = provision(ALICE, "Alice");
        platform.fail(FakePlatformGateway.SET_PERMISSION, PlatformException.Kind.FORBIDDEN);

        Outcome<TemporaryChannel> outcome = coordinator.permit(GUILD, channelId, ALICE, CAROL);

        assertThat(outcome.failure()).isEqualTo(FailureKind.FORBIDDEN);
        assertThat(registry.get(channelId).permittedUserIds()).isEmpty();
        assertThat(auditLog.count(AuditEventType.CHANNEL_PERMIT)).isZero();
    }

    @Test
    void lockAndTeardownOfSameChannelNeverOverlap() throws Exception {
        long channelId = provision(ALICE, "Alice");
        platform.dropSilently(ALICE);
        platform.delay(FakePlatformGateway.SET_PERMISSION, Duration.ofMillis(150));

        CountDownLatch lockStarted = new CountDownLatch(1);
        Future<Outcome<TemporaryChannel>> lock = pool.submit(() -> {
            lockStarted.countDown();
            return coordinator.lock(GUILD, channelId, ALICE);
        });
        lockStarted.await();
        Thread.sleep(50);
        Future<Outcome<LifecycleAction>> teardown = pool.submit((Callable<Outcome<LifecycleAction>>) () -> coordinator.teardown(channelId));

        assertThat(lock.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(teardown.get(10, TimeUnit.SECONDS).value()).isEqualTo(LifecycleAction.TORN_DOWN);
        assertThat(platform.overlapDetected()).isFalse();
        assertThat(registry.get(channelId)).isNull();
    }

    @Test
    void waitingLongerThanSectionTimeoutFailsWithBusy() throws Exception {
        props.setSectionTimeout(Duration.ofMillis(100));
        coordinator = new LifecycleCoordinator(platform, guildConfigs, settings, registry, auditLog, unitOfWork,
                props, clock);
        long channelId = provision(ALICE, "Alice");
        platform.delay(FakePlatformGateway.SET_PERMISSION, Duration.ofMillis(300));

        CountDownLatch lockStarted = new CountDownLatch(1);
        Future<Outcome<TemporaryChannel>> lock = pool.submit(() -> {
            lockStarted.countDown();
            return coordinator.lock(GUILD, channelId, ALICE);
        });
        lockStarted.await();
        Thread.sleep(50);

        Outcome<TemporaryChannel> unlock = coordinator.unlock(GUILD, channelId, ALICE);

        assertThat(unlock.failure()).isEqualTo(FailureKind.BUSY);
        assertThat(lock.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
    }

    // ---------------------------------------------------------------------
    // Name and limit
    // ---------------------------------------------------------------------

    @Test
    void invalidLimitIsRejectedWithoutAnyChange() {
        long channelId = provision(ALICE, "Alice");

        assertThat(coordinator.setLimit(GUILD, ALICE, -1).failure()).isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(coordinator.setLimit(GUILD, ALICE, props.getMaxUserLimit() + 1).failure())
                .isEqualTo(FailureKind.INVALID_VALUE);

        assertThat(platform.calls(FakePlatformGateway.SET_LIMIT)).isZero();
        assertThat(platform.limitOf(channelId)).isZero();
        assertThat(settings.preference(GUILD, ALICE)).isNull();
    }

    @Test
    void invalidNameIsRejectedWithoutAnyChange() {
        provision(ALICE, "Alice");

        assertThat(coordinator.setName(GUILD, ALICE, "   ").failure()).isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(coordinator.setName(GUILD, ALICE, "x".repeat(props.getMaxNameLength() + 1)).failure())
                .isEqualTo(FailureKind.INVALID_VALUE);
        assertThat(platform.calls(FakePlatformGateway.RENAME)).isZero();
    }

    @Test
    void limitAppliesToLiveChannelAndBecomesPreference() {
        long channelId = provision(ALICE, "Alice");

        Outcome<PreferenceScope> outcome = coordinator.setLimit(GUILD, ALICE, 5);

        assertThat(outcome.value()).isEqualTo(PreferenceScope.LIVE_CHANNEL);
        assertThat(platform.limitOf(channelId)).isEqualTo(5);
        assertThat(settings.preference(GUILD, ALICE).userLimit()).isEqualTo(5);
        assertThat(auditLog.count(AuditEventType.LIVE_CHANNEL_LIMIT_CHANGED)).isEqualTo(1);
    }

    @Test
    void nameWithoutLiveChannelOnlyStoresPreference() {
        Outcome<PreferenceScope> outcome = coordinator.setName(GUILD, ALICE, "  Alice HQ ");

        assertThat(outcome.value()).isEqualTo(PreferenceScope.PREFERENCE_ONLY);
        assertThat(settings.preference(GUILD, ALICE).channelName()).isEqualTo("Alice HQ");
        assertThat(auditLog.count(AuditEventType.USER_DEFAULT_NAME_SET)).isEqualTo(1);

        long channelId = provision(ALICE, "Alice");
        assertThat(platform.nameOf(channelId)).isEqualTo("Alice HQ");
    }

    @Test
    void renameAppliesToOwnedChannelEvenWhenOwnerIsElsewhere() {
        long channelId = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, BOB, "Bob", channelId));
        long lobby = platform.addVoice(GUILD, null, "Lobby");
        coordinator.onMemberMoved(platform.join(GUILD, ALICE, "Alice", lobby));

        Outcome<PreferenceScope> outcome = coordinator.setName(GUILD, ALICE, "Gaming");

        assertThat(outcome.value()).isEqualTo(PreferenceScope.LIVE_CHANNEL);
        assertThat(platform.nameOf(channelId)).isEqualTo("Gaming");
        assertThat(auditLog.count(AuditEventType.LIVE_CHANNEL_NAME_CHANGED)).isEqualTo(1);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @Test
    void listReportsTrackedChannelsWithMemberCounts() {
        long aliceChannel = provision(ALICE, "Alice");
        coordinator.onMemberMoved(platform.join(GUILD, CAROL, "Carol", aliceChannel));
        provision(BOB, "Bob");

        Outcome<List<ChannelListing>> outcome = coordinator.list(GUILD, ADMIN);

        assertThat(outcome.value()).hasSize(2);
        ChannelListing alice = outcome.value().stream()
                .filter(l -> l.channelId() == aliceChannel).findFirst().orElseThrow();
        assertThat(alice.ownerId()).isEqualTo(ALICE);
        assertThat(alice.memberCount()).isEqualTo(2);
        assertThat(auditLog.count(AuditEventType.LIST_CHANNELS)).isEqualTo(1);
    }

    @Test
    void auditLogCountIsDefaultedAndClamped() {
        for (int i = 0; i < 8; i++) {
            auditLog.append(AuditEntry.success(clock.instant().plusSeconds(i), GUILD, ALICE,
                    AuditEventType.USER_DEFAULT_NAME_SET, null, "entry " + i)).block();
        }

        assertThat(coordinator.recentAudit(GUILD, null).value()).hasSize(3);
        assertThat(coordinator.recentAudit(GUILD, 0).value()).hasSize(1);
        assertThat(coordinator.recentAudit(GUILD, 1000).value()).hasSize(5);

        List<AuditEntry> latest = coordinator.recentAudit(GUILD, 2).value();
        assertThat(latest).extracting(AuditEntry::details).containsExactly("entry 7", "entry 6");
    }

    @Test
    void auditStoreOutageDoesNotFailLifecycle() {
        auditLog.setFailing(true);
        long channelId = platform.addVoice(GUILD, categoryId, "stray");
        registry.put(TemporaryChannel.provisioned(channelId, GUILD, ALICE, clock.instant()));

        assertThat(coordinator.list(GUILD, ADMIN).isSuccess()).isTrue();
        assertThat(coordinator.recentAudit(GUILD, 5).value()).isEmpty();
    }

    @Test
    void trackedChannelExposesRegistryRow() {
        long channelId = provision(ALICE, "Alice");

        assertThat(coordinator.trackedChannel(channelId).value().ownerId()).isEqualTo(ALICE);
        assertThat(coordinator.trackedChannel(incubatorId).failure()).isEqualTo(FailureKind.NOT_TRACKED);
    }
}
