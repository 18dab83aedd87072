package com.voicemaster.sync.r2dbc.store;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.voicemaster.sync.core.model.TemporaryChannel;
import com.voicemaster.sync.core.store.ChannelRegistry;
import com.voicemaster.sync.r2dbc.entity.TemporaryChannelEntity;

import io.r2dbc.spi.Readable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for temporary_channel and its permitted set in temporary_channel_permit.
 *
 * Rows are read together with their permitted set; a duplicate insert fails on the primary key.
 */
@Repository
public class R2dbcChannelRegistry implements ChannelRegistry {

	private static final String COLUMNS = "channel_id, guild_id, owner_id, locked, created_at";

	private final DatabaseClient db;

	public R2dbcChannelRegistry(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<TemporaryChannel> find(long channelId) {
		String sql = "SELECT " + COLUMNS + " FROM temporary_channel WHERE channel_id = :channel_id";
		return db.sql(sql).bind("channel_id", channelId).map(R2dbcChannelRegistry::read).one()
				.flatMap(this::withPermits)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("temporary_channel.find", e));
	}

	@Override
	public Flux<TemporaryChannel> findByOwner(long guildId, long ownerId) {
		String sql = "SELECT " + COLUMNS + " FROM temporary_channel WHERE guild_id = :guild_id AND owner_id = :owner_id "
				+ "ORDER BY created_at DESC, channel_id DESC";
		return db.sql(sql).bind("guild_id", guildId).bind("owner_id", ownerId).map(R2dbcChannelRegistry::read).all()
				.concatMap(this::withPermits)
				.onErrorMap(StoreErrors::isNotStoreError,
						e -> StoreErrors.unavailable("temporary_channel.findByOwner", e));
	}

	@Override
	public Flux<TemporaryChannel> findByGuild(long guildId) {
		String sql = "SELECT " + COLUMNS + " FROM temporary_channel WHERE guild_id = :guild_id "
				+ "ORDER BY created_at ASC, channel_id ASC";
		return db.sql(sql).bind("guild_id", guildId).map(R2dbcChannelRegistry::read).all()
				.concatMap(this::withPermits)
				.onErrorMap(StoreErrors::isNotStoreError,
						e -> StoreErrors.unavailable("temporary_channel.findByGuild", e));
	}

	@Override
	public Mono<Void> insert(TemporaryChannel channel) {
		String sql = "INSERT INTO temporary_channel (" + COLUMNS + ") "
				+ "VALUES (:channel_id, :guild_id, :owner_id, :locked, :created_at)";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("channel_id", channel.channelId())
				.bind("guild_id", channel.guildId()).bind("locked", channel.locked())
				.bind("created_at", StoreErrors.utc(channel.createdAt()));
		spec = channel.ownerId() == null ? spec.bindNull("owner_id", Long.class) : spec.bind("owner_id", channel.ownerId());

		return spec.fetch().rowsUpdated()
				.thenMany(Flux.fromIterable(channel.permittedUserIds())
						.concatMap(userId -> insertPermit(channel.channelId(), userId)))
				.then()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("temporary_channel.insert", e));
	}

	@Override
	public Mono<Void> updateOwner(long channelId, Long ownerId) {
		String sql = "UPDATE temporary_channel SET owner_id = :owner_id WHERE channel_id = :channel_id";
		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("channel_id", channelId);
		spec = ownerId == null ? spec.bindNull("owner_id", Long.class) : spec.bind("owner_id", ownerId);
		return spec.fetch().rowsUpdated().then()
				.onErrorMap(StoreErrors::isNotStoreError,
						e -> StoreErrors.unavailable("temporary_channel.updateOwner", e));
	}

	@Override
	public Mono<Void> updateLocked(long channelId, boolean locked) {
		String sql = "UPDATE temporary_channel SET locked = :locked WHERE channel_id = :channel_id";
		return db.sql(sql).bind("locked", locked).bind("channel_id", channelId).fetch().rowsUpdated().then()
				.onErrorMap(StoreErrors::isNotStoreError,
						e -> StoreErrors.unavailable("temporary_channel.updateLocked", e));
	}

	@Override
	public Mono<Void> addPermitted(long channelId, long userId) {
		String sql = "SELECT COUNT(*) AS n FROM temporary_channel_permit WHERE channel_id = :channel_id AND user_id = :user_id";
		return db.sql(sql).bind("channel_id", channelId).bind("user_id", userId)
				.map(row -> row.get("n", Long.class)).one()
				.flatMap(n -> n != null && n > 0 ? Mono.<Void>empty() : insertPermit(channelId, userId))
				.onErrorMap(StoreErrors::isNotStoreError,
						e -> StoreErrors.unavailable("temporary_channel.addPermitted", e));
	}

	@Override
	public Mono<Boolean> remove(long channelId) {
		String permits = "DELETE FROM temporary_channel_permit WHERE channel_id = :channel_id";
		String row = "DELETE FROM temporary_channel WHERE channel_id = :channel_id";
		return db.sql(permits).bind("channel_id", channelId).fetch().rowsUpdated()
				.then(db.sql(row).bind("channel_id", channelId).fetch().rowsUpdated())
				.map(deleted -> deleted > 0)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("temporary_channel.remove", e));
	}

	private Mono<Void> insertPermit(long channelId, long userId) {
		String sql = "INSERT INTO temporary_channel_permit (channel_id, user_id) VALUES (:channel_id, :user_id)";
		return db.sql(sql).bind("channel_id", channelId).bind("user_id", userId).fetch().rowsUpdated().then();
	}

	private Mono<TemporaryChannel> withPermits(TemporaryChannelEntity e) {
		String sql = "SELECT user_id FROM temporary_channel_permit WHERE channel_id = :channel_id";
		return db.sql(sql).bind("channel_id", e.getChannelId()).map(row -> row.get("user_id", Long.class)).all()
				.collect(HashSet<Long>::new, Set::add)
				.map(permitted -> new TemporaryChannel(e.getChannelId(), e.getGuildId(), e.getOwnerId(),
						Boolean.TRUE.equals(e.getLocked()), permitted, StoreErrors.instant(e.getCreatedAt())));
	}

	private static TemporaryChannelEntity read(Readable row) {
		TemporaryChannelEntity e = new TemporaryChannelEntity();
		e.setChannelId(row.get("channel_id", Long.class));
		e.setGuildId(row.get("guild_id", Long.class));
		e.setOwnerId(row.get("owner_id", Long.class));
		e.setLocked(row.get("locked", Boolean.class));
		e.setCreatedAt(row.get("created_at", OffsetDateTime.class));
		return e;
	}
}
