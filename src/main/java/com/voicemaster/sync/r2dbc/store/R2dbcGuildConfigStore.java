package com.voicemaster.sync.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.voicemaster.sync.core.model.GuildConfig;
import com.voicemaster.sync.core.store.GuildConfigStore;
import com.voicemaster.sync.r2dbc.entity.GuildConfigEntity;

import io.r2dbc.spi.Readable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for the guild_config table.
 *
 * Saves are update-then-insert so the same SQL runs on PostgreSQL and H2.
 */
@Repository
public class R2dbcGuildConfigStore implements GuildConfigStore {

	private static final String COLUMNS = "guild_id, owner_id, category_id, incubator_channel_id, cleanup_on_startup";

	private final DatabaseClient db;

	public R2dbcGuildConfigStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<GuildConfig> find(long guildId) {
		String sql = "SELECT " + COLUMNS + " FROM guild_config WHERE guild_id = :guild_id";
		return db.sql(sql).bind("guild_id", guildId).map(R2dbcGuildConfigStore::read).one()
				.map(R2dbcGuildConfigStore::toModel)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("guild_config.find", e));
	}

	@Override
	public Flux<GuildConfig> findAll() {
		String sql = "SELECT " + COLUMNS + " FROM guild_config ORDER BY guild_id";
		return db.sql(sql).map(R2dbcGuildConfigStore::read).all().map(R2dbcGuildConfigStore::toModel)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("guild_config.findAll", e));
	}

	@Override
	public Mono<Void> save(GuildConfig config) {
		String update = "UPDATE guild_config SET owner_id = :owner_id, category_id = :category_id, "
				+ "incubator_channel_id = :incubator_channel_id, cleanup_on_startup = :cleanup_on_startup "
				+ "WHERE guild_id = :guild_id";
		String insert = "INSERT INTO guild_config (" + COLUMNS + ") "
				+ "VALUES (:guild_id, :owner_id, :category_id, :incubator_channel_id, :cleanup_on_startup)";

		return bind(db.sql(update), config).fetch().rowsUpdated()
				.flatMap(updated -> updated > 0 ? Mono.<Long>empty() : bind(db.sql(insert), config).fetch().rowsUpdated())
				.then()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("guild_config.save", e));
	}

	private static DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, GuildConfig c) {
		spec = spec.bind("guild_id", c.guildId()).bind("owner_id", c.ownerId())
				.bind("cleanup_on_startup", c.cleanupOnStartup());
		spec = c.categoryId() == null ? spec.bindNull("category_id", Long.class) : spec.bind("category_id", c.categoryId());
		spec = c.incubatorChannelId() == null ? spec.bindNull("incubator_channel_id", Long.class)
				: spec.bind("incubator_channel_id", c.incubatorChannelId());
		return spec;
	}

	private static GuildConfigEntity read(Readable row) {
		GuildConfigEntity e = new GuildConfigEntity();
		e.setGuildId(row.get("guild_id", Long.class));
		e.setOwnerId(row.get("owner_id", Long.class));
		e.setCategoryId(row.get("category_id", Long.class));
		e.setIncubatorChannelId(row.get("incubator_channel_id", Long.class));
		e.setCleanupOnStartup(row.get("cleanup_on_startup", Boolean.class));
		return e;
	}

	private static GuildConfig toModel(GuildConfigEntity e) {
		return new GuildConfig(e.getGuildId(), e.getOwnerId(), e.getCategoryId(), e.getIncubatorChannelId(),
				e.getCleanupOnStartup() == null || e.getCleanupOnStartup());
	}
}
