package com.voicemaster.sync.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.voicemaster.sync.core.model.GuildDefaults;
import com.voicemaster.sync.core.model.UserPreference;
import com.voicemaster.sync.core.store.SettingsStore;

import reactor.core.publisher.Mono;

/**
 * Database access for guild_defaults and user_preference.
 *
 * The user-scoped setters touch only their own column; the row is created on first use.
 */
@Repository
public class R2dbcSettingsStore implements SettingsStore {

	private final DatabaseClient db;

	public R2dbcSettingsStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<GuildDefaults> findGuildDefaults(long guildId) {
		String sql = "SELECT guild_id, name_template, user_limit FROM guild_defaults WHERE guild_id = :guild_id";
		return db.sql(sql).bind("guild_id", guildId)
				.map(row -> new GuildDefaults(row.get("guild_id", Long.class), row.get("name_template", String.class),
						row.get("user_limit", Integer.class)))
				.one()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("guild_defaults.find", e));
	}

	@Override
	public Mono<Void> saveGuildDefaults(GuildDefaults defaults) {
		String update = "UPDATE guild_defaults SET name_template = :name_template, user_limit = :user_limit "
				+ "WHERE guild_id = :guild_id";
		String insert = "INSERT INTO guild_defaults (guild_id, name_template, user_limit) "
				+ "VALUES (:guild_id, :name_template, :user_limit)";

		return bindDefaults(db.sql(update), defaults).fetch().rowsUpdated()
				.flatMap(updated -> updated > 0 ? Mono.<Long>empty()
						: bindDefaults(db.sql(insert), defaults).fetch().rowsUpdated())
				.then()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("guild_defaults.save", e));
	}

	@Override
	public Mono<UserPreference> findUserPreference(long guildId, long userId) {
		String sql = "SELECT guild_id, user_id, channel_name, user_limit FROM user_preference "
				+ "WHERE guild_id = :guild_id AND user_id = :user_id";
		return db.sql(sql).bind("guild_id", guildId).bind("user_id", userId)
				.map(row -> new UserPreference(row.get("guild_id", Long.class), row.get("user_id", Long.class),
						row.get("channel_name", String.class), row.get("user_limit", Integer.class)))
				.one()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("user_preference.find", e));
	}

	@Override
	public Mono<Void> saveUserChannelName(long guildId, long userId, String channelName) {
		String update = "UPDATE user_preference SET channel_name = :value WHERE guild_id = :guild_id AND user_id = :user_id";
		String insert = "INSERT INTO user_preference (guild_id, user_id, channel_name) VALUES (:guild_id, :user_id, :value)";
		return upsertColumn(update, insert, guildId, userId, channelName)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("user_preference.saveName", e));
	}

	@Override
	public Mono<Void> saveUserChannelLimit(long guildId, long userId, int userLimit) {
		String update = "UPDATE user_preference SET user_limit = :value WHERE guild_id = :guild_id AND user_id = :user_id";
		String insert = "INSERT INTO user_preference (guild_id, user_id, user_limit) VALUES (:guild_id, :user_id, :value)";
		return upsertColumn(update, insert, guildId, userId, userLimit)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("user_preference.saveLimit", e));
	}

	private Mono<Void> upsertColumn(String update, String insert, long guildId, long userId, Object value) {
		return db.sql(update).bind("value", value).bind("guild_id", guildId).bind("user_id", userId)
				.fetch().rowsUpdated()
				.flatMap(updated -> updated > 0 ? Mono.<Long>empty()
						: db.sql(insert).bind("guild_id", guildId).bind("user_id", userId).bind("value", value)
								.fetch().rowsUpdated())
				.then();
	}

	private static DatabaseClient.GenericExecuteSpec bindDefaults(DatabaseClient.GenericExecuteSpec spec,
			GuildDefaults d) {
		spec = spec.bind("guild_id", d.guildId());
		spec = d.nameTemplate() == null ? spec.bindNull("name_template", String.class)
				: spec.bind("name_template", d.nameTemplate());
		spec = d.userLimit() == null ? spec.bindNull("user_limit", Integer.class) : spec.bind("user_limit", d.userLimit());
		return spec;
	}
}
