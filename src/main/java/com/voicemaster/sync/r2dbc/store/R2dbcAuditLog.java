package com.voicemaster.sync.r2dbc.store;

import java.time.OffsetDateTime;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.voicemaster.sync.core.model.AuditEntry;
import com.voicemaster.sync.core.model.AuditEventType;
import com.voicemaster.sync.core.model.AuditOutcome;
import com.voicemaster.sync.core.store.AuditLog;
import com.voicemaster.sync.r2dbc.entity.AuditEntryEntity;

import io.r2dbc.spi.Readable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for the append-only audit_entry table. Details longer than the column are
 * truncated.
 */
@Repository
public class R2dbcAuditLog implements AuditLog {

	static final int MAX_DETAILS = 1000;

	private final DatabaseClient db;

	public R2dbcAuditLog(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<Void> append(AuditEntry entry) {
		String sql = "INSERT INTO audit_entry (guild_id, actor_id, channel_id, event_type, outcome, details, created_at) "
				+ "VALUES (:guild_id, :actor_id, :channel_id, :event_type, :outcome, :details, :created_at)";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("guild_id", entry.guildId())
				.bind("event_type", entry.eventType().name()).bind("outcome", entry.outcome().name())
				.bind("created_at", StoreErrors.utc(entry.createdAt()));

		spec = entry.actorId() == null ? spec.bindNull("actor_id", Long.class) : spec.bind("actor_id", entry.actorId());
		spec = entry.channelId() == null ? spec.bindNull("channel_id", Long.class)
				: spec.bind("channel_id", entry.channelId());
		spec = entry.details() == null ? spec.bindNull("details", String.class)
				: spec.bind("details", truncate(entry.details()));

		return spec.fetch().rowsUpdated().then()
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("audit_entry.append", e));
	}

	@Override
	public Flux<AuditEntry> latest(long guildId, int count) {
		String sql = "SELECT id, guild_id, actor_id, channel_id, event_type, outcome, details, created_at "
				+ "FROM audit_entry WHERE guild_id = :guild_id ORDER BY created_at DESC, id DESC LIMIT :limit";

		return db.sql(sql).bind("guild_id", guildId).bind("limit", count).map(R2dbcAuditLog::read).all()
				.map(R2dbcAuditLog::toModel)
				.onErrorMap(StoreErrors::isNotStoreError, e -> StoreErrors.unavailable("audit_entry.latest", e));
	}

	private static AuditEntryEntity read(Readable row) {
		AuditEntryEntity e = new AuditEntryEntity();
		e.setId(row.get("id", Long.class));
		e.setGuildId(row.get("guild_id", Long.class));
		e.setActorId(row.get("actor_id", Long.class));
		e.setChannelId(row.get("channel_id", Long.class));
		e.setEventType(row.get("event_type", String.class));
		e.setOutcome(row.get("outcome", String.class));
		e.setDetails(row.get("details", String.class));
		e.setCreatedAt(row.get("created_at", OffsetDateTime.class));
		return e;
	}

	private static AuditEntry toModel(AuditEntryEntity e) {
		return new AuditEntry(e.getId(), StoreErrors.instant(e.getCreatedAt()), e.getGuildId(), e.getActorId(),
				AuditEventType.valueOf(e.getEventType()), e.getChannelId(), AuditOutcome.valueOf(e.getOutcome()),
				e.getDetails());
	}

	private static String truncate(String details) {
		return details.length() <= MAX_DETAILS ? details : details.substring(0, MAX_DETAILS);
	}
}
