package com.voicemaster.sync.r2dbc.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.voicemaster.sync.core.store.StoreUnavailableException;

/**
 * Shared conversions for the R2DBC stores. Timestamps are bound and read as UTC
 * {@link OffsetDateTime}, which both the PostgreSQL and the H2 driver map to
 * {@code TIMESTAMP WITH TIME ZONE}.
 */
final class StoreErrors {

	private StoreErrors() {
	}

	static Throwable unavailable(String operation, Throwable e) {
		if (e instanceof StoreUnavailableException) {
			return e;
		}
		return new StoreUnavailableException(operation + " failed: " + e.getMessage(), e);
	}

	static boolean isNotStoreError(Throwable e) {
		return !(e instanceof StoreUnavailableException);
	}

	static OffsetDateTime utc(Instant instant) {
		return instant.atOffset(ZoneOffset.UTC);
	}

	static Instant instant(OffsetDateTime value) {
		return value == null ? null : value.toInstant();
	}
}
