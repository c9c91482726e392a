package org.scriptonbasestar.serving.spring.actuator;

import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Map;

/**
 * Pings the cache store. DOWN when it is disconnected or does not answer.
 * A reachable store also reports its {@link CacheStore#getStats() stats}.
 *
 * @since 2026-10
 */
public class CacheStoreHealthIndicator implements HealthIndicator {

	private final CacheStore cacheStore;

	public CacheStoreHealthIndicator(CacheStore cacheStore) {
		if (cacheStore == null) {
			throw new IllegalArgumentException("cacheStore must not be null");
		}
		this.cacheStore = cacheStore;
	}

	@Override
	public Health health() {
		boolean connected = cacheStore.isConnected();
		boolean reachable = connected && cacheStore.ping();

		Health.Builder builder = reachable ? Health.up() : Health.down();
		builder
			.withDetail("store", cacheStore.getClass().getSimpleName())
			.withDetail("connected", connected)
			.withDetail("defaultTtlSeconds", cacheStore.defaultTtlSeconds());
		if (reachable) {
			Map<String, String> stats = cacheStore.getStats();
			if (stats != null && !stats.isEmpty()) {
				builder.withDetail("stats", stats);
			}
		}
		return builder.build();
	}
}
