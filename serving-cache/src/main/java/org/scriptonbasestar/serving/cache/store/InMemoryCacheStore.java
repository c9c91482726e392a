package org.scriptonbasestar.serving.cache.store;

import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.cache.CacheValueCodec;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 단일 프로세스 메모리 기반 CacheStore
 *
 * <p>Redis 구현과 같은 규칙을 따릅니다: 값은 JSON 문자열로 저장되고, TTL이 지나면 조회되지 않으며,
 * {@link #increment(String, long)}은 키 단위로 원자적이고 기존 TTL을 유지합니다.
 * 만료된 항목은 접근 시점에 제거되며 {@link #removeExpired()}로 한번에 정리할 수 있습니다.</p>
 *
 * <pre>{@code
 * CacheStore store = new InMemoryCacheStore(3600);
 * store.connect();
 * store.set("posts:1", post, 60);
 * Object cached = store.get("posts:1");
 * }</pre>
 *
 * @since 2026-10
 */
public class InMemoryCacheStore implements CacheStore {

	private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

	private final ConcurrentHashMap<String, Entry> data = new ConcurrentHashMap<>();
	private final AtomicBoolean connected = new AtomicBoolean(false);
	private final CacheValueCodec codec;
	private final int defaultTtlSeconds;
	private final LongSupplier clock;

	public InMemoryCacheStore(int defaultTtlSeconds) {
		this(defaultTtlSeconds, new CacheValueCodec(), System::currentTimeMillis);
	}

	/**
	 * @param defaultTtlSeconds 기본 TTL (초)
	 * @param codec 값 코덱
	 * @param clock 현재 시각 (epoch milliseconds) 공급자
	 */
	public InMemoryCacheStore(int defaultTtlSeconds, CacheValueCodec codec, LongSupplier clock) {
		TimeCheckerUtil.requireValidTtl(defaultTtlSeconds);
		if (codec == null) {
			throw new IllegalArgumentException("codec must not be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("clock must not be null");
		}
		this.defaultTtlSeconds = defaultTtlSeconds;
		this.codec = codec;
		this.clock = clock;
	}

	@Override
	public void connect() {
		if (connected.compareAndSet(false, true)) {
			log.info("In-memory cache store ready (defaultTtl={}s)", defaultTtlSeconds);
		}
	}

	@Override
	public boolean isConnected() {
		return connected.get();
	}

	@Override
	public Object get(String key) {
		String raw = readRaw(key);
		return raw == null ? null : codec.decode(raw);
	}

	@Override
	public <T> T get(String key, Class<T> type) {
		String raw = readRaw(key);
		return raw == null ? null : codec.decode(raw, type);
	}

	private String readRaw(String key) {
		if (!connected.get()) {
			log.warn("Cache get skipped, store not connected: {}", key);
			return null;
		}
		Entry entry = data.get(key);
		if (entry == null) {
			return null;
		}
		if (entry.isExpired(clock.getAsLong())) {
			data.remove(key, entry);
			log.trace("Expired entry removed: {}", key);
			return null;
		}
		return entry.value;
	}

	@Override
	public void set(String key, Object value, int ttlSeconds) {
		TimeCheckerUtil.requireValidTtl(ttlSeconds);
		if (!connected.get()) {
			log.warn("Cache set skipped, store not connected: {}", key);
			return;
		}
		try {
			String encoded = codec.encode(value);
			long now = clock.getAsLong();
			data.put(key, new Entry(encoded, TimeCheckerUtil.expiresAt(now, ttlSeconds)));
			log.trace("Saved with TTL: {} ({}s)", key, ttlSeconds);
		} catch (RuntimeException e) {
			log.warn("Cache set error: {} - {}", key, e.getMessage());
		}
	}

	@Override
	public void delete(String key) {
		if (!connected.get()) {
			log.warn("Cache delete skipped, store not connected: {}", key);
			return;
		}
		data.remove(key);
	}

	@Override
	public void deleteMany(Collection<String> keys) {
		if (keys == null || keys.isEmpty()) {
			return;
		}
		if (!connected.get()) {
			log.warn("Cache deleteMany skipped, store not connected: {} keys", keys.size());
			return;
		}
		keys.forEach(data::remove);
	}

	@Override
	public long clearByPattern(String pattern) {
		if (!connected.get()) {
			log.warn("Cache clearByPattern skipped, store not connected: {}", pattern);
			return 0;
		}
		if (pattern == null || pattern.trim().isEmpty()) {
			log.warn("Cache clearByPattern skipped, empty pattern");
			return 0;
		}
		Pattern regex = GlobPattern.compile(pattern);
		long now = clock.getAsLong();

		List<String> matched = data.entrySet().stream()
			.filter(e -> !e.getValue().isExpired(now))
			.map(Map.Entry::getKey)
			.filter(k -> regex.matcher(k).matches())
			.collect(Collectors.toList());

		long removed = 0;
		for (String key : matched) {
			if (data.remove(key) != null) {
				removed++;
			}
		}
		log.debug("Cleared {} keys matching {}", removed, pattern);
		return removed;
	}

	@Override
	public long increment(String key, long by) {
		if (!connected.get()) {
			log.warn("Cache increment skipped, store not connected: {}", key);
			return 0;
		}
		try {
			Entry updated = data.compute(key, (k, current) -> {
				long now = clock.getAsLong();
				if (current == null || current.isExpired(now)) {
					return new Entry(String.valueOf(by), TimeCheckerUtil.NO_EXPIRY);
				}
				long base = Long.parseLong(current.value);
				return new Entry(String.valueOf(Math.addExact(base, by)), current.expiresAt);
			});
			return Long.parseLong(updated.value);
		} catch (NumberFormatException | ArithmeticException e) {
			log.warn("Cache increment error: {} - value is not an integer or out of range", key);
			return 0;
		}
	}

	@Override
	public boolean ping() {
		return connected.get();
	}

	/**
	 * 보관 중인 항목 수를 보고합니다.
	 * {@code keys}는 만료되었지만 아직 제거되지 않은 항목을 포함하고, {@code expired_keys}는 그 중 만료된 항목 수입니다.
	 */
	@Override
	public Map<String, String> getStats() {
		Map<String, String> stats = new LinkedHashMap<>();
		stats.put("connected", String.valueOf(connected.get()));
		long now = clock.getAsLong();
		long expired = data.values().stream().filter(e -> e.isExpired(now)).count();
		stats.put("keys", String.valueOf(data.size()));
		stats.put("expired_keys", String.valueOf(expired));
		return stats;
	}

	@Override
	public int defaultTtlSeconds() {
		return defaultTtlSeconds;
	}

	/**
	 * 만료된 항목을 모두 제거합니다.
	 *
	 * @return 제거된 항목 수
	 */
	public int removeExpired() {
		long now = clock.getAsLong();
		int before = data.size();
		data.entrySet().removeIf(e -> e.getValue().isExpired(now));
		return before - data.size();
	}

	/**
	 * @return 만료 여부와 관계없이 보관 중인 항목 수
	 */
	public int size() {
		return data.size();
	}

	@Override
	public void close() {
		if (connected.compareAndSet(true, false)) {
			data.clear();
			log.info("In-memory cache store closed");
		}
	}

	private static final class Entry {
		private final String value;
		private final long expiresAt;

		private Entry(String value, long expiresAt) {
			this.value = value;
			this.expiresAt = expiresAt;
		}

		private boolean isExpired(long now) {
			return TimeCheckerUtil.isExpired(expiresAt, now);
		}
	}
}
