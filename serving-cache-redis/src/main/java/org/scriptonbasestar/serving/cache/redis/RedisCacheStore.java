package org.scriptonbasestar.serving.cache.redis;

import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.cache.CacheValueCodec;
import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.scriptonbasestar.serving.core.exception.ServingCacheConnectException;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Redis를 백엔드로 사용하는 CacheStore
 *
 * <p>모든 값은 JSON으로 인코딩되어 문자열로 저장됩니다.
 * 연결 이후 발생하는 Redis 오류는 호출자에게 전파되지 않고 WARN 로그와 함께
 * 미스(null), 0, 무동작으로 처리됩니다.</p>
 *
 * 사용 예시:
 * <pre>
 * RedisCacheStore store = RedisCacheStore.from(settings.getCache());
 * store.connect();
 *
 * store.set("users:1", user, 600);
 * Object cached = store.get("users:1");
 * long removed = store.clearByPattern("users:*");
 * </pre>
 *
 * @since 2026-10
 */
public class RedisCacheStore implements CacheStore {

	private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

	static final long MAX_BACKOFF_MILLIS = 3_000L;
	static final int SCAN_COUNT = 100;
	private static final String PONG = "PONG";

	private final HostAndPort address;
	private final JedisClientConfig clientConfig;
	private final BiFunction<HostAndPort, JedisClientConfig, JedisPooled> clientFactory;
	private final CacheValueCodec codec;
	private final int defaultTtlSeconds;
	private final int connectMaxRetries;
	private final long connectTimeoutMillis;

	private volatile JedisPooled jedis;

	/**
	 * 설정으로부터 생성합니다.
	 *
	 * @param settings 캐시 설정 (호스트, 포트, 비밀번호, DB, TTL, 재시도)
	 * @return 아직 연결되지 않은 저장소
	 */
	public static RedisCacheStore from(ServingSettings.Cache settings) {
		return from(settings, JedisPooled::new);
	}

	static RedisCacheStore from(ServingSettings.Cache settings,
								BiFunction<HostAndPort, JedisClientConfig, JedisPooled> clientFactory) {
		JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
			.password(blankToNull(settings.getPassword()))
			.database(settings.getDatabase())
			.connectionTimeoutMillis(settings.getSocketTimeoutMillis())
			.socketTimeoutMillis(settings.getSocketTimeoutMillis())
			.build();
		return new RedisCacheStore(
			new HostAndPort(settings.getHost(), settings.getPort()),
			clientConfig,
			clientFactory,
			new CacheValueCodec(),
			settings.getDefaultTtlSeconds(),
			settings.getConnectMaxRetries(),
			settings.getConnectTimeoutMillis());
	}

	public RedisCacheStore(HostAndPort address,
						   JedisClientConfig clientConfig,
						   BiFunction<HostAndPort, JedisClientConfig, JedisPooled> clientFactory,
						   CacheValueCodec codec,
						   int defaultTtlSeconds,
						   int connectMaxRetries,
						   long connectTimeoutMillis) {
		if (address == null || clientConfig == null || clientFactory == null || codec == null) {
			throw new IllegalArgumentException("address, clientConfig, clientFactory and codec must not be null");
		}
		TimeCheckerUtil.requireValidTtl(defaultTtlSeconds);
		if (connectMaxRetries < 1) {
			throw new IllegalArgumentException("connectMaxRetries must be at least 1: " + connectMaxRetries);
		}
		this.address = address;
		this.clientConfig = clientConfig;
		this.clientFactory = clientFactory;
		this.codec = codec;
		this.defaultTtlSeconds = defaultTtlSeconds;
		this.connectMaxRetries = connectMaxRetries;
		this.connectTimeoutMillis = connectTimeoutMillis;
	}

	/**
	 * Redis에 연결합니다. 이미 연결되어 있으면 아무것도 하지 않습니다.
	 *
	 * <p>PING이 성공할 때까지 재시도하며, 시도 사이에는 {@code min(attempt * 100, 3000)}ms 대기합니다.
	 * 재시도 횟수나 전체 타임아웃을 넘기면 {@link ServingCacheConnectException}을 던집니다.</p>
	 */
	@Override
	public synchronized void connect() {
		if (jedis != null) {
			return;
		}
		log.info("Connecting to Redis {} (maxRetries={}, timeout={}ms)", address, connectMaxRetries, connectTimeoutMillis);

		long deadline = System.currentTimeMillis() + connectTimeoutMillis;
		RuntimeException lastError = null;
		int attempt = 0;

		while (attempt < connectMaxRetries) {
			attempt++;
			JedisPooled candidate = null;
			try {
				candidate = clientFactory.apply(address, clientConfig);
				if (PONG.equalsIgnoreCase(candidate.ping())) {
					jedis = candidate;
					log.info("Redis connected: {} (attempt {})", address, attempt);
					return;
				}
				lastError = new IllegalStateException("Unexpected PING reply");
			} catch (RuntimeException e) {
				lastError = e;
			}
			closeQuietly(candidate);
			log.warn("Redis connection attempt {}/{} failed: {}", attempt, connectMaxRetries,
				lastError.getMessage());

			long backoff = backoffMillis(attempt);
			if (attempt >= connectMaxRetries || System.currentTimeMillis() + backoff > deadline) {
				break;
			}
			try {
				Thread.sleep(backoff);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new ServingCacheConnectException("Interrupted while connecting to Redis " + address, attempt, e);
			}
		}

		log.error("Redis connection failed after {} attempts: {}", attempt, address);
		throw new ServingCacheConnectException("Failed to connect to Redis " + address, attempt, lastError);
	}

	static long backoffMillis(int attempt) {
		return Math.min(attempt * 100L, MAX_BACKOFF_MILLIS);
	}

	@Override
	public boolean isConnected() {
		return jedis != null;
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
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, get skipped: {}", key);
			return null;
		}
		try {
			String value = client.get(key);
			log.trace("Loaded from Redis: {} (hit={})", key, value != null);
			return value;
		} catch (RuntimeException e) {
			log.warn("Cache get error: {} - {}", key, e.getMessage());
			return null;
		}
	}

	@Override
	public void set(String key, Object value, int ttlSeconds) {
		TimeCheckerUtil.requireValidTtl(ttlSeconds);
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, set skipped: {}", key);
			return;
		}
		try {
			String encoded = codec.encode(value);
			if (ttlSeconds > 0) {
				client.setex(key, ttlSeconds, encoded);
				log.trace("Saved to Redis with TTL: {} ({}s)", key, ttlSeconds);
			} else {
				client.set(key, encoded);
				log.trace("Saved to Redis: {}", key);
			}
		} catch (RuntimeException e) {
			log.warn("Cache set error: {} - {}", key, e.getMessage());
		}
	}

	@Override
	public void delete(String key) {
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, delete skipped: {}", key);
			return;
		}
		try {
			client.del(key);
			log.trace("Deleted from Redis: {}", key);
		} catch (RuntimeException e) {
			log.warn("Cache delete error: {} - {}", key, e.getMessage());
		}
	}

	@Override
	public void deleteMany(Collection<String> keys) {
		if (keys == null || keys.isEmpty()) {
			return;
		}
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, deleteMany skipped: {} keys", keys.size());
			return;
		}
		try {
			client.del(keys.toArray(new String[0]));
		} catch (RuntimeException e) {
			log.warn("Cache deleteMany error: {} keys - {}", keys.size(), e.getMessage());
		}
	}

	/**
	 * 패턴과 일치하는 키를 SCAN으로 찾아 삭제합니다.
	 *
	 * SCAN 도중 추가된 키는 삭제되지 않을 수 있습니다.
	 */
	@Override
	public long clearByPattern(String pattern) {
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, clearByPattern skipped: {}", pattern);
			return 0;
		}
		if (pattern == null || pattern.trim().isEmpty()) {
			log.warn("Redis clearByPattern skipped, empty pattern");
			return 0;
		}
		try {
			ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
			String cursor = ScanParams.SCAN_POINTER_START;
			long removed = 0;
			do {
				ScanResult<String> page = client.scan(cursor, params);
				List<String> keys = new ArrayList<>(page.getResult());
				if (!keys.isEmpty()) {
					removed += client.del(keys.toArray(new String[0]));
				}
				cursor = page.getCursor();
			} while (!ScanParams.SCAN_POINTER_START.equals(cursor));

			log.debug("Cleared {} keys matching {}", removed, pattern);
			return removed;
		} catch (RuntimeException e) {
			log.warn("Cache clearByPattern error: {} - {}", pattern, e.getMessage());
			return 0;
		}
	}

	@Override
	public long increment(String key, long by) {
		JedisPooled client = jedis;
		if (client == null) {
			log.warn("Redis not connected, increment skipped: {}", key);
			return 0;
		}
		try {
			return client.incrBy(key, by);
		} catch (RuntimeException e) {
			log.warn("Cache increment error: {} - {}", key, e.getMessage());
			return 0;
		}
	}

	@Override
	public boolean ping() {
		JedisPooled client = jedis;
		if (client == null) {
			return false;
		}
		try {
			return PONG.equalsIgnoreCase(client.ping());
		} catch (RuntimeException e) {
			log.warn("Redis ping failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * {@code INFO stats} 섹션을 항목별로 나누어 돌려줍니다.
	 */
	@Override
	public Map<String, String> getStats() {
		JedisPooled client = jedis;
		if (client == null) {
			return Collections.emptyMap();
		}
		try {
			return parseInfo(client.info("stats"));
		} catch (RuntimeException e) {
			log.warn("Redis stats error: {}", e.getMessage());
			return Collections.emptyMap();
		}
	}

	static Map<String, String> parseInfo(String info) {
		Map<String, String> stats = new LinkedHashMap<>();
		if (info == null) {
			return stats;
		}
		for (String line : info.split("\r?\n")) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")) {
				continue;
			}
			int colon = trimmed.indexOf(':');
			if (colon > 0) {
				stats.put(trimmed.substring(0, colon), trimmed.substring(colon + 1));
			}
		}
		return stats;
	}

	@Override
	public int defaultTtlSeconds() {
		return defaultTtlSeconds;
	}

	@Override
	public synchronized void close() {
		JedisPooled client = jedis;
		jedis = null;
		if (client != null) {
			log.info("Closing Redis connection: {}", address);
			closeQuietly(client);
		}
	}

	private static void closeQuietly(JedisPooled client) {
		if (client == null) {
			return;
		}
		try {
			client.close();
		} catch (RuntimeException e) {
			log.warn("Error while closing Redis client: {}", e.getMessage());
		}
	}

	private static String blankToNull(String value) {
		return value == null || value.trim().isEmpty() ? null : value;
	}
}
