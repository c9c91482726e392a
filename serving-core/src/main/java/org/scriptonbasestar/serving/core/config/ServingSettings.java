package org.scriptonbasestar.serving.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 서빙 인프라 설정
 *
 * <p>환경 변수에서 읽어 오거나({@link #fromEnvironment(Map)}),
 * Spring Boot에서는 {@code sb-serving.*} 프로퍼티로 같은 트리를 바인딩합니다.</p>
 *
 * <pre>
 * REDIS_HOST, REDIS_PORT, REDIS_PASSWORD, REDIS_DB, CACHE_TTL,
 * CACHE_CONNECT_MAX_RETRIES, CACHE_CONNECT_TIMEOUT_MS,
 * HEALTH_CHECK_INTERVAL, HEALTH_CHECK_TIMEOUT,
 * LOG_LEVEL, LOG_FILE,
 * SENTRY_DSN, SENTRY_ENVIRONMENT, SENTRY_TRACES_SAMPLE_RATE,
 * METRICS_WINDOW_SIZE
 * MONITORING_ENABLED
 * </pre>
 *
 * @since 2026-10
 */
public class ServingSettings {

	private static final Logger log = LoggerFactory.getLogger(ServingSettings.class);

	private Cache cache = new Cache();
	private Health health = new Health();
	private Logging logging = new Logging();
	private ErrorTracking errorTracking = new ErrorTracking();
	private Metrics metrics = new Metrics();

	/**
	 * 현재 프로세스의 환경 변수로 설정을 만듭니다.
	 */
	public static ServingSettings fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	/**
	 * 환경 변수 맵으로 설정을 만듭니다. 값이 없거나 잘못된 항목은 기본값을 유지합니다.
	 *
	 * @param env 환경 변수
	 * @return 설정
	 */
	public static ServingSettings fromEnvironment(Map<String, String> env) {
		ServingSettings settings = new ServingSettings();

		Cache cache = settings.getCache();
		cache.setHost(text(env, "REDIS_HOST", cache.getHost()));
		cache.setPort(integer(env, "REDIS_PORT", cache.getPort()));
		cache.setPassword(text(env, "REDIS_PASSWORD", cache.getPassword()));
		cache.setDatabase(integer(env, "REDIS_DB", cache.getDatabase()));
		cache.setDefaultTtlSeconds(integer(env, "CACHE_TTL", cache.getDefaultTtlSeconds()));
		cache.setConnectMaxRetries(integer(env, "CACHE_CONNECT_MAX_RETRIES", cache.getConnectMaxRetries()));
		cache.setConnectTimeoutMillis(integer(env, "CACHE_CONNECT_TIMEOUT_MS", cache.getConnectTimeoutMillis()));

		Health health = settings.getHealth();
		health.setIntervalMillis(integer(env, "HEALTH_CHECK_INTERVAL", (int) health.getIntervalMillis()));
		health.setProbeTimeoutMillis(integer(env, "HEALTH_CHECK_TIMEOUT", (int) health.getProbeTimeoutMillis()));

		Logging logging = settings.getLogging();
		logging.setLevel(text(env, "LOG_LEVEL", logging.getLevel()));
		logging.setFile(text(env, "LOG_FILE", logging.getFile()));

		ErrorTracking errorTracking = settings.getErrorTracking();
		errorTracking.setDsn(text(env, "SENTRY_DSN", errorTracking.getDsn()));
		errorTracking.setEnvironment(text(env, "SENTRY_ENVIRONMENT", errorTracking.getEnvironment()));
		errorTracking.setTracesSampleRate(decimal(env, "SENTRY_TRACES_SAMPLE_RATE", errorTracking.getTracesSampleRate()));

		Metrics metrics = settings.getMetrics();
		metrics.setWindowSize(integer(env, "METRICS_WINDOW_SIZE", metrics.getWindowSize()));
		metrics.setEnabled(bool(env, "MONITORING_ENABLED", metrics.isEnabled()));

		return settings;
	}

	private static String text(Map<String, String> env, String name, String defaultValue) {
		String value = env.get(name);
		return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
	}

	private static int integer(Map<String, String> env, String name, int defaultValue) {
		String value = text(env, name, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			log.warn("Ignoring malformed {}={}, using default {}", name, value, defaultValue);
			return defaultValue;
		}
	}

	private static boolean bool(Map<String, String> env, String name, boolean defaultValue) {
		String value = text(env, name, null);
		if (value == null) {
			return defaultValue;
		}
		if ("true".equalsIgnoreCase(value)) {
			return true;
		}
		if ("false".equalsIgnoreCase(value)) {
			return false;
		}
		log.warn("Ignoring malformed {}={}, using default {}", name, value, defaultValue);
		return defaultValue;
	}

	private static double decimal(Map<String, String> env, String name, double defaultValue) {
		String value = text(env, name, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			log.warn("Ignoring malformed {}={}, using default {}", name, value, defaultValue);
			return defaultValue;
		}
	}

	public Cache getCache() {
		return cache;
	}

	public void setCache(Cache cache) {
		this.cache = cache;
	}

	public Health getHealth() {
		return health;
	}

	public void setHealth(Health health) {
		this.health = health;
	}

	public Logging getLogging() {
		return logging;
	}

	public void setLogging(Logging logging) {
		this.logging = logging;
	}

	public ErrorTracking getErrorTracking() {
		return errorTracking;
	}

	public void setErrorTracking(ErrorTracking errorTracking) {
		this.errorTracking = errorTracking;
	}

	public Metrics getMetrics() {
		return metrics;
	}

	public void setMetrics(Metrics metrics) {
		this.metrics = metrics;
	}

	/**
	 * 원격 캐시 연결 설정
	 */
	public static class Cache {
		private String host = "localhost";
		private int port = 6379;
		private String password;
		private int database = 0;
		/**
		 * 기본 TTL (초)
		 */
		private int defaultTtlSeconds = 3600;
		/**
		 * 연결 재시도 최대 횟수
		 */
		private int connectMaxRetries = 10;
		/**
		 * 연결 전체 제한 시간 (밀리초)
		 */
		private int connectTimeoutMillis = 30_000;
		/**
		 * 소켓 읽기/쓰기 제한 시간 (밀리초)
		 */
		private int socketTimeoutMillis = 2_000;

		public String getHost() {
			return host;
		}

		public void setHost(String host) {
			this.host = host;
		}

		public int getPort() {
			return port;
		}

		public void setPort(int port) {
			this.port = port;
		}

		public String getPassword() {
			return password;
		}

		public void setPassword(String password) {
			this.password = password;
		}

		public int getDatabase() {
			return database;
		}

		public void setDatabase(int database) {
			this.database = database;
		}

		public int getDefaultTtlSeconds() {
			return defaultTtlSeconds;
		}

		public void setDefaultTtlSeconds(int defaultTtlSeconds) {
			this.defaultTtlSeconds = defaultTtlSeconds;
		}

		public int getConnectMaxRetries() {
			return connectMaxRetries;
		}

		public void setConnectMaxRetries(int connectMaxRetries) {
			this.connectMaxRetries = connectMaxRetries;
		}

		public int getConnectTimeoutMillis() {
			return connectTimeoutMillis;
		}

		public void setConnectTimeoutMillis(int connectTimeoutMillis) {
			this.connectTimeoutMillis = connectTimeoutMillis;
		}

		public int getSocketTimeoutMillis() {
			return socketTimeoutMillis;
		}

		public void setSocketTimeoutMillis(int socketTimeoutMillis) {
			this.socketTimeoutMillis = socketTimeoutMillis;
		}
	}

	/**
	 * 헬스체크 설정
	 */
	public static class Health {
		private long intervalMillis = 60_000L;
		private long probeTimeoutMillis = 5_000L;

		public long getIntervalMillis() {
			return intervalMillis;
		}

		public void setIntervalMillis(long intervalMillis) {
			this.intervalMillis = intervalMillis;
		}

		public long getProbeTimeoutMillis() {
			return probeTimeoutMillis;
		}

		public void setProbeTimeoutMillis(long probeTimeoutMillis) {
			this.probeTimeoutMillis = probeTimeoutMillis;
		}
	}

	/**
	 * 로깅 설정
	 */
	public static class Logging {
		/**
		 * debug | info | warn | error
		 */
		private String level = "info";
		/**
		 * 로그 파일 경로, null이면 콘솔만 사용
		 */
		private String file;

		public String getLevel() {
			return level;
		}

		public void setLevel(String level) {
			this.level = level;
		}

		public String getFile() {
			return file;
		}

		public void setFile(String file) {
			this.file = file;
		}
	}

	/**
	 * 원격 에러 수집기 설정
	 */
	public static class ErrorTracking {
		/**
		 * 수집기 DSN, null이면 로컬 로깅만 수행
		 */
		private String dsn;
		private String environment = "development";
		private double tracesSampleRate = 0.1;

		public String getDsn() {
			return dsn;
		}

		public void setDsn(String dsn) {
			this.dsn = dsn;
		}

		public String getEnvironment() {
			return environment;
		}

		public void setEnvironment(String environment) {
			this.environment = environment;
		}

		public double getTracesSampleRate() {
			return tracesSampleRate;
		}

		public void setTracesSampleRate(double tracesSampleRate) {
			this.tracesSampleRate = tracesSampleRate;
		}

		public boolean isRemoteConfigured() {
			return dsn != null && !dsn.trim().isEmpty();
		}
	}

	/**
	 * 요청 메트릭 설정
	 */
	public static class Metrics {
		/**
		 * 백분위 계산에 쓰는 최근 지연 시간 샘플 수
		 */
		private int windowSize = 10_000;

		/**
		 * false이면 파이프라인에 요청 지표 수집 단계를 넣지 않습니다.
		 */
		private boolean enabled = true;

		public int getWindowSize() {
			return windowSize;
		}

		public void setWindowSize(int windowSize) {
			this.windowSize = windowSize;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}
	}
}
