package org.scriptonbasestar.serving.spring;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.serving.cache.function.CachedFunction;
import org.scriptonbasestar.serving.cache.middleware.CacheMiddleware;
import org.scriptonbasestar.serving.cache.redis.RedisCacheStore;
import org.scriptonbasestar.serving.cache.session.SessionStore;
import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.scriptonbasestar.serving.core.exception.ServingCacheConnectException;
import org.scriptonbasestar.serving.core.pipeline.RequestHandler;
import org.scriptonbasestar.serving.core.pipeline.ServingPipeline;
import org.scriptonbasestar.serving.observability.error.ErrorTracker;
import org.scriptonbasestar.serving.observability.error.ErrorTrackingStages;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.scriptonbasestar.serving.observability.logging.LogbackConfigurer;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;
import org.scriptonbasestar.serving.observability.monitoring.MonitoringStage;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 캐시, 세션, 메트릭, 헬스 체크, 에러 추적을 한곳에서 생성하고 수명을 관리하는 컨텍스트
 *
 * <p>전역 싱글톤 대신 시작 시점에 한 번 만들어 요청 파이프라인에 넘깁니다.
 * 테스트마다 독립된 인스턴스를 만들 수 있습니다.</p>
 *
 * <pre>{@code
 * try (ServingContext context = ServingContext.fromEnvironment()) {
 *     context.start();
 *     ServingPipeline pipeline = context.pipeline((request, response) -> response.send(loadPosts(request)));
 *     ...
 * }
 * }</pre>
 *
 * 파이프라인 순서: 에러 컨텍스트 → 에러 캡처 → 모니터링 → 응답 캐시 → 핸들러
 *
 * @since 2026-10
 */
@Slf4j
public class ServingContext implements AutoCloseable {

	public static final String CACHE_CHECK_NAME = "cache";

	private final ServingSettings settings;
	private final CacheStore cacheStore;
	private final SessionStore sessionStore;
	private final MetricsCollector metricsCollector;
	private final HealthChecker healthChecker;
	private final ErrorTracker errorTracker;
	private final ExecutorService populateExecutor;
	private final boolean configureLogging;
	private final boolean periodicHealthChecks;
	private final boolean failOnCacheConnectError;

	private boolean started;
	private boolean closed;

	private ServingContext(Builder builder) {
		this.settings = builder.settings;
		this.cacheStore = builder.cacheStore;
		this.sessionStore = new SessionStore(cacheStore);
		this.metricsCollector = builder.metricsCollector;
		this.healthChecker = builder.healthChecker;
		this.errorTracker = builder.errorTracker;
		this.populateExecutor = builder.populateExecutor;
		this.configureLogging = builder.configureLogging;
		this.periodicHealthChecks = builder.periodicHealthChecks;
		this.failOnCacheConnectError = builder.failOnCacheConnectError;
	}

	/**
	 * 환경 변수 설정과 Redis 저장소로 컨텍스트를 만듭니다. {@link #start()}는 호출하지 않습니다.
	 */
	public static ServingContext fromEnvironment() {
		return builder()
			.settings(ServingSettings.fromEnvironment())
			.configureLogging(true)
			.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 인프라를 초기화합니다.
	 *
	 * <ol>
	 *   <li>(선택) 로그 레벨/파일 적용</li>
	 *   <li>에러 추적 초기화</li>
	 *   <li>캐시 연결, 실패하면 예외 전파
	 *       ({@link Builder#failOnCacheConnectError(boolean) false}이면 WARN 로그 후 캐시 없이 계속)</li>
	 *   <li>캐시 헬스 프로브 등록, 주기 점검 시작</li>
	 * </ol>
	 *
	 * @throws ServingCacheConnectException 캐시 연결 재시도를 모두 소진했을 때
	 */
	public synchronized void start() {
		if (closed) {
			throw new IllegalStateException("ServingContext is already closed");
		}
		if (started) {
			return;
		}
		if (configureLogging) {
			LogbackConfigurer.configure(settings.getLogging());
		}

		errorTracker.initialize();

		try {
			cacheStore.connect();
		} catch (ServingCacheConnectException e) {
			if (failOnCacheConnectError) {
				log.error("Cache connection failed after {} attempts", e.getAttempts());
				errorTracker.close();
				throw e;
			}
			log.atWarn()
				.addKeyValue("attempts", e.getAttempts())
				.log("Cache initialization skipped: {}", e.getMessage());
		}

		healthChecker.registerCheck(CACHE_CHECK_NAME, cacheStore::ping);
		if (periodicHealthChecks) {
			healthChecker.startPeriodicChecks();
		}

		started = true;
		log.info("Serving infrastructure initialized (cacheConnected={})", cacheStore.isConnected());
	}

	public synchronized boolean isStarted() {
		return started;
	}

	/**
	 * 표준 스테이지가 채워진 파이프라인 빌더를 반환합니다. 핸들러만 지정하면 됩니다.
	 * 지표 수집이 꺼져 있으면({@code MONITORING_ENABLED=false}) 지표 스테이지는 빠집니다.
	 */
	public ServingPipeline.Builder pipelineBuilder() {
		ErrorTrackingStages errorStages = errorTracker.stages();
		ServingPipeline.Builder builder = ServingPipeline.builder()
			.stage(errorStages.contextCapture())
			.stage(errorStages.errorCapture());
		if (settings.getMetrics().isEnabled()) {
			builder.stage(new MonitoringStage(metricsCollector));
		}
		return builder.stage(cacheMiddleware());
	}

	public ServingPipeline pipeline(RequestHandler handler) {
		return pipelineBuilder().handler(handler).build();
	}

	/**
	 * 기본 TTL과 {@code api:} 네임스페이스를 쓰는 응답 캐시 스테이지
	 */
	public CacheMiddleware cacheMiddleware() {
		return CacheMiddleware.builder()
			.cacheStore(cacheStore)
			.populateExecutor(populateExecutor)
			.build();
	}

	/**
	 * 함수 결과를 이 컨텍스트의 캐시에 저장하도록 감쌉니다.
	 *
	 * @see CachedFunction#of(CacheStore, String, int, Class, Function)
	 */
	public <A, R> Function<A, R> cached(String keyPrefix, int ttlSeconds, Class<R> resultType,
										Function<? super A, ? extends R> operation) {
		return CachedFunction.of(cacheStore, keyPrefix, ttlSeconds, resultType, operation);
	}

	public ServingSettings getSettings() {
		return settings;
	}

	public CacheStore getCacheStore() {
		return cacheStore;
	}

	public SessionStore getSessionStore() {
		return sessionStore;
	}

	public MetricsCollector getMetricsCollector() {
		return metricsCollector;
	}

	public HealthChecker getHealthChecker() {
		return healthChecker;
	}

	public ErrorTracker getErrorTracker() {
		return errorTracker;
	}

	/**
	 * 주기 점검 중단, 캐시 쓰기 스레드 종료, 캐시 연결 해제, 에러 추적 종료 순으로 정리합니다.
	 */
	@Override
	public synchronized void close() {
		if (closed) {
			return;
		}
		closed = true;

		healthChecker.close();

		populateExecutor.shutdown();
		try {
			if (!populateExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				populateExecutor.shutdownNow();
			}
		} catch (InterruptedException e) {
			populateExecutor.shutdownNow();
			Thread.currentThread().interrupt();
		}

		cacheStore.close();
		errorTracker.close();
		log.info("Serving infrastructure closed");
	}

	public static class Builder {
		private ServingSettings settings;
		private CacheStore cacheStore;
		private MetricsCollector metricsCollector;
		private HealthChecker healthChecker;
		private ErrorTracker errorTracker;
		private ExecutorService populateExecutor;
		private boolean configureLogging = false;
		private boolean periodicHealthChecks = true;
		private boolean failOnCacheConnectError = true;

		public Builder settings(ServingSettings settings) {
			this.settings = settings;
			return this;
		}

		/**
		 * 캐시 저장소, 지정하지 않으면 설정 기반 {@link RedisCacheStore}
		 */
		public Builder cacheStore(CacheStore cacheStore) {
			this.cacheStore = cacheStore;
			return this;
		}

		public Builder metricsCollector(MetricsCollector metricsCollector) {
			this.metricsCollector = metricsCollector;
			return this;
		}

		public Builder healthChecker(HealthChecker healthChecker) {
			this.healthChecker = healthChecker;
			return this;
		}

		public Builder errorTracker(ErrorTracker errorTracker) {
			this.errorTracker = errorTracker;
			return this;
		}

		/**
		 * 응답 캐시 쓰기용 executor, 컨텍스트가 닫힐 때 함께 종료됩니다.
		 */
		public Builder populateExecutor(ExecutorService populateExecutor) {
			this.populateExecutor = populateExecutor;
			return this;
		}

		/**
		 * start() 시 LOG_LEVEL / LOG_FILE 설정을 Logback에 적용할지 여부
		 */
		public Builder configureLogging(boolean configureLogging) {
			this.configureLogging = configureLogging;
			return this;
		}

		public Builder periodicHealthChecks(boolean periodicHealthChecks) {
			this.periodicHealthChecks = periodicHealthChecks;
			return this;
		}

		/**
		 * false이면 캐시 연결 실패 시 기동을 멈추지 않고 캐시 없이 계속합니다.
		 * 이후 캐시 연산은 미스/no-op으로 처리되고 헬스는 degraded로 보고됩니다.
		 */
		public Builder failOnCacheConnectError(boolean failOnCacheConnectError) {
			this.failOnCacheConnectError = failOnCacheConnectError;
			return this;
		}

		public ServingContext build() {
			if (settings == null) {
				settings = new ServingSettings();
			}
			if (cacheStore == null) {
				cacheStore = RedisCacheStore.from(settings.getCache());
			}
			if (metricsCollector == null) {
				metricsCollector = new MetricsCollector(settings.getMetrics().getWindowSize());
			}
			if (healthChecker == null) {
				healthChecker = new HealthChecker(
					settings.getHealth().getIntervalMillis(),
					settings.getHealth().getProbeTimeoutMillis());
			}
			if (errorTracker == null) {
				errorTracker = new ErrorTracker(settings.getErrorTracking());
			}
			if (populateExecutor == null) {
				AtomicInteger threadIndex = new AtomicInteger();
				populateExecutor = Executors.newFixedThreadPool(2, r -> {
					Thread t = new Thread(r, "cache-populate-" + threadIndex.incrementAndGet());
					t.setDaemon(true);
					return t;
				});
			}
			return new ServingContext(this);
		}
	}
}
