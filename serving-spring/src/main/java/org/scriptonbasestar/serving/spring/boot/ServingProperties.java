package org.scriptonbasestar.serving.spring.boot;

import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the serving infrastructure.
 * <p>
 * Binds the same tree as {@link ServingSettings#fromEnvironment()} under {@code sb-serving.*},
 * plus a few Spring-only switches.
 * </p>
 *
 * <pre>{@code
 * # application.yml
 * sb-serving:
 *   store-type: redis
 *   cache:
 *     host: redis.internal
 *     port: 6379
 *     default-ttl-seconds: 600
 *   health:
 *     interval-millis: 30000
 *   error-tracking:
 *     dsn: https://key@sentry.example.com/1
 *     environment: production
 *   metrics:
 *     enabled: true
 *     window-size: 5000
 *     application: blog-api
 * }</pre>
 *
 * @since 2026-10
 */
@ConfigurationProperties(prefix = "sb-serving")
public class ServingProperties extends ServingSettings {

	/**
	 * Backing store used when no CacheStore bean is defined.
	 */
	private StoreType storeType = StoreType.REDIS;

	/**
	 * Whether logging.level/logging.file are applied to Logback on startup.
	 * Off by default because Spring Boot configures logging itself.
	 */
	private boolean configureLogging = false;

	/**
	 * Whether health probes are swept on a schedule.
	 */
	private boolean periodicHealthChecks = true;

	/**
	 * Whether startup fails when the cache cannot be reached.
	 * When false the application starts without caching and reports degraded health.
	 */
	private boolean failOnCacheConnectError = true;

	/**
	 * Value of the "application" tag on exported meters.
	 */
	private String metricsApplication = "serving";

	public StoreType getStoreType() {
		return storeType;
	}

	public void setStoreType(StoreType storeType) {
		this.storeType = storeType;
	}

	public boolean isConfigureLogging() {
		return configureLogging;
	}

	public void setConfigureLogging(boolean configureLogging) {
		this.configureLogging = configureLogging;
	}

	public boolean isPeriodicHealthChecks() {
		return periodicHealthChecks;
	}

	public void setPeriodicHealthChecks(boolean periodicHealthChecks) {
		this.periodicHealthChecks = periodicHealthChecks;
	}

	public boolean isFailOnCacheConnectError() {
		return failOnCacheConnectError;
	}

	public void setFailOnCacheConnectError(boolean failOnCacheConnectError) {
		this.failOnCacheConnectError = failOnCacheConnectError;
	}

	public String getMetricsApplication() {
		return metricsApplication;
	}

	public void setMetricsApplication(String metricsApplication) {
		this.metricsApplication = metricsApplication;
	}

	public enum StoreType {
		/** Redis via Jedis */
		REDIS,
		/** process-local store, for development and tests */
		MEMORY
	}
}
