package org.scriptonbasestar.serving.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import org.scriptonbasestar.serving.cache.redis.RedisCacheStore;
import org.scriptonbasestar.serving.cache.session.SessionStore;
import org.scriptonbasestar.serving.cache.store.InMemoryCacheStore;
import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.metrics.micrometer.MicrometerMetricsAdapter;
import org.scriptonbasestar.serving.observability.error.ErrorTracker;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;
import org.scriptonbasestar.serving.spring.ServingContext;
import org.scriptonbasestar.serving.spring.actuator.CacheStoreHealthIndicator;
import org.scriptonbasestar.serving.spring.actuator.ServingHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot Auto-Configuration for the serving infrastructure.
 * <p>
 * Creates a started {@link ServingContext} and exposes its parts as beans.
 * Components owned by the context are closed by the context, so the derived beans
 * declare no destroy method.
 * </p>
 *
 * <ul>
 *   <li>{@link CacheStore}: Redis by default, in-memory with {@code sb-serving.store-type=memory},
 *       or any user-defined bean</li>
 *   <li>{@link SessionStore}, {@link MetricsCollector}, {@link HealthChecker}, {@link ErrorTracker}</li>
 *   <li>actuator health indicators when Spring Boot Actuator is present</li>
 *   <li>Micrometer meters when a {@link MeterRegistry} bean is present</li>
 * </ul>
 *
 * @since 2026-10
 */
@Configuration
@ConditionalOnClass(ServingContext.class)
@EnableConfigurationProperties(ServingProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class ServingAutoConfiguration {

	@Bean(destroyMethod = "")
	@ConditionalOnMissingBean(CacheStore.class)
	public CacheStore servingCacheStore(ServingProperties properties) {
		if (properties.getStoreType() == ServingProperties.StoreType.MEMORY) {
			return new InMemoryCacheStore(properties.getCache().getDefaultTtlSeconds());
		}
		return RedisCacheStore.from(properties.getCache());
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	public ServingContext servingContext(ServingProperties properties, CacheStore cacheStore) {
		ServingContext context = ServingContext.builder()
			.settings(properties)
			.cacheStore(cacheStore)
			.configureLogging(properties.isConfigureLogging())
			.periodicHealthChecks(properties.isPeriodicHealthChecks())
			.failOnCacheConnectError(properties.isFailOnCacheConnectError())
			.build();
		context.start();
		return context;
	}

	@Bean
	@ConditionalOnMissingBean
	public SessionStore servingSessionStore(ServingContext context) {
		return context.getSessionStore();
	}

	@Bean(destroyMethod = "")
	@ConditionalOnMissingBean
	public MetricsCollector servingMetricsCollector(ServingContext context) {
		return context.getMetricsCollector();
	}

	@Bean(destroyMethod = "")
	@ConditionalOnMissingBean
	public HealthChecker servingHealthChecker(ServingContext context) {
		return context.getHealthChecker();
	}

	@Bean(destroyMethod = "")
	@ConditionalOnMissingBean
	public ErrorTracker servingErrorTracker(ServingContext context) {
		return context.getErrorTracker();
	}

	/**
	 * Health indicators, only activated when Spring Boot Actuator is on the classpath.
	 */
	@Configuration
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	static class ActuatorConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "servingHealthIndicator")
		public ServingHealthIndicator servingHealthIndicator(ServingContext context) {
			return new ServingHealthIndicator(context.getHealthChecker());
		}

		@Bean
		@ConditionalOnMissingBean(name = "cacheStoreHealthIndicator")
		public CacheStoreHealthIndicator cacheStoreHealthIndicator(ServingContext context) {
			return new CacheStoreHealthIndicator(context.getCacheStore());
		}
	}

	/**
	 * Micrometer meters, only activated when a MeterRegistry bean exists.
	 */
	@Configuration
	@ConditionalOnClass(name = {
		"io.micrometer.core.instrument.MeterRegistry",
		"org.scriptonbasestar.serving.metrics.micrometer.MicrometerMetricsAdapter"
	})
	static class MicrometerConfiguration {

		@Bean(destroyMethod = "unbind")
		@ConditionalOnBean(MeterRegistry.class)
		@ConditionalOnMissingBean
		public MicrometerMetricsAdapter servingMicrometerMetricsAdapter(ServingContext context,
																		MeterRegistry meterRegistry,
																		ServingProperties properties) {
			MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(
				context.getMetricsCollector(), meterRegistry, properties.getMetricsApplication());
			adapter.bindHealth(context.getHealthChecker());
			return adapter;
		}
	}
}
