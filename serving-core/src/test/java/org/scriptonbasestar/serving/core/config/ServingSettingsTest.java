package org.scriptonbasestar.serving.core.config;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ServingSettingsTest {

	@Test
	public void testDefaults() {
		ServingSettings settings = ServingSettings.fromEnvironment(new HashMap<>());

		assertEquals("localhost", settings.getCache().getHost());
		assertEquals(6379, settings.getCache().getPort());
		assertNull(settings.getCache().getPassword());
		assertEquals(0, settings.getCache().getDatabase());
		assertEquals(3600, settings.getCache().getDefaultTtlSeconds());
		assertEquals(60_000L, settings.getHealth().getIntervalMillis());
		assertEquals("info", settings.getLogging().getLevel());
		assertNull(settings.getLogging().getFile());
		assertFalse(settings.getErrorTracking().isRemoteConfigured());
		assertEquals("development", settings.getErrorTracking().getEnvironment());
		assertEquals(0.1, settings.getErrorTracking().getTracesSampleRate(), 0.0001);
		assertEquals(10_000, settings.getMetrics().getWindowSize());
		assertTrue(settings.getMetrics().isEnabled());
	}

	@Test
	public void testMonitoringCanBeDisabled() {
		Map<String, String> env = new HashMap<>();
		env.put("MONITORING_ENABLED", "FALSE");

		assertFalse(ServingSettings.fromEnvironment(env).getMetrics().isEnabled());

		env.put("MONITORING_ENABLED", "maybe");

		assertTrue(ServingSettings.fromEnvironment(env).getMetrics().isEnabled());
	}

	@Test
	public void testEnvironmentOverrides() {
		Map<String, String> env = new HashMap<>();
		env.put("REDIS_HOST", "cache.internal");
		env.put("REDIS_PORT", "6380");
		env.put("REDIS_PASSWORD", "secret");
		env.put("REDIS_DB", "2");
		env.put("CACHE_TTL", "120");
		env.put("HEALTH_CHECK_INTERVAL", "15000");
		env.put("LOG_LEVEL", "debug");
		env.put("LOG_FILE", "/var/log/serving/app.log");
		env.put("SENTRY_DSN", "https://key@sentry.example/1");
		env.put("SENTRY_ENVIRONMENT", "production");
		env.put("SENTRY_TRACES_SAMPLE_RATE", "0.5");

		ServingSettings settings = ServingSettings.fromEnvironment(env);

		assertEquals("cache.internal", settings.getCache().getHost());
		assertEquals(6380, settings.getCache().getPort());
		assertEquals("secret", settings.getCache().getPassword());
		assertEquals(2, settings.getCache().getDatabase());
		assertEquals(120, settings.getCache().getDefaultTtlSeconds());
		assertEquals(15_000L, settings.getHealth().getIntervalMillis());
		assertEquals("debug", settings.getLogging().getLevel());
		assertEquals("/var/log/serving/app.log", settings.getLogging().getFile());
		assertTrue(settings.getErrorTracking().isRemoteConfigured());
		assertEquals("production", settings.getErrorTracking().getEnvironment());
		assertEquals(0.5, settings.getErrorTracking().getTracesSampleRate(), 0.0001);
	}

	@Test
	public void testMalformedNumbersKeepDefaults() {
		Map<String, String> env = new HashMap<>();
		env.put("REDIS_PORT", "not-a-port");
		env.put("SENTRY_TRACES_SAMPLE_RATE", "lots");
		env.put("REDIS_HOST", "   ");

		ServingSettings settings = ServingSettings.fromEnvironment(env);

		assertEquals(6379, settings.getCache().getPort());
		assertEquals(0.1, settings.getErrorTracking().getTracesSampleRate(), 0.0001);
		assertEquals("localhost", settings.getCache().getHost());
	}
}
