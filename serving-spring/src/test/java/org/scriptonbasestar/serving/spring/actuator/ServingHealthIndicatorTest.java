package org.scriptonbasestar.serving.spring.actuator;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.Assert.*;

/**
 * ServingHealthIndicator 테스트
 *
 * @since 2026-10
 */
public class ServingHealthIndicatorTest {

	private HealthChecker healthChecker;
	private ServingHealthIndicator indicator;

	@Before
	public void setUp() {
		healthChecker = new HealthChecker(60_000L, 1_000L);
		indicator = new ServingHealthIndicator(healthChecker);
	}

	@After
	public void tearDown() {
		healthChecker.close();
	}

	@Test
	public void testAllProbesHealthy() {
		// Given
		healthChecker.registerCheck("cache", () -> true);
		healthChecker.registerCheck("database", () -> true);

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertEquals("healthy", health.getDetails().get("overall"));
		Map<?, ?> checks = (Map<?, ?>) health.getDetails().get("checks");
		assertEquals(2, checks.size());
	}

	@Test
	public void testFailingProbeIsDown() {
		// Given
		healthChecker.registerCheck("cache", () -> false);
		healthChecker.registerCheck("search", () -> {
			throw new IllegalStateException("index missing");
		});

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.DOWN, health.getStatus());
		assertEquals("degraded", health.getDetails().get("overall"));

		Map<?, ?> checks = (Map<?, ?>) health.getDetails().get("checks");
		Map<?, ?> cache = (Map<?, ?>) checks.get("cache");
		Map<?, ?> search = (Map<?, ?>) checks.get("search");
		assertEquals("unhealthy", cache.get("status"));
		assertEquals("error", search.get("status"));
		assertEquals("index missing", search.get("error"));
	}

	@Test
	public void testNoProbesIsUp() {
		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullHealthChecker() {
		new ServingHealthIndicator(null);
	}
}
