package org.scriptonbasestar.serving.spring.actuator;

import org.scriptonbasestar.serving.observability.health.AggregatedHealth;
import org.scriptonbasestar.serving.observability.health.HealthCheckResult;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports the aggregated result of all registered probes via Spring Boot Actuator.
 * <p>
 * Each call runs a fresh sweep. {@code healthy} maps to UP, {@code degraded} to DOWN.
 * </p>
 *
 * <pre>{@code
 * {
 *   "status": "DOWN",
 *   "details": {
 *     "overall": "degraded",
 *     "checks": {
 *       "cache": { "status": "unhealthy", "duration": 3, ... }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @since 2026-10
 */
public class ServingHealthIndicator implements HealthIndicator {

	private final HealthChecker healthChecker;

	public ServingHealthIndicator(HealthChecker healthChecker) {
		if (healthChecker == null) {
			throw new IllegalArgumentException("healthChecker must not be null");
		}
		this.healthChecker = healthChecker;
	}

	@Override
	public Health health() {
		AggregatedHealth aggregated = healthChecker.performChecks();

		Health.Builder builder;
		switch (aggregated.status()) {
			case HEALTHY:
				builder = Health.up();
				break;
			case DEGRADED:
				builder = Health.down();
				break;
			default:
				builder = Health.unknown();
		}

		Map<String, Object> checks = new LinkedHashMap<>();
		for (HealthCheckResult result : aggregated.checks().values()) {
			checks.put(result.name(), result.toMap());
		}

		return builder
			.withDetail("overall", aggregated.status().value())
			.withDetail("checks", checks)
			.build();
	}
}
