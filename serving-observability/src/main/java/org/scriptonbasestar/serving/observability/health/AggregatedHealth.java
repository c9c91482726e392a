package org.scriptonbasestar.serving.observability.health;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 번의 점검(sweep) 결과 전체
 *
 * 모든 프로브가 HEALTHY이면 HEALTHY, 하나라도 아니면 DEGRADED입니다.
 * 프로브가 없으면 HEALTHY입니다.
 *
 * @since 2026-10
 */
public final class AggregatedHealth {

	private final OverallStatus status;
	private final Map<String, HealthCheckResult> checks;
	private final long timestamp;

	private AggregatedHealth(OverallStatus status, Map<String, HealthCheckResult> checks, long timestamp) {
		this.status = status;
		this.checks = checks;
		this.timestamp = timestamp;
	}

	/**
	 * 점검 전 초기 상태
	 */
	public static AggregatedHealth unknown(long timestamp) {
		return new AggregatedHealth(OverallStatus.UNKNOWN, Collections.emptyMap(), timestamp);
	}

	public static AggregatedHealth of(Collection<HealthCheckResult> results, long timestamp) {
		Map<String, HealthCheckResult> checks = new LinkedHashMap<>();
		boolean allHealthy = true;
		for (HealthCheckResult result : results) {
			checks.put(result.name(), result);
			allHealthy &= result.isHealthy();
		}
		OverallStatus status = allHealthy ? OverallStatus.HEALTHY : OverallStatus.DEGRADED;
		return new AggregatedHealth(status, Collections.unmodifiableMap(checks), timestamp);
	}

	public OverallStatus status() {
		return status;
	}

	public boolean isHealthy() {
		return status == OverallStatus.HEALTHY;
	}

	public Map<String, HealthCheckResult> checks() {
		return checks;
	}

	public HealthCheckResult check(String name) {
		return checks.get(name);
	}

	public long timestamp() {
		return timestamp;
	}

	public Map<String, Object> toMap() {
		Map<String, Object> details = new LinkedHashMap<>();
		checks.forEach((name, result) -> details.put(name, result.toMap()));

		Map<String, Object> map = new LinkedHashMap<>();
		map.put("status", status.value());
		map.put("timestamp", timestamp);
		map.put("checks", details);
		return map;
	}

	@Override
	public String toString() {
		return "AggregatedHealth{status=" + status.value() + ", checks=" + checks.values() + "}";
	}
}
