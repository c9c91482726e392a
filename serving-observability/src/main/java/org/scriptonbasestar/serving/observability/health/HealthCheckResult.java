package org.scriptonbasestar.serving.observability.health;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 프로브 한 건의 점검 결과
 *
 * @since 2026-10
 */
public final class HealthCheckResult {

	private final String name;
	private final ProbeStatus status;
	private final long durationMillis;
	private final long timestamp;
	private final String error;

	public HealthCheckResult(String name, ProbeStatus status, long durationMillis, long timestamp, String error) {
		this.name = name;
		this.status = status;
		this.durationMillis = durationMillis;
		this.timestamp = timestamp;
		this.error = error;
	}

	public String name() {
		return name;
	}

	public ProbeStatus status() {
		return status;
	}

	public long durationMillis() {
		return durationMillis;
	}

	public long timestamp() {
		return timestamp;
	}

	/**
	 * @return 에러 메시지, ERROR 상태가 아니면 null
	 */
	public String error() {
		return error;
	}

	public boolean isHealthy() {
		return status == ProbeStatus.HEALTHY;
	}

	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("status", status.value());
		map.put("duration", durationMillis);
		map.put("timestamp", timestamp);
		if (error != null) {
			map.put("error", error);
		}
		return map;
	}

	@Override
	public String toString() {
		return "HealthCheckResult{name=" + name + ", status=" + status.value()
			+ ", duration=" + durationMillis + "ms"
			+ (error != null ? ", error=" + error : "") + "}";
	}
}
