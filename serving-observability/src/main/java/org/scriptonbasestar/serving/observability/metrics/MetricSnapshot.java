package org.scriptonbasestar.serving.observability.metrics;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 요청 메트릭의 불변 스냅샷
 *
 * {@link MetricsCollector#getMetrics()} 시점의 카운터, 응답 시간 통계, 프로세스 사용량을 담습니다.
 *
 * @since 2026-10
 */
public final class MetricSnapshot {

	private final long timestamp;
	private final long totalRequests;
	private final Map<String, Long> requestsByMethod;
	private final Map<Integer, Long> requestsByStatus;
	private final long totalErrors;
	private final Map<String, Long> errorsByType;
	private final int sampleCount;
	private final double averageMillis;
	private final long p95Millis;
	private final long p99Millis;
	private final ProcessUsage processUsage;

	MetricSnapshot(long timestamp,
				   long totalRequests,
				   Map<String, Long> requestsByMethod,
				   Map<Integer, Long> requestsByStatus,
				   long totalErrors,
				   Map<String, Long> errorsByType,
				   int sampleCount,
				   double averageMillis,
				   long p95Millis,
				   long p99Millis,
				   ProcessUsage processUsage) {
		this.timestamp = timestamp;
		this.totalRequests = totalRequests;
		this.requestsByMethod = Collections.unmodifiableMap(new TreeMap<>(requestsByMethod));
		this.requestsByStatus = Collections.unmodifiableMap(new TreeMap<>(requestsByStatus));
		this.totalErrors = totalErrors;
		this.errorsByType = Collections.unmodifiableMap(new TreeMap<>(errorsByType));
		this.sampleCount = sampleCount;
		this.averageMillis = averageMillis;
		this.p95Millis = p95Millis;
		this.p99Millis = p99Millis;
		this.processUsage = processUsage;
	}

	/**
	 * 스냅샷 생성 시간 (epoch milliseconds)
	 */
	public long timestamp() {
		return timestamp;
	}

	public Instant instant() {
		return Instant.ofEpochMilli(timestamp);
	}

	public long totalRequests() {
		return totalRequests;
	}

	public Map<String, Long> requestsByMethod() {
		return requestsByMethod;
	}

	public Map<Integer, Long> requestsByStatus() {
		return requestsByStatus;
	}

	public long totalErrors() {
		return totalErrors;
	}

	public Map<String, Long> errorsByType() {
		return errorsByType;
	}

	/**
	 * 응답 시간 윈도우에 남아있는 샘플 수
	 */
	public int sampleCount() {
		return sampleCount;
	}

	public double averageMillis() {
		return averageMillis;
	}

	public long p95Millis() {
		return p95Millis;
	}

	public long p99Millis() {
		return p99Millis;
	}

	public ProcessUsage processUsage() {
		return processUsage;
	}

	/**
	 * JSON 응답이나 헬스 상세 정보용 맵으로 변환합니다.
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> requests = new LinkedHashMap<>();
		requests.put("total", totalRequests);
		requests.put("byMethod", requestsByMethod);
		requests.put("byStatus", requestsByStatus);

		Map<String, Object> errors = new LinkedHashMap<>();
		errors.put("total", totalErrors);
		errors.put("byType", errorsByType);

		Map<String, Object> responseTime = new LinkedHashMap<>();
		responseTime.put("samples", sampleCount);
		responseTime.put("avg", averageMillis);
		responseTime.put("p95", p95Millis);
		responseTime.put("p99", p99Millis);

		Map<String, Object> map = new LinkedHashMap<>();
		map.put("timestamp", instant().toString());
		map.put("requests", requests);
		map.put("errors", errors);
		map.put("responseTime", responseTime);
		map.put("process", processUsage.toMap());
		return map;
	}

	@Override
	public String toString() {
		return String.format(
			"MetricSnapshot{requests=%d, errors=%d, samples=%d, avg=%.2fms, p95=%dms, p99=%dms}",
			totalRequests, totalErrors, sampleCount, averageMillis, p95Millis, p99Millis
		);
	}
}
