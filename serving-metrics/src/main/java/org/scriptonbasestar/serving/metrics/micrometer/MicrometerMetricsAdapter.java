package org.scriptonbasestar.serving.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.scriptonbasestar.serving.observability.health.OverallStatus;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;
import org.scriptonbasestar.serving.observability.metrics.MetricsListener;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer MeterRegistry와 MetricsCollector를 연동하는 어댑터
 *
 * MetricsCollector에 기록되는 요청/에러를 Micrometer 메트릭으로도 기록하고,
 * 윈도우 기반 평균/p95/p99는 Gauge로 노출합니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MetricsCollector collector = new MetricsCollector();
 *
 * MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(collector, registry, "api");
 * adapter.bindHealth(healthChecker);
 *
 * collector.recordRequest("GET", 200, 35);  // serving.requests{method=GET,status=200} 증가
 * }</pre>
 *
 * @since 2026-10
 */
public class MicrometerMetricsAdapter implements MetricsListener {

	private final MetricsCollector collector;
	private final MeterRegistry meterRegistry;
	private final String application;

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param collector 요청 메트릭 수집기
	 * @param meterRegistry Micrometer 레지스트리
	 * @param application 애플리케이션 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(MetricsCollector collector, MeterRegistry meterRegistry, String application) {
		if (collector == null) {
			throw new IllegalArgumentException("MetricsCollector must not be null");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (application == null || application.trim().isEmpty()) {
			throw new IllegalArgumentException("Application name must not be null or empty");
		}
		this.collector = collector;
		this.meterRegistry = meterRegistry;
		this.application = application;

		Gauge.builder("serving.response.time.avg", collector, c -> c.getMetrics().averageMillis())
			.tag("application", application)
			.description("Average response time over the latency window (ms)")
			.strongReference(true)
			.register(meterRegistry);
		Gauge.builder("serving.response.time.p95", collector, c -> c.getMetrics().p95Millis())
			.tag("application", application)
			.description("95th percentile response time over the latency window (ms)")
			.strongReference(true)
			.register(meterRegistry);
		Gauge.builder("serving.response.time.p99", collector, c -> c.getMetrics().p99Millis())
			.tag("application", application)
			.description("99th percentile response time over the latency window (ms)")
			.strongReference(true)
			.register(meterRegistry);

		collector.addListener(this);
	}

	@Override
	public void onRequest(String method, int status, long durationMillis) {
		Counter.builder("serving.requests")
			.tag("application", application)
			.tag("method", method)
			.tag("status", String.valueOf(status))
			.description("Completed requests")
			.register(meterRegistry)
			.increment();
		Timer.builder("serving.request.duration")
			.tag("application", application)
			.tag("method", method)
			.description("Request duration")
			.register(meterRegistry)
			.record(durationMillis, TimeUnit.MILLISECONDS);
	}

	@Override
	public void onError(String type, Throwable error) {
		Counter.builder("serving.errors")
			.tag("application", application)
			.tag("type", type)
			.description("Recorded errors")
			.register(meterRegistry)
			.increment();
	}

	/**
	 * 마지막 헬스 점검 결과를 Gauge로 노출합니다. (1 = healthy, 0 = degraded, -1 = unknown)
	 *
	 * @param healthChecker 헬스 체커
	 */
	public void bindHealth(HealthChecker healthChecker) {
		Gauge.builder("serving.health.status", healthChecker, MicrometerMetricsAdapter::healthValue)
			.tag("application", application)
			.description("Aggregated health status")
			.strongReference(true)
			.register(meterRegistry);
	}

	static double healthValue(HealthChecker healthChecker) {
		OverallStatus status = healthChecker.getStatus().status();
		switch (status) {
			case HEALTHY:
				return 1.0;
			case DEGRADED:
				return 0.0;
			default:
				return -1.0;
		}
	}

	/**
	 * 수집기와의 연동을 해제합니다. 이미 등록된 메터는 레지스트리에 남습니다.
	 */
	public void unbind() {
		collector.removeListener(this);
	}

	public String getApplication() {
		return application;
	}

	public MetricsCollector getCollector() {
		return collector;
	}
}
