package org.scriptonbasestar.serving.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.scriptonbasestar.serving.observability.health.HealthChecker;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;

import java.util.Set;

/**
 * 서빙 프로세스의 /metrics 응답을 만드는 Prometheus 헬퍼
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
 * PrometheusMetricsHelper.bindServing(collector, healthChecker, registry, "blog-api");
 *
 * // GET /metrics
 * response.header("Content-Type", PrometheusMetricsHelper.CONTENT_TYPE);
 * response.send(PrometheusMetricsHelper.scrapeMetrics(registry));
 * }</pre>
 *
 * @since 2026-10
 */
public class PrometheusMetricsHelper {

	/**
	 * Prometheus 텍스트 포맷 0.0.4 Content-Type
	 */
	public static final String CONTENT_TYPE = TextFormat.CONTENT_TYPE_004;

	public static PrometheusMeterRegistry createPrometheusRegistry() {
		return createPrometheusRegistry(PrometheusConfig.DEFAULT);
	}

	public static PrometheusMeterRegistry createPrometheusRegistry(PrometheusConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		return new PrometheusMeterRegistry(config);
	}

	/**
	 * 요청 메트릭만 바인딩합니다.
	 */
	public static MicrometerMetricsAdapter bindMetrics(MetricsCollector collector,
													   MeterRegistry meterRegistry,
													   String application) {
		return new MicrometerMetricsAdapter(collector, meterRegistry, application);
	}

	/**
	 * 요청 메트릭과 헬스 상태 게이지를 함께 바인딩합니다.
	 *
	 * @param collector 요청 메트릭 수집기
	 * @param healthChecker 헬스 체커
	 * @param meterRegistry 메터 레지스트리
	 * @param application application 태그 값
	 * @return 바인딩된 어댑터, 해제는 {@link MicrometerMetricsAdapter#unbind()}
	 */
	public static MicrometerMetricsAdapter bindServing(MetricsCollector collector,
													   HealthChecker healthChecker,
													   MeterRegistry meterRegistry,
													   String application) {
		MicrometerMetricsAdapter adapter = bindMetrics(collector, meterRegistry, application);
		adapter.bindHealth(healthChecker);
		return adapter;
	}

	public static String scrapeMetrics(PrometheusMeterRegistry registry) {
		return registry.scrape(CONTENT_TYPE);
	}

	/**
	 * 지정한 시계열 이름만 출력합니다.
	 *
	 * @param registry Prometheus 레지스트리
	 * @param includedNames 출력할 시계열 이름 (예: "serving_health_status")
	 */
	public static String scrapeMetrics(PrometheusMeterRegistry registry, Set<String> includedNames) {
		return registry.scrape(CONTENT_TYPE, includedNames);
	}

	private PrometheusMetricsHelper() {
	}
}
