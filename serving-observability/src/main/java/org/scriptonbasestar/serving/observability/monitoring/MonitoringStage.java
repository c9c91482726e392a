package org.scriptonbasestar.serving.observability.monitoring;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.serving.core.pipeline.ResponseWriter;
import org.scriptonbasestar.serving.core.pipeline.ServingRequest;
import org.scriptonbasestar.serving.core.pipeline.ServingStage;
import org.scriptonbasestar.serving.core.pipeline.StageChain;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;

/**
 * 요청 처리 시간을 재고 MetricsCollector에 기록하는 스테이지
 *
 * 예외가 발생하면 예외 클래스 이름으로 에러를 기록하고 상태 500으로 집계한 뒤 다시 던집니다.
 *
 * @since 2026-10
 */
@Slf4j
public class MonitoringStage implements ServingStage {

	static final int ERROR_STATUS = 500;

	private final MetricsCollector metrics;

	public MonitoringStage(MetricsCollector metrics) {
		if (metrics == null) {
			throw new IllegalArgumentException("MetricsCollector must not be null");
		}
		this.metrics = metrics;
	}

	@Override
	public void handle(ServingRequest request, ResponseWriter response, StageChain next) throws Exception {
		long start = System.nanoTime();
		try {
			next.proceed(request, response);
		} catch (Exception e) {
			long duration = TimeCheckerUtil.elapsedMillis(start);
			metrics.recordError(e.getClass().getSimpleName(), e);
			metrics.recordRequest(request.method(), ERROR_STATUS, duration);
			throw e;
		}

		long duration = TimeCheckerUtil.elapsedMillis(start);
		metrics.recordRequest(request.method(), response.status(), duration);
		log.atInfo()
			.addKeyValue("status", response.status())
			.addKeyValue("duration", duration + "ms")
			.log("{} {}", request.method(), request.pathWithQuery());
	}
}
