package org.scriptonbasestar.serving.observability.error;

import org.scriptonbasestar.serving.core.pipeline.ServingRequest;
import org.scriptonbasestar.serving.core.pipeline.ServingStage;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 파이프라인 앞단에 순서대로 설치하는 두 스테이지
 *
 * <ol>
 *   <li>{@link #contextCapture()}: 요청 메서드와 경로를 MDC에 넣어 이후 모든 로그에 남깁니다.</li>
 *   <li>{@link #errorCapture()}: 이후 단계에서 던진 예외를 요청 정보와 함께 기록하고 다시 던집니다.</li>
 * </ol>
 *
 * @since 2026-10
 */
public class ErrorTrackingStages {

	public static final String MDC_METHOD = "method";
	public static final String MDC_PATH = "path";

	private final ErrorTracker tracker;

	ErrorTrackingStages(ErrorTracker tracker) {
		this.tracker = tracker;
	}

	public ServingStage contextCapture() {
		return (request, response, next) -> {
			MDC.put(MDC_METHOD, request.method());
			MDC.put(MDC_PATH, request.path());
			try {
				next.proceed(request, response);
			} finally {
				MDC.remove(MDC_METHOD);
				MDC.remove(MDC_PATH);
			}
		};
	}

	public ServingStage errorCapture() {
		return (request, response, next) -> {
			try {
				next.proceed(request, response);
			} catch (Exception e) {
				tracker.captureException(e, requestContext(request));
				throw e;
			}
		};
	}

	private static Map<String, Object> requestContext(ServingRequest request) {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("method", request.method());
		context.put("path", request.path());
		if (request.query() != null) {
			context.put("query", request.query());
		}
		return context;
	}
}
