package org.scriptonbasestar.serving.observability.metrics;

/**
 * MetricsCollector에 기록되는 이벤트를 전달받습니다.
 *
 * 기록 스레드에서 동기적으로 호출되므로 빨리 반환해야 합니다.
 *
 * @since 2026-10
 */
public interface MetricsListener {

	void onRequest(String method, int status, long durationMillis);

	default void onError(String type, Throwable error) {
	}

	default void onReset() {
	}
}
