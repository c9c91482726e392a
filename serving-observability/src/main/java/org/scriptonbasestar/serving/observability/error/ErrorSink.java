package org.scriptonbasestar.serving.observability.error;

import org.slf4j.event.Level;

import java.util.Map;

/**
 * 외부 에러 수집 서비스로 전달하는 출구
 *
 * 구현체는 예외를 던질 수 있으며, {@link ErrorTracker}가 잡아서 로그로만 남깁니다.
 *
 * @since 2026-10
 */
public interface ErrorSink extends AutoCloseable {

	void captureException(Throwable error, Map<String, Object> context);

	void captureMessage(String message, Level level);

	/**
	 * 남은 이벤트를 전송하고 연결을 닫습니다.
	 */
	@Override
	void close();
}
