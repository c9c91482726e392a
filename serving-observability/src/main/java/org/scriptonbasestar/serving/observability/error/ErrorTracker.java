package org.scriptonbasestar.serving.observability.error;

import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * 에러를 로컬 로그에 남기고, 설정되어 있으면 외부 수집 서비스(Sentry)로도 전달합니다.
 *
 * <p>외부 전달은 항상 best-effort입니다. 설정이 없거나 초기화/전송에 실패해도
 * 로컬 로그는 남고 호출자에게 예외가 전파되지 않습니다.</p>
 *
 * <pre>{@code
 * ErrorTracker tracker = new ErrorTracker(settings.getErrorTracking());
 * tracker.initialize();
 *
 * tracker.captureException(e, Map.of("userId", userId));
 * tracker.captureMessage("Payment provider slow", Level.WARN);
 * }</pre>
 *
 * @since 2026-10
 */
public class ErrorTracker implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(ErrorTracker.class);

	private final ServingSettings.ErrorTracking settings;
	private final Function<ServingSettings.ErrorTracking, ErrorSink> sinkFactory;
	private volatile ErrorSink sink;

	public ErrorTracker(ServingSettings.ErrorTracking settings) {
		this(settings, SentryErrorSink::new);
	}

	/**
	 * @param settings 에러 추적 설정
	 * @param sinkFactory 외부 전달 출구 생성 함수
	 */
	public ErrorTracker(ServingSettings.ErrorTracking settings,
						Function<ServingSettings.ErrorTracking, ErrorSink> sinkFactory) {
		if (settings == null || sinkFactory == null) {
			throw new IllegalArgumentException("settings and sinkFactory must not be null");
		}
		this.settings = settings;
		this.sinkFactory = sinkFactory;
	}

	/**
	 * 외부 전달을 준비합니다. DSN이 없거나 실패하면 로컬 로그만 사용하며, 예외를 던지지 않습니다.
	 */
	public synchronized void initialize() {
		if (sink != null) {
			return;
		}
		if (!settings.isRemoteConfigured()) {
			log.info("Error tracking disabled (no DSN configured), logging locally only");
			return;
		}
		try {
			sink = sinkFactory.apply(settings);
			log.info("Error tracking initialized (environment={})", settings.getEnvironment());
		} catch (RuntimeException e) {
			log.error("Failed to initialize error tracking, logging locally only", e);
		}
	}

	public boolean isRemoteEnabled() {
		return sink != null;
	}

	public void captureException(Throwable error) {
		captureException(error, Collections.emptyMap());
	}

	/**
	 * 예외를 ERROR 로그 한 건으로 남기고 외부로 전달합니다.
	 *
	 * @param error 예외
	 * @param context 로그와 외부 이벤트에 함께 남길 키-값
	 */
	public void captureException(Throwable error, Map<String, Object> context) {
		Map<String, Object> safeContext = context != null ? context : Collections.emptyMap();

		LoggingEventBuilder event = log.atError()
			.setCause(error)
			.addKeyValue("errorType", error.getClass().getName());
		safeContext.forEach(event::addKeyValue);
		event.log(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());

		ErrorSink current = sink;
		if (current != null) {
			try {
				current.captureException(error, safeContext);
			} catch (RuntimeException e) {
				log.warn("Failed to forward exception to error tracking: {}", e.getMessage());
			}
		}
	}

	public void captureMessage(String message) {
		captureMessage(message, Level.INFO);
	}

	/**
	 * 메시지를 지정한 레벨로 로그에 남기고 외부로 전달합니다.
	 */
	public void captureMessage(String message, Level level) {
		Level safeLevel = level != null ? level : Level.INFO;
		log.atLevel(safeLevel).log(message);

		ErrorSink current = sink;
		if (current != null) {
			try {
				current.captureMessage(message, safeLevel);
			} catch (RuntimeException e) {
				log.warn("Failed to forward message to error tracking: {}", e.getMessage());
			}
		}
	}

	/**
	 * 요청 파이프라인에 설치할 컨텍스트/에러 캡처 스테이지 쌍
	 */
	public ErrorTrackingStages stages() {
		return new ErrorTrackingStages(this);
	}

	@Override
	public synchronized void close() {
		ErrorSink current = sink;
		sink = null;
		if (current != null) {
			try {
				current.close();
			} catch (RuntimeException e) {
				log.warn("Failed to close error tracking: {}", e.getMessage());
			}
		}
	}
}
