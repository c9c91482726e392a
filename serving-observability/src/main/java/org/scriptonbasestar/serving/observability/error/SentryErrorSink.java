package org.scriptonbasestar.serving.observability.error;

import io.sentry.Sentry;
import io.sentry.SentryLevel;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.slf4j.event.Level;

import java.util.Map;

/**
 * Sentry Java SDK로 전달하는 ErrorSink
 *
 * @since 2026-10
 */
@Slf4j
public class SentryErrorSink implements ErrorSink {

	private static final long FLUSH_TIMEOUT_MILLIS = 2_000L;

	/**
	 * Sentry SDK를 초기화합니다.
	 *
	 * @param settings DSN, 환경, 트레이스 샘플링 비율
	 */
	public SentryErrorSink(ServingSettings.ErrorTracking settings) {
		if (settings == null || !settings.isRemoteConfigured()) {
			throw new IllegalArgumentException("Sentry DSN must be configured");
		}
		Sentry.init(options -> {
			options.setDsn(settings.getDsn());
			options.setEnvironment(settings.getEnvironment());
			options.setTracesSampleRate(settings.getTracesSampleRate());
			options.setSendDefaultPii(false);
		});
		log.debug("Sentry initialized (environment={}, tracesSampleRate={})",
			settings.getEnvironment(), settings.getTracesSampleRate());
	}

	@Override
	public void captureException(Throwable error, Map<String, Object> context) {
		Sentry.withScope(scope -> {
			context.forEach((key, value) -> scope.setExtra(key, String.valueOf(value)));
			Sentry.captureException(error);
		});
	}

	@Override
	public void captureMessage(String message, Level level) {
		Sentry.captureMessage(message, toSentryLevel(level));
	}

	@Override
	public void close() {
		Sentry.flush(FLUSH_TIMEOUT_MILLIS);
		Sentry.close();
	}

	static SentryLevel toSentryLevel(Level level) {
		switch (level) {
			case ERROR:
				return SentryLevel.ERROR;
			case WARN:
				return SentryLevel.WARNING;
			case INFO:
				return SentryLevel.INFO;
			default:
				return SentryLevel.DEBUG;
		}
	}
}
