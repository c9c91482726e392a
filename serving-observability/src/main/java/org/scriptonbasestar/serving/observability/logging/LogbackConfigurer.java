package org.scriptonbasestar.serving.observability.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;

/**
 * LOG_LEVEL / LOG_FILE 설정을 Logback 루트 로거에 적용합니다.
 *
 * <ul>
 *   <li>레벨: error, warn, info, debug, trace 외에 http/verbose는 DEBUG, silly는 TRACE로 취급</li>
 *   <li>파일: 지정되면 상위 디렉터리를 만들고 파일 appender를 루트 로거에 추가</li>
 * </ul>
 *
 * @since 2026-10
 */
@Slf4j
@UtilityClass
public class LogbackConfigurer {

	public static final String FILE_APPENDER_NAME = "SERVING_FILE";
	static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg %kvp%n";

	/**
	 * 설정을 적용합니다. Logback이 SLF4J 백엔드가 아니면 WARN 로그만 남깁니다.
	 *
	 * @param settings 로그 설정
	 * @return 적용했으면 true
	 */
	public static boolean configure(ServingSettings.Logging settings) {
		ILoggerFactory factory = LoggerFactory.getILoggerFactory();
		if (!(factory instanceof LoggerContext)) {
			log.warn("Logback is not the active SLF4J backend ({}), logging settings not applied",
				factory.getClass().getName());
			return false;
		}
		LoggerContext context = (LoggerContext) factory;
		Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

		Level level = toLevel(settings.getLevel());
		root.setLevel(level);

		String file = settings.getFile();
		if (file != null && !file.trim().isEmpty() && root.getAppender(FILE_APPENDER_NAME) == null) {
			root.addAppender(fileAppender(context, file));
		}
		log.info("Logging configured (level={}, file={})", level, file);
		return true;
	}

	static Level toLevel(String value) {
		if (value == null) {
			return Level.INFO;
		}
		switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "http":
			case "verbose":
				return Level.DEBUG;
			case "silly":
				return Level.TRACE;
			default:
				return Level.toLevel(value.trim(), Level.INFO);
		}
	}

	private static FileAppender<ILoggingEvent> fileAppender(LoggerContext context, String file) {
		File parent = new File(file).getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists() && !parent.mkdirs()) {
			log.warn("Could not create log directory: {}", parent);
		}

		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern(FILE_PATTERN);
		encoder.start();

		FileAppender<ILoggingEvent> appender = new FileAppender<>();
		appender.setContext(context);
		appender.setName(FILE_APPENDER_NAME);
		appender.setFile(file);
		appender.setAppend(true);
		appender.setEncoder(encoder);
		appender.start();
		return appender;
	}
}
