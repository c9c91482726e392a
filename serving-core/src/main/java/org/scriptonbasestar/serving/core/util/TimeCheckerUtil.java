package org.scriptonbasestar.serving.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * TTL 만료 시각 계산 유틸리티
 *
 * TTL 0은 만료 없음으로 취급합니다.
 *
 * @since 2026-10
 */
@Slf4j
@UtilityClass
public class TimeCheckerUtil {

	/**
	 * 만료 없음을 나타내는 만료 시각
	 */
	public static final long NO_EXPIRY = Long.MAX_VALUE;

	/**
	 * 기준 시각에 TTL을 더한 만료 시각을 계산합니다.
	 *
	 * @param nowMillis 기준 시각 (epoch milliseconds)
	 * @param ttlSeconds TTL (초), 0이면 만료 없음
	 * @return 만료 시각 (epoch milliseconds)
	 */
	public static long expiresAt(long nowMillis, int ttlSeconds) {
		requireValidTtl(ttlSeconds);
		if (ttlSeconds == 0) {
			return NO_EXPIRY;
		}
		return nowMillis + ttlSeconds * 1000L;
	}

	/**
	 * 만료 시각이 지났는지 확인합니다.
	 *
	 * @param expiresAtMillis 만료 시각 (epoch milliseconds)
	 * @param nowMillis 현재 시각 (epoch milliseconds)
	 * @return 만료되었으면 true
	 */
	public static boolean isExpired(long expiresAtMillis, long nowMillis) {
		if (log.isTraceEnabled() && expiresAtMillis != NO_EXPIRY) {
			log.trace("isExpired 비교 - expiresAt : {}, now : {}",
				Instant.ofEpochMilli(expiresAtMillis), Instant.ofEpochMilli(nowMillis));
		}
		return expiresAtMillis != NO_EXPIRY && nowMillis >= expiresAtMillis;
	}

	/**
	 * 두 시각 사이의 경과 시간을 밀리초로 반환합니다.
	 *
	 * @param startNanos System.nanoTime() 시작값
	 * @return 경과 시간 (밀리초)
	 */
	public static long elapsedMillis(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
	}

	/**
	 * TTL이 0 이상인지 검사합니다.
	 *
	 * @param ttlSeconds TTL (초)
	 * @throws IllegalArgumentException 음수일 때
	 */
	public static void requireValidTtl(int ttlSeconds) {
		if (ttlSeconds < 0) {
			throw new IllegalArgumentException("TTL must not be negative: " + ttlSeconds);
		}
	}
}
