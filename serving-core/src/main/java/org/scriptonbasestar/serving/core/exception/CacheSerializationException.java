package org.scriptonbasestar.serving.core.exception;

/**
 * 캐시 값을 JSON으로 인코딩하지 못했을 때 발생합니다.
 *
 * @since 2026-10
 */
public class CacheSerializationException extends RuntimeException {

	public CacheSerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
