package org.scriptonbasestar.serving.core.exception;

/**
 * 캐시 저장소 연결 실패
 *
 * 재시도 횟수 또는 연결 제한 시간을 모두 소진했을 때만 던져집니다.
 * 연결 이후의 개별 연산 실패는 이 예외로 전파되지 않습니다.
 *
 * @since 2026-10
 */
public class ServingCacheConnectException extends RuntimeException {

	private final int attempts;

	public ServingCacheConnectException(String message, int attempts) {
		super(message);
		this.attempts = attempts;
	}

	public ServingCacheConnectException(String message, int attempts, Throwable cause) {
		super(message, cause);
		this.attempts = attempts;
	}

	/**
	 * 포기하기 전까지 시도한 연결 횟수
	 */
	public int getAttempts() {
		return attempts;
	}
}
