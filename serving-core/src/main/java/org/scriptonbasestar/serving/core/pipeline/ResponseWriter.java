package org.scriptonbasestar.serving.core.pipeline;

/**
 * 응답을 직렬화해 내보내는 출구
 *
 * 스테이지는 이 인터페이스를 감싸는 데코레이터를 다음 스테이지에 넘겨
 * 응답을 관찰할 수 있습니다. 원본 객체를 직접 바꾸지 않습니다.
 *
 * @since 2026-10
 */
public interface ResponseWriter {

	/**
	 * 상태 코드를 지정합니다. {@link #send(Object)} 이전에만 의미가 있습니다.
	 */
	void status(int statusCode);

	/**
	 * @return 현재 상태 코드 (기본 200)
	 */
	int status();

	/**
	 * 응답 헤더를 지정합니다.
	 */
	void header(String name, String value);

	/**
	 * 페이로드를 직렬화해 내보냅니다. 응답당 한 번만 호출됩니다.
	 *
	 * @param payload 응답 본문
	 */
	void send(Object payload);

	/**
	 * @return send가 이미 호출되었으면 true
	 */
	boolean isCommitted();

	/**
	 * 2xx 상태인지 확인합니다.
	 */
	default boolean isSuccessful() {
		int code = status();
		return code >= 200 && code < 300;
	}
}
