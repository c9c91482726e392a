package org.scriptonbasestar.serving.core.cache;

/**
 * 캐시 키 접두사
 *
 * @since 2026-10
 */
public enum CacheNamespace {
	USERS("users:"),
	POSTS("posts:"),
	VIDEOS("videos:"),
	COURSES("courses:"),
	SESSIONS("sessions:"),
	API_RESPONSES("api:"),
	ANALYTICS("analytics:");

	private final String prefix;

	CacheNamespace(String prefix) {
		this.prefix = prefix;
	}

	public String prefix() {
		return prefix;
	}

	/**
	 * 네임스페이스가 붙은 키를 만듭니다.
	 *
	 * @param id 네임스페이스 내부 식별자
	 * @return 전체 캐시 키
	 */
	public String key(String id) {
		return prefix + id;
	}

	/**
	 * 네임스페이스 전체에 일치하는 glob 패턴
	 *
	 * @return 예: "posts:*"
	 */
	public String pattern() {
		return prefix + "*";
	}
}
