package org.scriptonbasestar.serving.cache.session;

import org.scriptonbasestar.serving.core.cache.CacheNamespace;
import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;

import java.util.Map;

/**
 * 사용자 세션 저장소
 *
 * <p>{@code sessions:} 네임스페이스를 쓰는 CacheStore 래퍼입니다.
 * 조회는 TTL을 연장하지 않고, {@link #updateSession(String, Map)}만 TTL을 다시 설정합니다.</p>
 *
 * @since 2026-10
 */
public class SessionStore {

	/**
	 * 기본 세션 TTL: 24시간
	 */
	public static final int DEFAULT_SESSION_TTL_SECONDS = 86_400;

	private final CacheStore cacheStore;
	private final int sessionTtlSeconds;

	public SessionStore(CacheStore cacheStore) {
		this(cacheStore, DEFAULT_SESSION_TTL_SECONDS);
	}

	public SessionStore(CacheStore cacheStore, int sessionTtlSeconds) {
		if (cacheStore == null) {
			throw new IllegalArgumentException("CacheStore must not be null");
		}
		TimeCheckerUtil.requireValidTtl(sessionTtlSeconds);
		this.cacheStore = cacheStore;
		this.sessionTtlSeconds = sessionTtlSeconds;
	}

	/**
	 * 기본 TTL로 세션을 생성합니다.
	 */
	public void createSession(String sessionId, Map<String, Object> sessionData) {
		createSession(sessionId, sessionData, sessionTtlSeconds);
	}

	/**
	 * 세션을 생성합니다.
	 *
	 * @param sessionId 세션 ID
	 * @param sessionData 세션 데이터
	 * @param ttlSeconds TTL (초)
	 */
	public void createSession(String sessionId, Map<String, Object> sessionData, int ttlSeconds) {
		cacheStore.set(key(sessionId), sessionData, ttlSeconds);
	}

	/**
	 * 세션을 조회합니다. TTL은 바뀌지 않습니다.
	 *
	 * @param sessionId 세션 ID
	 * @return 세션 데이터, 없거나 만료되었으면 null
	 */
	@SuppressWarnings("unchecked")
	public Map<String, Object> getSession(String sessionId) {
		return cacheStore.get(key(sessionId), Map.class);
	}

	/**
	 * 세션 데이터를 교체하고 TTL을 처음부터 다시 적용합니다.
	 */
	public void updateSession(String sessionId, Map<String, Object> sessionData) {
		cacheStore.set(key(sessionId), sessionData, sessionTtlSeconds);
	}

	/**
	 * 세션을 즉시 삭제합니다.
	 */
	public void destroySession(String sessionId) {
		cacheStore.delete(key(sessionId));
	}

	public int getSessionTtlSeconds() {
		return sessionTtlSeconds;
	}

	private static String key(String sessionId) {
		if (sessionId == null || sessionId.trim().isEmpty()) {
			throw new IllegalArgumentException("sessionId must not be null or empty");
		}
		return CacheNamespace.SESSIONS.key(sessionId);
	}
}
