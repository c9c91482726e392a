package org.scriptonbasestar.serving.core.cache;

import org.scriptonbasestar.serving.core.exception.ServingCacheConnectException;

import java.util.Collection;
import java.util.Map;

/**
 * 원격 키-값 캐시 클라이언트
 *
 * <p>연결 이후의 모든 연산은 best-effort이며 호출자에게 예외를 던지지 않습니다.
 * 조회 실패는 캐시 미스(null)로, 쓰기/삭제 실패는 로그만 남기는 no-op으로 처리됩니다.
 * 연결 실패({@link #connect()})만 호출자에게 전파됩니다.</p>
 *
 * <p>값은 JSON으로 저장되며, 조회 시 구조적으로 동일한 값
 * ({@code Map}, {@code List}, {@code String}, {@code Number}, {@code Boolean})으로 복원됩니다.</p>
 *
 * @since 2026-10
 */
public interface CacheStore extends AutoCloseable {

	/**
	 * 저장소에 연결합니다. 이미 연결되어 있으면 아무 것도 하지 않습니다.
	 *
	 * @throws ServingCacheConnectException 재시도를 모두 소진했을 때
	 */
	void connect();

	/**
	 * 연결되어 있는지 확인합니다.
	 *
	 * @return 연결 상태
	 */
	boolean isConnected();

	/**
	 * 값을 조회합니다.
	 *
	 * @param key 캐시 키
	 * @return 저장된 값, 없거나 만료되었거나 조회에 실패하면 null
	 */
	Object get(String key);

	/**
	 * 값을 지정 타입으로 조회합니다.
	 *
	 * @param key 캐시 키
	 * @param type 변환할 타입
	 * @return 변환된 값, 없거나 변환에 실패하면 null
	 */
	<T> T get(String key, Class<T> type);

	/**
	 * 기본 TTL로 값을 저장합니다.
	 *
	 * @param key 캐시 키
	 * @param value 저장할 값
	 */
	default void set(String key, Object value) {
		set(key, value, defaultTtlSeconds());
	}

	/**
	 * 값을 저장합니다.
	 *
	 * @param key 캐시 키
	 * @param value 저장할 값
	 * @param ttlSeconds TTL (초), 0이면 만료 없음
	 * @throws IllegalArgumentException TTL이 음수일 때
	 */
	void set(String key, Object value, int ttlSeconds);

	/**
	 * 키를 삭제합니다.
	 *
	 * @param key 캐시 키
	 */
	void delete(String key);

	/**
	 * 여러 키를 한번에 삭제합니다.
	 *
	 * @param keys 캐시 키 목록
	 */
	void deleteMany(Collection<String> keys);

	/**
	 * 패턴에 일치하는 키를 열거한 뒤 삭제합니다.
	 *
	 * <p>열거와 삭제는 원자적이지 않습니다. 열거 이후에 생성된 키는 남을 수 있습니다.</p>
	 *
	 * @param pattern glob 패턴 (예: "posts:*")
	 * @return 삭제된 키 개수, 실패하면 0
	 */
	long clearByPattern(String pattern);

	/**
	 * 카운터를 1 증가시킵니다.
	 *
	 * @param key 캐시 키
	 * @return 증가된 값, 실패하면 0
	 */
	default long increment(String key) {
		return increment(key, 1L);
	}

	/**
	 * 카운터를 원자적으로 증가시킵니다.
	 *
	 * @param key 캐시 키
	 * @param by 증가량
	 * @return 증가된 값, 실패하면 0
	 */
	long increment(String key, long by);

	/**
	 * 저장소가 응답하는지 확인합니다.
	 *
	 * @return 응답하면 true
	 */
	boolean ping();

	/**
	 * 저장소 통계를 조회합니다. 항목 이름과 값은 구현마다 다릅니다.
	 *
	 * @return 통계 항목, 조회할 수 없으면 빈 맵
	 */
	Map<String, String> getStats();

	/**
	 * TTL을 생략한 {@link #set(String, Object)}에 적용되는 기본 TTL
	 *
	 * @return 기본 TTL (초)
	 */
	int defaultTtlSeconds();

	/**
	 * 연결을 해제합니다.
	 */
	@Override
	void close();
}
