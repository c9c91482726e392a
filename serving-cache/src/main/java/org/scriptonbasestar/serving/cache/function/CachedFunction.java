package org.scriptonbasestar.serving.cache.function;

import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.cache.CacheValueCodec;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * 함수 결과를 캐시하는 고차 함수
 *
 * <pre>{@code
 * Function<Long, Post> findPost = CachedFunction.of(
 *     store, "posts", 300, Post.class, postRepository::findById);
 *
 * findPost.apply(7L);  // 미스: 조회 후 "posts:7"에 저장
 * findPost.apply(7L);  // 히트: 저장소 호출 없음
 * }</pre>
 *
 * null 결과는 캐시하지 않습니다.
 *
 * @since 2026-10
 */
public final class CachedFunction {

	private static final Logger log = LoggerFactory.getLogger(CachedFunction.class);
	private static final CacheValueCodec KEY_CODEC = new CacheValueCodec();

	private CachedFunction() {
	}

	/**
	 * 키 파생 함수를 직접 지정해 감쌉니다.
	 *
	 * @param cacheStore 캐시 저장소
	 * @param keyFunction 인자 → 캐시 키
	 * @param ttlSeconds TTL (초)
	 * @param resultType 결과 타입 (캐시 값 복원용)
	 * @param operation 원래 연산
	 * @return 캐시를 먼저 확인하는 함수
	 */
	public static <A, R> Function<A, R> of(CacheStore cacheStore,
										   Function<? super A, String> keyFunction,
										   int ttlSeconds,
										   Class<R> resultType,
										   Function<? super A, ? extends R> operation) {
		if (cacheStore == null || keyFunction == null || resultType == null || operation == null) {
			throw new IllegalArgumentException("cacheStore, keyFunction, resultType and operation must not be null");
		}
		TimeCheckerUtil.requireValidTtl(ttlSeconds);

		return argument -> {
			String cacheKey = keyFunction.apply(argument);
			R cached = cacheStore.get(cacheKey, resultType);
			if (cached != null) {
				log.debug("Cache hit: {}", cacheKey);
				return cached;
			}

			R result = operation.apply(argument);
			if (result != null) {
				cacheStore.set(cacheKey, result, ttlSeconds);
				log.debug("Cached: {}", cacheKey);
			}
			return result;
		};
	}

	/**
	 * 키를 {@code prefix + ":" + JSON(인자)}로 파생해 감쌉니다.
	 */
	public static <A, R> Function<A, R> of(CacheStore cacheStore,
										   String keyPrefix,
										   int ttlSeconds,
										   Class<R> resultType,
										   Function<? super A, ? extends R> operation) {
		if (keyPrefix == null) {
			throw new IllegalArgumentException("keyPrefix must not be null");
		}
		return of(cacheStore, argument -> keyPrefix + ":" + KEY_CODEC.encode(argument),
			ttlSeconds, resultType, operation);
	}
}
