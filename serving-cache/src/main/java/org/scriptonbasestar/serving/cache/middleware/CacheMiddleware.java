package org.scriptonbasestar.serving.cache.middleware;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.serving.core.cache.CacheNamespace;
import org.scriptonbasestar.serving.core.cache.CacheStore;
import org.scriptonbasestar.serving.core.pipeline.ForwardingResponseWriter;
import org.scriptonbasestar.serving.core.pipeline.ResponseWriter;
import org.scriptonbasestar.serving.core.pipeline.ServingRequest;
import org.scriptonbasestar.serving.core.pipeline.ServingStage;
import org.scriptonbasestar.serving.core.pipeline.StageChain;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 읽기 요청의 응답을 캐시하는 파이프라인 스테이지
 *
 * <ul>
 *   <li>캐시 대상 메서드(기본 GET)가 아니면 그대로 통과시키며 캐시에 쓰지 않습니다.</li>
 *   <li>캐시 키: 네임스페이스 + 경로 + 쿼리 문자열</li>
 *   <li>히트: 캐시된 페이로드를 그대로 보내고 핸들러를 호출하지 않습니다.</li>
 *   <li>미스: 다음 스테이지에 응답 출구를 감싼 데코레이터를 넘기고,
 *       처음 전송된 2xx 페이로드를 executor에서 비동기로 캐시에 씁니다.
 *       쓰기 실패는 응답에 영향을 주지 않습니다.</li>
 * </ul>
 *
 * <pre>{@code
 * CacheMiddleware middleware = CacheMiddleware.builder()
 *     .cacheStore(store)
 *     .ttlSeconds(300)
 *     .populateExecutor(executor)
 *     .build();
 * }</pre>
 *
 * @since 2026-10
 */
@Slf4j
public class CacheMiddleware implements ServingStage {

	public static final String CACHE_HEADER = "X-Cache";

	private final CacheStore cacheStore;
	private final int ttlSeconds;
	private final String namespace;
	private final Set<String> cacheableMethods;
	private final Executor populateExecutor;

	private CacheMiddleware(CacheStore cacheStore, int ttlSeconds, String namespace,
							Set<String> cacheableMethods, Executor populateExecutor) {
		this.cacheStore = cacheStore;
		this.ttlSeconds = ttlSeconds;
		this.namespace = namespace;
		this.cacheableMethods = Collections.unmodifiableSet(cacheableMethods);
		this.populateExecutor = populateExecutor;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void handle(ServingRequest request, ResponseWriter response, StageChain next) throws Exception {
		if (!cacheableMethods.contains(request.method())) {
			next.proceed(request, response);
			return;
		}

		String cacheKey = cacheKey(request);
		Object cached = lookup(cacheKey);
		if (cached != null) {
			log.debug("API cache hit: {}", request.pathWithQuery());
			response.header(CACHE_HEADER, "HIT");
			response.send(cached);
			return;
		}

		response.header(CACHE_HEADER, "MISS");
		next.proceed(request, new CachePopulatingWriter(response, cacheKey));
	}

	/**
	 * 요청의 캐시 키를 계산합니다.
	 *
	 * @param request 요청
	 * @return 예: "api:/api/posts?page=2"
	 */
	public String cacheKey(ServingRequest request) {
		return namespace + request.pathWithQuery();
	}

	private Object lookup(String cacheKey) {
		try {
			return cacheStore.get(cacheKey);
		} catch (RuntimeException e) {
			log.warn("Cache retrieval error: {} - {}", cacheKey, e.getMessage());
			return null;
		}
	}

	private void populate(String cacheKey, Object payload) {
		try {
			populateExecutor.execute(() -> {
				try {
					cacheStore.set(cacheKey, payload, ttlSeconds);
					log.trace("API response cached: {}", cacheKey);
				} catch (RuntimeException e) {
					log.warn("Cache write error: {} - {}", cacheKey, e.getMessage());
				}
			});
		} catch (RejectedExecutionException e) {
			log.warn("Cache write rejected: {} - {}", cacheKey, e.getMessage());
		}
	}

	public int getTtlSeconds() {
		return ttlSeconds;
	}

	public Set<String> getCacheableMethods() {
		return cacheableMethods;
	}

	/**
	 * 첫 성공 응답을 캐시에 옮겨 쓰는 데코레이터
	 */
	private final class CachePopulatingWriter extends ForwardingResponseWriter {

		private final String cacheKey;
		private final AtomicBoolean populated = new AtomicBoolean(false);

		private CachePopulatingWriter(ResponseWriter delegate, String cacheKey) {
			super(delegate);
			this.cacheKey = cacheKey;
		}

		@Override
		public void send(Object payload) {
			super.send(payload);
			if (payload != null && isSuccessful() && populated.compareAndSet(false, true)) {
				populate(cacheKey, payload);
			}
		}
	}

	public static class Builder {
		private CacheStore cacheStore;
		private Integer ttlSeconds;
		private String namespace = CacheNamespace.API_RESPONSES.prefix();
		private final Set<String> cacheableMethods = new LinkedHashSet<>(Collections.singleton("GET"));
		private Executor populateExecutor;

		public Builder cacheStore(CacheStore cacheStore) {
			this.cacheStore = cacheStore;
			return this;
		}

		/**
		 * 응답 캐시 TTL, 지정하지 않으면 CacheStore 기본 TTL
		 */
		public Builder ttlSeconds(int ttlSeconds) {
			this.ttlSeconds = ttlSeconds;
			return this;
		}

		public Builder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		/**
		 * 캐시 대상 메서드를 교체합니다. 멱등 읽기 메서드만 지정해야 합니다.
		 */
		public Builder cacheableMethods(String... methods) {
			this.cacheableMethods.clear();
			for (String method : methods) {
				this.cacheableMethods.add(method.toUpperCase(Locale.ROOT));
			}
			return this;
		}

		public Builder populateExecutor(Executor populateExecutor) {
			this.populateExecutor = populateExecutor;
			return this;
		}

		public CacheMiddleware build() {
			if (cacheStore == null) {
				throw new IllegalStateException("cacheStore must be set");
			}
			if (populateExecutor == null) {
				throw new IllegalStateException("populateExecutor must be set");
			}
			if (namespace == null) {
				throw new IllegalStateException("namespace must not be null");
			}
			int ttl = ttlSeconds != null ? ttlSeconds : cacheStore.defaultTtlSeconds();
			TimeCheckerUtil.requireValidTtl(ttl);
			return new CacheMiddleware(cacheStore, ttl, namespace, new LinkedHashSet<>(cacheableMethods), populateExecutor);
		}
	}
}
