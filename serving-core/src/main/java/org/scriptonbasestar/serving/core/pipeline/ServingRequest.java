package org.scriptonbasestar.serving.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 파이프라인을 통과하는 요청의 읽기 전용 뷰
 *
 * 호스트 웹 스택의 요청 객체에서 메서드, 경로, 쿼리 문자열, 헤더만 옮겨 담습니다.
 *
 * @since 2026-10
 */
public final class ServingRequest {

	private final String method;
	private final String path;
	private final String query;
	private final Map<String, String> headers;

	private ServingRequest(String method, String path, String query, Map<String, String> headers) {
		this.method = method;
		this.path = path;
		this.query = query;
		this.headers = Collections.unmodifiableMap(headers);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ServingRequest of(String method, String path) {
		return builder().method(method).path(path).build();
	}

	public String method() {
		return method;
	}

	public String path() {
		return path;
	}

	/**
	 * @return 쿼리 문자열 ('?' 제외), 없으면 null
	 */
	public String query() {
		return query;
	}

	public Map<String, String> headers() {
		return headers;
	}

	/**
	 * 헤더 값을 대소문자 구분 없이 조회합니다.
	 */
	public String header(String name) {
		return headers.get(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * 경로와 쿼리 문자열을 합친 원본 URL
	 *
	 * @return 예: "/api/posts?page=2"
	 */
	public String pathWithQuery() {
		if (query == null || query.isEmpty()) {
			return path;
		}
		return path + "?" + query;
	}

	@Override
	public String toString() {
		return method + " " + pathWithQuery();
	}

	public static class Builder {
		private String method = "GET";
		private String path = "/";
		private String query;
		private final Map<String, String> headers = new LinkedHashMap<>();

		public Builder method(String method) {
			this.method = method;
			return this;
		}

		public Builder path(String path) {
			this.path = path;
			return this;
		}

		public Builder query(String query) {
			this.query = query;
			return this;
		}

		public Builder header(String name, String value) {
			this.headers.put(name.toLowerCase(Locale.ROOT), value);
			return this;
		}

		public ServingRequest build() {
			if (method == null || method.trim().isEmpty()) {
				throw new IllegalArgumentException("method must not be null or empty");
			}
			if (path == null) {
				throw new IllegalArgumentException("path must not be null");
			}
			return new ServingRequest(method.toUpperCase(Locale.ROOT), path, query, headers);
		}
	}
}
