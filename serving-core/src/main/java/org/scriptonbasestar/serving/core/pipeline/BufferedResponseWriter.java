package org.scriptonbasestar.serving.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 응답을 메모리에 보관하는 ResponseWriter
 *
 * 호스트 어댑터가 파이프라인 실행 뒤 결과를 실제 응답으로 옮길 때 사용합니다.
 *
 * @since 2026-10
 */
public class BufferedResponseWriter implements ResponseWriter {

	private int statusCode = 200;
	private final Map<String, String> headers = new LinkedHashMap<>();
	private Object payload;
	private boolean committed;

	@Override
	public void status(int statusCode) {
		this.statusCode = statusCode;
	}

	@Override
	public int status() {
		return statusCode;
	}

	@Override
	public void header(String name, String value) {
		headers.put(name, value);
	}

	@Override
	public void send(Object payload) {
		if (committed) {
			throw new IllegalStateException("Response already sent");
		}
		this.payload = payload;
		this.committed = true;
	}

	@Override
	public boolean isCommitted() {
		return committed;
	}

	public Object getPayload() {
		return payload;
	}

	public Map<String, String> getHeaders() {
		return Collections.unmodifiableMap(headers);
	}

	public String getHeader(String name) {
		return headers.get(name);
	}
}
