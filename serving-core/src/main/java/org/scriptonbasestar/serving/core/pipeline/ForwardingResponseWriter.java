package org.scriptonbasestar.serving.core.pipeline;

/**
 * 모든 호출을 위임하는 ResponseWriter 데코레이터의 기반 클래스
 *
 * @since 2026-10
 */
public abstract class ForwardingResponseWriter implements ResponseWriter {

	private final ResponseWriter delegate;

	protected ForwardingResponseWriter(ResponseWriter delegate) {
		if (delegate == null) {
			throw new IllegalArgumentException("delegate must not be null");
		}
		this.delegate = delegate;
	}

	protected ResponseWriter delegate() {
		return delegate;
	}

	@Override
	public void status(int statusCode) {
		delegate.status(statusCode);
	}

	@Override
	public int status() {
		return delegate.status();
	}

	@Override
	public void header(String name, String value) {
		delegate.header(name, value);
	}

	@Override
	public void send(Object payload) {
		delegate.send(payload);
	}

	@Override
	public boolean isCommitted() {
		return delegate.isCommitted();
	}
}
