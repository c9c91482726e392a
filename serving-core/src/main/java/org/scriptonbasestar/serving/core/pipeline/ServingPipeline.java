package org.scriptonbasestar.serving.core.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 순서가 정해진 스테이지 목록과 종단 핸들러
 *
 * <pre>{@code
 * ServingPipeline pipeline = ServingPipeline.builder()
 *     .stage(monitoringStage)
 *     .stage(cacheMiddleware)
 *     .handler((request, response) -> response.send(loadPosts(request)))
 *     .build();
 *
 * BufferedResponseWriter response = new BufferedResponseWriter();
 * pipeline.handle(ServingRequest.of("GET", "/api/posts"), response);
 * }</pre>
 *
 * @since 2026-10
 */
public class ServingPipeline {

	private final List<ServingStage> stages;
	private final RequestHandler handler;

	private ServingPipeline(List<ServingStage> stages, RequestHandler handler) {
		this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
		this.handler = handler;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 요청을 첫 스테이지부터 실행합니다.
	 *
	 * @param request 요청
	 * @param response 응답 출구
	 * @throws Exception 스테이지나 핸들러가 던진 예외
	 */
	public void handle(ServingRequest request, ResponseWriter response) throws Exception {
		proceed(0, request, response);
	}

	private void proceed(int index, ServingRequest request, ResponseWriter response) throws Exception {
		if (index < stages.size()) {
			stages.get(index).handle(request, response, (req, res) -> proceed(index + 1, req, res));
		} else {
			handler.handle(request, response);
		}
	}

	public List<ServingStage> getStages() {
		return stages;
	}

	public static class Builder {
		private final List<ServingStage> stages = new ArrayList<>();
		private RequestHandler handler;

		public Builder stage(ServingStage stage) {
			if (stage == null) {
				throw new IllegalArgumentException("stage must not be null");
			}
			stages.add(stage);
			return this;
		}

		public Builder stages(List<? extends ServingStage> stages) {
			stages.forEach(this::stage);
			return this;
		}

		public Builder handler(RequestHandler handler) {
			this.handler = handler;
			return this;
		}

		public ServingPipeline build() {
			if (handler == null) {
				throw new IllegalStateException("handler must be set");
			}
			return new ServingPipeline(stages, handler);
		}
	}
}
