package org.scriptonbasestar.serving.core.pipeline;

/**
 * 파이프라인 끝에서 실제 응답을 만드는 핸들러
 *
 * @since 2026-10
 */
@FunctionalInterface
public interface RequestHandler {

	void handle(ServingRequest request, ResponseWriter response) throws Exception;
}
