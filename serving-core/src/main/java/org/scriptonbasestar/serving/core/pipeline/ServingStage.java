package org.scriptonbasestar.serving.core.pipeline;

/**
 * 요청 파이프라인의 한 단계 ({@code (request, response, next)} 계약)
 *
 * 스테이지는 {@code next}를 호출하지 않고 체인을 종료할 수 있습니다.
 *
 * @since 2026-10
 */
@FunctionalInterface
public interface ServingStage {

	void handle(ServingRequest request, ResponseWriter response, StageChain next) throws Exception;
}
