package org.scriptonbasestar.serving.core.pipeline;

/**
 * 다음 스테이지 호출 핸들 ({@code next})
 *
 * @since 2026-10
 */
@FunctionalInterface
public interface StageChain {

	void proceed(ServingRequest request, ResponseWriter response) throws Exception;
}
