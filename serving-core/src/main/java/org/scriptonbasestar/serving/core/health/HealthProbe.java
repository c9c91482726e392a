package org.scriptonbasestar.serving.core.health;

/**
 * 단일 서브시스템의 상태를 보고하는 헬스 프로브
 *
 * false를 반환하면 unhealthy, 예외를 던지면 error로 구분됩니다.
 *
 * @since 2026-10
 */
@FunctionalInterface
public interface HealthProbe {

	/**
	 * 상태를 확인합니다.
	 *
	 * @return 정상이면 true
	 * @throws Exception 확인 자체가 실패했을 때
	 */
	boolean check() throws Exception;
}
