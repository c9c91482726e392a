package org.scriptonbasestar.serving.observability.health;

/**
 * 개별 프로브 결과 상태
 *
 * @since 2026-10
 */
public enum ProbeStatus {
	/** 프로브가 true를 반환 */
	HEALTHY("healthy"),
	/** 프로브가 false를 반환 */
	UNHEALTHY("unhealthy"),
	/** 프로브가 예외를 던졌거나 제한 시간을 넘김 */
	ERROR("error");

	private final String value;

	ProbeStatus(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}
}
