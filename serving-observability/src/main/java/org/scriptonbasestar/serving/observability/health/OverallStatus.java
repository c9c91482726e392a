package org.scriptonbasestar.serving.observability.health;

/**
 * 전체 헬스 상태
 *
 * @since 2026-10
 */
public enum OverallStatus {
	HEALTHY("healthy"),
	DEGRADED("degraded"),
	/** 아직 한 번도 점검하지 않음 */
	UNKNOWN("unknown");

	private final String value;

	OverallStatus(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}
}
