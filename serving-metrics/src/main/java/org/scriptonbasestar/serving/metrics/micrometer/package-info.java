/**
 * Micrometer 기반 요청 메트릭 내보내기
 *
 * <h3>지원 메트릭</h3>
 * <ul>
 *   <li>serving.requests{method, status} - 완료된 요청 수 (Counter)</li>
 *   <li>serving.request.duration{method} - 요청 처리 시간 (Timer)</li>
 *   <li>serving.errors{type} - 에러 수 (Counter)</li>
 *   <li>serving.response.time.avg / p95 / p99 - 윈도우 기반 응답 시간 (Gauge, ms)</li>
 *   <li>serving.health.status - 마지막 헬스 점검 결과 (Gauge)</li>
 * </ul>
 *
 * 모든 메트릭에는 {@code application} 태그가 붙습니다.
 *
 * <h3>Prometheus 메트릭 예시</h3>
 * <pre>
 * # TYPE serving_requests_total counter
 * serving_requests_total{application="api",method="GET",status="200",} 1523.0
 *
 * # TYPE serving_response_time_p95 gauge
 * serving_response_time_p95{application="api",} 87.0
 * </pre>
 *
 * @since 2026-10
 */
package org.scriptonbasestar.serving.metrics.micrometer;
