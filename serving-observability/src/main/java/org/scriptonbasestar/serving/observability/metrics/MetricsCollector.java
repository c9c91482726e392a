package org.scriptonbasestar.serving.observability.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 요청 수, 에러 수, 응답 시간 분포를 수집합니다.
 *
 * <p>카운터는 AtomicLong, 응답 시간 윈도우와 파생 통계(평균/p95/p99)는 락으로 보호되어
 * 여러 요청 스레드가 동시에 기록할 수 있습니다.
 * 윈도우는 최근 N개(기본 10,000) 샘플만 유지하고, 기록할 때마다 통계를 다시 계산합니다.</p>
 *
 * <pre>{@code
 * MetricsCollector metrics = new MetricsCollector();
 * metrics.recordRequest("GET", 200, 35);
 * MetricSnapshot snapshot = metrics.getMetrics();
 * long p95 = snapshot.p95Millis();
 * }</pre>
 *
 * @since 2026-10
 */
public class MetricsCollector {

	private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

	public static final int DEFAULT_WINDOW_SIZE = 10_000;

	private final AtomicLong totalRequests = new AtomicLong(0);
	private final AtomicLong totalErrors = new AtomicLong(0);
	private final Map<String, AtomicLong> requestsByMethod = new ConcurrentHashMap<>();
	private final Map<Integer, AtomicLong> requestsByStatus = new ConcurrentHashMap<>();
	private final Map<String, AtomicLong> errorsByType = new ConcurrentHashMap<>();

	private final ReentrantLock windowLock = new ReentrantLock();
	private final LatencyWindow window;
	private double averageMillis;
	private long p95Millis;
	private long p99Millis;

	private final Supplier<ProcessUsage> processUsage;
	private final List<MetricsListener> listeners = new CopyOnWriteArrayList<>();

	public MetricsCollector() {
		this(DEFAULT_WINDOW_SIZE);
	}

	public MetricsCollector(int windowSize) {
		this(windowSize, ProcessUsage::capture);
	}

	/**
	 * @param windowSize 응답 시간 윈도우 크기
	 * @param processUsage 프로세스 사용량 공급자
	 */
	public MetricsCollector(int windowSize, Supplier<ProcessUsage> processUsage) {
		if (processUsage == null) {
			throw new IllegalArgumentException("processUsage must not be null");
		}
		this.window = new LatencyWindow(windowSize);
		this.processUsage = processUsage;
	}

	/**
	 * 완료된 요청을 기록합니다.
	 *
	 * @param method HTTP 메서드
	 * @param status 응답 상태 코드
	 * @param durationMillis 처리 시간 (밀리초)
	 */
	public void recordRequest(String method, int status, long durationMillis) {
		totalRequests.incrementAndGet();
		requestsByMethod.computeIfAbsent(method, k -> new AtomicLong()).incrementAndGet();
		requestsByStatus.computeIfAbsent(status, k -> new AtomicLong()).incrementAndGet();

		windowLock.lock();
		try {
			window.add(durationMillis);
			long[] sorted = window.sorted();
			averageMillis = window.average();
			p95Millis = LatencyWindow.percentile(sorted, 0.95);
			p99Millis = LatencyWindow.percentile(sorted, 0.99);
		} finally {
			windowLock.unlock();
		}

		for (MetricsListener listener : listeners) {
			try {
				listener.onRequest(method, status, durationMillis);
			} catch (RuntimeException e) {
				log.warn("Metrics listener failed: {}", e.getMessage());
			}
		}
	}

	/**
	 * 에러를 기록하고 스택 트레이스를 포함한 로그를 한 건 남깁니다.
	 *
	 * @param type 에러 유형 (예: 예외 클래스 이름)
	 * @param error 원인 예외, 없으면 null
	 */
	public void recordError(String type, Throwable error) {
		totalErrors.incrementAndGet();
		errorsByType.computeIfAbsent(type, k -> new AtomicLong()).incrementAndGet();

		log.atError()
			.addKeyValue("errorType", type)
			.setCause(error)
			.log("Error recorded: {}", error != null ? error.getMessage() : type);

		for (MetricsListener listener : listeners) {
			try {
				listener.onError(type, error);
			} catch (RuntimeException e) {
				log.warn("Metrics listener failed: {}", e.getMessage());
			}
		}
	}

	/**
	 * 현재 메트릭 스냅샷을 반환합니다.
	 */
	public MetricSnapshot getMetrics() {
		int samples;
		double avg;
		long p95;
		long p99;
		windowLock.lock();
		try {
			samples = window.size();
			avg = averageMillis;
			p95 = p95Millis;
			p99 = p99Millis;
		} finally {
			windowLock.unlock();
		}

		return new MetricSnapshot(
			System.currentTimeMillis(),
			totalRequests.get(),
			snapshot(requestsByMethod),
			snapshot(requestsByStatus),
			totalErrors.get(),
			snapshot(errorsByType),
			samples,
			avg,
			p95,
			p99,
			processUsage.get()
		);
	}

	/**
	 * 모든 카운터와 응답 시간 윈도우를 초기화합니다.
	 */
	public void resetMetrics() {
		windowLock.lock();
		try {
			totalRequests.set(0);
			totalErrors.set(0);
			requestsByMethod.clear();
			requestsByStatus.clear();
			errorsByType.clear();
			window.clear();
			averageMillis = 0.0;
			p95Millis = 0L;
			p99Millis = 0L;
		} finally {
			windowLock.unlock();
		}
		listeners.forEach(MetricsListener::onReset);
		log.debug("Metrics reset");
	}

	/**
	 * 기록 이벤트를 받을 리스너를 추가합니다.
	 */
	public void addListener(MetricsListener listener) {
		if (listener == null) {
			throw new IllegalArgumentException("listener must not be null");
		}
		listeners.add(listener);
	}

	public void removeListener(MetricsListener listener) {
		listeners.remove(listener);
	}

	public int getWindowSize() {
		return window.capacity();
	}

	private static <K> Map<K, Long> snapshot(Map<K, AtomicLong> counters) {
		Map<K, Long> copy = new HashMap<>();
		counters.forEach((key, count) -> copy.put(key, count.get()));
		return copy;
	}
}
