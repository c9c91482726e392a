package org.scriptonbasestar.serving.observability.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JVM 프로세스 자원 사용량 스냅샷
 *
 * @since 2026-10
 */
public final class ProcessUsage {

	private final long uptimeMillis;
	private final long heapUsedBytes;
	private final long heapMaxBytes;
	private final long nonHeapUsedBytes;
	private final int availableProcessors;
	private final double systemLoadAverage;

	public ProcessUsage(long uptimeMillis, long heapUsedBytes, long heapMaxBytes,
						long nonHeapUsedBytes, int availableProcessors, double systemLoadAverage) {
		this.uptimeMillis = uptimeMillis;
		this.heapUsedBytes = heapUsedBytes;
		this.heapMaxBytes = heapMaxBytes;
		this.nonHeapUsedBytes = nonHeapUsedBytes;
		this.availableProcessors = availableProcessors;
		this.systemLoadAverage = systemLoadAverage;
	}

	/**
	 * 현재 JVM의 사용량을 측정합니다.
	 *
	 * @return 측정값, 시스템 부하 평균을 지원하지 않는 플랫폼에서는 음수
	 */
	public static ProcessUsage capture() {
		MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
		MemoryUsage heap = memory.getHeapMemoryUsage();
		MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();
		return new ProcessUsage(
			ManagementFactory.getRuntimeMXBean().getUptime(),
			heap.getUsed(),
			heap.getMax(),
			nonHeap.getUsed(),
			Runtime.getRuntime().availableProcessors(),
			ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage()
		);
	}

	public long uptimeMillis() {
		return uptimeMillis;
	}

	public long heapUsedBytes() {
		return heapUsedBytes;
	}

	public long heapMaxBytes() {
		return heapMaxBytes;
	}

	public long nonHeapUsedBytes() {
		return nonHeapUsedBytes;
	}

	public int availableProcessors() {
		return availableProcessors;
	}

	public double systemLoadAverage() {
		return systemLoadAverage;
	}

	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("uptimeMillis", uptimeMillis);
		map.put("heapUsedBytes", heapUsedBytes);
		map.put("heapMaxBytes", heapMaxBytes);
		map.put("nonHeapUsedBytes", nonHeapUsedBytes);
		map.put("availableProcessors", availableProcessors);
		map.put("systemLoadAverage", systemLoadAverage);
		return map;
	}

	@Override
	public String toString() {
		return String.format("ProcessUsage{uptime=%dms, heap=%d/%d, nonHeap=%d, cpus=%d, load=%.2f}",
			uptimeMillis, heapUsedBytes, heapMaxBytes, nonHeapUsedBytes, availableProcessors, systemLoadAverage);
	}
}
