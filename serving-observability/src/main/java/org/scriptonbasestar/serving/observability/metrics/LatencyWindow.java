package org.scriptonbasestar.serving.observability.metrics;

import java.util.Arrays;

/**
 * 최근 N개 응답 시간을 보관하는 고정 크기 링 버퍼
 *
 * 스레드 안전하지 않습니다. {@link MetricsCollector}의 락 안에서만 사용합니다.
 */
final class LatencyWindow {

	private final long[] samples;
	private int next;
	private int size;
	private long sum;

	LatencyWindow(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Window capacity must be at least 1: " + capacity);
		}
		this.samples = new long[capacity];
	}

	/**
	 * 샘플을 추가합니다. 가득 차 있으면 가장 오래된 샘플을 덮어씁니다.
	 */
	void add(long durationMillis) {
		if (size == samples.length) {
			sum -= samples[next];
		} else {
			size++;
		}
		samples[next] = durationMillis;
		sum += durationMillis;
		next = (next + 1) % samples.length;
	}

	int size() {
		return size;
	}

	int capacity() {
		return samples.length;
	}

	double average() {
		return size == 0 ? 0.0 : (double) sum / size;
	}

	long[] sorted() {
		long[] copy = Arrays.copyOf(samples, size);
		Arrays.sort(copy);
		return copy;
	}

	void clear() {
		Arrays.fill(samples, 0L);
		next = 0;
		size = 0;
		sum = 0;
	}

	/**
	 * 정렬된 배열에서 {@code floor(n * quantile)} 위치의 값을 구합니다.
	 */
	static long percentile(long[] sorted, double quantile) {
		if (sorted.length == 0) {
			return 0L;
		}
		int index = (int) Math.floor(sorted.length * quantile);
		return sorted[Math.min(index, sorted.length - 1)];
	}
}
