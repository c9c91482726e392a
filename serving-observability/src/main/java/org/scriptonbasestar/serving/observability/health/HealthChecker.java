package org.scriptonbasestar.serving.observability.health;

import org.scriptonbasestar.serving.core.health.HealthProbe;
import org.scriptonbasestar.serving.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 이름 붙은 헬스 프로브를 등록하고 주기적으로 점검합니다.
 *
 * <ul>
 *   <li>프로브는 병렬로 실행되며 각각 제한 시간(기본 5초) 안에 끝나야 합니다.</li>
 *   <li>false 반환은 UNHEALTHY, 예외나 시간 초과는 ERROR입니다.</li>
 *   <li>한 프로브의 실패는 다른 프로브 실행에 영향을 주지 않습니다.</li>
 *   <li>주기 점검은 이전 점검이 끝나지 않았으면 이번 차례를 건너뜁니다.</li>
 *   <li>점검이 겹치면 나중에 시작한 점검의 결과가 남습니다.</li>
 *   <li>프로브 스레드는 최대 {@value #DEFAULT_MAX_PROBE_THREADS}개이며,
 *       여유가 없거나 종료된 뒤의 프로브는 ERROR로 기록됩니다.</li>
 * </ul>
 *
 * <pre>{@code
 * HealthChecker checker = new HealthChecker(60_000, 5_000);
 * checker.registerCheck("redis", cacheStore::ping);
 * checker.startPeriodicChecks();
 * ...
 * AggregatedHealth health = checker.getStatus();
 * checker.close();
 * }</pre>
 *
 * @since 2026-10
 */
public class HealthChecker implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

	public static final long DEFAULT_INTERVAL_MILLIS = 60_000L;
	public static final long DEFAULT_PROBE_TIMEOUT_MILLIS = 5_000L;
	public static final int DEFAULT_MAX_PROBE_THREADS = 32;

	private final Map<String, HealthProbe> probes = new LinkedHashMap<>();
	private final long intervalMillis;
	private final long probeTimeoutMillis;
	private final ThreadPoolExecutor probeExecutor;
	private final AtomicInteger runningProbes = new AtomicInteger();
	private final AtomicBoolean sweepInFlight = new AtomicBoolean(false);
	private final AtomicLong sweepSequence = new AtomicLong();
	private final AtomicReference<Snapshot> lastStatus =
		new AtomicReference<>(new Snapshot(0L, AggregatedHealth.unknown(System.currentTimeMillis())));
	private ScheduledExecutorService scheduler;
	private ScheduledFuture<?> periodicTask;

	public HealthChecker() {
		this(DEFAULT_INTERVAL_MILLIS, DEFAULT_PROBE_TIMEOUT_MILLIS);
	}

	/**
	 * @param intervalMillis 주기 점검 간격 (밀리초)
	 * @param probeTimeoutMillis 프로브 한 건의 제한 시간 (밀리초)
	 */
	public HealthChecker(long intervalMillis, long probeTimeoutMillis) {
		this(intervalMillis, probeTimeoutMillis, DEFAULT_MAX_PROBE_THREADS);
	}

	/**
	 * @param intervalMillis 주기 점검 간격 (밀리초)
	 * @param probeTimeoutMillis 프로브 한 건의 제한 시간 (밀리초)
	 * @param maxProbeThreads 동시에 실행할 수 있는 프로브 스레드 수
	 */
	public HealthChecker(long intervalMillis, long probeTimeoutMillis, int maxProbeThreads) {
		if (maxProbeThreads <= 0) {
			throw new IllegalArgumentException("maxProbeThreads must be positive: " + maxProbeThreads);
		}
		if (intervalMillis <= 0) {
			throw new IllegalArgumentException("intervalMillis must be positive: " + intervalMillis);
		}
		if (probeTimeoutMillis <= 0) {
			throw new IllegalArgumentException("probeTimeoutMillis must be positive: " + probeTimeoutMillis);
		}
		this.intervalMillis = intervalMillis;
		this.probeTimeoutMillis = probeTimeoutMillis;

		AtomicInteger threadIndex = new AtomicInteger();
		this.probeExecutor = new ThreadPoolExecutor(0, maxProbeThreads, 60L, TimeUnit.SECONDS,
			new SynchronousQueue<>(), r -> {
				Thread t = new Thread(r, "health-probe-" + threadIndex.incrementAndGet());
				t.setDaemon(true);
				return t;
			});
	}

	/**
	 * 프로브를 등록합니다. 같은 이름이면 교체됩니다.
	 *
	 * @param name 프로브 이름 (예: "redis", "database")
	 * @param probe 점검 함수
	 */
	public void registerCheck(String name, HealthProbe probe) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Check name must not be null or empty");
		}
		if (probe == null) {
			throw new IllegalArgumentException("Probe must not be null");
		}
		synchronized (probes) {
			probes.put(name, probe);
		}
		log.debug("Health check registered: {}", name);
	}

	public void unregisterCheck(String name) {
		synchronized (probes) {
			probes.remove(name);
		}
	}

	/**
	 * 등록된 모든 프로브를 실행하고 결과로 상태를 교체합니다.
	 * 이 점검보다 나중에 시작한 점검이 먼저 끝났으면 상태는 교체되지 않습니다.
	 *
	 * @return 이번 점검 결과
	 */
	public AggregatedHealth performChecks() {
		long sequence = sweepSequence.incrementAndGet();
		Map<String, HealthProbe> current;
		synchronized (probes) {
			current = new LinkedHashMap<>(probes);
		}

		List<String> names = new ArrayList<>(current.keySet());
		List<Future<HealthCheckResult>> futures = new ArrayList<>(names.size());
		List<Long> startTimes = new ArrayList<>(names.size());
		List<HealthCheckResult> rejected = new ArrayList<>(names.size());
		for (String name : names) {
			HealthProbe probe = current.get(name);
			long start = System.nanoTime();
			startTimes.add(start);
			try {
				futures.add(probeExecutor.submit(() -> runProbe(name, probe)));
				rejected.add(null);
			} catch (RejectedExecutionException e) {
				futures.add(null);
				rejected.add(rejectedResult(name, start));
			}
		}

		List<HealthCheckResult> results = new ArrayList<>(names.size());
		for (int i = 0; i < names.size(); i++) {
			Future<HealthCheckResult> future = futures.get(i);
			results.add(future == null ? rejected.get(i) : awaitResult(names.get(i), future, startTimes.get(i)));
		}

		AggregatedHealth health = AggregatedHealth.of(results, System.currentTimeMillis());
		publish(new Snapshot(sequence, health));
		return health;
	}

	private void publish(Snapshot candidate) {
		Snapshot previous;
		do {
			previous = lastStatus.get();
			if (previous.sequence > candidate.sequence) {
				log.debug("Health sweep #{} finished after newer sweep #{}, result not published",
					candidate.sequence, previous.sequence);
				return;
			}
		} while (!lastStatus.compareAndSet(previous, candidate));
	}

	private HealthCheckResult rejectedResult(String name, long startNanos) {
		String reason = probeExecutor.isShutdown()
			? "Health checker closed"
			: "No probe thread available (" + runningProbes.get() + " running)";
		log.warn("Health check '{}' not run: {}", name, reason);
		return new HealthCheckResult(name, ProbeStatus.ERROR, TimeCheckerUtil.elapsedMillis(startNanos),
			System.currentTimeMillis(), reason);
	}

	private HealthCheckResult runProbe(String name, HealthProbe probe) {
		long start = System.nanoTime();
		runningProbes.incrementAndGet();
		try {
			boolean healthy = probe.check();
			return new HealthCheckResult(name, healthy ? ProbeStatus.HEALTHY : ProbeStatus.UNHEALTHY,
				TimeCheckerUtil.elapsedMillis(start), System.currentTimeMillis(), null);
		} catch (Exception e) {
			log.warn("Health check '{}' failed: {}", name, e.getMessage());
			return new HealthCheckResult(name, ProbeStatus.ERROR,
				TimeCheckerUtil.elapsedMillis(start), System.currentTimeMillis(), describe(e));
		} finally {
			runningProbes.decrementAndGet();
		}
	}

	private HealthCheckResult awaitResult(String name, Future<HealthCheckResult> future, long startNanos) {
		long remainingNanos = TimeUnit.MILLISECONDS.toNanos(probeTimeoutMillis) - (System.nanoTime() - startNanos);
		try {
			return future.get(Math.max(remainingNanos, 0L), TimeUnit.NANOSECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			log.warn("Health check '{}' timed out after {}ms ({} probe threads still running)",
				name, probeTimeoutMillis, runningProbes.get());
			return new HealthCheckResult(name, ProbeStatus.ERROR, TimeCheckerUtil.elapsedMillis(startNanos),
				System.currentTimeMillis(), "Timed out after " + probeTimeoutMillis + "ms");
		} catch (ExecutionException e) {
			return new HealthCheckResult(name, ProbeStatus.ERROR, TimeCheckerUtil.elapsedMillis(startNanos),
				System.currentTimeMillis(), describe(e.getCause()));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			return new HealthCheckResult(name, ProbeStatus.ERROR, TimeCheckerUtil.elapsedMillis(startNanos),
				System.currentTimeMillis(), "Interrupted");
		}
	}

	/**
	 * 점검이 진행 중이 아닐 때만 점검합니다.
	 *
	 * @return 점검을 실행했으면 true, 진행 중이라 건너뛰었으면 false
	 */
	boolean sweepIfIdle() {
		if (!sweepInFlight.compareAndSet(false, true)) {
			log.debug("Health sweep skipped, previous sweep still running");
			return false;
		}
		try {
			AggregatedHealth health = performChecks();
			log.info("Health check completed: {}", health.status().value());
			return true;
		} catch (RuntimeException e) {
			log.error("Health sweep failed", e);
			return true;
		} finally {
			sweepInFlight.set(false);
		}
	}

	/**
	 * 설정된 간격으로 주기 점검을 시작합니다. 이미 시작되었으면 아무것도 하지 않습니다.
	 */
	public synchronized void startPeriodicChecks() {
		if (periodicTask != null) {
			return;
		}
		if (scheduler == null) {
			scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread t = new Thread(r, "health-checker");
				t.setDaemon(true);
				return t;
			});
		}
		periodicTask = scheduler.scheduleAtFixedRate(this::sweepIfIdle, 0, intervalMillis, TimeUnit.MILLISECONDS);
		log.info("Periodic health checks started (interval={}ms)", intervalMillis);
	}

	/**
	 * 주기 점검을 중단합니다. 진행 중인 점검은 끝까지 실행됩니다.
	 */
	public synchronized void stopPeriodicChecks() {
		if (periodicTask != null) {
			periodicTask.cancel(false);
			periodicTask = null;
			log.info("Periodic health checks stopped");
		}
	}

	public synchronized boolean isPeriodicChecksRunning() {
		return periodicTask != null;
	}

	/**
	 * 마지막 점검 결과를 반환합니다. 프로브를 실행하지 않습니다.
	 */
	public AggregatedHealth getStatus() {
		return lastStatus.get().health;
	}

	public long getIntervalMillis() {
		return intervalMillis;
	}

	public long getProbeTimeoutMillis() {
		return probeTimeoutMillis;
	}

	/**
	 * @return 지금 실행 중인 프로브 수 (시간 초과 후에도 끝나지 않은 프로브 포함)
	 */
	public int getRunningProbeCount() {
		return runningProbes.get();
	}

	@Override
	public void close() {
		stopPeriodicChecks();
		synchronized (this) {
			if (scheduler != null) {
				shutdown(scheduler);
				scheduler = null;
			}
		}
		shutdown(probeExecutor);
	}

	private static void shutdown(ExecutorService executor) {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	private static final class Snapshot {
		private final long sequence;
		private final AggregatedHealth health;

		private Snapshot(long sequence, AggregatedHealth health) {
			this.sequence = sequence;
			this.health = health;
		}
	}

	private static String describe(Throwable error) {
		if (error == null) {
			return "Unknown error";
		}
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}
}
