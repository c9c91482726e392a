package org.scriptonbasestar.serving.observability.health;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class HealthCheckerTest {

	private HealthChecker checker;

	@Before
	public void setUp() {
		checker = new HealthChecker(60_000L, 500L);
	}

	@After
	public void tearDown() {
		checker.close();
	}

	@Test
	public void testMixedProbesAreDegraded() {
		// Given
		checker.registerCheck("a", () -> true);
		checker.registerCheck("b", () -> {
			throw new IllegalStateException("x");
		});
		checker.registerCheck("c", () -> false);

		// When
		AggregatedHealth health = checker.performChecks();

		// Then
		assertEquals(OverallStatus.DEGRADED, health.status());
		assertEquals(ProbeStatus.HEALTHY, health.check("a").status());
		assertEquals(ProbeStatus.ERROR, health.check("b").status());
		assertEquals("x", health.check("b").error());
		assertEquals(ProbeStatus.UNHEALTHY, health.check("c").status());
		assertNull(health.check("c").error());
	}

	@Test
	public void testAllHealthy() {
		checker.registerCheck("redis", () -> true);
		checker.registerCheck("database", () -> true);

		AggregatedHealth health = checker.performChecks();

		assertEquals(OverallStatus.HEALTHY, health.status());
		assertTrue(health.isHealthy());
		assertEquals(2, health.checks().size());
	}

	@Test
	public void testNoProbesIsHealthy() {
		assertEquals(OverallStatus.HEALTHY, checker.performChecks().status());
	}

	@Test
	public void testStatusUnknownBeforeFirstSweep() {
		checker.registerCheck("a", () -> true);

		assertEquals(OverallStatus.UNKNOWN, checker.getStatus().status());
		assertTrue(checker.getStatus().checks().isEmpty());
	}

	@Test
	public void testGetStatusDoesNotRunProbes() {
		// Given
		AtomicInteger calls = new AtomicInteger();
		checker.registerCheck("a", () -> calls.incrementAndGet() > 0);
		checker.performChecks();

		// When
		AggregatedHealth first = checker.getStatus();
		AggregatedHealth second = checker.getStatus();

		// Then
		assertEquals(1, calls.get());
		assertSame(first, second);
	}

	@Test
	public void testSweepReplacesPreviousResult() {
		AtomicBoolean up = new AtomicBoolean(false);
		checker.registerCheck("a", up::get);

		assertEquals(OverallStatus.DEGRADED, checker.performChecks().status());
		up.set(true);
		checker.performChecks();

		assertEquals(OverallStatus.HEALTHY, checker.getStatus().status());
	}

	@Test
	public void testSlowProbeTimesOutAsError() {
		// Given
		checker.registerCheck("slow", () -> {
			Thread.sleep(5_000);
			return true;
		});
		checker.registerCheck("fast", () -> true);

		// When
		long start = System.nanoTime();
		AggregatedHealth health = checker.performChecks();
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		// Then
		assertEquals(ProbeStatus.ERROR, health.check("slow").status());
		assertTrue(health.check("slow").error().contains("Timed out"));
		assertEquals(ProbeStatus.HEALTHY, health.check("fast").status());
		assertTrue("elapsed " + elapsedMillis, elapsedMillis < 3_000);
	}

	@Test
	public void testOverlappingSweepIsSkipped() throws Exception {
		// Given: 첫 점검이 프로브 안에서 대기 중
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger calls = new AtomicInteger();
		HealthChecker slowChecker = new HealthChecker(60_000L, 5_000L);
		slowChecker.registerCheck("blocking", () -> {
			calls.incrementAndGet();
			entered.countDown();
			return release.await(5, TimeUnit.SECONDS);
		});

		Thread first = new Thread(slowChecker::sweepIfIdle);
		first.start();
		assertTrue(entered.await(5, TimeUnit.SECONDS));

		// When
		boolean ran = slowChecker.sweepIfIdle();

		// Then
		assertFalse(ran);
		release.countDown();
		first.join(5_000);
		assertEquals(1, calls.get());
		assertTrue(slowChecker.sweepIfIdle());
		assertEquals(OverallStatus.HEALTHY, slowChecker.getStatus().status());
		slowChecker.close();
	}

	@Test
	public void testPeriodicChecksStartAndStop() throws Exception {
		// Given
		HealthChecker periodic = new HealthChecker(50L, 500L);
		CountDownLatch sweeps = new CountDownLatch(3);
		periodic.registerCheck("a", () -> {
			sweeps.countDown();
			return true;
		});

		// When
		periodic.startPeriodicChecks();
		periodic.startPeriodicChecks();

		// Then
		assertTrue(sweeps.await(5, TimeUnit.SECONDS));
		assertTrue(periodic.isPeriodicChecksRunning());
		assertEquals(OverallStatus.HEALTHY, periodic.getStatus().status());

		periodic.stopPeriodicChecks();
		assertFalse(periodic.isPeriodicChecksRunning());
		periodic.close();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullProbeRejected() {
		checker.registerCheck("a", null);
	}

	@Test
	public void testUnregister() {
		checker.registerCheck("a", () -> false);
		checker.unregisterCheck("a");

		assertEquals(OverallStatus.HEALTHY, checker.performChecks().status());
	}

	@Test
	public void testOlderSweepDoesNotOverwriteNewerResult() throws Exception {
		// Given: 먼저 시작한 점검은 실패 결과를 들고 대기, 나중 점검은 HEALTHY
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger calls = new AtomicInteger();
		HealthChecker slowChecker = new HealthChecker(60_000L, 5_000L);
		slowChecker.registerCheck("flaky", () -> {
			if (calls.incrementAndGet() == 1) {
				entered.countDown();
				release.await(5, TimeUnit.SECONDS);
				return false;
			}
			return true;
		});

		Thread older = new Thread(slowChecker::sweepIfIdle);
		older.start();
		assertTrue(entered.await(5, TimeUnit.SECONDS));

		// When
		AggregatedHealth newer = slowChecker.performChecks();
		release.countDown();
		older.join(5_000);

		// Then
		assertEquals(OverallStatus.HEALTHY, newer.status());
		assertEquals(2, calls.get());
		assertEquals(OverallStatus.HEALTHY, slowChecker.getStatus().status());
		slowChecker.close();
	}

	@Test
	public void testChecksAfterCloseReportErrors() {
		// Given
		checker.registerCheck("a", () -> true);
		checker.registerCheck("b", () -> true);
		checker.close();

		// When
		AggregatedHealth health = checker.performChecks();

		// Then
		assertEquals(OverallStatus.DEGRADED, health.status());
		assertEquals(ProbeStatus.ERROR, health.check("a").status());
		assertEquals("Health checker closed", health.check("b").error());
		assertEquals(OverallStatus.DEGRADED, checker.getStatus().status());
	}

	@Test
	public void testHungCheckHoldsThreadUntilItReturns() throws Exception {
		// Given: 스레드 하나, 인터럽트를 무시하는 프로브
		CountDownLatch release = new CountDownLatch(1);
		HealthChecker bounded = new HealthChecker(60_000L, 200L, 1);
		bounded.registerCheck("hung", () -> awaitIgnoringInterrupt(release));
		bounded.registerCheck("fast", () -> true);

		// When
		AggregatedHealth health = bounded.performChecks();

		// Then
		assertEquals(ProbeStatus.ERROR, health.check("hung").status());
		assertTrue(health.check("hung").error().contains("Timed out"));
		assertEquals(ProbeStatus.ERROR, health.check("fast").status());
		assertTrue(health.check("fast").error().contains("No probe thread available"));
		assertEquals(1, bounded.getRunningProbeCount());

		release.countDown();
		long deadline = System.currentTimeMillis() + 5_000;
		while (bounded.getRunningProbeCount() > 0 && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		assertEquals(0, bounded.getRunningProbeCount());
		bounded.close();
	}

	private static boolean awaitIgnoringInterrupt(CountDownLatch latch) {
		while (true) {
			try {
				return latch.await(10, TimeUnit.SECONDS);
			} catch (InterruptedException e) {
				// 취소되어도 끝까지 대기
			}
		}
	}
}
