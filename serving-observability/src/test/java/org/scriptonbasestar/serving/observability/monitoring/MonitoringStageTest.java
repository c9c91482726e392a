package org.scriptonbasestar.serving.observability.monitoring;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.serving.core.pipeline.BufferedResponseWriter;
import org.scriptonbasestar.serving.core.pipeline.RequestHandler;
import org.scriptonbasestar.serving.core.pipeline.ServingPipeline;
import org.scriptonbasestar.serving.core.pipeline.ServingRequest;
import org.scriptonbasestar.serving.observability.metrics.MetricSnapshot;
import org.scriptonbasestar.serving.observability.metrics.MetricsCollector;
import org.scriptonbasestar.serving.observability.metrics.ProcessUsage;

import static org.junit.Assert.*;

public class MonitoringStageTest {

	private MetricsCollector metrics;

	@Before
	public void setUp() {
		metrics = new MetricsCollector(100, () -> new ProcessUsage(0, 0, 0, 0, 1, 0.0));
	}

	private ServingPipeline pipeline(RequestHandler handler) {
		return ServingPipeline.builder()
			.stage(new MonitoringStage(metrics))
			.handler(handler)
			.build();
	}

	@Test
	public void testRecordsStatusAndDuration() throws Exception {
		// When
		pipeline((request, response) -> {
			Thread.sleep(20);
			response.status(201);
			response.send("created");
		}).handle(ServingRequest.of("POST", "/api/posts"), new BufferedResponseWriter());

		// Then
		MetricSnapshot snapshot = metrics.getMetrics();
		assertEquals(1, snapshot.totalRequests());
		assertEquals(Long.valueOf(1), snapshot.requestsByMethod().get("POST"));
		assertEquals(Long.valueOf(1), snapshot.requestsByStatus().get(201));
		assertTrue(snapshot.p95Millis() >= 20);
	}

	@Test
	public void testExceptionRecordedAsErrorAnd500() throws Exception {
		ServingPipeline pipeline = pipeline((request, response) -> {
			throw new IllegalArgumentException("bad input");
		});

		try {
			pipeline.handle(ServingRequest.of("GET", "/api/posts"), new BufferedResponseWriter());
			fail("exception should propagate");
		} catch (IllegalArgumentException expected) {
			// 다시 던져져야 한다
		}

		MetricSnapshot snapshot = metrics.getMetrics();
		assertEquals(1, snapshot.totalErrors());
		assertEquals(Long.valueOf(1), snapshot.errorsByType().get("IllegalArgumentException"));
		assertEquals(Long.valueOf(1), snapshot.requestsByStatus().get(500));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMetricsRequired() {
		new MonitoringStage(null);
	}
}
