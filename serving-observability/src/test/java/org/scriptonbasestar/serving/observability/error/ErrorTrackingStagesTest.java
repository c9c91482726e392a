package org.scriptonbasestar.serving.observability.error;

import org.junit.Test;
import org.scriptonbasestar.serving.core.config.ServingSettings;
import org.scriptonbasestar.serving.core.pipeline.BufferedResponseWriter;
import org.scriptonbasestar.serving.core.pipeline.ServingPipeline;
import org.scriptonbasestar.serving.core.pipeline.ServingRequest;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class ErrorTrackingStagesTest {

	@Test
	public void testErrorCaptureRecordsAndRethrows() throws Exception {
		// Given
		ServingSettings.ErrorTracking settings = new ServingSettings.ErrorTracking();
		settings.setDsn("https://key@example.invalid/1");
		ErrorSink sink = mock(ErrorSink.class);
		ErrorTracker tracker = new ErrorTracker(settings, s -> sink);
		tracker.initialize();

		ErrorTrackingStages stages = tracker.stages();
		IllegalStateException failure = new IllegalStateException("handler failed");
		ServingPipeline pipeline = ServingPipeline.builder()
			.stage(stages.contextCapture())
			.stage(stages.errorCapture())
			.handler((request, response) -> {
				throw failure;
			})
			.build();

		// When
		try {
			pipeline.handle(ServingRequest.builder().method("GET").path("/api/posts").query("page=2").build(),
				new BufferedResponseWriter());
			fail("exception should propagate");
		} catch (IllegalStateException e) {
			assertSame(failure, e);
		}

		// Then
		verify(sink).captureException(failure, Map.of("method", "GET", "path", "/api/posts", "query", "page=2"));
	}

	@Test
	public void testContextCaptureScopesMdc() throws Exception {
		ErrorTracker tracker = new ErrorTracker(new ServingSettings.ErrorTracking());
		List<String> seen = new ArrayList<>();

		ServingPipeline pipeline = ServingPipeline.builder()
			.stage(tracker.stages().contextCapture())
			.handler((request, response) -> {
				seen.add(MDC.get(ErrorTrackingStages.MDC_METHOD));
				seen.add(MDC.get(ErrorTrackingStages.MDC_PATH));
				response.send("ok");
			})
			.build();

		pipeline.handle(ServingRequest.of("post", "/api/users"), new BufferedResponseWriter());

		assertEquals(List.of("POST", "/api/users"), seen);
		assertNull(MDC.get(ErrorTrackingStages.MDC_METHOD));
		assertNull(MDC.get(ErrorTrackingStages.MDC_PATH));
	}
}
