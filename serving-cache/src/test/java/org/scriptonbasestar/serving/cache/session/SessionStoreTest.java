package org.scriptonbasestar.serving.cache.session;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.serving.cache.store.InMemoryCacheStore;
import org.scriptonbasestar.serving.core.cache.CacheValueCodec;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class SessionStoreTest {

	private AtomicLong now;
	private InMemoryCacheStore cacheStore;
	private SessionStore sessionStore;

	@Before
	public void setUp() {
		now = new AtomicLong(0L);
		cacheStore = new InMemoryCacheStore(3600, new CacheValueCodec(), now::get);
		cacheStore.connect();
		sessionStore = new SessionStore(cacheStore, 10);
	}

	@Test
	public void testCreateAndGetSession() {
		// Given
		Map<String, Object> data = new HashMap<>();
		data.put("userId", 42);
		data.put("role", "admin");

		// When
		sessionStore.createSession("abc", data);

		// Then
		assertEquals(data, sessionStore.getSession("abc"));
		assertNotNull(cacheStore.get("sessions:abc"));
	}

	@Test
	public void testDestroyedSessionIsGone() {
		sessionStore.createSession("abc", Map.of("userId", 1));

		sessionStore.destroySession("abc");

		assertNull(sessionStore.getSession("abc"));
	}

	@Test
	public void testReadDoesNotExtendTtl() {
		sessionStore.createSession("abc", Map.of("userId", 1));

		now.addAndGet(9_000L);
		assertNotNull(sessionStore.getSession("abc"));

		now.addAndGet(1_000L);
		assertNull(sessionStore.getSession("abc"));
	}

	@Test
	public void testUpdateResetsTtl() {
		sessionStore.createSession("abc", Map.of("step", 1));

		now.addAndGet(9_000L);
		sessionStore.updateSession("abc", Map.of("step", 2));

		now.addAndGet(9_000L);
		Map<String, Object> session = sessionStore.getSession("abc");
		assertNotNull(session);
		assertEquals(2, session.get("step"));
	}

	@Test
	public void testExplicitTtlOverridesDefault() {
		sessionStore.createSession("abc", Map.of("userId", 1), 2);

		now.addAndGet(2_000L);

		assertNull(sessionStore.getSession("abc"));
	}

	@Test
	public void testDefaultTtlIsOneDay() {
		assertEquals(86_400, new SessionStore(cacheStore).getSessionTtlSeconds());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBlankSessionIdRejected() {
		sessionStore.getSession(" ");
	}
}
