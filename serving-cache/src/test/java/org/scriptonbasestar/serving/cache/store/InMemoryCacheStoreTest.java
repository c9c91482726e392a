package org.scriptonbasestar.serving.cache.store;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.serving.core.cache.CacheValueCodec;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class InMemoryCacheStoreTest {

	private AtomicLong now;
	private InMemoryCacheStore store;

	@Before
	public void setUp() {
		now = new AtomicLong(1_000_000L);
		store = new InMemoryCacheStore(3600, new CacheValueCodec(), now::get);
		store.connect();
	}

	@After
	public void tearDown() {
		store.close();
	}

	@Test
	public void testSetThenGetReturnsStructurallyEqualValue() {
		// Given
		Map<String, Object> post = Map.of("id", 1, "title", "hello", "tags", List.of("a", "b"));

		// When
		store.set("posts:1", post, 60);

		// Then
		assertEquals(post, store.get("posts:1"));
		assertEquals("hello", store.get("posts:1", Map.class).get("title"));
	}

	@Test
	public void testNumericStringStaysString() {
		store.set("k", "123");

		assertEquals("123", store.get("k"));
	}

	@Test
	public void testMissingKeyReturnsNull() {
		assertNull(store.get("nothing"));
		assertNull(store.get("nothing", Map.class));
	}

	@Test
	public void testEntryExpiresAfterTtl() {
		// Given
		store.set("k", "v", 1);
		assertEquals("v", store.get("k"));

		// When: 1초 경과
		now.addAndGet(1_000L);

		// Then
		assertNull(store.get("k"));
		assertEquals(0, store.size());
	}

	@Test
	public void testZeroTtlNeverExpires() {
		store.set("k", "v", 0);
		now.addAndGet(TimeUnit.DAYS.toMillis(365));

		assertEquals("v", store.get("k"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeTtlRejected() {
		store.set("k", "v", -1);
	}

	@Test
	public void testDefaultTtlApplied() {
		store.set("k", "v");

		now.addAndGet(3_599_000L);
		assertEquals("v", store.get("k"));
		now.addAndGet(1_000L);
		assertNull(store.get("k"));
	}

	@Test
	public void testDeleteAndDeleteMany() {
		store.set("a", 1);
		store.set("b", 2);
		store.set("c", 3);

		store.delete("a");
		store.deleteMany(List.of("b", "c", "missing"));

		assertNull(store.get("a"));
		assertNull(store.get("b"));
		assertNull(store.get("c"));
	}

	@Test
	public void testClearByPatternRemovesOnlyMatches() {
		// Given
		store.set("users:1", "u1");
		store.set("users:2", "u2");
		store.set("posts:1", "p1");

		// When
		long removed = store.clearByPattern("users:*");

		// Then
		assertEquals(2, removed);
		assertNull(store.get("users:1"));
		assertNull(store.get("users:2"));
		assertEquals("p1", store.get("posts:1"));
	}

	@Test
	public void testClearByPatternDoesNotCountExpiredKeys() {
		store.set("users:1", "u1", 1);
		store.set("users:2", "u2", 10);
		now.addAndGet(2_000L);

		assertEquals(1, store.clearByPattern("users:*"));
	}

	@Test
	public void testClearByPatternWithoutPatternRemovesNothing() {
		// Given
		store.set("users:1", "u1");

		// When
		long removedByNull = store.clearByPattern(null);
		long removedByBlank = store.clearByPattern("  ");

		// Then
		assertEquals(0, removedByNull);
		assertEquals(0, removedByBlank);
		assertEquals("u1", store.get("users:1"));
	}

	@Test
	public void testIncrementStartsFromZero() {
		assertEquals(1, store.increment("counter"));
		assertEquals(6, store.increment("counter", 5));
		assertEquals(6, ((Number) store.get("counter")).longValue());
	}

	@Test
	public void testIncrementKeepsExistingTtl() {
		store.set("counter", 10, 5);
		assertEquals(11, store.increment("counter"));

		now.addAndGet(5_000L);
		assertNull(store.get("counter"));
	}

	@Test
	public void testIncrementOnNonIntegerValueReturnsZero() {
		store.set("k", "not-a-number");

		assertEquals(0, store.increment("k"));
		assertEquals("not-a-number", store.get("k"));
	}

	@Test
	public void testConcurrentIncrementsAreAtomic() throws Exception {
		// Given
		int threads = 10;
		int perThread = 100;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		CountDownLatch done = new CountDownLatch(threads);

		// When
		for (int i = 0; i < threads; i++) {
			executor.submit(() -> {
				try {
					start.await();
					for (int j = 0; j < perThread; j++) {
						store.increment("hits");
					}
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				} finally {
					done.countDown();
				}
			});
		}
		start.countDown();
		assertTrue(done.await(10, TimeUnit.SECONDS));
		executor.shutdown();

		// Then
		assertEquals(threads * perThread, store.increment("hits", 0));
	}

	@Test
	public void testOperationsDegradeWhenNotConnected() {
		InMemoryCacheStore disconnected = new InMemoryCacheStore(60);

		disconnected.set("k", "v");
		assertNull(disconnected.get("k"));
		assertEquals(0, disconnected.increment("k"));
		assertEquals(0, disconnected.clearByPattern("*"));
		assertFalse(disconnected.ping());
	}

	@Test
	public void testCloseDisconnects() {
		store.set("k", "v");
		assertTrue(store.ping());

		store.close();

		assertFalse(store.isConnected());
		assertFalse(store.ping());
		assertEquals(0, store.size());
	}

	@Test
	public void testRemoveExpired() {
		store.set("a", 1, 1);
		store.set("b", 2, 100);
		now.addAndGet(1_500L);

		assertEquals(1, store.removeExpired());
		assertEquals(1, store.size());
	}

	@Test
	public void testGetStatsCountsEntries() {
		// Given
		store.set("a", 1, 1);
		store.set("b", 2, 100);
		store.set("c", 3, 0);
		now.addAndGet(1_500L);

		// When
		Map<String, String> stats = store.getStats();

		// Then
		assertEquals("true", stats.get("connected"));
		assertEquals("3", stats.get("keys"));
		assertEquals("1", stats.get("expired_keys"));
	}

	@Test
	public void testGetStatsAfterClose() {
		store.set("a", 1);
		store.close();

		Map<String, String> stats = store.getStats();

		assertEquals("false", stats.get("connected"));
		assertEquals("0", stats.get("keys"));
	}
}
