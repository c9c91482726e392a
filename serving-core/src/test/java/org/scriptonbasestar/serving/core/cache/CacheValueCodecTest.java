package org.scriptonbasestar.serving.core.cache;

import org.junit.Test;
import org.scriptonbasestar.serving.core.exception.CacheSerializationException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CacheValueCodecTest {

	private final CacheValueCodec codec = new CacheValueCodec();

	@Test
	public void testMapIsStructurallyRestored() {
		// Given
		Map<String, Object> value = new LinkedHashMap<>();
		value.put("id", 7);
		value.put("tags", Arrays.asList("a", "b"));
		value.put("active", true);

		// When
		Object decoded = codec.decode(codec.encode(value));

		// Then
		assertEquals(value, decoded);
	}

	@Test
	public void testNumericLookingStringStaysString() {
		String encoded = codec.encode("123");

		assertEquals("\"123\"", encoded);
		assertEquals("123", codec.decode(encoded));
	}

	@Test
	public void testRawValueFallsBack() {
		// 다른 클라이언트가 JSON이 아닌 값을 저장한 경우
		assertEquals("plain text", codec.decode("plain text"));
		assertNull(codec.decode(null));
	}

	@Test
	public void testTypedDecode() {
		String encoded = codec.encode(Arrays.asList(1, 2, 3));

		List<?> list = codec.decode(encoded, List.class);
		assertEquals(Arrays.asList(1, 2, 3), list);

		assertNull(codec.decode(encoded, Map.class));
		assertEquals("raw", codec.decode("raw", String.class));
	}

	@Test(expected = CacheSerializationException.class)
	public void testUnencodableValue() {
		// 프로퍼티가 없는 빈은 직렬화할 수 없다
		codec.encode(new Object());
	}

	@Test
	public void testNamespaceKeys() {
		assertEquals("sessions:abc", CacheNamespace.SESSIONS.key("abc"));
		assertEquals("api:*", CacheNamespace.API_RESPONSES.pattern());
	}
}
