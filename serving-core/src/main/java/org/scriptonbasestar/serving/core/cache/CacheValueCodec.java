package org.scriptonbasestar.serving.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.serving.core.exception.CacheSerializationException;

/**
 * 캐시 값 JSON 코덱
 *
 * 문자열도 JSON 문자열로 인코딩하므로 "123" 같은 값이 숫자로 바뀌지 않습니다.
 * JSON이 아닌 원시 값(다른 클라이언트가 저장한 값)은 디코딩 시 그대로 반환합니다.
 *
 * @since 2026-10
 */
public class CacheValueCodec {

	private final ObjectMapper objectMapper;

	public CacheValueCodec() {
		this(new ObjectMapper());
	}

	public CacheValueCodec(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * 값을 JSON 문자열로 인코딩합니다.
	 *
	 * @param value 값
	 * @return JSON 문자열
	 * @throws CacheSerializationException 인코딩할 수 없는 값일 때
	 */
	public String encode(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new CacheSerializationException(
				"Failed to encode cache value of type " + value.getClass().getName(), e);
		}
	}

	/**
	 * 저장된 문자열을 구조화된 값으로 디코딩합니다.
	 *
	 * @param raw 저장된 문자열
	 * @return 디코딩된 값, JSON이 아니면 원문
	 */
	public Object decode(String raw) {
		if (raw == null) {
			return null;
		}
		try {
			return objectMapper.readValue(raw, Object.class);
		} catch (JsonProcessingException e) {
			return raw;
		}
	}

	/**
	 * 저장된 문자열을 지정 타입으로 디코딩합니다.
	 *
	 * @param raw 저장된 문자열
	 * @param type 대상 타입
	 * @return 디코딩된 값, 변환할 수 없으면 null
	 */
	public <T> T decode(String raw, Class<T> type) {
		if (raw == null) {
			return null;
		}
		try {
			return objectMapper.readValue(raw, type);
		} catch (JsonProcessingException e) {
			if (type == String.class || type == Object.class) {
				return type.cast(raw);
			}
			return null;
		}
	}

	/**
	 * 이미 디코딩된 값을 다른 타입으로 변환합니다.
	 *
	 * @param value 값
	 * @param type 대상 타입
	 * @return 변환된 값
	 * @throws IllegalArgumentException 변환할 수 없을 때
	 */
	public <T> T convert(Object value, Class<T> type) {
		return objectMapper.convertValue(value, type);
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}
}
