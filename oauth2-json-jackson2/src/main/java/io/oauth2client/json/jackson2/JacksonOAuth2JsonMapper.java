/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.oauth2client.json.OAuth2JsonMapper;
import io.oauth2client.json.TypeRef;

/**
 * Jackson-based implementation of {@link OAuth2JsonMapper}. Wraps a Jackson
 * {@link ObjectMapper} but keeps the client API decoupled from Jackson.
 */
public final class JacksonOAuth2JsonMapper implements OAuth2JsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonOAuth2JsonMapper instance with the given ObjectMapper.
	 * @param objectMapper the ObjectMapper to be used for JSON processing. Must not be
	 * null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null.
	 */
	public JacksonOAuth2JsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.readValue(content, javaType);
	}

}
