/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.json.jackson2;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import io.oauth2client.json.OAuth2JsonMapper;
import io.oauth2client.json.OAuth2JsonMapperSupplier;

/**
 * A supplier of {@link OAuth2JsonMapper} instances that uses the Jackson library for
 * JSON deserialization.
 * <p>
 * The mapper does not call {@code setAccessible()} on constructors or fields, so no
 * {@code --add-opens} flags are needed.
 */
public class JacksonOAuth2JsonMapperSupplier implements OAuth2JsonMapperSupplier {

	@Override
	public OAuth2JsonMapper get() {
		return new JacksonOAuth2JsonMapper(createMapper());
	}

	private static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.build();
	}

}
