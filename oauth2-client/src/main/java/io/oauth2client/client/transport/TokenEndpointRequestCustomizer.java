/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

import java.net.http.HttpRequest;

/**
 * Customize {@link HttpRequest.Builder} before a token endpoint request is sent, for
 * instance to add tracing or {@code User-Agent} headers.
 */
@FunctionalInterface
public interface TokenEndpointRequestCustomizer {

	TokenEndpointRequestCustomizer NOOP = (builder, request) -> {
	};

	/**
	 * Customize the request builder. The URI, method and body are already set and should
	 * not be changed.
	 * @param builder the request builder
	 * @param request the request being sent
	 */
	void customize(HttpRequest.Builder builder, TokenEndpointRequest request);

}
