/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

import reactor.core.publisher.Mono;

/**
 * Performs the HTTP exchange with the token endpoint on behalf of the client.
 * <p>
 * Implementations send exactly one {@code POST} per subscription and report every HTTP
 * status as a {@link TokenEndpointResponse}, leaving its interpretation to the client.
 * Connection failures, timeouts and cancellation are the transport's business and
 * surface as error signals, unchanged. Implementations must not retry.
 */
public interface TokenEndpointTransport {

	/**
	 * Sends a request to the token endpoint.
	 * @param request the fully assembled request
	 * @return a {@link Mono} emitting the response once it has been read in full
	 */
	Mono<TokenEndpointResponse> exchange(TokenEndpointRequest request);

}
