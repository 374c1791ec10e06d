/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client;

import java.util.Map;

import io.oauth2client.spec.AuthorizationRequest;
import io.oauth2client.spec.OAuth2TransportException;
import io.oauth2client.spec.TokenRequest;
import io.oauth2client.spec.TokenResponse;
import io.oauth2client.util.Assert;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * A synchronous OAuth 2.0 client that wraps an {@link OAuth2AsyncClient} and blocks on
 * its results.
 *
 * <p>
 * Calls block for as long as the transport takes; timeouts belong to the transport, see
 * {@link io.oauth2client.client.transport.HttpClientTokenEndpointTransport.Builder}.
 * Unchecked exceptions, such as {@link io.oauth2client.spec.OAuth2ServerException} or
 * those of a custom transport, are rethrown as-is. A checked transport failure, for
 * instance a {@link java.net.ConnectException} or an
 * {@link java.net.http.HttpTimeoutException}, is rethrown as an
 * {@link OAuth2TransportException} holding it as the cause.
 *
 * @see OAuth2Client
 * @see OAuth2AsyncClient
 */
public class OAuth2SyncClient {

	private final OAuth2AsyncClient delegate;

	OAuth2SyncClient(OAuth2AsyncClient delegate) {
		Assert.notNull(delegate, "The async client must not be null");
		this.delegate = delegate;
	}

	public OAuth2ClientConfig getConfig() {
		return this.delegate.getConfig();
	}

	/**
	 * @see OAuth2AsyncClient#authorizationUrl(AuthorizationRequest)
	 * @param request the authorization request
	 * @return the authorization URL
	 */
	public String authorizationUrl(AuthorizationRequest request) {
		return this.delegate.authorizationUrl(request);
	}

	/**
	 * @see OAuth2AsyncClient#requestToken(TokenRequest)
	 * @param request the token request
	 * @return the decoded response, error responses included
	 */
	public TokenResponse requestToken(TokenRequest request) {
		return block(this.delegate.requestToken(request));
	}

	/**
	 * @see OAuth2AsyncClient#refreshToken(String, String, Map)
	 * @param refreshToken the refresh token
	 * @param scope the requested scope, or {@code null} for the originally granted one
	 * @param parameters extension parameters, may be empty
	 * @return the decoded response
	 */
	public TokenResponse refreshToken(String refreshToken, String scope, Map<String, String> parameters) {
		return block(this.delegate.refreshToken(refreshToken, scope, parameters));
	}

	/**
	 * @see OAuth2AsyncClient#refreshToken(String)
	 * @param refreshToken the refresh token
	 * @return the decoded response
	 */
	public TokenResponse refreshToken(String refreshToken) {
		return block(this.delegate.refreshToken(refreshToken));
	}

	/**
	 * Retrieves the underlying asynchronous client.
	 * @return the underlying {@link OAuth2AsyncClient}
	 */
	public OAuth2AsyncClient async() {
		return this.delegate;
	}

	private static <T> T block(Mono<T> result) {
		try {
			return result.block();
		}
		catch (RuntimeException e) {
			Throwable cause = Exceptions.unwrap(e);
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new OAuth2TransportException("Token endpoint exchange failed", cause);
		}
	}

}
