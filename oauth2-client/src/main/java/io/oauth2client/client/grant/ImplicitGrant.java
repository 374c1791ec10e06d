/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import io.oauth2client.spec.GrantTypes;

/**
 * Implicit grant, RFC 6749 section 4.2.
 *
 * <p>
 * Optimized for public clients operating a known redirect URI, typically in a browser.
 * There is no token request: the access token comes back in the fragment of the redirect
 * URI, where the application's redirect handler picks it up.
 */
public final class ImplicitGrant {

	private ImplicitGrant() {
	}

	/**
	 * Starts an authorization request with response type {@code token}.
	 * @return a new builder
	 */
	public static AuthorizationRequestBuilder authorizationRequest() {
		return new AuthorizationRequestBuilder();
	}

	public static final class AuthorizationRequestBuilder
			extends AbstractAuthorizationRequestBuilder<AuthorizationRequestBuilder> {

		private AuthorizationRequestBuilder() {
			super(GrantTypes.RESPONSE_TYPE_TOKEN);
		}

	}

}
