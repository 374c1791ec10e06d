/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import io.oauth2client.spec.GrantTypes;
import io.oauth2client.spec.OAuth2Parameters;

/**
 * Client credentials grant, RFC 6749 section 4.4, for confidential clients acting on
 * their own behalf.
 *
 * <p>
 * The client authenticates with HTTP Basic when it is configured with a secret.
 * Otherwise put {@code client_secret} in the client's default body, or add it to the
 * request with {@link TokenRequestBuilder#parameter(String, String)}.
 */
public final class ClientCredentialsGrant {

	private ClientCredentialsGrant() {
	}

	/**
	 * Starts a token request, RFC 6749 section 4.4.2.
	 * @return a new builder
	 */
	public static TokenRequestBuilder tokenRequest() {
		return new TokenRequestBuilder();
	}

	public static final class TokenRequestBuilder extends AbstractTokenRequestBuilder<TokenRequestBuilder> {

		private TokenRequestBuilder() {
			super(GrantTypes.CLIENT_CREDENTIALS);
			this.parameters.put(OAuth2Parameters.SCOPE, null);
		}

	}

}
