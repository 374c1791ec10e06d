/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import io.oauth2client.spec.GrantTypes;
import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.util.Assert;

/**
 * Refreshing an access token, RFC 6749 section 6.
 */
public final class RefreshTokenGrant {

	private RefreshTokenGrant() {
	}

	/**
	 * Starts a refresh request. Without a scope the server grants the scope of the
	 * original token.
	 * @param refreshToken the refresh token issued to the client
	 * @return a new builder
	 */
	public static TokenRequestBuilder tokenRequest(String refreshToken) {
		return new TokenRequestBuilder(refreshToken);
	}

	public static final class TokenRequestBuilder extends AbstractTokenRequestBuilder<TokenRequestBuilder> {

		private TokenRequestBuilder(String refreshToken) {
			super(GrantTypes.REFRESH_TOKEN);
			Assert.hasText(refreshToken, "refreshToken must not be empty");
			this.parameters.put(OAuth2Parameters.REFRESH_TOKEN, refreshToken);
			this.parameters.put(OAuth2Parameters.SCOPE, null);
		}

	}

}
