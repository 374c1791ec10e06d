/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import io.oauth2client.spec.GrantTypes;
import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.util.Assert;

/**
 * Resource owner password credentials grant, RFC 6749 section 4.3. Meant for legacy
 * applications trusted with the resource owner's credentials.
 */
public final class ResourceOwnerPasswordCredentialsGrant {

	private ResourceOwnerPasswordCredentialsGrant() {
	}

	/**
	 * Starts a token request, RFC 6749 section 4.3.2.
	 * @param username the resource owner username
	 * @param password the resource owner password
	 * @return a new builder
	 */
	public static TokenRequestBuilder tokenRequest(String username, String password) {
		return new TokenRequestBuilder(username, password);
	}

	public static final class TokenRequestBuilder extends AbstractTokenRequestBuilder<TokenRequestBuilder> {

		private TokenRequestBuilder(String username, String password) {
			super(GrantTypes.PASSWORD);
			Assert.hasText(username, "username must not be empty");
			Assert.notNull(password, "password must not be null");
			this.parameters.put(OAuth2Parameters.USERNAME, username);
			this.parameters.put(OAuth2Parameters.PASSWORD, password);
			this.parameters.put(OAuth2Parameters.SCOPE, null);
		}

	}

}
