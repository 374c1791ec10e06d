/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import java.util.Map;

import io.oauth2client.spec.GrantTypes;
import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.util.Assert;

/**
 * Authorization code grant, RFC 6749 section 4.1. Usable by confidential and public
 * clients.
 *
 * <p>
 * The flow has two legs:
 * <ol>
 * <li>{@link #authorizationRequest()} describes where to send the resource owner. The
 * caller keeps the {@code state} to check the redirect with
 * {@link io.oauth2client.spec.AuthorizationResponses}.
 * <li>{@link #tokenRequest(String)} exchanges the returned code for a token.
 * </ol>
 */
public final class AuthorizationCodeGrant {

	private AuthorizationCodeGrant() {
	}

	/**
	 * Starts an authorization request with response type {@code code}.
	 * @return a new builder
	 */
	public static AuthorizationRequestBuilder authorizationRequest() {
		return new AuthorizationRequestBuilder();
	}

	/**
	 * Starts a token request exchanging an authorization code, RFC 6749 section 4.1.3.
	 * @param code the authorization code received at the redirect URI
	 * @return a new builder
	 */
	public static TokenRequestBuilder tokenRequest(String code) {
		return new TokenRequestBuilder(code);
	}

	public static final class AuthorizationRequestBuilder
			extends AbstractAuthorizationRequestBuilder<AuthorizationRequestBuilder> {

		private AuthorizationRequestBuilder() {
			super(GrantTypes.RESPONSE_TYPE_CODE);
		}

		/**
		 * Adds the PKCE code challenge, RFC 7636 section 4.3.
		 * @param pkce the verifier and challenge pair, whose verifier is later sent with
		 * the token request
		 * @return this builder
		 */
		public AuthorizationRequestBuilder pkce(Pkce pkce) {
			Assert.notNull(pkce, "pkce must not be null");
			pkce.authorizationParameters().forEach(this.parameters::put);
			return this;
		}

		/**
		 * Adds an extension parameter, for instance {@code prompt} or {@code nonce}. A
		 * {@code null} value removes the parameter from the URL, even a base one.
		 * @param name the parameter name
		 * @param value the value
		 * @return this builder
		 */
		public AuthorizationRequestBuilder parameter(String name, String value) {
			Assert.hasText(name, "parameter name must not be empty");
			this.parameters.put(name, value);
			return this;
		}

		/**
		 * Adds extension parameters, in iteration order.
		 * @param parameters the parameters
		 * @return this builder
		 * @see #parameter(String, String)
		 */
		public AuthorizationRequestBuilder parameters(Map<String, String> parameters) {
			Assert.notNull(parameters, "parameters must not be null");
			parameters.forEach(this::parameter);
			return this;
		}

	}

	public static final class TokenRequestBuilder extends AbstractTokenRequestBuilder<TokenRequestBuilder> {

		private TokenRequestBuilder(String code) {
			super(GrantTypes.AUTHORIZATION_CODE);
			Assert.hasText(code, "code must not be empty");
			this.parameters.put(OAuth2Parameters.CODE, code);
			this.parameters.put(OAuth2Parameters.REDIRECT_URI, null);
		}

		/**
		 * Sets the redirect URI. Required if it was part of the authorization request, in
		 * which case both values must be identical. It is passed through unchanged.
		 * @param redirectUri the redirect URI
		 * @return this builder
		 */
		public TokenRequestBuilder redirectUri(String redirectUri) {
			this.parameters.put(OAuth2Parameters.REDIRECT_URI, redirectUri);
			return this;
		}

		/**
		 * Adds the PKCE code verifier, RFC 7636 section 4.5.
		 * @param pkce the pair whose challenge went out with the authorization request
		 * @return this builder
		 */
		public TokenRequestBuilder pkce(Pkce pkce) {
			Assert.notNull(pkce, "pkce must not be null");
			pkce.tokenParameters().forEach(this.parameters::put);
			return this;
		}

	}

}
