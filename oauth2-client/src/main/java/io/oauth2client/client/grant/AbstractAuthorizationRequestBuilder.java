/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import io.oauth2client.spec.AuthorizationRequest;
import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.spec.Scopes;

/**
 * Abstract base builder for authorization requests.
 *
 * <p>
 * Holds the parameters shared by the authorization code and implicit grants. Unset
 * parameters stay {@code null} and are left out of the authorization URL, and the
 * parameter order is fixed: {@code redirect_uri}, {@code scope}, {@code state}, then any
 * grant-specific extras in the order they were added.
 *
 * @param <B> the concrete builder type for fluent method chaining
 * @see AuthorizationCodeGrant.AuthorizationRequestBuilder
 * @see ImplicitGrant.AuthorizationRequestBuilder
 */
public abstract class AbstractAuthorizationRequestBuilder<B extends AbstractAuthorizationRequestBuilder<B>> {

	private final String responseType;

	protected final Map<String, String> parameters = new LinkedHashMap<>();

	protected AbstractAuthorizationRequestBuilder(String responseType) {
		this.responseType = responseType;
		this.parameters.put(OAuth2Parameters.REDIRECT_URI, null);
		this.parameters.put(OAuth2Parameters.SCOPE, null);
		this.parameters.put(OAuth2Parameters.STATE, null);
	}

	/**
	 * Returns this builder cast to the concrete type for fluent chaining.
	 * @return this builder as the concrete type B
	 */
	@SuppressWarnings("unchecked")
	protected B self() {
		return (B) this;
	}

	/**
	 * Sets the redirection endpoint. When left out the server uses the pre-registered
	 * one.
	 * @param redirectUri the redirect URI, echoed verbatim
	 * @return this builder
	 */
	public B redirectUri(String redirectUri) {
		this.parameters.put(OAuth2Parameters.REDIRECT_URI, redirectUri);
		return self();
	}

	/**
	 * Sets the scope as a space-delimited string. An empty string is sent as-is.
	 * @param scope the scope
	 * @return this builder
	 */
	public B scope(String scope) {
		this.parameters.put(OAuth2Parameters.SCOPE, scope);
		return self();
	}

	/**
	 * Sets the scope from individual tokens, joined with a space in iteration order. An
	 * empty collection leaves the scope out.
	 * @param scopes the scope tokens
	 * @return this builder
	 */
	public B scope(Collection<String> scopes) {
		this.parameters.put(OAuth2Parameters.SCOPE, Scopes.normalize(scopes));
		return self();
	}

	/**
	 * Sets the opaque value the server echoes back with the redirect. The caller keeps
	 * it to validate the redirect, see
	 * {@link io.oauth2client.spec.AuthorizationResponses}.
	 * @param state the state
	 * @return this builder
	 */
	public B state(String state) {
		this.parameters.put(OAuth2Parameters.STATE, state);
		return self();
	}

	public AuthorizationRequest build() {
		return AuthorizationRequest.of(this.responseType, this.parameters);
	}

}
