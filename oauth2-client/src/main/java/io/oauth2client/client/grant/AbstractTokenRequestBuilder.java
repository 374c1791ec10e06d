/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.spec.Scopes;
import io.oauth2client.spec.TokenRequest;
import io.oauth2client.util.Assert;

/**
 * Abstract base builder for token requests.
 *
 * <p>
 * A {@code null} body parameter never overrides the client's default body: it reads as
 * "use the configured default". Subclasses register their named parameters in the
 * constructor so that the body order does not depend on the order of the setter calls.
 *
 * @param <B> the concrete builder type for fluent method chaining
 */
public abstract class AbstractTokenRequestBuilder<B extends AbstractTokenRequestBuilder<B>> {

	private final String grantType;

	private final Map<String, String> query = new LinkedHashMap<>();

	protected final Map<String, String> parameters = new LinkedHashMap<>();

	protected AbstractTokenRequestBuilder(String grantType) {
		this.grantType = grantType;
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
	 * Sets the requested scope as a space-delimited string. An empty string is sent
	 * as-is.
	 * @param scope the scope
	 * @return this builder
	 */
	public B scope(String scope) {
		this.parameters.put(OAuth2Parameters.SCOPE, scope);
		return self();
	}

	/**
	 * Sets the requested scope from individual tokens, joined with a space in iteration
	 * order. An empty collection leaves the scope out.
	 * @param scopes the scope tokens
	 * @return this builder
	 */
	public B scope(Collection<String> scopes) {
		this.parameters.put(OAuth2Parameters.SCOPE, Scopes.normalize(scopes));
		return self();
	}

	/**
	 * Adds an extension parameter to the request body, for instance
	 * {@code client_secret} when the server does not accept HTTP Basic authentication.
	 * @param name the parameter name
	 * @param value the value, or {@code null} to keep the configured default
	 * @return this builder
	 */
	public B parameter(String name, String value) {
		Assert.hasText(name, "parameter name must not be empty");
		this.parameters.put(name, value);
		return self();
	}

	/**
	 * Adds extension parameters to the request body, in iteration order.
	 * @param parameters the parameters, values may be {@code null}
	 * @return this builder
	 * @see #parameter(String, String)
	 */
	public B parameters(Map<String, String> parameters) {
		Assert.notNull(parameters, "parameters must not be null");
		parameters.forEach(this::parameter);
		return self();
	}

	/**
	 * Adds a parameter to the query string of the token endpoint URL.
	 * @param name the parameter name
	 * @param value the value, {@code null} values are omitted
	 * @return this builder
	 */
	public B queryParameter(String name, String value) {
		Assert.hasText(name, "query parameter name must not be empty");
		this.query.put(name, value);
		return self();
	}

	public TokenRequest build() {
		return TokenRequest.of(this.grantType, this.query, this.parameters);
	}

}
