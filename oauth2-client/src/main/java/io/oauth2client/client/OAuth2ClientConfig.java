/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.oauth2client.util.Assert;

/**
 * Identity and endpoint configuration of an OAuth 2.0 client. Immutable.
 *
 * <p>
 * Client authentication (RFC 6749 section 2.3.1) is decided from this configuration:
 * a non-empty {@link #getClientSecret() client secret} makes the client use HTTP Basic
 * authentication. Clients that must send their credentials in the request body instead
 * leave the secret unset and put {@code client_secret} in the
 * {@link #getDefaultBody() default body}.
 */
public final class OAuth2ClientConfig {

	private final String clientId;

	private final String clientSecret;

	private final Map<String, String> defaultBody;

	private final String authorizationEndpoint;

	private final String tokenEndpoint;

	private OAuth2ClientConfig(Builder builder) {
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.defaultBody = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultBody));
		this.authorizationEndpoint = builder.authorizationEndpoint;
		this.tokenEndpoint = builder.tokenEndpoint;
	}

	/**
	 * Creates a new builder.
	 * @param clientId the client identifier issued by the authorization server
	 * @return a new builder instance
	 */
	public static Builder builder(String clientId) {
		return new Builder(clientId);
	}

	public String getClientId() {
		return this.clientId;
	}

	/**
	 * @return the client secret, or {@code null} for a public client
	 */
	public String getClientSecret() {
		return this.clientSecret;
	}

	/**
	 * Parameters merged into every token request body, after {@code client_id} and
	 * {@code grant_type} and before the request's own parameters.
	 * @return an unmodifiable map, in insertion order
	 */
	public Map<String, String> getDefaultBody() {
		return this.defaultBody;
	}

	/**
	 * @return the authorization endpoint, or {@code null} if not configured
	 */
	public String getAuthorizationEndpoint() {
		return this.authorizationEndpoint;
	}

	/**
	 * @return the token endpoint, or {@code null} if not configured
	 */
	public String getTokenEndpoint() {
		return this.tokenEndpoint;
	}

	@Override
	public String toString() {
		return "OAuth2ClientConfig[clientId=" + this.clientId + ", clientSecret="
				+ (this.clientSecret != null ? "****" : null) + ", defaultBody=" + this.defaultBody.keySet()
				+ ", authorizationEndpoint=" + this.authorizationEndpoint + ", tokenEndpoint=" + this.tokenEndpoint
				+ "]";
	}

	/**
	 * Builder for {@link OAuth2ClientConfig}.
	 */
	public static final class Builder {

		private final String clientId;

		private String clientSecret;

		private final Map<String, String> defaultBody = new LinkedHashMap<>();

		private String authorizationEndpoint;

		private String tokenEndpoint;

		private Builder(String clientId) {
			Assert.hasText(clientId, "clientId must not be empty");
			this.clientId = clientId;
		}

		/**
		 * Sets the client secret of a confidential client, triggering HTTP Basic
		 * authentication when it is not empty.
		 * @param clientSecret the client secret
		 * @return this builder
		 */
		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		/**
		 * Adds a parameter sent in every token request body.
		 * @param name the parameter name
		 * @param value the parameter value
		 * @return this builder
		 */
		public Builder defaultBodyParameter(String name, String value) {
			Assert.hasText(name, "parameter name must not be empty");
			this.defaultBody.put(name, value);
			return this;
		}

		/**
		 * Adds parameters sent in every token request body, in iteration order.
		 * @param defaultBody the parameters
		 * @return this builder
		 */
		public Builder defaultBody(Map<String, String> defaultBody) {
			Assert.notNull(defaultBody, "defaultBody must not be null");
			defaultBody.forEach(this::defaultBodyParameter);
			return this;
		}

		/**
		 * Sets the authorization endpoint. It may already carry a query string.
		 * @param authorizationEndpoint an absolute URL
		 * @return this builder
		 */
		public Builder authorizationEndpoint(String authorizationEndpoint) {
			this.authorizationEndpoint = validEndpoint(authorizationEndpoint, "authorizationEndpoint");
			return this;
		}

		/**
		 * Sets the token endpoint. It may already carry a query string.
		 * @param tokenEndpoint an absolute URL
		 * @return this builder
		 */
		public Builder tokenEndpoint(String tokenEndpoint) {
			this.tokenEndpoint = validEndpoint(tokenEndpoint, "tokenEndpoint");
			return this;
		}

		private static String validEndpoint(String endpoint, String name) {
			Assert.hasText(endpoint, name + " must not be empty");
			URI uri;
			try {
				uri = URI.create(endpoint);
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid " + name + ": " + endpoint, e);
			}
			if (!uri.isAbsolute()) {
				throw new IllegalArgumentException(name + " must be an absolute URL: " + endpoint);
			}
			return endpoint;
		}

		/**
		 * Builds a new {@link OAuth2ClientConfig} instance.
		 * @return a new configuration instance
		 */
		public OAuth2ClientConfig build() {
			return new OAuth2ClientConfig(this);
		}

	}

}
