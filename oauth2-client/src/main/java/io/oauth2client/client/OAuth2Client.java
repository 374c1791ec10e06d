/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client;

import io.oauth2client.client.transport.HttpClientTokenEndpointTransport;
import io.oauth2client.client.transport.TokenEndpointTransport;
import io.oauth2client.json.OAuth2JsonMapper;
import io.oauth2client.util.Assert;

/**
 * Factory class for creating OAuth 2.0 clients.
 *
 * <p>
 * Example of a client credentials exchange:
 *
 * <pre>{@code
 * OAuth2SyncClient client = OAuth2Client.sync(OAuth2ClientConfig.builder("my-client")
 *         .clientSecret("secret")
 *         .tokenEndpoint("https://auth.example.com/oauth2/token")
 *         .build())
 *     .build();
 *
 * TokenResponse response = client.requestToken(ClientCredentialsGrant.tokenRequest()
 *     .scope("read write")
 *     .build());
 * if (response.isError()) {
 *     // RFC 6749 section 5.2 error, see response.getError()
 * }
 * }</pre>
 *
 * <p>
 * Unless configured otherwise, clients use a {@link HttpClientTokenEndpointTransport}
 * with default settings and the {@link OAuth2JsonMapper} found on the classpath.
 */
public interface OAuth2Client {

	/**
	 * Start building a synchronous client.
	 * @param config the client configuration
	 * @return a new builder
	 */
	static SyncSpec sync(OAuth2ClientConfig config) {
		return new SyncSpec(config);
	}

	/**
	 * Start building an asynchronous client.
	 * @param config the client configuration
	 * @return a new builder
	 */
	static AsyncSpec async(OAuth2ClientConfig config) {
		return new AsyncSpec(config);
	}

	/**
	 * Builder for a synchronous client.
	 */
	class SyncSpec {

		private final AsyncSpec delegate;

		private SyncSpec(OAuth2ClientConfig config) {
			this.delegate = new AsyncSpec(config);
		}

		/**
		 * Sets the transport used for token endpoint exchanges.
		 * @param transport the transport
		 * @return this builder
		 */
		public SyncSpec transport(TokenEndpointTransport transport) {
			this.delegate.transport(transport);
			return this;
		}

		/**
		 * Sets the JSON mapper used to decode token endpoint responses.
		 * @param jsonMapper the JSON mapper
		 * @return this builder
		 */
		public SyncSpec jsonMapper(OAuth2JsonMapper jsonMapper) {
			this.delegate.jsonMapper(jsonMapper);
			return this;
		}

		public OAuth2SyncClient build() {
			return new OAuth2SyncClient(this.delegate.build());
		}

	}

	/**
	 * Builder for an asynchronous client.
	 */
	class AsyncSpec {

		private final OAuth2ClientConfig config;

		private TokenEndpointTransport transport;

		private OAuth2JsonMapper jsonMapper;

		private AsyncSpec(OAuth2ClientConfig config) {
			Assert.notNull(config, "config must not be null");
			this.config = config;
		}

		/**
		 * Sets the transport used for token endpoint exchanges.
		 * @param transport the transport
		 * @return this builder
		 */
		public AsyncSpec transport(TokenEndpointTransport transport) {
			Assert.notNull(transport, "transport must not be null");
			this.transport = transport;
			return this;
		}

		/**
		 * Sets the JSON mapper used to decode token endpoint responses.
		 * @param jsonMapper the JSON mapper
		 * @return this builder
		 */
		public AsyncSpec jsonMapper(OAuth2JsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public OAuth2AsyncClient build() {
			return new OAuth2AsyncClient(this.config,
					this.transport != null ? this.transport : HttpClientTokenEndpointTransport.builder().build(),
					this.jsonMapper != null ? this.jsonMapper : OAuth2JsonMapper.getDefault());
		}

	}

}
