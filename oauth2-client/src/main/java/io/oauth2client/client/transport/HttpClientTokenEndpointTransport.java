/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oauth2client.util.Assert;
import io.oauth2client.util.Utils;
import reactor.core.publisher.Mono;

/**
 * {@link TokenEndpointTransport} implementation using Java's {@link HttpClient}.
 * <p>
 * The request is sent lazily on subscription, and cancelling the subscription cancels
 * the in-flight exchange. Connect and request timeouts are configured here; the client
 * on top never applies its own.
 */
public class HttpClientTokenEndpointTransport implements TokenEndpointTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientTokenEndpointTransport.class);

	private static final String CONTENT_TYPE = "Content-Type";

	private static final String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

	/** HTTP client used for all token endpoint exchanges */
	private final HttpClient httpClient;

	/** Request builder template, copied for every exchange */
	private final HttpRequest.Builder requestBuilder;

	/** Customizer applied to every request before it is sent */
	private final TokenEndpointRequestCustomizer requestCustomizer;

	HttpClientTokenEndpointTransport(HttpClient httpClient, HttpRequest.Builder requestBuilder,
			TokenEndpointRequestCustomizer requestCustomizer) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(requestBuilder, "requestBuilder must not be null");
		Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
		this.httpClient = httpClient;
		this.requestBuilder = requestBuilder;
		this.requestCustomizer = requestCustomizer;
	}

	/**
	 * Creates a new builder for {@link HttpClientTokenEndpointTransport}.
	 * @return a new builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Mono<TokenEndpointResponse> exchange(TokenEndpointRequest request) {
		return Mono.fromCallable(() -> buildHttpRequest(request))
			.flatMap(httpRequest -> Mono
				.fromFuture(() -> this.httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())))
			.map(response -> new TokenEndpointResponse(response.statusCode(), response.body()))
			.doOnNext(response -> logger.debug("Token endpoint {} answered with HTTP {}",
					Utils.withoutQuery(request.uri()), response.statusCode()));
	}

	private HttpRequest buildHttpRequest(TokenEndpointRequest request) {
		HttpRequest.Builder builder = this.requestBuilder.copy()
			.uri(request.uri())
			.header(CONTENT_TYPE, APPLICATION_FORM_URLENCODED)
			.POST(HttpRequest.BodyPublishers.ofString(request.encodedBody()));
		request.headers().forEach(builder::header);
		this.requestCustomizer.customize(builder, request);
		return builder.build();
	}

	/**
	 * Builder for {@link HttpClientTokenEndpointTransport}.
	 */
	public static class Builder {

		private HttpClient externalHttpClient;

		private HttpRequest.Builder requestBuilder = HttpRequest.newBuilder();

		private TokenEndpointRequestCustomizer requestCustomizer = TokenEndpointRequestCustomizer.NOOP;

		private Duration connectTimeout = Duration.ofSeconds(10);

		private Duration requestTimeout;

		private HttpClient.Redirect followRedirects = HttpClient.Redirect.NEVER;

		private Builder() {
		}

		/**
		 * Uses the given {@link HttpClient} instead of creating one. Connect timeout and
		 * redirect policy settings of this builder are ignored in that case.
		 * @param httpClient the HTTP client to use
		 * @return this builder
		 */
		public Builder withExternalHttpClient(HttpClient httpClient) {
			Assert.notNull(httpClient, "httpClient must not be null");
			this.externalHttpClient = httpClient;
			return this;
		}

		/**
		 * Sets the HTTP request builder template.
		 * @param requestBuilder the HTTP request builder
		 * @return this builder
		 */
		public Builder requestBuilder(HttpRequest.Builder requestBuilder) {
			Assert.notNull(requestBuilder, "requestBuilder must not be null");
			this.requestBuilder = requestBuilder;
			return this;
		}

		/**
		 * Sets a customizer applied to each request right before it is sent.
		 * @param requestCustomizer the request customizer
		 * @return this builder
		 */
		public Builder requestCustomizer(TokenEndpointRequestCustomizer requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			this.requestCustomizer = requestCustomizer;
			return this;
		}

		/**
		 * Sets the connection timeout of the internally created HTTP client.
		 * @param connectTimeout the connection timeout
		 * @return this builder
		 */
		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.connectTimeout = connectTimeout;
			return this;
		}

		/**
		 * Sets a timeout for each token endpoint exchange. No timeout by default.
		 * @param requestTimeout the request timeout
		 * @return this builder
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * Sets the redirect policy of the internally created HTTP client. Redirects are
		 * not followed by default.
		 * @param followRedirects the redirect policy
		 * @return this builder
		 */
		public Builder followRedirects(HttpClient.Redirect followRedirects) {
			Assert.notNull(followRedirects, "followRedirects must not be null");
			this.followRedirects = followRedirects;
			return this;
		}

		/**
		 * Builds a new {@link HttpClientTokenEndpointTransport} instance.
		 * @return a new transport instance
		 */
		public HttpClientTokenEndpointTransport build() {
			HttpClient httpClient = this.externalHttpClient;
			if (httpClient == null) {
				httpClient = HttpClient.newBuilder()
					.version(HttpClient.Version.HTTP_1_1)
					.connectTimeout(this.connectTimeout)
					.followRedirects(this.followRedirects)
					.build();
			}
			HttpRequest.Builder template = this.requestBuilder.copy();
			if (this.requestTimeout != null) {
				template.timeout(this.requestTimeout);
			}
			return new HttpClientTokenEndpointTransport(httpClient, template, this.requestCustomizer);
		}

	}

}
