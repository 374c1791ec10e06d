/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oauth2client.client.grant.RefreshTokenGrant;
import io.oauth2client.client.transport.TokenEndpointRequest;
import io.oauth2client.client.transport.TokenEndpointResponse;
import io.oauth2client.client.transport.TokenEndpointTransport;
import io.oauth2client.json.OAuth2JsonMapper;
import io.oauth2client.json.TypeRef;
import io.oauth2client.spec.AuthorizationRequest;
import io.oauth2client.spec.OAuth2ConfigurationException;
import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.spec.OAuth2ResponseParseException;
import io.oauth2client.spec.OAuth2ServerException;
import io.oauth2client.spec.TokenRequest;
import io.oauth2client.spec.TokenResponse;
import io.oauth2client.util.Assert;
import io.oauth2client.util.FormUrlEncoding;
import io.oauth2client.util.Utils;
import reactor.core.publisher.Mono;

/**
 * The OAuth 2.0 client (RFC 6749) providing non-blocking operations.
 *
 * <p>
 * This client builds authorization URLs and performs token endpoint requests for every
 * grant type through the same two primitives:
 * <ul>
 * <li>{@link #authorizationUrl(AuthorizationRequest)} assembles the URL the resource
 * owner is sent to
 * <li>{@link #requestToken(TokenRequest)} merges the request with the configured
 * {@code client_id} and default body, picks the client authentication method and
 * {@code POST}s to the token endpoint
 * </ul>
 * Grant-specific requests are built with the grant type classes in
 * {@link io.oauth2client.client.grant}.
 *
 * <p>
 * Protocol errors are data: any response below 500 is decoded and emitted as a
 * {@link TokenResponse}, including {@code 400} responses holding an {@code error}
 * member. Only a 5xx status is signalled as an {@link OAuth2ServerException}, which the
 * caller may retry. The client keeps no state beyond its configuration and is safe to
 * share across threads.
 *
 * @see OAuth2Client
 * @see OAuth2SyncClient
 */
public class OAuth2AsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(OAuth2AsyncClient.class);

	private static final TypeRef<Map<String, Object>> RESPONSE_TYPE_REF = new TypeRef<>() {
	};

	private static final String ACCEPT = "Accept";

	private static final String AUTHORIZATION = "Authorization";

	private static final String APPLICATION_JSON = "application/json";

	private final OAuth2ClientConfig config;

	private final TokenEndpointTransport transport;

	private final OAuth2JsonMapper jsonMapper;

	OAuth2AsyncClient(OAuth2ClientConfig config, TokenEndpointTransport transport, OAuth2JsonMapper jsonMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.config = config;
		this.transport = transport;
		this.jsonMapper = jsonMapper;
	}

	public OAuth2ClientConfig getConfig() {
		return this.config;
	}

	/**
	 * Builds the URL to send the resource owner to, RFC 6749 sections 4.1.1 and 4.2.1.
	 * <p>
	 * {@code client_id} and {@code response_type} come first, followed by the request
	 * parameters. Parameters whose value is {@code null} are left out, so a {@code null}
	 * request parameter also removes a base parameter of the same name. The query is
	 * appended with {@code &} if the endpoint already has one, with {@code ?} otherwise.
	 * No network I/O takes place.
	 * @param request the authorization request
	 * @return the authorization URL
	 * @throws OAuth2ConfigurationException if no authorization endpoint is configured
	 */
	public String authorizationUrl(AuthorizationRequest request) {
		Assert.notNull(request, "request must not be null");
		String endpoint = this.config.getAuthorizationEndpoint();
		if (endpoint == null) {
			throw new OAuth2ConfigurationException("An authorization endpoint must be configured");
		}
		Map<String, String> params = new LinkedHashMap<>();
		params.put(OAuth2Parameters.CLIENT_ID, this.config.getClientId());
		params.put(OAuth2Parameters.RESPONSE_TYPE, request.getResponseType());
		params.putAll(request.getParameters());
		params.values().removeIf(Objects::isNull);
		return Utils.appendQuery(endpoint, FormUrlEncoding.encode(params));
	}

	/**
	 * Requests a token from the token endpoint.
	 * <p>
	 * The body is {@code client_id} and {@code grant_type}, then the configured default
	 * body, then the request parameters, later values replacing earlier ones. A
	 * {@code null} request parameter keeps the earlier value. When the client has both a
	 * client id and a non-empty secret they are sent with HTTP Basic authentication,
	 * otherwise the body alone carries whatever credentials were configured.
	 * @param request the token request
	 * @return a {@link Mono} emitting the decoded response, error responses included
	 * @see OAuth2ConfigurationException
	 * @see OAuth2ServerException
	 * @see OAuth2ResponseParseException
	 */
	public Mono<TokenResponse> requestToken(TokenRequest request) {
		Assert.notNull(request, "request must not be null");
		return Mono.fromCallable(() -> toEndpointRequest(request))
			.doOnNext(endpointRequest -> logger.debug("Requesting token with grant type '{}' from {} using {}",
					request.getGrantType(), Utils.withoutQuery(endpointRequest.uri()),
					endpointRequest.headers().containsKey(AUTHORIZATION) ? "HTTP Basic authentication"
							: "body credentials"))
			.flatMap(this.transport::exchange)
			.map(this::toTokenResponse);
	}

	/**
	 * Refreshes an access token, RFC 6749 section 6.
	 * @param refreshToken the refresh token
	 * @param scope the requested scope, or {@code null} for the originally granted one
	 * @param parameters extension parameters, may be empty
	 * @return a {@link Mono} emitting the decoded response
	 */
	public Mono<TokenResponse> refreshToken(String refreshToken, String scope, Map<String, String> parameters) {
		return requestToken(
				RefreshTokenGrant.tokenRequest(refreshToken).scope(scope).parameters(parameters).build());
	}

	/**
	 * Refreshes an access token, keeping the originally granted scope.
	 * @param refreshToken the refresh token
	 * @return a {@link Mono} emitting the decoded response
	 */
	public Mono<TokenResponse> refreshToken(String refreshToken) {
		return refreshToken(refreshToken, null, Map.of());
	}

	TokenEndpointRequest toEndpointRequest(TokenRequest request) {
		String endpoint = this.config.getTokenEndpoint();
		if (endpoint == null) {
			throw new OAuth2ConfigurationException("A token endpoint must be configured");
		}

		Map<String, String> form = new LinkedHashMap<>();
		form.put(OAuth2Parameters.CLIENT_ID, this.config.getClientId());
		form.put(OAuth2Parameters.GRANT_TYPE, request.getGrantType());
		form.putAll(this.config.getDefaultBody());
		request.getParameters().forEach((name, value) -> {
			if (value != null) {
				form.put(name, value);
			}
		});
		form.values().removeIf(Objects::isNull);

		Map<String, String> headers = new LinkedHashMap<>();
		headers.put(ACCEPT, APPLICATION_JSON);
		String clientId = this.config.getClientId();
		String clientSecret = this.config.getClientSecret();
		if (Utils.hasLength(clientId) && Utils.hasLength(clientSecret)) {
			headers.put(AUTHORIZATION, basicAuthorization(clientId, clientSecret));
		}

		URI uri = URI.create(Utils.appendQuery(endpoint, FormUrlEncoding.encode(request.getQuery())));
		return new TokenEndpointRequest(uri, headers, form);
	}

	private TokenResponse toTokenResponse(TokenEndpointResponse response) {
		int statusCode = response.statusCode();
		if (statusCode >= 500) {
			logger.warn("Token endpoint returned HTTP {}", statusCode);
			throw new OAuth2ServerException(statusCode, response.body());
		}
		String body = response.body() != null ? response.body() : "";
		Map<String, Object> parameters;
		try {
			parameters = this.jsonMapper.readValue(body, RESPONSE_TYPE_REF);
		}
		catch (IOException e) {
			throw new OAuth2ResponseParseException(statusCode,
					"Token endpoint response (HTTP " + statusCode + ") is not valid JSON", e);
		}
		if (parameters == null) {
			throw new OAuth2ResponseParseException(statusCode,
					"Token endpoint response (HTTP " + statusCode + ") is not a JSON object", null);
		}
		return new TokenResponse(statusCode, parameters);
	}

	private static String basicAuthorization(String username, String password) {
		String credentials = username + ":" + password;
		return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
	}

}
