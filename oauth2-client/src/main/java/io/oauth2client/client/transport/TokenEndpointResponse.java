/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

/**
 * Raw token endpoint response.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, possibly empty
 */
public record TokenEndpointResponse(int statusCode, String body) {

}
