/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.spec;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.oauth2client.util.Assert;
import io.oauth2client.util.FormUrlEncoding;

/**
 * Checks the parameters an authorization server redirects back with (RFC 6749 sections
 * 4.1.2 and 4.2.2).
 * <p>
 * Only {@code state} is examined. Everything else, {@code code}, {@code access_token} or
 * an {@code error}, is handed back to the caller untouched.
 * <p>
 * A response without {@code state} matches an expected state of {@code null}. Callers
 * that did send a state must pass it here, otherwise no check takes place.
 */
public final class AuthorizationResponses {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizationResponses.class);

	private AuthorizationResponses() {
	}

	/**
	 * Parses a raw query or fragment component and checks its {@code state}.
	 * @param queryOrFragment the encoded component, with or without its leading
	 * {@code ?} or {@code #}
	 * @param expectedState the state sent with the authorization request, or
	 * {@code null} if none was sent
	 * @return the parsed parameters, every key mapping to all of its values
	 * @throws StateMismatchException if the returned state differs from the expected one
	 */
	public static Map<String, List<String>> validateAuthorization(String queryOrFragment, String expectedState) {
		Assert.notNull(queryOrFragment, "queryOrFragment must not be null");
		return validateAuthorization(FormUrlEncoding.decode(queryOrFragment), expectedState);
	}

	/**
	 * Checks the {@code state} of already parsed redirect parameters. Values may be
	 * single strings or collections of strings, in which case the first one is compared.
	 * @param params the redirect parameters
	 * @param expectedState the state sent with the authorization request, or
	 * {@code null} if none was sent
	 * @param <M> the map type, returned as-is
	 * @return {@code params}, unchanged
	 * @throws StateMismatchException if the returned state differs from the expected one
	 */
	public static <M extends Map<String, ?>> M validateAuthorization(M params, String expectedState) {
		Assert.notNull(params, "params must not be null");
		String actualState = firstValue(params.get(OAuth2Parameters.STATE));
		if (!Objects.equals(actualState, expectedState)) {
			logger.warn("Authorization response state does not match the expected state");
			throw new StateMismatchException(expectedState, actualState);
		}
		return params;
	}

	private static String firstValue(Object value) {
		if (value instanceof Collection) {
			Collection<?> values = (Collection<?>) value;
			return values.isEmpty() ? null : firstValue(values.iterator().next());
		}
		if (value instanceof String[]) {
			String[] values = (String[]) value;
			return values.length == 0 ? null : values[0];
		}
		return value != null ? value.toString() : null;
	}

}
