/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.util;

import java.net.URI;
import java.util.Collection;
import java.util.Map;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Check whether the given {@code String} is neither {@code null} nor of length 0.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null} and has length
	 */
	public static boolean hasLength(String str) {
		return (str != null && !str.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Appends an already encoded query string to an endpoint. Uses {@code &} when the
	 * endpoint already carries a {@code ?}, and {@code ?} otherwise.
	 * @param endpoint the endpoint URL
	 * @param query the encoded query string, may be empty
	 * @return the endpoint with the query appended
	 */
	public static String appendQuery(String endpoint, String query) {
		if (!hasLength(query)) {
			return endpoint;
		}
		String separator = endpoint.indexOf('?') >= 0 ? "&" : "?";
		return endpoint + separator + query;
	}

	/**
	 * Renders a URI without its query and fragment, for logging. Query values may carry
	 * provider credentials.
	 * @param uri the URI
	 * @return the URI up to its path
	 */
	public static String withoutQuery(URI uri) {
		String value = uri.toString();
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '?' || c == '#') {
				return value.substring(0, i);
			}
		}
		return value;
	}

}
