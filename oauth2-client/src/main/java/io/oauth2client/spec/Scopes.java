/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.spec;

import java.util.Collection;

import io.oauth2client.util.Assert;

/**
 * Scope normalization. A scope is sent as a space-delimited, case-sensitive string (RFC
 * 6749 section 3.3). Scope strings are sent unchanged, including the empty string, which
 * some providers read as a request for the default scope.
 */
public final class Scopes {

	private Scopes() {
	}

	/**
	 * Joins scope tokens with a single space, in iteration order.
	 * @param scopes the scope tokens
	 * @return the scope string, or {@code null} for an empty or {@code null} collection so
	 * that the parameter is omitted
	 */
	public static String normalize(Collection<String> scopes) {
		if (scopes == null || scopes.isEmpty()) {
			return null;
		}
		Assert.noNullElements(scopes, "scope tokens must not be null");
		return String.join(" ", scopes);
	}

}
