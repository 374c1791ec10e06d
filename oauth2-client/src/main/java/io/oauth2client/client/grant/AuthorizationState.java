/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates {@code state} values for authorization requests (RFC 6749 section 10.12).
 */
public final class AuthorizationState {

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final int STATE_BYTES = 32;

	private AuthorizationState() {
	}

	/**
	 * Returns a new unguessable, URL-safe state value.
	 * @return the state
	 */
	public static String generate() {
		byte[] stateBytes = new byte[STATE_BYTES];
		secureRandom.nextBytes(stateBytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);
	}

}
