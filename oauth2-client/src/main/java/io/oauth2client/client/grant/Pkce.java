/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.grant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import io.oauth2client.spec.OAuth2Parameters;
import io.oauth2client.util.Assert;

/**
 * Proof Key for Code Exchange (RFC 7636) verifier and {@code S256} challenge.
 *
 * <p>
 * Generate one per authorization request, send the challenge with
 * {@link AuthorizationCodeGrant.AuthorizationRequestBuilder#pkce(Pkce)} and the verifier
 * with {@link AuthorizationCodeGrant.TokenRequestBuilder#pkce(Pkce)}.
 */
public final class Pkce {

	public static final String METHOD_S256 = "S256";

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final String ALLOWED_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";

	private static final Pattern VERIFIER_PATTERN = Pattern.compile("[A-Za-z0-9\\-._~]{43,128}");

	private static final int VERIFIER_LENGTH = 128;

	private final String codeVerifier;

	private final String codeChallenge;

	private Pkce(String codeVerifier) {
		this.codeVerifier = codeVerifier;
		this.codeChallenge = challengeOf(codeVerifier);
	}

	/**
	 * Generates a cryptographically random code verifier and its challenge.
	 * @return a new pair
	 */
	public static Pkce generate() {
		StringBuilder codeVerifier = new StringBuilder(VERIFIER_LENGTH);
		for (int i = 0; i < VERIFIER_LENGTH; i++) {
			codeVerifier.append(ALLOWED_CHARS.charAt(secureRandom.nextInt(ALLOWED_CHARS.length())));
		}
		return new Pkce(codeVerifier.toString());
	}

	/**
	 * Restores a pair from a verifier kept across the redirect.
	 * @param codeVerifier 43 to 128 unreserved characters
	 * @return the pair
	 * @throws IllegalArgumentException if the verifier is malformed
	 */
	public static Pkce of(String codeVerifier) {
		Assert.notNull(codeVerifier, "codeVerifier must not be null");
		if (!VERIFIER_PATTERN.matcher(codeVerifier).matches()) {
			throw new IllegalArgumentException("codeVerifier must be 43 to 128 unreserved characters");
		}
		return new Pkce(codeVerifier);
	}

	public String getCodeVerifier() {
		return this.codeVerifier;
	}

	public String getCodeChallenge() {
		return this.codeChallenge;
	}

	public String getCodeChallengeMethod() {
		return METHOD_S256;
	}

	Map<String, String> authorizationParameters() {
		Map<String, String> params = new LinkedHashMap<>();
		params.put(OAuth2Parameters.CODE_CHALLENGE, this.codeChallenge);
		params.put(OAuth2Parameters.CODE_CHALLENGE_METHOD, METHOD_S256);
		return params;
	}

	Map<String, String> tokenParameters() {
		return Map.of(OAuth2Parameters.CODE_VERIFIER, this.codeVerifier);
	}

	private static String challengeOf(String codeVerifier) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	@Override
	public String toString() {
		return "Pkce[codeChallenge=" + this.codeChallenge + ", codeChallengeMethod=" + METHOD_S256 + "]";
	}

}
