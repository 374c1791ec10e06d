/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.spec;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationResponsesTests {

	@Test
	void matchingStateReturnsParameters() {
		Map<String, List<String>> params = AuthorizationResponses.validateAuthorization("state=xyz&code=abc", "xyz");

		assertThat(params).containsEntry("state", List.of("xyz")).containsEntry("code", List.of("abc"));
	}

	@Test
	void mismatchingStateIsRejected() {
		assertThatThrownBy(() -> AuthorizationResponses.validateAuthorization("state=xyz", "wrong"))
			.isInstanceOf(OAuth2Exception.class)
			.isInstanceOfSatisfying(StateMismatchException.class, ex -> {
				assertThat(ex.getExpectedState()).isEqualTo("wrong");
				assertThat(ex.getActualState()).isEqualTo("xyz");
			});
	}

	@Test
	void missingStateIsRejectedWhenOneIsExpected() {
		assertThatThrownBy(() -> AuthorizationResponses.validateAuthorization("code=abc", "xyz"))
			.isInstanceOf(StateMismatchException.class);
	}

	@Test
	void unexpectedStateIsRejected() {
		assertThatThrownBy(() -> AuthorizationResponses.validateAuthorization("code=abc&state=xyz", null))
			.isInstanceOf(StateMismatchException.class);
	}

	@Test
	void absentStateOnBothSidesIsAccepted() {
		assertThat(AuthorizationResponses.validateAuthorization("code=abc", null)).containsOnlyKeys("code");
	}

	@Test
	void emptyStateCountsAsAbsent() {
		assertThat(AuthorizationResponses.validateAuthorization("code=abc&state=", null)).containsOnlyKeys("code");
	}

	@Test
	void redirectFragmentIsAccepted() {
		Map<String, List<String>> params = AuthorizationResponses
			.validateAuthorization("#access_token=2YotnFZFEjr1zCsicMWpAA&token_type=example&state=xyz", "xyz");

		assertThat(params.get("access_token")).containsExactly("2YotnFZFEjr1zCsicMWpAA");
	}

	@Test
	void onlyFirstStateValueIsCompared() {
		assertThat(AuthorizationResponses.validateAuthorization("state=xyz&state=other", "xyz")).containsKey("state");
	}

	@Test
	void preParsedParametersAreReturnedAsIs() {
		Map<String, String> params = new HashMap<>();
		params.put("state", "xyz");
		params.put("code", "abc");

		assertThat(AuthorizationResponses.validateAuthorization(params, "xyz")).isSameAs(params);
	}

	@Test
	void preParsedArrayValues() {
		Map<String, String[]> params = Map.of("state", new String[] { "xyz", "ignored" });

		assertThat(AuthorizationResponses.validateAuthorization(params, "xyz")).isSameAs(params);
		assertThatThrownBy(() -> AuthorizationResponses.validateAuthorization(params, "ignored"))
			.isInstanceOf(StateMismatchException.class);
	}

}
