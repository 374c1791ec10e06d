/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuth2ClientConfigTests {

	@Test
	void builderCopiesValues() {
		Map<String, String> defaults = new LinkedHashMap<>();
		defaults.put("resource", "https://api.example.com");

		OAuth2ClientConfig config = OAuth2ClientConfig.builder("client-1")
			.clientSecret("s3cret")
			.defaultBody(defaults)
			.defaultBodyParameter("audience", "api")
			.authorizationEndpoint("https://as.example.com/authorize")
			.tokenEndpoint("https://as.example.com/token")
			.build();
		defaults.put("late", "ignored");

		assertThat(config.getClientId()).isEqualTo("client-1");
		assertThat(config.getClientSecret()).isEqualTo("s3cret");
		assertThat(config.getDefaultBody()).containsExactly(Map.entry("resource", "https://api.example.com"),
				Map.entry("audience", "api"));
		assertThat(config.getAuthorizationEndpoint()).isEqualTo("https://as.example.com/authorize");
		assertThat(config.getTokenEndpoint()).isEqualTo("https://as.example.com/token");
	}

	@Test
	void endpointsAreOptional() {
		OAuth2ClientConfig config = OAuth2ClientConfig.builder("client-1").build();

		assertThat(config.getAuthorizationEndpoint()).isNull();
		assertThat(config.getTokenEndpoint()).isNull();
		assertThat(config.getClientSecret()).isNull();
		assertThat(config.getDefaultBody()).isEmpty();
	}

	@Test
	void clientIdIsRequired() {
		assertThatThrownBy(() -> OAuth2ClientConfig.builder(" ")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void relativeEndpointsAreRejected() {
		assertThatThrownBy(() -> OAuth2ClientConfig.builder("client-1").tokenEndpoint("/token"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("absolute");
		assertThatThrownBy(() -> OAuth2ClientConfig.builder("client-1").authorizationEndpoint("not a url"))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void defaultBodyIsImmutable() {
		OAuth2ClientConfig config = OAuth2ClientConfig.builder("client-1").defaultBodyParameter("a", "1").build();

		assertThatThrownBy(() -> config.getDefaultBody().put("b", "2"))
			.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void toStringMasksSecret() {
		OAuth2ClientConfig config = OAuth2ClientConfig.builder("client-1").clientSecret("s3cret").build();

		assertThat(config.toString()).contains("client-1").doesNotContain("s3cret");
	}

}
