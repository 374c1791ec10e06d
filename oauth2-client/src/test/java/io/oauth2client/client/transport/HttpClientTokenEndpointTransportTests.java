/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HttpClientTokenEndpointTransport} against a local HTTP server.
 */
class HttpClientTokenEndpointTransportTests {

	private HttpServer server;

	private URI tokenUri;

	private final AtomicReference<String> lastMethod = new AtomicReference<>();

	private final AtomicReference<Headers> lastHeaders = new AtomicReference<>();

	private final AtomicReference<String> lastBody = new AtomicReference<>();

	private volatile int responseStatus = 200;

	private volatile String responseBody = "{\"access_token\":\"at\"}";

	@BeforeEach
	void startServer() throws IOException {
		this.server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		this.server.createContext("/token", exchange -> {
			this.lastMethod.set(exchange.getRequestMethod());
			this.lastHeaders.set(exchange.getRequestHeaders());
			this.lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			byte[] bytes = this.responseBody.getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(this.responseStatus, bytes.length);
			try (OutputStream os = exchange.getResponseBody()) {
				os.write(bytes);
			}
		});
		this.server.start();
		this.tokenUri = URI.create("http://localhost:" + this.server.getAddress().getPort() + "/token");
	}

	@AfterEach
	void stopServer() {
		if (this.server != null) {
			this.server.stop(0);
		}
	}

	private TokenEndpointRequest request() {
		Map<String, String> form = new LinkedHashMap<>();
		form.put("client_id", "client-1");
		form.put("grant_type", "client_credentials");
		form.put("scope", "read write");
		return new TokenEndpointRequest(this.tokenUri, Map.of("Accept", "application/json"), form);
	}

	@Test
	void postsFormEncodedBody() {
		HttpClientTokenEndpointTransport transport = HttpClientTokenEndpointTransport.builder().build();

		StepVerifier.create(transport.exchange(request())).assertNext(response -> {
			assertThat(response.statusCode()).isEqualTo(200);
			assertThat(response.body()).isEqualTo("{\"access_token\":\"at\"}");
		}).verifyComplete();

		assertThat(this.lastMethod.get()).isEqualTo("POST");
		assertThat(this.lastBody.get()).isEqualTo("client_id=client-1&grant_type=client_credentials&scope=read+write");
		assertThat(this.lastHeaders.get().getFirst("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
		assertThat(this.lastHeaders.get().getFirst("Accept")).isEqualTo("application/json");
	}

	@Test
	void errorStatusesAreReturnedAsResponses() {
		this.responseStatus = 503;
		this.responseBody = "maintenance";
		HttpClientTokenEndpointTransport transport = HttpClientTokenEndpointTransport.builder().build();

		StepVerifier.create(transport.exchange(request()))
			.expectNext(new TokenEndpointResponse(503, "maintenance"))
			.verifyComplete();
	}

	@Test
	void customizerIsAppliedToEveryRequest() {
		HttpClientTokenEndpointTransport transport = HttpClientTokenEndpointTransport.builder()
			.requestCustomizer((builder, request) -> builder.header("X-Grant", request.form().get("grant_type")))
			.build();

		transport.exchange(request()).block();

		assertThat(this.lastHeaders.get().getFirst("X-Grant")).isEqualTo("client_credentials");
	}

	@Test
	void requestBuilderTemplateHeadersAreSent() {
		HttpClientTokenEndpointTransport transport = HttpClientTokenEndpointTransport.builder()
			.requestBuilder(HttpRequest.newBuilder().header("User-Agent", "oauth2-client-test"))
			.requestTimeout(Duration.ofSeconds(5))
			.build();

		transport.exchange(request()).block();
		transport.exchange(request()).block();

		assertThat(this.lastHeaders.get().get("User-Agent")).containsExactly("oauth2-client-test");
	}

	@Test
	void connectionFailureIsSignalled() {
		this.server.stop(0);
		this.server = null;
		HttpClientTokenEndpointTransport transport = HttpClientTokenEndpointTransport.builder()
			.connectTimeout(Duration.ofSeconds(2))
			.build();

		StepVerifier.create(transport.exchange(request())).expectError().verify(Duration.ofSeconds(10));
	}

	@Test
	void builderRejectsNullArguments() {
		assertThatThrownBy(() -> HttpClientTokenEndpointTransport.builder().requestCustomizer(null))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> HttpClientTokenEndpointTransport.builder().withExternalHttpClient(null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void requestToStringHidesFormValues() {
		assertThat(request().toString()).contains("client_id").doesNotContain("client-1");
	}

}
