/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.client.transport;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.oauth2client.util.Assert;
import io.oauth2client.util.FormUrlEncoding;

/**
 * A token endpoint {@code POST}, ready to be sent.
 *
 * @param uri the token endpoint, query string included
 * @param headers request headers, {@code Accept} and {@code Authorization} among them
 * @param form the form parameters of the body, in order, without {@code null} values
 */
public record TokenEndpointRequest(URI uri, Map<String, String> headers, Map<String, String> form) {

	public TokenEndpointRequest {
		Assert.notNull(uri, "uri must not be null");
		Assert.notNull(headers, "headers must not be null");
		Assert.notNull(form, "form must not be null");
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
		form = Collections.unmodifiableMap(new LinkedHashMap<>(form));
	}

	/**
	 * The body, encoded as {@code application/x-www-form-urlencoded}.
	 * @return the encoded body
	 */
	public String encodedBody() {
		return FormUrlEncoding.encode(this.form);
	}

	@Override
	public String toString() {
		// headers and form carry credentials
		return "TokenEndpointRequest[uri=" + this.uri + ", headers=" + this.headers.keySet() + ", form="
				+ this.form.keySet() + "]";
	}

}
