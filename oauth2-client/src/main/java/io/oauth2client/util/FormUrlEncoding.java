/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.util;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code application/x-www-form-urlencoded} serialization, used both for query strings
 * and token request bodies (RFC 6749 Appendix B).
 */
public final class FormUrlEncoding {

	private FormUrlEncoding() {
	}

	/**
	 * Encodes parameters in iteration order. Entries with a {@code null} value are
	 * skipped.
	 * @param params the parameters
	 * @return the encoded form, empty when nothing is left to encode
	 */
	public static String encode(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			if (result.length() > 0) {
				result.append('&');
			}
			result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
			result.append('=');
			result.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return result.toString();
	}

	/**
	 * Parses an encoded form into a multi-valued map. Pairs with a blank value are
	 * dropped, and a single leading {@code ?} or {@code #} is ignored so that raw query
	 * and fragment components can be passed as-is.
	 * @param form the encoded form
	 * @return the decoded parameters, in order of first appearance
	 * @throws IllegalArgumentException if a pair holds an illegal percent escape
	 */
	public static Map<String, List<String>> decode(String form) {
		Map<String, List<String>> params = new LinkedHashMap<>();
		if (!Utils.hasLength(form)) {
			return params;
		}
		String content = form;
		if (content.charAt(0) == '?' || content.charAt(0) == '#') {
			content = content.substring(1);
		}
		for (String pair : content.split("&")) {
			int idx = pair.indexOf('=');
			if (idx < 0 || idx == pair.length() - 1) {
				continue;
			}
			String name = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
			String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
			params.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
		}
		return params;
	}

}
