/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Abstraction for JSON deserialization of token endpoint responses, decoupling the client
 * from any specific JSON library. A Jackson backed implementation is provided by the
 * {@code oauth2-json-jackson2} module.
 */
public interface OAuth2JsonMapper {

	/**
	 * Deserialize JSON string into a parameterized target type.
	 * @param content JSON as String
	 * @param type parameterized type reference
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Resolves the default {@link OAuth2JsonMapper} from the first
	 * {@link OAuth2JsonMapperSupplier} found on the classpath.
	 * @return The default {@link OAuth2JsonMapper}
	 * @throws IllegalStateException If no {@link OAuth2JsonMapper} implementation exists
	 * on the classpath.
	 */
	static OAuth2JsonMapper getDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(OAuth2JsonMapperSupplier.class).stream().flatMap(p -> {
			try {
				return Stream.ofNullable(p.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).flatMap(supplier -> {
			try {
				return Stream.of(supplier.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			return new IllegalStateException("No default OAuth2JsonMapper implementation found");
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default OAuth2JsonMapper", toAdd);
			}
			existing.addSuppressed(toAdd);
			return existing;
		});
	}

}
