/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.oauth2client.json;

import java.util.function.Supplier;

/**
 * Service provider interface for {@link OAuth2JsonMapper} implementations. Registered
 * through {@code META-INF/services/io.oauth2client.json.OAuth2JsonMapperSupplier}.
 */
public interface OAuth2JsonMapperSupplier extends Supplier<OAuth2JsonMapper> {

}
