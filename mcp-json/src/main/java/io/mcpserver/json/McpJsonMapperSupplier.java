/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.json;

import java.util.function.Supplier;

/**
 * Service provider contract for the default {@link McpJsonMapper}. Implementations are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
