/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Renders handler results as JSON text so the server core does not depend on a specific
 * JSON library. The Jackson backed implementation lives in the {@code mcp-json-jackson2}
 * module.
 */
public interface McpJsonMapper {

	/**
	 * Serialize an object to a JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Resolves the default {@link McpJsonMapper}.
	 * @return The default {@link McpJsonMapper}
	 * @throws IllegalStateException If no {@link McpJsonMapper} implementation exists on
	 * the classpath.
	 */
	static McpJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(McpJsonMapperSupplier.class).stream().flatMap(p -> {
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
			else {
				return new IllegalStateException("No default McpJsonMapper implementation found");
			}
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default McpJsonMapper", toAdd);
			}
			else {
				existing.addSuppressed(toAdd);
				return existing;
			}
		});
	}

}
