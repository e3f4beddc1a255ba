/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.schema.ArgumentSchema;

/**
 * A named tool, resource or prompt held by a registry.
 */
public interface RegisteredEntity {

	/**
	 * @return the registry key
	 */
	String name();

	/**
	 * @return the schema invocation arguments are validated against
	 */
	ArgumentSchema schema();

	/**
	 * @return the entry announced to peers in list results
	 */
	Map<String, Object> toMetadata();

}
