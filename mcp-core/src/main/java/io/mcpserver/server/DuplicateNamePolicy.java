/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

/**
 * What a registry does when an entity is registered under a name that is already taken.
 */
public enum DuplicateNamePolicy {

	/**
	 * Replace the existing entity in place. It keeps its position in listings.
	 */
	REPLACE,

	/**
	 * Refuse the registration with an {@link IllegalStateException}.
	 */
	REJECT

}
