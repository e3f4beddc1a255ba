/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

/**
 * How a {@link ToolRegistry} treats tool names outside the recommended character set.
 *
 * @see io.mcpserver.util.ToolNameValidator
 */
public enum ToolNamePolicy {

	/**
	 * Any non-empty name is registered unchecked. The default.
	 */
	ACCEPT,

	/**
	 * Names are checked and violations are logged, the tool is registered anyway.
	 */
	WARN,

	/**
	 * Names are checked and a violation fails the registration with
	 * {@link IllegalArgumentException}.
	 */
	STRICT

}
