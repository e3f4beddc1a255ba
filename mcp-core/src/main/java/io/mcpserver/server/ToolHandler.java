/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.cancellation.CancellationToken;

/**
 * Host code behind a tool. The result is returned to the peer as is when it is a map
 * carrying {@code content}; anything else is rendered as a single text content item.
 */
@FunctionalInterface
public interface ToolHandler {

	/**
	 * @param arguments validated arguments
	 * @param token signals that the peer cancelled the call
	 * @return the tool result
	 * @throws Exception on failure; reported to the peer as an internal error
	 */
	Object call(Map<String, Object> arguments, CancellationToken token) throws Exception;

}
