/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.spec.McpSchema.JSONRPCError;
import io.mcpserver.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Outcome of dispatching one request: either a result map or an error. The transport
 * wraps it in the protocol's response envelope.
 *
 * @param result the success result, {@code null} on error
 * @param error the error, {@code null} on success
 */
public record McpResponse(@Nullable Map<String, Object> result, @Nullable JSONRPCError error) {

	public McpResponse {
		Assert.isTrue((result == null) != (error == null), "Exactly one of result and error must be set");
	}

	public static McpResponse success(Map<String, Object> result) {
		return new McpResponse(result, null);
	}

	public static McpResponse failure(JSONRPCError error) {
		return new McpResponse(null, error);
	}

	public boolean isError() {
		return this.error != null;
	}

}
