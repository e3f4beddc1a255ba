/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import io.mcpserver.spec.ErrorKind;
import io.mcpserver.spec.McpError;
import reactor.util.annotation.Nullable;

/**
 * Raised by an operation that observed a cancelled {@link CancellationToken}.
 */
public class McpCancellationException extends McpError {

	@Nullable
	private final String reason;

	private final transient CancellationToken token;

	public McpCancellationException(@Nullable String reason, CancellationToken token) {
		super(ErrorKind.CANCELLED, reason != null ? "Operation cancelled: " + reason : "Operation cancelled");
		this.reason = reason;
		this.token = token;
	}

	@Nullable
	public String getReason() {
		return this.reason;
	}

	public CancellationToken getToken() {
		return this.token;
	}

}
