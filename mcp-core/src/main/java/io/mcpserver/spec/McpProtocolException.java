/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.spec;

import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Raised when a peer asks for a protocol version this server cannot speak.
 */
public class McpProtocolException extends McpError {

	@Nullable
	private final String requestedVersion;

	public McpProtocolException(@Nullable String requestedVersion) {
		super(ErrorKind.PROTOCOL, "Unsupported protocol version: " + requestedVersion, data(requestedVersion), null);
		this.requestedVersion = requestedVersion;
	}

	private static Map<String, Object> data(@Nullable String requestedVersion) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("supported", McpSchema.ProtocolVersions.SUPPORTED);
		data.put("requested", requestedVersion);
		return data;
	}

	@Nullable
	public String getRequestedVersion() {
		return this.requestedVersion;
	}

}
