/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpserver.json.McpJsonMapper;

/**
 * Jackson based implementation of {@link McpJsonMapper}.
 */
public final class JacksonMcpJsonMapper implements McpJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonMcpJsonMapper instance.
	 * @param objectMapper the ObjectMapper to be used for JSON serialization. Must not be
	 * null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null.
	 */
	public JacksonMcpJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

}
