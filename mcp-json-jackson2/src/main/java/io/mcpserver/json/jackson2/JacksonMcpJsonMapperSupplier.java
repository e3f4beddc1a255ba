/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.json.jackson2;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.mcpserver.json.McpJsonMapper;
import io.mcpserver.json.McpJsonMapperSupplier;

/**
 * A supplier of {@link McpJsonMapper} instances that uses the Jackson library for JSON
 * serialization.
 * <p>
 * The mapper does not call {@code setAccessible()} on constructors or fields, so it
 * works without {@code --add-opens} flags, and it keeps map entries in insertion order
 * so rendered results mirror the order handlers produced them in.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createMapper());
	}

	static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
