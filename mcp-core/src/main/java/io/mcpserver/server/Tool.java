/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.LinkedHashMap;
import java.util.Map;

import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A registered tool.
 *
 * @param name unique tool name
 * @param description optional human readable description
 * @param schema schema of the call arguments, announced as {@code inputSchema}
 * @param handler the code run on {@code tools/call}
 */
public record Tool(String name, @Nullable String description, ArgumentSchema schema,
		ToolHandler handler) implements RegisteredEntity {

	public Tool {
		Assert.hasText(name, "Tool name must not be empty");
		Assert.notNull(schema, "Tool schema must not be null");
		Assert.notNull(handler, "Tool handler must not be null");
	}

	@Override
	public Map<String, Object> toMetadata() {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("name", this.name);
		if (this.description != null) {
			metadata.put("description", this.description);
		}
		metadata.put("inputSchema", this.schema.toMap());
		return metadata;
	}

}
