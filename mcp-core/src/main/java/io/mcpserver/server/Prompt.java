/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A registered prompt template.
 *
 * @param name unique prompt name
 * @param description optional human readable description
 * @param schema schema of the prompt arguments
 * @param handler renders the prompt on {@code prompts/get}
 */
public record Prompt(String name, @Nullable String description, ArgumentSchema schema,
		PromptHandler handler) implements RegisteredEntity {

	public Prompt {
		Assert.hasText(name, "Prompt name must not be empty");
		Assert.notNull(schema, "Prompt schema must not be null");
		Assert.notNull(handler, "Prompt handler must not be null");
	}

	/**
	 * Announces {@code arguments} as an object schema with its properties and required
	 * names.
	 */
	@Override
	public Map<String, Object> toMetadata() {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("name", this.name);
		if (this.description != null) {
			metadata.put("description", this.description);
		}
		Map<String, Object> arguments = new LinkedHashMap<>();
		arguments.put("type", "object");
		Map<String, Object> properties = new LinkedHashMap<>();
		this.schema.properties().forEach((property, constraint) -> properties.put(property, constraint.toMap()));
		arguments.put("properties", properties);
		arguments.put("required", List.copyOf(this.schema.required()));
		metadata.put("arguments", arguments);
		return metadata;
	}

}
