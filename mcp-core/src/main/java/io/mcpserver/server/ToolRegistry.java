/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.cancellation.CancellationToken;
import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.schema.SchemaValidator;
import io.mcpserver.spec.NotificationQueue;
import io.mcpserver.util.Assert;
import io.mcpserver.util.ToolNameValidator;
import reactor.util.annotation.Nullable;

/**
 * Registry of the tools a server exposes through {@code tools/list} and
 * {@code tools/call}.
 */
public class ToolRegistry extends AbstractRegistry<Tool> {

	private final ToolNamePolicy namePolicy;

	public ToolRegistry() {
		this(null);
	}

	public ToolRegistry(@Nullable NotificationQueue notificationQueue) {
		this(notificationQueue, SchemaValidator.createDefault(), DuplicateNamePolicy.REPLACE);
	}

	public ToolRegistry(@Nullable NotificationQueue notificationQueue, SchemaValidator validator,
			DuplicateNamePolicy duplicateNamePolicy) {
		this(notificationQueue, validator, duplicateNamePolicy, ToolNamePolicy.ACCEPT);
	}

	public ToolRegistry(@Nullable NotificationQueue notificationQueue, SchemaValidator validator,
			DuplicateNamePolicy duplicateNamePolicy, ToolNamePolicy namePolicy) {
		super(notificationQueue, validator, duplicateNamePolicy);
		Assert.notNull(namePolicy, "Tool name policy must not be null");
		this.namePolicy = namePolicy;
	}

	/**
	 * Register a tool described by a raw JSON Schema descriptor. The tool description is
	 * taken from the descriptor's {@code description}, if any.
	 * @param name the tool name
	 * @param descriptor raw input schema, may be {@code null} for a tool without
	 * arguments
	 * @param handler the tool handler
	 * @return the registered tool
	 * @throws IllegalArgumentException if the descriptor is invalid, or the name is
	 * invalid under {@link ToolNamePolicy#STRICT}
	 */
	public Tool register(String name, @Nullable Map<String, ?> descriptor, ToolHandler handler) {
		ArgumentSchema schema = ArgumentSchema.fromMap(descriptor);
		return register(new Tool(name, schema.description(), schema, handler));
	}

	public Tool register(String name, @Nullable String description, ArgumentSchema schema, ToolHandler handler) {
		return register(new Tool(name, description, schema, handler));
	}

	/**
	 * Register a tool, checking its name first according to the {@link ToolNamePolicy}.
	 * @throws IllegalArgumentException if the policy is {@link ToolNamePolicy#STRICT}
	 * and the name is invalid
	 */
	public Tool register(Tool tool) {
		Assert.notNull(tool, "Tool must not be null");
		if (this.namePolicy != ToolNamePolicy.ACCEPT) {
			ToolNameValidator.validate(tool.name(), this.namePolicy == ToolNamePolicy.WARN);
		}
		return store(tool);
	}

	@Override
	protected String kind() {
		return "Tool";
	}

	@Override
	protected void notifyListChanged(NotificationQueue queue) {
		queue.toolsListChanged();
	}

	@Override
	protected Object invoke(Tool tool, Map<String, Object> arguments, CancellationToken token) throws Exception {
		return tool.handler().call(arguments, token);
	}

}
