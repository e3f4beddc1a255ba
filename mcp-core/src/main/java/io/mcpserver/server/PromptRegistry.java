/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.cancellation.CancellationToken;
import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.schema.SchemaValidator;
import io.mcpserver.spec.NotificationQueue;
import reactor.util.annotation.Nullable;

/**
 * Registry of the prompts a server exposes through {@code prompts/list} and
 * {@code prompts/get}.
 */
public class PromptRegistry extends AbstractRegistry<Prompt> {

	public PromptRegistry() {
		this(null);
	}

	public PromptRegistry(@Nullable NotificationQueue notificationQueue) {
		this(notificationQueue, SchemaValidator.createDefault(), DuplicateNamePolicy.REPLACE);
	}

	public PromptRegistry(@Nullable NotificationQueue notificationQueue, SchemaValidator validator,
			DuplicateNamePolicy duplicateNamePolicy) {
		super(notificationQueue, validator, duplicateNamePolicy);
	}

	/**
	 * Register a prompt described by a raw argument schema descriptor.
	 * @param name the prompt name
	 * @param descriptor raw argument schema, may be {@code null}
	 * @param handler renders the prompt
	 * @return the registered prompt
	 */
	public Prompt register(String name, @Nullable Map<String, ?> descriptor, PromptHandler handler) {
		ArgumentSchema schema = ArgumentSchema.fromMap(descriptor);
		return register(new Prompt(name, schema.description(), schema, handler));
	}

	public Prompt register(String name, @Nullable String description, ArgumentSchema schema,
			PromptHandler handler) {
		return register(new Prompt(name, description, schema, handler));
	}

	public Prompt register(Prompt prompt) {
		return store(prompt);
	}

	@Override
	protected String kind() {
		return "Prompt";
	}

	@Override
	protected void notifyListChanged(NotificationQueue queue) {
		queue.promptsListChanged();
	}

	@Override
	protected Object invoke(Prompt prompt, Map<String, Object> arguments, CancellationToken token)
			throws Exception {
		return prompt.handler().render(arguments, token);
	}

}
