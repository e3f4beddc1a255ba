/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.schema.McpValidationException;
import io.mcpserver.schema.PropertySchema;
import io.mcpserver.spec.McpNotFoundException;
import io.mcpserver.spec.McpSchema;
import io.mcpserver.spec.NotificationQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PromptRegistryTests {

	private NotificationQueue queue;

	private PromptRegistry registry;

	@BeforeEach
	void setUp() {
		this.queue = new NotificationQueue();
		this.registry = new PromptRegistry(this.queue);
	}

	private static Map<String, Object> greet(Map<String, Object> args) {
		return Map.of("messages", List.of(Map.of("role", "user", "content",
				Map.of("type", "text", "text", "Say hello to " + args.get("name")))));
	}

	@Test
	void rendersPrompt() {
		this.registry.register("greet", "Greets someone",
				ArgumentSchema.builder().requiredProperty("name", PropertySchema.string()).build(),
				(args, token) -> greet(args));

		assertThat(this.registry.execute("greet", Map.of("name", "Ada"))).isEqualTo(greet(Map.of("name", "Ada")));
	}

	@Test
	void missingRequiredArgumentIsRejected() {
		this.registry.register("greet", Map.of("required", List.of("name")), (args, token) -> greet(args));

		assertThatThrownBy(() -> this.registry.execute("greet", Map.of()))
			.isInstanceOfSatisfying(McpValidationException.class,
					ex -> assertThat(ex.getViolation().path()).isEqualTo("name"));
	}

	@Test
	void unknownPromptIsNotFound() {
		assertThatThrownBy(() -> this.registry.execute("nope", Map.of())).isInstanceOf(McpNotFoundException.class);
	}

	@Test
	void metadataAnnouncesArgumentsAsObjectSchema() {
		this.registry.register("summarize", "Summarize a text",
				ArgumentSchema.builder()
					.requiredProperty("text", PropertySchema.string())
					.property("style", PropertySchema.string().withEnum("short", "long"))
					.build(),
				(args, token) -> Map.of());

		Map<String, Object> metadata = this.registry.list().get(0);
		assertThat(metadata).containsEntry("name", "summarize").containsEntry("description", "Summarize a text");
		assertThat(metadata.get("arguments")).isEqualTo(Map.of("type", "object", "properties",
				Map.of("text", Map.of("type", "string"), "style",
						Map.of("type", "string", "enum", List.of("short", "long"))),
				"required", List.of("text")));
	}

	@Test
	void promptWithoutArgumentsAnnouncesEmptySchema() {
		this.registry.register("hello", null, (args, token) -> Map.of());

		assertThat(this.registry.list()).containsExactly(Map.of("name", "hello", "arguments",
				Map.of("type", "object", "properties", Map.of(), "required", List.of())));
	}

	@Test
	void mutationsEnqueuePromptListChanged() {
		this.registry.register("hello", null, (args, token) -> Map.of());
		this.registry.clear();

		assertThat(this.queue.drain()).extracting(McpSchema.Notification::method)
			.containsOnly(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED)
			.hasSize(2);
	}

}
