/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.spec;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import io.mcpserver.spec.McpSchema.LoggingLevel;
import io.mcpserver.spec.McpSchema.Notification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationQueueTests {

	private NotificationQueue queue;

	@BeforeEach
	void setUp() {
		this.queue = new NotificationQueue();
	}

	@Test
	void drainReturnsNotificationsInFifoOrderAndEmptiesQueue() {
		this.queue.toolsListChanged();
		this.queue.promptsListChanged();
		this.queue.resourcesListChanged();

		assertThat(this.queue.size()).isEqualTo(3);
		List<Notification> drained = this.queue.drain();

		assertThat(drained).extracting(Notification::method)
			.containsExactly(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
					McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED,
					McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED);
		assertThat(this.queue.isEmpty()).isTrue();
		assertThat(this.queue.drain()).isEmpty();
	}

	@Test
	void doesNotCoalesceRepeatedNotifications() {
		this.queue.toolsListChanged();
		this.queue.toolsListChanged();
		assertThat(this.queue.size()).isEqualTo(2);
	}

	@Test
	void payloadIsCopiedAndNullBecomesEmpty() {
		Notification empty = this.queue.enqueue("notifications/custom", null);
		assertThat(empty.params()).isEmpty();

		Notification updated = this.queue.resourceUpdated("file:///a.txt");
		assertThat(updated.params()).isEqualTo(Map.of("uri", "file:///a.txt"));
	}

	@Test
	void logMessageCarriesLevelLoggerAndData() {
		Notification notification = this.queue.logMessage(LoggingLevel.WARNING, "db", "slow query");

		assertThat(notification.method()).isEqualTo(McpSchema.METHOD_NOTIFICATION_MESSAGE);
		assertThat(notification.params()).containsExactly(Map.entry("level", "warning"), Map.entry("logger", "db"),
				Map.entry("data", "slow query"));
	}

	@Test
	void clearDropsPendingNotifications() {
		this.queue.toolsListChanged();
		this.queue.clear();
		assertThat(this.queue.size()).isZero();
	}

}
