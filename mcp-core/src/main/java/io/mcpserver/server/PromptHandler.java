/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.cancellation.CancellationToken;

/**
 * Host code that renders a prompt, typically into {@code {description, messages}}.
 */
@FunctionalInterface
public interface PromptHandler {

	Map<String, Object> render(Map<String, Object> arguments, CancellationToken token) throws Exception;

}
