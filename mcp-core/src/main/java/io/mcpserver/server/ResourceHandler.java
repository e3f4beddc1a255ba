/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.Map;

import io.mcpserver.cancellation.CancellationToken;

/**
 * Host code that produces the contents of a resource.
 *
 * <p>
 * The result may be a {@code String} (plain text), a single content map with
 * {@code text} or {@code blob}, a map with a {@code contents} list, or a list of
 * content items. Any other value is rendered as JSON.
 */
@FunctionalInterface
public interface ResourceHandler {

	/**
	 * @param uri the URI being read
	 * @param variables values bound by the URI template, empty for literal resources
	 * @param token signals that the peer cancelled the read
	 * @return the resource contents
	 * @throws Exception on failure; reported to the peer as an internal error
	 */
	Object read(String uri, Map<String, String> variables, CancellationToken token) throws Exception;

}
