/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives exceptions thrown by cancellation callbacks. A faulty callback never stops
 * the remaining callbacks and never reaches the code that called
 * {@link CancellationToken#cancel(String)}.
 */
@FunctionalInterface
public interface CancellationFaultHandler {

	void handleFault(CancellationToken token, Throwable fault);

	/**
	 * A handler that logs each fault at warn level.
	 * @return the logging handler
	 */
	static CancellationFaultHandler logging() {
		Logger logger = LoggerFactory.getLogger(CancellationToken.class);
		return (token, fault) -> logger.warn("Cancellation callback failed (reason: {})", token.reason(), fault);
	}

}
