/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

/**
 * How {@link ErrorRecovery} reacts when an operation fails.
 */
public enum RecoveryStrategy {

	/**
	 * Run the operation again with exponential backoff.
	 */
	RETRY,

	/**
	 * Answer with the result of a fallback operation.
	 */
	FALLBACK,

	/**
	 * Stop calling an operation that keeps failing until it had time to recover.
	 */
	CIRCUIT_BREAKER,

	/**
	 * Answer with a degraded response instead of failing.
	 */
	GRACEFUL_DEGRADATION

}
