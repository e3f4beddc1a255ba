/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

import java.time.Duration;

/**
 * Thrown instead of running an operation while its circuit breaker is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

	private final String circuitName;

	private final Duration retryAfter;

	public CircuitBreakerOpenException(String circuitName, Duration retryAfter) {
		super("Circuit breaker '" + circuitName + "' is open");
		this.circuitName = circuitName;
		this.retryAfter = retryAfter;
	}

	public String getCircuitName() {
		return this.circuitName;
	}

	/**
	 * @return time left until the breaker lets a trial call through
	 */
	public Duration getRetryAfter() {
		return this.retryAfter;
	}

}
