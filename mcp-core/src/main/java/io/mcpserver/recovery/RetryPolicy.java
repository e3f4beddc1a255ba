/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

import java.time.Duration;

import io.mcpserver.util.Assert;

/**
 * Backoff settings of the {@link RecoveryStrategy#RETRY} strategy. The delay starts at
 * {@code initialDelay} and doubles after every failed attempt, capped at
 * {@code maxDelay}.
 *
 * @param maxRetries attempts after the first one, 0 disables retrying
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound of any delay
 * @param jitter random spread applied to each delay, between 0 and 1
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double jitter) {

	/**
	 * Three retries starting at 100 ms, capped at 5 s, with 25% jitter.
	 */
	public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 0.25);

	public RetryPolicy {
		Assert.isTrue(maxRetries >= 0, "Max retries must not be negative");
		Assert.notNull(initialDelay, "Initial delay must not be null");
		Assert.notNull(maxDelay, "Max delay must not be null");
		Assert.isTrue(!initialDelay.isNegative(), "Initial delay must not be negative");
		Assert.isTrue(maxDelay.compareTo(initialDelay) >= 0, "Max delay must not be shorter than the initial delay");
		Assert.isTrue(jitter >= 0 && jitter <= 1, "Jitter must be between 0 and 1");
	}

	public RetryPolicy withoutJitter() {
		return new RetryPolicy(this.maxRetries, this.initialDelay, this.maxDelay, 0);
	}

}
