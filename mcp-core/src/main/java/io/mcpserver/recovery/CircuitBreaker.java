/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Circuit breaker guarding one named operation.
 *
 * <p>
 * The breaker starts {@link State#CLOSED}. After {@code failureThreshold} consecutive
 * failures it opens and rejects calls with {@link CircuitBreakerOpenException}. Once
 * {@code recoveryTimeout} has passed since the last failure the next call moves it to
 * {@link State#HALF_OPEN}; {@code successThreshold} consecutive successes close it again
 * while any failure reopens it.
 */
public class CircuitBreaker {

	private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

	public enum State {

		CLOSED, OPEN, HALF_OPEN

	}

	/**
	 * Thresholds of a circuit breaker.
	 *
	 * @param failureThreshold consecutive failures that open the breaker
	 * @param recoveryTimeout time the breaker stays open after the last failure
	 * @param successThreshold consecutive half-open successes that close the breaker
	 */
	public record Policy(int failureThreshold, Duration recoveryTimeout, int successThreshold) {

		/**
		 * Opens after 5 failures, recovers after 60 s, closes after 3 successes.
		 */
		public static final Policy DEFAULT = new Policy(5, Duration.ofSeconds(60), 3);

		public Policy {
			Assert.isTrue(failureThreshold > 0, "Failure threshold must be positive");
			Assert.notNull(recoveryTimeout, "Recovery timeout must not be null");
			Assert.isTrue(!recoveryTimeout.isNegative(), "Recovery timeout must not be negative");
			Assert.isTrue(successThreshold > 0, "Success threshold must be positive");
		}

	}

	/**
	 * Point in time view of a breaker.
	 */
	public record Snapshot(State state, int consecutiveFailures, int consecutiveSuccesses,
			@Nullable Instant lastFailureTime) {
	}

	private final String name;

	private final Policy policy;

	private final Clock clock;

	private State state = State.CLOSED;

	private int consecutiveFailures;

	private int consecutiveSuccesses;

	@Nullable
	private Instant lastFailureTime;

	public CircuitBreaker(String name, Policy policy, Clock clock) {
		Assert.hasText(name, "Circuit name must not be empty");
		Assert.notNull(policy, "Policy must not be null");
		Assert.notNull(clock, "Clock must not be null");
		this.name = name;
		this.policy = policy;
		this.clock = clock;
	}

	/**
	 * Check whether a call may proceed, moving an open breaker to half-open once the
	 * recovery timeout has passed.
	 * @throws CircuitBreakerOpenException if the breaker is open
	 */
	public synchronized void acquire() {
		if (this.state != State.OPEN) {
			return;
		}
		Instant reopensAt = this.lastFailureTime.plus(this.policy.recoveryTimeout());
		Instant now = this.clock.instant();
		if (now.isBefore(reopensAt)) {
			Duration retryAfter = Duration.between(now, reopensAt);
			logger.warn("Circuit breaker '{}' is open, rejecting call for another {}", this.name, retryAfter);
			throw new CircuitBreakerOpenException(this.name, retryAfter);
		}
		transition(State.HALF_OPEN);
		logger.info("Circuit breaker '{}' is half-open", this.name);
	}

	public synchronized void recordSuccess() {
		if (this.state == State.HALF_OPEN) {
			this.consecutiveSuccesses++;
			if (this.consecutiveSuccesses >= this.policy.successThreshold()) {
				transition(State.CLOSED);
				logger.info("Circuit breaker '{}' closed after successful recovery", this.name);
			}
		}
		else {
			this.consecutiveFailures = 0;
		}
	}

	public synchronized void recordFailure() {
		this.consecutiveFailures++;
		this.consecutiveSuccesses = 0;
		this.lastFailureTime = this.clock.instant();
		if (this.state == State.HALF_OPEN || (this.state == State.CLOSED
				&& this.consecutiveFailures >= this.policy.failureThreshold())) {
			transition(State.OPEN);
			logger.error("Circuit breaker '{}' opened after {} consecutive failures", this.name,
					this.consecutiveFailures);
		}
	}

	public String name() {
		return this.name;
	}

	public synchronized State state() {
		return this.state;
	}

	public synchronized Snapshot snapshot() {
		return new Snapshot(this.state, this.consecutiveFailures, this.consecutiveSuccesses, this.lastFailureTime);
	}

	private void transition(State next) {
		this.state = next;
		if (next == State.CLOSED) {
			this.consecutiveFailures = 0;
			this.consecutiveSuccesses = 0;
		}
		else if (next == State.HALF_OPEN) {
			this.consecutiveSuccesses = 0;
		}
	}

}
