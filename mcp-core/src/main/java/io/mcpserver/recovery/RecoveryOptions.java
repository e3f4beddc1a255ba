/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

import java.util.function.Function;

import io.mcpserver.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Per-call settings of {@link ErrorRecovery}. Only the settings of the chosen
 * {@link RecoveryStrategy} are used.
 *
 * <pre>{@code
 * RecoveryOptions options = RecoveryOptions.builder(RecoveryStrategy.FALLBACK)
 *     .fallback(error -> Map.of("cached", true))
 *     .build();
 * }</pre>
 */
public final class RecoveryOptions {

	private final RecoveryStrategy strategy;

	@Nullable
	private final RetryPolicy retryPolicy;

	@Nullable
	private final String circuitName;

	private final CircuitBreaker.Policy circuitBreakerPolicy;

	@Nullable
	private final String operation;

	@Nullable
	private final Function<Throwable, ?> fallback;

	private final boolean throwFallbackException;

	@Nullable
	private final Function<Throwable, ?> degradationHandler;

	@Nullable
	private final Object degradedResponse;

	private RecoveryOptions(Builder builder) {
		this.strategy = builder.strategy;
		this.retryPolicy = builder.retryPolicy;
		this.circuitName = builder.circuitName;
		this.circuitBreakerPolicy = builder.circuitBreakerPolicy;
		this.operation = builder.operation;
		this.fallback = builder.fallback;
		this.throwFallbackException = builder.throwFallbackException;
		this.degradationHandler = builder.degradationHandler;
		this.degradedResponse = builder.degradedResponse;
	}

	public static Builder builder(RecoveryStrategy strategy) {
		return new Builder(strategy);
	}

	/**
	 * Retry with the {@link ErrorRecovery}'s default policy.
	 */
	public static RecoveryOptions retry() {
		return builder(RecoveryStrategy.RETRY).build();
	}

	public static RecoveryOptions retry(RetryPolicy policy) {
		return builder(RecoveryStrategy.RETRY).retryPolicy(policy).build();
	}

	public static RecoveryOptions circuitBreaker(String circuitName) {
		return builder(RecoveryStrategy.CIRCUIT_BREAKER).circuitName(circuitName).build();
	}

	public static RecoveryOptions gracefulDegradation() {
		return builder(RecoveryStrategy.GRACEFUL_DEGRADATION).build();
	}

	/**
	 * Fill in the circuit name and the operation name when they are not set, e.g. with
	 * the name of the tool being called.
	 * @param name the default name
	 * @return these options, or a copy carrying the default name
	 */
	public RecoveryOptions withDefaultName(String name) {
		if (this.circuitName != null && this.operation != null) {
			return this;
		}
		Builder builder = toBuilder();
		if (this.circuitName == null) {
			builder.circuitName(name);
		}
		if (this.operation == null) {
			builder.operation(name);
		}
		return builder.build();
	}

	public RecoveryStrategy strategy() {
		return this.strategy;
	}

	@Nullable
	public RetryPolicy retryPolicy() {
		return this.retryPolicy;
	}

	@Nullable
	public String circuitName() {
		return this.circuitName;
	}

	public CircuitBreaker.Policy circuitBreakerPolicy() {
		return this.circuitBreakerPolicy;
	}

	@Nullable
	public String operation() {
		return this.operation;
	}

	@Nullable
	public Function<Throwable, ?> fallback() {
		return this.fallback;
	}

	public boolean throwFallbackException() {
		return this.throwFallbackException;
	}

	@Nullable
	public Function<Throwable, ?> degradationHandler() {
		return this.degradationHandler;
	}

	@Nullable
	public Object degradedResponse() {
		return this.degradedResponse;
	}

	private Builder toBuilder() {
		Builder builder = new Builder(this.strategy);
		builder.retryPolicy = this.retryPolicy;
		builder.circuitName = this.circuitName;
		builder.circuitBreakerPolicy = this.circuitBreakerPolicy;
		builder.operation = this.operation;
		builder.fallback = this.fallback;
		builder.throwFallbackException = this.throwFallbackException;
		builder.degradationHandler = this.degradationHandler;
		builder.degradedResponse = this.degradedResponse;
		return builder;
	}

	public static final class Builder {

		private final RecoveryStrategy strategy;

		@Nullable
		private RetryPolicy retryPolicy;

		@Nullable
		private String circuitName;

		private CircuitBreaker.Policy circuitBreakerPolicy = CircuitBreaker.Policy.DEFAULT;

		@Nullable
		private String operation;

		@Nullable
		private Function<Throwable, ?> fallback;

		private boolean throwFallbackException;

		@Nullable
		private Function<Throwable, ?> degradationHandler;

		@Nullable
		private Object degradedResponse;

		private Builder(RecoveryStrategy strategy) {
			Assert.notNull(strategy, "Strategy must not be null");
			this.strategy = strategy;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			Assert.notNull(retryPolicy, "Retry policy must not be null");
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder circuitName(String circuitName) {
			Assert.hasText(circuitName, "Circuit name must not be empty");
			this.circuitName = circuitName;
			return this;
		}

		/**
		 * Thresholds used when the named circuit breaker is first created.
		 */
		public Builder circuitBreakerPolicy(CircuitBreaker.Policy circuitBreakerPolicy) {
			Assert.notNull(circuitBreakerPolicy, "Circuit breaker policy must not be null");
			this.circuitBreakerPolicy = circuitBreakerPolicy;
			return this;
		}

		/**
		 * Name under which a fallback handler was registered with
		 * {@link ErrorRecovery#registerFallbackHandler}.
		 */
		public Builder operation(String operation) {
			Assert.hasText(operation, "Operation must not be empty");
			this.operation = operation;
			return this;
		}

		public Builder fallback(Function<Throwable, ?> fallback) {
			Assert.notNull(fallback, "Fallback must not be null");
			this.fallback = fallback;
			return this;
		}

		/**
		 * Fail with the fallback's exception instead of the original one when both
		 * fail.
		 */
		public Builder throwFallbackException(boolean throwFallbackException) {
			this.throwFallbackException = throwFallbackException;
			return this;
		}

		public Builder degradationHandler(Function<Throwable, ?> degradationHandler) {
			Assert.notNull(degradationHandler, "Degradation handler must not be null");
			this.degradationHandler = degradationHandler;
			return this;
		}

		public Builder degradedResponse(Object degradedResponse) {
			Assert.notNull(degradedResponse, "Degraded response must not be null");
			this.degradedResponse = degradedResponse;
			return this;
		}

		public RecoveryOptions build() {
			return new RecoveryOptions(this);
		}

	}

}
