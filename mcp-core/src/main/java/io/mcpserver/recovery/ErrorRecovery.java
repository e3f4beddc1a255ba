/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.recovery;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import io.mcpserver.spec.ErrorKind;
import io.mcpserver.spec.McpError;
import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Runs operations under a {@link RecoveryStrategy}: retry with exponential backoff,
 * fallback, circuit breaking or graceful degradation.
 *
 * <p>
 * The core's own {@link McpError}s, {@link IllegalArgumentException}s and open circuit
 * rejections are never retried. {@code McpError}s are also never replaced by a fallback
 * or degraded response and never count as circuit breaker failures, so validation and
 * cancellation keep their meaning.
 */
public class ErrorRecovery {

	private static final Logger logger = LoggerFactory.getLogger(ErrorRecovery.class);

	static final String DEFAULT_CIRCUIT = "default";

	private final Clock clock;

	private final Scheduler scheduler;

	private final RetryPolicy defaultRetryPolicy;

	private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

	private final Map<String, Function<Throwable, ?>> fallbackHandlers = new ConcurrentHashMap<>();

	public ErrorRecovery() {
		this(Clock.systemUTC(), Schedulers.parallel(), RetryPolicy.DEFAULT);
	}

	/**
	 * @param clock clock of the circuit breakers
	 * @param scheduler scheduler that times retry delays
	 * @param defaultRetryPolicy policy of retries that do not name their own
	 */
	public ErrorRecovery(Clock clock, Scheduler scheduler, RetryPolicy defaultRetryPolicy) {
		Assert.notNull(clock, "Clock must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(defaultRetryPolicy, "Retry policy must not be null");
		this.clock = clock;
		this.scheduler = scheduler;
		this.defaultRetryPolicy = defaultRetryPolicy;
	}

	/**
	 * Run an operation under the given options and wait for the outcome.
	 * @param operation the operation
	 * @param options strategy and its settings
	 * @return the operation's result, or the fallback or degraded response
	 * @throws Exception the operation's last failure when recovery gives up
	 */
	public <T> T executeWithRecovery(Callable<T> operation, RecoveryOptions options) throws Exception {
		try {
			return execute(operation, options).block();
		}
		catch (RuntimeException ex) {
			Throwable cause = Exceptions.unwrap(ex);
			if (cause instanceof Exception checked && cause != ex) {
				throw checked;
			}
			throw ex;
		}
	}

	/**
	 * Run an operation lazily under the given options. Nothing happens until the
	 * returned {@link Mono} is subscribed to. A {@code null} result completes empty.
	 * @param operation the operation
	 * @param options strategy and its settings
	 * @return the outcome
	 * @throws IllegalArgumentException if the fallback strategy has no fallback
	 */
	public <T> Mono<T> execute(Callable<T> operation, RecoveryOptions options) {
		Assert.notNull(operation, "Operation must not be null");
		Assert.notNull(options, "Options must not be null");
		Mono<T> source = Mono.fromCallable(operation);
		return switch (options.strategy()) {
			case RETRY -> withRetry(source, options);
			case FALLBACK -> withFallback(source, options);
			case CIRCUIT_BREAKER -> withCircuitBreaker(source, options);
			case GRACEFUL_DEGRADATION -> withGracefulDegradation(source, options);
		};
	}

	/**
	 * Register a fallback used by {@link RecoveryStrategy#FALLBACK} calls whose options
	 * name this operation and carry no fallback of their own.
	 */
	public void registerFallbackHandler(String operation, Function<Throwable, ?> handler) {
		Assert.hasText(operation, "Operation must not be empty");
		Assert.notNull(handler, "Fallback handler must not be null");
		this.fallbackHandlers.put(operation, handler);
	}

	public Statistics statistics() {
		Map<String, CircuitBreaker.Snapshot> snapshots = new LinkedHashMap<>();
		this.circuitBreakers.forEach((name, breaker) -> snapshots.put(name, breaker.snapshot()));
		return new Statistics(snapshots, new LinkedHashSet<>(this.fallbackHandlers.keySet()));
	}

	public void resetCircuitBreakers() {
		this.circuitBreakers.clear();
		logger.info("All circuit breakers reset");
	}

	/**
	 * @return the named breaker, created on first use with the given policy
	 */
	public CircuitBreaker circuitBreaker(String name, CircuitBreaker.Policy policy) {
		return this.circuitBreakers.computeIfAbsent(name, key -> new CircuitBreaker(key, policy, this.clock));
	}

	private <T> Mono<T> withRetry(Mono<T> source, RecoveryOptions options) {
		RetryPolicy policy = options.retryPolicy() != null ? options.retryPolicy() : this.defaultRetryPolicy;
		AtomicInteger retries = new AtomicInteger();
		Retry retry = Retry.backoff(policy.maxRetries(), policy.initialDelay())
			.maxBackoff(policy.maxDelay())
			.jitter(policy.jitter())
			.scheduler(this.scheduler)
			.filter(ErrorRecovery::shouldRetry)
			.doBeforeRetry(signal -> {
				retries.incrementAndGet();
				logger.warn("Operation failed, retrying (attempt {} of {}): {}", signal.totalRetries() + 1,
						policy.maxRetries(), signal.failure().toString());
			})
			.onRetryExhaustedThrow((spec, signal) -> signal.failure());
		return source.retryWhen(retry).doOnSuccess(result -> {
			if (retries.get() > 0) {
				logger.info("Operation succeeded after {} retries", retries.get());
			}
		}).doOnError(ex -> {
			if (retries.get() > 0) {
				logger.error("All {} retry attempts failed", retries.get(), ex);
			}
		});
	}

	private <T> Mono<T> withFallback(Mono<T> source, RecoveryOptions options) {
		Function<Throwable, ?> fallback = options.fallback();
		if (fallback == null && options.operation() != null) {
			fallback = this.fallbackHandlers.get(options.operation());
		}
		if (fallback == null) {
			throw new IllegalArgumentException("Fallback strategy requires a fallback operation");
		}
		Function<Throwable, ?> handler = fallback;
		return source.onErrorResume(ErrorRecovery::isRecoverable, ex -> {
			logger.warn("Primary operation failed, trying fallback: {}", ex.toString());
			return Mono.fromCallable(() -> this.<T>cast(handler.apply(ex)))
				.doOnSuccess(result -> logger.info("Fallback operation succeeded"))
				.onErrorMap(fallbackEx -> {
					logger.error("Fallback operation also failed: {}", fallbackEx.toString(), ex);
					return options.throwFallbackException() ? fallbackEx : ex;
				});
		});
	}

	private <T> Mono<T> withCircuitBreaker(Mono<T> source, RecoveryOptions options) {
		String name = options.circuitName() != null ? options.circuitName() : DEFAULT_CIRCUIT;
		CircuitBreaker breaker = circuitBreaker(name, options.circuitBreakerPolicy());
		return Mono.defer(() -> {
			breaker.acquire();
			return source;
		}).doOnSuccess(result -> breaker.recordSuccess()).doOnError(ex -> {
			if (isRecoverable(ex) && !(ex instanceof CircuitBreakerOpenException)) {
				breaker.recordFailure();
			}
		});
	}

	private <T> Mono<T> withGracefulDegradation(Mono<T> source, RecoveryOptions options) {
		return source.onErrorResume(ErrorRecovery::isRecoverable, ex -> {
			logger.warn("Operation failed, providing degraded response: {}", ex.toString());
			if (options.degradationHandler() != null) {
				return Mono.fromCallable(() -> this.<T>cast(options.degradationHandler().apply(ex)));
			}
			if (options.degradedResponse() != null) {
				return Mono.just(this.<T>cast(options.degradedResponse()));
			}
			return Mono.just(this.<T>cast(defaultDegradedResponse()));
		});
	}

	/**
	 * @return {@code {error: {code: -32603, message: "Service temporarily unavailable",
	 * degraded: true}}}
	 */
	public static Map<String, Object> defaultDegradedResponse() {
		Map<String, Object> error = new LinkedHashMap<>();
		error.put("code", ErrorKind.INTERNAL.code());
		error.put("message", "Service temporarily unavailable");
		error.put("degraded", true);
		Map<String, Object> response = new LinkedHashMap<>();
		response.put("error", error);
		return response;
	}

	static boolean shouldRetry(Throwable ex) {
		return isRecoverable(ex) && !(ex instanceof IllegalArgumentException)
				&& !(ex instanceof CircuitBreakerOpenException);
	}

	private static boolean isRecoverable(Throwable ex) {
		return !(ex instanceof McpError);
	}

	@SuppressWarnings("unchecked")
	private <T> T cast(Object value) {
		return (T) value;
	}

	/**
	 * @param circuitBreakers snapshot of every circuit breaker by name
	 * @param fallbackHandlers operations with a registered fallback handler
	 */
	public record Statistics(Map<String, CircuitBreaker.Snapshot> circuitBreakers, Set<String> fallbackHandlers) {
	}

}
