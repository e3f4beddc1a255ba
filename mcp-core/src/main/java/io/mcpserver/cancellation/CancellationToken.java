/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.mcpserver.util.Assert;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

/**
 * One-shot cooperative cancellation signal shared between the caller of an operation and
 * the operation itself.
 *
 * <p>
 * A token starts pending and moves to cancelled at most once. Long running handlers
 * either poll {@link #throwIfCancelled()} or register a callback with
 * {@link #onCancelled(Consumer)}. Callbacks receive the cancellation reason and run
 * synchronously on the cancelling thread, in registration order, each exactly once.
 * Exceptions thrown by a callback go to the token's {@link CancellationFaultHandler}.
 */
public final class CancellationToken {

	private final Clock clock;

	private final CancellationFaultHandler faultHandler;

	private final List<Consumer<String>> callbacks = new ArrayList<>();

	private volatile boolean cancelled;

	@Nullable
	private volatile String reason;

	@Nullable
	private volatile Instant cancelledAt;

	public CancellationToken() {
		this(Clock.systemUTC(), CancellationFaultHandler.logging());
	}

	public CancellationToken(Clock clock, CancellationFaultHandler faultHandler) {
		Assert.notNull(clock, "Clock must not be null");
		Assert.notNull(faultHandler, "Fault handler must not be null");
		this.clock = clock;
		this.faultHandler = faultHandler;
	}

	/**
	 * @return a fresh pending token
	 */
	public static CancellationToken none() {
		return new CancellationToken();
	}

	/**
	 * @param reason the cancellation reason
	 * @return a token that is already cancelled
	 */
	public static CancellationToken cancelled(@Nullable String reason) {
		return cancelled(reason, Clock.systemUTC(), CancellationFaultHandler.logging());
	}

	/**
	 * @param reason the cancellation reason
	 * @param clock clock that records the cancellation time
	 * @param faultHandler receives faults of callbacks registered later
	 * @return a token that is already cancelled
	 */
	public static CancellationToken cancelled(@Nullable String reason, Clock clock,
			CancellationFaultHandler faultHandler) {
		CancellationToken token = new CancellationToken(clock, faultHandler);
		token.cancel(reason);
		return token;
	}

	public static CancellationToken cancelAfter(Duration timeout, @Nullable String reason, Scheduler scheduler) {
		return cancelAfter(timeout, reason, scheduler, Clock.systemUTC(), CancellationFaultHandler.logging());
	}

	/**
	 * Create a token that cancels itself once {@code timeout} has elapsed on the given
	 * scheduler. The timer is disposed if the token is cancelled earlier.
	 * @param timeout delay before cancellation
	 * @param reason reason recorded when the timer fires
	 * @param scheduler scheduler that arms the timer
	 * @param clock clock that records the cancellation time
	 * @param faultHandler receives faults of the token's callbacks
	 * @return a pending token
	 */
	public static CancellationToken cancelAfter(Duration timeout, @Nullable String reason, Scheduler scheduler,
			Clock clock, CancellationFaultHandler faultHandler) {
		Assert.notNull(timeout, "Timeout must not be null");
		Assert.isTrue(!timeout.isNegative(), "Timeout must not be negative");
		Assert.notNull(scheduler, "Scheduler must not be null");
		CancellationToken token = new CancellationToken(clock, faultHandler);
		Disposable timer = scheduler.schedule(() -> token.cancel(reason), timeout.toNanos(), TimeUnit.NANOSECONDS);
		token.onCancelled(r -> timer.dispose());
		return token;
	}

	/**
	 * Cancel the token. Only the first call has an effect: it records the reason and the
	 * time, then runs every registered callback.
	 * @param reason optional human readable reason
	 */
	public void cancel(@Nullable String reason) {
		List<Consumer<String>> toRun;
		synchronized (this) {
			if (this.cancelled) {
				return;
			}
			this.reason = reason;
			this.cancelledAt = this.clock.instant();
			this.cancelled = true;
			toRun = new ArrayList<>(this.callbacks);
			this.callbacks.clear();
		}
		for (Consumer<String> callback : toRun) {
			runIsolated(callback);
		}
	}

	/**
	 * Register a callback. If the token is already cancelled the callback runs
	 * immediately on the calling thread.
	 * @param callback receives the cancellation reason, which may be {@code null}
	 */
	public void onCancelled(Consumer<String> callback) {
		Assert.notNull(callback, "Callback must not be null");
		synchronized (this) {
			if (!this.cancelled) {
				this.callbacks.add(callback);
				return;
			}
		}
		runIsolated(callback);
	}

	/**
	 * @throws McpCancellationException if the token has been cancelled
	 */
	public void throwIfCancelled() {
		if (this.cancelled) {
			throw new McpCancellationException(this.reason, this);
		}
	}

	public boolean isCancelled() {
		return this.cancelled;
	}

	@Nullable
	public String reason() {
		return this.reason;
	}

	@Nullable
	public Instant cancelledAt() {
		return this.cancelledAt;
	}

	private void runIsolated(Consumer<String> callback) {
		try {
			callback.accept(this.reason);
		}
		catch (Exception ex) {
			this.faultHandler.handleFault(this, ex);
		}
	}

	@Override
	public String toString() {
		return this.cancelled ? "CancellationToken[cancelled: " + this.reason + "]" : "CancellationToken[pending]";
	}

}
