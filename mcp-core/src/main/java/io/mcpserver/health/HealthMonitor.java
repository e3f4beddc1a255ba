/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

/**
 * Watches the connection to the peer with periodic {@code ping} requests.
 *
 * <p>
 * Each {@link #tick()} sends a ping through the {@link PingSender} when none is pending
 * and the ping interval has elapsed, and counts a pending ping that outlived the ping
 * timeout as failed. After {@code maxFailedPings} failures in a row the connection is
 * unhealthy; the next answered ping makes it healthy again. Ticks are driven by the host
 * or by {@link #schedule(Scheduler, Duration)}.
 *
 * <p>
 * Status callbacks run on the ticking thread, each behind its own fault boundary.
 */
public class HealthMonitor {

	private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

	private static final int RECENT_RESPONSE_TIMES = 10;

	private static final Duration MIN_PERIOD = Duration.ofSeconds(1);

	/**
	 * Sends a {@code ping} request with the given id to the peer.
	 */
	@FunctionalInterface
	public interface PingSender {

		void sendPing(String requestId) throws Exception;

	}

	/**
	 * Point in time view of the monitor.
	 *
	 * @param averageResponseTime mean of the last ten response times, {@code null}
	 * before the first answered ping
	 * @param totalPings number of answered pings since the last reset
	 */
	public record Stats(boolean healthy, boolean monitoring, int failedPingCount, int maxFailedPings,
			@Nullable Instant lastPingSent, @Nullable Instant lastPongReceived, Duration pingInterval,
			Duration pingTimeout, @Nullable Duration averageResponseTime, long totalPings) {
	}

	private final Clock clock;

	private final AtomicLong pingIds = new AtomicLong();

	private final Deque<Duration> responseTimes = new ArrayDeque<>();

	@Nullable
	private PingSender pingSender;

	private boolean monitoring;

	private boolean healthy = true;

	private Duration pingInterval = Duration.ofSeconds(30);

	private Duration pingTimeout = Duration.ofSeconds(10);

	private int maxFailedPings = 3;

	private int failedPingCount;

	private long totalPings;

	@Nullable
	private Instant lastPingSent;

	@Nullable
	private Instant lastPongReceived;

	@Nullable
	private String pendingPingId;

	@Nullable
	private Runnable onHealthy;

	@Nullable
	private Runnable onUnhealthy;

	@Nullable
	private Runnable onTimeout;

	public HealthMonitor() {
		this(Clock.systemUTC());
	}

	public HealthMonitor(Clock clock) {
		Assert.notNull(clock, "Clock must not be null");
		this.clock = clock;
	}

	/**
	 * Set how pings reach the peer. Removing the sender stops monitoring.
	 * @param pingSender the sender, {@code null} to detach
	 */
	public void setPingSender(@Nullable PingSender pingSender) {
		synchronized (this) {
			this.pingSender = pingSender;
		}
		if (pingSender == null) {
			stopMonitoring();
		}
	}

	/**
	 * Start monitoring from a clean, healthy state. Ignored without a ping sender.
	 */
	public synchronized void startMonitoring() {
		if (this.monitoring) {
			return;
		}
		if (this.pingSender == null) {
			logger.warn("Cannot start health monitoring: no ping sender set");
			return;
		}
		this.monitoring = true;
		this.healthy = true;
		this.failedPingCount = 0;
		this.lastPingSent = null;
		this.lastPongReceived = null;
		this.pendingPingId = null;
		logger.info("Health monitoring started (interval {}, timeout {}, max failed pings {})", this.pingInterval,
				this.pingTimeout, this.maxFailedPings);
	}

	public synchronized void stopMonitoring() {
		if (!this.monitoring) {
			return;
		}
		this.monitoring = false;
		logger.info("Health monitoring stopped");
	}

	public synchronized boolean isMonitoring() {
		return this.monitoring;
	}

	public synchronized boolean isHealthy() {
		return this.healthy;
	}

	/**
	 * @param interval time between pings, raised to one second if shorter
	 */
	public synchronized void setPingInterval(Duration interval) {
		Assert.notNull(interval, "Ping interval must not be null");
		this.pingInterval = atLeastOneSecond(interval);
	}

	/**
	 * @param timeout time a ping may stay unanswered, raised to one second if shorter
	 */
	public synchronized void setPingTimeout(Duration timeout) {
		Assert.notNull(timeout, "Ping timeout must not be null");
		this.pingTimeout = atLeastOneSecond(timeout);
	}

	/**
	 * @param count consecutive failed pings that make the connection unhealthy, raised
	 * to 1 if smaller
	 */
	public synchronized void setMaxFailedPings(int count) {
		this.maxFailedPings = Math.max(1, count);
	}

	public synchronized void onHealthy(@Nullable Runnable callback) {
		this.onHealthy = callback;
	}

	public synchronized void onUnhealthy(@Nullable Runnable callback) {
		this.onUnhealthy = callback;
	}

	/**
	 * @param callback run on every failed ping once the failure limit is reached
	 */
	public synchronized void onTimeout(@Nullable Runnable callback) {
		this.onTimeout = callback;
	}

	/**
	 * Send a ping if one is due and detect a timed out ping. Does nothing while not
	 * monitoring.
	 */
	public void tick() {
		List<Runnable> callbacks = new ArrayList<>(2);
		String pingId = null;
		PingSender sender = null;
		synchronized (this) {
			if (!this.monitoring || this.pingSender == null) {
				return;
			}
			Instant now = this.clock.instant();
			if (this.pendingPingId != null && !now.isBefore(this.lastPingSent.plus(this.pingTimeout))) {
				logger.warn("Ping {} timed out", this.pendingPingId);
				this.pendingPingId = null;
				pingFailed(callbacks);
			}
			else if (this.pendingPingId == null
					&& (this.lastPingSent == null || !now.isBefore(this.lastPingSent.plus(this.pingInterval)))) {
				pingId = "health-ping-" + this.pingIds.incrementAndGet();
				this.pendingPingId = pingId;
				this.lastPingSent = now;
				sender = this.pingSender;
			}
		}
		callbacks.forEach(HealthMonitor::runIsolated);
		if (sender != null) {
			send(sender, pingId);
		}
	}

	private void send(PingSender sender, String pingId) {
		try {
			sender.sendPing(pingId);
			logger.debug("Health ping {} sent", pingId);
		}
		catch (Exception ex) {
			logger.error("Failed to send health ping {}", pingId, ex);
			List<Runnable> callbacks = new ArrayList<>(2);
			synchronized (this) {
				if (pingId.equals(this.pendingPingId)) {
					this.pendingPingId = null;
					pingFailed(callbacks);
				}
			}
			callbacks.forEach(HealthMonitor::runIsolated);
		}
	}

	/**
	 * Record the answer to a ping. Answers to anything but the pending ping are ignored.
	 * @param requestId id of the answered request
	 * @return whether the id was the pending ping
	 */
	public boolean handlePingResponse(Object requestId) {
		Runnable callback = null;
		synchronized (this) {
			if (this.pendingPingId == null || !this.pendingPingId.equals(requestId)) {
				return false;
			}
			Instant now = this.clock.instant();
			Duration responseTime = Duration.between(this.lastPingSent, now);
			this.responseTimes.addLast(responseTime);
			if (this.responseTimes.size() > RECENT_RESPONSE_TIMES) {
				this.responseTimes.removeFirst();
			}
			this.totalPings++;
			this.lastPongReceived = now;
			this.pendingPingId = null;
			this.failedPingCount = 0;
			logger.debug("Ping {} answered in {}", requestId, responseTime);
			if (!this.healthy) {
				callback = setHealthy(true);
			}
		}
		runIsolated(callback);
		return true;
	}

	public synchronized Stats stats() {
		Duration average = null;
		if (!this.responseTimes.isEmpty()) {
			Duration total = Duration.ZERO;
			for (Duration responseTime : this.responseTimes) {
				total = total.plus(responseTime);
			}
			average = total.dividedBy(this.responseTimes.size());
		}
		return new Stats(this.healthy, this.monitoring, this.failedPingCount, this.maxFailedPings, this.lastPingSent,
				this.lastPongReceived, this.pingInterval, this.pingTimeout, average, this.totalPings);
	}

	/**
	 * Forget ping history and become healthy, keeping the settings and the monitoring
	 * state.
	 */
	public void reset() {
		Runnable callback;
		synchronized (this) {
			this.failedPingCount = 0;
			this.lastPingSent = null;
			this.lastPongReceived = null;
			this.pendingPingId = null;
			this.responseTimes.clear();
			this.totalPings = 0;
			callback = setHealthy(true);
		}
		runIsolated(callback);
	}

	/**
	 * Tick periodically on the given scheduler and start monitoring.
	 * @param scheduler scheduler driving the ticks
	 * @param period time between ticks
	 * @return handle that stops the ticks when disposed
	 */
	public Disposable schedule(Scheduler scheduler, Duration period) {
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(period, "Period must not be null");
		Assert.isTrue(!period.isNegative() && !period.isZero(), "Period must be positive");
		startMonitoring();
		return Flux.interval(period, scheduler).subscribe(sequence -> tick());
	}

	// caller holds the lock and runs the collected callbacks once it is released
	private void pingFailed(List<Runnable> callbacks) {
		this.failedPingCount++;
		logger.warn("Ping failed ({} of {})", this.failedPingCount, this.maxFailedPings);
		if (this.failedPingCount < this.maxFailedPings) {
			return;
		}
		Runnable statusCallback = setHealthy(false);
		if (statusCallback != null) {
			callbacks.add(statusCallback);
		}
		if (this.onTimeout != null) {
			callbacks.add(this.onTimeout);
		}
	}

	@Nullable
	private Runnable setHealthy(boolean healthy) {
		if (this.healthy == healthy) {
			return null;
		}
		this.healthy = healthy;
		logger.info("Connection health changed to {}", healthy ? "healthy" : "unhealthy");
		return healthy ? this.onHealthy : this.onUnhealthy;
	}

	private static void runIsolated(@Nullable Runnable callback) {
		if (callback == null) {
			return;
		}
		try {
			callback.run();
		}
		catch (Exception ex) {
			logger.error("Health monitor callback failed", ex);
		}
	}

	private static Duration atLeastOneSecond(Duration duration) {
		return duration.compareTo(MIN_PERIOD) < 0 ? MIN_PERIOD : duration;
	}

}
