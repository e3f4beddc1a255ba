/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

class HealthMonitorTests {

	private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

	private final AtomicReference<Instant> now = new AtomicReference<>(START);

	private final List<String> sentPings = new ArrayList<>();

	private HealthMonitor monitor;

	@BeforeEach
	void setUp() {
		Clock clock = mock(Clock.class);
		when(clock.instant()).thenAnswer(invocation -> this.now.get());
		this.monitor = new HealthMonitor(clock);
		this.monitor.setPingSender(this.sentPings::add);
	}

	private void advance(Duration duration) {
		this.now.set(this.now.get().plus(duration));
	}

	private void failPings(int count) {
		for (int i = 0; i < count; i++) {
			this.monitor.tick();
			advance(Duration.ofSeconds(10));
			this.monitor.tick();
			advance(Duration.ofSeconds(20));
		}
	}

	@Test
	void doesNothingUntilMonitoringStarts() {
		this.monitor.tick();

		assertThat(this.sentPings).isEmpty();
		assertThat(this.monitor.isMonitoring()).isFalse();
	}

	@Test
	void cannotStartWithoutPingSender() {
		HealthMonitor detached = new HealthMonitor();

		detached.startMonitoring();

		assertThat(detached.isMonitoring()).isFalse();
	}

	@Test
	void sendsPingOncePerInterval() {
		this.monitor.startMonitoring();

		this.monitor.tick();
		assertThat(this.monitor.handlePingResponse("health-ping-1")).isTrue();
		advance(Duration.ofSeconds(29));
		this.monitor.tick();
		advance(Duration.ofSeconds(1));
		this.monitor.tick();

		assertThat(this.sentPings).containsExactly("health-ping-1", "health-ping-2");
	}

	@Test
	void answeredPingIsRecordedInStats() {
		this.monitor.startMonitoring();
		this.monitor.tick();
		advance(Duration.ofMillis(250));

		this.monitor.handlePingResponse("health-ping-1");

		HealthMonitor.Stats stats = this.monitor.stats();
		assertThat(stats.healthy()).isTrue();
		assertThat(stats.monitoring()).isTrue();
		assertThat(stats.totalPings()).isEqualTo(1);
		assertThat(stats.averageResponseTime()).isEqualTo(Duration.ofMillis(250));
		assertThat(stats.lastPingSent()).isEqualTo(START);
		assertThat(stats.lastPongReceived()).isEqualTo(START.plusMillis(250));
	}

	@Test
	void unknownResponseIdsAreIgnored() {
		this.monitor.startMonitoring();
		this.monitor.tick();

		assertThat(this.monitor.handlePingResponse("req-7")).isFalse();
		assertThat(this.monitor.handlePingResponse(1)).isFalse();
		assertThat(this.monitor.stats().totalPings()).isZero();
	}

	@Test
	void becomesUnhealthyAfterMaxFailedPings() {
		AtomicInteger unhealthy = new AtomicInteger();
		AtomicInteger timeouts = new AtomicInteger();
		this.monitor.onUnhealthy(unhealthy::incrementAndGet);
		this.monitor.onTimeout(timeouts::incrementAndGet);
		this.monitor.startMonitoring();

		failPings(2);
		assertThat(this.monitor.isHealthy()).isTrue();
		assertThat(this.monitor.stats().failedPingCount()).isEqualTo(2);
		failPings(1);

		assertThat(this.monitor.isHealthy()).isFalse();
		assertThat(unhealthy).hasValue(1);
		assertThat(timeouts).hasValue(1);
	}

	@Test
	void answeredPingRestoresHealth() {
		AtomicInteger healthy = new AtomicInteger();
		this.monitor.onHealthy(healthy::incrementAndGet);
		this.monitor.setMaxFailedPings(1);
		this.monitor.startMonitoring();
		failPings(1);
		assertThat(this.monitor.isHealthy()).isFalse();

		this.monitor.tick();
		this.monitor.handlePingResponse(this.sentPings.get(this.sentPings.size() - 1));

		assertThat(this.monitor.isHealthy()).isTrue();
		assertThat(this.monitor.stats().failedPingCount()).isZero();
		assertThat(healthy).hasValue(1);
	}

	@Test
	void sendFailureCountsAsFailedPing() {
		this.monitor.setPingSender(requestId -> {
			throw new IOException("broken pipe");
		});
		this.monitor.setMaxFailedPings(1);
		this.monitor.startMonitoring();

		this.monitor.tick();

		assertThat(this.monitor.isHealthy()).isFalse();
	}

	@Test
	void failingCallbackDoesNotStopMonitoring() {
		this.monitor.onUnhealthy(() -> {
			throw new IllegalStateException("listener broken");
		});
		this.monitor.setMaxFailedPings(1);
		this.monitor.startMonitoring();

		failPings(1);
		this.monitor.tick();

		assertThat(this.monitor.isHealthy()).isFalse();
		assertThat(this.sentPings).hasSize(2);
	}

	@Test
	void settingsHaveLowerBounds() {
		this.monitor.setPingInterval(Duration.ofMillis(10));
		this.monitor.setPingTimeout(Duration.ZERO);
		this.monitor.setMaxFailedPings(0);

		HealthMonitor.Stats stats = this.monitor.stats();
		assertThat(stats.pingInterval()).isEqualTo(Duration.ofSeconds(1));
		assertThat(stats.pingTimeout()).isEqualTo(Duration.ofSeconds(1));
		assertThat(stats.maxFailedPings()).isEqualTo(1);
	}

	@Test
	void removingPingSenderStopsMonitoring() {
		this.monitor.startMonitoring();

		this.monitor.setPingSender(null);

		assertThat(this.monitor.isMonitoring()).isFalse();
	}

	@Test
	void resetRestoresHealthAndClearsHistory() {
		this.monitor.setMaxFailedPings(1);
		this.monitor.startMonitoring();
		failPings(1);

		this.monitor.reset();

		HealthMonitor.Stats stats = this.monitor.stats();
		assertThat(stats.healthy()).isTrue();
		assertThat(stats.monitoring()).isTrue();
		assertThat(stats.failedPingCount()).isZero();
		assertThat(stats.lastPingSent()).isNull();
	}

	@Test
	void scheduledTicksSendPings() {
		VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
		try {
			Disposable ticks = this.monitor.schedule(scheduler, Duration.ofSeconds(1));
			assertThat(this.monitor.isMonitoring()).isTrue();

			scheduler.advanceTimeBy(Duration.ofSeconds(1));
			assertThat(this.sentPings).containsExactly("health-ping-1");

			ticks.dispose();
			this.monitor.handlePingResponse("health-ping-1");
			advance(Duration.ofMinutes(1));
			scheduler.advanceTimeBy(Duration.ofMinutes(1));
			assertThat(this.sentPings).hasSize(1);
		}
		finally {
			scheduler.dispose();
		}
	}

}
