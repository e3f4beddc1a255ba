/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CancellationManagerTests {

	private CancellationManager manager;

	@BeforeEach
	void setUp() {
		this.manager = new CancellationManager();
	}

	@Test
	void cancelReachesTrackedToken() {
		CancellationToken token = this.manager.register("req-1");

		assertThat(this.manager.cancel("req-1", "client gave up")).isTrue();

		assertThat(token.isCancelled()).isTrue();
		assertThat(token.reason()).isEqualTo("client gave up");
	}

	@Test
	void cancelOfUnknownRequestIsIgnored() {
		assertThat(this.manager.cancel(42, "late")).isFalse();
	}

	@Test
	void unregisterStopsTracking() {
		CancellationToken token = this.manager.register(7);
		assertThat(this.manager.unregister(7)).isTrue();
		assertThat(this.manager.unregister(7)).isFalse();

		this.manager.cancel(7, "too late");
		assertThat(token.isCancelled()).isFalse();
		assertThat(this.manager.token(7)).isEmpty();
	}

	@Test
	void rejectsDuplicateInFlightId() {
		this.manager.register("dup");
		assertThatThrownBy(() -> this.manager.register("dup")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void cancelAllCancelsEveryTrackedRequest() {
		CancellationToken first = this.manager.register(1);
		CancellationToken second = this.manager.register(2, CancellationToken.none());

		assertThat(this.manager.activeRequestIds()).containsExactly(1, 2);
		assertThat(this.manager.cancelAll("shutdown")).isEqualTo(2);

		assertThat(first.reason()).isEqualTo("shutdown");
		assertThat(second.reason()).isEqualTo("shutdown");
	}

	@Test
	void registrationKeepsMetadata() {
		Instant now = Instant.parse("2026-05-01T12:00:00Z");
		Clock clock = mock(Clock.class);
		when(clock.instant()).thenReturn(now);
		CancellationManager manager = new CancellationManager(clock, CancellationFaultHandler.logging());

		manager.register("req-1", Map.of("method", "tools/call"));

		assertThat(manager.hasRequest("req-1")).isTrue();
		assertThat(manager.activeRequestCount()).isEqualTo(1);
		assertThat(manager.requestMetadata("req-1")).contains(
				Map.of("method", "tools/call", "requestId", "req-1", "registeredAt", now));
		assertThat(manager.requestMetadata("other")).isEmpty();
	}

	@Test
	void globalListenerSeesCancelledRequests() {
		List<Object> seen = new ArrayList<>();
		this.manager.setGlobalCancellationListener((requestId, token, metadata) -> seen
			.add(requestId + ":" + token.reason() + ":" + metadata.get("method")));
		this.manager.register(5, Map.of("method", "prompts/get"));

		this.manager.cancel(5, "stop");
		this.manager.cancel(6, "unknown");

		assertThat(seen).containsExactly("5:stop:prompts/get");
		assertThat(this.manager.hasRequest(5)).isTrue();
	}

	@Test
	void failingGlobalListenerGoesToFaultHandler() {
		CancellationFaultHandler faultHandler = mock(CancellationFaultHandler.class);
		CancellationManager manager = new CancellationManager(Clock.systemUTC(), faultHandler);
		IllegalStateException boom = new IllegalStateException("listener");
		manager.setGlobalCancellationListener((requestId, token, metadata) -> {
			throw boom;
		});
		CancellationToken token = manager.register("r");

		assertThat(manager.cancel("r", "bye")).isTrue();

		assertThat(token.isCancelled()).isTrue();
		verify(faultHandler).handleFault(same(token), same(boom));
	}

	@Test
	void cleanupDropsRequestsOlderThanMaxAge() {
		Instant start = Instant.parse("2026-05-01T12:00:00Z");
		Clock clock = mock(Clock.class);
		when(clock.instant()).thenReturn(start, start.plusSeconds(50), start.plusSeconds(100));
		CancellationManager manager = new CancellationManager(clock, CancellationFaultHandler.logging());
		CancellationToken old = manager.register("old");
		manager.register("recent");

		assertThat(manager.cleanupOldRequests(Duration.ofSeconds(60))).isEqualTo(1);

		assertThat(manager.activeRequestIds()).containsExactly("recent");
		assertThat(old.isCancelled()).isFalse();
	}

	@Test
	void statsReportRequestAges() {
		Instant start = Instant.parse("2026-05-01T12:00:00Z");
		Clock clock = mock(Clock.class);
		when(clock.instant()).thenReturn(start, start.plusSeconds(20), start.plusSeconds(30));
		CancellationManager manager = new CancellationManager(clock, CancellationFaultHandler.logging());
		manager.register("a");
		manager.register("b");

		CancellationManager.Stats stats = manager.stats();

		assertThat(stats.activeRequestCount()).isEqualTo(2);
		assertThat(stats.oldestRequestAge()).isEqualTo(Duration.ofSeconds(30));
		assertThat(stats.averageRequestAge()).isEqualTo(Duration.ofSeconds(20));
		assertThat(stats.requestIds()).containsExactly("a", "b");
	}

	@Test
	void statsOfIdleManager() {
		CancellationManager.Stats stats = this.manager.stats();

		assertThat(stats.activeRequestCount()).isZero();
		assertThat(stats.oldestRequestAge()).isNull();
		assertThat(stats.averageRequestAge()).isNull();
		assertThat(stats.requestIds()).isEmpty();
	}

}
