/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

@ExtendWith(MockitoExtension.class)
class CancellationTokenTests {

	private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

	@Mock
	private CancellationFaultHandler faultHandler;

	private CancellationToken newToken() {
		return new CancellationToken(Clock.fixed(NOW, ZoneOffset.UTC), this.faultHandler);
	}

	@Test
	void startsPending() {
		CancellationToken token = newToken();
		assertThat(token.isCancelled()).isFalse();
		assertThat(token.reason()).isNull();
		assertThat(token.cancelledAt()).isNull();
		assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();
	}

	@Test
	void firstCancelWins() {
		CancellationToken token = newToken();
		token.cancel("a");
		token.cancel("b");

		assertThat(token.isCancelled()).isTrue();
		assertThat(token.reason()).isEqualTo("a");
		assertThat(token.cancelledAt()).isEqualTo(NOW);
	}

	@Test
	void throwIfCancelledCarriesReasonAndToken() {
		CancellationToken token = newToken();
		token.cancel("user aborted");

		assertThatThrownBy(token::throwIfCancelled).isInstanceOfSatisfying(McpCancellationException.class, ex -> {
			assertThat(ex.getReason()).isEqualTo("user aborted");
			assertThat(ex.getToken()).isSameAs(token);
			assertThat(ex.getJsonRpcError().code()).isEqualTo(-32001);
		});
	}

	@Test
	void callbacksRunOnceInRegistrationOrder() {
		CancellationToken token = newToken();
		List<String> calls = new ArrayList<>();
		token.onCancelled(reason -> calls.add("first:" + reason));
		token.onCancelled(reason -> calls.add("second:" + reason));

		token.cancel("timeout");
		token.cancel("again");

		assertThat(calls).containsExactly("first:timeout", "second:timeout");
	}

	@Test
	void lateSubscriberRunsImmediatelyExactlyOnce() {
		CancellationToken token = newToken();
		token.cancel("done");
		AtomicInteger calls = new AtomicInteger();

		token.onCancelled(reason -> calls.incrementAndGet());
		token.cancel("done again");

		assertThat(calls).hasValue(1);
	}

	@Test
	void faultyCallbackIsIsolated() {
		CancellationToken token = newToken();
		IllegalStateException boom = new IllegalStateException("boom");
		List<String> calls = new ArrayList<>();
		token.onCancelled(reason -> {
			throw boom;
		});
		token.onCancelled(reason -> calls.add("after"));

		assertThatCode(() -> token.cancel("stop")).doesNotThrowAnyException();

		assertThat(calls).containsExactly("after");
		verify(this.faultHandler).handleFault(same(token), same(boom));
	}

	@Test
	void faultInLateSubscriberIsIsolated() {
		CancellationToken token = newToken();
		token.cancel("stop");

		assertThatCode(() -> token.onCancelled(reason -> {
			throw new IllegalArgumentException("late");
		})).doesNotThrowAnyException();
		verify(this.faultHandler).handleFault(same(token), any(IllegalArgumentException.class));
	}

	@Test
	void noFaultsNoReports() {
		CancellationToken token = newToken();
		token.onCancelled(reason -> {
		});
		token.cancel(null);
		verify(this.faultHandler, never()).handleFault(any(), any());
	}

	@Test
	void factories() {
		assertThat(CancellationToken.none().isCancelled()).isFalse();
		CancellationToken cancelled = CancellationToken.cancelled("gone");
		assertThat(cancelled.isCancelled()).isTrue();
		assertThat(cancelled.reason()).isEqualTo("gone");
		assertThat(cancelled.cancelledAt()).isNotNull();
	}

	@Test
	void cancelAfterFiresWhenTimeElapses() {
		VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
		CancellationToken token = CancellationToken.cancelAfter(Duration.ofSeconds(30), "timeout", scheduler);

		scheduler.advanceTimeBy(Duration.ofSeconds(29));
		assertThat(token.isCancelled()).isFalse();

		scheduler.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(token.isCancelled()).isTrue();
		assertThat(token.reason()).isEqualTo("timeout");
	}

	@Test
	void earlyCancelDisarmsTimer() {
		VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
		CancellationToken token = CancellationToken.cancelAfter(Duration.ofSeconds(30), "timeout", scheduler);

		token.cancel("user");
		scheduler.advanceTimeBy(Duration.ofMinutes(1));

		assertThat(token.reason()).isEqualTo("user");
	}

	@Test
	void cancelledFactoryUsesGivenClockAndFaultHandler() {
		IllegalStateException boom = new IllegalStateException("late");
		CancellationToken token = CancellationToken.cancelled("gone", Clock.fixed(NOW, ZoneOffset.UTC),
				this.faultHandler);

		token.onCancelled(reason -> {
			throw boom;
		});

		assertThat(token.cancelledAt()).isEqualTo(NOW);
		verify(this.faultHandler).handleFault(same(token), same(boom));
	}

	@Test
	void cancelAfterUsesGivenClockAndFaultHandler() {
		VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
		IllegalStateException boom = new IllegalStateException("cleanup");
		CancellationToken token = CancellationToken.cancelAfter(Duration.ofSeconds(5), "timeout", scheduler,
				Clock.fixed(NOW, ZoneOffset.UTC), this.faultHandler);
		token.onCancelled(reason -> {
			throw boom;
		});

		scheduler.advanceTimeBy(Duration.ofSeconds(5));

		assertThat(token.reason()).isEqualTo("timeout");
		assertThat(token.cancelledAt()).isEqualTo(NOW);
		verify(this.faultHandler).handleFault(same(token), same(boom));
	}

	@Test
	void cancelAfterRejectsNegativeTimeout() {
		assertThatThrownBy(
				() -> CancellationToken.cancelAfter(Duration.ofSeconds(-1), "x", VirtualTimeScheduler.create()))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
