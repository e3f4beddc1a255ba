/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.cancellation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Tracks the cancellation tokens of in-flight requests by request id, so that a
 * {@code notifications/cancelled} message from the peer can reach the running handler.
 *
 * <p>
 * Each tracked request carries metadata: whatever the caller supplied at registration,
 * plus {@code requestId} and {@code registeredAt}. A cancelled request stays tracked
 * until it is unregistered or cleaned up.
 */
public class CancellationManager {

	/**
	 * Notified after any tracked request has been cancelled.
	 */
	@FunctionalInterface
	public interface CancellationListener {

		void requestCancelled(Object requestId, CancellationToken token, Map<String, Object> metadata);

	}

	/**
	 * Snapshot of the tracked requests.
	 *
	 * @param activeRequestCount number of tracked requests
	 * @param oldestRequestAge age of the oldest request, {@code null} when none is tracked
	 * @param averageRequestAge mean age, {@code null} when none is tracked
	 * @param requestIds tracked ids in registration order
	 */
	public record Stats(int activeRequestCount, @Nullable Duration oldestRequestAge,
			@Nullable Duration averageRequestAge, List<Object> requestIds) {
	}

	private record TrackedRequest(CancellationToken token, Instant registeredAt, Map<String, Object> metadata) {
	}

	private static final Logger logger = LoggerFactory.getLogger(CancellationManager.class);

	private final Clock clock;

	private final CancellationFaultHandler faultHandler;

	private final Map<Object, TrackedRequest> requests = new LinkedHashMap<>();

	@Nullable
	private volatile CancellationListener globalListener;

	public CancellationManager() {
		this(Clock.systemUTC(), CancellationFaultHandler.logging());
	}

	public CancellationManager(Clock clock, CancellationFaultHandler faultHandler) {
		Assert.notNull(clock, "Clock must not be null");
		Assert.notNull(faultHandler, "Fault handler must not be null");
		this.clock = clock;
		this.faultHandler = faultHandler;
	}

	/**
	 * Create and track a token for a request.
	 * @param requestId the request id
	 * @return the new pending token
	 * @throws IllegalStateException if a request with this id is already in flight
	 */
	public CancellationToken register(Object requestId) {
		return register(requestId, Map.of());
	}

	/**
	 * Create and track a token for a request, keeping metadata such as the method name.
	 * @param requestId the request id
	 * @param metadata caller supplied metadata
	 * @return the new pending token
	 * @throws IllegalStateException if a request with this id is already in flight
	 */
	public CancellationToken register(Object requestId, Map<String, ?> metadata) {
		return register(requestId, new CancellationToken(this.clock, this.faultHandler), metadata);
	}

	/**
	 * Track an existing token for a request.
	 * @param requestId the request id
	 * @param token the token to track
	 * @return the token
	 * @throws IllegalStateException if a request with this id is already in flight
	 */
	public CancellationToken register(Object requestId, CancellationToken token) {
		return register(requestId, token, Map.of());
	}

	private synchronized CancellationToken register(Object requestId, CancellationToken token,
			Map<String, ?> metadata) {
		Assert.notNull(requestId, "Request id must not be null");
		Assert.notNull(token, "Token must not be null");
		Assert.notNull(metadata, "Metadata must not be null");
		if (this.requests.containsKey(requestId)) {
			throw new IllegalStateException("Request " + requestId + " is already in flight");
		}
		Instant registeredAt = this.clock.instant();
		Map<String, Object> tracked = new LinkedHashMap<>(metadata);
		tracked.put("registeredAt", registeredAt);
		tracked.put("requestId", requestId);
		this.requests.put(requestId, new TrackedRequest(token, registeredAt, tracked));
		logger.debug("Tracking request {} {}", requestId, metadata);
		return token;
	}

	/**
	 * Stop tracking a request, typically once its response has been produced.
	 * @return whether the request was tracked
	 */
	public synchronized boolean unregister(Object requestId) {
		return this.requests.remove(requestId) != null;
	}

	/**
	 * Cancel a tracked request. Unknown ids are ignored, as the request may already have
	 * completed.
	 * @param requestId the request id
	 * @param reason optional reason
	 * @return whether a tracked request was found
	 */
	public boolean cancel(Object requestId, @Nullable String reason) {
		TrackedRequest request;
		synchronized (this) {
			request = this.requests.get(requestId);
		}
		if (request == null) {
			logger.debug("Ignoring cancellation of unknown request {}", requestId);
			return false;
		}
		logger.debug("Cancelling request {} (reason: {})", requestId, reason);
		request.token().cancel(reason);
		notifyListener(requestId, request);
		return true;
	}

	/**
	 * Cancel every tracked request.
	 * @return the number of requests cancelled
	 */
	public int cancelAll(@Nullable String reason) {
		List<Object> requestIds = activeRequestIds();
		int cancelled = 0;
		for (Object requestId : requestIds) {
			if (cancel(requestId, reason)) {
				cancelled++;
			}
		}
		if (cancelled > 0) {
			logger.info("Cancelled {} active requests (reason: {})", cancelled, reason);
		}
		return cancelled;
	}

	/**
	 * Set the listener notified after every successful {@link #cancel}. A failing
	 * listener is reported to the fault handler and does not affect the cancellation.
	 * @param listener the listener, {@code null} to remove it
	 */
	public void setGlobalCancellationListener(@Nullable CancellationListener listener) {
		this.globalListener = listener;
	}

	/**
	 * Stop tracking requests registered longer than {@code maxAge} ago. Their tokens are
	 * left untouched.
	 * @param maxAge maximum age of a tracked request
	 * @return the number of requests dropped
	 */
	public int cleanupOldRequests(Duration maxAge) {
		Assert.notNull(maxAge, "Max age must not be null");
		Instant now = this.clock.instant();
		int removed = 0;
		synchronized (this) {
			Iterator<TrackedRequest> iterator = this.requests.values().iterator();
			while (iterator.hasNext()) {
				if (Duration.between(iterator.next().registeredAt(), now).compareTo(maxAge) > 0) {
					iterator.remove();
					removed++;
				}
			}
		}
		if (removed > 0) {
			logger.info("Dropped {} requests older than {}", removed, maxAge);
		}
		return removed;
	}

	public synchronized Optional<CancellationToken> token(Object requestId) {
		TrackedRequest request = this.requests.get(requestId);
		return request != null ? Optional.of(request.token()) : Optional.empty();
	}

	/**
	 * @return the request's metadata, including {@code requestId} and
	 * {@code registeredAt}
	 */
	public synchronized Optional<Map<String, Object>> requestMetadata(Object requestId) {
		TrackedRequest request = this.requests.get(requestId);
		return request != null ? Optional.of(new LinkedHashMap<>(request.metadata())) : Optional.empty();
	}

	public synchronized boolean hasRequest(Object requestId) {
		return this.requests.containsKey(requestId);
	}

	public synchronized int activeRequestCount() {
		return this.requests.size();
	}

	/**
	 * @return ids of tracked requests in registration order
	 */
	public synchronized List<Object> activeRequestIds() {
		return List.copyOf(this.requests.keySet());
	}

	public Stats stats() {
		Instant now = this.clock.instant();
		List<TrackedRequest> snapshot;
		List<Object> requestIds;
		synchronized (this) {
			snapshot = new ArrayList<>(this.requests.values());
			requestIds = List.copyOf(this.requests.keySet());
		}
		if (snapshot.isEmpty()) {
			return new Stats(0, null, null, requestIds);
		}
		Duration oldest = Duration.ZERO;
		Duration total = Duration.ZERO;
		for (TrackedRequest request : snapshot) {
			Duration age = Duration.between(request.registeredAt(), now);
			if (age.compareTo(oldest) > 0) {
				oldest = age;
			}
			total = total.plus(age);
		}
		return new Stats(snapshot.size(), oldest, total.dividedBy(snapshot.size()), requestIds);
	}

	private void notifyListener(Object requestId, TrackedRequest request) {
		CancellationListener listener = this.globalListener;
		if (listener == null) {
			return;
		}
		try {
			listener.requestCancelled(requestId, request.token(), new LinkedHashMap<>(request.metadata()));
		}
		catch (Exception ex) {
			this.faultHandler.handleFault(request.token(), ex);
		}
	}

}
