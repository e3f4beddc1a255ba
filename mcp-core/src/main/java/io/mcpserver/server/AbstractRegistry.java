/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import io.mcpserver.cancellation.CancellationToken;
import io.mcpserver.recovery.ErrorRecovery;
import io.mcpserver.recovery.RecoveryOptions;
import io.mcpserver.schema.SchemaValidator;
import io.mcpserver.spec.McpError;
import io.mcpserver.spec.McpInternalException;
import io.mcpserver.spec.McpNotFoundException;
import io.mcpserver.spec.NotificationQueue;
import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Base class of the tool, resource and prompt registries.
 *
 * <p>
 * Entities are kept in first-registration order. Every successful mutation enqueues one
 * list-changed notification when a {@link NotificationQueue} is attached. Mutations
 * synchronize on the registry; handlers always run outside that lock.
 *
 * @param <E> the entity type
 */
public abstract class AbstractRegistry<E extends RegisteredEntity> {

	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private final Map<String, E> entities = new LinkedHashMap<>();

	@Nullable
	private final NotificationQueue notificationQueue;

	private final SchemaValidator validator;

	private final DuplicateNamePolicy duplicateNamePolicy;

	@Nullable
	private volatile HandlerRecovery recovery;

	protected AbstractRegistry(@Nullable NotificationQueue notificationQueue, SchemaValidator validator,
			DuplicateNamePolicy duplicateNamePolicy) {
		Assert.notNull(validator, "Schema validator must not be null");
		Assert.notNull(duplicateNamePolicy, "Duplicate name policy must not be null");
		this.notificationQueue = notificationQueue;
		this.validator = validator;
		this.duplicateNamePolicy = duplicateNamePolicy;
	}

	/**
	 * @return the entity kind used in log and error messages, e.g. "Tool"
	 */
	protected abstract String kind();

	/**
	 * Enqueue the list-changed notification of this registry's entity kind.
	 */
	protected abstract void notifyListChanged(NotificationQueue queue);

	/**
	 * Run the entity's handler with already validated arguments.
	 */
	protected abstract Object invoke(E entity, Map<String, Object> arguments, CancellationToken token)
			throws Exception;

	/**
	 * Store an entity, replacing or rejecting an existing one with the same name
	 * according to the {@link DuplicateNamePolicy}.
	 * @param entity the entity
	 * @return the stored entity
	 */
	protected E store(E entity) {
		Assert.notNull(entity, kind() + " must not be null");
		synchronized (this) {
			boolean replacing = this.entities.containsKey(entity.name());
			if (replacing && this.duplicateNamePolicy == DuplicateNamePolicy.REJECT) {
				throw new IllegalStateException(kind() + " '" + entity.name() + "' is already registered");
			}
			this.entities.put(entity.name(), entity);
			logger.debug("{} {} '{}'", replacing ? "Replaced" : "Registered", kind().toLowerCase(Locale.ROOT),
					entity.name());
		}
		listChanged();
		return entity;
	}

	public synchronized Optional<E> get(String name) {
		return Optional.ofNullable(this.entities.get(name));
	}

	public synchronized boolean exists(String name) {
		return this.entities.containsKey(name);
	}

	public synchronized int count() {
		return this.entities.size();
	}

	/**
	 * @return registered names in first-registration order
	 */
	public synchronized List<String> names() {
		return List.copyOf(this.entities.keySet());
	}

	/**
	 * @return metadata of every entity in first-registration order
	 */
	public List<Map<String, Object>> list() {
		List<Map<String, Object>> metadata = new ArrayList<>();
		for (E entity : snapshot()) {
			metadata.add(entity.toMetadata());
		}
		return metadata;
	}

	/**
	 * Remove an entity.
	 * @param name the entity name
	 * @return {@code false} if no entity had that name
	 */
	public boolean remove(String name) {
		synchronized (this) {
			if (this.entities.remove(name) == null) {
				return false;
			}
			logger.debug("Removed {} '{}'", kind().toLowerCase(Locale.ROOT), name);
		}
		listChanged();
		return true;
	}

	/**
	 * Remove every entity. Always enqueues exactly one notification when a queue is
	 * attached, even if the registry was already empty.
	 */
	public void clear() {
		synchronized (this) {
			this.entities.clear();
		}
		listChanged();
	}

	/**
	 * Run every handler of this registry under an error recovery strategy. Circuit
	 * breaker and fallback handler names default to the entity kind and name, e.g.
	 * {@code tool:weather}.
	 * @param recovery the recovery to use, {@code null} to run handlers directly
	 * @param options the strategy and its settings, required with a recovery
	 */
	public void setRecovery(@Nullable ErrorRecovery recovery, @Nullable RecoveryOptions options) {
		if (recovery == null) {
			this.recovery = null;
			return;
		}
		Assert.notNull(options, "Recovery options must not be null");
		this.recovery = new HandlerRecovery(recovery, options);
	}

	public Object execute(String name, Map<String, Object> arguments) {
		return execute(name, arguments, CancellationToken.none());
	}

	/**
	 * Validate the arguments and run the entity's handler.
	 * @param name the entity name
	 * @param arguments invocation arguments, {@code null} is treated as empty
	 * @param token cancellation token handed to the handler
	 * @return the handler result, unchanged
	 * @throws McpNotFoundException if no entity has that name
	 * @throws io.mcpserver.schema.McpValidationException if the arguments are invalid,
	 * in which case the handler does not run
	 * @throws io.mcpserver.cancellation.McpCancellationException if the token is
	 * cancelled before or while the handler runs
	 * @throws McpInternalException if the handler fails
	 */
	public Object execute(String name, @Nullable Map<String, Object> arguments, CancellationToken token) {
		E entity = get(name).orElseThrow(() -> new McpNotFoundException(kind(), name));
		Map<String, Object> args = arguments != null ? arguments : Map.of();
		this.validator.validate(args, entity.schema());
		return guard(entity, () -> invoke(entity, args, token), token);
	}

	/**
	 * Run a handler call, translating faults into {@link McpInternalException}. The
	 * core's own {@link McpError}s pass through unchanged.
	 */
	protected Object guard(E entity, HandlerCall call, CancellationToken token) {
		Assert.notNull(token, "Cancellation token must not be null");
		token.throwIfCancelled();
		HandlerRecovery handlerRecovery = this.recovery;
		try {
			if (handlerRecovery == null) {
				return call.call();
			}
			RecoveryOptions options = handlerRecovery.options()
				.withDefaultName(kind().toLowerCase(Locale.ROOT) + ":" + entity.name());
			return handlerRecovery.recovery().executeWithRecovery(() -> {
				token.throwIfCancelled();
				return call.call();
			}, options);
		}
		catch (McpError ex) {
			throw ex;
		}
		catch (Exception ex) {
			logger.error("{} '{}' failed", kind(), entity.name(), ex);
			throw new McpInternalException(kind() + " '" + entity.name() + "' failed: " + ex.getMessage(), ex);
		}
	}

	protected synchronized List<E> snapshot() {
		return new ArrayList<>(this.entities.values());
	}

	private void listChanged() {
		if (this.notificationQueue != null) {
			notifyListChanged(this.notificationQueue);
		}
	}

	private record HandlerRecovery(ErrorRecovery recovery, RecoveryOptions options) {
	}

	/**
	 * A handler invocation that may throw.
	 */
	@FunctionalInterface
	protected interface HandlerCall {

		Object call() throws Exception;

	}

}
