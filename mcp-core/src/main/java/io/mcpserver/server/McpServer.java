/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.mcpserver.cancellation.CancellationFaultHandler;
import io.mcpserver.cancellation.CancellationManager;
import io.mcpserver.cancellation.CancellationToken;
import io.mcpserver.health.HealthMonitor;
import io.mcpserver.json.McpJsonMapper;
import io.mcpserver.recovery.ErrorRecovery;
import io.mcpserver.recovery.RecoveryOptions;
import io.mcpserver.schema.McpValidationException;
import io.mcpserver.schema.McpValidationException.Constraint;
import io.mcpserver.schema.McpValidationException.Violation;
import io.mcpserver.schema.SchemaValidator;
import io.mcpserver.spec.CapabilitySet;
import io.mcpserver.spec.ErrorKind;
import io.mcpserver.spec.McpError;
import io.mcpserver.spec.McpInternalException;
import io.mcpserver.spec.McpNotFoundException;
import io.mcpserver.spec.McpProtocolException;
import io.mcpserver.spec.McpSchema;
import io.mcpserver.spec.McpSchema.Implementation;
import io.mcpserver.spec.McpSchema.JSONRPCError;
import io.mcpserver.spec.McpSchema.LoggingLevel;
import io.mcpserver.spec.McpSchema.Notification;
import io.mcpserver.spec.NotificationQueue;
import io.mcpserver.spec.SessionManager;
import io.mcpserver.util.Assert;
import io.mcpserver.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Composition root of an MCP server: owns the tool, resource and prompt registries, the
 * notification queue, the session manager and the cancellation manager, and routes
 * protocol methods to them.
 *
 * <p>
 * Dispatch is synchronous: {@link #handle(String, Map, Object)} runs the handler on the
 * calling thread. It is the only place where exceptions become error responses; the
 * peer sees each {@link ErrorKind}'s generic message while details are logged.
 *
 * <pre>{@code
 * McpServer server = McpServer.builder().serverInfo("demo", "1.0.0").build();
 * server.tools().register("echo", schema, (args, token) -> args.get("text"));
 * McpResponse response = server.handle("tools/call", Map.of("name", "echo", "arguments", args));
 * }</pre>
 */
public class McpServer {

	private static final Logger logger = LoggerFactory.getLogger(McpServer.class);

	private static final String TEXT_PLAIN = "text/plain";

	private static final String APPLICATION_JSON = "application/json";

	private static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

	@FunctionalInterface
	private interface RequestHandler {

		Map<String, Object> handle(Map<String, Object> params, CancellationToken token);

	}

	@FunctionalInterface
	private interface NotificationHandler {

		void handle(Map<String, Object> params);

	}

	private final Implementation serverInfo;

	@Nullable
	private final String instructions;

	private final CapabilitySet declaredCapabilities;

	private final NotificationQueue notificationQueue;

	private final ToolRegistry tools;

	private final ResourceRegistry resources;

	private final PromptRegistry prompts;

	private final SessionManager sessionManager;

	private final CancellationManager cancellationManager;

	private final McpJsonMapper jsonMapper;

	private final Clock clock;

	private final CancellationFaultHandler faultHandler;

	@Nullable
	private final HealthMonitor healthMonitor;

	private final Set<String> subscriptions = new LinkedHashSet<>();

	private final Map<String, RequestHandler> requestHandlers = new LinkedHashMap<>();

	private final Map<String, NotificationHandler> notificationHandlers = new LinkedHashMap<>();

	@Nullable
	private volatile Map<String, Object> clientInfo;

	@Nullable
	private volatile Map<String, Object> clientCapabilities;

	private volatile boolean clientInitialized;

	private McpServer(Builder builder) {
		this.serverInfo = builder.serverInfo;
		this.instructions = builder.instructions;
		this.declaredCapabilities = builder.capabilities.copy();
		this.notificationQueue = new NotificationQueue();
		this.tools = new ToolRegistry(this.notificationQueue, builder.schemaValidator, builder.duplicateNamePolicy,
				builder.toolNamePolicy);
		this.resources = new ResourceRegistry(this.notificationQueue, builder.schemaValidator,
				builder.duplicateNamePolicy);
		this.prompts = new PromptRegistry(this.notificationQueue, builder.schemaValidator,
				builder.duplicateNamePolicy);
		this.sessionManager = builder.sessionManager != null ? builder.sessionManager
				: new SessionManager(builder.secureRandom != null ? builder.secureRandom : new SecureRandom());
		this.clock = builder.clock;
		this.faultHandler = builder.faultHandler;
		this.cancellationManager = new CancellationManager(this.clock, this.faultHandler);
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonMapper.createDefault();
		this.healthMonitor = builder.healthMonitor;
		if (builder.errorRecovery != null) {
			this.tools.setRecovery(builder.errorRecovery, builder.recoveryOptions);
			this.resources.setRecovery(builder.errorRecovery, builder.recoveryOptions);
			this.prompts.setRecovery(builder.errorRecovery, builder.recoveryOptions);
		}

		this.requestHandlers.put(McpSchema.METHOD_INITIALIZE, (params, token) -> initialize(params));
		this.requestHandlers.put(McpSchema.METHOD_PING, (params, token) -> new LinkedHashMap<>());
		this.requestHandlers.put(McpSchema.METHOD_TOOLS_LIST, (params, token) -> Map.of("tools", this.tools.list()));
		this.requestHandlers.put(McpSchema.METHOD_TOOLS_CALL, this::callTool);
		this.requestHandlers.put(McpSchema.METHOD_RESOURCES_LIST,
				(params, token) -> Map.of("resources", this.resources.list()));
		this.requestHandlers.put(McpSchema.METHOD_RESOURCES_TEMPLATES_LIST,
				(params, token) -> Map.of("resourceTemplates", this.resources.listTemplates()));
		this.requestHandlers.put(McpSchema.METHOD_RESOURCES_READ, this::readResource);
		this.requestHandlers.put(McpSchema.METHOD_RESOURCES_SUBSCRIBE, (params, token) -> subscribe(params));
		this.requestHandlers.put(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE, (params, token) -> unsubscribe(params));
		this.requestHandlers.put(McpSchema.METHOD_PROMPT_LIST,
				(params, token) -> Map.of("prompts", this.prompts.list()));
		this.requestHandlers.put(McpSchema.METHOD_PROMPT_GET, this::getPrompt);

		this.notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_INITIALIZED, params -> {
			this.clientInitialized = true;
			logger.debug("Client initialized");
		});
		this.notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_CANCELLED, this::cancelRequest);
	}

	public static Builder builder() {
		return new Builder();
	}

	// ---------------------------------------
	// Dispatch
	// ---------------------------------------

	public McpResponse handle(String method, @Nullable Map<String, Object> params) {
		return handle(method, params, null);
	}

	/**
	 * Dispatch a request.
	 * @param method the protocol method, e.g. {@code tools/call}
	 * @param params the request params, {@code null} is treated as empty
	 * @param requestId the request id; when given, the request can be cancelled through
	 * {@code notifications/cancelled} while it runs
	 * @return the result or the error to send back
	 */
	public McpResponse handle(String method, @Nullable Map<String, Object> params, @Nullable Object requestId) {
		RequestHandler handler = this.requestHandlers.get(method);
		if (handler == null) {
			logger.debug("Method not found: {}", method);
			return McpResponse.failure(new JSONRPCError(ErrorKind.METHOD_NOT_FOUND.code(),
					ErrorKind.METHOD_NOT_FOUND.message(), Map.of("method", String.valueOf(method))));
		}
		if (this.healthMonitor != null && requestId != null && McpSchema.METHOD_PING.equals(method)) {
			this.healthMonitor.handlePingResponse(requestId);
		}
		Map<String, Object> safeParams = params != null ? params : Map.of();
		CancellationToken token;
		if (requestId == null) {
			token = new CancellationToken(this.clock, this.faultHandler);
		}
		else {
			try {
				token = this.cancellationManager.register(requestId, Map.of("method", method));
			}
			catch (IllegalStateException ex) {
				logger.warn("Rejecting {}: {}", method, ex.getMessage());
				return McpResponse.failure(new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST,
						"Duplicate request id", Map.of("requestId", requestId)));
			}
		}
		try {
			logger.debug("Handling {} (request id: {})", method, requestId);
			return McpResponse.success(handler.handle(safeParams, token));
		}
		catch (McpInternalException ex) {
			logger.error("Request {} failed", method, ex);
			return McpResponse.failure(ex.getJsonRpcError());
		}
		catch (McpError ex) {
			logger.debug("Request {} rejected: {}", method, ex.getMessage());
			return McpResponse.failure(ex.getJsonRpcError());
		}
		catch (RuntimeException ex) {
			logger.error("Unexpected failure handling {}", method, ex);
			return McpResponse.failure(
					new JSONRPCError(ErrorKind.INTERNAL.code(), ErrorKind.INTERNAL.message(), null));
		}
		finally {
			if (requestId != null) {
				this.cancellationManager.unregister(requestId);
			}
		}
	}

	/**
	 * Dispatch a notification from the peer. Unknown notifications are logged and
	 * ignored.
	 * @param method the notification method
	 * @param params the notification params, {@code null} is treated as empty
	 */
	public void handleNotification(String method, @Nullable Map<String, Object> params) {
		NotificationHandler handler = this.notificationHandlers.get(method);
		if (handler == null) {
			logger.warn("Missing handler for notification type: {}", method);
			return;
		}
		handler.handle(params != null ? params : Map.of());
	}

	// ---------------------------------------
	// Lifecycle
	// ---------------------------------------

	private Map<String, Object> initialize(Map<String, Object> params) {
		Object requested = params.get("protocolVersion");
		String version = requested instanceof String text ? text : null;
		if (!McpSchema.ProtocolVersions.isSupported(version)) {
			throw new McpProtocolException(version);
		}
		this.clientInfo = asMap(params.get("clientInfo"));
		this.clientCapabilities = asMap(params.get("capabilities"));
		logger.debug("Initialize with protocol version {} from {}", version, this.clientInfo);

		Map<String, Object> result = new LinkedHashMap<>();
		result.put("protocolVersion", McpSchema.ProtocolVersions.LATEST);
		result.put("capabilities", negotiatedCapabilities().toMap());
		result.put("serverInfo", this.serverInfo.toMap());
		if (this.instructions != null) {
			result.put("instructions", this.instructions);
		}
		return result;
	}

	/**
	 * Capabilities announced on {@code initialize}: list-changed support for tools,
	 * resources and prompts, resource subscriptions and logging, overlaid with the
	 * capabilities declared on the builder.
	 * @return a fresh capability set
	 */
	public CapabilitySet negotiatedCapabilities() {
		CapabilitySet defaults = CapabilitySet.builder()
			.logging()
			.prompts(true)
			.resources(true, true)
			.tools(true)
			.build();
		return defaults.merge(this.declaredCapabilities);
	}

	// ---------------------------------------
	// Tools, prompts and resources
	// ---------------------------------------

	private Map<String, Object> callTool(Map<String, Object> params, CancellationToken token) {
		String name = requiredString(params, "name");
		Object result = this.tools.execute(name, arguments(params), token);
		return toCallToolResult(result);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> toCallToolResult(@Nullable Object result) {
		if (result instanceof Map<?, ?> map && map.containsKey("content")) {
			return (Map<String, Object>) map;
		}
		Map<String, Object> text = new LinkedHashMap<>();
		text.put("type", "text");
		text.put("text", render(result));
		Map<String, Object> wrapped = new LinkedHashMap<>();
		wrapped.put("content", List.of(text));
		return wrapped;
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> getPrompt(Map<String, Object> params, CancellationToken token) {
		String name = requiredString(params, "name");
		return (Map<String, Object>) this.prompts.execute(name, arguments(params), token);
	}

	private Map<String, Object> readResource(Map<String, Object> params, CancellationToken token) {
		String uri = requiredString(params, "uri");
		Resource resource = this.resources.resolve(uri).orElseThrow(() -> McpNotFoundException.forUri(uri));
		Object result = this.resources.read(resource, uri, token);
		Map<String, Object> response = new LinkedHashMap<>();
		response.put("contents", normalizeContents(uri, resource.mimeType(), result));
		return response;
	}

	private List<Map<String, Object>> normalizeContents(String uri, @Nullable String mimeType,
			@Nullable Object result) {
		List<?> items;
		if (result instanceof Map<?, ?> map && map.get("contents") instanceof List<?> contents) {
			items = contents;
		}
		else if (result instanceof Map<?, ?> map && map.get("content") instanceof List<?> content) {
			items = content;
		}
		else if (result instanceof List<?> list) {
			items = list;
		}
		else {
			items = Collections.singletonList(result);
		}
		List<Map<String, Object>> normalized = new ArrayList<>(items.size());
		for (Object item : items) {
			normalized.add(normalizeItem(uri, mimeType, item));
		}
		return normalized;
	}

	private Map<String, Object> normalizeItem(String uri, @Nullable String mimeType, @Nullable Object item) {
		Map<String, Object> content = new LinkedHashMap<>();
		if (item instanceof String text) {
			content.put("uri", uri);
			content.put("mimeType", mimeType != null ? mimeType : TEXT_PLAIN);
			content.put("text", text);
			return content;
		}
		if (item instanceof Map<?, ?> map && (map.containsKey("text") || map.containsKey("blob")
				|| map.containsKey("data"))) {
			Object itemUri = map.get("uri");
			content.put("uri", itemUri != null ? itemUri.toString() : uri);
			String itemMimeType = itemMimeType(map, mimeType);
			if (map.containsKey("text")) {
				content.put("mimeType", itemMimeType != null ? itemMimeType : TEXT_PLAIN);
				content.put("text", String.valueOf(map.get("text")));
			}
			else {
				content.put("mimeType", itemMimeType != null ? itemMimeType : APPLICATION_OCTET_STREAM);
				content.put("blob", map.containsKey("blob") ? map.get("blob") : map.get("data"));
			}
			return content;
		}
		content.put("uri", uri);
		content.put("mimeType", APPLICATION_JSON);
		content.put("text", render(item));
		return content;
	}

	@Nullable
	private static String itemMimeType(Map<?, ?> item, @Nullable String fallback) {
		if (item.get("mimeType") instanceof String mimeType) {
			return mimeType;
		}
		// content items may carry the MIME type in "type", e.g. "text/markdown"
		if (item.get("type") instanceof String type && type.contains("/")) {
			return type;
		}
		return fallback;
	}

	private Map<String, Object> subscribe(Map<String, Object> params) {
		String uri = requiredString(params, "uri");
		if (this.resources.resolve(uri).isEmpty()) {
			throw McpNotFoundException.forUri(uri);
		}
		synchronized (this.subscriptions) {
			this.subscriptions.add(uri);
		}
		logger.debug("Subscribed to {}", uri);
		return new LinkedHashMap<>();
	}

	private Map<String, Object> unsubscribe(Map<String, Object> params) {
		String uri = requiredString(params, "uri");
		synchronized (this.subscriptions) {
			this.subscriptions.remove(uri);
		}
		logger.debug("Unsubscribed from {}", uri);
		return new LinkedHashMap<>();
	}

	/**
	 * Announce that a resource changed. Only subscribed URIs produce a notification.
	 * @param uri the changed resource
	 * @return whether a notification was queued
	 */
	public boolean notifyResourceUpdated(String uri) {
		synchronized (this.subscriptions) {
			if (!this.subscriptions.contains(uri)) {
				return false;
			}
		}
		this.notificationQueue.resourceUpdated(uri);
		return true;
	}

	public Set<String> subscriptions() {
		synchronized (this.subscriptions) {
			return Set.copyOf(this.subscriptions);
		}
	}

	/**
	 * Queue a {@code notifications/message} log message for the peer.
	 */
	public void sendLogMessage(LoggingLevel level, @Nullable String loggerName, Object data) {
		this.notificationQueue.logMessage(level, loggerName, data);
	}

	/**
	 * @return every pending notification, in FIFO order; the queue is emptied
	 */
	public List<Notification> drainNotifications() {
		return this.notificationQueue.drain();
	}

	private void cancelRequest(Map<String, Object> params) {
		Object requestId = params.get("requestId");
		if (requestId == null) {
			logger.warn("Ignoring {} without requestId", McpSchema.METHOD_NOTIFICATION_CANCELLED);
			return;
		}
		Object reason = params.get("reason");
		this.cancellationManager.cancel(requestId, reason != null ? reason.toString() : null);
	}

	// ---------------------------------------
	// Helpers
	// ---------------------------------------

	private static String requiredString(Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value == null) {
			throw new McpValidationException(new Violation(key, Constraint.REQUIRED, "missing request parameter"));
		}
		if (!(value instanceof String text) || !Utils.hasText(text)) {
			throw new McpValidationException(new Violation(key, Constraint.TYPE, "expected a non-empty string"));
		}
		return text;
	}

	/**
	 * Arguments are read from {@code arguments}, falling back to the legacy
	 * {@code params} key.
	 */
	@SuppressWarnings("unchecked")
	private static Map<String, Object> arguments(Map<String, Object> params) {
		String key = params.containsKey("arguments") ? "arguments" : "params";
		Object arguments = params.get(key);
		if (arguments == null) {
			return Map.of();
		}
		if (!(arguments instanceof Map)) {
			throw new McpValidationException(new Violation(key, Constraint.TYPE, "expected an object"));
		}
		return (Map<String, Object>) arguments;
	}

	@Nullable
	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(@Nullable Object value) {
		return value instanceof Map<?, ?> map ? (Map<String, Object>) Utils.deepCopyValue(map) : null;
	}

	private String render(@Nullable Object value) {
		if (value instanceof String text) {
			return text;
		}
		try {
			return this.jsonMapper.writeValueAsString(value);
		}
		catch (IOException ex) {
			throw new McpInternalException("Failed to render result as JSON", ex);
		}
	}

	// ---------------------------------------
	// Accessors
	// ---------------------------------------

	public ToolRegistry tools() {
		return this.tools;
	}

	public ResourceRegistry resources() {
		return this.resources;
	}

	public PromptRegistry prompts() {
		return this.prompts;
	}

	public NotificationQueue notificationQueue() {
		return this.notificationQueue;
	}

	public SessionManager sessionManager() {
		return this.sessionManager;
	}

	public CancellationManager cancellationManager() {
		return this.cancellationManager;
	}

	public Optional<HealthMonitor> healthMonitor() {
		return Optional.ofNullable(this.healthMonitor);
	}

	public Implementation serverInfo() {
		return this.serverInfo;
	}

	public Optional<Map<String, Object>> clientInfo() {
		return Optional.ofNullable(this.clientInfo);
	}

	public Optional<Map<String, Object>> clientCapabilities() {
		return Optional.ofNullable(this.clientCapabilities);
	}

	public boolean isClientInitialized() {
		return this.clientInitialized;
	}

	/**
	 * Configures and creates an {@link McpServer}.
	 */
	public static final class Builder {

		private Implementation serverInfo = new Implementation("mcp-server", "1.0.0");

		@Nullable
		private String instructions;

		private CapabilitySet capabilities = CapabilitySet.empty();

		private DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.REPLACE;

		private ToolNamePolicy toolNamePolicy = ToolNamePolicy.ACCEPT;

		private SchemaValidator schemaValidator = SchemaValidator.createDefault();

		@Nullable
		private McpJsonMapper jsonMapper;

		@Nullable
		private SessionManager sessionManager;

		@Nullable
		private SecureRandom secureRandom;

		private Clock clock = Clock.systemUTC();

		private CancellationFaultHandler faultHandler = CancellationFaultHandler.logging();

		@Nullable
		private ErrorRecovery errorRecovery;

		@Nullable
		private RecoveryOptions recoveryOptions;

		@Nullable
		private HealthMonitor healthMonitor;

		private Builder() {
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be empty");
			Assert.hasText(version, "Version must not be empty");
			this.serverInfo = new Implementation(name, version);
			return this;
		}

		public Builder serverInfo(Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			return serverInfo(serverInfo.name(), serverInfo.version());
		}

		public Builder instructions(@Nullable String instructions) {
			this.instructions = instructions;
			return this;
		}

		/**
		 * Capabilities merged over the defaults on {@code initialize}; they win on
		 * conflicting keys.
		 */
		public Builder capabilities(CapabilitySet capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public Builder duplicateNamePolicy(DuplicateNamePolicy duplicateNamePolicy) {
			Assert.notNull(duplicateNamePolicy, "Duplicate name policy must not be null");
			this.duplicateNamePolicy = duplicateNamePolicy;
			return this;
		}

		/**
		 * Whether tool names are checked against the recommended character set.
		 * Defaults to {@link ToolNamePolicy#ACCEPT}.
		 */
		public Builder toolNamePolicy(ToolNamePolicy toolNamePolicy) {
			Assert.notNull(toolNamePolicy, "Tool name policy must not be null");
			this.toolNamePolicy = toolNamePolicy;
			return this;
		}

		public Builder schemaValidator(SchemaValidator schemaValidator) {
			Assert.notNull(schemaValidator, "Schema validator must not be null");
			this.schemaValidator = schemaValidator;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder sessionManager(SessionManager sessionManager) {
			Assert.notNull(sessionManager, "Session manager must not be null");
			this.sessionManager = sessionManager;
			return this;
		}

		/**
		 * Random source for session ids. Ignored when a session manager is supplied.
		 */
		public Builder secureRandom(SecureRandom secureRandom) {
			Assert.notNull(secureRandom, "Random source must not be null");
			this.secureRandom = secureRandom;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "Clock must not be null");
			this.clock = clock;
			return this;
		}

		public Builder cancellationFaultHandler(CancellationFaultHandler faultHandler) {
			Assert.notNull(faultHandler, "Fault handler must not be null");
			this.faultHandler = faultHandler;
			return this;
		}

		/**
		 * Run tool, resource and prompt handlers under an error recovery strategy.
		 */
		public Builder errorRecovery(ErrorRecovery errorRecovery, RecoveryOptions options) {
			Assert.notNull(errorRecovery, "Error recovery must not be null");
			Assert.notNull(options, "Recovery options must not be null");
			this.errorRecovery = errorRecovery;
			this.recoveryOptions = options;
			return this;
		}

		/**
		 * Monitor the peer connection. A {@code ping} request carrying the id of the
		 * monitor's pending ping counts as its answer.
		 */
		public Builder healthMonitor(HealthMonitor healthMonitor) {
			Assert.notNull(healthMonitor, "Health monitor must not be null");
			this.healthMonitor = healthMonitor;
			return this;
		}

		public McpServer build() {
			return new McpServer(this);
		}

	}

}
