/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.mcpserver.cancellation.CancellationToken;
import io.mcpserver.schema.SchemaValidator;
import io.mcpserver.spec.McpNotFoundException;
import io.mcpserver.spec.NotificationQueue;
import io.mcpserver.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Registry of literal and templated resources. Both kinds share one name space.
 *
 * <p>
 * {@link #read(String, CancellationToken)} resolves a URI against literal resources
 * first and then against templates in registration order.
 */
public class ResourceRegistry extends AbstractRegistry<Resource> {

	public ResourceRegistry() {
		this(null);
	}

	public ResourceRegistry(@Nullable NotificationQueue notificationQueue) {
		this(notificationQueue, SchemaValidator.createDefault(), DuplicateNamePolicy.REPLACE);
	}

	public ResourceRegistry(@Nullable NotificationQueue notificationQueue, SchemaValidator validator,
			DuplicateNamePolicy duplicateNamePolicy) {
		super(notificationQueue, validator, duplicateNamePolicy);
	}

	public Resource register(String name, String uri, ResourceHandler handler) {
		return register(Resource.literal(name, uri, null, null, handler));
	}

	public Resource register(String name, String uri, @Nullable String description, @Nullable String mimeType,
			ResourceHandler handler) {
		return register(Resource.literal(name, uri, description, mimeType, handler));
	}

	/**
	 * Register a literal resource whose contents never change.
	 * @param name the resource name
	 * @param uri the resource URI
	 * @param contents the contents returned on every read
	 * @return the registered resource
	 */
	public Resource registerStatic(String name, String uri, Object contents) {
		return registerStatic(name, uri, null, contents);
	}

	public Resource registerStatic(String name, String uri, @Nullable String mimeType, Object contents) {
		Assert.notNull(contents, "Resource contents must not be null");
		return register(Resource.literal(name, uri, null, mimeType, (u, variables, token) -> contents));
	}

	/**
	 * Register a resource template such as {@code user://{id}}.
	 * @param name the resource name
	 * @param uriTemplate the URI template
	 * @param handler called with the requested URI and the bound variables
	 * @return the registered resource
	 * @throws IllegalArgumentException if the template is malformed
	 */
	public Resource registerTemplate(String name, String uriTemplate, ResourceHandler handler) {
		return register(Resource.template(name, uriTemplate, null, null, handler));
	}

	public Resource registerTemplate(String name, String uriTemplate, @Nullable String description,
			@Nullable String mimeType, ResourceHandler handler) {
		return register(Resource.template(name, uriTemplate, description, mimeType, handler));
	}

	public Resource register(Resource resource) {
		return store(resource);
	}

	/**
	 * @return metadata of literal resources in first-registration order
	 */
	@Override
	public List<Map<String, Object>> list() {
		return metadata(false);
	}

	/**
	 * @return metadata of resource templates in first-registration order
	 */
	public List<Map<String, Object>> listTemplates() {
		return metadata(true);
	}

	private List<Map<String, Object>> metadata(boolean templates) {
		List<Map<String, Object>> metadata = new ArrayList<>();
		for (Resource resource : snapshot()) {
			if (resource.isTemplate() == templates) {
				metadata.add(resource.toMetadata());
			}
		}
		return metadata;
	}

	/**
	 * Find the resource serving a URI: a literal resource with that exact URI, otherwise
	 * the first template that matches it.
	 * @param uri the URI
	 * @return the resource, if any
	 */
	public Optional<Resource> resolve(String uri) {
		List<Resource> resources = snapshot();
		for (Resource resource : resources) {
			if (!resource.isTemplate() && resource.uri().equals(uri)) {
				return Optional.of(resource);
			}
		}
		for (Resource resource : resources) {
			if (resource.isTemplate() && resource.uriTemplate().matches(uri)) {
				return Optional.of(resource);
			}
		}
		return Optional.empty();
	}

	public Object read(String uri) {
		return read(uri, CancellationToken.none());
	}

	/**
	 * Read a resource by URI.
	 * @param uri the URI
	 * @param token cancellation token handed to the handler
	 * @return the handler result, unchanged
	 * @throws McpNotFoundException if no resource serves the URI
	 * @throws io.mcpserver.spec.McpInternalException if the handler fails
	 */
	public Object read(String uri, CancellationToken token) {
		Assert.hasText(uri, "Resource URI must not be empty");
		Resource resource = resolve(uri).orElseThrow(() -> McpNotFoundException.forUri(uri));
		return read(resource, uri, token);
	}

	/**
	 * Read an already resolved resource, even if it has been removed since.
	 * @param resource the resource serving the URI, as returned by {@link #resolve}
	 * @param uri the URI
	 * @param token cancellation token handed to the handler
	 * @return the handler result, unchanged
	 * @throws io.mcpserver.spec.McpInternalException if the handler fails
	 */
	public Object read(Resource resource, String uri, CancellationToken token) {
		Assert.notNull(resource, "Resource must not be null");
		Assert.hasText(uri, "Resource URI must not be empty");
		Map<String, String> variables = resource.isTemplate() ? resource.uriTemplate().extractVariableValues(uri)
				: Map.of();
		logger.debug("Reading resource '{}' for {}", resource.name(), uri);
		return guard(resource, () -> resource.handler().read(uri, variables, token), token);
	}

	@Override
	protected String kind() {
		return "Resource";
	}

	@Override
	protected void notifyListChanged(NotificationQueue queue) {
		queue.resourcesListChanged();
	}

	/**
	 * Reading by name passes the literal URI, or for templates the template text with the
	 * arguments as variables.
	 */
	@Override
	protected Object invoke(Resource resource, Map<String, Object> arguments, CancellationToken token)
			throws Exception {
		if (!resource.isTemplate()) {
			return resource.handler().read(resource.uri(), Map.of(), token);
		}
		Map<String, String> variables = new LinkedHashMap<>();
		arguments.forEach((key, value) -> variables.put(key, String.valueOf(value)));
		return resource.handler().read(resource.uriTemplate().getTemplate(), variables, token);
	}

}
