/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.server;

import java.util.LinkedHashMap;
import java.util.Map;

import io.mcpserver.schema.ArgumentSchema;
import io.mcpserver.util.Assert;
import io.mcpserver.util.UriTemplate;
import reactor.util.annotation.Nullable;

/**
 * A registered resource, addressed either by a literal URI or by a URI template.
 *
 * @param name unique resource name
 * @param uri the literal URI, {@code null} for template resources
 * @param uriTemplate the URI template, {@code null} for literal resources
 * @param description optional human readable description
 * @param mimeType optional MIME type of the contents
 * @param handler produces the contents
 */
public record Resource(String name, @Nullable String uri, @Nullable UriTemplate uriTemplate,
		@Nullable String description, @Nullable String mimeType, ResourceHandler handler) implements RegisteredEntity {

	public Resource {
		Assert.hasText(name, "Resource name must not be empty");
		Assert.isTrue((uri == null) != (uriTemplate == null), "Resource needs either a URI or a URI template");
		Assert.isTrue(uri == null || !uri.isBlank(), "Resource URI must not be empty");
		Assert.notNull(handler, "Resource handler must not be null");
	}

	public static Resource literal(String name, String uri, @Nullable String description, @Nullable String mimeType,
			ResourceHandler handler) {
		return new Resource(name, uri, null, description, mimeType, handler);
	}

	public static Resource template(String name, String uriTemplate, @Nullable String description,
			@Nullable String mimeType, ResourceHandler handler) {
		return new Resource(name, null, new UriTemplate(uriTemplate), description, mimeType, handler);
	}

	public boolean isTemplate() {
		return this.uriTemplate != null;
	}

	/**
	 * Resources take no arguments.
	 */
	@Override
	public ArgumentSchema schema() {
		return ArgumentSchema.empty();
	}

	@Override
	public Map<String, Object> toMetadata() {
		Map<String, Object> metadata = new LinkedHashMap<>();
		if (this.uriTemplate != null) {
			metadata.put("uriTemplate", this.uriTemplate.getTemplate());
		}
		else {
			metadata.put("uri", this.uri);
		}
		metadata.put("name", this.name);
		if (this.description != null) {
			metadata.put("description", this.description);
		}
		if (this.mimeType != null) {
			metadata.put("mimeType", this.mimeType);
		}
		return metadata;
	}

}
