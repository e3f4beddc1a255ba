/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.mcpserver.util.Assert;
import io.mcpserver.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Lightweight JSON Schema describing the arguments a tool or prompt accepts: ordered
 * property constraints, required names, an optional description and whether undeclared
 * arguments are allowed.
 *
 * <p>
 * A required name without a property constraint is "required but untyped": it must be
 * present, any value is accepted.
 */
public final class ArgumentSchema {

	private static final ArgumentSchema EMPTY = new ArgumentSchema(Map.of(), List.of(), null, true, null);

	private final Map<String, PropertySchema> properties;

	private final List<String> required;

	@Nullable
	private final String description;

	private final boolean additionalProperties;

	@Nullable
	private final Map<String, Object> raw;

	private ArgumentSchema(Map<String, PropertySchema> properties, List<String> required,
			@Nullable String description, boolean additionalProperties, @Nullable Map<String, Object> raw) {
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		this.required = List.copyOf(new LinkedHashSet<>(required));
		this.description = description;
		this.additionalProperties = additionalProperties;
		this.raw = raw;
	}

	/**
	 * @return a schema that accepts any arguments
	 */
	public static ArgumentSchema empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Normalize a raw descriptor such as
	 * {@code {"type": "object", "properties": {...}, "required": [...]}}.
	 * @param raw the descriptor, {@code null} yields {@link #empty()}
	 * @return the schema, keeping the raw descriptor for listings
	 * @throws IllegalArgumentException if {@code properties} is not a map, a property
	 * descriptor is not a map, or {@code required} is not a list of strings
	 */
	public static ArgumentSchema fromMap(@Nullable Map<String, ?> raw) {
		if (raw == null) {
			return EMPTY;
		}
		Map<String, PropertySchema> properties = new LinkedHashMap<>();
		Object rawProperties = raw.get("properties");
		if (rawProperties != null) {
			if (!(rawProperties instanceof Map<?, ?> propertyMap)) {
				throw new IllegalArgumentException(
						"'properties' must be a map, got " + rawProperties.getClass().getSimpleName());
			}
			propertyMap.forEach((name, descriptor) -> properties.put(String.valueOf(name),
					PropertySchema.fromMap(asDescriptor(String.valueOf(name), descriptor))));
		}

		List<String> required = new ArrayList<>();
		Object rawRequired = raw.get("required");
		if (rawRequired != null) {
			if (!(rawRequired instanceof List<?> requiredList)) {
				throw new IllegalArgumentException(
						"'required' must be a list, got " + rawRequired.getClass().getSimpleName());
			}
			for (Object name : requiredList) {
				if (!(name instanceof String text)) {
					throw new IllegalArgumentException("'required' must only contain property names, got " + name);
				}
				required.add(text);
			}
		}

		Object description = raw.get("description");
		boolean additionalProperties = !Boolean.FALSE.equals(raw.get("additionalProperties"));
		return new ArgumentSchema(properties, required, description != null ? description.toString() : null,
				additionalProperties, Utils.deepCopy(raw));
	}

	@SuppressWarnings("unchecked")
	static Map<String, ?> asDescriptor(String name, Object descriptor) {
		if (!(descriptor instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Descriptor of '" + name + "' must be a map, got "
					+ (descriptor == null ? "null" : descriptor.getClass().getSimpleName()));
		}
		return (Map<String, ?>) map;
	}

	public Map<String, PropertySchema> properties() {
		return this.properties;
	}

	public List<String> required() {
		return this.required;
	}

	@Nullable
	public String description() {
		return this.description;
	}

	public boolean additionalProperties() {
		return this.additionalProperties;
	}

	/**
	 * @return the descriptor as registered, or a rendering of this schema when it was
	 * built programmatically
	 */
	public Map<String, Object> toMap() {
		if (this.raw != null) {
			return Utils.deepCopy(this.raw);
		}
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("type", "object");
		Map<String, Object> renderedProperties = new LinkedHashMap<>();
		this.properties.forEach((name, property) -> renderedProperties.put(name, property.toMap()));
		map.put("properties", renderedProperties);
		if (!this.required.isEmpty()) {
			map.put("required", new ArrayList<>(this.required));
		}
		if (this.description != null) {
			map.put("description", this.description);
		}
		if (!this.additionalProperties) {
			map.put("additionalProperties", false);
		}
		return map;
	}

	@Override
	public String toString() {
		return "ArgumentSchema" + toMap();
	}

	public static final class Builder {

		private final Map<String, PropertySchema> properties = new LinkedHashMap<>();

		private final Set<String> required = new LinkedHashSet<>();

		@Nullable
		private String description;

		private boolean additionalProperties = true;

		private Builder() {
		}

		public Builder property(String name, PropertySchema property) {
			Assert.hasText(name, "Property name must not be empty");
			Assert.notNull(property, "Property schema must not be null");
			this.properties.put(name, property);
			return this;
		}

		/**
		 * Declare a property and mark it required.
		 */
		public Builder requiredProperty(String name, PropertySchema property) {
			property(name, property);
			this.required.add(name);
			return this;
		}

		public Builder required(String... names) {
			for (String name : names) {
				Assert.hasText(name, "Required name must not be empty");
				this.required.add(name);
			}
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder additionalProperties(boolean additionalProperties) {
			this.additionalProperties = additionalProperties;
			return this;
		}

		public ArgumentSchema build() {
			return new ArgumentSchema(this.properties, new ArrayList<>(this.required), this.description,
					this.additionalProperties, null);
		}

	}

}
