/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.mcpserver.util.Assert;
import io.mcpserver.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Constraint on a single argument: an optional type, an optional list of allowed values,
 * a nested {@link ArgumentSchema} for objects and an item schema for arrays. Instances
 * are immutable; the {@code with*} methods return copies.
 */
public final class PropertySchema {

	/**
	 * JSON types an argument can be constrained to.
	 */
	public enum Type {

		STRING, NUMBER, INTEGER, BOOLEAN, OBJECT, ARRAY, NULL;

		public String tag() {
			return name().toLowerCase(Locale.ROOT);
		}

		/**
		 * @return the matching type, or {@code null} for an unknown or missing tag
		 */
		@Nullable
		public static Type fromTag(@Nullable Object tag) {
			if (!(tag instanceof String text)) {
				return null;
			}
			for (Type type : values()) {
				if (type.tag().equals(text)) {
					return type;
				}
			}
			return null;
		}

	}

	@Nullable
	private final Type type;

	@Nullable
	private final List<Object> enumValues;

	@Nullable
	private final ArgumentSchema objectSchema;

	@Nullable
	private final PropertySchema items;

	@Nullable
	private final String description;

	@Nullable
	private final Map<String, Object> raw;

	private PropertySchema(@Nullable Type type, @Nullable List<Object> enumValues,
			@Nullable ArgumentSchema objectSchema, @Nullable PropertySchema items, @Nullable String description,
			@Nullable Map<String, Object> raw) {
		this.type = type;
		this.enumValues = enumValues != null ? Collections.unmodifiableList(new ArrayList<>(enumValues)) : null;
		this.objectSchema = objectSchema;
		this.items = items;
		this.description = description;
		this.raw = raw;
	}

	/**
	 * A property that accepts any value.
	 */
	public static PropertySchema any() {
		return new PropertySchema(null, null, null, null, null, null);
	}

	public static PropertySchema of(Type type) {
		Assert.notNull(type, "Type must not be null");
		return new PropertySchema(type, null, null, null, null, null);
	}

	public static PropertySchema string() {
		return of(Type.STRING);
	}

	public static PropertySchema number() {
		return of(Type.NUMBER);
	}

	public static PropertySchema integer() {
		return of(Type.INTEGER);
	}

	public static PropertySchema bool() {
		return of(Type.BOOLEAN);
	}

	public static PropertySchema object(ArgumentSchema schema) {
		Assert.notNull(schema, "Object schema must not be null");
		return new PropertySchema(Type.OBJECT, null, schema, null, null, null);
	}

	public static PropertySchema array(PropertySchema items) {
		Assert.notNull(items, "Item schema must not be null");
		return new PropertySchema(Type.ARRAY, null, null, items, null, null);
	}

	public PropertySchema withEnum(Object... values) {
		Assert.isTrue(values != null && values.length > 0, "Enum must list at least one value");
		return new PropertySchema(this.type, Arrays.asList(values), this.objectSchema, this.items, this.description,
				null);
	}

	public PropertySchema withDescription(String description) {
		return new PropertySchema(this.type, this.enumValues, this.objectSchema, this.items, description, null);
	}

	/**
	 * Normalize a raw property descriptor such as
	 * {@code {"type": "string", "enum": ["add", "subtract"]}}.
	 * @param raw the descriptor
	 * @return the property schema, keeping the raw descriptor for listings
	 * @throws IllegalArgumentException if the descriptor is malformed
	 */
	public static PropertySchema fromMap(Map<String, ?> raw) {
		Assert.notNull(raw, "Property descriptor must not be null");
		Type type = Type.fromTag(raw.get("type"));

		List<Object> enumValues = null;
		Object rawEnum = raw.get("enum");
		if (rawEnum != null) {
			if (!(rawEnum instanceof List<?> list)) {
				throw new IllegalArgumentException("'enum' must be a list, got " + rawEnum.getClass().getSimpleName());
			}
			enumValues = new ArrayList<>(list);
		}

		ArgumentSchema objectSchema = null;
		if (type == Type.OBJECT && (raw.containsKey("properties") || raw.containsKey("required"))) {
			objectSchema = ArgumentSchema.fromMap(raw);
		}

		PropertySchema items = null;
		Object rawItems = raw.get("items");
		if (rawItems != null) {
			items = PropertySchema.fromMap(ArgumentSchema.asDescriptor("items", rawItems));
		}

		Object description = raw.get("description");
		return new PropertySchema(type, enumValues, objectSchema, items,
				description != null ? description.toString() : null, Utils.deepCopy(raw));
	}

	@Nullable
	public Type type() {
		return this.type;
	}

	@Nullable
	public List<Object> enumValues() {
		return this.enumValues;
	}

	@Nullable
	public ArgumentSchema objectSchema() {
		return this.objectSchema;
	}

	@Nullable
	public PropertySchema items() {
		return this.items;
	}

	@Nullable
	public String description() {
		return this.description;
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
		if (this.type != null) {
			map.put("type", this.type.tag());
		}
		if (this.description != null) {
			map.put("description", this.description);
		}
		if (this.enumValues != null) {
			map.put("enum", new ArrayList<>(this.enumValues));
		}
		if (this.objectSchema != null) {
			Map<String, Object> nested = this.objectSchema.toMap();
			nested.remove("type");
			map.putAll(nested);
		}
		if (this.items != null) {
			map.put("items", this.items.toMap());
		}
		return map;
	}

	@Override
	public String toString() {
		return "PropertySchema" + toMap();
	}

}
