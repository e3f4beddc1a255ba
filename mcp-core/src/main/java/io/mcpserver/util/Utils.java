/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Copy a string keyed map, descending into nested maps and lists so the copy shares
	 * no mutable container with the source. Iteration order is preserved.
	 * @param source the map to copy (may be {@code null})
	 * @return a mutable deep copy, or {@code null} if {@code source} is {@code null}
	 */
	@Nullable
	public static Map<String, Object> deepCopy(@Nullable Map<String, ?> source) {
		if (source == null) {
			return null;
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		source.forEach((key, value) -> copy.put(key, deepCopyValue(value)));
		return copy;
	}

	/**
	 * Deep copy a single value: maps become string keyed {@link LinkedHashMap}s, lists
	 * become {@link ArrayList}s, anything else is returned as is.
	 * @param value the value to copy (may be {@code null})
	 * @return the copy
	 */
	@Nullable
	public static Object deepCopyValue(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> copy = new LinkedHashMap<>();
			map.forEach((key, nested) -> copy.put(String.valueOf(key), deepCopyValue(nested)));
			return copy;
		}
		if (value instanceof List<?> list) {
			List<Object> copy = new ArrayList<>(list.size());
			for (Object nested : list) {
				copy.add(deepCopyValue(nested));
			}
			return copy;
		}
		return value;
	}

}
