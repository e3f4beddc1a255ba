/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.util;

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.util.annotation.Nullable;

/**
 * Checks tool names before they enter the tool registry.
 *
 * <p>
 * A tool name is 1 to 128 characters drawn from {@code A-Z}, {@code a-z}, {@code 0-9},
 * underscore, hyphen and dot. Spaces, commas and other punctuation are rejected. The
 * check only runs when the registry's {@code ToolNamePolicy} asks for it.
 */
public final class ToolNameValidator {

	private static final Logger logger = LoggerFactory.getLogger(ToolNameValidator.class);

	private static final int MAX_LENGTH = 128;

	private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-.]+$");

	private ToolNameValidator() {
	}

	/**
	 * Validate a tool name.
	 * @param name the tool name
	 * @param warnOnly true to only log a warning, false to throw
	 * @return whether the name is valid
	 * @throws IllegalArgumentException if the name is invalid and warnOnly is false
	 */
	public static boolean validate(@Nullable String name, boolean warnOnly) {
		if (name == null || name.isEmpty()) {
			return reject("Tool name must not be null or empty", name, warnOnly);
		}
		if (name.length() > MAX_LENGTH) {
			return reject("Tool name must not exceed " + MAX_LENGTH + " characters", name, warnOnly);
		}
		if (!VALID_NAME_PATTERN.matcher(name).matches()) {
			return reject("Tool name contains invalid characters (allowed: A-Z, a-z, 0-9, _, -, .)", name,
					warnOnly);
		}
		return true;
	}

	private static boolean reject(String message, @Nullable String name, boolean warnOnly) {
		String fullMessage = message + ": '" + name + "'";
		if (!warnOnly) {
			throw new IllegalArgumentException(fullMessage);
		}
		logger.warn("{}. Registering anyway because strict tool name validation is disabled.", fullMessage);
		return false;
	}

}
