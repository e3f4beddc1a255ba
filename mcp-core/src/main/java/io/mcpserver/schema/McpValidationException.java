/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.schema;

import io.mcpserver.spec.ErrorKind;
import io.mcpserver.spec.McpError;

/**
 * Raised when arguments do not satisfy an {@link ArgumentSchema}. The peer only sees the
 * generic "Invalid params" message; {@link #getViolation()} keeps the offending path and
 * constraint for logs and callers.
 */
public class McpValidationException extends McpError {

	/**
	 * The constraint an argument failed.
	 */
	public enum Constraint {

		REQUIRED, TYPE, ENUM, OTHER, ADDITIONAL_PROPERTIES

	}

	/**
	 * A single schema violation.
	 *
	 * @param path dotted and indexed path of the argument, e.g. {@code address.city} or
	 * {@code tags[1]}
	 * @param constraint the failed constraint
	 * @param message human readable detail
	 */
	public record Violation(String path, Constraint constraint, String message) {
	}

	private final Violation violation;

	public McpValidationException(Violation violation) {
		super(ErrorKind.VALIDATION, "Invalid argument '" + violation.path() + "': " + violation.message());
		this.violation = violation;
	}

	public Violation getViolation() {
		return this.violation;
	}

}
