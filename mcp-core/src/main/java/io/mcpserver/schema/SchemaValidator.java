/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.schema;

import java.util.Map;

/**
 * Validates invocation arguments against an {@link ArgumentSchema} before a handler runs.
 */
public interface SchemaValidator {

	/**
	 * Validate arguments, reporting the first violation found. Required names are
	 * checked first in declared order, then present properties in declared property
	 * order.
	 * @param arguments the arguments, {@code null} is treated as empty
	 * @param schema the schema to validate against
	 * @throws McpValidationException on the first violation
	 */
	void validate(Map<String, Object> arguments, ArgumentSchema schema);

	/**
	 * @return the built-in validator
	 */
	static SchemaValidator createDefault() {
		return new DefaultSchemaValidator();
	}

}
