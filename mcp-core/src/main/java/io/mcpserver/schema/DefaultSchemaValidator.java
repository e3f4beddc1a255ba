/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.mcpserver.schema.McpValidationException.Constraint;
import io.mcpserver.schema.McpValidationException.Violation;
import io.mcpserver.schema.PropertySchema.Type;
import io.mcpserver.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SchemaValidator} backed by the networknt JSON Schema validator (draft
 * 2020-12). Values are never coerced, so {@code "5"} does not satisfy {@code number}. A
 * {@code null} argument counts as missing.
 *
 * <p>
 * Only the first violation is reported: missing required arguments first, then the
 * other violations in declared property order, undeclared arguments last.
 */
public class DefaultSchemaValidator implements SchemaValidator {

	private static final Logger logger = LoggerFactory.getLogger(DefaultSchemaValidator.class);

	// keywords holding instance values rather than subschemas
	private static final Set<String> VALUE_KEYWORDS = Set.of("enum", "const", "default", "examples");

	private final ObjectMapper objectMapper;

	private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

	private final Map<JsonNode, JsonSchema> schemaCache = new ConcurrentHashMap<>();

	public DefaultSchemaValidator() {
		this(new ObjectMapper());
	}

	public DefaultSchemaValidator(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	@Override
	public void validate(Map<String, Object> arguments, ArgumentSchema schema) {
		Assert.notNull(schema, "Schema must not be null");
		JsonNode schemaNode = this.objectMapper.valueToTree(schema.toMap());
		normalizeSchema(schemaNode);
		JsonSchema jsonSchema = this.schemaCache.computeIfAbsent(schemaNode, this.schemaFactory::getSchema);

		JsonNode argumentNode = this.objectMapper.valueToTree(arguments != null ? arguments : Map.of());
		removeNullMembers(argumentNode);

		Set<ValidationMessage> messages = jsonSchema.validate(argumentNode);
		if (messages.isEmpty()) {
			return;
		}
		logger.debug("Arguments rejected by schema: {}", messages);
		List<Violation> violations = new ArrayList<>(messages.size());
		for (ValidationMessage message : messages) {
			violations.add(toViolation(message));
		}
		violations.sort(reportingOrder(schema));
		throw new McpValidationException(violations.get(0));
	}

	/**
	 * Unknown type tags accept any value, and a required name without a property
	 * constraint stays allowed when undeclared arguments are rejected.
	 */
	private static void normalizeSchema(JsonNode node) {
		if (node instanceof ArrayNode array) {
			array.forEach(DefaultSchemaValidator::normalizeSchema);
			return;
		}
		if (!(node instanceof ObjectNode object)) {
			return;
		}
		JsonNode type = object.get("type");
		if (type != null && type.isTextual() && Type.fromTag(type.asText()) == null) {
			object.remove("type");
		}
		JsonNode additional = object.get("additionalProperties");
		JsonNode required = object.get("required");
		if (additional != null && additional.isBoolean() && !additional.booleanValue() && required != null
				&& required.isArray()) {
			JsonNode properties = object.get("properties");
			ObjectNode declared = properties instanceof ObjectNode existing ? existing : object.putObject("properties");
			for (JsonNode name : required) {
				if (name.isTextual() && !declared.has(name.asText())) {
					declared.putObject(name.asText());
				}
			}
		}
		object.fields().forEachRemaining(field -> {
			if (!VALUE_KEYWORDS.contains(field.getKey())) {
				normalizeSchema(field.getValue());
			}
		});
	}

	private static void removeNullMembers(JsonNode node) {
		if (node instanceof ObjectNode object) {
			Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
			while (fields.hasNext()) {
				if (fields.next().getValue().isNull()) {
					fields.remove();
				}
			}
		}
		node.forEach(DefaultSchemaValidator::removeNullMembers);
	}

	private static Violation toViolation(ValidationMessage message) {
		Constraint constraint = constraintOf(message.getType());
		String path = path(message.getInstanceLocation().toString());
		if ((constraint == Constraint.REQUIRED || constraint == Constraint.ADDITIONAL_PROPERTIES)
				&& message.getProperty() != null) {
			path = path.isEmpty() ? message.getProperty() : path + "." + message.getProperty();
		}
		return new Violation(path, constraint, message.getMessage());
	}

	private static Constraint constraintOf(String keyword) {
		if (keyword == null) {
			return Constraint.OTHER;
		}
		return switch (keyword) {
			case "required" -> Constraint.REQUIRED;
			case "type" -> Constraint.TYPE;
			case "enum" -> Constraint.ENUM;
			case "additionalProperties" -> Constraint.ADDITIONAL_PROPERTIES;
			default -> Constraint.OTHER;
		};
	}

	// "$.address.city" -> "address.city", "$.tags[1]" -> "tags[1]"
	private static String path(String location) {
		String path = location.startsWith("$") ? location.substring(1) : location;
		return path.startsWith(".") ? path.substring(1) : path;
	}

	private static Comparator<Violation> reportingOrder(ArgumentSchema schema) {
		List<String> required = schema.required();
		List<String> declared = new ArrayList<>(schema.properties().keySet());
		return Comparator.comparingInt(DefaultSchemaValidator::group)
			.thenComparingInt(violation -> {
				String head = head(violation.path());
				if (group(violation) == 0) {
					return required.indexOf(head);
				}
				int index = declared.indexOf(head);
				return index >= 0 ? index : Integer.MAX_VALUE;
			})
			.thenComparingInt(violation -> violation.constraint().ordinal())
			.thenComparing(Violation::path);
	}

	// top-level missing arguments, then per-property violations, then undeclared
	// arguments
	private static int group(Violation violation) {
		boolean topLevel = head(violation.path()).equals(violation.path());
		if (topLevel && violation.constraint() == Constraint.REQUIRED) {
			return 0;
		}
		if (topLevel && violation.constraint() == Constraint.ADDITIONAL_PROPERTIES) {
			return 2;
		}
		return 1;
	}

	private static String head(String path) {
		int end = path.length();
		int dot = path.indexOf('.');
		int bracket = path.indexOf('[');
		if (dot >= 0) {
			end = dot;
		}
		if (bracket >= 0 && bracket < end) {
			end = bracket;
		}
		return path.substring(0, end);
	}

}
