/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches URIs against an RFC 6570 style URI template and extracts the bound variable
 * values. Supported expressions are simple string expansion ({@code {var}}), reserved
 * ({@code {+var}}), fragment ({@code {#var}}), label ({@code {.var}}), path segment
 * ({@code {/var}}) and query ({@code {?a,b}}, {@code {&c}}) expansion. Extracted values
 * are returned as they appear in the URI, without percent-decoding.
 */
public final class UriTemplate {

	private static final Pattern TEMPLATE_EXPRESSION = Pattern.compile("\\{[^}\\s]+}");

	private static final String OPERATORS = "+#./?&";

	private final String template;

	private final List<String> variableNames;

	private final Pattern pattern;

	/**
	 * Create a template.
	 * @param template the URI template, e.g. {@code user://{id}/profile}
	 * @throws IllegalArgumentException if the template is empty, has an unclosed
	 * expression or declares the same variable twice
	 */
	public UriTemplate(String template) {
		Assert.hasText(template, "URI template must not be empty");
		this.template = template;

		List<String> names = new ArrayList<>();
		StringBuilder regex = new StringBuilder("^");
		int index = 0;
		while (index < template.length()) {
			int open = template.indexOf('{', index);
			if (open < 0) {
				regex.append(Pattern.quote(template.substring(index)));
				break;
			}
			if (open > index) {
				regex.append(Pattern.quote(template.substring(index, open)));
			}
			int close = template.indexOf('}', open);
			if (close < 0) {
				throw new IllegalArgumentException("Unclosed template expression in: " + template);
			}
			appendExpression(template.substring(open + 1, close), names, regex);
			index = close + 1;
		}
		regex.append('$');

		Set<String> unique = new LinkedHashSet<>(names);
		if (unique.size() != names.size()) {
			throw new IllegalArgumentException("URI template declares a variable more than once: " + template);
		}
		this.variableNames = Collections.unmodifiableList(names);
		this.pattern = Pattern.compile(regex.toString());
	}

	/**
	 * Returns true if the given string contains any URI template expression, like
	 * {@code {foo}} or {@code {?bar}}.
	 * @param str the string to inspect
	 * @return whether the string is a template rather than a literal URI
	 */
	public static boolean isTemplate(String str) {
		return str != null && TEMPLATE_EXPRESSION.matcher(str).find();
	}

	private static void appendExpression(String expression, List<String> names, StringBuilder regex) {
		if (expression.isEmpty()) {
			throw new IllegalArgumentException("Empty template expression");
		}
		char first = expression.charAt(0);
		String operator = OPERATORS.indexOf(first) >= 0 ? String.valueOf(first) : "";
		List<String> expressionNames = new ArrayList<>();
		for (String name : expression.substring(operator.length()).split(",")) {
			String trimmed = name.replace("*", "").trim();
			if (!trimmed.isEmpty()) {
				expressionNames.add(trimmed);
			}
		}
		if (expressionNames.isEmpty()) {
			throw new IllegalArgumentException("Template expression without variable: {" + expression + "}");
		}
		names.addAll(expressionNames);

		switch (operator) {
			case "?", "&" -> {
				for (int i = 0; i < expressionNames.size(); i++) {
					String prefix = (i == 0) ? operator : "&";
					regex.append(Pattern.quote(prefix + expressionNames.get(i) + "=")).append("([^&#]+)");
				}
			}
			case "+" -> appendJoined(regex, "", "(.+?)", ",", expressionNames.size());
			case "#" -> appendJoined(regex, "#", "(.+?)", ",", expressionNames.size());
			case "." -> appendJoined(regex, "\\.", "([^/,.]+)", "\\.", expressionNames.size());
			case "/" -> appendJoined(regex, "/", "([^/,]+)", "/", expressionNames.size());
			default -> appendJoined(regex, "", "([^/,?#]+)", ",", expressionNames.size());
		}
	}

	private static void appendJoined(StringBuilder regex, String prefix, String group, String separator,
			int count) {
		regex.append(prefix);
		for (int i = 0; i < count; i++) {
			if (i > 0) {
				regex.append(separator);
			}
			regex.append(group);
		}
	}

	/**
	 * Match a URI against this template.
	 * @param uri the URI to match
	 * @return the variable bindings in declaration order, or empty if the URI does not
	 * match
	 */
	public Optional<Map<String, String>> match(String uri) {
		if (uri == null) {
			return Optional.empty();
		}
		Matcher matcher = this.pattern.matcher(uri);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		Map<String, String> values = new LinkedHashMap<>();
		for (int i = 0; i < this.variableNames.size(); i++) {
			values.put(this.variableNames.get(i), matcher.group(i + 1));
		}
		return Optional.of(values);
	}

	public boolean matches(String uri) {
		return match(uri).isPresent();
	}

	/**
	 * Extract the variable values of a URI.
	 * @param uri the URI to inspect
	 * @return the bindings, or an empty map if the URI is {@code null} or does not match
	 */
	public Map<String, String> extractVariableValues(String uri) {
		return match(uri).orElse(Map.of());
	}

	public List<String> getVariableNames() {
		return this.variableNames;
	}

	public String getTemplate() {
		return this.template;
	}

	@Override
	public String toString() {
		return this.template;
	}

}
