package io.forgedi.di.definition;

import io.forgedi.di.Container;
import io.forgedi.di.error.DependencyException;
import io.forgedi.di.error.NotFoundException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.forgedi.common.Preconditions.checkNotNull;

/**
 * A string in which every {@code {entry}} placeholder is replaced with the value of that entry
 */
public final class StringDefinition implements Definition {
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

	private final String expression;

	public StringDefinition(String expression) {
		this.expression = checkNotNull(expression);
	}

	public String getExpression() {
		return expression;
	}

	public static String resolveExpression(String entryName, String expression, Container container) {
		Matcher matcher = PLACEHOLDER.matcher(expression);
		StringBuffer sb = new StringBuffer();
		while (matcher.find()) {
			Object value;
			try {
				value = container.get(matcher.group(1));
			} catch (NotFoundException e) {
				throw new DependencyException("Error while parsing string expression for entry '" + entryName + "': " +
						e.getMessage(), e);
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(value)));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return expression.equals(((StringDefinition) o).expression);
	}

	@Override
	public int hashCode() {
		return expression.hashCode();
	}

	@Override
	public String toString() {
		return "string(" + expression + ')';
	}
}
