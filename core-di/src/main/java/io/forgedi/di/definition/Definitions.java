package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Shorthands for declaring definitions
 */
public final class Definitions {
	private Definitions() {
	}

	public static ValueDefinition value(@Nullable Object value) {
		return new ValueDefinition(value);
	}

	public static AliasDefinition get(String entryName) {
		return new AliasDefinition(entryName);
	}

	public static AliasDefinition get(Class<?> type) {
		return new AliasDefinition(type.getName());
	}

	public static FactoryDefinition factory(Factory<?> factory) {
		return new FactoryDefinition(factory);
	}

	public static ClassDefinition create(String className) {
		return ClassDefinition.create(className);
	}

	public static ClassDefinition create(Class<?> type) {
		return ClassDefinition.create(type.getName());
	}

	public static ClassDefinition autowire(String className) {
		return ClassDefinition.autowire(className);
	}

	public static ClassDefinition autowire(Class<?> type) {
		return ClassDefinition.autowire(type.getName());
	}

	public static EnvironmentVariableDefinition env(String variableName) {
		return new EnvironmentVariableDefinition(variableName, false, null);
	}

	public static EnvironmentVariableDefinition env(String variableName, @Nullable Object defaultValue) {
		return new EnvironmentVariableDefinition(variableName, true, normalize(defaultValue));
	}

	public static StringDefinition string(String expression) {
		return new StringDefinition(expression);
	}

	/**
	 * Turns a raw value given to the builder into a definition: definitions are kept,
	 * lists and string-keyed maps become {@link ArrayDefinition}s and anything else
	 * becomes a {@link ValueDefinition}
	 */
	@SuppressWarnings("unchecked")
	public static Definition normalize(@Nullable Object value) {
		if (value instanceof Definition) {
			return (Definition) value;
		}
		if (value instanceof List) {
			return ArrayDefinition.ofList((List<?>) value);
		}
		if (value instanceof Map && ((Map<?, ?>) value).keySet().stream().allMatch(key -> key instanceof String)) {
			return ArrayDefinition.ofMap((Map<String, ?>) value);
		}
		return new ValueDefinition(value);
	}
}
