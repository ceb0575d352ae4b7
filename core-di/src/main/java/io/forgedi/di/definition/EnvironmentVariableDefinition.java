package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

import static io.forgedi.common.Preconditions.checkNotNull;

/**
 * Reads an environment variable when the entry is resolved.
 * An unset variable yields the default value if there is one, {@code null} if the
 * definition is optional, and fails the resolution otherwise.
 */
public final class EnvironmentVariableDefinition implements Definition {
	private final String variableName;
	private final boolean optional;
	@Nullable
	private final Definition defaultValue;

	public EnvironmentVariableDefinition(String variableName, boolean optional, @Nullable Definition defaultValue) {
		this.variableName = checkNotNull(variableName);
		this.optional = optional || defaultValue != null;
		this.defaultValue = defaultValue;
	}

	public String getVariableName() {
		return variableName;
	}

	public boolean isOptional() {
		return optional;
	}

	@Nullable
	public Definition getDefaultValue() {
		return defaultValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EnvironmentVariableDefinition that = (EnvironmentVariableDefinition) o;
		return optional == that.optional &&
				variableName.equals(that.variableName) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variableName, optional, defaultValue);
	}

	@Override
	public String toString() {
		return "env(" + variableName + (defaultValue != null ? ", " + defaultValue : "") + ')';
	}
}
