package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An already constructed value which is returned as is
 */
public final class ValueDefinition implements Definition {
	@Nullable
	private final Object value;

	public ValueDefinition(@Nullable Object value) {
		this.value = value;
	}

	@Nullable
	public Object getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(value, ((ValueDefinition) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return "Value(" + value + ')';
	}
}
