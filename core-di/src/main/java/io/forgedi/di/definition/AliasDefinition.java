package io.forgedi.di.definition;

import static io.forgedi.common.Preconditions.checkNotNull;

/**
 * Resolves to the value of another entry
 */
public final class AliasDefinition implements Definition {
	private final String targetName;

	public AliasDefinition(String targetName) {
		this.targetName = checkNotNull(targetName);
	}

	public String getTargetName() {
		return targetName;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return targetName.equals(((AliasDefinition) o).targetName);
	}

	@Override
	public int hashCode() {
		return targetName.hashCode();
	}

	@Override
	public String toString() {
		return "get(" + targetName + ')';
	}
}
