package io.forgedi.di.definition;

import static io.forgedi.common.Preconditions.checkNotNull;

/**
 * Produces the value by calling back into user code. Never compiled.
 */
public final class FactoryDefinition implements Definition {
	private final Factory<?> factory;

	public FactoryDefinition(Factory<?> factory) {
		this.factory = checkNotNull(factory);
	}

	public Factory<?> getFactory() {
		return factory;
	}

	@Override
	public String toString() {
		return "Factory(" + factory + ')';
	}
}
