package io.forgedi.di.definition;

import io.forgedi.di.Container;

@FunctionalInterface
public interface Factory<T> {
	T create(Container container) throws Exception;
}
