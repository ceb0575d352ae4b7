package io.forgedi.di.error;

public final class CompiledContainerImmutableException extends DIException {
	public CompiledContainerImmutableException(String entryName) {
		super("You cannot set entry '" + entryName + "' at runtime on a compiled container. " +
				"You can either put your definitions in the builder before building it, " +
				"or disable compilation and set values on an interpreted container instead.");
	}
}
