package io.forgedi.di.introspect;

/**
 * Thrown by {@link InjectionPlanner} when a class definition does not fit the class it targets
 */
public final class InjectionException extends Exception {
	public InjectionException(String reason) {
		super(reason);
	}
}
