package io.forgedi.di.error;

/**
 * Raised when an entry is registered but could not be resolved
 */
public final class DependencyException extends DIException {
	public DependencyException(String message) {
		super(message);
	}

	public DependencyException(String message, Throwable cause) {
		super(message, cause);
	}
}
