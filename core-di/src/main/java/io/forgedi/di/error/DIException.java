package io.forgedi.di.error;

/**
 * Base type of every failure raised by the container, its compiler and its artifact cache
 */
public class DIException extends RuntimeException {
	public DIException(String message) {
		super(message);
	}

	public DIException(String message, Throwable cause) {
		super(message, cause);
	}
}
