package io.forgedi.di.error;

public final class InvalidArtifactNameException extends DIException {
	private final String className;

	public InvalidArtifactNameException(String className) {
		super("The container cannot be compiled: `" + className + "` is not a valid Java class name");
		this.className = className;
	}

	public String getClassName() {
		return className;
	}
}
