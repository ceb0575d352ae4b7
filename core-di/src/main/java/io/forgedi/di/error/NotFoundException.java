package io.forgedi.di.error;

public final class NotFoundException extends DIException {
	private final String entryName;

	public NotFoundException(String entryName) {
		super("No entry or class found for '" + entryName + "'");
		this.entryName = entryName;
	}

	public String getEntryName() {
		return entryName;
	}
}
