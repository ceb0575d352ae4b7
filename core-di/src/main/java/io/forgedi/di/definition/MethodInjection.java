package io.forgedi.di.definition;

import java.util.List;

import static io.forgedi.common.Preconditions.checkNotNull;
import static java.util.Collections.unmodifiableList;

public final class MethodInjection {
	private final String methodName;
	private final List<Definition> arguments;

	public MethodInjection(String methodName, List<Definition> arguments) {
		this.methodName = checkNotNull(methodName);
		this.arguments = unmodifiableList(arguments);
	}

	public String getMethodName() {
		return methodName;
	}

	public List<Definition> getArguments() {
		return arguments;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		MethodInjection that = (MethodInjection) o;
		return methodName.equals(that.methodName) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * methodName.hashCode() + arguments.hashCode();
	}

	@Override
	public String toString() {
		return methodName + arguments;
	}
}
