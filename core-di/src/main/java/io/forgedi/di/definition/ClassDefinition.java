package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.forgedi.common.Preconditions.checkNotNull;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Constructs an instance of a class: constructor arguments first, then properties,
 * then method calls, each in declaration order.
 * <p>
 * An autowired definition completes what is not given explicitly from the class
 * itself: missing constructor parameters, {@link io.forgedi.di.Inject} fields and methods.
 */
public final class ClassDefinition implements Definition {
	private final String className;
	@Nullable
	private final List<Definition> constructorArguments;
	private final Map<String, Definition> properties;
	private final List<MethodInjection> methods;
	private final boolean autowired;

	private ClassDefinition(String className, @Nullable List<Definition> constructorArguments,
			Map<String, Definition> properties, List<MethodInjection> methods, boolean autowired) {
		this.className = checkNotNull(className);
		this.constructorArguments = constructorArguments == null ? null : unmodifiableList(constructorArguments);
		this.properties = unmodifiableMap(properties);
		this.methods = unmodifiableList(methods);
		this.autowired = autowired;
	}

	public static ClassDefinition create(String className) {
		return new ClassDefinition(className, null, new LinkedHashMap<>(), new ArrayList<>(), false);
	}

	public static ClassDefinition autowire(String className) {
		return new ClassDefinition(className, null, new LinkedHashMap<>(), new ArrayList<>(), true);
	}

	public ClassDefinition withConstructor(Object... arguments) {
		List<Definition> definitions = new ArrayList<>();
		for (Object argument : arguments) {
			definitions.add(Definitions.normalize(argument));
		}
		return new ClassDefinition(className, definitions, properties, methods, autowired);
	}

	public ClassDefinition withProperty(String property, @Nullable Object value) {
		Map<String, Definition> newProperties = new LinkedHashMap<>(properties);
		newProperties.put(checkNotNull(property), Definitions.normalize(value));
		return new ClassDefinition(className, constructorArguments, newProperties, methods, autowired);
	}

	public ClassDefinition withMethod(String methodName, Object... arguments) {
		List<Definition> definitions = new ArrayList<>();
		for (Object argument : arguments) {
			definitions.add(Definitions.normalize(argument));
		}
		List<MethodInjection> newMethods = new ArrayList<>(methods);
		newMethods.add(new MethodInjection(methodName, definitions));
		return new ClassDefinition(className, constructorArguments, properties, newMethods, autowired);
	}

	public String getClassName() {
		return className;
	}

	/**
	 * Returns explicit constructor arguments, {@code null} if none were given
	 */
	@Nullable
	public List<Definition> getConstructorArguments() {
		return constructorArguments;
	}

	public Map<String, Definition> getProperties() {
		return properties;
	}

	public List<MethodInjection> getMethods() {
		return methods;
	}

	public boolean isAutowired() {
		return autowired;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClassDefinition that = (ClassDefinition) o;
		return autowired == that.autowired &&
				className.equals(that.className) &&
				Objects.equals(constructorArguments, that.constructorArguments) &&
				properties.equals(that.properties) &&
				methods.equals(that.methods);
	}

	@Override
	public int hashCode() {
		return Objects.hash(className, constructorArguments, properties, methods, autowired);
	}

	@Override
	public String toString() {
		return (autowired ? "autowire(" : "create(") + className + ')';
	}
}
