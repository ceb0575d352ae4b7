package io.forgedi.di.introspect;

import io.forgedi.di.definition.Definition;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * How one instance is built: constructor with its arguments, then properties, then method calls.
 * Every argument is still a definition, resolved or compiled by the caller.
 */
public final class ObjectInjection {
	private final Class<?> type;
	private final Constructor<?> constructor;
	private final List<Definition> constructorArguments;
	private final List<PropertyInjection> properties;
	private final List<MethodCall> methodCalls;

	ObjectInjection(Class<?> type, Constructor<?> constructor, List<Definition> constructorArguments,
			List<PropertyInjection> properties, List<MethodCall> methodCalls) {
		this.type = type;
		this.constructor = constructor;
		this.constructorArguments = unmodifiableList(constructorArguments);
		this.properties = unmodifiableList(properties);
		this.methodCalls = unmodifiableList(methodCalls);
	}

	public Class<?> getType() {
		return type;
	}

	public Constructor<?> getConstructor() {
		return constructor;
	}

	public List<Definition> getConstructorArguments() {
		return constructorArguments;
	}

	public List<PropertyInjection> getProperties() {
		return properties;
	}

	public List<MethodCall> getMethodCalls() {
		return methodCalls;
	}

	/**
	 * A value assigned either to a field or through a setter, exactly one of them being set
	 */
	public static final class PropertyInjection {
		private final String name;
		@Nullable
		private final Field field;
		@Nullable
		private final Method setter;
		private final Definition value;

		PropertyInjection(String name, @Nullable Field field, @Nullable Method setter, Definition value) {
			this.name = name;
			this.field = field;
			this.setter = setter;
			this.value = value;
		}

		public String getName() {
			return name;
		}

		@Nullable
		public Field getField() {
			return field;
		}

		@Nullable
		public Method getSetter() {
			return setter;
		}

		public Definition getValue() {
			return value;
		}
	}

	public static final class MethodCall {
		private final Method method;
		private final List<Definition> arguments;

		MethodCall(Method method, List<Definition> arguments) {
			this.method = method;
			this.arguments = unmodifiableList(arguments);
		}

		public Method getMethod() {
			return method;
		}

		public List<Definition> getArguments() {
			return arguments;
		}
	}
}
