package io.forgedi.di.resolver;

import io.forgedi.di.Container;
import io.forgedi.di.definition.*;
import io.forgedi.di.error.DIException;
import io.forgedi.di.error.DependencyException;
import io.forgedi.di.introspect.InjectionException;
import io.forgedi.di.introspect.InjectionPlanner;
import io.forgedi.di.introspect.ObjectInjection;
import io.forgedi.di.introspect.ObjectInjection.MethodCall;
import io.forgedi.di.introspect.ObjectInjection.PropertyInjection;
import io.forgedi.di.introspect.TypeIntrospector;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.*;
import java.util.*;

/**
 * Resolves definitions on demand with reflection.
 * Nested aliases go back through the owning container, so its singleton cache and
 * resolution guard apply to them.
 */
public final class DefinitionResolver {
	private final Container container;
	private final InjectionPlanner planner;

	public DefinitionResolver(Container container, TypeIntrospector introspector) {
		this.container = container;
		this.planner = new InjectionPlanner(introspector);
	}

	@Nullable
	public Object resolve(String entryName, Definition definition) {
		if (definition instanceof ValueDefinition) {
			return ((ValueDefinition) definition).getValue();
		}
		if (definition instanceof AliasDefinition) {
			return container.get(((AliasDefinition) definition).getTargetName());
		}
		if (definition instanceof FactoryDefinition) {
			return resolveFactory(entryName, (FactoryDefinition) definition);
		}
		if (definition instanceof ClassDefinition) {
			return resolveClass(entryName, (ClassDefinition) definition);
		}
		if (definition instanceof ArrayDefinition) {
			return resolveArray(entryName, (ArrayDefinition) definition);
		}
		if (definition instanceof EnvironmentVariableDefinition) {
			return resolveEnvironmentVariable(entryName, (EnvironmentVariableDefinition) definition);
		}
		if (definition instanceof StringDefinition) {
			return StringDefinition.resolveExpression(entryName, ((StringDefinition) definition).getExpression(), container);
		}
		throw new DependencyException("Entry '" + entryName + "' has unsupported definition " + definition);
	}

	/**
	 * Tells whether the definition can be resolved at all, without resolving it
	 */
	public boolean isResolvable(Definition definition) {
		if (!(definition instanceof ClassDefinition)) {
			return true;
		}
		ClassDefinition classDefinition = (ClassDefinition) definition;
		Class<?> type = planner.getIntrospector().findClass(classDefinition.getClassName());
		if (type == null) {
			return false;
		}
		try {
			planner.plan(type, classDefinition);
			return true;
		} catch (InjectionException e) {
			return false;
		}
	}

	private Object resolveFactory(String entryName, FactoryDefinition definition) {
		try {
			return definition.getFactory().create(container);
		} catch (DIException e) {
			throw e;
		} catch (Exception e) {
			throw new DependencyException("Error while resolving entry '" + entryName + "' with its factory: " + e.getMessage(), e);
		}
	}

	private Object resolveClass(String entryName, ClassDefinition definition) {
		Class<?> type = planner.getIntrospector().findClass(definition.getClassName());
		if (type == null) {
			throw new DependencyException("Entry '" + entryName + "' cannot be resolved: the class " +
					definition.getClassName() + " doesn't exist");
		}
		ObjectInjection injection;
		try {
			injection = planner.plan(type, definition);
		} catch (InjectionException e) {
			throw new DependencyException("Entry '" + entryName + "' cannot be resolved: " + e.getMessage());
		}

		Object instance;
		try {
			Constructor<?> constructor = injection.getConstructor();
			constructor.setAccessible(true);
			instance = constructor.newInstance(resolveAll(entryName, injection.getConstructorArguments()));

			for (PropertyInjection property : injection.getProperties()) {
				Object value = resolve(entryName, property.getValue());
				Field field = property.getField();
				if (field != null) {
					field.setAccessible(true);
					field.set(instance, value);
				} else {
					Method setter = property.getSetter();
					setter.setAccessible(true);
					setter.invoke(instance, value);
				}
			}

			for (MethodCall call : injection.getMethodCalls()) {
				Method method = call.getMethod();
				method.setAccessible(true);
				method.invoke(instance, resolveAll(entryName, call.getArguments()));
			}
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof DIException) {
				throw (DIException) cause;
			}
			throw new DependencyException("Error while constructing entry '" + entryName + "': " + cause, cause);
		} catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
			throw new DependencyException("Entry '" + entryName + "' cannot be resolved: " + e.getMessage(), e);
		}
		return instance;
	}

	private Object[] resolveAll(String entryName, List<Definition> definitions) {
		Object[] values = new Object[definitions.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = resolve(entryName, definitions.get(i));
		}
		return values;
	}

	private Object resolveArray(String entryName, ArrayDefinition definition) {
		if (definition.isList()) {
			List<Object> list = new ArrayList<>();
			for (Definition element : definition.getElements().values()) {
				list.add(resolve(entryName, element));
			}
			return list;
		}
		Map<String, Object> map = new LinkedHashMap<>();
		for (Map.Entry<Object, Definition> element : definition.getElements().entrySet()) {
			map.put((String) element.getKey(), resolve(entryName, element.getValue()));
		}
		return map;
	}

	@Nullable
	private Object resolveEnvironmentVariable(String entryName, EnvironmentVariableDefinition definition) {
		String value = System.getenv(definition.getVariableName());
		if (value != null) {
			return value;
		}
		Definition defaultValue = definition.getDefaultValue();
		if (defaultValue != null) {
			return resolve(entryName, defaultValue);
		}
		if (definition.isOptional()) {
			return null;
		}
		throw missingEnvironmentVariable(definition.getVariableName(), entryName);
	}

	public static DependencyException missingEnvironmentVariable(String variableName, String entryName) {
		return new DependencyException("The environment variable '" + variableName +
				"' has not been defined, it is required by entry '" + entryName + "'");
	}
}
