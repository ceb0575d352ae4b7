package io.forgedi.di.introspect;

import io.forgedi.di.definition.AliasDefinition;
import io.forgedi.di.definition.ClassDefinition;
import io.forgedi.di.definition.Definition;
import io.forgedi.di.definition.MethodInjection;
import io.forgedi.di.introspect.ObjectInjection.MethodCall;
import io.forgedi.di.introspect.ObjectInjection.PropertyInjection;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;

import static java.lang.String.format;

/**
 * Matches a {@link ClassDefinition} against its class.
 * <p>
 * Shared by the interpreted resolver and the compiler, so both construct an entry
 * with the same constructor and inject the same members in the same order.
 */
public final class InjectionPlanner {
	public static final String NOT_INSTANTIABLE = "the class is not instantiable";

	private final TypeIntrospector introspector;

	public InjectionPlanner(TypeIntrospector introspector) {
		this.introspector = introspector;
	}

	public TypeIntrospector getIntrospector() {
		return introspector;
	}

	public ObjectInjection plan(Class<?> type, ClassDefinition definition) throws InjectionException {
		if (type.isInterface() || type.isArray() || type.isPrimitive() || type.isEnum() ||
				Modifier.isAbstract(type.getModifiers())) {
			throw new InjectionException(NOT_INSTANTIABLE);
		}

		List<Definition> explicitArguments = definition.getConstructorArguments();
		int explicitCount = explicitArguments == null ? 0 : explicitArguments.size();
		Constructor<?> constructor = introspector.findConstructor(type, explicitCount);
		if (constructor == null) {
			throw new InjectionException(format("%s: no constructor of %s can be used with %d arguments",
					NOT_INSTANTIABLE, type.getName(), explicitCount));
		}
		List<Definition> constructorArguments = new ArrayList<>();
		if (explicitArguments != null) {
			constructorArguments.addAll(explicitArguments);
		}
		int parameterCount = constructor.getParameterCount();
		if (explicitCount > parameterCount || (explicitCount < parameterCount && !definition.isAutowired())) {
			throw new InjectionException(format("%s: constructor %s expects %d arguments, %d given",
					NOT_INSTANTIABLE, constructor, parameterCount, explicitCount));
		}
		List<String> dependencies = introspector.getParameterDependencies(constructor);
		for (int i = explicitCount; i < parameterCount; i++) {
			constructorArguments.add(new AliasDefinition(dependencies.get(i)));
		}

		Map<String, PropertyInjection> properties = new LinkedHashMap<>();
		if (definition.isAutowired()) {
			for (Field field : introspector.getInjectedFields(type)) {
				properties.put(field.getName(), new PropertyInjection(field.getName(), field, null,
						new AliasDefinition(introspector.getFieldDependency(field))));
			}
		}
		for (Map.Entry<String, Definition> entry : definition.getProperties().entrySet()) {
			String name = entry.getKey();
			Field field = introspector.findField(type, name);
			Method setter = field == null ? introspector.findSetter(type, name) : null;
			if (field == null && setter == null) {
				throw new InjectionException(format("%s: %s has no property '%s'", NOT_INSTANTIABLE, type.getName(), name));
			}
			properties.remove(name);
			properties.put(name, new PropertyInjection(name, field, setter, entry.getValue()));
		}

		List<MethodCall> methodCalls = new ArrayList<>();
		if (definition.isAutowired()) {
			for (Method method : introspector.getInjectedMethods(type)) {
				List<Definition> arguments = new ArrayList<>();
				for (String dependency : introspector.getParameterDependencies(method)) {
					arguments.add(new AliasDefinition(dependency));
				}
				methodCalls.add(new MethodCall(method, arguments));
			}
		}
		for (MethodInjection injection : definition.getMethods()) {
			Method method = introspector.findMethod(type, injection.getMethodName(), injection.getArguments().size());
			if (method == null) {
				throw new InjectionException(format("%s: %s has no method %s taking %d arguments",
						NOT_INSTANTIABLE, type.getName(), injection.getMethodName(), injection.getArguments().size()));
			}
			methodCalls.add(new MethodCall(method, injection.getArguments()));
		}

		return new ObjectInjection(type, constructor, constructorArguments, new ArrayList<>(properties.values()), methodCalls);
	}
}
