package io.forgedi.di.introspect;

import io.forgedi.di.Inject;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.*;
import java.util.ArrayList;
import java.util.List;

import static java.lang.reflect.Modifier.isStatic;
import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toList;

public final class ReflectionTypeIntrospector implements TypeIntrospector {
	private final ClassLoader classLoader;

	public ReflectionTypeIntrospector() {
		this(ReflectionTypeIntrospector.class.getClassLoader());
	}

	public ReflectionTypeIntrospector(ClassLoader classLoader) {
		this.classLoader = classLoader;
	}

	@Override
	@Nullable
	public Class<?> findClass(String className) {
		try {
			return Class.forName(className, false, classLoader);
		} catch (ClassNotFoundException | LinkageError e) {
			return null;
		}
	}

	@Override
	@Nullable
	public Constructor<?> findConstructor(Class<?> type, int explicitArguments) {
		Constructor<?>[] declared = type.getDeclaredConstructors();
		List<Constructor<?>> injectable = stream(declared)
				.filter(constructor -> constructor.isAnnotationPresent(Inject.class))
				.collect(toList());
		if (injectable.size() == 1) {
			return injectable.get(0);
		}
		if (injectable.size() > 1) {
			return null;
		}
		Constructor<?>[] constructors = type.getConstructors();
		if (constructors.length == 1) {
			return constructors[0];
		}
		if (constructors.length == 0 && declared.length == 1) {
			return declared[0];
		}
		for (Constructor<?> constructor : constructors) {
			if (constructor.getParameterCount() == explicitArguments) {
				return constructor;
			}
		}
		return null;
	}

	@Override
	public List<String> getParameterDependencies(Executable executable) {
		List<String> dependencies = new ArrayList<>();
		for (Parameter parameter : executable.getParameters()) {
			Inject inject = parameter.getAnnotation(Inject.class);
			dependencies.add(inject != null && !inject.value().isEmpty() ?
					inject.value() :
					parameter.getType().getName());
		}
		return dependencies;
	}

	@Override
	public List<Field> getInjectedFields(Class<?> type) {
		List<Field> fields = new ArrayList<>();
		for (Class<?> cls : hierarchy(type)) {
			for (Field field : cls.getDeclaredFields()) {
				if (field.isAnnotationPresent(Inject.class) && !isStatic(field.getModifiers())) {
					fields.add(field);
				}
			}
		}
		return fields;
	}

	@Override
	public List<Method> getInjectedMethods(Class<?> type) {
		List<Method> methods = new ArrayList<>();
		for (Class<?> cls : hierarchy(type)) {
			for (Method method : cls.getDeclaredMethods()) {
				if (method.isAnnotationPresent(Inject.class) && !isStatic(method.getModifiers())) {
					methods.add(method);
				}
			}
		}
		return methods;
	}

	@Override
	public String getFieldDependency(Field field) {
		Inject inject = field.getAnnotation(Inject.class);
		return inject != null && !inject.value().isEmpty() ? inject.value() : field.getType().getName();
	}

	@Override
	@Nullable
	public Field findField(Class<?> type, String name) {
		for (Class<?> cls = type; cls != null && cls != Object.class; cls = cls.getSuperclass()) {
			try {
				Field field = cls.getDeclaredField(name);
				if (!isStatic(field.getModifiers())) {
					return field;
				}
			} catch (NoSuchFieldException ignored) {
			}
		}
		return null;
	}

	@Override
	@Nullable
	public Method findSetter(Class<?> type, String property) {
		if (property.isEmpty()) {
			return null;
		}
		String setterName = "set" + Character.toUpperCase(property.charAt(0)) + property.substring(1);
		return findMethod(type, setterName, 1);
	}

	@Override
	@Nullable
	public Method findMethod(Class<?> type, String name, int parameterCount) {
		for (Method method : type.getMethods()) {
			if (method.getName().equals(name) && method.getParameterCount() == parameterCount && !isStatic(method.getModifiers())) {
				return method;
			}
		}
		for (Class<?> cls = type; cls != null && cls != Object.class; cls = cls.getSuperclass()) {
			for (Method method : cls.getDeclaredMethods()) {
				if (method.getName().equals(name) && method.getParameterCount() == parameterCount && !isStatic(method.getModifiers())) {
					return method;
				}
			}
		}
		return null;
	}

	private static List<Class<?>> hierarchy(Class<?> type) {
		List<Class<?>> classes = new ArrayList<>();
		for (Class<?> cls = type; cls != null && cls != Object.class; cls = cls.getSuperclass()) {
			classes.add(0, cls);
		}
		return classes;
	}
}
