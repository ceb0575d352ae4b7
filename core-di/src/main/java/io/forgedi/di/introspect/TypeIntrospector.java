package io.forgedi.di.introspect;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;

/**
 * Tells how a type can be constructed and what it depends on.
 * <p>
 * The compiler consults it only while generating code, the interpreted resolver
 * on every resolution. An implementation may answer from a static registry instead of
 * reflection, as long as both callers get the same answers.
 */
public interface TypeIntrospector {
	@Nullable
	Class<?> findClass(String className);

	/**
	 * Picks the constructor used to instantiate {@code type}: the {@link io.forgedi.di.Inject}
	 * annotated one, else the only public one, else a public one taking exactly
	 * {@code explicitArguments} parameters
	 */
	@Nullable
	Constructor<?> findConstructor(Class<?> type, int explicitArguments);

	/**
	 * Returns the name of the entry injected into each parameter, in order
	 */
	List<String> getParameterDependencies(Executable executable);

	/**
	 * Returns fields annotated for injection, superclass fields first
	 */
	List<Field> getInjectedFields(Class<?> type);

	/**
	 * Returns methods annotated for injection, superclass methods first
	 */
	List<Method> getInjectedMethods(Class<?> type);

	String getFieldDependency(Field field);

	/**
	 * Finds a field with the given name in {@code type} or its superclasses, whatever its visibility
	 */
	@Nullable
	Field findField(Class<?> type, String name);

	/**
	 * Finds a public one-argument {@code setXxx} method for the property
	 */
	@Nullable
	Method findSetter(Class<?> type, String property);

	@Nullable
	Method findMethod(Class<?> type, String name, int parameterCount);
}
