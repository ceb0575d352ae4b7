package io.forgedi.di.compiler;

import io.forgedi.di.compiler.CompilationPlan.*;
import io.forgedi.di.definition.*;
import io.forgedi.di.error.CompilationException;
import io.forgedi.di.introspect.InjectionException;
import io.forgedi.di.introspect.InjectionPlanner;
import io.forgedi.di.introspect.ObjectInjection;
import io.forgedi.di.introspect.ObjectInjection.MethodCall;
import io.forgedi.di.introspect.ObjectInjection.PropertyInjection;
import io.forgedi.di.introspect.TypeIntrospector;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.*;

import static io.forgedi.codegen.Utils.isAccessible;
import static io.forgedi.di.error.CompilationException.Kind.*;
import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isPublic;

/**
 * Decides whether a definition can be turned into generated code, and how.
 * <p>
 * The analysis looks at the definition and at classes only, so the same definitions always
 * give the same answer. A definition is compilable only if all of its nested definitions are;
 * the first nested failure is rethrown wrapped once for every enclosing definition.
 */
public final class CompilabilityAnalyzer {
	public static final String OBJECT_FOUND = "An object was found but objects cannot be compiled";
	public static final String ANONYMOUS_CLASS = "anonymous classes cannot be compiled";
	public static final String CLASS_DOES_NOT_EXIST = "the class doesn't exist";

	private static final Set<Class<?>> SCALAR_TYPES = new HashSet<>(Arrays.asList(
			String.class, Boolean.class, Character.class,
			Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class));

	private final InjectionPlanner planner;

	public CompilabilityAnalyzer(TypeIntrospector introspector) {
		this.planner = new InjectionPlanner(introspector);
	}

	/**
	 * Returns the plan of the definition, or {@code null} if it is never compiled because it is,
	 * or contains, a factory
	 *
	 * @param path segments leading from the entry name to this definition
	 * @throws CompilationException if the definition cannot be compiled
	 */
	@Nullable
	public CompilationPlan analyze(Definition definition, List<Object> path) {
		if (definition instanceof ValueDefinition) {
			return analyzeValue(((ValueDefinition) definition).getValue(), path);
		}
		if (definition instanceof AliasDefinition) {
			return new Reference(((AliasDefinition) definition).getTargetName());
		}
		if (definition instanceof FactoryDefinition) {
			return null;
		}
		if (definition instanceof ClassDefinition) {
			return analyzeClass((ClassDefinition) definition, path);
		}
		if (definition instanceof ArrayDefinition) {
			return analyzeArray((ArrayDefinition) definition, path);
		}
		if (definition instanceof EnvironmentVariableDefinition) {
			EnvironmentVariableDefinition env = (EnvironmentVariableDefinition) definition;
			Definition defaultValue = env.getDefaultValue();
			CompilationPlan defaultPlan = null;
			if (defaultValue != null) {
				defaultPlan = analyzeNested(defaultValue, path, "default");
				if (defaultPlan == null) {
					return null;
				}
			}
			return new EnvironmentVariable(env.getVariableName(), entryName(path), env.isOptional(), defaultPlan);
		}
		if (definition instanceof StringDefinition) {
			return new Interpolation(entryName(path), ((StringDefinition) definition).getExpression());
		}
		throw CompilationException.of(OBJECT_NOT_COMPILABLE, path, OBJECT_FOUND);
	}

	private CompilationPlan analyzeValue(@Nullable Object value, List<Object> path) {
		if (value == null || SCALAR_TYPES.contains(value.getClass())) {
			return new Constant(value);
		}
		if (value instanceof Enum) {
			Class<?> enumType = ((Enum<?>) value).getDeclaringClass();
			if (!isAccessible(enumType)) {
				throw CompilationException.of(MEMBER_NOT_ACCESSIBLE, path, "the enum " + enumType.getName() + " is not public");
			}
			return new Constant(value);
		}
		if (value instanceof List) {
			List<CompilationPlan> elements = new ArrayList<>();
			List<?> list = (List<?>) value;
			for (int i = 0; i < list.size(); i++) {
				elements.add(analyzeNestedValue(list.get(i), path, i));
			}
			return new ListOf(elements);
		}
		if (value instanceof Map && ((Map<?, ?>) value).keySet().stream().allMatch(key -> key instanceof String)) {
			Map<String, CompilationPlan> elements = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				String key = (String) entry.getKey();
				elements.put(key, analyzeNestedValue(entry.getValue(), path, key));
			}
			return new MapOf(elements);
		}
		throw CompilationException.of(OBJECT_NOT_COMPILABLE, path, OBJECT_FOUND);
	}

	private CompilationPlan analyzeNestedValue(@Nullable Object value, List<Object> path, Object segment) {
		try {
			return analyzeValue(value, append(path, segment));
		} catch (CompilationException e) {
			throw CompilationException.nested(path, e);
		}
	}

	@Nullable
	private CompilationPlan analyzeArray(ArrayDefinition definition, List<Object> path) {
		boolean compiled = true;
		List<CompilationPlan> elements = new ArrayList<>();
		Map<String, CompilationPlan> entries = new LinkedHashMap<>();
		for (Map.Entry<Object, Definition> element : definition.getElements().entrySet()) {
			CompilationPlan plan = analyzeNested(element.getValue(), path, element.getKey());
			compiled &= plan != null;
			if (definition.isList()) {
				elements.add(plan);
			} else {
				entries.put((String) element.getKey(), plan);
			}
		}
		if (!compiled) {
			return null;
		}
		return definition.isList() ? new ListOf(elements) : new MapOf(entries);
	}

	@Nullable
	private CompilationPlan analyzeClass(ClassDefinition definition, List<Object> path) {
		Class<?> type = planner.getIntrospector().findClass(definition.getClassName());
		if (type == null) {
			throw CompilationException.of(CLASS_NOT_FOUND, path, CLASS_DOES_NOT_EXIST);
		}
		if (type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic() || type.getCanonicalName() == null) {
			throw CompilationException.of(ANONYMOUS_TYPE_NOT_COMPILABLE, path, ANONYMOUS_CLASS);
		}
		ObjectInjection injection;
		try {
			injection = planner.plan(type, definition);
		} catch (InjectionException e) {
			throw CompilationException.of(CLASS_NOT_INSTANTIABLE, path, e.getMessage());
		}
		if (!isAccessible(type)) {
			throw CompilationException.of(MEMBER_NOT_ACCESSIBLE, path, "the class " + type.getName() + " is not public");
		}
		Constructor<?> constructor = injection.getConstructor();
		if (!isAccessible(constructor)) {
			throw CompilationException.of(MEMBER_NOT_ACCESSIBLE, path, "the constructor " + constructor + " is not public");
		}

		boolean compiled = true;
		List<CompilationPlan> arguments = new ArrayList<>();
		List<Definition> constructorArguments = injection.getConstructorArguments();
		for (int i = 0; i < constructorArguments.size(); i++) {
			CompilationPlan plan = analyzeNested(constructorArguments.get(i), path, "constructor(" + i + ")");
			compiled &= plan != null;
			arguments.add(plan);
		}

		List<Injection> injections = new ArrayList<>();
		for (PropertyInjection property : injection.getProperties()) {
			CompilationPlan plan = analyzeNested(property.getValue(), path, property.getName());
			compiled &= plan != null;
			Field field = property.getField();
			if (field != null) {
				boolean direct = isAccessible(field) && !isFinal(field.getModifiers());
				injections.add(new FieldAssignment(field, direct, plan));
			} else {
				injections.add(new Invocation(checkAccessible(property.getSetter(), path), Collections.singletonList(plan)));
			}
		}
		for (MethodCall call : injection.getMethodCalls()) {
			Method method = checkAccessible(call.getMethod(), path);
			List<CompilationPlan> methodArguments = new ArrayList<>();
			List<Definition> callArguments = call.getArguments();
			for (int i = 0; i < callArguments.size(); i++) {
				CompilationPlan plan = analyzeNested(callArguments.get(i), path, method.getName() + "(" + i + ")");
				compiled &= plan != null;
				methodArguments.add(plan);
			}
			injections.add(new Invocation(method, methodArguments));
		}

		return compiled ? new Construction(constructor, arguments, injections) : null;
	}

	@Nullable
	private CompilationPlan analyzeNested(Definition definition, List<Object> path, Object segment) {
		try {
			return analyze(definition, append(path, segment));
		} catch (CompilationException e) {
			throw CompilationException.nested(path, e);
		}
	}

	private static Method checkAccessible(Method method, List<Object> path) {
		if (!isAccessible(method) || !isPublic(method.getDeclaringClass().getModifiers())) {
			throw CompilationException.of(MEMBER_NOT_ACCESSIBLE, path, "the method " + method + " is not public");
		}
		return method;
	}

	private static List<Object> append(List<Object> path, Object segment) {
		List<Object> result = new ArrayList<>(path.size() + 1);
		result.addAll(path);
		result.add(segment);
		return result;
	}

	private static String entryName(List<Object> path) {
		return String.valueOf(path.get(0));
	}
}
