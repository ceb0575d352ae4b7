package io.forgedi.di.compiler;

import io.forgedi.codegen.ClassBuilder;
import io.forgedi.codegen.DefiningClassLoader;
import io.forgedi.codegen.Expression;
import io.forgedi.di.CompiledContainer;
import io.forgedi.di.Container;
import io.forgedi.di.compiler.CompilationPlan.*;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.definition.StringDefinition;
import io.forgedi.di.introspect.TypeIntrospector;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.forgedi.codegen.Expressions.*;
import static io.forgedi.di.CompiledContainer.ENTRY_ROUTINE_PREFIX;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;

/**
 * Turns compilation plans into the bytecode of a {@link CompiledContainer} subclass.
 * <p>
 * Each entry gets its own routine. A routine never inlines another entry, it asks
 * the container for it, so compiled and interpreted entries can depend on each other freely.
 * Long lists of entry names or of collection elements are spread over helper methods
 * so that no generated method outgrows the size limit of the class file format.
 */
public final class CodeGenerator {
	static final int MAX_ELEMENTS_PER_METHOD = 256;
	static final int MAX_ENTRY_NAMES_PER_METHOD = 1024;

	private static final String PART_SEPARATOR = "$part";

	private static final Method CONTAINER_GET = method(Container.class, "get", String.class);
	private static final Method LIST_OF = method(CompiledContainer.class, "listOf", Object[].class);
	private static final Method MAP_OF = method(CompiledContainer.class, "mapOf", Object[].class);
	private static final Method CONCAT_ELEMENTS = method(CompiledContainer.class, "concatElements", Object[][].class);
	private static final Method CONCAT_ENTRY_NAMES = method(CompiledContainer.class, "concatEntryNames", String[][].class);
	private static final Method ENVIRONMENT_VARIABLE = method(CompiledContainer.class, "environmentVariable", String.class);
	private static final Method MISSING_ENVIRONMENT_VARIABLE = method(CompiledContainer.class, "missingEnvironmentVariable", String.class, String.class);
	private static final Method INJECT_FIELD = method(CompiledContainer.class, "injectField", Object.class, String.class, String.class, Object.class);
	private static final Method RESOLVE_EXPRESSION = method(StringDefinition.class, "resolveExpression", String.class, String.class, Container.class);

	/**
	 * Generates the body of a routine, adding the helper methods it needs to {@code builder}.
	 * Helper methods are named after the routine, so each routine name must be used once per class.
	 */
	public Expression generate(CompilationPlan plan, String routineName, ClassBuilder<?> builder) {
		return new Routine(builder, routineName).generate(plan);
	}

	/**
	 * Generates the container class: a constructor taking a {@link DefinitionSource} and a {@link TypeIntrospector},
	 * routines {@code entry0}, {@code entry1}, ... in the iteration order of {@code plans},
	 * and {@link CompiledContainer#getCompiledEntries()}
	 */
	public byte[] assemble(Map<String, CompilationPlan> plans, ArtifactIdentity identity) {
		DefiningClassLoader classLoader = DefiningClassLoader.create(identity.getParentType().getClassLoader());
		ClassBuilder<? extends CompiledContainer> builder = ClassBuilder.create(classLoader, identity.getParentType());
		builder.withClassName(identity.getClassName());
		builder.withConstructor(asList(DefinitionSource.class, TypeIntrospector.class));

		List<Expression> entryNames = new ArrayList<>();
		int index = 0;
		for (Map.Entry<String, CompilationPlan> entry : plans.entrySet()) {
			String routineName = ENTRY_ROUTINE_PREFIX + index++;
			builder.withMethod(routineName, Object.class, emptyList(), generate(entry.getValue(), routineName, builder));
			entryNames.add(value(entry.getKey()));
		}
		builder.withMethod("getCompiledEntries", String[].class, emptyList(), entryNamesTable(builder, entryNames));
		return builder.toBytecode();
	}

	private static Expression entryNamesTable(ClassBuilder<?> builder, List<Expression> entryNames) {
		if (entryNames.size() <= MAX_ENTRY_NAMES_PER_METHOD) {
			return arrayOf(String.class, entryNames);
		}
		List<Expression> parts = new ArrayList<>();
		for (int from = 0; from < entryNames.size(); from += MAX_ENTRY_NAMES_PER_METHOD) {
			String part = "getCompiledEntries" + PART_SEPARATOR + parts.size();
			List<Expression> chunk = entryNames.subList(from, Math.min(entryNames.size(), from + MAX_ENTRY_NAMES_PER_METHOD));
			builder.withMethod(part, String[].class, emptyList(), arrayOf(String.class, new ArrayList<>(chunk)));
			parts.add(callSelf(part, String[].class));
		}
		return callStatic(CONCAT_ENTRY_NAMES, arrayOf(String[].class, parts));
	}

	private static Method method(Class<?> owner, String name, Class<?>... parameterTypes) {
		try {
			return owner.getDeclaredMethod(name, parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new IllegalStateException(e);
		}
	}

	private static final class Routine {
		private final ClassBuilder<?> builder;
		private final String name;
		private int parts;

		Routine(ClassBuilder<?> builder, String name) {
			this.builder = builder;
			this.name = name;
		}

		Expression generate(CompilationPlan plan) {
			if (plan instanceof Constant) {
				Object value = ((Constant) plan).getValue();
				return value == null ? nullRef(Object.class) : value(value);
			}
			if (plan instanceof Reference) {
				return call(self(), CONTAINER_GET, value(((Reference) plan).getEntryName()));
			}
			if (plan instanceof ListOf) {
				List<Expression> elements = new ArrayList<>();
				for (CompilationPlan element : ((ListOf) plan).getElements()) {
					elements.add(generate(element));
				}
				return callStatic(LIST_OF, elements(elements));
			}
			if (plan instanceof MapOf) {
				List<Expression> keysAndValues = new ArrayList<>();
				for (Map.Entry<String, CompilationPlan> entry : ((MapOf) plan).getElements().entrySet()) {
					keysAndValues.add(value(entry.getKey()));
					keysAndValues.add(generate(entry.getValue()));
				}
				return callStatic(MAP_OF, elements(keysAndValues));
			}
			if (plan instanceof Construction) {
				return generateConstruction((Construction) plan);
			}
			if (plan instanceof EnvironmentVariable) {
				EnvironmentVariable env = (EnvironmentVariable) plan;
				Expression variable = callStatic(ENVIRONMENT_VARIABLE, value(env.getVariableName()));
				if (env.getDefaultValue() != null) {
					return ifNull(variable, generate(env.getDefaultValue()));
				}
				if (env.isOptional()) {
					return variable;
				}
				return ifNull(variable, callStatic(MISSING_ENVIRONMENT_VARIABLE, value(env.getVariableName()), value(env.getEntryName())));
			}
			if (plan instanceof Interpolation) {
				Interpolation interpolation = (Interpolation) plan;
				return callStatic(RESOLVE_EXPRESSION, value(interpolation.getEntryName()), value(interpolation.getExpression()), self());
			}
			throw new IllegalArgumentException("Unknown compilation plan " + plan);
		}

		/**
		 * Builds an {@code Object[]} of the elements, filled by helper methods when there are too many of them
		 */
		private Expression elements(List<Expression> elements) {
			if (elements.size() <= MAX_ELEMENTS_PER_METHOD) {
				return arrayOf(Object.class, elements);
			}
			List<Expression> chunks = new ArrayList<>();
			for (int from = 0; from < elements.size(); from += MAX_ELEMENTS_PER_METHOD) {
				String part = name + PART_SEPARATOR + parts++;
				List<Expression> chunk = elements.subList(from, Math.min(elements.size(), from + MAX_ELEMENTS_PER_METHOD));
				builder.withMethod(part, Object[].class, emptyList(), arrayOf(Object.class, new ArrayList<>(chunk)));
				chunks.add(callSelf(part, Object[].class));
			}
			return callStatic(CONCAT_ELEMENTS, arrayOf(Object[].class, chunks));
		}

		private Expression generateConstruction(Construction construction) {
			List<Expression> arguments = new ArrayList<>();
			for (CompilationPlan argument : construction.getArguments()) {
				arguments.add(generate(argument));
			}
			return let(constructor(construction.getConstructor(), arguments), instance -> {
				List<Expression> steps = new ArrayList<>();
				for (Injection injection : construction.getInjections()) {
					if (injection instanceof FieldAssignment) {
						FieldAssignment assignment = (FieldAssignment) injection;
						Expression value = generate(assignment.getValue());
						steps.add(assignment.isDirect() ?
								setField(instance, assignment.getField(), value) :
								callStatic(INJECT_FIELD, instance,
										value(assignment.getField().getDeclaringClass().getName()),
										value(assignment.getField().getName()),
										value));
					} else {
						Invocation invocation = (Invocation) injection;
						List<Expression> invocationArguments = new ArrayList<>();
						for (CompilationPlan argument : invocation.getArguments()) {
							invocationArguments.add(generate(argument));
						}
						steps.add(call(instance, invocation.getMethod(), invocationArguments));
					}
				}
				steps.add(instance);
				return sequence(steps);
			});
		}
	}
}
