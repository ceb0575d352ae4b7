package io.forgedi.di.compiler;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Resolution steps of one compilable definition, with every class member already looked up.
 * Plans form a tree mirroring the definition they were produced from.
 */
public abstract class CompilationPlan {
	private CompilationPlan() {
	}

	public static final class Constant extends CompilationPlan {
		@Nullable
		private final Object value;

		Constant(@Nullable Object value) {
			this.value = value;
		}

		@Nullable
		public Object getValue() {
			return value;
		}
	}

	public static final class ListOf extends CompilationPlan {
		private final List<CompilationPlan> elements;

		ListOf(List<CompilationPlan> elements) {
			this.elements = unmodifiableList(elements);
		}

		public List<CompilationPlan> getElements() {
			return elements;
		}
	}

	public static final class MapOf extends CompilationPlan {
		private final Map<String, CompilationPlan> elements;

		MapOf(Map<String, CompilationPlan> elements) {
			this.elements = unmodifiableMap(elements);
		}

		public Map<String, CompilationPlan> getElements() {
			return elements;
		}
	}

	/**
	 * Looks another entry up through the container
	 */
	public static final class Reference extends CompilationPlan {
		private final String entryName;

		Reference(String entryName) {
			this.entryName = entryName;
		}

		public String getEntryName() {
			return entryName;
		}
	}

	public static final class Construction extends CompilationPlan {
		private final Constructor<?> constructor;
		private final List<CompilationPlan> arguments;
		private final List<Injection> injections;

		Construction(Constructor<?> constructor, List<CompilationPlan> arguments, List<Injection> injections) {
			this.constructor = constructor;
			this.arguments = unmodifiableList(arguments);
			this.injections = unmodifiableList(injections);
		}

		public Constructor<?> getConstructor() {
			return constructor;
		}

		public List<CompilationPlan> getArguments() {
			return arguments;
		}

		/**
		 * Properties first, then method calls
		 */
		public List<Injection> getInjections() {
			return injections;
		}
	}

	public abstract static class Injection {
		private Injection() {
		}
	}

	public static final class FieldAssignment extends Injection {
		private final Field field;
		private final boolean direct;
		private final CompilationPlan value;

		FieldAssignment(Field field, boolean direct, CompilationPlan value) {
			this.field = field;
			this.direct = direct;
			this.value = value;
		}

		public Field getField() {
			return field;
		}

		/**
		 * Tells whether generated code may assign the field itself, otherwise it goes through reflection
		 */
		public boolean isDirect() {
			return direct;
		}

		public CompilationPlan getValue() {
			return value;
		}
	}

	/**
	 * A setter or any other method called on the constructed instance
	 */
	public static final class Invocation extends Injection {
		private final Method method;
		private final List<CompilationPlan> arguments;

		Invocation(Method method, List<CompilationPlan> arguments) {
			this.method = method;
			this.arguments = unmodifiableList(arguments);
		}

		public Method getMethod() {
			return method;
		}

		public List<CompilationPlan> getArguments() {
			return arguments;
		}
	}

	public static final class EnvironmentVariable extends CompilationPlan {
		private final String variableName;
		private final String entryName;
		private final boolean optional;
		@Nullable
		private final CompilationPlan defaultValue;

		EnvironmentVariable(String variableName, String entryName, boolean optional, @Nullable CompilationPlan defaultValue) {
			this.variableName = variableName;
			this.entryName = entryName;
			this.optional = optional;
			this.defaultValue = defaultValue;
		}

		public String getVariableName() {
			return variableName;
		}

		public String getEntryName() {
			return entryName;
		}

		public boolean isOptional() {
			return optional;
		}

		@Nullable
		public CompilationPlan getDefaultValue() {
			return defaultValue;
		}
	}

	public static final class Interpolation extends CompilationPlan {
		private final String entryName;
		private final String expression;

		Interpolation(String entryName, String expression) {
			this.entryName = entryName;
			this.expression = expression;
		}

		public String getEntryName() {
			return entryName;
		}

		public String getExpression() {
			return expression;
		}
	}
}
