package io.forgedi.di;

import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.error.CompiledContainerImmutableException;
import io.forgedi.di.error.DIException;
import io.forgedi.di.error.DependencyException;
import io.forgedi.di.introspect.TypeIntrospector;
import io.forgedi.di.resolver.DefinitionResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.util.*;

import static java.lang.invoke.MethodType.methodType;
import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableMap;

/**
 * Base class of generated containers.
 * <p>
 * A generated subclass declares one no-arg routine per compiled entry, named
 * {@value #ENTRY_ROUTINE_PREFIX} followed by the index of the entry in
 * {@link #getCompiledEntries()}. Those routines form the dispatch table, which is consulted
 * before the interpreted resolution of the definitions this container was created with.
 * <p>
 * A custom parent type for generated containers must extend this class, must not be final
 * and must declare a public or protected constructor taking a {@link DefinitionSource} and a
 * {@link TypeIntrospector}, the one used to resolve entries which are not compiled.
 */
public abstract class CompiledContainer extends Container {
	public static final String ENTRY_ROUTINE_PREFIX = "entry";

	private final Map<String, MethodHandle> dispatchTable;

	protected CompiledContainer(@NotNull DefinitionSource definitionSource, @NotNull TypeIntrospector introspector) {
		super(definitionSource, introspector);
		String[] compiledEntries = getCompiledEntries();
		MethodHandles.Lookup lookup = MethodHandles.publicLookup();
		Map<String, MethodHandle> table = new LinkedHashMap<>();
		for (int i = 0; i < compiledEntries.length; i++) {
			String routine = ENTRY_ROUTINE_PREFIX + i;
			try {
				table.put(compiledEntries[i], lookup.findVirtual(getClass(), routine, methodType(Object.class)).bindTo(this));
			} catch (NoSuchMethodException | IllegalAccessException e) {
				throw new DIException("Compiled container " + getClass().getName() + " has no routine " + routine +
						" for entry '" + compiledEntries[i] + "'", e);
			}
		}
		this.dispatchTable = unmodifiableMap(table);
	}

	/**
	 * Returns the names of compiled entries in the order of their routines
	 */
	public abstract String[] getCompiledEntries();

	public boolean isEntryCompiled(@NotNull String name) {
		return dispatchTable.containsKey(name);
	}

	@Override
	public synchronized boolean has(@NotNull String name) {
		return dispatchTable.containsKey(name) || super.has(name);
	}

	/**
	 * Always fails: the generated routines are fixed once the container is compiled
	 */
	@Override
	public void set(@NotNull String name, @Nullable Object value) {
		throw new CompiledContainerImmutableException(name);
	}

	@Override
	@Nullable
	protected Object resolveEntry(String name) {
		MethodHandle routine = dispatchTable.get(name);
		if (routine == null) {
			return super.resolveEntry(name);
		}
		try {
			return (Object) routine.invokeExact();
		} catch (DIException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new DependencyException("Error while resolving compiled entry '" + name + "': " + e, e);
		}
	}

	// region helpers called from generated code
	protected static List<Object> listOf(Object[] elements) {
		return new ArrayList<>(asList(elements));
	}

	/**
	 * @param keysAndValues keys at even positions, each followed by its value
	 */
	protected static Map<String, Object> mapOf(Object[] keysAndValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			map.put((String) keysAndValues[i], keysAndValues[i + 1]);
		}
		return map;
	}

	protected static Object[] concatElements(Object[][] parts) {
		List<Object> elements = new ArrayList<>();
		for (Object[] part : parts) {
			elements.addAll(asList(part));
		}
		return elements.toArray();
	}

	protected static String[] concatEntryNames(String[][] parts) {
		List<String> names = new ArrayList<>();
		for (String[] part : parts) {
			names.addAll(asList(part));
		}
		return names.toArray(new String[0]);
	}

	@Nullable
	protected static Object environmentVariable(String variableName) {
		return System.getenv(variableName);
	}

	protected static Object missingEnvironmentVariable(String variableName, String entryName) {
		throw DefinitionResolver.missingEnvironmentVariable(variableName, entryName);
	}

	/**
	 * Assigns a field generated code cannot reach directly, like a private or final one
	 */
	protected static void injectField(Object target, String declaringClassName, String fieldName, @Nullable Object value) {
		try {
			Class<?> declaringClass = Class.forName(declaringClassName, false, target.getClass().getClassLoader());
			Field field = declaringClass.getDeclaredField(fieldName);
			field.setAccessible(true);
			field.set(target, value);
		} catch (ReflectiveOperationException | IllegalArgumentException e) {
			throw new DependencyException("Cannot inject field " + fieldName + " of " + declaringClassName, e);
		}
	}
	// endregion
}
