package io.forgedi.di;

import io.forgedi.di.definition.Definition;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.error.DependencyException;
import io.forgedi.di.error.NotFoundException;
import io.forgedi.di.introspect.ReflectionTypeIntrospector;
import io.forgedi.di.introspect.TypeIntrospector;
import io.forgedi.di.resolver.DefinitionResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves entries on demand from a {@link DefinitionSource}.
 * <p>
 * Every resolved entry is kept and returned on later calls, so an entry is constructed at most
 * once per container. Resolution is synchronized on the container.
 */
public class Container {
	private static final Object NO_VALUE = new Object();

	private final DefinitionSource definitionSource;
	private final DefinitionResolver resolver;

	private final Map<String, Object> resolvedEntries = new HashMap<>();
	private final Map<String, Definition> definitionOverrides = new HashMap<>();
	private final Set<String> entriesBeingResolved = new HashSet<>();

	public Container(@NotNull DefinitionSource definitionSource) {
		this(definitionSource, new ReflectionTypeIntrospector());
	}

	public Container(@NotNull DefinitionSource definitionSource, @NotNull TypeIntrospector introspector) {
		this.definitionSource = definitionSource;
		this.resolver = new DefinitionResolver(this, introspector);
		resolvedEntries.put(Container.class.getName(), this);
	}

	@Nullable
	public synchronized Object get(@NotNull String name) {
		Object value = resolvedEntries.getOrDefault(name, NO_VALUE);
		if (value != NO_VALUE) {
			return value;
		}
		if (!entriesBeingResolved.add(name)) {
			throw new DependencyException("Circular dependency detected while trying to resolve entry '" + name + "'");
		}
		try {
			value = resolveEntry(name);
		} finally {
			entriesBeingResolved.remove(name);
		}
		resolvedEntries.put(name, value);
		return value;
	}

	@SuppressWarnings("unchecked")
	public <T> T get(@NotNull Class<T> type) {
		return (T) get(type.getName());
	}

	public synchronized boolean has(@NotNull String name) {
		if (resolvedEntries.containsKey(name)) {
			return true;
		}
		Definition definition = getDefinition(name);
		return definition != null && resolver.isResolvable(definition);
	}

	public boolean has(@NotNull Class<?> type) {
		return has(type.getName());
	}

	/**
	 * Registers a definition, which replaces any other definition for this name, or a raw value,
	 * which is returned as is
	 */
	public synchronized void set(@NotNull String name, @Nullable Object value) {
		if (value instanceof Definition) {
			definitionOverrides.put(name, (Definition) value);
			resolvedEntries.remove(name);
		} else {
			resolvedEntries.put(name, value);
		}
	}

	public DefinitionSource getDefinitionSource() {
		return definitionSource;
	}

	/**
	 * Produces the value of an entry which is neither cached nor being resolved
	 */
	@Nullable
	protected Object resolveEntry(String name) {
		Definition definition = getDefinition(name);
		if (definition == null) {
			throw new NotFoundException(name);
		}
		return resolver.resolve(name, definition);
	}

	@Nullable
	protected Definition getDefinition(String name) {
		Definition definition = definitionOverrides.get(name);
		return definition != null ? definition : definitionSource.getDefinition(name);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{definitions=" + definitionSource + '}';
	}
}
