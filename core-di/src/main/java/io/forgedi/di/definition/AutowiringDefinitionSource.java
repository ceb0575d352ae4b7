package io.forgedi.di.definition;

import io.forgedi.di.introspect.TypeIntrospector;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * Falls back to an autowired {@link ClassDefinition} for any name of a concrete class
 * which has no explicit definition
 */
public final class AutowiringDefinitionSource implements DefinitionSource {
	private final DefinitionSource explicit;
	private final TypeIntrospector introspector;

	public AutowiringDefinitionSource(DefinitionSource explicit, TypeIntrospector introspector) {
		this.explicit = explicit;
		this.introspector = introspector;
	}

	@Override
	@Nullable
	public Definition getDefinition(String name) {
		Definition definition = explicit.getDefinition(name);
		if (definition != null) {
			return definition;
		}
		Class<?> type = introspector.findClass(name);
		if (type == null || type.isInterface() || type.isPrimitive() || type.isArray() ||
				Modifier.isAbstract(type.getModifiers())) {
			return null;
		}
		return ClassDefinition.autowire(name);
	}

	@Override
	public Map<String, Definition> getDefinitions() {
		return explicit.getDefinitions();
	}
}
