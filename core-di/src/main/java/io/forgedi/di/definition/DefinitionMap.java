package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

public final class DefinitionMap implements DefinitionSource {
	private final Map<String, Definition> definitions;

	private DefinitionMap(Map<String, Definition> definitions) {
		this.definitions = unmodifiableMap(definitions);
	}

	public static DefinitionMap of(Map<String, ?> values) {
		Map<String, Definition> definitions = new LinkedHashMap<>();
		values.forEach((name, value) -> definitions.put(name, Definitions.normalize(value)));
		return new DefinitionMap(definitions);
	}

	@Override
	@Nullable
	public Definition getDefinition(String name) {
		return definitions.get(name);
	}

	@Override
	public Map<String, Definition> getDefinitions() {
		return definitions;
	}

	@Override
	public String toString() {
		return "DefinitionMap" + definitions.keySet();
	}
}
