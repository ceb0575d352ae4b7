package io.forgedi.di.definition;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * The definitions a container resolves its entries from
 */
public interface DefinitionSource {
	@Nullable
	Definition getDefinition(String name);

	/**
	 * Returns explicitly registered definitions in registration order
	 */
	Map<String, Definition> getDefinitions();
}
