package io.forgedi.di.definition;

import java.util.*;

import static java.util.Collections.unmodifiableMap;

/**
 * An ordered collection of nested definitions, resolved either to a {@link List}
 * (elements keyed by their index) or to an insertion-ordered {@link Map} with string keys
 */
public final class ArrayDefinition implements Definition {
	private final Map<Object, Definition> elements;
	private final boolean list;

	private ArrayDefinition(Map<Object, Definition> elements, boolean list) {
		this.elements = unmodifiableMap(elements);
		this.list = list;
	}

	public static ArrayDefinition ofList(List<?> values) {
		Map<Object, Definition> elements = new LinkedHashMap<>();
		for (int i = 0; i < values.size(); i++) {
			elements.put(i, Definitions.normalize(values.get(i)));
		}
		return new ArrayDefinition(elements, true);
	}

	public static ArrayDefinition ofMap(Map<String, ?> values) {
		Map<Object, Definition> elements = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : values.entrySet()) {
			elements.put(entry.getKey(), Definitions.normalize(entry.getValue()));
		}
		return new ArrayDefinition(elements, false);
	}

	/**
	 * Returns elements keyed by {@code Integer} index for a list and by {@code String} for a map
	 */
	public Map<Object, Definition> getElements() {
		return elements;
	}

	public boolean isList() {
		return list;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ArrayDefinition that = (ArrayDefinition) o;
		return list == that.list && elements.equals(that.elements);
	}

	@Override
	public int hashCode() {
		return 31 * elements.hashCode() + (list ? 1 : 0);
	}

	@Override
	public String toString() {
		return (list ? "List" : "Map") + elements;
	}
}
