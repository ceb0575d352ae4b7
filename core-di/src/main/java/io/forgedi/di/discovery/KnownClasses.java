package io.forgedi.di.discovery;

import io.forgedi.di.error.DIException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.asList;
import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toList;

/**
 * Names of classes which are compiled as autowired entries when they have no explicit definition.
 * Names are only enumerated when the container is compiled.
 */
public final class KnownClasses implements Iterable<String> {
	private final Supplier<Iterator<String>> names;

	private KnownClasses(Supplier<Iterator<String>> names) {
		this.names = names;
	}

	public static KnownClasses of(String... classNames) {
		List<String> names = asList(classNames);
		return new KnownClasses(names::iterator);
	}

	public static KnownClasses fromIterable(Iterable<String> classNames) {
		return new KnownClasses(classNames::iterator);
	}

	public static KnownClasses fromClasses(Class<?>... classes) {
		List<String> names = stream(classes).map(Class::getName).collect(toList());
		return new KnownClasses(names::iterator);
	}

	/**
	 * Reads class names from an index file on every enumeration: one name per line,
	 * blank lines and lines starting with {@code #} are ignored
	 */
	public static KnownClasses fromIndex(Path indexFile) {
		return new KnownClasses(() -> readIndex(indexFile).iterator());
	}

	private static List<String> readIndex(Path indexFile) {
		try {
			return Files.readAllLines(indexFile, UTF_8).stream()
					.map(String::trim)
					.filter(line -> !line.isEmpty() && !line.startsWith("#"))
					.collect(toList());
		} catch (IOException e) {
			throw new DIException("Could not read known classes from " + indexFile, e);
		}
	}

	@Override
	public Iterator<String> iterator() {
		return names.get();
	}
}
