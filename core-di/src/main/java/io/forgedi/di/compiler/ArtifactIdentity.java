package io.forgedi.di.compiler;

import io.forgedi.di.CompiledContainer;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.introspect.TypeIntrospector;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.file.Path;

import static io.forgedi.common.Preconditions.checkArgument;
import static io.forgedi.common.Preconditions.checkNotNull;

/**
 * Names a generated container: the directory it is persisted to, its class name and the class it extends.
 * The class name is validated by {@link ArtifactCache} before anything is generated.
 */
public final class ArtifactIdentity {
	public static final String ARTIFACT_EXTENSION = ".class";

	private final Path directory;
	private final String className;
	private final Class<? extends CompiledContainer> parentType;

	private ArtifactIdentity(Path directory, String className, Class<? extends CompiledContainer> parentType) {
		this.directory = directory;
		this.className = className;
		this.parentType = parentType;
	}

	public static ArtifactIdentity of(Path directory, String className) {
		return of(directory, className, CompiledContainer.class);
	}

	public static ArtifactIdentity of(Path directory, String className, Class<? extends CompiledContainer> parentType) {
		checkNotNull(directory, "Target directory is not set");
		checkNotNull(className, "Class name is not set");
		checkArgument(Modifier.isPublic(parentType.getModifiers()) && !Modifier.isFinal(parentType.getModifiers()),
				"Parent type %s must be public and not final", parentType.getName());
		checkArgument(hasContainerConstructor(parentType),
				"Parent type %s must declare a public or protected constructor taking a DefinitionSource and a TypeIntrospector", parentType.getName());
		return new ArtifactIdentity(directory, className, parentType);
	}

	private static boolean hasContainerConstructor(Class<?> parentType) {
		try {
			Constructor<?> constructor = parentType.getDeclaredConstructor(DefinitionSource.class, TypeIntrospector.class);
			int modifiers = constructor.getModifiers();
			return Modifier.isPublic(modifiers) || Modifier.isProtected(modifiers);
		} catch (NoSuchMethodException e) {
			return false;
		}
	}

	public Path getDirectory() {
		return directory;
	}

	public String getClassName() {
		return className;
	}

	public Class<? extends CompiledContainer> getParentType() {
		return parentType;
	}

	public Path getArtifactPath() {
		return directory.resolve(className + ARTIFACT_EXTENSION);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ArtifactIdentity that = (ArtifactIdentity) o;
		return directory.equals(that.directory) && className.equals(that.className) && parentType.equals(that.parentType);
	}

	@Override
	public int hashCode() {
		int result = directory.hashCode();
		result = 31 * result + className.hashCode();
		result = 31 * result + parentType.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "ArtifactIdentity{" + getArtifactPath() + " extends " + parentType.getName() + '}';
	}
}
