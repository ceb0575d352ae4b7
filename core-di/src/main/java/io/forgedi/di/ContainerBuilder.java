package io.forgedi.di;

import io.forgedi.common.ApplicationSettings;
import io.forgedi.common.Initializable;
import io.forgedi.di.compiler.ArtifactCache;
import io.forgedi.di.compiler.ArtifactIdentity;
import io.forgedi.di.compiler.ContainerCompiler;
import io.forgedi.di.definition.AutowiringDefinitionSource;
import io.forgedi.di.definition.DefinitionMap;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.error.DIException;
import io.forgedi.di.introspect.ReflectionTypeIntrospector;
import io.forgedi.di.introspect.TypeIntrospector;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.forgedi.common.Preconditions.checkNotNull;
import static io.forgedi.common.Preconditions.checkState;

/**
 * Assembles definitions and builds either an interpreted {@link Container}
 * or, once compilation is enabled, a {@link CompiledContainer}.
 */
public final class ContainerBuilder implements Initializable<ContainerBuilder> {
	private static final Logger logger = LoggerFactory.getLogger(ContainerBuilder.class);

	public static final boolean USE_AUTOWIRING = ApplicationSettings.getBoolean(ContainerBuilder.class, "useAutowiring", true);

	private final Map<String, Object> definitions = new LinkedHashMap<>();
	private final List<Iterable<String>> knownClasses = new ArrayList<>();
	private boolean useAutowiring = USE_AUTOWIRING;
	private TypeIntrospector introspector = new ReflectionTypeIntrospector();

	@Nullable
	private Path compilationDirectory;
	@Nullable
	private String compiledClassName;
	private Class<? extends CompiledContainer> parentType = CompiledContainer.class;
	@Nullable
	private ArtifactCache artifactCache;

	private boolean built;

	// region builders
	private ContainerBuilder() {
	}

	public static ContainerBuilder create() {
		return new ContainerBuilder();
	}

	/**
	 * Adds definitions or raw values, replacing those already added under the same names
	 */
	public ContainerBuilder addDefinitions(Map<String, ?> definitions) {
		checkState(!built, "Definitions cannot be added once the container is built");
		this.definitions.putAll(definitions);
		return this;
	}

	public ContainerBuilder addDefinition(String name, @Nullable Object definition) {
		checkState(!built, "Definitions cannot be added once the container is built");
		definitions.put(checkNotNull(name), definition);
		return this;
	}

	public ContainerBuilder useAutowiring(boolean useAutowiring) {
		this.useAutowiring = useAutowiring;
		return this;
	}

	public ContainerBuilder withTypeIntrospector(TypeIntrospector introspector) {
		this.introspector = checkNotNull(introspector);
		return this;
	}

	public ContainerBuilder enableCompilation(Path directory, String className) {
		return enableCompilation(directory, className, CompiledContainer.class);
	}

	/**
	 * Makes {@link #build()} return a compiled container, generated into {@code directory} on the
	 * first build and loaded from there afterwards
	 */
	public ContainerBuilder enableCompilation(Path directory, String className, Class<? extends CompiledContainer> parentType) {
		this.compilationDirectory = checkNotNull(directory);
		this.compiledClassName = checkNotNull(className);
		this.parentType = checkNotNull(parentType);
		return this;
	}

	/**
	 * Compiles the given classes as autowired entries too, unless they have explicit definitions
	 */
	public ContainerBuilder compileAllClasses(Iterable<String> classNames) {
		knownClasses.add(checkNotNull(classNames));
		return this;
	}

	public ContainerBuilder withArtifactCache(ArtifactCache artifactCache) {
		this.artifactCache = checkNotNull(artifactCache);
		return this;
	}
	// endregion

	public boolean isCompilationEnabled() {
		return compilationDirectory != null;
	}

	public Container build() {
		built = true;
		DefinitionSource source = DefinitionMap.of(definitions);
		if (useAutowiring) {
			source = new AutowiringDefinitionSource(source, introspector);
		}
		if (compilationDirectory == null) {
			return new Container(source, introspector);
		}

		ArtifactIdentity identity = ArtifactIdentity.of(compilationDirectory, compiledClassName, parentType);
		if (artifactCache == null) {
			artifactCache = ArtifactCache.create();
		}
		Class<? extends CompiledContainer> containerClass = new ContainerCompiler(artifactCache, introspector)
				.compile(identity, source, this::iterateKnownClasses);
		logger.debug("Instantiating {}", containerClass.getName());
		try {
			return containerClass.getConstructor(DefinitionSource.class, TypeIntrospector.class).newInstance(source, introspector);
		} catch (InvocationTargetException e) {
			if (e.getCause() instanceof DIException) {
				throw (DIException) e.getCause();
			}
			throw new DIException("Could not instantiate compiled container " + containerClass.getName(), e.getCause());
		} catch (ReflectiveOperationException e) {
			throw new DIException("Could not instantiate compiled container " + containerClass.getName(), e);
		}
	}

	private Iterator<String> iterateKnownClasses() {
		List<String> names = new ArrayList<>();
		for (Iterable<String> classNames : knownClasses) {
			classNames.forEach(names::add);
		}
		return names.iterator();
	}
}
