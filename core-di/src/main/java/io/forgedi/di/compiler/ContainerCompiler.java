package io.forgedi.di.compiler;

import io.forgedi.di.CompiledContainer;
import io.forgedi.di.definition.ClassDefinition;
import io.forgedi.di.definition.Definition;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.discovery.KnownClassesDiscovery;
import io.forgedi.di.error.CompilationException;
import io.forgedi.di.introspect.TypeIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.singletonList;

/**
 * Compiles definitions into a container class through an {@link ArtifactCache}.
 * <p>
 * Explicit entries must all be compilable, except factories which are left to the interpreted
 * resolution: the first failure aborts the build. Entries discovered from known classes are
 * compiled when possible and silently left to autowiring otherwise.
 */
public final class ContainerCompiler {
	private static final Logger logger = LoggerFactory.getLogger(ContainerCompiler.class);

	private final ArtifactCache artifactCache;
	private final CompilabilityAnalyzer analyzer;
	private final KnownClassesDiscovery discovery;
	private final CodeGenerator generator = new CodeGenerator();

	public ContainerCompiler(ArtifactCache artifactCache, TypeIntrospector introspector) {
		this.artifactCache = artifactCache;
		this.analyzer = new CompilabilityAnalyzer(introspector);
		this.discovery = new KnownClassesDiscovery(introspector);
	}

	public Class<? extends CompiledContainer> compile(ArtifactIdentity identity, DefinitionSource definitions,
			Iterable<String> knownClasses) {
		artifactCache.obtainArtifact(identity, () -> generator.assemble(analyzeAll(definitions, knownClasses), identity));
		return artifactCache.loadArtifact(identity);
	}

	/**
	 * Returns plans of compilable entries, explicit entries first
	 *
	 * @throws CompilationException for the first explicit entry which cannot be compiled
	 */
	public Map<String, CompilationPlan> analyzeAll(DefinitionSource definitions, Iterable<String> knownClasses) {
		Map<String, CompilationPlan> plans = new LinkedHashMap<>();
		for (Map.Entry<String, Definition> entry : definitions.getDefinitions().entrySet()) {
			CompilationPlan plan = analyzer.analyze(entry.getValue(), singletonList(entry.getKey()));
			if (plan != null) {
				plans.put(entry.getKey(), plan);
			} else {
				logger.debug("Entry '{}' is left to interpreted resolution", entry.getKey());
			}
		}
		for (Map.Entry<String, ClassDefinition> entry : discovery.discover(definitions, knownClasses).entrySet()) {
			try {
				CompilationPlan plan = analyzer.analyze(entry.getValue(), singletonList(entry.getKey()));
				if (plan != null) {
					plans.put(entry.getKey(), plan);
				}
			} catch (CompilationException e) {
				logger.debug("Known class {} is not compiled: {}", entry.getKey(), e.getMessage());
			}
		}
		logger.debug("{} entries are compiled", plans.size());
		return plans;
	}
}
