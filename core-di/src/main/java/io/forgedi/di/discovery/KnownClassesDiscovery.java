package io.forgedi.di.discovery;

import io.forgedi.di.definition.ClassDefinition;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.introspect.TypeIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;

public final class KnownClassesDiscovery {
	private static final Logger logger = LoggerFactory.getLogger(KnownClassesDiscovery.class);

	private final TypeIntrospector introspector;

	public KnownClassesDiscovery(TypeIntrospector introspector) {
		this.introspector = introspector;
	}

	/**
	 * Returns an autowired definition for each known class which has no explicit entry and can be autowired,
	 * in the order the names are enumerated
	 */
	public Map<String, ClassDefinition> discover(DefinitionSource explicit, Iterable<String> knownClasses) {
		Map<String, ClassDefinition> discovered = new LinkedHashMap<>();
		for (String className : knownClasses) {
			if (explicit.getDefinitions().containsKey(className) || discovered.containsKey(className)) {
				continue;
			}
			Class<?> type = introspector.findClass(className);
			if (type == null) {
				logger.debug("Known class {} is skipped: not found", className);
				continue;
			}
			if (type.isInterface() || type.isPrimitive() || type.isArray() || type.isEnum() ||
					Modifier.isAbstract(type.getModifiers())) {
				logger.debug("Known class {} is skipped: not instantiable", className);
				continue;
			}
			if (type.isAnonymousClass() || type.isLocalClass() || type.getCanonicalName() == null) {
				logger.debug("Known class {} is skipped: anonymous", className);
				continue;
			}
			discovered.put(className, ClassDefinition.autowire(className));
		}
		return discovered;
	}
}
