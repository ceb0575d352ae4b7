package io.forgedi.di.fixture;

import io.forgedi.di.CompiledContainer;
import io.forgedi.di.Inject;
import io.forgedi.di.definition.DefinitionSource;
import io.forgedi.di.introspect.ReflectionTypeIntrospector;
import io.forgedi.di.introspect.TypeIntrospector;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classes resolved by container tests, public so that generated code can reach them
 */
public final class Fixtures {
	private Fixtures() {
	}

	public enum Fuel {
		PETROL, DIESEL
	}

	public static class Engine {
		private final String name;

		public Engine(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}
	}

	public static class Car {
		private final Engine engine;
		private final int doors;
		public Fuel fuel;
		private String color;
		private String plate;
		private final List<String> log = new ArrayList<>();

		@Inject
		public Car(Engine engine, int doors) {
			this.engine = engine;
			this.doors = doors;
		}

		public Car() {
			this(null, 0);
		}

		public void setPaint(String color) {
			log.add("paint");
			this.color = color;
		}

		public void register(String plate, String owner) {
			log.add("register");
			this.plate = plate + "/" + owner;
		}

		public Engine getEngine() {
			return engine;
		}

		public int getDoors() {
			return doors;
		}

		public String getColor() {
			return color;
		}

		public String getPlate() {
			return plate;
		}

		public List<String> getLog() {
			return log;
		}
	}

	public static class Garage {
		private Car car;
		private String secret;

		public Car getCar() {
			return car;
		}

		public String getSecret() {
			return secret;
		}
	}

	public static class Dependency {
	}

	public static class AutowiredClass {
		private final Dependency dependency;
		@Inject
		private Dependency injectedField;
		private Dependency injectedByMethod;

		public AutowiredClass(Dependency dependency) {
			this.dependency = dependency;
		}

		@Inject
		public void init(Dependency dependency) {
			this.injectedByMethod = dependency;
		}

		public Dependency getDependency() {
			return dependency;
		}

		public Dependency getInjectedField() {
			return injectedField;
		}

		public Dependency getInjectedByMethod() {
			return injectedByMethod;
		}
	}

	public static class Named {
		private final String value;

		public Named(@Inject("greeting") String value) {
			this.value = value;
		}

		public String getValue() {
			return value;
		}
	}

	public static class CycleA {
		public CycleA(CycleB b) {
		}
	}

	public static class CycleB {
		public CycleB(CycleA a) {
		}
	}

	public interface Service {
	}

	public abstract static class AbstractService implements Service {
	}

	static class Hidden {
		public Hidden() {
		}
	}

	/**
	 * Injects one entry into every constructor and method parameter
	 */
	public static final class RedirectingIntrospector implements TypeIntrospector {
		private final TypeIntrospector reflection = new ReflectionTypeIntrospector();
		private final String target;

		public RedirectingIntrospector(String target) {
			this.target = target;
		}

		@Override
		public Class<?> findClass(String className) {
			return reflection.findClass(className);
		}

		@Override
		public Constructor<?> findConstructor(Class<?> type, int explicitArguments) {
			return reflection.findConstructor(type, explicitArguments);
		}

		@Override
		public List<String> getParameterDependencies(Executable executable) {
			return Collections.nCopies(executable.getParameterCount(), target);
		}

		@Override
		public List<Field> getInjectedFields(Class<?> type) {
			return reflection.getInjectedFields(type);
		}

		@Override
		public List<Method> getInjectedMethods(Class<?> type) {
			return reflection.getInjectedMethods(type);
		}

		@Override
		public String getFieldDependency(Field field) {
			return reflection.getFieldDependency(field);
		}

		@Override
		public Field findField(Class<?> type, String name) {
			return reflection.findField(type, name);
		}

		@Override
		public Method findSetter(Class<?> type, String property) {
			return reflection.findSetter(type, property);
		}

		@Override
		public Method findMethod(Class<?> type, String name, int parameterCount) {
			return reflection.findMethod(type, name, parameterCount);
		}
	}

	public abstract static class CustomParentContainer extends CompiledContainer {
		protected CustomParentContainer(DefinitionSource definitionSource, TypeIntrospector introspector) {
			super(definitionSource, introspector);
		}

		public String describe() {
			return getCompiledEntries().length + " compiled entries";
		}
	}
}
