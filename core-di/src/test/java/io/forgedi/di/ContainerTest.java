package io.forgedi.di;

import io.forgedi.common.Initializer;
import io.forgedi.di.error.DependencyException;
import io.forgedi.di.error.NotFoundException;
import io.forgedi.di.fixture.Fixtures.*;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.forgedi.di.definition.Definitions.*;
import static java.util.Arrays.asList;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.*;

public final class ContainerTest {
	private static final String UNDEFINED_VARIABLE = "FORGEDI_TEST_SURELY_UNDEFINED_VARIABLE";

	@Test
	public void valuesAndAliases() {
		Container container = ContainerBuilder.create()
				.addDefinition("foo", "bar")
				.addDefinition("answer", 42)
				.addDefinition("alias", get("foo"))
				.build();

		assertEquals("bar", container.get("foo"));
		assertEquals(42, container.get("answer"));
		assertEquals("bar", container.get("alias"));
		assertTrue(container.has("alias"));
		assertFalse(container.has("nothing"));
	}

	@Test
	public void containerIsAnEntry() {
		Container container = ContainerBuilder.create().build();

		assertSame(container, container.get(Container.class));
	}

	@Test
	public void classDefinition() {
		Container container = ContainerBuilder.create()
				.addDefinition("engine", create(Engine.class).withConstructor("V8"))
				.addDefinition("car", create(Car.class)
						.withConstructor(get("engine"), 5)
						.withProperty("fuel", Fuel.DIESEL)
						.withProperty("paint", "red")
						.withMethod("register", "AB-123", get("owner")))
				.addDefinition("owner", "John")
				.build();

		Car car = (Car) container.get("car");
		assertEquals("V8", car.getEngine().getName());
		assertEquals(5, car.getDoors());
		assertEquals(Fuel.DIESEL, car.fuel);
		assertEquals("red", car.getColor());
		assertEquals("AB-123/John", car.getPlate());
		assertEquals(asList("paint", "register"), car.getLog());
		assertSame(car.getEngine(), container.get("engine"));
	}

	@Test
	public void privateFieldIsInjected() {
		Container container = ContainerBuilder.create()
				.addDefinition("garage", create(Garage.class).withProperty("secret", "s3cr3t"))
				.build();

		assertEquals("s3cr3t", ((Garage) container.get("garage")).getSecret());
	}

	@Test
	public void autowiring() {
		Container container = ContainerBuilder.create().build();

		AutowiredClass instance = container.get(AutowiredClass.class);
		Dependency dependency = container.get(Dependency.class);
		assertSame(dependency, instance.getDependency());
		assertSame(dependency, instance.getInjectedField());
		assertSame(dependency, instance.getInjectedByMethod());
		assertSame(instance, container.get(AutowiredClass.class));
	}

	@Test
	public void namedParameter() {
		Container container = ContainerBuilder.create()
				.addDefinition("greeting", "hello")
				.build();

		assertEquals("hello", container.get(Named.class).getValue());
	}

	@Test
	public void autowiringCanBeDisabled() {
		Container container = ContainerBuilder.create()
				.useAutowiring(false)
				.build();

		assertFalse(container.has(Dependency.class));
		try {
			container.get(Dependency.class);
			fail();
		} catch (NotFoundException e) {
			assertEquals("No entry or class found for '" + Dependency.class.getName() + "'", e.getMessage());
		}
	}

	@Test
	public void abstractClassesAreNotAutowired() {
		Container container = ContainerBuilder.create().build();

		assertFalse(container.has(Service.class));
		assertFalse(container.has(AbstractService.class));
	}

	@Test
	public void factoryIsCalledOnce() {
		AtomicInteger calls = new AtomicInteger();
		Container container = ContainerBuilder.create()
				.addDefinition("counter", factory(c -> calls.incrementAndGet()))
				.build();

		assertEquals(1, container.get("counter"));
		assertEquals(1, container.get("counter"));
		assertEquals(1, calls.get());
	}

	@Test
	public void factoryFailureIsWrapped() {
		Container container = ContainerBuilder.create()
				.addDefinition("broken", factory(c -> {
					throw new IllegalStateException("boom");
				}))
				.build();

		try {
			container.get("broken");
			fail();
		} catch (DependencyException e) {
			assertThat(e.getMessage(), containsString("'broken'"));
			assertTrue(e.getCause() instanceof IllegalStateException);
		}
	}

	@Test
	public void circularDependency() {
		Container container = ContainerBuilder.create().build();

		try {
			container.get(CycleA.class);
			fail();
		} catch (DependencyException e) {
			assertThat(e.getMessage(), containsString("Circular dependency detected while trying to resolve entry"));
		}
	}

	@Test
	public void arrays() {
		Map<String, Object> nested = new LinkedHashMap<>();
		nested.put("first", get("foo"));
		nested.put("second", asList(1, 2));
		Container container = ContainerBuilder.create()
				.addDefinition("foo", "bar")
				.addDefinition("map", nested)
				.build();

		Map<?, ?> map = (Map<?, ?>) container.get("map");
		assertEquals("bar", map.get("first"));
		assertEquals(asList(1, 2), map.get("second"));
	}

	@Test
	public void environmentVariables() {
		Container container = ContainerBuilder.create()
				.addDefinition("withDefault", env(UNDEFINED_VARIABLE, "fallback"))
				.addDefinition("withAliasDefault", env(UNDEFINED_VARIABLE, get("foo")))
				.addDefinition("optional", env(UNDEFINED_VARIABLE, null))
				.addDefinition("required", env(UNDEFINED_VARIABLE))
				.addDefinition("foo", "bar")
				.build();

		assertEquals("fallback", container.get("withDefault"));
		assertEquals("bar", container.get("withAliasDefault"));
		assertNull(container.get("optional"));
		try {
			container.get("required");
			fail();
		} catch (DependencyException e) {
			assertThat(e.getMessage(), containsString(UNDEFINED_VARIABLE));
		}
	}

	@Test
	public void stringExpressions() {
		Container container = ContainerBuilder.create()
				.addDefinition("host", "localhost")
				.addDefinition("port", 8080)
				.addDefinition("url", string("http://{host}:{port}/"))
				.addDefinition("broken", string("{missing}"))
				.build();

		assertEquals("http://localhost:8080/", container.get("url"));
		try {
			container.get("broken");
			fail();
		} catch (DependencyException e) {
			assertThat(e.getMessage(), containsString("Error while parsing string expression for entry 'broken'"));
		}
	}

	@Test
	public void setOverridesEntries() {
		Container container = ContainerBuilder.create()
				.addDefinition("foo", "bar")
				.build();

		container.set("foo", "baz");
		container.set("list", value(asList("a", "b")));
		container.set("alias", get("foo"));

		assertEquals("baz", container.get("foo"));
		assertEquals(asList("a", "b"), container.get("list"));
		assertEquals("baz", container.get("alias"));
	}

	@Test
	public void laterDefinitionsReplaceEarlierOnes() {
		Map<String, Object> first = new HashMap<>();
		first.put("foo", "first");
		Map<String, Object> second = new HashMap<>();
		second.put("foo", "second");

		Container container = ContainerBuilder.create()
				.addDefinitions(first)
				.addDefinitions(second)
				.build();

		assertEquals("second", container.get("foo"));
	}

	@Test
	public void missingConstructorArgumentsAreReported() {
		Container container = ContainerBuilder.create()
				.addDefinition("engine", create(Engine.class))
				.build();

		assertFalse(container.has("engine"));
		try {
			container.get("engine");
			fail();
		} catch (DependencyException e) {
			assertThat(e.getMessage(), containsString("the class is not instantiable"));
		}
	}

	@Test
	public void initializers() {
		Initializer<ContainerBuilder> values = builder -> builder.addDefinition("foo", "bar");
		Container container = ContainerBuilder.create()
				.initialize(values.andThen(builder -> builder.addDefinition("baz", "qux")))
				.build();

		assertEquals("bar", container.get("foo"));
		assertEquals("qux", container.get("baz"));
	}
}
