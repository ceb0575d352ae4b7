package io.forgedi.di.compiler;

import io.forgedi.di.compiler.CompilationPlan.*;
import io.forgedi.di.definition.ClassDefinition;
import io.forgedi.di.definition.Definition;
import io.forgedi.di.error.CompilationException;
import io.forgedi.di.fixture.Fixtures;
import io.forgedi.di.fixture.Fixtures.*;
import io.forgedi.di.introspect.ReflectionTypeIntrospector;
import org.junit.Test;

import java.util.List;

import static io.forgedi.di.definition.Definitions.*;
import static io.forgedi.di.error.CompilationException.Kind.*;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.*;

public final class CompilabilityAnalyzerTest {
	private final CompilabilityAnalyzer analyzer = new CompilabilityAnalyzer(new ReflectionTypeIntrospector());

	@Test
	public void scalarsAreConstants() {
		for (Object scalar : asList("text", 1, 2L, 3.0f, 4.0d, (byte) 5, (short) 6, 'c', true, Fuel.PETROL)) {
			CompilationPlan plan = analyze(value(scalar));
			assertThat(plan, instanceOf(Constant.class));
			assertEquals(scalar, ((Constant) plan).getValue());
		}
		assertNull(((Constant) analyze(value(null))).getValue());
	}

	@Test
	public void aliasesAreReferences() {
		CompilationPlan plan = analyze(get("other"));

		assertEquals("other", ((Reference) plan).getEntryName());
	}

	@Test
	public void factoriesAreNotCompiled() {
		assertNull(analyze(factory(c -> "value")));
		assertNull(analyze(normalize(asList("a", factory(c -> "value")))));
		assertNull(analyze(create(Engine.class).withConstructor(factory(c -> "V8"))));
	}

	@Test
	public void errorsTakePrecedenceOverFactories() {
		try {
			analyze(normalize(asList(factory(c -> "value"), new Object())));
			fail();
		} catch (CompilationException e) {
			assertEquals(OBJECT_NOT_COMPILABLE, e.getRootKind());
			assertEquals(asList("entry", 1), e.getPath());
		}
	}

	@Test
	public void classConstruction() {
		ClassDefinition definition = create(Car.class)
				.withConstructor(get("engine"), 4)
				.withProperty("fuel", Fuel.DIESEL)
				.withProperty("paint", "green")
				.withMethod("register", "plate", "owner");

		Construction plan = (Construction) analyze(definition);

		assertEquals(2, plan.getConstructor().getParameterCount());
		assertThat(plan.getArguments().get(0), instanceOf(Reference.class));
		assertEquals(3, plan.getInjections().size());
		FieldAssignment fuel = (FieldAssignment) plan.getInjections().get(0);
		assertTrue(fuel.isDirect());
		assertEquals("setPaint", ((Invocation) plan.getInjections().get(1)).getMethod().getName());
		assertEquals("register", ((Invocation) plan.getInjections().get(2)).getMethod().getName());
	}

	@Test
	public void privateFieldsAreAssignedIndirectly() {
		Construction plan = (Construction) analyze(create(Garage.class).withProperty("secret", "value"));

		assertFalse(((FieldAssignment) plan.getInjections().get(0)).isDirect());
	}

	@Test
	public void autowiredDependenciesAreReferences() {
		Construction plan = (Construction) analyze(autowire(AutowiredClass.class));

		assertEquals(Dependency.class.getName(), ((Reference) plan.getArguments().get(0)).getEntryName());
		assertEquals(2, plan.getInjections().size());
	}

	@Test
	public void missingClass() {
		try {
			analyze(create("io.forgedi.NoSuchClass"));
			fail();
		} catch (CompilationException e) {
			assertEquals(CLASS_NOT_FOUND, e.getKind());
			assertEquals("Entry \"entry\" cannot be compiled: the class doesn't exist", e.getMessage());
		}
	}

	@Test
	public void interfacesAreNotInstantiable() {
		try {
			analyze(create(Service.class));
			fail();
		} catch (CompilationException e) {
			assertEquals(CLASS_NOT_INSTANTIABLE, e.getKind());
		}
	}

	@Test
	public void unknownPropertyIsNotInstantiable() {
		try {
			analyze(create(Dependency.class).withProperty("nope", 1));
			fail();
		} catch (CompilationException e) {
			assertEquals(CLASS_NOT_INSTANTIABLE, e.getKind());
			assertEquals(singletonList("entry"), e.getPath());
		}
	}

	@Test
	public void nonPublicClassIsNotAccessible() {
		try {
			analyze(create(Fixtures.class.getName() + "$Hidden"));
			fail();
		} catch (CompilationException e) {
			assertEquals(MEMBER_NOT_ACCESSIBLE, e.getKind());
		}
	}

	@Test
	public void nestedFailureInConstructorArgument() {
		try {
			analyze(create(Car.class).withConstructor(create(Engine.class).withConstructor(new Object()), 4));
			fail();
		} catch (CompilationException e) {
			assertEquals(NESTED_COMPILATION_FAILURE, e.getKind());
			assertEquals(OBJECT_NOT_COMPILABLE, e.getRootKind());
			assertEquals(asList("entry", "constructor(0)", "constructor(0)"), e.getPath());
			assertEquals("Error while compiling entry. Error while compiling <nested definition>. " +
					"An object was found but objects cannot be compiled", e.getMessage());
		}
	}

	@Test
	public void nestedValuesCarryTheirIndex() {
		try {
			analyze(value(asList("a", asList("b", new StringBuilder()))));
			fail();
		} catch (CompilationException e) {
			assertEquals(asList("entry", 1, 1), e.getPath());
			assertEquals("entry → index 1 → index 1", e.getDisplayPath());
		}
	}

	@Test
	public void environmentVariablesAndStrings() {
		EnvironmentVariable env = (EnvironmentVariable) analyze(env("HOME", "/tmp"));
		assertEquals("HOME", env.getVariableName());
		assertTrue(env.isOptional());
		assertEquals("/tmp", ((Constant) env.getDefaultValue()).getValue());

		Interpolation interpolation = (Interpolation) analyze(string("{a}-{b}"));
		assertEquals("entry", interpolation.getEntryName());
		assertEquals("{a}-{b}", interpolation.getExpression());
	}

	@Test
	public void analysisIsRepeatable() {
		List<Object> path = singletonList("entry");
		Definition definition = create(Car.class).withConstructor(get("engine"), 4);

		Construction first = (Construction) analyzer.analyze(definition, path);
		Construction second = (Construction) analyzer.analyze(definition, path);

		assertEquals(first.getConstructor(), second.getConstructor());
		assertEquals(first.getArguments().size(), second.getArguments().size());
	}

	private CompilationPlan analyze(Definition definition) {
		return analyzer.analyze(definition, singletonList("entry"));
	}
}
