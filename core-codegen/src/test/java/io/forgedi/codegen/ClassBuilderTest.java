/*
 * Copyright (C) 2015-2019 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.forgedi.codegen;

import org.junit.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static io.forgedi.codegen.Expressions.*;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public class ClassBuilderTest {

	public static abstract class Base {
		private final String prefix;

		public Base(String prefix) {
			this.prefix = prefix;
		}

		public String prefixed(String value) {
			return prefix + value;
		}

		public abstract Object produce();
	}

	public enum Color {
		RED, GREEN
	}

	public static class Pojo {
		public int count;
		public String label;
		private long total;

		public Pojo(int count) {
			this.count = count;
		}

		public void setTotal(long total) {
			this.total = total;
		}

		public long getTotal() {
			return total;
		}
	}

	public static String nothing() {
		return null;
	}

	private static Base build(Expression expression) throws Exception {
		Class<Base> cls = ClassBuilder.<Base>create(DefiningClassLoader.create(ClassBuilderTest.class.getClassLoader()), Base.class)
				.withClassName("io.forgedi.codegen.GeneratedBase")
				.withConstructor(singletonList(String.class))
				.withMethod("produce", Object.class, emptyList(), expression)
				.build();
		return cls.getConstructor(String.class).newInstance(">");
	}

	@Test
	public void constants() throws Exception {
		assertEquals("text", build(value("text")).produce());
		assertEquals(42, build(value(42)).produce());
		assertEquals(42L, build(value(42L)).produce());
		assertEquals(1.5d, build(value(1.5d)).produce());
		assertEquals('c', build(value('c')).produce());
		assertEquals(true, build(value(true)).produce());
		assertEquals(Color.GREEN, build(value(Color.GREEN)).produce());
		assertNull(build(nullRef(Object.class)).produce());
	}

	@Test
	public void stringsLongerThanConstantPoolEntry() throws Exception {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 70_000; i++) {
			sb.append(i % 3 == 0 ? '\u20ac' : (char) ('a' + i % 26));
		}
		String text = sb.toString();

		assertEquals(text, build(value(text)).produce());
		String exactChunk = text.substring(0, ExpressionConstant.MAX_STRING_CHUNK);
		assertEquals(exactChunk, build(value(exactChunk)).produce());
	}

	@Test
	public void constructorAndFieldsAndSetters() throws Exception {
		Field label = Pojo.class.getField("label");
		Method setTotal = Pojo.class.getMethod("setTotal", long.class);
		Expression expression = let(constructor(Pojo.class.getConstructor(int.class), cast(value(7), Object.class)),
				pojo -> sequence(
						setField(pojo, label, value("seven")),
						call(pojo, setTotal, cast(value(100L), Object.class)),
						pojo));

		Pojo pojo = (Pojo) build(expression).produce();
		assertEquals(7, pojo.count);
		assertEquals("seven", pojo.label);
		assertEquals(100L, pojo.getTotal());
	}

	@Test
	public void callsOnSelfAndStatics() throws Exception {
		Method prefixed = Base.class.getMethod("prefixed", String.class);
		assertEquals(">x", build(call(self(), prefixed, value("x"))).produce());

		Method asList = Arrays.class.getMethod("asList", Object[].class);
		Object list = build(callStatic(asList, arrayOf(Object.class, asList(value("a"), value(1))))).produce();
		assertEquals(asList("a", 1), list);
	}

	@Test
	public void callsGeneratedMethods() throws Exception {
		Base base = ClassBuilder.<Base>create(DefiningClassLoader.create(ClassBuilderTest.class.getClassLoader()), Base.class)
				.withClassName("io.forgedi.codegen.SelfCalling")
				.withConstructor(singletonList(String.class))
				.withMethod("part", String[].class, emptyList(), arrayOf(String.class, asList(value("a"), value("b"))))
				.withMethod("produce", Object.class, emptyList(), callSelf("part", String[].class))
				.build()
				.getConstructor(String.class).newInstance(">");

		assertArrayEquals(new String[]{"a", "b"}, (String[]) base.produce());
	}

	@Test
	public void ifNullFallsBack() throws Exception {
		Method nothing = ClassBuilderTest.class.getMethod("nothing");
		assertEquals("fallback", build(ifNull(callStatic(nothing), value("fallback"))).produce());
		assertEquals("present", build(ifNull(value("present"), value("fallback"))).produce());
	}

	@Test
	public void bytecodeIsStable() {
		ClassBuilder<Base> builder = ClassBuilder.<Base>create(DefiningClassLoader.create(), Base.class)
				.withClassName("io.forgedi.codegen.Stable")
				.withConstructor(singletonList(String.class))
				.withMethod("produce", Object.class, emptyList(), value("x"));
		assertArrayEquals(builder.toBytecode(), builder.toBytecode());
	}

	@Test
	public void sameNameCannotBeDefinedTwice() {
		DefiningClassLoader classLoader = DefiningClassLoader.create(ClassBuilderTest.class.getClassLoader());
		List<Class<?>> parameters = singletonList(String.class);
		ClassBuilder.<Base>create(classLoader, Base.class)
				.withClassName("io.forgedi.codegen.Twice")
				.withConstructor(parameters)
				.withMethod("produce", Object.class, emptyList(), value("x"))
				.build();
		try {
			ClassBuilder.<Base>create(classLoader, Base.class)
					.withClassName("io.forgedi.codegen.Twice")
					.withConstructor(parameters)
					.withMethod("produce", Object.class, emptyList(), value("y"))
					.build();
			fail();
		} catch (IllegalStateException e) {
			assertEquals("Class io.forgedi.codegen.Twice is already defined", e.getMessage());
		}
		assertEquals(1, classLoader.getDefinedClassesCount());
	}
}
