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

import org.jetbrains.annotations.NotNull;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.Method;

import java.lang.reflect.Member;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

import static io.forgedi.common.Preconditions.checkArgument;
import static io.forgedi.common.Preconditions.checkNotNull;
import static java.lang.String.format;
import static org.objectweb.asm.Type.getType;

@SuppressWarnings("WeakerAccess")
public final class Utils {
	private static final Map<String, Type> WRAPPER_TO_PRIMITIVE = new HashMap<>();

	private static final Type BOOLEAN_TYPE = getType(Boolean.class);
	private static final Type CHARACTER_TYPE = getType(Character.class);
	private static final Type BYTE_TYPE = getType(Byte.class);
	private static final Type SHORT_TYPE = getType(Short.class);
	private static final Type INT_TYPE = getType(Integer.class);
	private static final Type FLOAT_TYPE = getType(Float.class);
	private static final Type LONG_TYPE = getType(Long.class);
	private static final Type DOUBLE_TYPE = getType(Double.class);

	static {
		WRAPPER_TO_PRIMITIVE.put(Boolean.class.getName(), Type.BOOLEAN_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Character.class.getName(), Type.CHAR_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Byte.class.getName(), Type.BYTE_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Short.class.getName(), Type.SHORT_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Integer.class.getName(), Type.INT_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Float.class.getName(), Type.FLOAT_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Long.class.getName(), Type.LONG_TYPE);
		WRAPPER_TO_PRIMITIVE.put(Double.class.getName(), Type.DOUBLE_TYPE);
	}

	private static final Method BOOLEAN_VALUE = Method.getMethod("boolean booleanValue()");
	private static final Method CHAR_VALUE = Method.getMethod("char charValue()");
	private static final Method INT_VALUE = Method.getMethod("int intValue()");
	private static final Method FLOAT_VALUE = Method.getMethod("float floatValue()");
	private static final Method LONG_VALUE = Method.getMethod("long longValue()");
	private static final Method DOUBLE_VALUE = Method.getMethod("double doubleValue()");
	private static final Method SHORT_VALUE = Method.getMethod("short shortValue()");
	private static final Method BYTE_VALUE = Method.getMethod("byte byteValue()");

	private Utils() {
	}

	public static boolean isPrimitiveType(Type type) {
		int sort = type.getSort();
		return sort == Type.BOOLEAN ||
				sort == Type.CHAR ||
				sort == Type.BYTE ||
				sort == Type.SHORT ||
				sort == Type.INT ||
				sort == Type.FLOAT ||
				sort == Type.LONG ||
				sort == Type.DOUBLE;
	}

	public static boolean isWrapperType(Type type) {
		return type.getSort() == Type.OBJECT &&
				WRAPPER_TO_PRIMITIVE.containsKey(type.getClassName());
	}

	public static Method primitiveValueMethod(Type type) {
		switch (type.getSort()) {
			case Type.BOOLEAN:
				return BOOLEAN_VALUE;
			case Type.CHAR:
				return CHAR_VALUE;
			case Type.BYTE:
				return BYTE_VALUE;
			case Type.SHORT:
				return SHORT_VALUE;
			case Type.INT:
				return INT_VALUE;
			case Type.FLOAT:
				return FLOAT_VALUE;
			case Type.LONG:
				return LONG_VALUE;
			case Type.DOUBLE:
				return DOUBLE_VALUE;
			default:
				throw new IllegalArgumentException(format("No primitive value method for %s ", type.getClassName()));
		}
	}

	public static Type wrap(Type type) {
		switch (type.getSort()) {
			case Type.BOOLEAN:
				return BOOLEAN_TYPE;
			case Type.CHAR:
				return CHARACTER_TYPE;
			case Type.BYTE:
				return BYTE_TYPE;
			case Type.SHORT:
				return SHORT_TYPE;
			case Type.INT:
				return INT_TYPE;
			case Type.FLOAT:
				return FLOAT_TYPE;
			case Type.LONG:
				return LONG_TYPE;
			case Type.DOUBLE:
				return DOUBLE_TYPE;
			default:
				throw new IllegalArgumentException(format("%s is not primitive", type.getClassName()));
		}
	}

	public static Type unwrap(@NotNull Type type) {
		checkArgument(type.getSort() == Type.OBJECT, "Cannot unwrap type that is not an object reference");
		return checkNotNull(WRAPPER_TO_PRIMITIVE.get(type.getClassName()));
	}

	/**
	 * Tells whether bytecode defined by an unrelated class loader may link against the member:
	 * the member and every class enclosing its declaring class must be public
	 */
	public static boolean isAccessible(Member member) {
		return Modifier.isPublic(member.getModifiers()) && isAccessible(member.getDeclaringClass());
	}

	public static boolean isAccessible(Class<?> type) {
		for (Class<?> cls = type; cls != null; cls = cls.getEnclosingClass()) {
			if (!Modifier.isPublic(cls.getModifiers())) {
				return false;
			}
		}
		return true;
	}

	public static String exceptionInGeneratedClass(Context ctx) {
		return format("Thrown in generated class %s in method %s",
				ctx.getSelfType().getClassName(),
				ctx.getMethod()
		);
	}

	public static boolean isValidCast(Type from, Type to) {
		return from.getSort() != to.getSort()
				&&
				!(from.getSort() < Type.BOOLEAN
						|| from.getSort() > Type.DOUBLE
						|| to.getSort() < Type.BOOLEAN
						|| to.getSort() > Type.DOUBLE);
	}
}
