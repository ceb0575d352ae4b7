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

import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;

import static io.forgedi.common.Preconditions.checkNotNull;
import static java.lang.String.format;
import static org.objectweb.asm.Type.getType;

/**
 * Pushes a constant which can be embedded into the constant pool of a class.
 * Strings too long for a single constant pool entry are joined at runtime from several entries.
 */
final class ExpressionConstant implements Expression {
	// a char takes at most 3 bytes in modified UTF-8, a constant pool entry at most 65535 bytes
	static final int MAX_STRING_CHUNK = 65535 / 3;

	private static final Type STRING_BUILDER_TYPE = getType(StringBuilder.class);
	private static final Method STRING_BUILDER_INIT = new Method("<init>", Type.VOID_TYPE, new Type[]{Type.INT_TYPE});
	private static final Method STRING_BUILDER_APPEND = new Method("append", STRING_BUILDER_TYPE, new Type[]{getType(String.class)});
	private static final Method STRING_BUILDER_TO_STRING = new Method("toString", getType(String.class), new Type[0]);

	private final Object value;

	ExpressionConstant(Object value) {
		this.value = checkNotNull(value);
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		if (value instanceof String) {
			pushString(g, (String) value);
			return getType(String.class);
		} else if (value instanceof Boolean) {
			g.push((Boolean) value);
			return Type.BOOLEAN_TYPE;
		} else if (value instanceof Character) {
			g.push((Character) value);
			return Type.CHAR_TYPE;
		} else if (value instanceof Byte) {
			g.push((Byte) value);
			return Type.BYTE_TYPE;
		} else if (value instanceof Short) {
			g.push((Short) value);
			return Type.SHORT_TYPE;
		} else if (value instanceof Integer) {
			g.push((Integer) value);
			return Type.INT_TYPE;
		} else if (value instanceof Long) {
			g.push((Long) value);
			return Type.LONG_TYPE;
		} else if (value instanceof Float) {
			g.push((Float) value);
			return Type.FLOAT_TYPE;
		} else if (value instanceof Double) {
			g.push((Double) value);
			return Type.DOUBLE_TYPE;
		} else if (value instanceof Enum) {
			Type type = getType(((Enum<?>) value).getDeclaringClass());
			g.getStatic(type, ((Enum<?>) value).name(), type);
			return type;
		} else if (value instanceof Class) {
			g.push(getType((Class<?>) value));
			return getType(Class.class);
		}
		throw new IllegalArgumentException(format("%s cannot be embedded as a constant. %s",
				value.getClass().getName(), Utils.exceptionInGeneratedClass(ctx)));
	}

	private static void pushString(GeneratorAdapter g, String string) {
		if (string.length() <= MAX_STRING_CHUNK) {
			g.push(string);
			return;
		}
		g.newInstance(STRING_BUILDER_TYPE);
		g.dup();
		g.push(string.length());
		g.invokeConstructor(STRING_BUILDER_TYPE, STRING_BUILDER_INIT);
		for (int from = 0; from < string.length(); from += MAX_STRING_CHUNK) {
			g.push(string.substring(from, Math.min(string.length(), from + MAX_STRING_CHUNK)));
			g.invokeVirtual(STRING_BUILDER_TYPE, STRING_BUILDER_APPEND);
		}
		g.invokeVirtual(STRING_BUILDER_TYPE, STRING_BUILDER_TO_STRING);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionConstant that = (ExpressionConstant) o;

		return value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}
}
